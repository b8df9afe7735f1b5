package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.graph.InvalidGraphException;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import java.util.Arrays;

/**
 * Immutable injective map from source (or pattern) vertex ids to target
 * vertex ids.
 */
public final class Mapping {
   private static final Mapping EMPTY = new Mapping(new int[0], new int[0]);

   // sources ascending, targets[i] is the image of sources[i]
   private final int[] sources;
   private final int[] targets;

   private Mapping(int[] sources, int[] targets) {
      this.sources = sources;
      this.targets = targets;
   }

   public static Mapping empty() {
      return EMPTY;
   }

   /**
    * @throws InvalidGraphException when two sources share a target
    */
   public static Mapping of(IntIntMap map) {
      int[] sources = map.keySet().toIntArray();
      Arrays.sort(sources);
      int[] targets = new int[sources.length];
      for (int i = 0; i < sources.length; ++i) {
         targets[i] = map.get(sources[i]);
      }
      return checked(sources, targets);
   }

   /**
    * Mapping from alternating {@code source, target} pairs.
    */
   public static Mapping ofPairs(int... pairs) {
      if (pairs.length % 2 != 0) {
         throw new IllegalArgumentException("Odd number of mapping entries");
      }

      IntIntMap map = HashIntIntMaps.newMutableMap(pairs.length / 2);
      for (int i = 0; i < pairs.length; i += 2) {
         if (map.containsKey(pairs[i])) {
            throw new InvalidGraphException(
                    "Vertex " + pairs[i] + " mapped twice");
         }
         map.put(pairs[i], pairs[i + 1]);
      }
      return of(map);
   }

   public static Mapping identity(IntArrayList vertices) {
      int[] ids = vertices.toIntArray();
      Arrays.sort(ids);
      return new Mapping(ids, ids.clone());
   }

   /**
    * Built by the engine from its dense source-to-target array.
    */
   static Mapping fromArray(IntArrayList sourceVertices, int[] sourceToTarget) {
      int[] sources = sourceVertices.toIntArray();
      Arrays.sort(sources);
      int[] targets = new int[sources.length];
      for (int i = 0; i < sources.length; ++i) {
         targets[i] = sourceToTarget[sources[i]];
      }
      return new Mapping(sources, targets);
   }

   private static Mapping checked(int[] sources, int[] targets) {
      int[] sortedTargets = targets.clone();
      Arrays.sort(sortedTargets);
      for (int i = 1; i < sortedTargets.length; ++i) {
         if (sortedTargets[i] == sortedTargets[i - 1]) {
            throw new InvalidGraphException("Target vertex " +
                    sortedTargets[i] + " is the image of two vertices");
         }
      }
      return new Mapping(sources, targets);
   }

   public int size() {
      return sources.length;
   }

   public boolean isEmpty() {
      return sources.length == 0;
   }

   public boolean containsSource(int source) {
      return Arrays.binarySearch(sources, source) >= 0;
   }

   /**
    * @return image of {@code source}, or -1 when unmapped
    */
   public int get(int source) {
      int idx = Arrays.binarySearch(sources, source);
      return idx >= 0 ? targets[idx] : -1;
   }

   /**
    * Mapped source ids, ascending.
    */
   public IntArrayList sources() {
      return IntArrayList.of(sources);
   }

   /**
    * Images in the order of {@link #sources()}.
    */
   public IntArrayList targets() {
      return IntArrayList.of(targets);
   }

   public IntIntMap toMap() {
      IntIntMap map = HashIntIntMaps.getDefaultFactory()
              .withDefaultValue(-1).newMutableMap(sources.length);
      for (int i = 0; i < sources.length; ++i) {
         map.put(sources[i], targets[i]);
      }
      return map;
   }

   public Mapping inverse() {
      IntIntMap map = HashIntIntMaps.newMutableMap(sources.length);
      for (int i = 0; i < sources.length; ++i) {
         map.put(targets[i], sources[i]);
      }
      return of(map);
   }

   /**
    * This mapping followed by {@code other}: {@code v -> other(this(v))}.
    * Sources whose image is not mapped by {@code other} are dropped.
    */
   public Mapping compose(Mapping other) {
      IntIntMap map = HashIntIntMaps.newMutableMap(sources.length);
      for (int i = 0; i < sources.length; ++i) {
         int image = other.get(targets[i]);
         if (image >= 0) {
            map.put(sources[i], image);
         }
      }
      return of(map);
   }

   public boolean isIdentity() {
      for (int i = 0; i < sources.length; ++i) {
         if (sources[i] != targets[i]) {
            return false;
         }
      }
      return true;
   }

   /**
    * Source edge id to target edge id, for every source edge whose two
    * endpoints are mapped to adjacent target vertices.
    */
   public IntIntMap edgeCorrespondence(LabeledGraph<?, ?> source,
                                       LabeledGraph<?, ?> target) {
      IntIntMap edges = HashIntIntMaps.newMutableMap();
      IntArrayList sourceEdges = source.edges();

      for (int i = 0; i < sourceEdges.size(); ++i) {
         int e = sourceEdges.getu(i);
         int u = get(source.edgeSrc(e));
         int v = get(source.edgeDst(e));
         if (u < 0 || v < 0 || !target.containsVertex(u) ||
                 !target.containsVertex(v)) {
            continue;
         }

         int targetEdge = target.getEdge(u, v);
         if (targetEdge >= 0) {
            edges.put(e, targetEdge);
         }
      }

      return edges;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      Mapping mapping = (Mapping) o;

      return Arrays.equals(sources, mapping.sources) &&
              Arrays.equals(targets, mapping.targets);
   }

   @Override
   public int hashCode() {
      return 31 * Arrays.hashCode(sources) +
              Arrays.hashCode(targets);
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder("Mapping{");
      for (int i = 0; i < sources.length; ++i) {
         if (i > 0) sb.append(",");
         sb.append(sources[i]).append("->").append(targets[i]);
      }
      return sb.append('}').toString();
   }
}
