package br.ufmg.cs.systems.chemgraph.ring;

import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;

import java.util.Arrays;
import java.util.BitSet;

/**
 * A simple cycle of a graph.
 *
 * <p>Vertices are kept in cycle order, rotated to start at the smallest id and
 * oriented towards the smaller of its two ring neighbours, so equal cycles
 * always print the same way. Two rings are equal iff they use the same
 * edges.</p>
 */
public class Ring implements Comparable<Ring> {
   private final IntArrayList vertices;
   private final IntArrayList edges;
   private final BitSet edgeSet;

   Ring(IntArrayList cycleVertices, IntArrayList cycleEdges) {
      this.vertices = normalize(cycleVertices);
      this.edges = new IntArrayList(cycleEdges);
      this.edges.sort();
      this.edgeSet = new BitSet();
      for (int i = 0; i < edges.size(); ++i) {
         edgeSet.set(edges.getu(i));
      }
   }

   private static IntArrayList normalize(IntArrayList cycle) {
      int n = cycle.size();
      int start = 0;
      for (int i = 1; i < n; ++i) {
         if (cycle.getu(i) < cycle.getu(start)) {
            start = i;
         }
      }

      int next = cycle.getu((start + 1) % n);
      int prev = cycle.getu((start - 1 + n) % n);
      int step = next <= prev ? 1 : n - 1;

      IntArrayList normalized = new IntArrayList(n);
      for (int i = 0, idx = start; i < n; ++i, idx = (idx + step) % n) {
         normalized.add(cycle.getu(idx));
      }

      return normalized;
   }

   public int size() {
      return vertices.size();
   }

   /**
    * Vertex ids in cycle order.
    */
   public IntArrayList getVertices() {
      return new IntArrayList(vertices);
   }

   /**
    * Edge ids, ascending.
    */
   public IntArrayList getEdges() {
      return new IntArrayList(edges);
   }

   public boolean containsVertex(int vertexId) {
      return vertices.contains(vertexId);
   }

   public boolean containsEdge(int edgeId) {
      return edgeId >= 0 && edgeSet.get(edgeId);
   }

   BitSet getEdgeSet() {
      return edgeSet;
   }

   /**
    * Orders by size, then by the sorted vertex ids.
    */
   @Override
   public int compareTo(Ring other) {
      int cmp = Integer.compare(size(), other.size());
      if (cmp != 0) {
         return cmp;
      }

      int[] mine = vertices.toIntArray();
      int[] theirs = other.vertices.toIntArray();
      Arrays.sort(mine);
      Arrays.sort(theirs);

      for (int i = 0; i < mine.length; ++i) {
         cmp = Integer.compare(mine[i], theirs[i]);
         if (cmp != 0) {
            return cmp;
         }
      }

      for (int i = 0; i < edges.size(); ++i) {
         cmp = Integer.compare(edges.getu(i), other.edges.getu(i));
         if (cmp != 0) {
            return cmp;
         }
      }

      return 0;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      Ring ring = (Ring) o;

      return edgeSet.equals(ring.edgeSet);
   }

   @Override
   public int hashCode() {
      return edgeSet.hashCode();
   }

   @Override
   public String toString() {
      return "Ring{" + vertices + '}';
   }
}
