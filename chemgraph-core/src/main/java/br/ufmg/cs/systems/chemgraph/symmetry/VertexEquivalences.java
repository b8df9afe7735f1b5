package br.ufmg.cs.systems.chemgraph.symmetry;

import br.ufmg.cs.systems.chemgraph.isomorphism.Mapping;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import com.koloboke.collect.IntCursor;
import com.koloboke.collect.set.IntSet;
import com.koloboke.collect.set.hash.HashIntSets;

import java.util.ArrayList;
import java.util.List;

/**
 * For every vertex, the set of vertices some automorphism sends it to.
 * Once propagated, the sets are the automorphism orbits.
 */
public class VertexEquivalences {
   private final IntSet[] equivalences;
   private final IntArrayList vertices;

   public VertexEquivalences(int vertexIdBound, IntArrayList vertices) {
      this.equivalences = new IntSet[vertexIdBound];
      this.vertices = new IntArrayList(vertices);
      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         equivalences[u] = HashIntSets.newMutableSet();
         equivalences[u].add(u);
      }
   }

   public static VertexEquivalences of(int vertexIdBound, IntArrayList vertices,
                                       List<Mapping> automorphisms) {
      VertexEquivalences equivalences =
              new VertexEquivalences(vertexIdBound, vertices);
      for (Mapping automorphism : automorphisms) {
         equivalences.addAll(automorphism);
      }
      equivalences.propagateEquivalences();
      return equivalences;
   }

   public void addEquivalence(int u, int v) {
      equivalences[u].add(v);
      equivalences[v].add(u);
   }

   public void addAll(Mapping automorphism) {
      IntArrayList sources = automorphism.sources();
      IntArrayList targets = automorphism.targets();
      for (int i = 0; i < sources.size(); ++i) {
         addEquivalence(sources.getu(i), targets.getu(i));
      }
   }

   /**
    * Closes the relation transitively, until every set is a full orbit.
    */
   public void propagateEquivalences() {
      boolean changed = true;
      while (changed) {
         changed = false;
         for (int i = 0; i < vertices.size(); ++i) {
            int u = vertices.getu(i);
            IntSet current = equivalences[u];
            IntCursor cursor = current.cursor();

            IntArrayList toMerge = new IntArrayList();
            while (cursor.moveNext()) {
               int v = cursor.elem();
               if (v != u) {
                  toMerge.add(v);
               }
            }

            for (int j = 0; j < toMerge.size(); ++j) {
               IntSet other = equivalences[toMerge.getu(j)];
               if (other.addAll(current)) {
                  changed = true;
               }
               if (current.addAll(other)) {
                  changed = true;
               }
            }
         }
      }
   }

   public IntSet getEquivalences(int u) {
      return equivalences[u];
   }

   public boolean isEquivalent(int u, int v) {
      return equivalences[u].contains(v);
   }

   /**
    * Orbits, each sorted, ordered by smallest member.
    */
   public List<IntArrayList> orbits() {
      List<IntArrayList> orbits = new ArrayList<>();
      boolean[] seen = new boolean[equivalences.length];

      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         if (seen[u]) {
            continue;
         }

         IntArrayList orbit = new IntArrayList(equivalences[u].size());
         IntCursor cursor = equivalences[u].cursor();
         while (cursor.moveNext()) {
            orbit.add(cursor.elem());
            seen[cursor.elem()] = true;
         }
         orbit.sort();
         orbits.add(orbit);
      }

      return orbits;
   }

   public int numOrbits() {
      return orbits().size();
   }

   @Override
   public String toString() {
      return "VertexEquivalences{" +
              "orbits=" + orbits() +
              '}';
   }
}
