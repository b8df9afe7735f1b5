package br.ufmg.cs.systems.chemgraph.symmetry;

import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.isomorphism.Mapping;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Automorphisms of one graph, tied to the modification stamp the graph had
 * when they were enumerated. Any later edit of the graph invalidates the set.
 */
public class AutomorphismSet {
   private final LabeledGraph<?, ?> graph;
   private final long stamp;
   private final int vertexIdBound;
   private final IntArrayList vertices;
   private final List<Mapping> automorphisms;
   private final Set<Mapping> lookup;
   private volatile VertexEquivalences equivalences;

   public AutomorphismSet(LabeledGraph<?, ?> graph, List<Mapping> automorphisms) {
      this.graph = graph;
      this.stamp = graph.getModificationStamp();
      this.vertexIdBound = graph.vertexIdBound();
      this.vertices = graph.vertices();
      this.automorphisms = Collections.unmodifiableList(
              new ArrayList<>(automorphisms));
      this.lookup = new HashSet<>(automorphisms);
   }

   public boolean isValidFor(LabeledGraph<?, ?> other) {
      return other == graph && other.getModificationStamp() == stamp;
   }

   public int size() {
      return automorphisms.size();
   }

   public List<Mapping> getAutomorphisms() {
      return automorphisms;
   }

   public boolean contains(Mapping mapping) {
      return lookup.contains(mapping);
   }

   public boolean containsIdentity() {
      for (Mapping automorphism : automorphisms) {
         if (automorphism.isIdentity()) {
            return true;
         }
      }
      return false;
   }

   /**
    * True if the set holds the identity and is closed under composition and
    * inversion, that is, it is a group.
    */
   public boolean isGroup() {
      if (!containsIdentity()) {
         return false;
      }

      for (Mapping a : automorphisms) {
         if (!lookup.contains(a.inverse())) {
            return false;
         }
         for (Mapping b : automorphisms) {
            if (!lookup.contains(a.compose(b))) {
               return false;
            }
         }
      }

      return true;
   }

   /**
    * Orbits are computed on first use; concurrent first calls may each compute
    * them, and all get equal results.
    */
   public VertexEquivalences getEquivalences() {
      VertexEquivalences result = equivalences;
      if (result == null) {
         result = VertexEquivalences.of(vertexIdBound, vertices, automorphisms);
         equivalences = result;
      }
      return result;
   }

   public List<IntArrayList> orbits() {
      return getEquivalences().orbits();
   }

   @Override
   public String toString() {
      return "AutomorphismSet{" +
              "size=" + automorphisms.size() +
              ",stamp=" + stamp +
              '}';
   }
}
