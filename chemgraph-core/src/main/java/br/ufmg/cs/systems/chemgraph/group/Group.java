package br.ufmg.cs.systems.chemgraph.group;

import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.isomorphism.EqualLabelMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.GraphMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.MatchResult;
import br.ufmg.cs.systems.chemgraph.isomorphism.SearchBound;
import br.ufmg.cs.systems.chemgraph.molecule.Atom;
import br.ufmg.cs.systems.chemgraph.molecule.AtomType;
import br.ufmg.cs.systems.chemgraph.molecule.BondOrder;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import java.util.Map;

/**
 * Structural pattern with wildcard labels. Built once through a
 * {@link Builder} and read-only afterwards, so a group can be matched from
 * several threads at once.
 */
public class Group extends LabeledGraph<GroupAtom, GroupBond> {
   private boolean frozen;

   private Group() {
   }

   public static Builder builder() {
      return new Builder();
   }

   @Override
   protected LabeledGraph<GroupAtom, GroupBond> newEmptyGraph() {
      return new Group();
   }

   @Override
   protected void checkMutable() {
      if (frozen) {
         throw new UnsupportedOperationException("Group is immutable");
      }
   }

   @Override
   public Group copy() {
      return copy(HashIntIntMaps.newMutableMap(numVertices()));
   }

   @Override
   public Group copy(IntIntMap oldToNew) {
      Group copy = new Group();
      copyInto(copy, oldToNew);
      copy.frozen = true;
      return copy;
   }

   public static boolean matchesLabel(GroupAtom groupAtom, Atom atom,
                                      AtomType atomType) {
      return groupAtom.matches(atom, atomType);
   }

   public static boolean matchesBond(GroupBond groupBond, BondOrder order) {
      return groupBond.matches(order);
   }

   public GroupAtom getGroupAtom(int vertexId) {
      return vertexLabel(vertexId);
   }

   /**
    * @return the atom carrying the tag, or -1
    */
   public int getLabeledAtom(String tag) {
      return findTagged(tag);
   }

   public Map<String, Integer> getLabeledAtoms() {
      return getTaggedVertices();
   }

   /**
    * Same structure and labels, tags included.
    */
   public boolean isIsomorphic(Group other) {
      return isIsomorphic(other, GraphMatcher.getDefault().defaultBound());
   }

   public boolean isIsomorphic(Group other, SearchBound bound) {
      return GraphMatcher.getDefault().findIsomorphism(this, other,
              new EqualLabelMatcher<>(this, other, true), bound)
              .orThrow().isMatch();
   }

   /**
    * True if every constraint of {@code other} embeds into an equal or
    * narrower constraint of this group, with tagged atoms kept in place.
    * Every molecule this group matches is then matched by {@code other}.
    */
   public boolean isSpecificCaseOf(Group other) {
      return findSpecialization(other, GraphMatcher.getDefault().defaultBound())
              .orThrow().isMatch();
   }

   public MatchResult findSpecialization(Group other, SearchBound bound) {
      return GraphMatcher.getDefault().findSubgraphIsomorphism(other, this,
              new GroupSpecializationMatcher(other, this), bound, null);
   }

   public static class Builder {
      private Group group = new Group();

      private Group group() {
         if (group == null) {
            throw new IllegalStateException("Group already built");
         }
         return group;
      }

      public int addAtom(GroupAtom atom) {
         return group().addVertex(atom);
      }

      public int addAtom(GroupAtom atom, String tag) {
         int atomId = group().addVertex(atom);
         group.setTag(atomId, tag);
         return atomId;
      }

      public int addBond(int atom1, int atom2, GroupBond bond) {
         return group().addEdge(atom1, atom2, bond);
      }

      public Group build() {
         Group built = group();
         built.validate();
         built.frozen = true;
         group = null;
         return built;
      }
   }
}
