package br.ufmg.cs.systems.chemgraph.group;

import br.ufmg.cs.systems.chemgraph.isomorphism.LabelMatcher;
import br.ufmg.cs.systems.chemgraph.molecule.AtomType;
import br.ufmg.cs.systems.chemgraph.molecule.Molecule;

/**
 * Wildcard compatibility of group atoms and bonds against one molecule. The
 * molecule's atom types are computed once, into this matcher.
 */
public class GroupMoleculeMatcher implements LabelMatcher {
   private final Group group;
   private final Molecule molecule;
   private final AtomType[] atomTypes;

   public GroupMoleculeMatcher(Group group, Molecule molecule) {
      this.group = group;
      this.molecule = molecule;
      this.atomTypes = molecule.atomTypes();
   }

   @Override
   public boolean isVertexCompatible(int groupVertex, int moleculeVertex) {
      return Group.matchesLabel(group.vertexLabel(groupVertex),
              molecule.getAtom(moleculeVertex), atomTypes[moleculeVertex]);
   }

   @Override
   public boolean isEdgeCompatible(int groupEdge, int moleculeEdge) {
      return Group.matchesBond(group.edgeLabel(groupEdge),
              molecule.edgeLabel(moleculeEdge));
   }
}
