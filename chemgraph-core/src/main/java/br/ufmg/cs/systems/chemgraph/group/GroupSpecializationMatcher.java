package br.ufmg.cs.systems.chemgraph.group;

import br.ufmg.cs.systems.chemgraph.isomorphism.LabelMatcher;

/**
 * Matches a general group (source) into a specific one (target): each target
 * label must be a specific case of the source label it is mapped from, and a
 * tagged source atom must land on an atom with the same tag.
 */
public class GroupSpecializationMatcher implements LabelMatcher {
   private final Group general;
   private final Group specific;

   public GroupSpecializationMatcher(Group general, Group specific) {
      this.general = general;
      this.specific = specific;
   }

   @Override
   public boolean isVertexCompatible(int generalVertex, int specificVertex) {
      String tag = general.getTag(generalVertex);
      if (tag != null && !tag.equals(specific.getTag(specificVertex))) {
         return false;
      }

      return specific.vertexLabel(specificVertex)
              .isSpecificCaseOf(general.vertexLabel(generalVertex));
   }

   @Override
   public boolean isEdgeCompatible(int generalEdge, int specificEdge) {
      return specific.edgeLabel(specificEdge)
              .isSpecificCaseOf(general.edgeLabel(generalEdge));
   }
}
