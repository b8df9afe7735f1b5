package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;

import java.util.Objects;

/**
 * Compatibility by label equality, for exact isomorphism and automorphisms.
 * Optionally vertex tags must be equal as well.
 */
public class EqualLabelMatcher<V, E> implements LabelMatcher {
   private final LabeledGraph<V, E> source;
   private final LabeledGraph<V, E> target;
   private final boolean matchTags;

   public EqualLabelMatcher(LabeledGraph<V, E> source,
                            LabeledGraph<V, E> target) {
      this(source, target, false);
   }

   public EqualLabelMatcher(LabeledGraph<V, E> source,
                            LabeledGraph<V, E> target, boolean matchTags) {
      this.source = source;
      this.target = target;
      this.matchTags = matchTags;
   }

   @Override
   public boolean isVertexCompatible(int sourceVertex, int targetVertex) {
      if (!source.vertexLabel(sourceVertex).equals(
              target.vertexLabel(targetVertex))) {
         return false;
      }

      return !matchTags || Objects.equals(source.getTag(sourceVertex),
              target.getTag(targetVertex));
   }

   @Override
   public boolean isEdgeCompatible(int sourceEdge, int targetEdge) {
      return source.edgeLabel(sourceEdge).equals(target.edgeLabel(targetEdge));
   }

   @Override
   public int sourceVertexHash(int sourceVertex) {
      return vertexHash(source, sourceVertex);
   }

   @Override
   public int targetVertexHash(int targetVertex) {
      return vertexHash(target, targetVertex);
   }

   private int vertexHash(LabeledGraph<V, E> graph, int vertex) {
      int hash = graph.vertexLabel(vertex).hashCode();
      if (matchTags) {
         hash = 31 * hash + Objects.hashCode(graph.getTag(vertex));
      }
      return hash;
   }

   @Override
   public int sourceEdgeHash(int sourceEdge) {
      return source.edgeLabel(sourceEdge).hashCode();
   }

   @Override
   public int targetEdgeHash(int targetEdge) {
      return target.edgeLabel(targetEdge).hashCode();
   }
}
