package br.ufmg.cs.systems.chemgraph.isomorphism;

/**
 * Vertex and edge compatibility between a source (or pattern) graph and a
 * target graph. Instances are bound to one pair of graphs and may hold data
 * derived from them, so each query builds its own.
 *
 * <p>The hash methods let the engine prune with label information: two
 * compatible vertices (or edges) must have equal hashes. Matchers whose
 * compatibility is not an equivalence keep the default constant.</p>
 */
public interface LabelMatcher {
   boolean isVertexCompatible(int sourceVertex, int targetVertex);

   boolean isEdgeCompatible(int sourceEdge, int targetEdge);

   default int sourceVertexHash(int sourceVertex) {
      return 0;
   }

   default int targetVertexHash(int targetVertex) {
      return 0;
   }

   default int sourceEdgeHash(int sourceEdge) {
      return 0;
   }

   default int targetEdgeHash(int targetEdge) {
      return 0;
   }
}
