package br.ufmg.cs.systems.chemgraph.graph;

/**
 * Raised while building or editing a graph with malformed input (duplicate
 * edge, dangling endpoint, self-loop, missing label). Never repaired silently.
 */
public class GraphConstructionException extends RuntimeException {
   public GraphConstructionException(String message) {
      super(message);
   }
}
