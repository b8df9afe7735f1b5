package br.ufmg.cs.systems.chemgraph.graph;

/**
 * A graph handed to a query breaks the simple-graph invariant, or the query
 * arguments reference it inconsistently. Indicates a caller bug.
 */
public class InvalidGraphException extends RuntimeException {
   public InvalidGraphException(String message) {
      super(message);
   }
}
