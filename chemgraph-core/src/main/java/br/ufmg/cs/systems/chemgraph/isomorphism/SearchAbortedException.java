package br.ufmg.cs.systems.chemgraph.isomorphism;

/**
 * Thrown by convenience methods that return a plain boolean or count when
 * the underlying search hit its bound.
 */
public class SearchAbortedException extends RuntimeException {
   private final long steps;

   public SearchAbortedException(long steps) {
      super("Search aborted after " + steps + " steps");
      this.steps = steps;
   }

   public long getSteps() {
      return steps;
   }
}
