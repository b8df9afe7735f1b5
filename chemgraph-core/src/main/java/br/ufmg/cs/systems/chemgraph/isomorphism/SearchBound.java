package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.conf.Configuration;

import java.util.function.BooleanSupplier;

/**
 * Limits on one backtracking search: a step budget, a wall-clock budget
 * measured from the start of the search, and a caller cancellation flag.
 * Negative budgets mean unbounded.
 */
public final class SearchBound {
   private static final BooleanSupplier NEVER = () -> false;
   private static final SearchBound UNBOUNDED = new SearchBound(-1, -1, NEVER);

   private final long maxSteps;
   private final long deadlineMs;
   private final BooleanSupplier cancelled;

   private SearchBound(long maxSteps, long deadlineMs,
                       BooleanSupplier cancelled) {
      this.maxSteps = maxSteps;
      this.deadlineMs = deadlineMs;
      this.cancelled = cancelled;
   }

   public static SearchBound unbounded() {
      return UNBOUNDED;
   }

   public static SearchBound steps(long maxSteps) {
      return new SearchBound(maxSteps, -1, NEVER);
   }

   public static SearchBound deadline(long deadlineMs) {
      return new SearchBound(-1, deadlineMs, NEVER);
   }

   public static SearchBound fromConfiguration(Configuration conf) {
      return new SearchBound(conf.getSearchMaxSteps(),
              conf.getSearchDeadlineMs(), NEVER);
   }

   public SearchBound withMaxSteps(long maxSteps) {
      return new SearchBound(maxSteps, deadlineMs, cancelled);
   }

   public SearchBound withDeadlineMs(long deadlineMs) {
      return new SearchBound(maxSteps, deadlineMs, cancelled);
   }

   public SearchBound withCancellation(BooleanSupplier cancelled) {
      if (cancelled == null) {
         cancelled = NEVER;
      }
      return new SearchBound(maxSteps, deadlineMs, cancelled);
   }

   public long getMaxSteps() {
      return maxSteps;
   }

   public long getDeadlineMs() {
      return deadlineMs;
   }

   public boolean isUnbounded() {
      return maxSteps < 0 && deadlineMs < 0 && cancelled == NEVER;
   }

   boolean stepsExceeded(long steps) {
      return maxSteps >= 0 && steps > maxSteps;
   }

   boolean timeExceeded(long startNanos) {
      return deadlineMs >= 0 &&
              (System.nanoTime() - startNanos) / 1_000_000L >= deadlineMs;
   }

   boolean isCancelled() {
      return cancelled.getAsBoolean();
   }

   @Override
   public String toString() {
      return "SearchBound{" +
              "maxSteps=" + maxSteps +
              ",deadlineMs=" + deadlineMs +
              ",cancellable=" + (cancelled != NEVER) +
              '}';
   }
}
