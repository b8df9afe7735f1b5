package br.ufmg.cs.systems.chemgraph.isomorphism;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one search: a status, the mappings found (possibly some even when
 * aborted) and the number of steps spent.
 */
public final class MatchResult {
   private final MatchStatus status;
   private final List<Mapping> mappings;
   private final long steps;

   MatchResult(MatchStatus status, List<Mapping> mappings, long steps) {
      this.status = status;
      this.mappings = Collections.unmodifiableList(mappings);
      this.steps = steps;
   }

   public MatchStatus getStatus() {
      return status;
   }

   public boolean isMatch() {
      return status == MatchStatus.MATCH;
   }

   public boolean isAborted() {
      return status == MatchStatus.ABORTED;
   }

   /**
    * @return the first mapping found, or null
    */
   public Mapping getMapping() {
      return mappings.isEmpty() ? null : mappings.get(0);
   }

   public List<Mapping> getMappings() {
      return mappings;
   }

   public int numMappings() {
      return mappings.size();
   }

   public long getSteps() {
      return steps;
   }

   /**
    * @throws SearchAbortedException if the search was aborted
    */
   public MatchResult orThrow() {
      if (isAborted()) {
         throw new SearchAbortedException(steps);
      }
      return this;
   }

   @Override
   public String toString() {
      return "MatchResult{" +
              "status=" + status +
              ",mappings=" + mappings.size() +
              ",steps=" + steps +
              '}';
   }
}
