package br.ufmg.cs.systems.chemgraph.isomorphism;

public enum MatchStatus {
   MATCH,
   NO_MATCH,
   /**
    * The search bound was hit before the answer was proven.
    */
   ABORTED
}
