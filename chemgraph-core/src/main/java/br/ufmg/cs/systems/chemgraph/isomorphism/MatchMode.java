package br.ufmg.cs.systems.chemgraph.isomorphism;

public enum MatchMode {
   /**
    * Bijection covering every vertex and edge of both graphs.
    */
   EXACT,
   /**
    * Injective embedding of a pattern; unmatched target edges are ignored.
    */
   SUBGRAPH,
   /**
    * Every bijection of a graph onto itself.
    */
   AUTOMORPHISM;

   public boolean isBijective() {
      return this != SUBGRAPH;
   }
}
