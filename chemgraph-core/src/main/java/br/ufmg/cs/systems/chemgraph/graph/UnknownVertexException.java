package br.ufmg.cs.systems.chemgraph.graph;

public class UnknownVertexException extends GraphConstructionException {
   private final int vertex;

   public UnknownVertexException(int vertex) {
      super("Vertex " + vertex + " does not belong to this graph");
      this.vertex = vertex;
   }

   public int getVertex() {
      return vertex;
   }
}
