package br.ufmg.cs.systems.chemgraph.graph;

public class DuplicateEdgeException extends GraphConstructionException {
   private final int vertex1;
   private final int vertex2;

   public DuplicateEdgeException(int vertex1, int vertex2) {
      super("Vertices " + vertex1 + " and " + vertex2 +
              " are already connected");
      this.vertex1 = vertex1;
      this.vertex2 = vertex2;
   }

   public int getVertex1() {
      return vertex1;
   }

   public int getVertex2() {
      return vertex2;
   }
}
