package br.ufmg.cs.systems.chemgraph.graph;

import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectivityTest {

   /**
    * Path 0-1-2 hanging off the triangle 2-3-4.
    */
   private static LabeledGraph<String, String> tailedTriangle() {
      LabeledGraph<String, String> graph = new LabeledGraph<>();
      for (int i = 0; i < 5; ++i) {
         graph.addVertex("C");
      }
      graph.addEdge(0, 1, "-");
      graph.addEdge(1, 2, "-");
      graph.addEdge(2, 3, "-");
      graph.addEdge(3, 4, "-");
      graph.addEdge(4, 2, "-");
      return graph;
   }

   @Test
   void testBridgesAndCutVertices() {
      LabeledGraph<String, String> graph = tailedTriangle();
      Connectivity connectivity = Connectivity.of(graph);

      assertThat(connectivity.bridges(), equalTo(IntArrayList.of(0, 1)));
      assertThat(connectivity.cutVertices(), equalTo(IntArrayList.of(1, 2)));
      assertThat(connectivity.ringEdges(), equalTo(IntArrayList.of(2, 3, 4)));
      assertTrue(connectivity.isCyclic());
   }

   @Test
   void testRingMembership() {
      Connectivity connectivity = Connectivity.of(tailedTriangle());
      assertFalse(connectivity.isVertexInCycle(0));
      assertFalse(connectivity.isVertexInCycle(1));
      assertTrue(connectivity.isVertexInCycle(2));
      assertTrue(connectivity.isVertexInCycle(4));
      assertTrue(connectivity.isEdgeInCycle(3));
      assertFalse(connectivity.isEdgeInCycle(0));

      boolean[] flags = connectivity.ringVertexFlags();
      assertFalse(flags[1]);
      assertTrue(flags[3]);
   }

   @Test
   void testForestHasNoCycle() {
      LabeledGraph<String, String> graph = new LabeledGraph<>();
      int center = graph.addVertex("C");
      for (int i = 0; i < 3; ++i) {
         graph.addEdge(center, graph.addVertex("H"), "-");
      }
      graph.addEdge(graph.addVertex("O"), graph.addVertex("O"), "=");

      Connectivity connectivity = Connectivity.of(graph);
      assertFalse(connectivity.isCyclic());
      assertThat(connectivity.bridges().size(), equalTo(4));
      assertThat(connectivity.cutVertices(), equalTo(IntArrayList.of(center)));
   }

   @Test
   void testUnknownVertexRejected() {
      Connectivity connectivity = Connectivity.of(tailedTriangle());
      assertThrows(UnknownVertexException.class,
              () -> connectivity.isCutVertex(9));
   }
}
