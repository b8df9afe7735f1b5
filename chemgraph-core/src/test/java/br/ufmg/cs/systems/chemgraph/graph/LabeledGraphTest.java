package br.ufmg.cs.systems.chemgraph.graph;

import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabeledGraphTest {
   private LabeledGraph<String, Integer> graph;

   /**
    * 0-1, 0-2, 1-3, 2-3, 3-4
    */
   @BeforeEach
   void setUp() {
      graph = new LabeledGraph<>();
      for (int i = 0; i < 5; ++i) {
         graph.addVertex("v" + i);
      }
      graph.addEdge(0, 1, 1);
      graph.addEdge(0, 2, 1);
      graph.addEdge(1, 3, 2);
      graph.addEdge(2, 3, 1);
      graph.addEdge(3, 4, 1);
   }

   @Test
   void testIdsAscending() {
      assertThat(graph.vertices(), equalTo(IntArrayList.of(0, 1, 2, 3, 4)));
      assertThat(graph.edges(), equalTo(IntArrayList.of(0, 1, 2, 3, 4)));
      assertEquals(5, graph.numVertices());
      assertEquals(5, graph.numEdges());
   }

   @Test
   void testAdjacencyIsSymmetric() {
      assertEquals(graph.getEdge(1, 3), graph.getEdge(3, 1));
      assertTrue(graph.hasEdge(4, 3));
      assertFalse(graph.hasEdge(0, 4));
      assertEquals(-1, graph.getEdge(0, 4));
      assertThat(graph.neighbors(3), equalTo(IntArrayList.of(1, 2, 4)));
      assertEquals(3, graph.degree(3));
      assertEquals(1, graph.otherEnd(2, 3));
      assertEquals(2, graph.edgeLabel(graph.getEdge(3, 1)).intValue());
   }

   @Test
   void testDuplicateEdgeRejected() {
      DuplicateEdgeException e = assertThrows(DuplicateEdgeException.class,
              () -> graph.addEdge(3, 1, 5));
      assertEquals(3, e.getVertex1());
      assertEquals(1, e.getVertex2());
      assertEquals(5, graph.numEdges());
   }

   @Test
   void testInvalidEdgesRejected() {
      assertThrows(GraphConstructionException.class,
              () -> graph.addEdge(2, 2, 1));
      UnknownVertexException e = assertThrows(UnknownVertexException.class,
              () -> graph.addEdge(0, 7, 1));
      assertEquals(7, e.getVertex());
      assertThrows(GraphConstructionException.class,
              () -> graph.addEdge(0, 4, null));
      assertThrows(GraphConstructionException.class,
              () -> graph.addVertex(null));
   }

   @Test
   void testRemoveVertexDropsIncidentEdges() {
      graph.removeVertex(3);
      assertFalse(graph.containsVertex(3));
      assertEquals(2, graph.numEdges());
      assertThat(graph.neighbors(1), equalTo(IntArrayList.of(0)));
      assertEquals(0, graph.degree(4));
      assertThrows(UnknownVertexException.class, () -> graph.vertexLabel(3));
      graph.validate();
   }

   @Test
   void testIdsNeverReused() {
      graph.removeVertex(4);
      int id = graph.addVertex("v5");
      assertEquals(5, id);
      assertEquals(6, graph.vertexIdBound());

      int edge = graph.getEdge(0, 1);
      graph.removeEdge(edge);
      assertFalse(graph.containsEdge(edge));
      assertEquals(5, graph.addEdge(0, 1, 1));
   }

   @Test
   void testModificationStampAdvances() {
      long stamp = graph.getModificationStamp();
      graph.setVertexLabel(0, "x");
      long afterLabel = graph.getModificationStamp();
      assertThat(afterLabel, greaterThan(stamp));

      graph.removeEdge(graph.getEdge(3, 4));
      long afterRemove = graph.getModificationStamp();
      assertThat(afterRemove, greaterThan(afterLabel));

      graph.neighbors(0);
      graph.breadthFirst(0);
      graph.copy();
      assertEquals(afterRemove, graph.getModificationStamp());
   }

   @Test
   void testTraversalOrder() {
      assertThat(graph.breadthFirst(0), equalTo(IntArrayList.of(0, 1, 2, 3, 4)));
      assertThat(graph.depthFirst(0), equalTo(IntArrayList.of(0, 1, 3, 2, 4)));
      assertThat(graph.breadthFirst(4), equalTo(IntArrayList.of(4, 3, 1, 2, 0)));
   }

   @Test
   void testComponents() {
      assertTrue(graph.isConnected());
      int lone = graph.addVertex("lone");
      int a = graph.addVertex("a");
      int b = graph.addVertex("b");
      graph.addEdge(b, a, 1);

      List<IntArrayList> components = graph.connectedComponents();
      assertEquals(3, components.size());
      assertThat(components.get(0), equalTo(IntArrayList.of(0, 1, 2, 3, 4)));
      assertThat(components.get(1), equalTo(IntArrayList.of(lone)));
      assertThat(components.get(2), equalTo(IntArrayList.of(a, b)));
      assertFalse(graph.isConnected());
      assertTrue(new LabeledGraph<String, Integer>().isConnected());
   }

   @Test
   void testTags() {
      graph.setTag(1, "*1");
      graph.setTag(3, "*2");
      assertEquals("*1", graph.getTag(1));
      assertNull(graph.getTag(0));
      assertEquals(3, graph.findTagged("*2"));
      assertEquals(-1, graph.findTagged("*3"));
      assertThat(graph.getTaggedVertices().keySet().toString(),
              equalTo("[*1, *2]"));

      graph.setTag(1, null);
      assertEquals(-1, graph.findTagged("*1"));
   }

   @Test
   void testCopyCompactsIds() {
      graph.setTag(4, "*1");
      graph.removeVertex(2);

      IntIntMap oldToNew = HashIntIntMaps.newMutableMap();
      LabeledGraph<String, Integer> copy = graph.copy(oldToNew);

      assertEquals(4, copy.numVertices());
      assertEquals(3, copy.numEdges());
      assertEquals(4, copy.vertexIdBound());
      assertEquals(2, oldToNew.get(3));
      assertEquals(3, oldToNew.get(4));
      assertEquals("v4", copy.vertexLabel(3));
      assertEquals("*1", copy.getTag(3));
      assertTrue(copy.hasEdge(oldToNew.get(1), oldToNew.get(3)));
      copy.validate();

      copy.addVertex("new");
      assertEquals(4, graph.numVertices());
   }
}
