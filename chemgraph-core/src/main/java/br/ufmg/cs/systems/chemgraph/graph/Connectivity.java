package br.ufmg.cs.systems.chemgraph.graph;

import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;

import java.util.BitSet;

/**
 * Cut vertices and bridges of a graph, from one low-link depth-first search
 * run with an explicit stack. An edge lies on a cycle iff it is not a bridge;
 * a vertex lies on a cycle iff one of its edges does.
 */
public class Connectivity {
   private final LabeledGraph<?, ?> graph;
   private final BitSet cutVertices;
   private final BitSet bridges;

   private Connectivity(LabeledGraph<?, ?> graph) {
      this.graph = graph;
      this.cutVertices = new BitSet(graph.vertexIdBound());
      this.bridges = new BitSet(graph.edgeIdBound());
   }

   public static Connectivity of(LabeledGraph<?, ?> graph) {
      Connectivity connectivity = new Connectivity(graph);
      connectivity.compute();
      return connectivity;
   }

   private void compute() {
      int bound = graph.vertexIdBound();
      int[] discovery = new int[bound];
      int[] low = new int[bound];
      int[] parentEdge = new int[bound];
      int[] nextNeighbourIdx = new int[bound];
      int time = 0;

      IntArrayList vertices = graph.vertices();
      IntArrayList stack = new IntArrayList();

      for (int r = 0; r < vertices.size(); ++r) {
         int root = vertices.getu(r);
         if (discovery[root] != 0) {
            continue;
         }

         int rootChildren = 0;
         discovery[root] = low[root] = ++time;
         parentEdge[root] = -1;
         stack.add(root);

         while (!stack.isEmpty()) {
            int u = stack.getLast();
            VertexNeighbourhood neighbourhood = graph.neighbourhood(u);
            IntArrayList neighbours = neighbourhood.getOrderedVertices();

            if (nextNeighbourIdx[u] < neighbours.size()) {
               int v = neighbours.getu(nextNeighbourIdx[u]++);
               int e = neighbourhood.getEdge(v);

               if (e == parentEdge[u]) {
                  continue;
               }

               if (discovery[v] == 0) {
                  discovery[v] = low[v] = ++time;
                  parentEdge[v] = e;
                  if (u == root) {
                     ++rootChildren;
                  }
                  stack.add(v);
               } else {
                  low[u] = Math.min(low[u], discovery[v]);
               }
            } else {
               stack.pop();
               if (parentEdge[u] < 0) {
                  continue;
               }

               int p = graph.otherEnd(parentEdge[u], u);
               low[p] = Math.min(low[p], low[u]);

               if (low[u] > discovery[p]) {
                  bridges.set(parentEdge[u]);
               }

               if (p != root && low[u] >= discovery[p]) {
                  cutVertices.set(p);
               }
            }
         }

         if (rootChildren > 1) {
            cutVertices.set(root);
         }
      }
   }

   public boolean isCutVertex(int vertexId) {
      graph.checkVertex(vertexId);
      return cutVertices.get(vertexId);
   }

   public boolean isBridge(int edgeId) {
      graph.checkEdge(edgeId);
      return bridges.get(edgeId);
   }

   public boolean isEdgeInCycle(int edgeId) {
      return !isBridge(edgeId);
   }

   public boolean isVertexInCycle(int vertexId) {
      VertexNeighbourhood neighbourhood = graph.neighbourhood(vertexId);
      IntArrayList neighbours = neighbourhood.getOrderedVertices();
      for (int i = 0; i < neighbours.size(); ++i) {
         if (!bridges.get(neighbourhood.getEdge(neighbours.getu(i)))) {
            return true;
         }
      }
      return false;
   }

   public boolean isCyclic() {
      IntArrayList edges = graph.edges();
      for (int i = 0; i < edges.size(); ++i) {
         if (!bridges.get(edges.getu(i))) {
            return true;
         }
      }
      return false;
   }

   public IntArrayList cutVertices() {
      return toList(cutVertices);
   }

   public IntArrayList bridges() {
      return toList(bridges);
   }

   /**
    * Edges that belong to at least one cycle.
    */
   public IntArrayList ringEdges() {
      IntArrayList edges = graph.edges();
      edges.removeIf(bridges::get);
      return edges;
   }

   /**
    * Per-vertex ring-membership flags, indexed by vertex id.
    */
   public boolean[] ringVertexFlags() {
      boolean[] flags = new boolean[graph.vertexIdBound()];
      IntArrayList vertices = graph.vertices();
      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         flags[u] = isVertexInCycle(u);
      }
      return flags;
   }

   private static IntArrayList toList(BitSet bits) {
      IntArrayList list = new IntArrayList(Math.max(bits.cardinality(), 1));
      for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
         list.add(i);
      }
      return list;
   }
}
