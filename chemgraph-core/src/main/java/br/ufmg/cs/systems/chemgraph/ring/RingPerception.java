package br.ufmg.cs.systems.chemgraph.ring;

import br.ufmg.cs.systems.chemgraph.graph.Connectivity;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.graph.UnknownVertexException;
import br.ufmg.cs.systems.chemgraph.graph.VertexNeighbourhood;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import com.koloboke.collect.map.IntObjMap;
import com.koloboke.collect.map.hash.HashIntObjMaps;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Smallest set of smallest rings.
 *
 * <p>Candidate cycles come from two sources: the shortest cycle through every
 * ring edge (breadth-first search between its endpoints with the edge itself
 * excluded) and Horton cycles (shortest paths from a root to both ends of an
 * edge, joined by that edge). The Horton set always spans the cycle space, so
 * greedy selection of linearly independent candidates over GF(2), smallest
 * first, accepts exactly {@code |E| - |V| + components} rings.</p>
 */
public class RingPerception {
   private static final Logger LOG = Logger.getLogger(RingPerception.class);

   private final LabeledGraph<?, ?> graph;
   private final boolean[] inRing;
   private final Set<BitSet> seen;
   private final List<Ring> candidates;

   private RingPerception(LabeledGraph<?, ?> graph) {
      this.graph = graph;
      this.inRing = Connectivity.of(graph).ringVertexFlags();
      this.seen = new HashSet<>();
      this.candidates = new ArrayList<>();
   }

   public static int cycleRank(LabeledGraph<?, ?> graph) {
      return graph.numEdges() - graph.numVertices() +
              graph.numConnectedComponents();
   }

   public static List<Ring> sssr(LabeledGraph<?, ?> graph) {
      int rank = cycleRank(graph);
      if (rank == 0) {
         return Collections.emptyList();
      }

      RingPerception perception = new RingPerception(graph);
      perception.addEdgeCycles();
      perception.addHortonCycles();
      List<Ring> rings = perception.select(rank);

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("SSSR: %d rings from %d candidates (rank=%d)",
                 rings.size(), perception.candidates.size(), rank));
      }

      return rings;
   }

   /**
    * Number of SSSR rings through each vertex, indexed by vertex id.
    */
   public static int[] ringMembership(LabeledGraph<?, ?> graph) {
      return ringMembership(graph, sssr(graph));
   }

   public static int[] ringMembership(LabeledGraph<?, ?> graph,
                                      List<Ring> rings) {
      int[] counts = new int[graph.vertexIdBound()];
      for (Ring ring : rings) {
         IntArrayList vertices = ring.getVertices();
         for (int i = 0; i < vertices.size(); ++i) {
            ++counts[vertices.getu(i)];
         }
      }
      return counts;
   }

   /**
    * @return size of the smallest SSSR ring through the vertex, 0 if none
    */
   public static int smallestRingSize(LabeledGraph<?, ?> graph, int vertexId) {
      if (!graph.containsVertex(vertexId)) {
         throw new UnknownVertexException(vertexId);
      }

      int smallest = 0;
      for (Ring ring : sssr(graph)) {
         if (ring.containsVertex(vertexId) &&
                 (smallest == 0 || ring.size() < smallest)) {
            smallest = ring.size();
         }
      }
      return smallest;
   }

   private void addEdgeCycles() {
      IntArrayList edges = graph.edges();
      int[] parent = new int[graph.vertexIdBound()];

      for (int i = 0; i < edges.size(); ++i) {
         int e = edges.getu(i);
         int src = graph.edgeSrc(e);
         int dst = graph.edgeDst(e);

         if (!inRing[src] || !inRing[dst]) {
            continue;
         }

         IntArrayList path = shortestPath(src, dst, e, parent);
         if (path != null) {
            addCandidate(path);
         }
      }
   }

   /**
    * Breadth-first path from {@code src} to {@code dst} that does not use
    * {@code excludedEdge}, or null when there is none.
    */
   private IntArrayList shortestPath(int src, int dst, int excludedEdge,
                                     int[] parent) {
      boolean[] visited = new boolean[graph.vertexIdBound()];
      IntArrayList queue = new IntArrayList();
      queue.add(src);
      visited[src] = true;
      parent[src] = -1;

      for (int head = 0; head < queue.size(); ++head) {
         int u = queue.getu(head);
         VertexNeighbourhood neighbourhood = graph.neighbourhood(u);
         IntArrayList neighbours = neighbourhood.getOrderedVertices();

         for (int i = 0; i < neighbours.size(); ++i) {
            int v = neighbours.getu(i);
            if (visited[v] || !inRing[v] ||
                    neighbourhood.getEdge(v) == excludedEdge) {
               continue;
            }

            visited[v] = true;
            parent[v] = u;

            if (v == dst) {
               IntArrayList path = new IntArrayList();
               for (int w = dst; w >= 0; w = parent[w]) {
                  path.add(w);
               }
               return path;
            }

            queue.add(v);
         }
      }

      return null;
   }

   private void addHortonCycles() {
      int bound = graph.vertexIdBound();
      int[] parent = new int[bound];
      int[] depth = new int[bound];
      boolean[] onPath = new boolean[bound];
      IntArrayList vertices = graph.vertices();
      IntArrayList edges = graph.edges();

      for (int r = 0; r < vertices.size(); ++r) {
         int root = vertices.getu(r);
         if (!inRing[root]) {
            continue;
         }

         breadthFirstTree(root, parent, depth);

         for (int i = 0; i < edges.size(); ++i) {
            int e = edges.getu(i);
            int u = graph.edgeSrc(e);
            int v = graph.edgeDst(e);

            if (depth[u] < 0 || depth[v] < 0 || parent[u] == v ||
                    parent[v] == u) {
               continue;
            }

            IntArrayList pathU = treePath(u, parent);
            IntArrayList pathV = treePath(v, parent);

            boolean disjoint = true;
            for (int k = 0; k < pathU.size(); ++k) {
               onPath[pathU.getu(k)] = true;
            }
            // both paths end at the root
            for (int k = 0; k < pathV.size() - 1; ++k) {
               if (onPath[pathV.getu(k)]) {
                  disjoint = false;
                  break;
               }
            }
            for (int k = 0; k < pathU.size(); ++k) {
               onPath[pathU.getu(k)] = false;
            }

            if (!disjoint) {
               continue;
            }

            // u .. root, then root's successor .. v
            IntArrayList cycle = new IntArrayList(pathU);
            for (int k = pathV.size() - 2; k >= 0; --k) {
               cycle.add(pathV.getu(k));
            }
            addCandidate(cycle);
         }
      }
   }

   private void breadthFirstTree(int root, int[] parent, int[] depth) {
      Arrays.fill(depth, -1);
      IntArrayList queue = new IntArrayList();
      queue.add(root);
      depth[root] = 0;
      parent[root] = -1;

      for (int head = 0; head < queue.size(); ++head) {
         int u = queue.getu(head);
         IntArrayList neighbours = graph.neighbourhood(u).getOrderedVertices();
         for (int i = 0; i < neighbours.size(); ++i) {
            int v = neighbours.getu(i);
            if (depth[v] < 0 && inRing[v]) {
               depth[v] = depth[u] + 1;
               parent[v] = u;
               queue.add(v);
            }
         }
      }
   }

   private static IntArrayList treePath(int vertex, int[] parent) {
      IntArrayList path = new IntArrayList();
      for (int w = vertex; w >= 0; w = parent[w]) {
         path.add(w);
      }
      return path;
   }

   /**
    * @param cycle vertices in cycle order, the last one adjacent to the first
    */
   private void addCandidate(IntArrayList cycle) {
      int n = cycle.size();
      if (n < 3) {
         return;
      }

      IntArrayList cycleEdges = new IntArrayList(n);
      for (int i = 0; i < n; ++i) {
         int e = graph.getEdge(cycle.getu(i), cycle.getu((i + 1) % n));
         if (e < 0) {
            return;
         }
         cycleEdges.add(e);
      }

      Ring ring = new Ring(cycle, cycleEdges);
      if (seen.add(ring.getEdgeSet())) {
         candidates.add(ring);
      }
   }

   /**
    * Greedy Gaussian elimination over GF(2). Each kept row is reduced so that
    * its pivot is its lowest set bit and no other row shares that pivot.
    */
   private List<Ring> select(int rank) {
      Collections.sort(candidates);

      IntObjMap<BitSet> rowsByPivot = HashIntObjMaps.newMutableMap();
      List<Ring> rings = new ArrayList<>(rank);

      for (Ring candidate : candidates) {
         BitSet vector = (BitSet) candidate.getEdgeSet().clone();

         while (!vector.isEmpty()) {
            int pivot = vector.nextSetBit(0);
            BitSet row = rowsByPivot.get(pivot);
            if (row == null) {
               rowsByPivot.put(pivot, vector);
               rings.add(candidate);
               break;
            }
            vector.xor(row);
         }

         if (rings.size() == rank) {
            break;
         }
      }

      if (rings.size() != rank) {
         throw new IllegalStateException("Cycle basis has " + rings.size() +
                 " rings, expected " + rank);
      }

      return rings;
   }
}
