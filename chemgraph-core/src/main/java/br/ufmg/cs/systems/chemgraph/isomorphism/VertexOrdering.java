package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import org.apache.log4j.Logger;

/**
 * Order in which the engine assigns source vertices.
 *
 * <p>Pinned vertices come first. Then, repeatedly, the unordered vertex with
 * the highest cost tuple is appended, where the cost is (number of already
 * ordered neighbours, minus the number of compatible target candidates,
 * degree) and ties go to the lowest id. The first ordered neighbour of a
 * vertex is its parent: candidates for the vertex are drawn from the
 * neighbours of the parent's image.</p>
 */
public final class VertexOrdering {
   private static final Logger LOG = Logger.getLogger(VertexOrdering.class);

   private final IntArrayList order;
   private final IntArrayList parents;

   private VertexOrdering(IntArrayList order, IntArrayList parents) {
      this.order = order;
      this.parents = parents;
   }

   /**
    * @param candidateCounts compatible target candidates per source vertex id
    * @param pinned          source vertices fixed by an initial map
    * @param heuristic       false orders free vertices by insertion order,
    *                        still keeping each component connected
    */
   public static VertexOrdering compute(LabeledGraph<?, ?> graph,
                                        int[] candidateCounts,
                                        IntArrayList pinned,
                                        boolean heuristic) {
      int bound = graph.vertexIdBound();
      IntArrayList vertices = graph.vertices();
      int n = vertices.size();

      IntArrayList order = new IntArrayList(n);
      IntArrayList parents = new IntArrayList(n);
      boolean[] ordered = new boolean[bound];
      int[] orderedNeighbours = new int[bound];
      int[] parent = new int[bound];
      for (int i = 0; i < bound; ++i) {
         parent[i] = -1;
      }

      for (int i = 0; i < pinned.size(); ++i) {
         int u = pinned.getu(i);
         order.add(u);
         parents.add(-1);
         markOrdered(graph, u, ordered, orderedNeighbours, parent);
      }

      while (order.size() < n) {
         int best = -1;
         for (int i = 0; i < n; ++i) {
            int v = vertices.getu(i);
            if (ordered[v]) {
               continue;
            }
            if (best < 0) {
               best = v;
               if (!heuristic && orderedNeighbours[v] > 0) {
                  break;
               }
               continue;
            }
            if (heuristic) {
               if (compareCosts(graph, v, best, orderedNeighbours,
                       candidateCounts) > 0) {
                  best = v;
               }
            } else if (orderedNeighbours[v] > 0 && orderedNeighbours[best] == 0) {
               best = v;
               break;
            }
         }

         order.add(best);
         parents.add(parent[best]);
         markOrdered(graph, best, ordered, orderedNeighbours, parent);
      }

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("Ordering order=%s parents=%s", order,
                 parents));
      }

      return new VertexOrdering(order, parents);
   }

   private static void markOrdered(LabeledGraph<?, ?> graph, int u,
                                   boolean[] ordered, int[] orderedNeighbours,
                                   int[] parent) {
      ordered[u] = true;
      IntArrayList neighbours = graph.neighbourhood(u).getOrderedVertices();
      for (int i = 0; i < neighbours.size(); ++i) {
         int v = neighbours.getu(i);
         if (!ordered[v] && orderedNeighbours[v]++ == 0) {
            parent[v] = u;
         }
      }
   }

   private static int compareCosts(LabeledGraph<?, ?> graph, int v1, int v2,
                                   int[] orderedNeighbours,
                                   int[] candidateCounts) {
      int cmp = Integer.compare(orderedNeighbours[v1], orderedNeighbours[v2]);
      if (cmp != 0) return cmp;

      cmp = Integer.compare(candidateCounts[v2], candidateCounts[v1]);
      if (cmp != 0) return cmp;

      return Integer.compare(graph.degree(v1), graph.degree(v2));
   }

   public int size() {
      return order.size();
   }

   /**
    * Source vertex assigned at the given depth.
    */
   public int vertexAt(int depth) {
      return order.getu(depth);
   }

   /**
    * Parent of the vertex at the given depth, or -1.
    */
   public int parentAt(int depth) {
      return parents.getu(depth);
   }

   public IntArrayList getOrder() {
      return new IntArrayList(order);
   }

   @Override
   public String toString() {
      return "VertexOrdering{" +
              "order=" + order +
              ",parents=" + parents +
              '}';
   }
}
