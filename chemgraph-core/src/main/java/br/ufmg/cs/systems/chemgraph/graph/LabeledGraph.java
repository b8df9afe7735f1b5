package br.ufmg.cs.systems.chemgraph.graph;

import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.IntObjCursor;
import com.koloboke.collect.map.IntObjMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.collect.map.hash.HashIntObjMaps;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simple undirected graph with one label per vertex and per edge.
 *
 * <p>Vertices and edges live in an arena and are addressed by integer ids.
 * Ids are issued in increasing order and never reused by the same graph, so
 * ascending id order is insertion order. Adjacency is an index
 * ({@link VertexNeighbourhood}) updated on every edit.</p>
 *
 * <p>Each vertex may carry a string tag (a reactive-center role such as
 * {@code *1}). Tags are annotations only and never take part in matching.</p>
 *
 * @param <V> vertex label type
 * @param <E> edge label type
 */
public class LabeledGraph<V, E> {
   private final ArrayList<V> vertexLabels;
   private final ArrayList<VertexNeighbourhood> neighbourhoods;
   private final ArrayList<E> edgeLabels;
   private final IntArrayList edgeSources;
   private final IntArrayList edgeDestinations;

   // live ids, ascending
   private final IntArrayList vertices;
   private final IntArrayList edges;

   private final IntObjMap<String> tags;

   private long modificationStamp;

   public LabeledGraph() {
      vertexLabels = new ArrayList<>();
      neighbourhoods = new ArrayList<>();
      edgeLabels = new ArrayList<>();
      edgeSources = new IntArrayList();
      edgeDestinations = new IntArrayList();
      vertices = new IntArrayList();
      edges = new IntArrayList();
      tags = HashIntObjMaps.newMutableMap();
   }

   /**
    * Empty graph of the same concrete type, used by {@link #copy()}.
    */
   protected LabeledGraph<V, E> newEmptyGraph() {
      return new LabeledGraph<>();
   }

   /**
    * Hook called before every mutation.
    */
   protected void checkMutable() {
   }

   protected void touch() {
      ++modificationStamp;
   }

   /**
    * Counter bumped by every structural or label edit. Results derived from
    * the graph (automorphisms, invariants) are valid only for the stamp they
    * were computed at.
    */
   public long getModificationStamp() {
      return modificationStamp;
   }

   public int addVertex(V label) {
      checkMutable();

      if (label == null) {
         throw new GraphConstructionException("Vertex label must not be null");
      }

      int vertexId = vertexLabels.size();
      vertexLabels.add(label);
      neighbourhoods.add(new VertexNeighbourhood());
      vertices.add(vertexId);
      touch();

      return vertexId;
   }

   public int addEdge(int vertex1, int vertex2, E label) {
      checkMutable();
      checkVertex(vertex1);
      checkVertex(vertex2);

      if (vertex1 == vertex2) {
         throw new GraphConstructionException("Self-loop on vertex " + vertex1);
      }

      if (label == null) {
         throw new GraphConstructionException("Edge label must not be null");
      }

      if (neighbourhoods.get(vertex1).isNeighbourVertex(vertex2)) {
         throw new DuplicateEdgeException(vertex1, vertex2);
      }

      int edgeId = edgeLabels.size();
      edgeLabels.add(label);
      edgeSources.add(vertex1);
      edgeDestinations.add(vertex2);
      neighbourhoods.get(vertex1).addEdge(vertex2, edgeId);
      neighbourhoods.get(vertex2).addEdge(vertex1, edgeId);
      edges.add(edgeId);
      touch();

      return edgeId;
   }

   public void removeEdge(int edgeId) {
      checkMutable();
      checkEdge(edgeId);

      int src = edgeSources.getu(edgeId);
      int dst = edgeDestinations.getu(edgeId);
      neighbourhoods.get(src).removeNeighbour(dst);
      neighbourhoods.get(dst).removeNeighbour(src);
      edgeLabels.set(edgeId, null);
      edges.removeSorted(edgeId);
      touch();
   }

   public void removeVertex(int vertexId) {
      checkMutable();
      checkVertex(vertexId);

      IntArrayList incident = new IntArrayList(degree(vertexId));
      neighbourhoods.get(vertexId).forEachNeighbour((v, e) -> incident.add(e));
      for (int i = 0; i < incident.size(); ++i) {
         removeEdge(incident.getu(i));
      }

      vertexLabels.set(vertexId, null);
      neighbourhoods.set(vertexId, null);
      vertices.removeSorted(vertexId);
      tags.remove(vertexId);
      touch();
   }

   public boolean containsVertex(int vertexId) {
      return vertexId >= 0 && vertexId < vertexLabels.size() &&
              vertexLabels.get(vertexId) != null;
   }

   public boolean containsEdge(int edgeId) {
      return edgeId >= 0 && edgeId < edgeLabels.size() &&
              edgeLabels.get(edgeId) != null;
   }

   protected void checkVertex(int vertexId) {
      if (!containsVertex(vertexId)) {
         throw new UnknownVertexException(vertexId);
      }
   }

   protected void checkEdge(int edgeId) {
      if (!containsEdge(edgeId)) {
         throw new GraphConstructionException(
                 "Edge " + edgeId + " does not belong to this graph");
      }
   }

   public V vertexLabel(int vertexId) {
      checkVertex(vertexId);
      return vertexLabels.get(vertexId);
   }

   public E edgeLabel(int edgeId) {
      checkEdge(edgeId);
      return edgeLabels.get(edgeId);
   }

   public void setVertexLabel(int vertexId, V label) {
      checkMutable();
      checkVertex(vertexId);

      if (label == null) {
         throw new GraphConstructionException("Vertex label must not be null");
      }

      vertexLabels.set(vertexId, label);
      touch();
   }

   public void setEdgeLabel(int edgeId, E label) {
      checkMutable();
      checkEdge(edgeId);

      if (label == null) {
         throw new GraphConstructionException("Edge label must not be null");
      }

      edgeLabels.set(edgeId, label);
      touch();
   }

   public int edgeSrc(int edgeId) {
      checkEdge(edgeId);
      return edgeSources.getu(edgeId);
   }

   public int edgeDst(int edgeId) {
      checkEdge(edgeId);
      return edgeDestinations.getu(edgeId);
   }

   public int otherEnd(int edgeId, int vertexId) {
      int src = edgeSrc(edgeId);
      int dst = edgeDestinations.getu(edgeId);

      if (src == vertexId) {
         return dst;
      } else if (dst == vertexId) {
         return src;
      }

      throw new UnknownVertexException(vertexId);
   }

   /**
    * @return id of the edge joining both vertices, or -1 if not adjacent
    */
   public int getEdge(int vertex1, int vertex2) {
      checkVertex(vertex1);
      checkVertex(vertex2);
      return neighbourhoods.get(vertex1).getEdge(vertex2);
   }

   public boolean hasEdge(int vertex1, int vertex2) {
      return getEdge(vertex1, vertex2) >= 0;
   }

   public VertexNeighbourhood neighbourhood(int vertexId) {
      checkVertex(vertexId);
      return neighbourhoods.get(vertexId);
   }

   /**
    * Neighbours of a vertex in insertion order.
    */
   public IntArrayList neighbors(int vertexId) {
      return new IntArrayList(neighbourhood(vertexId).getOrderedVertices());
   }

   public int degree(int vertexId) {
      return neighbourhood(vertexId).size();
   }

   /**
    * Live vertex ids in insertion order.
    */
   public IntArrayList vertices() {
      return new IntArrayList(vertices);
   }

   /**
    * Live edge ids in insertion order.
    */
   public IntArrayList edges() {
      return new IntArrayList(edges);
   }

   public int numVertices() {
      return vertices.size();
   }

   public int numEdges() {
      return edges.size();
   }

   public boolean isEmpty() {
      return vertices.isEmpty();
   }

   /**
    * Exclusive upper bound of vertex ids ever issued; sizes id-indexed arrays.
    */
   public int vertexIdBound() {
      return vertexLabels.size();
   }

   public int edgeIdBound() {
      return edgeLabels.size();
   }

   // Tags

   public void setTag(int vertexId, String tag) {
      checkMutable();
      checkVertex(vertexId);

      if (tag == null || tag.isEmpty()) {
         tags.remove(vertexId);
      } else {
         tags.put(vertexId, tag);
      }
   }

   public String getTag(int vertexId) {
      checkVertex(vertexId);
      return tags.get(vertexId);
   }

   /**
    * @return the vertex carrying the given tag, or -1
    */
   public int findTagged(String tag) {
      IntObjCursor<String> cur = tags.cursor();
      int found = -1;
      while (cur.moveNext()) {
         if (cur.value().equals(tag) && (found < 0 || cur.key() < found)) {
            found = cur.key();
         }
      }
      return found;
   }

   /**
    * All tagged vertices, keyed by tag in lexicographic order.
    */
   public Map<String, Integer> getTaggedVertices() {
      Map<String, Integer> tagged = new TreeMap<>();
      IntObjCursor<String> cur = tags.cursor();
      while (cur.moveNext()) {
         tagged.put(cur.value(), cur.key());
      }
      return tagged;
   }

   // Traversal

   public IntArrayList breadthFirst(int start) {
      checkVertex(start);

      boolean[] visited = new boolean[vertexIdBound()];
      IntArrayList order = new IntArrayList(numVertices());
      order.add(start);
      visited[start] = true;

      // order doubles as the queue
      for (int head = 0; head < order.size(); ++head) {
         IntArrayList neighbours = neighbourhoods.get(order.getu(head))
                 .getOrderedVertices();
         for (int i = 0; i < neighbours.size(); ++i) {
            int v = neighbours.getu(i);
            if (!visited[v]) {
               visited[v] = true;
               order.add(v);
            }
         }
      }

      return order;
   }

   /**
    * Preorder depth-first traversal visiting lower-id neighbours first.
    */
   public IntArrayList depthFirst(int start) {
      checkVertex(start);

      boolean[] visited = new boolean[vertexIdBound()];
      IntArrayList order = new IntArrayList(numVertices());
      IntArrayList stack = new IntArrayList();
      stack.add(start);

      while (!stack.isEmpty()) {
         int u = stack.pop();
         if (visited[u]) {
            continue;
         }

         visited[u] = true;
         order.add(u);

         IntArrayList neighbours = neighbourhoods.get(u).getOrderedVertices();
         for (int i = neighbours.size() - 1; i >= 0; --i) {
            int v = neighbours.getu(i);
            if (!visited[v]) {
               stack.add(v);
            }
         }
      }

      return order;
   }

   /**
    * Connected components, each sorted ascending, ordered by their smallest
    * vertex id.
    */
   public List<IntArrayList> connectedComponents() {
      List<IntArrayList> components = new ArrayList<>();
      boolean[] assigned = new boolean[vertexIdBound()];

      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         if (assigned[u]) {
            continue;
         }

         IntArrayList component = breadthFirst(u);
         for (int j = 0; j < component.size(); ++j) {
            assigned[component.getu(j)] = true;
         }
         component.sort();
         components.add(component);
      }

      return components;
   }

   public int numConnectedComponents() {
      return connectedComponents().size();
   }

   public boolean isConnected() {
      return vertices.isEmpty() ||
              breadthFirst(vertices.getu(0)).size() == vertices.size();
   }

   // Copies

   public LabeledGraph<V, E> copy() {
      return copy(HashIntIntMaps.newMutableMap(numVertices()));
   }

   /**
    * Deep copy with fresh, compacted ids ({@code 0..n-1} in insertion order).
    * Labels are shared, so label types are expected to be immutable.
    *
    * @param oldToNew filled with this graph's vertex ids mapped to the copy's
    */
   public LabeledGraph<V, E> copy(IntIntMap oldToNew) {
      LabeledGraph<V, E> copy = newEmptyGraph();
      copyInto(copy, oldToNew);
      return copy;
   }

   protected void copyInto(LabeledGraph<V, E> copy, IntIntMap oldToNew) {
      oldToNew.clear();

      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         oldToNew.put(u, copy.addVertex(vertexLabels.get(u)));
      }

      for (int i = 0; i < edges.size(); ++i) {
         int e = edges.getu(i);
         copy.addEdge(oldToNew.get(edgeSources.getu(e)),
                 oldToNew.get(edgeDestinations.getu(e)), edgeLabels.get(e));
      }

      IntObjCursor<String> cur = tags.cursor();
      while (cur.moveNext()) {
         copy.tags.put(oldToNew.get(cur.key()), cur.value());
      }
   }

   /**
    * Re-checks the simple-graph invariant and the consistency between the
    * adjacency index and the edge set.
    *
    * @throws InvalidGraphException when violated
    */
   public void validate() {
      int incidences = 0;

      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         VertexNeighbourhood neighbourhood = neighbourhoods.get(u);
         if (vertexLabels.get(u) == null || neighbourhood == null) {
            throw new InvalidGraphException("Vertex " + u + " is incomplete");
         }
         if (!neighbourhood.isConsistent()) {
            throw new InvalidGraphException(
                    "Adjacency index of vertex " + u + " is inconsistent");
         }
         incidences += neighbourhood.size();
      }

      for (int i = 0; i < edges.size(); ++i) {
         int e = edges.getu(i);
         int src = edgeSources.getu(e);
         int dst = edgeDestinations.getu(e);

         if (src == dst) {
            throw new InvalidGraphException("Edge " + e + " is a self-loop");
         }
         if (!containsVertex(src) || !containsVertex(dst)) {
            throw new InvalidGraphException("Edge " + e + " is dangling");
         }
         if (neighbourhoods.get(src).getEdge(dst) != e ||
                 neighbourhoods.get(dst).getEdge(src) != e) {
            throw new InvalidGraphException(
                    "Edge " + e + " is missing from the adjacency index");
         }
      }

      if (incidences != 2 * edges.size()) {
         throw new InvalidGraphException("Adjacency index holds " +
                 incidences + " incidences for " + edges.size() + " edges");
      }
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append(getClass().getSimpleName()).append("{vertices=[");
      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         if (i > 0) sb.append(",");
         sb.append(u).append(":").append(vertexLabels.get(u));
         String tag = tags.get(u);
         if (tag != null) sb.append("(").append(tag).append(")");
      }
      sb.append("],edges=[");
      for (int i = 0; i < edges.size(); ++i) {
         int e = edges.getu(i);
         if (i > 0) sb.append(",");
         sb.append(edgeSources.getu(e)).append("-")
                 .append(edgeDestinations.getu(e)).append(":")
                 .append(edgeLabels.get(e));
      }
      sb.append("]}");
      return sb.toString();
   }
}
