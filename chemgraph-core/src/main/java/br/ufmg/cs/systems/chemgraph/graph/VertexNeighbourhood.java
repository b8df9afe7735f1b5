package br.ufmg.cs.systems.chemgraph.graph;

import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayListView;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.function.IntIntConsumer;

/**
 * Adjacency of one vertex: neighbour vertex id to the id of the edge joining
 * them. Neighbours are also kept in ascending id order, which is vertex
 * insertion order, so traversals are reproducible. Only the owning graph
 * changes it; everyone else sees it read-only.
 */
public class VertexNeighbourhood {
   // Key = neighbour vertex id, Value = edge id that connects owner of neighbourhood with Key
   private final IntIntMap neighbourhoodMap;
   private final IntArrayList orderedVertices;
   private final IntArrayListView orderedVerticesView;

   VertexNeighbourhood() {
      this.neighbourhoodMap = HashIntIntMaps.getDefaultFactory()
              .withDefaultValue(-1).newMutableMap();
      this.orderedVertices = new IntArrayList(4);
      this.orderedVerticesView = new IntArrayListView(orderedVertices);
   }

   public int getEdge(int neighbourVertexId) {
      return neighbourhoodMap.get(neighbourVertexId);
   }

   public boolean isNeighbourVertex(int vertexId) {
      return neighbourhoodMap.containsKey(vertexId);
   }

   void addEdge(int neighbourVertexId, int edgeId) {
      neighbourhoodMap.put(neighbourVertexId, edgeId);
      orderedVertices.addSorted(neighbourVertexId);
      orderedVerticesView.sync();
   }

   /**
    * @return id of the removed edge, or -1 when not adjacent
    */
   int removeNeighbour(int neighbourVertexId) {
      int edgeId = neighbourhoodMap.remove(neighbourVertexId);
      if (edgeId != neighbourhoodMap.defaultValue()) {
         orderedVertices.removeSorted(neighbourVertexId);
         orderedVerticesView.sync();
      }
      return edgeId;
   }

   public int size() {
      return orderedVertices.size();
   }

   /**
    * Neighbour ids in ascending order, as a read-only view.
    */
   public IntArrayList getOrderedVertices() {
      return orderedVerticesView;
   }

   public void forEachNeighbour(IntIntConsumer consumer) {
      for (int i = 0; i < orderedVertices.size(); ++i) {
         int v = orderedVertices.getu(i);
         consumer.accept(v, neighbourhoodMap.get(v));
      }
   }

   boolean isConsistent() {
      if (neighbourhoodMap.size() != orderedVertices.size()) {
         return false;
      }

      for (int i = 0; i < orderedVertices.size(); ++i) {
         if (!neighbourhoodMap.containsKey(orderedVertices.getu(i))) {
            return false;
         }
         if (i > 0 && orderedVertices.getu(i - 1) >= orderedVertices.getu(i)) {
            return false;
         }
      }

      return true;
   }

   @Override
   public String toString() {
      return "VertexNeighbourhood{" +
              "neighbourhoodMap=" + neighbourhoodMap +
              '}';
   }
}
