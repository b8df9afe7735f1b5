package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.graph.Connectivity;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.graph.VertexNeighbourhood;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;

import java.util.Arrays;
import java.util.function.IntUnaryOperator;

/**
 * Isomorphism-invariant vertex codes: degree, label hash and ring flag,
 * refined by rounds of sorted neighbour codes. Equal codes do not imply
 * equivalence; different codes prove non-equivalence as long as the label
 * hashes agree on compatible labels.
 */
public final class VertexInvariants {
   private final long[] codes;
   private final boolean[] ringFlags;

   private VertexInvariants(long[] codes, boolean[] ringFlags) {
      this.codes = codes;
      this.ringFlags = ringFlags;
   }

   public static VertexInvariants compute(LabeledGraph<?, ?> graph,
                                          IntUnaryOperator vertexHash,
                                          IntUnaryOperator edgeHash,
                                          int rounds) {
      int bound = graph.vertexIdBound();
      boolean[] ringFlags = Connectivity.of(graph).ringVertexFlags();
      IntArrayList vertices = graph.vertices();
      long[] codes = new long[bound];

      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         long code = mix(17, graph.degree(u));
         code = mix(code, vertexHash.applyAsInt(u));
         code = mix(code, ringFlags[u] ? 1 : 0);
         codes[u] = code;
      }

      long[] next = new long[bound];
      for (int round = 0; round < rounds; ++round) {
         for (int i = 0; i < vertices.size(); ++i) {
            int u = vertices.getu(i);
            VertexNeighbourhood neighbourhood = graph.neighbourhood(u);
            IntArrayList neighbours = neighbourhood.getOrderedVertices();

            long[] neighbourCodes = new long[neighbours.size()];
            for (int j = 0; j < neighbours.size(); ++j) {
               int v = neighbours.getu(j);
               neighbourCodes[j] = mix(codes[v],
                       edgeHash.applyAsInt(neighbourhood.getEdge(v)));
            }
            Arrays.sort(neighbourCodes);

            long code = codes[u];
            for (long neighbourCode : neighbourCodes) {
               code = mix(code, neighbourCode);
            }
            next[u] = code;
         }

         long[] tmp = codes;
         codes = next;
         next = tmp;
      }

      return new VertexInvariants(codes, ringFlags);
   }

   static long mix(long hash, long value) {
      hash ^= value + 0x9E3779B97F4A7C15L + (hash << 6) + (hash >>> 2);
      return hash * 0xBF58476D1CE4E5B9L;
   }

   public long get(int vertexId) {
      return codes[vertexId];
   }

   public boolean isInRing(int vertexId) {
      return ringFlags[vertexId];
   }

   /**
    * Codes of the given vertices, sorted; equal multisets are necessary for
    * two graphs to be isomorphic.
    */
   public long[] sortedCodes(IntArrayList vertices) {
      long[] sorted = new long[vertices.size()];
      for (int i = 0; i < vertices.size(); ++i) {
         sorted[i] = codes[vertices.getu(i)];
      }
      Arrays.sort(sorted);
      return sorted;
   }
}
