package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.graph.InvalidGraphException;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.graph.VertexNeighbourhood;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Backtracking search for vertex mappings from a source graph into a target
 * graph, driven by an explicit stack of per-depth candidate lists.
 *
 * <p>One engine instance runs one query. {@link #step()} performs a single
 * backtracking step and can be called repeatedly by callers that interleave
 * their own work; {@link #run()} steps until the search finishes or its
 * bound is hit. A step is counted every time a candidate is accepted.</p>
 */
public class IsomorphismEngine {
   private static final Logger LOG = Logger.getLogger(IsomorphismEngine.class);

   private static final int INVARIANT_ROUNDS = 1;
   // clock and cancellation flag are polled every this many iterations
   private static final int POLL_INTERVAL = 64;

   private enum State {
      CREATED, RUNNING, DONE
   }

   private final LabeledGraph<?, ?> source;
   private final LabeledGraph<?, ?> target;
   private final MatchMode mode;
   private final LabelMatcher matcher;
   private final SearchBound bound;
   private final boolean findAll;
   private final Mapping initialMap;
   private final boolean heuristicOrdering;

   private VertexInvariants sourceInvariants;
   private VertexInvariants targetInvariants;
   private VertexOrdering ordering;
   private IntArrayList[] compatibleTargets;

   private int[] sourceToTarget;
   private int[] targetToSource;
   // number of mapped neighbours per vertex, for the non-adjacency check
   private int[] sourceMappedNeighbours;
   private int[] targetMappedNeighbours;

   private IntArrayList[] candidates;
   private int[] nextCandidate;
   private int numPinned;
   private int depth;

   private final List<Mapping> mappings;
   private MatchStatus status;
   private State state;
   private long steps;
   private long iterations;
   private long startNanos;

   public IsomorphismEngine(LabeledGraph<?, ?> source,
                            LabeledGraph<?, ?> target, MatchMode mode,
                            LabelMatcher matcher, SearchBound bound,
                            boolean findAll, Mapping initialMap,
                            boolean heuristicOrdering) {
      this.source = source;
      this.target = target;
      this.mode = mode;
      this.matcher = matcher;
      this.bound = bound == null ? SearchBound.unbounded() : bound;
      this.findAll = findAll || mode == MatchMode.AUTOMORPHISM;
      this.initialMap = initialMap == null ? Mapping.empty() : initialMap;
      this.heuristicOrdering = heuristicOrdering;
      this.mappings = new ArrayList<>();
      this.state = State.CREATED;
   }

   public MatchResult run() {
      while (step()) {
         // keep stepping
      }
      return getResult();
   }

   /**
    * Advances the search by one backtracking step.
    *
    * @return false once the search is finished (matched, exhausted or aborted)
    */
   public boolean step() {
      switch (state) {
         case CREATED:
            start();
            return state != State.DONE;
         case DONE:
            return false;
         default:
            break;
      }

      if (++iterations % POLL_INTERVAL == 0 &&
              (bound.timeExceeded(startNanos) || bound.isCancelled())) {
         abort();
         return false;
      }

      if (depth < numPinned) {
         finish();
         return false;
      }

      IntArrayList depthCandidates = candidates[depth];
      int u = ordering.vertexAt(depth);

      while (nextCandidate[depth] < depthCandidates.size()) {
         int w = depthCandidates.getu(nextCandidate[depth]++);
         if (!isFeasible(u, w)) {
            continue;
         }

         if (bound.stepsExceeded(steps + 1)) {
            abort();
            return false;
         }

         ++steps;
         assign(u, w);

         if (depth + 1 == ordering.size()) {
            mappings.add(Mapping.fromArray(source.vertices(), sourceToTarget));
            unassign(u);
            if (!findAll) {
               finish();
               return false;
            }
         } else {
            ++depth;
            prepareCandidates(depth);
         }

         return true;
      }

      // exhausted this depth, backtrack
      --depth;
      if (depth >= numPinned) {
         unassign(ordering.vertexAt(depth));
      }

      return true;
   }

   public MatchResult getResult() {
      if (state != State.DONE) {
         throw new IllegalStateException("Search has not finished");
      }
      return new MatchResult(status, mappings, steps);
   }

   public long getSteps() {
      return steps;
   }

   private void start() {
      state = State.RUNNING;
      startNanos = System.nanoTime();
      source.validate();
      if (target != source) {
         target.validate();
      }

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("Search start mode=%s source=%d/%d " +
                         "target=%d/%d pinned=%d bound=%s", mode,
                 source.numVertices(), source.numEdges(), target.numVertices(),
                 target.numEdges(), initialMap.size(), bound));
      }

      if (!preCheck()) {
         finish();
         return;
      }

      int sourceBound = source.vertexIdBound();
      int targetBound = target.vertexIdBound();
      sourceToTarget = new int[sourceBound];
      targetToSource = new int[targetBound];
      Arrays.fill(sourceToTarget, -1);
      Arrays.fill(targetToSource, -1);
      sourceMappedNeighbours = new int[sourceBound];
      targetMappedNeighbours = new int[targetBound];

      if (!computeCompatibleTargets() || !pinInitialMap()) {
         finish();
         return;
      }

      int[] candidateCounts = new int[sourceBound];
      IntArrayList sourceVertices = source.vertices();
      for (int i = 0; i < sourceVertices.size(); ++i) {
         int u = sourceVertices.getu(i);
         candidateCounts[u] = compatibleTargets[u].size();
      }

      ordering = VertexOrdering.compute(source, candidateCounts,
              initialMap.sources(), heuristicOrdering);

      int n = ordering.size();
      numPinned = initialMap.size();
      candidates = new IntArrayList[n];
      nextCandidate = new int[n];

      if (numPinned == n) {
         mappings.add(Mapping.fromArray(sourceVertices, sourceToTarget));
         finish();
         return;
      }

      depth = numPinned;
      prepareCandidates(depth);
   }

   private boolean preCheck() {
      if (mode.isBijective()) {
         if (source.numVertices() != target.numVertices() ||
                 source.numEdges() != target.numEdges()) {
            LOG.debug("Pre-check rejected: vertex or edge counts differ");
            return false;
         }
      } else if (source.numVertices() > target.numVertices() ||
              source.numEdges() > target.numEdges()) {
         LOG.debug("Pre-check rejected: pattern larger than target");
         return false;
      }

      int rounds = mode.isBijective() ? INVARIANT_ROUNDS : 0;
      sourceInvariants = VertexInvariants.compute(source,
              matcher::sourceVertexHash, matcher::sourceEdgeHash, rounds);
      targetInvariants = target == source && mode == MatchMode.AUTOMORPHISM ?
              sourceInvariants : VertexInvariants.compute(target,
              matcher::targetVertexHash, matcher::targetEdgeHash, rounds);

      if (mode.isBijective() && !Arrays.equals(
              sourceInvariants.sortedCodes(source.vertices()),
              targetInvariants.sortedCodes(target.vertices()))) {
         LOG.debug("Pre-check rejected: vertex invariants differ");
         return false;
      }

      return true;
   }

   /**
    * Fills, per source vertex, the target vertices passing the label,
    * degree and invariant filters.
    *
    * @return false if some source vertex has no candidate at all
    */
   private boolean computeCompatibleTargets() {
      IntArrayList sourceVertices = source.vertices();
      IntArrayList targetVertices = target.vertices();
      compatibleTargets = new IntArrayList[source.vertexIdBound()];

      for (int i = 0; i < sourceVertices.size(); ++i) {
         int u = sourceVertices.getu(i);
         IntArrayList compatible = new IntArrayList();

         for (int j = 0; j < targetVertices.size(); ++j) {
            int w = targetVertices.getu(j);
            if (isVertexCandidate(u, w)) {
               compatible.add(w);
            }
         }

         if (compatible.isEmpty()) {
            if (LOG.isDebugEnabled()) {
               LOG.debug("Pre-check rejected: no candidate for vertex " + u);
            }
            return false;
         }

         compatibleTargets[u] = compatible;
      }

      return true;
   }

   private boolean isVertexCandidate(int u, int w) {
      int sourceDegree = source.degree(u);
      int targetDegree = target.degree(w);

      if (mode.isBijective()) {
         if (sourceDegree != targetDegree ||
                 sourceInvariants.get(u) != targetInvariants.get(w)) {
            return false;
         }
      } else if (sourceDegree > targetDegree) {
         return false;
      }

      return matcher.isVertexCompatible(u, w);
   }

   /**
    * @return false when the initial map cannot be extended to any match
    * @throws InvalidGraphException when it names unknown vertices
    */
   private boolean pinInitialMap() {
      IntArrayList pinnedSources = initialMap.sources();

      for (int i = 0; i < pinnedSources.size(); ++i) {
         int u = pinnedSources.getu(i);
         int w = initialMap.get(u);

         if (!source.containsVertex(u) || !target.containsVertex(w)) {
            throw new InvalidGraphException("Initial map " + initialMap +
                    " names a vertex outside the graphs");
         }

         if (!compatibleTargets[u].contains(w) || !isFeasible(u, w)) {
            if (LOG.isDebugEnabled()) {
               LOG.debug("Initial map rejected at " + u + "->" + w);
            }
            return false;
         }

         assign(u, w);
      }

      return true;
   }

   private void prepareCandidates(int depth) {
      int parent = ordering.parentAt(depth);
      IntArrayList list;

      if (parent < 0) {
         list = compatibleTargets[ordering.vertexAt(depth)];
      } else {
         list = target.neighbourhood(sourceToTarget[parent]).getOrderedVertices();
      }

      candidates[depth] = list;
      nextCandidate[depth] = 0;
   }

   private boolean isFeasible(int u, int w) {
      if (targetToSource[w] >= 0) {
         return false;
      }

      if (!isVertexCandidate(u, w)) {
         return false;
      }

      VertexNeighbourhood sourceNeighbourhood = source.neighbourhood(u);
      VertexNeighbourhood targetNeighbourhood = target.neighbourhood(w);
      IntArrayList neighbours = sourceNeighbourhood.getOrderedVertices();

      for (int i = 0; i < neighbours.size(); ++i) {
         int v = neighbours.getu(i);
         int image = sourceToTarget[v];
         if (image < 0) {
            continue;
         }

         int targetEdge = targetNeighbourhood.getEdge(image);
         if (targetEdge < 0 || !matcher.isEdgeCompatible(
                 sourceNeighbourhood.getEdge(v), targetEdge)) {
            return false;
         }
      }

      // every mapped source neighbour has a mapped target neighbour as image,
      // so equal counts rule out extra adjacencies in the target
      return !mode.isBijective() ||
              sourceMappedNeighbours[u] == targetMappedNeighbours[w];
   }

   private void assign(int u, int w) {
      sourceToTarget[u] = w;
      targetToSource[w] = u;
      updateMappedNeighbours(u, w, 1);
   }

   private void unassign(int u) {
      int w = sourceToTarget[u];
      sourceToTarget[u] = -1;
      targetToSource[w] = -1;
      updateMappedNeighbours(u, w, -1);
   }

   private void updateMappedNeighbours(int u, int w, int delta) {
      IntArrayList sourceNeighbours = source.neighbourhood(u)
              .getOrderedVertices();
      for (int i = 0; i < sourceNeighbours.size(); ++i) {
         sourceMappedNeighbours[sourceNeighbours.getu(i)] += delta;
      }

      IntArrayList targetNeighbours = target.neighbourhood(w)
              .getOrderedVertices();
      for (int i = 0; i < targetNeighbours.size(); ++i) {
         targetMappedNeighbours[targetNeighbours.getu(i)] += delta;
      }
   }

   private void finish() {
      state = State.DONE;
      status = mappings.isEmpty() ? MatchStatus.NO_MATCH : MatchStatus.MATCH;

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("Search finished mode=%s status=%s " +
                 "mappings=%d steps=%d", mode, status, mappings.size(), steps));
      }
   }

   private void abort() {
      state = State.DONE;
      status = MatchStatus.ABORTED;

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("Search aborted mode=%s mappings=%d " +
                 "steps=%d bound=%s", mode, mappings.size(), steps, bound));
      }
   }
}
