package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.conf.Configuration;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;

/**
 * Entry point for matching queries. Methods without a {@link SearchBound} use
 * the bound from the configuration (unbounded by default).
 */
public class GraphMatcher {
   private static volatile GraphMatcher defaultMatcher;

   private final Configuration conf;

   public GraphMatcher() {
      this(Configuration.getDefault());
   }

   public GraphMatcher(Configuration conf) {
      this.conf = conf;
   }

   public static GraphMatcher getDefault() {
      GraphMatcher matcher = defaultMatcher;
      if (matcher == null) {
         synchronized (GraphMatcher.class) {
            matcher = defaultMatcher;
            if (matcher == null) {
               matcher = new GraphMatcher();
               defaultMatcher = matcher;
            }
         }
      }
      return matcher;
   }

   public Configuration getConfiguration() {
      return conf;
   }

   public SearchBound defaultBound() {
      return SearchBound.fromConfiguration(conf);
   }

   public MatchResult match(MatchMode mode, LabeledGraph<?, ?> source,
                            LabeledGraph<?, ?> target, LabelMatcher matcher,
                            SearchBound bound, Mapping initialMap,
                            boolean findAll) {
      IsomorphismEngine engine = new IsomorphismEngine(source, target, mode,
              matcher, bound, findAll, initialMap, conf.isHeuristicOrdering());
      return engine.run();
   }

   // Exact isomorphism

   public <V, E> MatchResult findIsomorphism(LabeledGraph<V, E> a,
                                             LabeledGraph<V, E> b) {
      return findIsomorphism(a, b, defaultBound());
   }

   public <V, E> MatchResult findIsomorphism(LabeledGraph<V, E> a,
                                             LabeledGraph<V, E> b,
                                             SearchBound bound) {
      return findIsomorphism(a, b, new EqualLabelMatcher<>(a, b), bound);
   }

   public MatchResult findIsomorphism(LabeledGraph<?, ?> a,
                                      LabeledGraph<?, ?> b,
                                      LabelMatcher matcher,
                                      SearchBound bound) {
      return match(MatchMode.EXACT, a, b, matcher, bound, null, false);
   }

   public <V, E> boolean isIsomorphic(LabeledGraph<V, E> a,
                                      LabeledGraph<V, E> b) {
      return isIsomorphic(a, b, defaultBound());
   }

   /**
    * @throws SearchAbortedException if the bound is hit before an answer
    */
   public <V, E> boolean isIsomorphic(LabeledGraph<V, E> a,
                                      LabeledGraph<V, E> b,
                                      SearchBound bound) {
      return findIsomorphism(a, b, bound).orThrow().isMatch();
   }

   // Subgraph isomorphism

   public MatchResult findSubgraphIsomorphism(LabeledGraph<?, ?> pattern,
                                              LabeledGraph<?, ?> target,
                                              LabelMatcher matcher) {
      return findSubgraphIsomorphism(pattern, target, matcher, defaultBound(),
              null);
   }

   public MatchResult findSubgraphIsomorphism(LabeledGraph<?, ?> pattern,
                                              LabeledGraph<?, ?> target,
                                              LabelMatcher matcher,
                                              SearchBound bound,
                                              Mapping initialMap) {
      return match(MatchMode.SUBGRAPH, pattern, target, matcher, bound,
              initialMap, false);
   }

   public MatchResult findSubgraphIsomorphisms(LabeledGraph<?, ?> pattern,
                                               LabeledGraph<?, ?> target,
                                               LabelMatcher matcher) {
      return findSubgraphIsomorphisms(pattern, target, matcher, defaultBound(),
              null);
   }

   /**
    * Every raw embedding, including those that differ only by a symmetry of
    * the pattern.
    */
   public MatchResult findSubgraphIsomorphisms(LabeledGraph<?, ?> pattern,
                                               LabeledGraph<?, ?> target,
                                               LabelMatcher matcher,
                                               SearchBound bound,
                                               Mapping initialMap) {
      return match(MatchMode.SUBGRAPH, pattern, target, matcher, bound,
              initialMap, true);
   }

   public boolean isSubgraphIsomorphic(LabeledGraph<?, ?> pattern,
                                       LabeledGraph<?, ?> target,
                                       LabelMatcher matcher) {
      return isSubgraphIsomorphic(pattern, target, matcher, defaultBound());
   }

   /**
    * @throws SearchAbortedException if the bound is hit before an answer
    */
   public boolean isSubgraphIsomorphic(LabeledGraph<?, ?> pattern,
                                       LabeledGraph<?, ?> target,
                                       LabelMatcher matcher,
                                       SearchBound bound) {
      return findSubgraphIsomorphism(pattern, target, matcher, bound, null)
              .orThrow().isMatch();
   }

   // Automorphisms

   public <V, E> MatchResult findAutomorphisms(LabeledGraph<V, E> graph) {
      return findAutomorphisms(graph, defaultBound(), null);
   }

   /**
    * @param anchors pairs pinned before the search, usually {@code a -> a}
    */
   public <V, E> MatchResult findAutomorphisms(LabeledGraph<V, E> graph,
                                               SearchBound bound,
                                               Mapping anchors) {
      return findAutomorphisms(graph, new EqualLabelMatcher<>(graph, graph),
              bound, anchors);
   }

   public MatchResult findAutomorphisms(LabeledGraph<?, ?> graph,
                                        LabelMatcher matcher,
                                        SearchBound bound, Mapping anchors) {
      return match(MatchMode.AUTOMORPHISM, graph, graph, matcher, bound,
              anchors, true);
   }
}
