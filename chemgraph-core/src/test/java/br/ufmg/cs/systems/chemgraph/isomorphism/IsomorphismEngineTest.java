package br.ufmg.cs.systems.chemgraph.isomorphism;

import br.ufmg.cs.systems.chemgraph.conf.Configuration;
import br.ufmg.cs.systems.chemgraph.graph.InvalidGraphException;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.group.Group;
import br.ufmg.cs.systems.chemgraph.group.GroupAtom;
import br.ufmg.cs.systems.chemgraph.group.GroupBond;
import br.ufmg.cs.systems.chemgraph.group.GroupMoleculeMatcher;
import br.ufmg.cs.systems.chemgraph.molecule.Atom;
import br.ufmg.cs.systems.chemgraph.molecule.AtomType;
import br.ufmg.cs.systems.chemgraph.molecule.BondOrder;
import br.ufmg.cs.systems.chemgraph.molecule.Element;
import br.ufmg.cs.systems.chemgraph.molecule.Molecule;
import br.ufmg.cs.systems.chemgraph.molecule.TestMolecules;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IsomorphismEngineTest {
   private final GraphMatcher matcher = new GraphMatcher(new Configuration());

   private static List<Molecule> molecules() {
      return Arrays.asList(
              TestMolecules.methane(),
              TestMolecules.ethane(),
              TestMolecules.methanol(),
              TestMolecules.formaldehyde(),
              TestMolecules.ethanol(),
              TestMolecules.dimethylEther(),
              TestMolecules.benzeneSkeleton(true),
              TestMolecules.benzeneSkeleton(false),
              TestMolecules.naphthaleneSkeleton(),
              TestMolecules.cubaneSkeleton());
   }

   private static <V, E> void assertLabelPreserving(LabeledGraph<V, E> a,
                                                     LabeledGraph<V, E> b,
                                                     Mapping mapping) {
      assertEquals(a.numVertices(), mapping.size());
      IntArrayList vertices = a.vertices();
      for (int i = 0; i < vertices.size(); ++i) {
         int u = vertices.getu(i);
         assertEquals(a.vertexLabel(u), b.vertexLabel(mapping.get(u)));
      }
      assertEquals(a.numEdges(), mapping.edgeCorrespondence(a, b).size());
   }

   @Test
   void testReflexive() {
      for (Molecule molecule : molecules()) {
         assertTrue(matcher.isIsomorphic(molecule, molecule),
                 molecule.getFormula());
         assertTrue(matcher.isIsomorphic(molecule, molecule.copy()),
                 molecule.getFormula());
      }
   }

   @Test
   void testSymmetric() {
      List<Molecule> molecules = molecules();
      for (Molecule a : molecules) {
         for (Molecule b : molecules) {
            assertEquals(matcher.isIsomorphic(a, b), matcher.isIsomorphic(b, a),
                    a.getFormula() + " vs " + b.getFormula());
         }
      }
   }

   @Test
   void testReorderedMoleculeIsIsomorphic() {
      Molecule a = TestMolecules.methanol();
      Molecule b = TestMolecules.methanolReordered();

      MatchResult forward = matcher.findIsomorphism(a, b);
      MatchResult backward = matcher.findIsomorphism(b, a);
      assertTrue(forward.isMatch());
      assertTrue(backward.isMatch());
      assertLabelPreserving(a, b, forward.getMapping());
      assertLabelPreserving(b, a, forward.getMapping().inverse());
   }

   @Test
   void testIsomersAreDistinguished() {
      Molecule ethanol = TestMolecules.ethanol();
      Molecule ether = TestMolecules.dimethylEther();
      assertEquals(ethanol.getFormula(), ether.getFormula());

      MatchResult result = matcher.findIsomorphism(ethanol, ether);
      assertEquals(MatchStatus.NO_MATCH, result.getStatus());
      assertNull(result.getMapping());
      assertFalse(matcher.isIsomorphic(ether, ethanol));
   }

   @Test
   void testBondOrdersDistinguished() {
      assertFalse(matcher.isIsomorphic(TestMolecules.benzeneSkeleton(true),
              TestMolecules.benzeneSkeleton(false)));
   }

   @Test
   void testDisconnectedGraphs() {
      Molecule pair = TestMolecules.methane().merge(TestMolecules.water());
      Molecule swapped = TestMolecules.water().merge(TestMolecules.methane());
      assertTrue(matcher.isIsomorphic(pair, swapped));
      assertFalse(matcher.isIsomorphic(TestMolecules.twoRings(3),
              TestMolecules.ring(6).merge(new Molecule())));
   }

   @Test
   void testEmptyGraphs() {
      MatchResult result = matcher.findIsomorphism(new Molecule(),
              new Molecule());
      assertTrue(result.isMatch());
      assertTrue(result.getMapping().isEmpty());
   }

   @Test
   void testSubgraphMonotonicity() {
      Group.Builder builder = Group.builder();
      int c = builder.addAtom(GroupAtom.of(AtomType.CD));
      int o = builder.addAtom(GroupAtom.of(AtomType.O));
      builder.addBond(c, o, GroupBond.of(BondOrder.DOUBLE));
      Group carbonyl = builder.build();

      Molecule molecule = TestMolecules.formaldehyde();
      assertTrue(matcher.isSubgraphIsomorphic(carbonyl, molecule,
              new GroupMoleculeMatcher(carbonyl, molecule)));

      // grow the molecule away from the matched atoms
      Molecule grown = molecule.merge(TestMolecules.methane());
      grown.addBond(1, 4, BondOrder.SINGLE);
      int extra = grown.addAtom(Atom.of(Element.C));
      grown.addBond(extra, 5, BondOrder.SINGLE);
      assertTrue(matcher.isSubgraphIsomorphic(carbonyl, grown,
              new GroupMoleculeMatcher(carbonyl, grown)));
   }

   @Test
   void testSubgraphEnumeratesAllEmbeddings() {
      Group.Builder builder = Group.builder();
      int c1 = builder.addAtom(GroupAtom.of(AtomType.C));
      int c2 = builder.addAtom(GroupAtom.of(AtomType.C));
      builder.addBond(c1, c2, GroupBond.anyBond());
      Group pair = builder.build();

      Molecule chain = TestMolecules.carbonChain(4);
      MatchResult all = matcher.findSubgraphIsomorphisms(pair, chain,
              new GroupMoleculeMatcher(pair, chain));
      assertEquals(6, all.numMappings());
      assertEquals(6, new HashSet<>(all.getMappings()).size());

      MatchResult first = matcher.findSubgraphIsomorphism(pair, chain,
              new GroupMoleculeMatcher(pair, chain));
      assertEquals(1, first.numMappings());
   }

   @Test
   void testPatternLargerThanTarget() {
      Molecule chain = TestMolecules.carbonChain(2);
      Group.Builder builder = Group.builder();
      int a = builder.addAtom(GroupAtom.of(AtomType.C));
      int b = builder.addAtom(GroupAtom.of(AtomType.C));
      int c = builder.addAtom(GroupAtom.of(AtomType.C));
      builder.addBond(a, b, GroupBond.anyBond());
      builder.addBond(b, c, GroupBond.anyBond());
      Group triple = builder.build();

      MatchResult result = matcher.findSubgraphIsomorphism(triple, chain,
              new GroupMoleculeMatcher(triple, chain));
      assertEquals(MatchStatus.NO_MATCH, result.getStatus());
      assertEquals(0, result.getSteps());
   }

   @Test
   void testStepBoundAborts() {
      Molecule ring = TestMolecules.ring(40);
      Molecule rings = TestMolecules.twoRings(20);

      MatchResult bounded = matcher.findIsomorphism(ring, rings,
              SearchBound.steps(1000));
      assertEquals(MatchStatus.ABORTED, bounded.getStatus());
      assertTrue(bounded.isAborted());
      assertThat(bounded.getSteps(), lessThanOrEqualTo(1000L));
      assertThrows(SearchAbortedException.class, bounded::orThrow);

      MatchResult unbounded = matcher.findIsomorphism(ring, rings,
              SearchBound.unbounded());
      assertEquals(MatchStatus.NO_MATCH, unbounded.getStatus());
      assertThat(unbounded.getSteps(), greaterThan(1000L));
   }

   @Test
   void testDeadlineAborts() {
      MatchResult result = matcher.findIsomorphism(TestMolecules.ring(40),
              TestMolecules.twoRings(20), SearchBound.deadline(0));
      assertEquals(MatchStatus.ABORTED, result.getStatus());
   }

   @Test
   void testCancellationAborts() {
      SearchBound bound = SearchBound.unbounded().withCancellation(() -> true);
      MatchResult result = matcher.findIsomorphism(TestMolecules.ring(40),
              TestMolecules.twoRings(20), bound);
      assertEquals(MatchStatus.ABORTED, result.getStatus());

      SearchAbortedException e = assertThrows(SearchAbortedException.class,
              () -> matcher.isIsomorphic(TestMolecules.ring(40),
                      TestMolecules.twoRings(20), bound));
      assertThat(e.getSteps(), greaterThan(0L));
   }

   @Test
   void testBoundFromConfiguration() {
      GraphMatcher bounded = new GraphMatcher(new Configuration()
              .set(Configuration.CONF_SEARCH_MAX_STEPS, 10));
      assertEquals(10, bounded.defaultBound().getMaxSteps());
      assertThrows(SearchAbortedException.class, () -> bounded.isIsomorphic(
              TestMolecules.ring(40), TestMolecules.twoRings(20)));
   }

   @Test
   void testSteppingByHand() {
      Molecule benzene = TestMolecules.benzeneSkeleton(true);
      IsomorphismEngine engine = new IsomorphismEngine(benzene, benzene,
              MatchMode.AUTOMORPHISM, new EqualLabelMatcher<>(benzene, benzene),
              SearchBound.unbounded(), false, null, true);

      assertThrows(IllegalStateException.class, engine::getResult);

      int calls = 0;
      while (engine.step()) {
         ++calls;
      }
      assertFalse(engine.step());

      MatchResult result = engine.getResult();
      assertEquals(12, result.numMappings());
      assertThat((long) calls, greaterThan(result.getSteps()));
      assertEquals(engine.getSteps(), result.getSteps());
   }

   @Test
   void testInitialMapPinsVertices() {
      Molecule propane = TestMolecules.carbonChain(3);

      MatchResult swapped = matcher.findAutomorphisms(propane,
              SearchBound.unbounded(), Mapping.ofPairs(0, 2));
      assertEquals(1, swapped.numMappings());
      assertEquals(Mapping.ofPairs(0, 2, 1, 1, 2, 0), swapped.getMapping());

      MatchResult impossible = matcher.findAutomorphisms(propane,
              SearchBound.unbounded(), Mapping.ofPairs(0, 1));
      assertEquals(MatchStatus.NO_MATCH, impossible.getStatus());

      MatchResult complete = matcher.findAutomorphisms(propane,
              SearchBound.unbounded(), Mapping.ofPairs(0, 0, 1, 1, 2, 2));
      assertEquals(1, complete.numMappings());
      assertTrue(complete.getMapping().isIdentity());
   }

   @Test
   void testInitialMapWithUnknownVertex() {
      Molecule propane = TestMolecules.carbonChain(3);
      assertThrows(InvalidGraphException.class, () ->
              matcher.findAutomorphisms(propane, SearchBound.unbounded(),
                      Mapping.ofPairs(0, 9)));
   }

   @Test
   void testInsertionOrderingFindsSameAnswers() {
      GraphMatcher insertion = new GraphMatcher(new Configuration()
              .set(Configuration.CONF_SEARCH_ORDERING, "insertion"));
      Molecule cubane = TestMolecules.cubaneSkeleton();

      MatchResult heuristic = matcher.findAutomorphisms(cubane);
      MatchResult plain = insertion.findAutomorphisms(cubane);
      assertEquals(48, heuristic.numMappings());
      assertEquals(new HashSet<>(heuristic.getMappings()),
              new HashSet<>(plain.getMappings()));
   }

   @Test
   void testOrderingKeepsComponentsConnected() {
      Molecule molecule = TestMolecules.naphthaleneSkeleton();
      int[] counts = new int[molecule.vertexIdBound()];
      Arrays.fill(counts, 1);

      VertexOrdering ordering = VertexOrdering.compute(molecule, counts,
              new IntArrayList(), true);
      assertEquals(10, ordering.size());
      assertEquals(-1, ordering.parentAt(0));
      for (int depth = 1; depth < ordering.size(); ++depth) {
         int parent = ordering.parentAt(depth);
         assertTrue(molecule.hasEdge(parent, ordering.vertexAt(depth)));
         assertTrue(ordering.getOrder().indexOf(parent) < depth);
      }
   }

   @Test
   void testCustomLabelMatcher() {
      // element-only comparison ignores radicals
      Molecule methyl = TestMolecules.methane();
      methyl.setVertexLabel(0, Atom.radical(Element.C, 1));
      Molecule methane = TestMolecules.methane();

      LabelMatcher elementsOnly = new LabelMatcher() {
         @Override
         public boolean isVertexCompatible(int sourceVertex, int targetVertex) {
            return methyl.getAtom(sourceVertex).getElement() ==
                    methane.getAtom(targetVertex).getElement();
         }

         @Override
         public boolean isEdgeCompatible(int sourceEdge, int targetEdge) {
            return true;
         }
      };

      assertFalse(matcher.isIsomorphic(methyl, methane));
      MatchResult result = matcher.findIsomorphism(methyl, methane,
              elementsOnly, SearchBound.unbounded());
      assertTrue(result.isMatch());
      assertNotNull(result.getMapping());
   }
}
