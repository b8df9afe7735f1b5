package br.ufmg.cs.systems.chemgraph.symmetry;

import br.ufmg.cs.systems.chemgraph.group.Group;
import br.ufmg.cs.systems.chemgraph.group.GroupMoleculeMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.EqualLabelMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.GraphMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.MatchResult;
import br.ufmg.cs.systems.chemgraph.isomorphism.Mapping;
import br.ufmg.cs.systems.chemgraph.isomorphism.SearchAbortedException;
import br.ufmg.cs.systems.chemgraph.isomorphism.SearchBound;
import br.ufmg.cs.systems.chemgraph.molecule.Molecule;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import org.apache.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Symmetry numbers and equivalent atoms from automorphism enumeration.
 *
 * <p>The global symmetry number of a molecule is the number of its
 * automorphisms. The local symmetry number of a reaction site counts only the
 * automorphisms fixing every anchor atom.</p>
 */
public final class SymmetryCounter {
   private static final Logger LOG = Logger.getLogger(SymmetryCounter.class);

   private SymmetryCounter() {
   }

   /**
    * @throws SearchAbortedException if the configured bound is hit
    */
   public static AutomorphismSet automorphisms(Molecule molecule) {
      return automorphisms(molecule,
              GraphMatcher.getDefault().defaultBound());
   }

   public static AutomorphismSet automorphisms(Molecule molecule,
                                               SearchBound bound,
                                               int... anchors) {
      int[] pairs = new int[anchors.length * 2];
      for (int i = 0; i < anchors.length; ++i) {
         pairs[2 * i] = anchors[i];
         pairs[2 * i + 1] = anchors[i];
      }

      MatchResult result = GraphMatcher.getDefault().findAutomorphisms(
              molecule, bound, Mapping.ofPairs(pairs)).orThrow();
      return new AutomorphismSet(molecule, result.getMappings());
   }

   public static int symmetryNumber(Molecule molecule) {
      return automorphisms(molecule).size();
   }

   public static int symmetryNumber(Molecule molecule, SearchBound bound) {
      return automorphisms(molecule, bound).size();
   }

   /**
    * Number of automorphisms mapping each anchor atom onto itself.
    */
   public static int symmetryNumber(Molecule molecule, int... anchors) {
      return automorphisms(molecule, GraphMatcher.getDefault().defaultBound(),
              anchors).size();
   }

   /**
    * Automorphism orbits: sorted atom sets, ordered by smallest atom id.
    */
   public static List<IntArrayList> equivalentAtomSets(Molecule molecule) {
      return automorphisms(molecule).orbits();
   }

   public static int numEquivalentAtomSets(Molecule molecule) {
      return equivalentAtomSets(molecule).size();
   }

   /**
    * Embeddings of the group in the molecule, counting once those that only
    * differ by a symmetry of the group (an automorphism preserving labels and
    * tags).
    */
   public static int distinctSiteCount(Group group, Molecule molecule) {
      return distinctSites(group, molecule,
              GraphMatcher.getDefault().defaultBound()).size();
   }

   /**
    * One representative embedding per class, the one whose image sequence
    * (in group atom order) is lexicographically smallest.
    */
   public static Set<Mapping> distinctSites(Group group, Molecule molecule,
                                            SearchBound bound) {
      GraphMatcher matcher = GraphMatcher.getDefault();
      List<Mapping> embeddings = matcher.findSubgraphIsomorphisms(group,
              molecule, new GroupMoleculeMatcher(group, molecule), bound, null)
              .orThrow().getMappings();
      List<Mapping> groupSymmetries = matcher.findAutomorphisms(group,
              new EqualLabelMatcher<>(group, group, true), bound, null)
              .orThrow().getMappings();

      Set<Mapping> representatives = new HashSet<>();
      for (Mapping embedding : embeddings) {
         Mapping best = embedding;
         for (Mapping symmetry : groupSymmetries) {
            Mapping candidate = symmetry.compose(embedding);
            if (compareImages(candidate, best) < 0) {
               best = candidate;
            }
         }
         representatives.add(best);
      }

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("Sites: %d embeddings, %d group symmetries, " +
                         "%d distinct", embeddings.size(),
                 groupSymmetries.size(), representatives.size()));
      }

      return representatives;
   }

   private static int compareImages(Mapping m1, Mapping m2) {
      IntArrayList t1 = m1.targets();
      IntArrayList t2 = m2.targets();
      for (int i = 0; i < t1.size(); ++i) {
         int cmp = Integer.compare(t1.getu(i), t2.getu(i));
         if (cmp != 0) {
            return cmp;
         }
      }
      return 0;
   }
}
