package br.ufmg.cs.systems.chemgraph.molecule;

import br.ufmg.cs.systems.chemgraph.graph.GraphConstructionException;
import br.ufmg.cs.systems.chemgraph.graph.LabeledGraph;
import br.ufmg.cs.systems.chemgraph.group.Group;
import br.ufmg.cs.systems.chemgraph.group.GroupMoleculeMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.GraphMatcher;
import br.ufmg.cs.systems.chemgraph.isomorphism.MatchResult;
import br.ufmg.cs.systems.chemgraph.isomorphism.Mapping;
import br.ufmg.cs.systems.chemgraph.isomorphism.SearchBound;
import br.ufmg.cs.systems.chemgraph.symmetry.SymmetryCounter;
import br.ufmg.cs.systems.chemgraph.util.collection.IntArrayList;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Concrete chemical species: atoms as vertices, bond orders as edges. May be
 * disconnected, for instance to hold a pair of reacting species.
 */
public class Molecule extends LabeledGraph<Atom, BondOrder> {
   private static final Logger LOG = Logger.getLogger(Molecule.class);

   public Molecule() {
   }

   @Override
   protected LabeledGraph<Atom, BondOrder> newEmptyGraph() {
      return new Molecule();
   }

   @Override
   public Molecule copy() {
      return (Molecule) super.copy();
   }

   @Override
   public Molecule copy(IntIntMap oldToNew) {
      return (Molecule) super.copy(oldToNew);
   }

   public int addAtom(Atom atom) {
      return addVertex(atom);
   }

   public int addAtom(Atom atom, String tag) {
      int atomId = addVertex(atom);
      setTag(atomId, tag);
      return atomId;
   }

   public int addBond(int atom1, int atom2, BondOrder order) {
      return addEdge(atom1, atom2, order);
   }

   public Atom getAtom(int atomId) {
      return vertexLabel(atomId);
   }

   /**
    * @return the order of the bond between both atoms, or null if unbonded
    */
   public BondOrder getBond(int atom1, int atom2) {
      int edgeId = getEdge(atom1, atom2);
      return edgeId < 0 ? null : edgeLabel(edgeId);
   }

   public int getNumAtoms() {
      return numVertices();
   }

   /**
    * Atom types indexed by atom id, computed on every call; entries of
    * removed atoms are null.
    *
    * @throws AtomTypeException if some atom has no type
    */
   public AtomType[] atomTypes() {
      AtomType[] types = new AtomType[vertexIdBound()];
      IntArrayList atoms = vertices();
      for (int i = 0; i < atoms.size(); ++i) {
         int atomId = atoms.getu(i);
         types[atomId] = atomType(atomId);
      }
      return types;
   }

   public AtomType atomType(int atomId) {
      Atom atom = getAtom(atomId);
      int[] counts = new int[BondOrder.values().length];
      neighbourhood(atomId).forEachNeighbour(
              (v, e) -> ++counts[edgeLabel(e).ordinal()]);

      try {
         return AtomType.assign(atom.getElement(),
                 counts[BondOrder.DOUBLE.ordinal()],
                 counts[BondOrder.TRIPLE.ordinal()],
                 counts[BondOrder.AROMATIC.ordinal()]);
      } catch (AtomTypeException e) {
         throw new AtomTypeException("Atom " + atomId + ": " + e.getMessage());
      }
   }

   /**
    * Molecular formula in Hill order: carbon, then hydrogen, then the other
    * elements alphabetically; without carbon, everything alphabetically.
    */
   public String getFormula() {
      Map<Element, Integer> counts = new EnumMap<>(Element.class);
      IntArrayList atoms = vertices();
      for (int i = 0; i < atoms.size(); ++i) {
         counts.merge(getAtom(atoms.getu(i)).getElement(), 1, Integer::sum);
      }

      List<Element> elements = new ArrayList<>(counts.keySet());
      boolean hasCarbon = counts.containsKey(Element.C);
      elements.sort((e1, e2) -> {
         if (hasCarbon) {
            int r1 = hillRank(e1);
            int r2 = hillRank(e2);
            if (r1 != r2) {
               return Integer.compare(r1, r2);
            }
         }
         return e1.getSymbol().compareTo(e2.getSymbol());
      });

      StringBuilder sb = new StringBuilder();
      for (Element element : elements) {
         sb.append(element.getSymbol());
         int count = counts.get(element);
         if (count > 1) {
            sb.append(count);
         }
      }
      return sb.toString();
   }

   private static int hillRank(Element element) {
      switch (element) {
         case C:
            return 0;
         case H:
            return 1;
         default:
            return 2;
      }
   }

   /**
    * Sum of standard atomic weights, in g/mol.
    */
   public double getMolecularWeight() {
      double weight = 0;
      IntArrayList atoms = vertices();
      for (int i = 0; i < atoms.size(); ++i) {
         weight += getAtom(atoms.getu(i)).getElement().getMass();
      }
      return weight;
   }

   public int getRadicalCount() {
      int radicals = 0;
      IntArrayList atoms = vertices();
      for (int i = 0; i < atoms.size(); ++i) {
         radicals += getAtom(atoms.getu(i)).getRadicalElectrons();
      }
      return radicals;
   }

   public boolean isRadical() {
      return getRadicalCount() > 0;
   }

   /**
    * One molecule per connected component, ordered by smallest atom id, with
    * atoms renumbered from zero and tags kept.
    */
   public List<Molecule> split() {
      List<Molecule> molecules = new ArrayList<>();

      for (IntArrayList component : connectedComponents()) {
         Molecule part = new Molecule();
         IntIntMap oldToNew = HashIntIntMaps.newMutableMap(component.size());

         for (int i = 0; i < component.size(); ++i) {
            int atomId = component.getu(i);
            oldToNew.put(atomId, part.addAtom(getAtom(atomId), getTag(atomId)));
         }

         IntArrayList bonds = edges();
         for (int i = 0; i < bonds.size(); ++i) {
            int e = bonds.getu(i);
            int src = edgeSrc(e);
            if (oldToNew.containsKey(src)) {
               part.addBond(oldToNew.get(src), oldToNew.get(edgeDst(e)),
                       edgeLabel(e));
            }
         }

         molecules.add(part);
      }

      return molecules;
   }

   /**
    * New molecule holding this one's atoms (renumbered first) followed by
    * {@code other}'s.
    */
   public Molecule merge(Molecule other) {
      Molecule merged = copy();
      IntIntMap oldToNew = HashIntIntMaps.newMutableMap(other.numVertices());

      IntArrayList atoms = other.vertices();
      for (int i = 0; i < atoms.size(); ++i) {
         int atomId = atoms.getu(i);
         oldToNew.put(atomId, merged.addAtom(other.getAtom(atomId),
                 other.getTag(atomId)));
      }

      IntArrayList bonds = other.edges();
      for (int i = 0; i < bonds.size(); ++i) {
         int e = bonds.getu(i);
         merged.addBond(oldToNew.get(other.edgeSrc(e)),
                 oldToNew.get(other.edgeDst(e)), other.edgeLabel(e));
      }

      return merged;
   }

   /**
    * Applies one reaction recipe step in place.
    *
    * @throws GraphConstructionException if the action does not apply
    */
   public void applyAction(ReactionAction action) {
      int atom1 = action.getAtom1();
      int atom2 = action.getAtom2();
      Atom atom = getAtom(atom1);

      if (atom2 < 0 && action.getAmount() <= 0) {
         throw new GraphConstructionException(
                 "Radical change must be positive in " + action);
      }

      switch (action.getType()) {
         case CHANGE_BOND: {
            int edgeId = requireBond(atom1, atom2, action);
            BondOrder order = edgeLabel(edgeId).increment(action.getAmount());
            if (order == null) {
               throw new GraphConstructionException(
                       "Bond order out of range for " + action);
            }
            setEdgeLabel(edgeId, order);
            break;
         }
         case FORM_BOND:
            if (hasEdge(atom1, atom2)) {
               throw new GraphConstructionException(
                       "Bond already exists for " + action);
            }
            addBond(atom1, atom2, BondOrder.SINGLE);
            break;
         case BREAK_BOND:
            removeEdge(requireBond(atom1, atom2, action));
            break;
         case GAIN_RADICAL:
            setVertexLabel(atom1, atom.withRadicalElectrons(
                    atom.getRadicalElectrons() + action.getAmount()));
            break;
         case LOSE_RADICAL: {
            int radicals = atom.getRadicalElectrons() - action.getAmount();
            if (radicals < 0) {
               throw new GraphConstructionException(
                       "Negative radical count for " + action);
            }
            setVertexLabel(atom1, atom.withRadicalElectrons(radicals));
            break;
         }
         default:
            throw new IllegalArgumentException("Unknown action " + action);
      }

      if (LOG.isDebugEnabled()) {
         LOG.debug("Applied " + action + " stamp=" + getModificationStamp());
      }
   }

   private int requireBond(int atom1, int atom2, ReactionAction action) {
      int edgeId = getEdge(atom1, atom2);
      if (edgeId < 0) {
         throw new GraphConstructionException("No bond for " + action);
      }
      return edgeId;
   }

   // Matching

   public boolean isIsomorphic(Molecule other) {
      return GraphMatcher.getDefault().isIsomorphic(this, other);
   }

   public MatchResult findIsomorphism(Molecule other) {
      return GraphMatcher.getDefault().findIsomorphism(this, other);
   }

   public MatchResult findIsomorphism(Molecule other, SearchBound bound) {
      return GraphMatcher.getDefault().findIsomorphism(this, other, bound);
   }

   public boolean isSubgraphIsomorphic(Group group) {
      return GraphMatcher.getDefault().isSubgraphIsomorphic(group, this,
              new GroupMoleculeMatcher(group, this));
   }

   /**
    * Every embedding of the group, as group atom id to molecule atom id.
    */
   public MatchResult findSubgraphIsomorphisms(Group group) {
      return findSubgraphIsomorphisms(group, null);
   }

   /**
    * @param initialMap group atoms pinned to molecule atoms, or null
    */
   public MatchResult findSubgraphIsomorphisms(Group group, Mapping initialMap) {
      GraphMatcher matcher = GraphMatcher.getDefault();
      return matcher.findSubgraphIsomorphisms(group, this,
              new GroupMoleculeMatcher(group, this), matcher.defaultBound(),
              initialMap);
   }

   public int getSymmetryNumber() {
      return SymmetryCounter.symmetryNumber(this);
   }
}
