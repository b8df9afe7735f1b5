package br.ufmg.cs.systems.chemgraph.registry;

import br.ufmg.cs.systems.chemgraph.isomorphism.VertexInvariants;
import br.ufmg.cs.systems.chemgraph.molecule.Atom;
import br.ufmg.cs.systems.chemgraph.molecule.Molecule;

import java.util.Arrays;

/**
 * Isomorphism-invariant key of a molecule: formula, atom and bond counts and
 * the sorted refined vertex invariants. Isomorphic molecules always share a
 * fingerprint; the converse needs an exact isomorphism check.
 */
public final class MoleculeFingerprint {
   private final String formula;
   private final int numAtoms;
   private final int numBonds;
   private final long[] invariants;
   private final int hash;

   private MoleculeFingerprint(String formula, int numAtoms, int numBonds,
                               long[] invariants) {
      this.formula = formula;
      this.numAtoms = numAtoms;
      this.numBonds = numBonds;
      this.invariants = invariants;

      int result = formula.hashCode();
      result = 31 * result + numAtoms;
      result = 31 * result + numBonds;
      result = 31 * result + Arrays.hashCode(invariants);
      this.hash = result;
   }

   public static MoleculeFingerprint of(Molecule molecule, int rounds) {
      VertexInvariants invariants = VertexInvariants.compute(molecule,
              v -> atomHash(molecule.getAtom(v)),
              e -> molecule.edgeLabel(e).ordinal() + 1, rounds);

      return new MoleculeFingerprint(molecule.getFormula(),
              molecule.numVertices(), molecule.numEdges(),
              invariants.sortedCodes(molecule.vertices()));
   }

   private static int atomHash(Atom atom) {
      int result = atom.getElement().getNumber();
      result = 31 * result + atom.getIsotope();
      result = 31 * result + atom.getRadicalElectrons();
      result = 31 * result + atom.getLonePairs();
      result = 31 * result + atom.getCharge();
      return result;
   }

   public String getFormula() {
      return formula;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      MoleculeFingerprint that = (MoleculeFingerprint) o;

      if (hash != that.hash) return false;
      if (numAtoms != that.numAtoms) return false;
      if (numBonds != that.numBonds) return false;
      if (!formula.equals(that.formula)) return false;
      return Arrays.equals(invariants, that.invariants);
   }

   @Override
   public int hashCode() {
      return hash;
   }

   @Override
   public String toString() {
      return "MoleculeFingerprint{" +
              "formula=" + formula +
              ",atoms=" + numAtoms +
              ",bonds=" + numBonds +
              ",hash=" + Integer.toHexString(hash) +
              '}';
   }
}
