package br.ufmg.cs.systems.chemgraph.molecule;

import static br.ufmg.cs.systems.chemgraph.molecule.BondOrder.AROMATIC;
import static br.ufmg.cs.systems.chemgraph.molecule.BondOrder.DOUBLE;
import static br.ufmg.cs.systems.chemgraph.molecule.BondOrder.SINGLE;

/**
 * Small molecules shared by the tests. Skeletons leave hydrogens out.
 */
public final class TestMolecules {
   private TestMolecules() {
   }

   private static void addHydrogens(Molecule molecule, int atom, int count) {
      for (int i = 0; i < count; ++i) {
         molecule.addBond(atom, molecule.addAtom(Atom.of(Element.H)), SINGLE);
      }
   }

   public static Molecule methane() {
      Molecule molecule = new Molecule();
      int c = molecule.addAtom(Atom.of(Element.C));
      addHydrogens(molecule, c, 4);
      return molecule;
   }

   public static Molecule ethane() {
      Molecule molecule = new Molecule();
      int c1 = molecule.addAtom(Atom.of(Element.C));
      int c2 = molecule.addAtom(Atom.of(Element.C));
      molecule.addBond(c1, c2, SINGLE);
      addHydrogens(molecule, c1, 3);
      addHydrogens(molecule, c2, 3);
      return molecule;
   }

   /**
    * C=C without hydrogens.
    */
   public static Molecule etheneSkeleton() {
      Molecule molecule = new Molecule();
      int c1 = molecule.addAtom(Atom.of(Element.C));
      int c2 = molecule.addAtom(Atom.of(Element.C));
      molecule.addBond(c1, c2, DOUBLE);
      return molecule;
   }

   public static Molecule carbonChain(int length) {
      Molecule molecule = new Molecule();
      int previous = -1;
      for (int i = 0; i < length; ++i) {
         int c = molecule.addAtom(Atom.of(Element.C));
         if (previous >= 0) {
            molecule.addBond(previous, c, SINGLE);
         }
         previous = c;
      }
      return molecule;
   }

   public static Molecule formaldehyde() {
      Molecule molecule = new Molecule();
      int c = molecule.addAtom(Atom.of(Element.C));
      int o = molecule.addAtom(Atom.of(Element.O));
      molecule.addBond(c, o, DOUBLE);
      addHydrogens(molecule, c, 2);
      return molecule;
   }

   public static Molecule methanol() {
      Molecule molecule = new Molecule();
      int c = molecule.addAtom(Atom.of(Element.C));
      int o = molecule.addAtom(Atom.of(Element.O));
      molecule.addBond(c, o, SINGLE);
      addHydrogens(molecule, c, 3);
      addHydrogens(molecule, o, 1);
      return molecule;
   }

   /**
    * Methanol built in a different atom and bond order.
    */
   public static Molecule methanolReordered() {
      Molecule molecule = new Molecule();
      int h1 = molecule.addAtom(Atom.of(Element.H));
      int o = molecule.addAtom(Atom.of(Element.O));
      int h2 = molecule.addAtom(Atom.of(Element.H));
      int h3 = molecule.addAtom(Atom.of(Element.H));
      int c = molecule.addAtom(Atom.of(Element.C));
      int h4 = molecule.addAtom(Atom.of(Element.H));
      molecule.addBond(h2, c, SINGLE);
      molecule.addBond(o, h1, SINGLE);
      molecule.addBond(c, h4, SINGLE);
      molecule.addBond(o, c, SINGLE);
      molecule.addBond(c, h3, SINGLE);
      return molecule;
   }

   public static Molecule ethanol() {
      Molecule molecule = new Molecule();
      int c1 = molecule.addAtom(Atom.of(Element.C));
      int c2 = molecule.addAtom(Atom.of(Element.C));
      int o = molecule.addAtom(Atom.of(Element.O));
      molecule.addBond(c1, c2, SINGLE);
      molecule.addBond(c2, o, SINGLE);
      addHydrogens(molecule, c1, 3);
      addHydrogens(molecule, c2, 2);
      addHydrogens(molecule, o, 1);
      return molecule;
   }

   public static Molecule dimethylEther() {
      Molecule molecule = new Molecule();
      int c1 = molecule.addAtom(Atom.of(Element.C));
      int o = molecule.addAtom(Atom.of(Element.O));
      int c2 = molecule.addAtom(Atom.of(Element.C));
      molecule.addBond(c1, o, SINGLE);
      molecule.addBond(o, c2, SINGLE);
      addHydrogens(molecule, c1, 3);
      addHydrogens(molecule, c2, 3);
      return molecule;
   }

   public static Molecule water() {
      Molecule molecule = new Molecule();
      int o = molecule.addAtom(Atom.of(Element.O));
      addHydrogens(molecule, o, 2);
      return molecule;
   }

   public static Molecule ammonia() {
      Molecule molecule = new Molecule();
      int n = molecule.addAtom(Atom.of(Element.N));
      addHydrogens(molecule, n, 3);
      return molecule;
   }

   /**
    * Six-carbon ring, either all aromatic or alternating single/double.
    */
   public static Molecule benzeneSkeleton(boolean aromatic) {
      Molecule molecule = new Molecule();
      for (int i = 0; i < 6; ++i) {
         molecule.addAtom(Atom.of(Element.C));
      }
      for (int i = 0; i < 6; ++i) {
         BondOrder order = aromatic ? AROMATIC : (i % 2 == 0 ? SINGLE : DOUBLE);
         molecule.addBond(i, (i + 1) % 6, order);
      }
      return molecule;
   }

   /**
    * Single-bonded carbon ring.
    */
   public static Molecule ring(int size) {
      Molecule molecule = new Molecule();
      for (int i = 0; i < size; ++i) {
         molecule.addAtom(Atom.of(Element.C));
      }
      for (int i = 0; i < size; ++i) {
         molecule.addBond(i, (i + 1) % size, SINGLE);
      }
      return molecule;
   }

   /**
    * Two disjoint single-bonded carbon rings of the same size.
    */
   public static Molecule twoRings(int size) {
      return ring(size).merge(ring(size));
   }

   /**
    * Two fused six-rings sharing the bond 4-9.
    */
   public static Molecule naphthaleneSkeleton() {
      Molecule molecule = new Molecule();
      for (int i = 0; i < 10; ++i) {
         molecule.addAtom(Atom.of(Element.C));
      }
      int[][] bonds = {
              {0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 9}, {9, 0},
              {4, 5}, {5, 6}, {6, 7}, {7, 8}, {8, 9}
      };
      for (int[] bond : bonds) {
         molecule.addBond(bond[0], bond[1], SINGLE);
      }
      return molecule;
   }

   public static Molecule cubaneSkeleton() {
      Molecule molecule = new Molecule();
      for (int i = 0; i < 8; ++i) {
         molecule.addAtom(Atom.of(Element.C));
      }
      for (int i = 0; i < 4; ++i) {
         molecule.addBond(i, (i + 1) % 4, SINGLE);
         molecule.addBond(4 + i, 4 + (i + 1) % 4, SINGLE);
         molecule.addBond(i, 4 + i, SINGLE);
      }
      return molecule;
   }

   /**
    * Four carbons, all pairwise bonded.
    */
   public static Molecule tetrahedraneSkeleton() {
      Molecule molecule = new Molecule();
      for (int i = 0; i < 4; ++i) {
         molecule.addAtom(Atom.of(Element.C));
      }
      for (int i = 0; i < 4; ++i) {
         for (int j = i + 1; j < 4; ++j) {
            molecule.addBond(i, j, SINGLE);
         }
      }
      return molecule;
   }
}
