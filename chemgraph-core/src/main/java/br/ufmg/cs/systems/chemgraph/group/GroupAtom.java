package br.ufmg.cs.systems.chemgraph.group;

import br.ufmg.cs.systems.chemgraph.graph.GraphConstructionException;
import br.ufmg.cs.systems.chemgraph.molecule.Atom;
import br.ufmg.cs.systems.chemgraph.molecule.AtomType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Wildcard atom label: a non-empty set of acceptable atom types plus optional
 * sets of acceptable radical counts, charges, lone-pair counts and isotopes.
 * An empty attribute set leaves that attribute unconstrained.
 */
public final class GroupAtom {
   private static final int[] ANY = new int[0];

   private final EnumSet<AtomType> atomTypes;
   // sorted, distinct
   private final int[] radicalElectrons;
   private final int[] charges;
   private final int[] lonePairs;
   private final int[] isotopes;

   private GroupAtom(EnumSet<AtomType> atomTypes, int[] radicalElectrons,
                     int[] charges, int[] lonePairs, int[] isotopes) {
      if (atomTypes.isEmpty()) {
         throw new GraphConstructionException(
                 "Group atom needs at least one atom type");
      }
      this.atomTypes = atomTypes;
      this.radicalElectrons = radicalElectrons;
      this.charges = charges;
      this.lonePairs = lonePairs;
      this.isotopes = isotopes;
   }

   public static GroupAtom of(AtomType first, AtomType... rest) {
      return new GroupAtom(EnumSet.of(first, rest), ANY, ANY, ANY, ANY);
   }

   public static GroupAtom of(Set<AtomType> atomTypes) {
      if (atomTypes.isEmpty()) {
         throw new GraphConstructionException(
                 "Group atom needs at least one atom type");
      }
      return new GroupAtom(EnumSet.copyOf(atomTypes), ANY, ANY, ANY, ANY);
   }

   public GroupAtom withRadicalElectrons(int... values) {
      return new GroupAtom(atomTypes, normalize(values), charges, lonePairs,
              isotopes);
   }

   public GroupAtom withCharges(int... values) {
      return new GroupAtom(atomTypes, radicalElectrons, normalize(values),
              lonePairs, isotopes);
   }

   public GroupAtom withLonePairs(int... values) {
      return new GroupAtom(atomTypes, radicalElectrons, charges,
              normalize(values), isotopes);
   }

   public GroupAtom withIsotopes(int... values) {
      return new GroupAtom(atomTypes, radicalElectrons, charges, lonePairs,
              normalize(values));
   }

   private static int[] normalize(int[] values) {
      return Arrays.stream(values).distinct().sorted().toArray();
   }

   public Set<AtomType> getAtomTypes() {
      return Collections.unmodifiableSet(atomTypes);
   }

   public int[] getRadicalElectrons() {
      return radicalElectrons.clone();
   }

   public int[] getCharges() {
      return charges.clone();
   }

   public int[] getLonePairs() {
      return lonePairs.clone();
   }

   public int[] getIsotopes() {
      return isotopes.clone();
   }

   /**
    * @param atomType the concrete type of {@code atom} in its molecule
    */
   public boolean matches(Atom atom, AtomType atomType) {
      boolean typeMatches = false;
      for (AtomType acceptable : atomTypes) {
         if (atomType.isSpecificCaseOf(acceptable)) {
            typeMatches = true;
            break;
         }
      }

      return typeMatches &&
              accepts(radicalElectrons, atom.getRadicalElectrons()) &&
              accepts(charges, atom.getCharge()) &&
              accepts(lonePairs, atom.getLonePairs()) &&
              accepts(isotopes, atom.getIsotope());
   }

   private static boolean accepts(int[] values, int value) {
      return values.length == 0 || Arrays.binarySearch(values, value) >= 0;
   }

   /**
    * True if every atom this one accepts is also accepted by {@code other}.
    */
   public boolean isSpecificCaseOf(GroupAtom other) {
      for (AtomType mine : atomTypes) {
         boolean covered = false;
         for (AtomType theirs : other.atomTypes) {
            if (mine.isSpecificCaseOf(theirs)) {
               covered = true;
               break;
            }
         }
         if (!covered) {
            return false;
         }
      }

      return narrower(radicalElectrons, other.radicalElectrons) &&
              narrower(charges, other.charges) &&
              narrower(lonePairs, other.lonePairs) &&
              narrower(isotopes, other.isotopes);
   }

   private static boolean narrower(int[] mine, int[] theirs) {
      if (theirs.length == 0) {
         return true;
      }
      if (mine.length == 0) {
         return false;
      }
      for (int value : mine) {
         if (Arrays.binarySearch(theirs, value) < 0) {
            return false;
         }
      }
      return true;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      GroupAtom groupAtom = (GroupAtom) o;

      if (!atomTypes.equals(groupAtom.atomTypes)) return false;
      if (!Arrays.equals(radicalElectrons, groupAtom.radicalElectrons)) return false;
      if (!Arrays.equals(charges, groupAtom.charges)) return false;
      if (!Arrays.equals(lonePairs, groupAtom.lonePairs)) return false;
      return Arrays.equals(isotopes, groupAtom.isotopes);
   }

   @Override
   public int hashCode() {
      int result = 0;
      for (AtomType type : atomTypes) {
         result = 31 * result + type.ordinal();
      }
      result = 31 * result + Arrays.hashCode(radicalElectrons);
      result = 31 * result + Arrays.hashCode(charges);
      result = 31 * result + Arrays.hashCode(lonePairs);
      result = 31 * result + Arrays.hashCode(isotopes);
      return result;
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder(atomTypes.toString());
      if (radicalElectrons.length > 0) {
         sb.append(" u").append(Arrays.toString(radicalElectrons));
      }
      if (charges.length > 0) {
         sb.append(" c").append(Arrays.toString(charges));
      }
      if (lonePairs.length > 0) {
         sb.append(" p").append(Arrays.toString(lonePairs));
      }
      if (isotopes.length > 0) {
         sb.append(" i").append(Arrays.toString(isotopes));
      }
      return sb.toString();
   }
}
