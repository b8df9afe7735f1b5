package br.ufmg.cs.systems.chemgraph.molecule;

import br.ufmg.cs.systems.chemgraph.graph.GraphConstructionException;

import java.util.Objects;

/**
 * Concrete atom label: element, isotope, radical electrons, lone pairs and
 * formal charge. Immutable; edits replace the label on the graph vertex.
 */
public final class Atom {
   /**
    * Isotope value meaning "natural abundance".
    */
   public static final int NATURAL_ISOTOPE = -1;

   private final Element element;
   private final int isotope;
   private final int radicalElectrons;
   private final int lonePairs;
   private final int charge;

   public Atom(Element element, int isotope, int radicalElectrons,
               int lonePairs, int charge) {
      if (element == null) {
         throw new GraphConstructionException("Atom element must not be null");
      }
      if (radicalElectrons < 0 || lonePairs < 0) {
         throw new GraphConstructionException(
                 "Negative electron count on " + element.getSymbol());
      }
      this.element = element;
      this.isotope = isotope;
      this.radicalElectrons = radicalElectrons;
      this.lonePairs = lonePairs;
      this.charge = charge;
   }

   /**
    * Neutral closed-shell atom with the element's default lone pairs.
    */
   public static Atom of(Element element) {
      return new Atom(element, NATURAL_ISOTOPE, 0,
              element.getDefaultLonePairs(), 0);
   }

   public static Atom radical(Element element, int radicalElectrons) {
      return new Atom(element, NATURAL_ISOTOPE, radicalElectrons,
              element.getDefaultLonePairs(), 0);
   }

   public Element getElement() {
      return element;
   }

   public int getIsotope() {
      return isotope;
   }

   public int getRadicalElectrons() {
      return radicalElectrons;
   }

   public int getLonePairs() {
      return lonePairs;
   }

   public int getCharge() {
      return charge;
   }

   public boolean isHydrogen() {
      return element == Element.H;
   }

   public boolean isNonHydrogen() {
      return element != Element.H;
   }

   public Atom withRadicalElectrons(int radicalElectrons) {
      return new Atom(element, isotope, radicalElectrons, lonePairs, charge);
   }

   public Atom withCharge(int charge) {
      return new Atom(element, isotope, radicalElectrons, lonePairs, charge);
   }

   public Atom withLonePairs(int lonePairs) {
      return new Atom(element, isotope, radicalElectrons, lonePairs, charge);
   }

   public Atom withIsotope(int isotope) {
      return new Atom(element, isotope, radicalElectrons, lonePairs, charge);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      Atom atom = (Atom) o;

      if (isotope != atom.isotope) return false;
      if (radicalElectrons != atom.radicalElectrons) return false;
      if (lonePairs != atom.lonePairs) return false;
      if (charge != atom.charge) return false;
      return element == atom.element;
   }

   @Override
   public int hashCode() {
      return Objects.hash(element, isotope, radicalElectrons, lonePairs, charge);
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      if (isotope != NATURAL_ISOTOPE) {
         sb.append(isotope);
      }
      sb.append(element.getSymbol());
      for (int i = 0; i < radicalElectrons; ++i) {
         sb.append('.');
      }
      if (charge > 0) {
         sb.append('+').append(charge);
      } else if (charge < 0) {
         sb.append(charge);
      }
      return sb.toString();
   }
}
