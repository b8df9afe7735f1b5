package br.ufmg.cs.systems.chemgraph.molecule;

/**
 * Chemical elements the atom-type hierarchy knows about.
 */
public enum Element {
   H(1, "H", 1.00794, 0),
   He(2, "He", 4.002602, 1),
   C(6, "C", 12.0107, 0),
   N(7, "N", 14.0067, 1),
   O(8, "O", 15.9994, 2),
   F(9, "F", 18.9984032, 3),
   Ne(10, "Ne", 20.1797, 4),
   Si(14, "Si", 28.0855, 0),
   P(15, "P", 30.973762, 1),
   S(16, "S", 32.065, 2),
   Cl(17, "Cl", 35.453, 3),
   Ar(18, "Ar", 39.948, 4),
   Br(35, "Br", 79.904, 3),
   I(53, "I", 126.90447, 3);

   private final int number;
   private final String symbol;
   private final double mass;
   private final int defaultLonePairs;

   Element(int number, String symbol, double mass, int defaultLonePairs) {
      this.number = number;
      this.symbol = symbol;
      this.mass = mass;
      this.defaultLonePairs = defaultLonePairs;
   }

   public int getNumber() {
      return number;
   }

   public String getSymbol() {
      return symbol;
   }

   /**
    * Standard atomic weight in g/mol.
    */
   public double getMass() {
      return mass;
   }

   /**
    * Lone pairs of the neutral, closed-shell atom in its usual valence.
    */
   public int getDefaultLonePairs() {
      return defaultLonePairs;
   }

   public static Element fromSymbol(String symbol) {
      for (Element element : values()) {
         if (element.symbol.equalsIgnoreCase(symbol)) {
            return element;
         }
      }
      throw new IllegalArgumentException("Unknown element " + symbol);
   }
}
