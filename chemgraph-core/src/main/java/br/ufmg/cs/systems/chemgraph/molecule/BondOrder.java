package br.ufmg.cs.systems.chemgraph.molecule;

/**
 * Concrete order of a molecule bond.
 */
public enum BondOrder {
   SINGLE(1.0, "S"),
   DOUBLE(2.0, "D"),
   TRIPLE(3.0, "T"),
   AROMATIC(1.5, "B");

   private final double value;
   private final String code;

   BondOrder(double value, String code) {
      this.value = value;
      this.code = code;
   }

   public double getValue() {
      return value;
   }

   public String getCode() {
      return code;
   }

   /**
    * Order after adding {@code delta} to a non-aromatic order, or null when the
    * result leaves SINGLE..TRIPLE.
    */
   public BondOrder increment(int delta) {
      if (this == AROMATIC) {
         return null;
      }

      int next = (int) value + delta;
      switch (next) {
         case 1:
            return SINGLE;
         case 2:
            return DOUBLE;
         case 3:
            return TRIPLE;
         default:
            return null;
      }
   }
}
