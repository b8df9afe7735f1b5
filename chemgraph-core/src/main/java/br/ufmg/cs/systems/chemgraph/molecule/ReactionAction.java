package br.ufmg.cs.systems.chemgraph.molecule;

/**
 * One step of a reaction recipe, applied to concrete atoms of a molecule by
 * {@link Molecule#applyAction(ReactionAction)}.
 */
public final class ReactionAction {
   public enum Type {
      CHANGE_BOND,
      FORM_BOND,
      BREAK_BOND,
      GAIN_RADICAL,
      LOSE_RADICAL
   }

   private final Type type;
   private final int atom1;
   private final int atom2;
   private final int amount;

   private ReactionAction(Type type, int atom1, int atom2, int amount) {
      this.type = type;
      this.atom1 = atom1;
      this.atom2 = atom2;
      this.amount = amount;
   }

   /**
    * Changes the order of an existing bond by {@code delta} (for example +1
    * turns a single bond into a double one).
    */
   public static ReactionAction changeBond(int atom1, int atom2, int delta) {
      return new ReactionAction(Type.CHANGE_BOND, atom1, atom2, delta);
   }

   public static ReactionAction formBond(int atom1, int atom2) {
      return new ReactionAction(Type.FORM_BOND, atom1, atom2, 1);
   }

   public static ReactionAction breakBond(int atom1, int atom2) {
      return new ReactionAction(Type.BREAK_BOND, atom1, atom2, 1);
   }

   public static ReactionAction gainRadical(int atom, int electrons) {
      return new ReactionAction(Type.GAIN_RADICAL, atom, -1, electrons);
   }

   public static ReactionAction loseRadical(int atom, int electrons) {
      return new ReactionAction(Type.LOSE_RADICAL, atom, -1, electrons);
   }

   public Type getType() {
      return type;
   }

   public int getAtom1() {
      return atom1;
   }

   /**
    * @return second atom, or -1 for radical actions
    */
   public int getAtom2() {
      return atom2;
   }

   public int getAmount() {
      return amount;
   }

   @Override
   public String toString() {
      if (atom2 < 0) {
         return type + "(" + atom1 + "," + amount + ")";
      }
      return type + "(" + atom1 + "," + atom2 + "," + amount + ")";
   }
}
