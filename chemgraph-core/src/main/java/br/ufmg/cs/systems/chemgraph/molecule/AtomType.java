package br.ufmg.cs.systems.chemgraph.molecule;

/**
 * Hierarchy of atom types. Each type is a specific case of its parent; the
 * root {@link #R} stands for any atom and {@link #R_NOT_H} for any heavy
 * atom. Leaves are assigned to molecule atoms from their element and bond
 * orders; inner nodes only appear in groups, as wildcards.
 */
public enum AtomType {
   R("R", null, null),
   R_NOT_H("R!H", R, null),

   H("H", R, Element.H),
   HE("He", R_NOT_H, Element.He),
   NE("Ne", R_NOT_H, Element.Ne),
   AR("Ar", R_NOT_H, Element.Ar),

   C("C", R_NOT_H, Element.C),
   CS("Cs", C, Element.C),
   CD("Cd", C, Element.C),
   CDD("Cdd", C, Element.C),
   CT("Ct", C, Element.C),
   CB("Cb", C, Element.C),
   CBF("Cbf", C, Element.C),

   N("N", R_NOT_H, Element.N),
   NS("Ns", N, Element.N),
   ND("Nd", N, Element.N),
   NT("Nt", N, Element.N),
   NB("Nb", N, Element.N),

   O("O", R_NOT_H, Element.O),
   OS("Os", O, Element.O),
   OD("Od", O, Element.O),

   SI("Si", R_NOT_H, Element.Si),
   SIS("Sis", SI, Element.Si),
   SID("Sid", SI, Element.Si),

   P("P", R_NOT_H, Element.P),

   S("S", R_NOT_H, Element.S),
   SS("Ss", S, Element.S),
   SD("Sd", S, Element.S),

   F("F", R_NOT_H, Element.F),
   CL("Cl", R_NOT_H, Element.Cl),
   BR("Br", R_NOT_H, Element.Br),
   I("I", R_NOT_H, Element.I);

   private final String label;
   private final AtomType parent;
   private final Element element;

   AtomType(String label, AtomType parent, Element element) {
      this.label = label;
      this.parent = parent;
      this.element = element;
   }

   public String getLabel() {
      return label;
   }

   public AtomType getParent() {
      return parent;
   }

   /**
    * @return the element every atom of this type has, or null for wildcards
    */
   public Element getElement() {
      return element;
   }

   /**
    * True if this type equals {@code other} or lies below it in the hierarchy.
    */
   public boolean isSpecificCaseOf(AtomType other) {
      for (AtomType t = this; t != null; t = t.parent) {
         if (t == other) {
            return true;
         }
      }
      return false;
   }

   public boolean isGeneralCaseOf(AtomType other) {
      return other.isSpecificCaseOf(this);
   }

   /**
    * The least specific type carrying the given element.
    */
   public static AtomType ofElement(Element element) {
      switch (element) {
         case H:
            return H;
         case He:
            return HE;
         case C:
            return C;
         case N:
            return N;
         case O:
            return O;
         case F:
            return F;
         case Ne:
            return NE;
         case Si:
            return SI;
         case P:
            return P;
         case S:
            return S;
         case Cl:
            return CL;
         case Ar:
            return AR;
         case Br:
            return BR;
         case I:
            return I;
         default:
            throw new IllegalArgumentException("No atom type for " + element);
      }
   }

   public static AtomType fromLabel(String label) {
      for (AtomType type : values()) {
         if (type.label.equals(label)) {
            return type;
         }
      }
      throw new IllegalArgumentException("Unknown atom type " + label);
   }

   /**
    * Most specific type of an atom with the given element and counts of
    * incident double, triple and aromatic bonds.
    *
    * @throws AtomTypeException when the combination is not a known type
    */
   public static AtomType assign(Element element, int doubleBonds,
                                 int tripleBonds, int aromaticBonds) {
      int multiple = doubleBonds + tripleBonds + aromaticBonds;

      switch (element) {
         case C:
            if (multiple == 0) {
               return CS;
            } else if (doubleBonds == 1 && tripleBonds + aromaticBonds == 0) {
               return CD;
            } else if (doubleBonds == 2 && tripleBonds + aromaticBonds == 0) {
               return CDD;
            } else if (tripleBonds == 1 && doubleBonds + aromaticBonds == 0) {
               return CT;
            } else if (doubleBonds + tripleBonds == 0 && aromaticBonds <= 2) {
               return CB;
            } else if (doubleBonds + tripleBonds == 0 && aromaticBonds == 3) {
               return CBF;
            }
            break;
         case N:
            if (multiple == 0) {
               return NS;
            } else if (doubleBonds == 1 && tripleBonds + aromaticBonds == 0) {
               return ND;
            } else if (tripleBonds == 1 && doubleBonds + aromaticBonds == 0) {
               return NT;
            } else if (doubleBonds + tripleBonds == 0 && aromaticBonds <= 3) {
               return NB;
            }
            break;
         case O:
            if (multiple == 0) {
               return OS;
            } else if (doubleBonds == 1 && multiple == 1) {
               return OD;
            }
            break;
         case Si:
            if (multiple == 0) {
               return SIS;
            } else if (doubleBonds == 1 && multiple == 1) {
               return SID;
            }
            break;
         case S:
            if (multiple == 0) {
               return SS;
            } else if (doubleBonds == 1 && multiple == 1) {
               return SD;
            }
            break;
         default:
            if (multiple == 0 || element == Element.P) {
               return ofElement(element);
            }
      }

      throw new AtomTypeException(String.format(
              "No atom type for %s with %d double, %d triple, %d aromatic bonds",
              element.getSymbol(), doubleBonds, tripleBonds, aromaticBonds));
   }

   @Override
   public String toString() {
      return label;
   }
}
