package br.ufmg.cs.systems.chemgraph.group;

import br.ufmg.cs.systems.chemgraph.graph.GraphConstructionException;
import br.ufmg.cs.systems.chemgraph.molecule.BondOrder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Wildcard bond label: a non-empty set of acceptable bond orders, or the
 * "any bond" wildcard, which accepts every order.
 */
public final class GroupBond {
   private static final GroupBond ANY_BOND =
           new GroupBond(EnumSet.allOf(BondOrder.class), true);

   private final EnumSet<BondOrder> orders;
   private final boolean anyBond;

   private GroupBond(EnumSet<BondOrder> orders, boolean anyBond) {
      this.orders = orders;
      this.anyBond = anyBond;
   }

   public static GroupBond of(BondOrder first, BondOrder... rest) {
      return new GroupBond(EnumSet.of(first, rest), false);
   }

   public static GroupBond of(Set<BondOrder> orders) {
      if (orders.isEmpty()) {
         throw new GraphConstructionException(
                 "Group bond needs at least one bond order");
      }
      return new GroupBond(EnumSet.copyOf(orders), false);
   }

   public static GroupBond anyBond() {
      return ANY_BOND;
   }

   public boolean isAnyBond() {
      return anyBond;
   }

   public Set<BondOrder> getOrders() {
      return Collections.unmodifiableSet(orders);
   }

   public boolean matches(BondOrder order) {
      return anyBond || orders.contains(order);
   }

   /**
    * True if every order this bond accepts is also accepted by {@code other}.
    */
   public boolean isSpecificCaseOf(GroupBond other) {
      return other.anyBond || other.orders.containsAll(orders);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      GroupBond groupBond = (GroupBond) o;

      if (anyBond != groupBond.anyBond) return false;
      return orders.equals(groupBond.orders);
   }

   @Override
   public int hashCode() {
      int result = anyBond ? 1 : 0;
      for (BondOrder order : orders) {
         result = 31 * result + order.ordinal();
      }
      return result;
   }

   @Override
   public String toString() {
      if (anyBond) {
         return "*";
      }

      StringBuilder sb = new StringBuilder("{");
      for (BondOrder order : orders) {
         if (sb.length() > 1) sb.append(",");
         sb.append(order.getCode());
      }
      return sb.append('}').toString();
   }
}
