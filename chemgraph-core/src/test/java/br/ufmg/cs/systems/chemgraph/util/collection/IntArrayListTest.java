package br.ufmg.cs.systems.chemgraph.util.collection;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntArrayListTest {

   @Test
   void testGrowsPastInitialCapacity() {
      IntArrayList list = new IntArrayList(1);
      for (int i = 0; i < 100; ++i) {
         list.add(i);
      }
      assertEquals(100, list.size());
      assertEquals(99, list.getLast());
      assertEquals(42, list.get(42));
   }

   @Test
   void testSortedInsertAndRemove() {
      IntArrayList list = new IntArrayList();
      assertTrue(list.addSorted(5));
      assertTrue(list.addSorted(1));
      assertTrue(list.addSorted(3));
      assertFalse(list.addSorted(3));
      assertThat(list, equalTo(IntArrayList.of(1, 3, 5)));

      assertTrue(list.removeSorted(3));
      assertFalse(list.removeSorted(4));
      assertThat(list, equalTo(IntArrayList.of(1, 5)));
   }

   @Test
   void testRemoveIfKeepsOrder() {
      IntArrayList list = IntArrayList.of(4, 1, 6, 3, 8);
      assertTrue(list.removeIf(x -> x % 2 == 0));
      assertThat(list, equalTo(IntArrayList.of(1, 3)));
      assertFalse(list.removeIf(x -> x > 10));
   }

   @Test
   void testViewFollowsSourceAfterSync() {
      IntArrayList source = IntArrayList.of(1, 3);
      IntArrayListView view = new IntArrayListView(source);
      assertEquals(2, view.size());

      for (int i = 4; i < 40; ++i) {
         source.addSorted(i);
      }
      view.sync();
      assertEquals(38, view.size());
      assertEquals(39, view.getLast());
      assertEquals(1, view.binarySearch(3));
   }

   @Test
   void testViewRejectsMutation() {
      IntArrayList source = IntArrayList.of(1, 2, 3);
      IntArrayListView view = new IntArrayListView(source);

      assertThrows(UnsupportedOperationException.class, () -> view.add(4));
      assertThrows(UnsupportedOperationException.class, () -> view.addSorted(0));
      assertThrows(UnsupportedOperationException.class, () -> view.removeSorted(2));
      assertThrows(UnsupportedOperationException.class, () -> view.remove(0));
      assertThrows(UnsupportedOperationException.class, () -> view.set(0, 9));
      assertThrows(UnsupportedOperationException.class, view::sort);
      assertThrows(UnsupportedOperationException.class, view::clear);
      assertThat(source, equalTo(IntArrayList.of(1, 2, 3)));

      IntArrayList copy = new IntArrayList(view);
      copy.add(4);
      assertThat(copy, equalTo(IntArrayList.of(1, 2, 3, 4)));
   }

   @Test
   void testIndexChecked() {
      IntArrayList list = IntArrayList.of(1);
      assertThrows(ArrayIndexOutOfBoundsException.class, () -> list.get(1));
   }

   @Test
   void testCopyIsIndependent() {
      IntArrayList list = IntArrayList.of(1, 2);
      IntArrayList copy = new IntArrayList(list);
      copy.add(3);
      assertEquals(2, list.size());
      assertEquals(3, copy.size());
   }
}
