package br.ufmg.cs.systems.chemgraph.util.collection;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.function.IntPredicate;

/**
 * Growable list of primitive ints. Used for vertex/edge id lists, orderings
 * and search stacks, where boxing would dominate the cost of the search.
 */
public class IntArrayList {
   private static final int INITIAL_SIZE = 16;

   protected int[] backingArray;
   protected int numElements;

   public IntArrayList() {
      this(INITIAL_SIZE);
   }

   public IntArrayList(int capacity) {
      ensureCapacity(Math.max(capacity, 1));
      this.numElements = 0;
   }

   public IntArrayList(IntArrayList intArrayList) {
      this(intArrayList.backingArray, intArrayList.numElements);
   }

   public IntArrayList(int[] intArray, int numElements) {
      set(intArray, numElements);
   }

   public IntArrayList(int[] intArray) {
      this(intArray, intArray.length);
   }

   public static IntArrayList of(int... elements) {
      return new IntArrayList(elements);
   }

   public void set(int[] intArray, int numElements) {
      this.numElements = numElements;
      backingArray = Arrays.copyOf(intArray, Math.max(numElements, 1));
   }

   public int size() {
      return numElements;
   }

   public boolean isEmpty() {
      return numElements == 0;
   }

   public boolean ensureCapacity(int minimumSize) {
      if (backingArray == null) {
         backingArray = new int[minimumSize];
      } else if (minimumSize > backingArray.length) {
         int targetLength = Math.max(backingArray.length, 1);

         while (targetLength < minimumSize) {
            targetLength = targetLength << 1;

            if (targetLength < 0) {
               targetLength = minimumSize;
               break;
            }
         }

         backingArray = Arrays.copyOf(backingArray, targetLength);
      } else {
         return false;
      }

      return true;
   }

   public boolean contains(int element) {
      return indexOf(element) >= 0;
   }

   public int indexOf(int element) {
      for (int i = 0; i < numElements; ++i) {
         if (backingArray[i] == element) {
            return i;
         }
      }

      return -1;
   }

   @Nonnull
   public int[] toIntArray() {
      return Arrays.copyOf(backingArray, numElements);
   }

   public int binarySearch(int value) {
      return Arrays.binarySearch(backingArray, 0, numElements, value);
   }

   public boolean add(int newValue) {
      ensureCapacity(numElements + 1);
      backingArray[numElements++] = newValue;
      return true;
   }

   public void addAll(IntArrayList other) {
      ensureCapacity(numElements + other.numElements);
      System.arraycopy(other.backingArray, 0, backingArray, numElements,
              other.numElements);
      numElements += other.numElements;
   }

   /**
    * Inserts keeping ascending order, assuming the list is already sorted.
    *
    * @return false if the value was already present
    */
   public boolean addSorted(int newValue) {
      int idx = binarySearch(newValue);
      if (idx >= 0) {
         return false;
      }

      idx = -idx - 1;
      ensureCapacity(numElements + 1);
      System.arraycopy(backingArray, idx, backingArray, idx + 1,
              numElements - idx);
      backingArray[idx] = newValue;
      ++numElements;
      return true;
   }

   public boolean removeSorted(int value) {
      int idx = binarySearch(value);
      if (idx < 0) {
         return false;
      }

      remove(idx);
      return true;
   }

   public int remove(int index) {
      checkIndex(index);

      int removedElement = backingArray[index];

      --numElements;

      if (index != numElements) {
         System.arraycopy(backingArray, index + 1, backingArray, index,
                 numElements - index);
      }

      return removedElement;
   }

   public boolean removeIf(IntPredicate predicate) {
      int writeIdx = 0;
      for (int i = 0; i < numElements; ++i) {
         int elem = backingArray[i];
         if (!predicate.test(elem)) {
            backingArray[writeIdx++] = elem;
         }
      }

      boolean removed = writeIdx != numElements;
      numElements = writeIdx;
      return removed;
   }

   public int get(int index) {
      checkIndex(index);
      return getu(index);
   }

   public int getu(int index) {
      return backingArray[index];
   }

   public void set(int index, int newValue) {
      checkIndex(index);
      setu(index, newValue);
   }

   public void setu(int index, int newValue) {
      backingArray[index] = newValue;
   }

   public void clear() {
      numElements = 0;
   }

   public void sort() {
      Arrays.sort(backingArray, 0, numElements);
   }

   public int pop() {
      return remove(numElements - 1);
   }

   public int getLast() {
      int index = numElements - 1;

      if (index >= 0) {
         return backingArray[index];
      } else {
         throw new ArrayIndexOutOfBoundsException(index);
      }
   }

   protected void checkIndex(int index) {
      if (index < 0 || index >= numElements) {
         throw new ArrayIndexOutOfBoundsException(index);
      }
   }

   @Override
   public String toString() {
      StringBuilder strBuilder = new StringBuilder();

      strBuilder.append("[");

      for (int i = 0; i < numElements; ++i) {
         if (i > 0) {
            strBuilder.append(",");
         }

         strBuilder.append(getu(i));
      }

      strBuilder.append("]");

      return strBuilder.toString();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      IntArrayList other = (IntArrayList) o;

      if (numElements != other.numElements) return false;

      for (int i = 0; i < numElements; ++i) {
         if (backingArray[i] != other.backingArray[i]) {
            return false;
         }
      }

      return true;
   }

   @Override
   public int hashCode() {
      int result = numElements;

      for (int i = 0; i < numElements; ++i) {
         result = 31 * result + backingArray[i];
      }

      return result;
   }
}
