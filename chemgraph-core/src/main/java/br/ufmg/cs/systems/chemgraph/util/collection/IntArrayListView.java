package br.ufmg.cs.systems.chemgraph.util.collection;

import java.util.function.IntPredicate;

/**
 * Read-only window over another list's contents. The owner of the source list
 * must call {@link #sync()} after every change to it; every mutator of the
 * view throws {@link UnsupportedOperationException}.
 */
public final class IntArrayListView extends IntArrayList {
   private final IntArrayList source;

   public IntArrayListView(IntArrayList source) {
      super(1);
      this.source = source;
      sync();
   }

   public void sync() {
      backingArray = source.backingArray;
      numElements = source.numElements;
   }

   @Override
   public void set(int[] intArray, int numElements) {
      throw new UnsupportedOperationException();
   }

   @Override
   public boolean add(int newValue) {
      throw new UnsupportedOperationException();
   }

   @Override
   public void addAll(IntArrayList other) {
      throw new UnsupportedOperationException();
   }

   @Override
   public boolean addSorted(int newValue) {
      throw new UnsupportedOperationException();
   }

   @Override
   public boolean removeSorted(int value) {
      throw new UnsupportedOperationException();
   }

   @Override
   public int remove(int index) {
      throw new UnsupportedOperationException();
   }

   @Override
   public boolean removeIf(IntPredicate predicate) {
      throw new UnsupportedOperationException();
   }

   @Override
   public void set(int index, int newValue) {
      throw new UnsupportedOperationException();
   }

   @Override
   public void setu(int index, int newValue) {
      throw new UnsupportedOperationException();
   }

   @Override
   public void clear() {
      throw new UnsupportedOperationException();
   }

   @Override
   public void sort() {
      throw new UnsupportedOperationException();
   }

   @Override
   public int pop() {
      throw new UnsupportedOperationException();
   }

   @Override
   public String toString() {
      return "view" + super.toString();
   }
}
