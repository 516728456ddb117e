package dev.dylanburati.orderedmap;

import java.util.Arrays;

/* package-private */ final class ArrayValueStore<E> implements ValueStore<E> {
  static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;
  private static final Object[] EMPTY = new Object[0];

  // INVARIANT: elements[i] == null for i >= size
  private Object[] elements;
  private int size;

  ArrayValueStore() {
    this.elements = EMPTY;
    this.size = 0;
  }

  private ArrayValueStore(Object[] elements, int size) {
    this.elements = elements;
    this.size = size;
  }

  @SuppressWarnings("unchecked")
  private static <E> E castUnsafe(Object e) {
    return (E) e;
  }

  @Override
  public int size() {
    return this.size;
  }

  @Override
  public E get(int index) {
    return castUnsafe(this.elements[index]);
  }

  @Override
  public E set(int index, E element) {
    E prev = castUnsafe(this.elements[index]);
    this.elements[index] = element;
    return prev;
  }

  @Override
  public void add(E element) {
    if (this.size == this.elements.length) {
      this.grow(this.size + 1);
    }
    this.elements[this.size++] = element;
  }

  @Override
  public E removeAt(int index) {
    E prev = castUnsafe(this.elements[index]);
    int tail = this.size - index - 1;
    if (tail > 0) {
      System.arraycopy(this.elements, index + 1, this.elements, index, tail);
    }
    this.elements[--this.size] = null;
    return prev;
  }

  @Override
  public void removeRange(int fromIndex, int toIndex) {
    int tail = this.size - toIndex;
    System.arraycopy(this.elements, toIndex, this.elements, fromIndex, tail);
    int newSize = this.size - (toIndex - fromIndex);
    Arrays.fill(this.elements, newSize, this.size, null);
    this.size = newSize;
  }

  @Override
  public void swap(int i, int j) {
    Object tmp = this.elements[i];
    this.elements[i] = this.elements[j];
    this.elements[j] = tmp;
  }

  @Override
  public void clear() {
    Arrays.fill(this.elements, 0, this.size, null);
    this.size = 0;
  }

  @Override
  public void ensureCapacity(int minCapacity) {
    if (minCapacity > this.elements.length) {
      this.grow(minCapacity);
    }
  }

  private void grow(int minCapacity) {
    if (minCapacity > MAX_ARRAY_SIZE) {
      throw new IllegalStateException("value store exceeds its maximum size");
    }
    int cap = this.elements.length;
    // 1.5x, like ArrayList
    long next = Math.max(8L, cap + (long) (cap >> 1));
    int newCapacity = (int) Math.min(MAX_ARRAY_SIZE, Math.max(next, minCapacity));
    this.elements = Arrays.copyOf(this.elements, newCapacity);
  }

  @Override
  public int capacity() {
    return this.elements.length;
  }

  @Override
  public void trimToSize() {
    if (this.size < this.elements.length) {
      this.elements = this.size == 0 ? EMPTY : Arrays.copyOf(this.elements, this.size);
    }
  }

  @Override
  public ArrayValueStore<E> copy() {
    return new ArrayValueStore<>(Arrays.copyOf(this.elements, this.elements.length), this.size);
  }
}
