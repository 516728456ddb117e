package dev.dylanburati.orderedmap;

/**
 * Dense, insertion-ordered sequence of entries. Index {@code i} always holds the {@code i}th
 * oldest live entry, with no gaps.
 *
 * Implementations make no promise that an element stays at the same index, or in the same
 * backing array, across a mutation: callers re-read by index after every insert or removal.
 */
/* package-private */ interface ValueStore<E> {
  int size();

  E get(int index);

  E set(int index, E element);

  void add(E element);

  /** Removes the element at {@code index}, shifting every later element left by one. */
  E removeAt(int index);

  /** Removes {@code [fromIndex, toIndex)}, shifting every later element left by the range length. */
  void removeRange(int fromIndex, int toIndex);

  void swap(int i, int j);

  void clear();

  void ensureCapacity(int minCapacity);

  /** Number of elements the store can hold before it has to allocate. */
  int capacity();

  void trimToSize();

  ValueStore<E> copy();
}
