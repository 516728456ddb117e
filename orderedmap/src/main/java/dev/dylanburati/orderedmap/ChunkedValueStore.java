package dev.dylanburati.orderedmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Value store split into chunks of {@link #CHUNK_SIZE} elements, so appending never copies
 * the existing elements.
 */
/* package-private */ final class ChunkedValueStore<E> implements ValueStore<E> {
  static final int CHUNK_BITS = 10;
  static final int CHUNK_SIZE = 1 << CHUNK_BITS;
  static final int CHUNK_MASK = CHUNK_SIZE - 1;
  static final int MAX_CHUNKS = (ArrayValueStore.MAX_ARRAY_SIZE >>> CHUNK_BITS);

  // INVARIANT 0: every chunk has length CHUNK_SIZE
  // INVARIANT 1: size <= chunks.size() * CHUNK_SIZE
  // INVARIANT 2: slots at index >= size are null
  private final List<Object[]> chunks;
  private int size;

  ChunkedValueStore() {
    this.chunks = new ArrayList<>();
    this.size = 0;
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
    return castUnsafe(this.chunks.get(index >>> CHUNK_BITS)[index & CHUNK_MASK]);
  }

  @Override
  public E set(int index, E element) {
    Object[] chunk = this.chunks.get(index >>> CHUNK_BITS);
    E prev = castUnsafe(chunk[index & CHUNK_MASK]);
    chunk[index & CHUNK_MASK] = element;
    return prev;
  }

  @Override
  public void add(E element) {
    if (this.size == this.chunks.size() << CHUNK_BITS) {
      this.addChunk();
    }
    this.chunks.get(this.size >>> CHUNK_BITS)[this.size & CHUNK_MASK] = element;
    this.size++;
  }

  private void addChunk() {
    if (this.chunks.size() >= MAX_CHUNKS) {
      throw new IllegalStateException("value store exceeds its maximum size");
    }
    this.chunks.add(new Object[CHUNK_SIZE]);
  }

  @Override
  public E removeAt(int index) {
    E prev = this.get(index);
    this.shiftLeft(index + 1, 1);
    return prev;
  }

  @Override
  public void removeRange(int fromIndex, int toIndex) {
    if (fromIndex < toIndex) {
      this.shiftLeft(toIndex, toIndex - fromIndex);
    }
  }

  // moves [from, size) to [from - delta, size - delta) and nulls the vacated tail
  private void shiftLeft(int from, int delta) {
    for (int src = from; src < this.size; src++) {
      int dst = src - delta;
      this.chunks.get(dst >>> CHUNK_BITS)[dst & CHUNK_MASK] = this.chunks.get(src >>> CHUNK_BITS)[src & CHUNK_MASK];
    }
    for (int i = this.size - delta; i < this.size; i++) {
      this.chunks.get(i >>> CHUNK_BITS)[i & CHUNK_MASK] = null;
    }
    this.size -= delta;
    // keep one spare chunk at most, like a deque
    int needed = (this.size + CHUNK_MASK) >>> CHUNK_BITS;
    while (this.chunks.size() > needed + 1) {
      this.chunks.remove(this.chunks.size() - 1);
    }
  }

  @Override
  public void swap(int i, int j) {
    Object[] ci = this.chunks.get(i >>> CHUNK_BITS);
    Object[] cj = this.chunks.get(j >>> CHUNK_BITS);
    Object tmp = ci[i & CHUNK_MASK];
    ci[i & CHUNK_MASK] = cj[j & CHUNK_MASK];
    cj[j & CHUNK_MASK] = tmp;
  }

  @Override
  public void clear() {
    this.chunks.clear();
    this.size = 0;
  }

  @Override
  public void ensureCapacity(int minCapacity) {
    while (this.capacity() < minCapacity) {
      this.addChunk();
    }
  }

  @Override
  public int capacity() {
    return this.chunks.size() << CHUNK_BITS;
  }

  @Override
  public void trimToSize() {
    int needed = (this.size + CHUNK_MASK) >>> CHUNK_BITS;
    while (this.chunks.size() > needed) {
      this.chunks.remove(this.chunks.size() - 1);
    }
  }

  @Override
  public ChunkedValueStore<E> copy() {
    ChunkedValueStore<E> result = new ChunkedValueStore<>();
    for (Object[] chunk : this.chunks) {
      result.chunks.add(Arrays.copyOf(chunk, CHUNK_SIZE));
    }
    result.size = this.size;
    return result;
  }
}
