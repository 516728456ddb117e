package dev.dylanburati.orderedmap;

/**
 * Memory layout of the insertion-ordered value store behind an {@link OrderedMap} or
 * {@link OrderedSet}. Both layouts are random-access.
 */
public enum StorageLayout {
  /** A single array, grown by copying. Supports {@code capacity()} and {@code trimToSize()}. */
  CONTIGUOUS,
  /**
   * A list of fixed-size chunks. Growth allocates a new chunk and never copies existing
   * elements.
   */
  CHUNKED;

  <E> ValueStore<E> newStore() {
    switch (this) {
      case CHUNKED:
        return new ChunkedValueStore<>();
      case CONTIGUOUS:
      default:
        return new ArrayValueStore<>();
    }
  }
}
