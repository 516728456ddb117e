package dev.dylanburati.orderedmap;

import java.util.ConcurrentModificationException;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Engine shared by {@link OrderedMap} and {@link OrderedSet}: an {@link IndexTable} using robin
 * hood probing with backward shift deletion, over a {@link ValueStore} which keeps the entries
 * in insertion order.
 *
 * {@code E} is the stored entry and {@code K} the part of it that is hashed and compared, as
 * projected by the {@link KeySelector}.
 */
/* package-private */ final class OrderedHash<K, E> {
  @FunctionalInterface
  interface KeySelector<K, E> {
    K keyOf(E entry);
  }

  static final int DEFAULT_MAX_SIZE = ArrayValueStore.MAX_ARRAY_SIZE;

  private final KeySelector<K, E> keySelector;
  private Hasher hasher;
  private KeyEquality<? super K> keyEquality;
  private boolean transparent;
  // INVARIANT 0: values.size() <= maxSize(), and values.size() <= buckets.bucketCount() * growth.maxLoadFactor()
  // INVARIANT 1: for each i in [0, values.size()), exactly one occupied bucket has valueIndex == i,
  //   and its truncated hash is hasher.hash(keyOf(values.get(i)))
  private ValueStore<E> values;
  private IndexTable buckets;
  private GrowthPolicy growth;
  private int maxSize;
  // power of two, buckets.bucketCount() <= maxBucketCount
  private int maxBucketCount;
  // incremented on every structural modification, checked by iterators and cursors
  private int modCount;

  OrderedHash(int bucketCount, final Hasher hasher, final KeyEquality<? super K> keyEquality,
      final KeySelector<K, E> keySelector, final StorageLayout layout, float maxLoadFactor, int maxSize,
      int maxBucketCount) {
    if (bucketCount < 0) {
      throw new IllegalArgumentException("expected non-negative bucketCount");
    }
    if (maxBucketCount <= 0 || maxBucketCount > IndexTable.MAX_BUCKET_COUNT
        || Integer.bitCount(maxBucketCount) != 1) {
      throw new IllegalArgumentException("expected maxBucketCount to be a power of two up to "
          + IndexTable.MAX_BUCKET_COUNT + ", got " + maxBucketCount);
    }
    if (bucketCount > maxBucketCount) {
      throw new IllegalArgumentException("The map exceeds its maximum size.");
    }
    this.hasher = Objects.requireNonNull(hasher);
    this.keyEquality = Objects.requireNonNull(keyEquality);
    this.transparent = keyEquality.isTransparent();
    this.keySelector = keySelector;
    this.values = Objects.requireNonNull(layout).newStore();
    int cap = GrowthPolicy.roundUpToPowerOfTwo(bucketCount);
    this.buckets = new IndexTable(cap);
    this.growth = new GrowthPolicy(maxLoadFactor, cap);
    this.maxSize = maxSize;
    this.maxBucketCount = maxBucketCount;
    this.modCount = 0;
  }

  private OrderedHash(OrderedHash<K, E> other, ValueStore<E> values) {
    // copy constructor, the index table is copied as-is since indices don't change
    this.keySelector = other.keySelector;
    this.hasher = other.hasher;
    this.keyEquality = other.keyEquality;
    this.transparent = other.transparent;
    this.values = values;
    this.buckets = other.buckets.copy();
    this.growth = other.growth.copy();
    this.maxSize = other.maxSize;
    this.maxBucketCount = other.maxBucketCount;
    this.modCount = 0;
  }

  /** Copy whose value store holds {@code entryCopier} applied to each entry, in order. */
  OrderedHash<K, E> copy(UnaryOperator<E> entryCopier) {
    ValueStore<E> copied = this.values.copy();
    for (int i = 0; i < copied.size(); i++) {
      copied.set(i, entryCopier.apply(copied.get(i)));
    }
    return new OrderedHash<>(this, copied);
  }

  // ---- observers

  int size() {
    return this.values.size();
  }

  int modCount() {
    return this.modCount;
  }

  /** The size limit, or fewer when the largest index table can't hold that many entries. */
  int maxSize() {
    long tableLimit = (long) (this.maxBucketCount * (double) this.growth.maxLoadFactor());
    return (int) Math.min(this.maxSize, tableLimit);
  }

  int maxBucketCount() {
    return this.maxBucketCount;
  }

  int bucketCount() {
    return this.buckets.bucketCount();
  }

  float loadFactor() {
    return (float) this.size() / (float) this.bucketCount();
  }

  float maxLoadFactor() {
    return this.growth.maxLoadFactor();
  }

  /** Rebuilds the index table right away if the current size is over the new limit. */
  void maxLoadFactor(float maxLoadFactor) {
    GrowthPolicy.checkLoadFactor(maxLoadFactor);
    long needed = (long) Math.ceil(this.size() / (double) maxLoadFactor);
    if (needed > this.maxBucketCount) {
      throw new IllegalArgumentException("The map exceeds its maximum size.");
    }
    this.growth.setMaxLoadFactor(maxLoadFactor, this.bucketCount());
    if (this.size() > this.growth.loadThreshold()) {
      this.rehashImpl((int) needed);
    }
  }

  Hasher hasher() {
    return this.hasher;
  }

  KeyEquality<? super K> keyEquality() {
    return this.keyEquality;
  }

  int capacity() {
    return this.values.capacity();
  }

  void trimToSize() {
    this.values.trimToSize();
  }

  E get(int index) {
    return this.values.get(index);
  }

  K keyAt(int index) {
    return this.keySelector.keyOf(this.values.get(index));
  }

  int hash(Object probe) {
    return this.hasher.hash(probe);
  }

  // ---- lookup

  private boolean matches(K stored, Object probe) {
    if (this.transparent) {
      return this.keyEquality.equalTo(stored, probe);
    }
    return this.keyEquality.equal(stored, castUnsafe(probe));
  }

  @SuppressWarnings("unchecked")
  private static <K> K castUnsafe(Object k) {
    return (K) k;
  }

  /**
   * Bucket whose entry matches {@code probe}, or -1. The probe stops early once it has come
   * farther from the initial bucket than the occupant of the current slot, since robin hood
   * insertion would have placed the probe's key before that occupant.
   */
  int findBucket(Object probe, int hash) {
    for (int b = this.buckets.bucketForHash(hash), dist = 0; ; b = this.buckets.nextBucket(b), dist++) {
      if (this.buckets.isEmpty(b)) {
        return -1;
      }
      if (this.buckets.truncatedHash(b) == hash
          && this.matches(this.keySelector.keyOf(this.values.get(this.buckets.valueIndex(b))), probe)) {
        return b;
      }
      if (dist > this.buckets.distFromInitialBucket(b)) {
        return -1;
      }
    }
  }

  /** Index in the value store of the entry matching {@code probe}, or -1. */
  int find(Object probe, int hash) {
    int b = this.findBucket(probe, hash);
    return b < 0 ? -1 : this.buckets.valueIndex(b);
  }

  int find(Object probe) {
    return this.find(probe, this.hash(probe));
  }

  int valueIndexOf(int bucket) {
    return this.buckets.valueIndex(bucket);
  }

  E entryInBucket(int bucket) {
    return this.values.get(this.buckets.valueIndex(bucket));
  }

  // bucket pointing at values[index], found by probing from the entry's own hash
  private int bucketOfIndex(int index) {
    int hash = this.hasher.hash(this.keyAt(index));
    int b = this.buckets.bucketForHash(hash);
    while (this.buckets.isEmpty(b) || this.buckets.valueIndex(b) != index) {
      assert !this.buckets.isEmpty(b) : "entry missing from index table";
      b = this.buckets.nextBucket(b);
    }
    return b;
  }

  // ---- insertion

  /**
   * Inserts the entry built by {@code entryFactory} unless an entry with an equal key exists.
   *
   * Returns:
   * <ul>
   * <li> {@code index} of the new entry, which is always the last one, when inserted
   * <li> {@code -index - 1} of the existing entry otherwise; the factory isn't called
   * </ul>
   */
  int insert(K key, int hash, Supplier<? extends E> entryFactory) {
    int b = this.buckets.bucketForHash(hash);
    int dist = 0;
    while (!this.buckets.isEmpty(b) && dist <= this.buckets.distFromInitialBucket(b)) {
      if (this.buckets.truncatedHash(b) == hash
          && this.keyEquality.equal(this.keySelector.keyOf(this.values.get(this.buckets.valueIndex(b))), key)) {
        return -this.buckets.valueIndex(b) - 1;
      }
      b = this.buckets.nextBucket(b);
      dist++;
    }

    if (this.values.size() >= this.maxSize()) {
      throw new IllegalStateException("We reached the maximum size for the hash table.");
    }
    int mc = this.modCount;
    E entry = entryFactory.get();
    if (this.modCount != mc) {
      // the factory modified this container, so b and dist are stale
      throw new ConcurrentModificationException();
    }

    int size = this.values.size();
    if (this.growth.shouldGrow(size)) {
      if (this.bucketCount() < this.maxBucketCount) {
        this.rehashImpl(this.growth.nextBucketCount(this.bucketCount(), size, this.maxBucketCount));
        b = this.buckets.bucketForHash(hash);
        dist = 0;
      } else if (size >= this.growth.loadThreshold()) {
        throw new IllegalStateException("The map exceeds its maximum size.");
      } else {
        // long chains in the largest table, but still room under the load factor
        this.growth.cancelEarlyGrowth();
      }
    }

    this.values.add(entry);
    int index = this.values.size() - 1;
    int probeLength = this.buckets.place(b, dist, hash, index);
    this.growth.recordProbe(probeLength, this.values.size());
    this.modCount++;
    return index;
  }

  // ---- deletion

  /**
   * Removes the entry that {@code bucket} points to. Later entries shift left by one in the
   * value store, so every bucket pointing past the removed index is renumbered, then the freed
   * bucket is closed with a backward shift.
   */
  E eraseBucket(int bucket) {
    int index = this.buckets.valueIndex(bucket);
    E removed = this.values.removeAt(index);
    if (index != this.values.size()) {
      this.shiftIndexesLeft(index, 1);
    }
    this.buckets.clear(bucket);
    this.buckets.backwardShift(bucket);
    this.modCount++;
    return removed;
  }

  /**
   * Decrements by {@code delta} the bucket index of each value now in {@code [from, size)}.
   * Probing for each moved value wins when few values moved; otherwise one pass over the
   * table is cheaper.
   */
  private void shiftIndexesLeft(int from, int delta) {
    int moved = this.values.size() - from;
    if (moved > this.bucketCount() >>> 3) {
      for (int b = 0; b < this.bucketCount(); b++) {
        if (!this.buckets.isEmpty(b) && this.buckets.valueIndex(b) >= from + delta) {
          this.buckets.setValueIndex(b, this.buckets.valueIndex(b) - delta);
        }
      }
      return;
    }
    for (int i = from; i < this.values.size(); i++) {
      int b = this.buckets.bucketForHash(this.hasher.hash(this.keyAt(i)));
      while (this.buckets.isEmpty(b) || this.buckets.valueIndex(b) != i + delta) {
        b = this.buckets.nextBucket(b);
      }
      this.buckets.setValueIndex(b, i);
    }
  }

  /** Ordered removal of the entry at {@code index}. Returns the index of the following entry. */
  int eraseAt(int index) {
    Objects.checkIndex(index, this.values.size());
    this.eraseBucket(this.bucketOfIndex(index));
    return index;
  }

  int erase(Object probe, int hash) {
    int b = this.findBucket(probe, hash);
    if (b < 0) {
      return 0;
    }
    this.eraseBucket(b);
    return 1;
  }

  /**
   * Ordered removal of {@code [fromIndex, toIndex)}. The value store is compacted once, then a
   * single pass over the index table clears the removed entries' buckets (with a backward shift
   * each) and renumbers the rest.
   */
  int eraseRange(int fromIndex, int toIndex) {
    Objects.checkFromToIndex(fromIndex, toIndex, this.values.size());
    if (fromIndex == toIndex) {
      return fromIndex;
    }
    int count = toIndex - fromIndex;
    this.values.removeRange(fromIndex, toIndex);

    int start = this.buckets.anyEmptyBucket();
    if (start < 0) {
      // completely full table: no slot to anchor the pass, rebuild instead
      IndexTable old = this.buckets;
      for (int b = 0; b < old.bucketCount(); b++) {
        int index = old.valueIndex(b);
        if (index >= fromIndex && index < toIndex) {
          old.clear(b);
        } else if (index >= toIndex) {
          old.setValueIndex(b, index - count);
        }
      }
      this.buckets = new IndexTable(old.bucketCount());
      this.buckets.replay(old);
    } else {
      // Walking from an empty slot, a backward shift started at b only pulls slots that the
      // walk hasn't reached yet, and never wraps past `start`. The slot pulled into b is
      // examined again before moving on.
      for (int step = 1; step < this.bucketCount(); step++) {
        int b = (start + step) & (this.bucketCount() - 1);
        while (!this.buckets.isEmpty(b)) {
          int index = this.buckets.valueIndex(b);
          if (index >= fromIndex && index < toIndex) {
            this.buckets.clear(b);
            this.buckets.backwardShift(b);
            continue;
          }
          if (index >= toIndex) {
            this.buckets.setValueIndex(b, index - count);
          }
          break;
        }
      }
    }
    this.modCount++;
    return fromIndex;
  }

  /**
   * Removes the matching entry in O(1) by first swapping it with the last entry of the value
   * store. Breaks insertion order: the previously last entry takes the removed entry's index.
   */
  int unorderedErase(Object probe, int hash) {
    int b = this.findBucket(probe, hash);
    if (b < 0) {
      return 0;
    }
    this.unorderedEraseBucket(b);
    return 1;
  }

  int unorderedEraseAt(int index) {
    Objects.checkIndex(index, this.values.size());
    this.unorderedEraseBucket(this.bucketOfIndex(index));
    return index;
  }

  private void unorderedEraseBucket(int bucket) {
    int index = this.buckets.valueIndex(bucket);
    int last = this.values.size() - 1;
    if (index != last) {
      int lastBucket = this.bucketOfIndex(last);
      this.values.swap(index, last);
      this.buckets.swapValueIndices(bucket, lastBucket);
    }
    // now the last entry, so no renumbering
    this.eraseBucket(bucket);
  }

  void clear() {
    this.buckets.clearAll();
    this.values.clear();
    this.modCount++;
  }

  // ---- growth

  void rehash(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("expected non-negative count");
    }
    long needed = Math.max(count, this.growth.bucketCountFor(this.size()));
    if (needed > this.maxBucketCount) {
      throw new IllegalArgumentException("The map exceeds its maximum size.");
    }
    this.rehashImpl((int) needed);
  }

  void reserve(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("expected non-negative count");
    }
    long needed = this.growth.bucketCountFor(count);
    if (needed > this.maxBucketCount || count > this.maxSize()) {
      throw new IllegalArgumentException("The map exceeds its maximum size.");
    }
    this.values.ensureCapacity(count);
    this.rehash((int) needed);
  }

  /**
   * Grows ahead of up to {@code additional} insertions, as far as the size limits allow. Unlike
   * {@link #reserve(int)} this never fails: some of the entries may turn out to exist already.
   */
  void reserveForInsertion(int additional) {
    long target = Math.min((long) this.size() + additional, this.maxSize());
    long needed = Math.min(this.growth.bucketCountFor(target), this.maxBucketCount);
    if (needed > this.bucketCount()) {
      this.values.ensureCapacity((int) target);
      this.rehashImpl((int) needed);
    }
  }

  private void rehashImpl(int count) {
    int bucketCount = GrowthPolicy.roundUpToPowerOfTwo(count);
    if (bucketCount == this.bucketCount()) {
      return;
    }
    IndexTable next = new IndexTable(bucketCount);
    next.replay(this.buckets);
    this.buckets = next;
    this.growth.resize(bucketCount);
    this.modCount++;
  }

  /** Exchanges all state with {@code other} in O(1). */
  void swap(OrderedHash<K, E> other) {
    Hasher h = this.hasher;
    this.hasher = other.hasher;
    other.hasher = h;
    KeyEquality<? super K> eq = this.keyEquality;
    this.keyEquality = other.keyEquality;
    other.keyEquality = eq;
    boolean t = this.transparent;
    this.transparent = other.transparent;
    other.transparent = t;
    ValueStore<E> v = this.values;
    this.values = other.values;
    other.values = v;
    IndexTable buckets = this.buckets;
    this.buckets = other.buckets;
    other.buckets = buckets;
    GrowthPolicy g = this.growth;
    this.growth = other.growth;
    other.growth = g;
    int ms = this.maxSize;
    this.maxSize = other.maxSize;
    other.maxSize = ms;
    int mb = this.maxBucketCount;
    this.maxBucketCount = other.maxBucketCount;
    other.maxBucketCount = mb;
    this.modCount++;
    other.modCount++;
  }

  /** Throws {@link AssertionError} if any table invariant is broken. */
  void verify() {
    int size = this.values.size();
    this.buckets.verify(size);
    for (int b = 0; b < this.bucketCount(); b++) {
      if (this.buckets.isEmpty(b)) {
        continue;
      }
      int index = this.buckets.valueIndex(b);
      if (this.buckets.truncatedHash(b) != this.hasher.hash(this.keyAt(index))) {
        throw new AssertionError(String.format("bucket %d caches a stale hash for index %d", b, index));
      }
    }
  }
}
