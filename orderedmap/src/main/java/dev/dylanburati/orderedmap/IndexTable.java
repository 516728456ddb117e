package dev.dylanburati.orderedmap;

import java.util.Arrays;

/**
 * Open-addressing table of slots pointing into the value store. Each slot is a {@code long}:
 *
 * <pre>
 *   bits[63:32] = truncated hash
 *       [31:1]  = index of the entry in the value store
 *       [0]     = occupied flag
 * </pre>
 *
 * An empty slot is {@code 0L}, so the occupied flag, never a reserved index value, tells the two
 * states apart. Slots are weak back-references: the value store owns the entries.
 */
/* package-private */ final class IndexTable {
  static final long OCCUPIED_FLAG = 1L;
  static final int INDEX_BITS = 31;
  static final long INDEX_MASK = (1L << INDEX_BITS) - 1;
  static final int HASH_SHIFT = INDEX_BITS + 1;
  /** Largest power of two that can size a {@code long[]}. */
  static final int MAX_BUCKET_COUNT = 1 << 30;
  static {
    assertBitsAreRight();
  }

  @SuppressWarnings("all")
  private static void assertBitsAreRight() {
    if (HASH_SHIFT + Integer.SIZE != 64) {
      throw new AssertionError();
    }
  }

  // INVARIANT 0: slots.length is a power of 2, and mask == slots.length - 1
  // INVARIANT 1: for every occupied slot s at distance d > 0 from its initial bucket, the slot
  //   before s is occupied and its own distance is >= d - 1 (robin hood ordering; lookups may
  //   stop as soon as they have probed farther than the slot they are looking at)
  private final long[] slots;
  private final int mask;

  IndexTable(int bucketCount) {
    assert bucketCount > 0 && (bucketCount & (bucketCount - 1)) == 0;
    this.slots = new long[bucketCount];
    this.mask = bucketCount - 1;
  }

  private IndexTable(long[] slots) {
    this.slots = slots;
    this.mask = slots.length - 1;
  }

  static long slot(int hash, int index) {
    return ((long) hash << HASH_SHIFT) | ((long) index << 1) | OCCUPIED_FLAG;
  }

  int bucketCount() {
    return this.slots.length;
  }

  int bucketForHash(int hash) {
    return hash & this.mask;
  }

  int nextBucket(int bucket) {
    return (bucket + 1) & this.mask;
  }

  boolean isEmpty(int bucket) {
    return (this.slots[bucket] & OCCUPIED_FLAG) == 0;
  }

  int truncatedHash(int bucket) {
    return (int) (this.slots[bucket] >>> HASH_SHIFT);
  }

  int valueIndex(int bucket) {
    assert !this.isEmpty(bucket);
    return (int) ((this.slots[bucket] >>> 1) & INDEX_MASK);
  }

  void setValueIndex(int bucket, int index) {
    assert !this.isEmpty(bucket);
    this.slots[bucket] = slot(this.truncatedHash(bucket), index);
  }

  /** Number of linear steps from the slot's initial bucket to {@code bucket}, modulo the table size. */
  int distFromInitialBucket(int bucket) {
    return (bucket - this.bucketForHash(this.truncatedHash(bucket))) & this.mask;
  }

  /**
   * Robin hood insertion of (hash, index), starting at {@code bucket} which is {@code dist}
   * steps from the initial bucket of {@code hash}. Whenever the probe has come farther than the
   * occupant of the current slot, the occupant is evicted and carried forward instead.
   *
   * Returns the longest probe distance reached while placing.
   */
  int place(int bucket, int dist, int hash, int index) {
    long carried = slot(hash, index);
    int longest = dist;
    while (!this.isEmpty(bucket)) {
      int occupantDist = this.distFromInitialBucket(bucket);
      if (dist > occupantDist) {
        long evicted = this.slots[bucket];
        this.slots[bucket] = carried;
        carried = evicted;
        dist = occupantDist;
      }
      bucket = this.nextBucket(bucket);
      dist++;
      longest = Math.max(longest, dist);
    }
    this.slots[bucket] = carried;
    return longest;
  }

  void clear(int bucket) {
    this.slots[bucket] = 0L;
  }

  /**
   * Pulls the slots following the empty {@code bucket} back by one, until reaching an empty slot
   * or a slot already in its initial bucket. No tombstones are left behind.
   */
  void backwardShift(int bucket) {
    assert this.isEmpty(bucket);
    int previous = bucket;
    for (int current = this.nextBucket(previous);
        !this.isEmpty(current) && this.distFromInitialBucket(current) > 0;
        previous = current, current = this.nextBucket(current)) {
      this.slots[previous] = this.slots[current];
      this.slots[current] = 0L;
    }
  }

  void swapValueIndices(int bucketA, int bucketB) {
    int a = this.valueIndex(bucketA);
    this.setValueIndex(bucketA, this.valueIndex(bucketB));
    this.setValueIndex(bucketB, a);
  }

  /** Index of some empty slot, or -1 when every slot is occupied. */
  int anyEmptyBucket() {
    for (int b = 0; b < this.slots.length; b++) {
      if (this.isEmpty(b)) {
        return b;
      }
    }
    return -1;
  }

  /** Reinserts every occupied slot of {@code source} into this table, which must start empty. */
  void replay(IndexTable source) {
    for (long s : source.slots) {
      if ((s & OCCUPIED_FLAG) == 0) {
        continue;
      }
      int hash = (int) (s >>> HASH_SHIFT);
      int index = (int) ((s >>> 1) & INDEX_MASK);
      this.place(this.bucketForHash(hash), 0, hash, index);
    }
  }

  void clearAll() {
    Arrays.fill(this.slots, 0L);
  }

  IndexTable copy() {
    return new IndexTable(Arrays.copyOf(this.slots, this.slots.length));
  }

  /**
   * Checks INVARIANT 1, and that the occupied slots reference each of {@code [0, size)} exactly
   * once.
   */
  void verify(int size) {
    boolean[] seen = new boolean[size];
    int occupied = 0;
    for (int b = 0; b < this.slots.length; b++) {
      if (this.isEmpty(b)) {
        continue;
      }
      occupied++;
      int index = this.valueIndex(b);
      if (index >= size || seen[index]) {
        throw new AssertionError(String.format("bucket %d holds bad or duplicate index %d", b, index));
      }
      seen[index] = true;
      int dist = this.distFromInitialBucket(b);
      if (dist > 0) {
        int previous = (b - 1) & this.mask;
        if (this.isEmpty(previous) || this.distFromInitialBucket(previous) + 1 < dist) {
          throw new AssertionError(String.format("robin hood ordering broken at bucket %d (distance %d)", b, dist));
        }
      }
    }
    if (occupied != size) {
      throw new AssertionError(String.format("%d occupied buckets for %d values", occupied, size));
    }
  }
}
