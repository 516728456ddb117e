package dev.dylanburati.orderedmap;

/**
 * Decides when the index table has to grow. Two triggers:
 * <ul>
 * <li> the number of entries reaches {@code bucketCount * maxLoadFactor}; the table then grows
 *   until it has room for one more entry, which is more than doubling for small tables under a
 *   low max load factor;
 * <li> an insertion probed more than {@link #LONG_PROBE_LIMIT} slots while the load factor was
 *   already above {@link #LONG_PROBE_MIN_LOAD_FACTOR}. Probe chains this long at a moderate
 *   load mean the hash is clustering, so the next insertion grows the table early.
 * </ul>
 */
/* package-private */ final class GrowthPolicy {
  static final int DEFAULT_BUCKET_COUNT = 16;
  static final float DEFAULT_MAX_LOAD_FACTOR = 0.9f;
  static final int LONG_PROBE_LIMIT = 128;
  static final float LONG_PROBE_MIN_LOAD_FACTOR = 0.15f;

  private float maxLoadFactor;
  // INVARIANT: both thresholds are derived from the current bucket count and maxLoadFactor
  private int loadThreshold;
  private int longProbeSizeThreshold;
  private boolean growOnNextInsert;

  GrowthPolicy(float maxLoadFactor, int bucketCount) {
    this.maxLoadFactor = checkLoadFactor(maxLoadFactor);
    this.resize(bucketCount);
  }

  private GrowthPolicy(GrowthPolicy other) {
    this.maxLoadFactor = other.maxLoadFactor;
    this.loadThreshold = other.loadThreshold;
    this.longProbeSizeThreshold = other.longProbeSizeThreshold;
    this.growOnNextInsert = other.growOnNextInsert;
  }

  static float checkLoadFactor(float maxLoadFactor) {
    if (!(maxLoadFactor > 0.0f && maxLoadFactor <= 1.0f)) {
      throw new IllegalArgumentException("expected max load factor in (0, 1], got " + maxLoadFactor);
    }
    return maxLoadFactor;
  }

  /** Smallest power of two {@code >= value}, and 1 for 0. Callers bound {@code value} first. */
  static int roundUpToPowerOfTwo(int value) {
    assert value >= 0 && value <= IndexTable.MAX_BUCKET_COUNT;
    if (value <= 1) {
      return 1;
    }
    return 1 << (32 - Integer.numberOfLeadingZeros(value - 1));
  }

  float maxLoadFactor() {
    return this.maxLoadFactor;
  }

  /** Changes the max load factor of a table which keeps its {@code bucketCount} slots. */
  void setMaxLoadFactor(float maxLoadFactor, int bucketCount) {
    this.maxLoadFactor = checkLoadFactor(maxLoadFactor);
    // a pending early growth still applies
    this.updateThresholds(bucketCount);
  }

  /** Called whenever the index table is rebuilt with {@code bucketCount} slots. */
  void resize(int bucketCount) {
    this.updateThresholds(bucketCount);
    this.growOnNextInsert = false;
  }

  private void updateThresholds(int bucketCount) {
    this.loadThreshold = (int) (bucketCount * this.maxLoadFactor);
    this.longProbeSizeThreshold = (int) (bucketCount * LONG_PROBE_MIN_LOAD_FACTOR);
  }

  int loadThreshold() {
    return this.loadThreshold;
  }

  /** Whether the table must double before one more entry is added to {@code size} entries. */
  boolean shouldGrow(int size) {
    return this.growOnNextInsert || size >= this.loadThreshold;
  }

  /** Records the probe length of an insertion that left the container with {@code size} entries. */
  void recordProbe(int probeLength, int size) {
    if (probeLength > LONG_PROBE_LIMIT && size >= this.longProbeSizeThreshold) {
      this.growOnNextInsert = true;
    }
  }

  boolean growOnNextInsert() {
    return this.growOnNextInsert;
  }

  /** Drops a pending early growth, for a table which can't grow any further. */
  void cancelEarlyGrowth() {
    this.growOnNextInsert = false;
  }

  /**
   * Bucket count to grow to before adding one entry to {@code size} entries: at least double,
   * and enough for {@code size + 1} entries under the max load factor, capped at
   * {@code maxBucketCount}.
   */
  int nextBucketCount(int bucketCount, int size, int maxBucketCount) {
    long wanted = Math.max(2L * bucketCount, this.bucketCountFor(size + 1L));
    return (int) Math.min(wanted, maxBucketCount);
  }

  /** Bucket count needed to hold {@code count} entries without passing the max load factor. */
  long bucketCountFor(long count) {
    return (long) Math.ceil(count / (double) this.maxLoadFactor);
  }

  GrowthPolicy copy() {
    return new GrowthPolicy(this);
  }
}
