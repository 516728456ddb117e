package dev.dylanburati.orderedmap;

/**
 * Computes hashes for insertion to ordered maps and sets. The rules of {@link Object#hashCode}
 * also apply here: keys which are equal according to the container's {@link KeyEquality} must
 * have equal hashes.
 *
 * The full 32-bit result is cached next to each index table slot, and its low bits select the
 * initial slot, so implementations should spread entropy into the low bits.
 */
@FunctionalInterface
public interface Hasher {
  int hash(Object key);

  static Hasher defaultHasher() {
    return DefaultHasher.instance();
  }
}
