package dev.dylanburati.orderedmap;

import java.util.Objects;

/**
 * Decides whether a stored key matches a lookup key.
 *
 * A transparent equality accepts lookup probes of other types than {@code K}, through
 * {@link #equalTo(Object, Object)}. Lookups on a container configured with a transparent
 * equality pass the probe to the {@link Hasher} and to {@code equalTo} as-is, so no temporary
 * key has to be built. A container whose equality is not transparent treats every probe as a
 * {@code K}, and incompatible probes fail with {@link ClassCastException}.
 */
public interface KeyEquality<K> {
  boolean equal(K stored, K candidate);

  default boolean isTransparent() {
    return false;
  }

  /**
   * Compares a stored key to a probe of any type. Only called when {@link #isTransparent()}.
   */
  default boolean equalTo(K stored, Object probe) {
    throw new UnsupportedOperationException("equality is not transparent");
  }

  /** {@link Object#equals} on the keys. */
  @SuppressWarnings("unchecked")
  static <K> KeyEquality<K> natural() {
    return (KeyEquality<K>) Natural.INSTANCE;
  }

  /* package-private */ enum Natural implements KeyEquality<Object> {
    INSTANCE;

    @Override
    public boolean equal(Object stored, Object candidate) {
      return Objects.equals(stored, candidate);
    }
  }
}
