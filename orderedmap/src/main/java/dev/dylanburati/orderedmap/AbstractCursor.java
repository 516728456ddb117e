package dev.dylanburati.orderedmap;

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable random-access position in the insertion order of an {@link OrderedMap} or
 * {@link OrderedSet}, from {@code 0} to {@code size()} (the end position). Arithmetic returns
 * new cursors.
 *
 * A cursor is invalidated by any structural modification of its container, after which every
 * method except {@link #index()} throws {@link ConcurrentModificationException}.
 */
public abstract class AbstractCursor<C extends AbstractCursor<C>> implements Comparable<C> {
  final OrderedHash<?, ?> ht;
  final int index;
  final int expectedModCount;

  AbstractCursor(final OrderedHash<?, ?> ht, int index, int expectedModCount) {
    this.ht = ht;
    this.index = index;
    this.expectedModCount = expectedModCount;
  }

  /** Cursor of the same kind and generation at {@code index}. */
  abstract C at(int index);

  public int index() {
    return this.index;
  }

  public boolean isEnd() {
    this.checkForComodification();
    return this.index == this.ht.size();
  }

  public C plus(int n) {
    this.checkForComodification();
    long target = (long) this.index + n;
    if (target < 0 || target > this.ht.size()) {
      throw new IndexOutOfBoundsException("cursor moved to " + target + " of " + this.ht.size());
    }
    return this.at((int) target);
  }

  public C minus(int n) {
    return this.plus(-n);
  }

  public C next() {
    return this.plus(1);
  }

  public C previous() {
    return this.plus(-1);
  }

  /** {@code this.index() - other.index()}, for cursors over the same container. */
  public int distanceFrom(C other) {
    this.checkForComodification();
    if (other.ht != this.ht) {
      throw new IllegalArgumentException("cursors belong to different containers");
    }
    return this.index - other.index;
  }

  @Override
  public int compareTo(C other) {
    return Integer.signum(this.distanceFrom(other));
  }

  final int checkDereferenceable() {
    this.checkForComodification();
    if (this.index >= this.ht.size()) {
      throw new NoSuchElementException("cursor is at the end");
    }
    return this.index;
  }

  final void checkForComodification() {
    if (this.ht.modCount() != this.expectedModCount) {
      throw new ConcurrentModificationException();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AbstractCursor<?>)) {
      return false;
    }
    AbstractCursor<?> other = (AbstractCursor<?>) o;
    return this.ht == other.ht && this.index == other.index && this.expectedModCount == other.expectedModCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(this.ht), this.index, this.expectedModCount);
  }
}
