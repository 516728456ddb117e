package dev.dylanburati.orderedmap;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Iterator over the value store of an {@link OrderedHash}, forwards or backwards. {@link #remove()}
 * is an ordered erase.
 */
/* package-private */ final class OrderedIterator<T> implements Iterator<T> {
  private final OrderedHash<?, ?> ht;
  private final IntFunction<? extends T> elementAt;
  private final boolean descending;
  private int expectedModCount;
  private int nextIndex;
  private int lastIndex;

  OrderedIterator(final OrderedHash<?, ?> ht, boolean descending, final IntFunction<? extends T> elementAt) {
    this.ht = ht;
    this.elementAt = elementAt;
    this.descending = descending;
    this.expectedModCount = ht.modCount();
    this.nextIndex = descending ? ht.size() - 1 : 0;
    this.lastIndex = -1;
  }

  @Override
  public boolean hasNext() {
    return this.descending ? this.nextIndex >= 0 : this.nextIndex < this.ht.size();
  }

  @Override
  public T next() {
    if (this.ht.modCount() != this.expectedModCount) {
      throw new ConcurrentModificationException();
    }
    if (!this.hasNext()) {
      throw new NoSuchElementException();
    }
    this.lastIndex = this.nextIndex;
    this.nextIndex += this.descending ? -1 : 1;
    return this.elementAt.apply(this.lastIndex);
  }

  @Override
  public void remove() {
    if (this.lastIndex < 0) {
      throw new IllegalStateException();
    }
    if (this.ht.modCount() != this.expectedModCount) {
      throw new ConcurrentModificationException();
    }
    this.ht.eraseAt(this.lastIndex);
    if (!this.descending) {
      // everything after lastIndex moved left by one
      this.nextIndex = this.lastIndex;
    }
    this.lastIndex = -1;
    this.expectedModCount = this.ht.modCount();
  }
}
