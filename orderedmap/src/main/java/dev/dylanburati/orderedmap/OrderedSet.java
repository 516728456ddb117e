package dev.dylanburati.orderedmap;

import java.util.AbstractList;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.RandomAccess;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Hash set which remembers the order in which elements were first added. Same structure and
 * costs as {@link OrderedMap}, with the element acting as its own key.
 */
public class OrderedSet<E> extends AbstractSet<E> implements Cloneable {
  private final OrderedHash<E, E> ht;

  public OrderedSet() {
    this(OrderedMap.DEFAULT_BUCKET_COUNT);
  }

  public OrderedSet(int bucketCount) {
    this(bucketCount, Hasher.defaultHasher(), KeyEquality.<E>natural());
  }

  public OrderedSet(int bucketCount, final Hasher hasher, final KeyEquality<? super E> keyEquality) {
    this(bucketCount, hasher, keyEquality, StorageLayout.CONTIGUOUS);
  }

  public OrderedSet(int bucketCount, final Hasher hasher, final KeyEquality<? super E> keyEquality,
      final StorageLayout layout) {
    this(new OrderedHash<E, E>(bucketCount, hasher, keyEquality, e -> e, layout,
        OrderedMap.DEFAULT_MAX_LOAD_FACTOR, OrderedHash.DEFAULT_MAX_SIZE, IndexTable.MAX_BUCKET_COUNT));
  }

  public OrderedSet(final Collection<? extends E> c) {
    this(OrderedMap.DEFAULT_BUCKET_COUNT);
    this.addAll(c);
  }

  private OrderedSet(final OrderedHash<E, E> ht) {
    this.ht = ht;
  }

  /** Set refusing to hold more than {@code maxSize} elements. */
  static <E> OrderedSet<E> withMaxSize(int bucketCount, int maxSize) {
    return withLimits(bucketCount, Hasher.defaultHasher(), maxSize, IndexTable.MAX_BUCKET_COUNT);
  }

  /** Set whose index table never grows past {@code maxBucketCount}, a power of two. */
  static <E> OrderedSet<E> withLimits(int bucketCount, final Hasher hasher, int maxSize, int maxBucketCount) {
    return new OrderedSet<E>(new OrderedHash<E, E>(bucketCount, hasher, KeyEquality.<E>natural(),
        e -> e, StorageLayout.CONTIGUOUS, OrderedMap.DEFAULT_MAX_LOAD_FACTOR, maxSize, maxBucketCount));
  }

  @Override
  public int size() {
    return this.ht.size();
  }

  @Override
  public boolean isEmpty() {
    return this.ht.size() == 0;
  }

  @Override
  public boolean contains(Object o) {
    return this.ht.find(o) >= 0;
  }

  @Override
  public boolean add(E e) {
    return this.ht.insert(e, this.ht.hash(e), () -> e) >= 0;
  }

  /** Adds {@code e} unless present, and reports its position either way. */
  public InsertResult insert(E e) {
    return InsertResult.fromEncoded(this.ht.insert(e, this.ht.hash(e), () -> e));
  }

  /** Reserves room for all of {@code c} once, then adds its elements in iteration order. */
  @Override
  public boolean addAll(Collection<? extends E> c) {
    this.ht.reserveForInsertion(c.size());
    boolean changed = false;
    for (E e : c) {
      changed |= this.add(e);
    }
    return changed;
  }

  /** Ordered removal: later elements move one position left. */
  @Override
  public boolean remove(Object o) {
    return this.ht.erase(o, this.ht.hash(o)) == 1;
  }

  @Override
  public boolean removeIf(Predicate<? super E> filter) {
    Objects.requireNonNull(filter);
    // test everything first, then compact runs of removed elements with one range erase each
    int mc = this.ht.modCount();
    boolean[] doomed = new boolean[this.ht.size()];
    boolean any = false;
    for (int i = 0; i < doomed.length; i++) {
      doomed[i] = filter.test(this.ht.get(i));
      any |= doomed[i];
      if (this.ht.modCount() != mc) {
        throw new ConcurrentModificationException();
      }
    }
    if (!any) {
      return false;
    }
    for (int end = doomed.length; end > 0; ) {
      if (!doomed[end - 1]) {
        end--;
        continue;
      }
      int start = end - 1;
      while (start > 0 && doomed[start - 1]) {
        start--;
      }
      this.ht.eraseRange(start, end);
      end = start;
    }
    return true;
  }

  @Override
  public void clear() {
    this.ht.clear();
  }

  @Override
  public Iterator<E> iterator() {
    return new OrderedIterator<>(this.ht, false, this.ht::get);
  }

  /** Iterates from newest to oldest. {@code remove()} is supported. */
  public Iterator<E> descendingIterator() {
    return new OrderedIterator<>(this.ht, true, this.ht::get);
  }

  @Override
  public void forEach(Consumer<? super E> action) {
    Objects.requireNonNull(action);
    int mc = this.ht.modCount();
    for (int i = 0; i < this.ht.size(); i++) {
      action.accept(this.ht.get(i));
      if (this.ht.modCount() != mc) {
        throw new ConcurrentModificationException();
      }
    }
  }

  // ---- erasure by position or key

  /** Ordered removal of the element at {@code index}. Returns the index of the element that followed it. */
  public int eraseAt(int index) {
    return this.ht.eraseAt(index);
  }

  public int eraseRange(int fromIndex, int toIndex) {
    return this.ht.eraseRange(fromIndex, toIndex);
  }

  public int erase(Object key) {
    return this.ht.erase(key, this.ht.hash(key));
  }

  public int erase(Object key, int precalculatedHash) {
    return this.ht.erase(key, precalculatedHash);
  }

  /** O(1) removal which moves the last element into position {@code index}. */
  public int unorderedEraseAt(int index) {
    return this.ht.unorderedEraseAt(index);
  }

  public int unorderedErase(Object key) {
    return this.ht.unorderedErase(key, this.ht.hash(key));
  }

  public int unorderedErase(Object key, int precalculatedHash) {
    return this.ht.unorderedErase(key, precalculatedHash);
  }

  /** Removes and returns the most recently added element, or null if empty. */
  public E pollLast() {
    if (this.isEmpty()) {
      return null;
    }
    int last = this.ht.size() - 1;
    E e = this.ht.get(last);
    this.ht.eraseAt(last);
    return e;
  }

  // ---- lookup

  public OptionalInt find(Object key) {
    return this.find(key, this.ht.hash(key));
  }

  public OptionalInt find(Object key, int precalculatedHash) {
    int idx = this.ht.find(key, precalculatedHash);
    return idx < 0 ? OptionalInt.empty() : OptionalInt.of(idx);
  }

  /**
   * The stored element equal to {@code key}.
   *
   * @throws NoSuchElementException if there is none
   */
  public E at(Object key) {
    return this.at(key, this.ht.hash(key));
  }

  public E at(Object key, int precalculatedHash) {
    int idx = this.ht.find(key, precalculatedHash);
    if (idx < 0) {
      throw new NoSuchElementException("Couldn't find the key.");
    }
    return this.ht.get(idx);
  }

  public int count(Object key) {
    return this.ht.find(key) >= 0 ? 1 : 0;
  }

  public int count(Object key, int precalculatedHash) {
    return this.ht.find(key, precalculatedHash) >= 0 ? 1 : 0;
  }

  public List<E> equalRange(Object key) {
    return this.equalRange(key, this.ht.hash(key));
  }

  public List<E> equalRange(Object key, int precalculatedHash) {
    int idx = this.ht.find(key, precalculatedHash);
    if (idx < 0) {
      return List.of();
    }
    return this.valuesContainer().subList(idx, idx + 1);
  }

  // ---- positional access

  public E get(int index) {
    Objects.checkIndex(index, this.ht.size());
    return this.ht.get(index);
  }

  public E first() {
    if (this.isEmpty()) {
      throw new NoSuchElementException();
    }
    return this.ht.get(0);
  }

  public E last() {
    if (this.isEmpty()) {
      throw new NoSuchElementException();
    }
    return this.ht.get(this.ht.size() - 1);
  }

  public Cursor<E> cursor(int index) {
    Objects.checkIndex(index, this.ht.size() + 1);
    return new Cursor<>(this.ht, index, this.ht.modCount());
  }

  public Cursor<E> begin() {
    return this.cursor(0);
  }

  public Cursor<E> end() {
    return this.cursor(this.ht.size());
  }

  // ---- bucket interface and hash policy

  public int bucketCount() {
    return this.ht.bucketCount();
  }

  public int maxBucketCount() {
    return this.ht.maxBucketCount();
  }

  public int maxSize() {
    return this.ht.maxSize();
  }

  public float loadFactor() {
    return this.ht.loadFactor();
  }

  public float maxLoadFactor() {
    return this.ht.maxLoadFactor();
  }

  public void maxLoadFactor(float maxLoadFactor) {
    this.ht.maxLoadFactor(maxLoadFactor);
  }

  public void rehash(int count) {
    this.ht.rehash(count);
  }

  public void reserve(int count) {
    this.ht.reserve(count);
  }

  public int capacity() {
    return this.ht.capacity();
  }

  public void trimToSize() {
    this.ht.trimToSize();
  }

  // ---- observers

  public Hasher hashFunction() {
    return this.ht.hasher();
  }

  public KeyEquality<? super E> keyEq() {
    return this.ht.keyEquality();
  }

  /** Read-only, random-access view of the elements in insertion order. */
  public List<E> valuesContainer() {
    return new ElementList<>(this.ht);
  }

  public void swap(OrderedSet<E> other) {
    this.ht.swap(other.ht);
  }

  public boolean equalsInOrder(OrderedSet<?> other) {
    if (other.size() != this.size()) {
      return false;
    }
    for (int i = 0; i < this.ht.size(); i++) {
      if (!Objects.equals(this.ht.get(i), other.ht.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public OrderedSet<E> clone() {
    return new OrderedSet<>(this.ht.copy(e -> e));
  }

  void verify() {
    this.ht.verify();
  }

  /** Random-access position in a set's insertion order. */
  public static final class Cursor<E> extends AbstractCursor<Cursor<E>> {
    private final OrderedHash<E, E> owner;

    Cursor(final OrderedHash<E, E> owner, int index, int expectedModCount) {
      super(owner, index, expectedModCount);
      this.owner = owner;
    }

    @Override
    Cursor<E> at(int index) {
      return new Cursor<>(this.owner, index, this.expectedModCount);
    }

    public E get() {
      return this.owner.get(this.checkDereferenceable());
    }

    @Override
    public String toString() {
      return "Cursor[" + this.index + "]";
    }
  }

  private static final class ElementList<E> extends AbstractList<E> implements RandomAccess {
    private final OrderedHash<E, E> ht;

    ElementList(final OrderedHash<E, E> ht) {
      this.ht = ht;
    }

    @Override
    public E get(int index) {
      Objects.checkIndex(index, this.ht.size());
      return this.ht.get(index);
    }

    @Override
    public int size() {
      return this.ht.size();
    }
  }
}
