package dev.dylanburati.orderedmap;

import java.util.AbstractCollection;
import java.util.AbstractList;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.RandomAccess;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Hash map which remembers the order in which keys were first inserted.
 *
 * Entries live in a dense value store, in insertion order and with no gaps, so iteration is
 * over a plain sequence and every entry has a stable position {@code 0 <= i < size()} until an
 * earlier entry is removed. Lookups go through a separate open-addressing index table using
 * robin hood hashing; removals use backward shift deletion, so no tombstones build up.
 *
 * {@link #remove(Object)} and the other ordered erasures are O(n) since later entries move
 * left. When order doesn't matter, {@link #unorderedErase(Object)} is O(1): it moves the last
 * entry into the removed entry's position.
 *
 * Iterators, cursors and views are invalidated by any structural modification (insertion of a
 * new key, removal, clear, rehash, reserve, swap), after which they throw
 * {@link ConcurrentModificationException}. Replacing the value of an existing key is not
 * structural. The map is not thread-safe.
 */
public class OrderedMap<K, V> extends AbstractMap<K, V> implements Cloneable {
  public static final int DEFAULT_BUCKET_COUNT = GrowthPolicy.DEFAULT_BUCKET_COUNT;
  public static final float DEFAULT_MAX_LOAD_FACTOR = GrowthPolicy.DEFAULT_MAX_LOAD_FACTOR;

  private final OrderedHash<K, Node<K, V>> ht;

  public OrderedMap() {
    this(DEFAULT_BUCKET_COUNT);
  }

  public OrderedMap(int bucketCount) {
    this(bucketCount, Hasher.defaultHasher(), KeyEquality.<K>natural());
  }

  public OrderedMap(int bucketCount, final Hasher hasher, final KeyEquality<? super K> keyEquality) {
    this(bucketCount, hasher, keyEquality, StorageLayout.CONTIGUOUS);
  }

  public OrderedMap(int bucketCount, final Hasher hasher, final KeyEquality<? super K> keyEquality,
      final StorageLayout layout) {
    this(new OrderedHash<K, Node<K, V>>(bucketCount, hasher, keyEquality, Node::getKey, layout,
        DEFAULT_MAX_LOAD_FACTOR, OrderedHash.DEFAULT_MAX_SIZE, IndexTable.MAX_BUCKET_COUNT));
  }

  public OrderedMap(final Map<? extends K, ? extends V> m) {
    this(DEFAULT_BUCKET_COUNT);
    this.putAll(m);
  }

  private OrderedMap(final OrderedHash<K, Node<K, V>> ht) {
    this.ht = ht;
  }

  /** Map refusing to hold more than {@code maxSize} entries. */
  static <K, V> OrderedMap<K, V> withMaxSize(int bucketCount, int maxSize) {
    return withLimits(bucketCount, Hasher.defaultHasher(), maxSize, IndexTable.MAX_BUCKET_COUNT);
  }

  /** Map whose index table never grows past {@code maxBucketCount}, a power of two. */
  static <K, V> OrderedMap<K, V> withLimits(int bucketCount, final Hasher hasher, int maxSize, int maxBucketCount) {
    return new OrderedMap<K, V>(new OrderedHash<K, Node<K, V>>(bucketCount, hasher, KeyEquality.<K>natural(),
        Node::getKey, StorageLayout.CONTIGUOUS, DEFAULT_MAX_LOAD_FACTOR, maxSize, maxBucketCount));
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
  public boolean containsKey(Object key) {
    return this.ht.find(key) >= 0;
  }

  @Override
  public boolean containsValue(Object value) {
    for (int i = 0; i < this.ht.size(); i++) {
      if (Objects.equals(this.ht.get(i).value, value)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public V get(Object key) {
    return this.getOrDefault(key, null);
  }

  @Override
  public V getOrDefault(Object key, V defaultValue) {
    int idx = this.ht.find(key);
    if (idx < 0) {
      return defaultValue;
    }
    return this.ht.get(idx).value;
  }

  /** Inserts or assigns, returning the previous value. */
  @Override
  public V put(K key, V value) {
    int encoded = this.ht.insert(key, this.ht.hash(key), () -> new Node<>(key, value));
    if (encoded >= 0) {
      return null;
    }
    Node<K, V> node = this.ht.get(-encoded - 1);
    V prev = node.value;
    node.value = value;
    return prev;
  }

  @Override
  public V putIfAbsent(K key, V value) {
    int encoded = this.ht.insert(key, this.ht.hash(key), () -> new Node<>(key, value));
    if (encoded >= 0) {
      return null;
    }
    Node<K, V> node = this.ht.get(-encoded - 1);
    if (node.value == null) {
      node.value = value;
      return null;
    }
    return node.value;
  }

  /**
   * Reserves room for all of {@code m} once, then inserts its entries in {@code m}'s iteration
   * order. Existing keys are assigned, and keep their position.
   */
  @Override
  public void putAll(Map<? extends K, ? extends V> m) {
    this.ht.reserveForInsertion(m.size());
    for (Map.Entry<? extends K, ? extends V> e : m.entrySet()) {
      this.put(e.getKey(), e.getValue());
    }
  }

  /**
   * Inserts {@code (key, value)} unless {@code key} is present. An existing value is never
   * changed.
   */
  public InsertResult insert(K key, V value) {
    return InsertResult.fromEncoded(this.ht.insert(key, this.ht.hash(key), () -> new Node<>(key, value)));
  }

  public InsertResult insert(Map.Entry<? extends K, ? extends V> entry) {
    return this.insert(entry.getKey(), entry.getValue());
  }

  /** Inserts {@code (key, value)}, or assigns {@code value} to the existing key in place. */
  public InsertResult insertOrAssign(K key, V value) {
    int encoded = this.ht.insert(key, this.ht.hash(key), () -> new Node<>(key, value));
    if (encoded < 0) {
      this.ht.get(-encoded - 1).value = value;
    }
    return InsertResult.fromEncoded(encoded);
  }

  /**
   * Inserts {@code key} with a value from {@code valueFactory}, which is only called when the
   * key is absent. {@code tryEmplace(key, Foo::new).index()} followed by {@link #valueAt} is the
   * get-or-default-insert idiom.
   */
  public InsertResult tryEmplace(K key, Supplier<? extends V> valueFactory) {
    Objects.requireNonNull(valueFactory);
    return InsertResult.fromEncoded(this.ht.insert(key, this.ht.hash(key), () -> new Node<>(key, valueFactory.get())));
  }

  @Override
  public V replace(K key, V value) {
    int idx = this.ht.find(key);
    if (idx >= 0) {
      Node<K, V> node = this.ht.get(idx);
      V prev = node.value;
      node.value = value;
      return prev;
    }
    return null;
  }

  @Override
  public boolean replace(K key, V oldValue, V newValue) {
    int idx = this.ht.find(key);
    if (idx >= 0 && Objects.equals(this.ht.get(idx).value, oldValue)) {
      this.ht.get(idx).value = newValue;
      return true;
    }
    return false;
  }

  /** Ordered removal: later entries move one position left. */
  @Override
  public V remove(Object key) {
    int b = this.ht.findBucket(key, this.ht.hash(key));
    if (b < 0) {
      return null;
    }
    return this.ht.eraseBucket(b).value;
  }

  @Override
  public boolean remove(Object key, Object value) {
    int b = this.ht.findBucket(key, this.ht.hash(key));
    if (b >= 0 && Objects.equals(this.ht.entryInBucket(b).value, value)) {
      this.ht.eraseBucket(b);
      return true;
    }
    return false;
  }

  @Override
  public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
    Objects.requireNonNull(mappingFunction);
    int hash = this.ht.hash(key);
    int b = this.ht.findBucket(key, hash);
    if (b >= 0 && this.ht.entryInBucket(b).value != null) {
      return this.ht.entryInBucket(b).value;
    }
    int mc = this.ht.modCount();
    V value = mappingFunction.apply(key);
    if (this.ht.modCount() != mc) {
      throw new ConcurrentModificationException();
    }
    if (value == null) {
      return null;
    }
    if (b >= 0) {
      this.ht.entryInBucket(b).value = value;
    } else {
      this.ht.insert(key, hash, () -> new Node<>(key, value));
    }
    return value;
  }

  @Override
  public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    Objects.requireNonNull(remappingFunction);
    int b = this.ht.findBucket(key, this.ht.hash(key));
    if (b < 0 || this.ht.entryInBucket(b).value == null) {
      return null;
    }
    int mc = this.ht.modCount();
    V result = remappingFunction.apply(key, this.ht.entryInBucket(b).value);
    if (this.ht.modCount() != mc) {
      throw new ConcurrentModificationException();
    }
    if (result != null) {
      this.ht.entryInBucket(b).value = result;
    } else {
      this.ht.eraseBucket(b);
    }
    return result;
  }

  @Override
  public V compute(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    Objects.requireNonNull(remappingFunction);
    int hash = this.ht.hash(key);
    int b = this.ht.findBucket(key, hash);
    V prev = b >= 0 ? this.ht.entryInBucket(b).value : null;
    int mc = this.ht.modCount();
    V result = remappingFunction.apply(key, prev);
    if (this.ht.modCount() != mc) {
      throw new ConcurrentModificationException();
    }
    if (result == null) {
      if (b >= 0) {
        this.ht.eraseBucket(b);
      }
      return null;
    }
    if (b >= 0) {
      this.ht.entryInBucket(b).value = result;
    } else {
      this.ht.insert(key, hash, () -> new Node<>(key, result));
    }
    return result;
  }

  @Override
  public V merge(K key, V value, BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
    Objects.requireNonNull(remappingFunction);
    Objects.requireNonNull(value);
    int hash = this.ht.hash(key);
    int b = this.ht.findBucket(key, hash);
    if (b < 0) {
      this.ht.insert(key, hash, () -> new Node<>(key, value));
      return value;
    }
    Node<K, V> node = this.ht.entryInBucket(b);
    if (node.value == null) {
      node.value = value;
      return value;
    }
    int mc = this.ht.modCount();
    V result = remappingFunction.apply(node.value, value);
    if (this.ht.modCount() != mc) {
      throw new ConcurrentModificationException();
    }
    if (result != null) {
      node.value = result;
    } else {
      this.ht.eraseBucket(b);
    }
    return result;
  }

  @Override
  public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
    Objects.requireNonNull(function);
    int mc = this.ht.modCount();
    for (int i = 0; i < this.ht.size(); i++) {
      Node<K, V> node = this.ht.get(i);
      node.value = function.apply(node.key, node.value);
      if (this.ht.modCount() != mc) {
        throw new ConcurrentModificationException();
      }
    }
  }

  @Override
  public void clear() {
    this.ht.clear();
  }

  // ---- erasure by position or key

  /** Ordered removal of the entry at {@code index}. Returns the index of the entry that followed it. */
  public int eraseAt(int index) {
    return this.ht.eraseAt(index);
  }

  /** Ordered removal of the entries in {@code [fromIndex, toIndex)}. Returns {@code fromIndex}. */
  public int eraseRange(int fromIndex, int toIndex) {
    return this.ht.eraseRange(fromIndex, toIndex);
  }

  /** Ordered removal; returns the number of entries removed, 0 or 1. */
  public int erase(Object key) {
    return this.ht.erase(key, this.ht.hash(key));
  }

  /**
   * Like {@link #erase(Object)}, with {@code hash} already computed by {@link #hashFunction()}
   * for {@code key}.
   */
  public int erase(Object key, int precalculatedHash) {
    return this.ht.erase(key, precalculatedHash);
  }

  /**
   * Removes the entry at {@code index} in O(1) by moving the last entry into its position. The
   * relative order of all other entries is unchanged. Returns {@code index}.
   */
  public int unorderedEraseAt(int index) {
    return this.ht.unorderedEraseAt(index);
  }

  /** @see #unorderedEraseAt(int) */
  public int unorderedErase(Object key) {
    return this.ht.unorderedErase(key, this.ht.hash(key));
  }

  /** @see #unorderedEraseAt(int) */
  public int unorderedErase(Object key, int precalculatedHash) {
    return this.ht.unorderedErase(key, precalculatedHash);
  }

  /** Removes and returns the most recently inserted entry, or null if empty. */
  public Map.Entry<K, V> pollLastEntry() {
    if (this.isEmpty()) {
      return null;
    }
    int last = this.ht.size() - 1;
    Node<K, V> node = this.ht.get(last);
    this.ht.eraseAt(last);
    return new AbstractMap.SimpleImmutableEntry<>(node);
  }

  // ---- lookup

  /** Position of {@code key} in insertion order. */
  public OptionalInt find(Object key) {
    return this.find(key, this.ht.hash(key));
  }

  public OptionalInt find(Object key, int precalculatedHash) {
    int idx = this.ht.find(key, precalculatedHash);
    return idx < 0 ? OptionalInt.empty() : OptionalInt.of(idx);
  }

  /**
   * Value of {@code key}, which may be null.
   *
   * @throws NoSuchElementException if the key isn't present
   */
  public V at(Object key) {
    return this.at(key, this.ht.hash(key));
  }

  public V at(Object key, int precalculatedHash) {
    int idx = this.ht.find(key, precalculatedHash);
    if (idx < 0) {
      throw new NoSuchElementException("Couldn't find the key.");
    }
    return this.ht.get(idx).value;
  }

  public int count(Object key) {
    return this.ht.find(key) >= 0 ? 1 : 0;
  }

  public int count(Object key, int precalculatedHash) {
    return this.ht.find(key, precalculatedHash) >= 0 ? 1 : 0;
  }

  /** Read-only window over the entries equal to {@code key}: empty, or the single matching entry. */
  public List<Map.Entry<K, V>> equalRange(Object key) {
    return this.equalRange(key, this.ht.hash(key));
  }

  public List<Map.Entry<K, V>> equalRange(Object key, int precalculatedHash) {
    int idx = this.ht.find(key, precalculatedHash);
    if (idx < 0) {
      return List.of();
    }
    return this.valuesContainer().subList(idx, idx + 1);
  }

  // ---- positional access

  /** Entry at {@code index} in insertion order. Its value can be set, its key can't. */
  public Map.Entry<K, V> entryAt(int index) {
    Objects.checkIndex(index, this.ht.size());
    return this.ht.get(index);
  }

  public K keyAt(int index) {
    Objects.checkIndex(index, this.ht.size());
    return this.ht.get(index).key;
  }

  public V valueAt(int index) {
    Objects.checkIndex(index, this.ht.size());
    return this.ht.get(index).value;
  }

  public V setValueAt(int index, V value) {
    Objects.checkIndex(index, this.ht.size());
    Node<K, V> node = this.ht.get(index);
    V prev = node.value;
    node.value = value;
    return prev;
  }

  /** Oldest entry, or null if empty. */
  public Map.Entry<K, V> firstEntry() {
    return this.isEmpty() ? null : this.ht.get(0);
  }

  /** Newest entry, or null if empty. */
  public Map.Entry<K, V> lastEntry() {
    return this.isEmpty() ? null : this.ht.get(this.ht.size() - 1);
  }

  /** Cursor at {@code index}, which may be {@code size()} for the end position. */
  public Cursor<K, V> cursor(int index) {
    Objects.checkIndex(index, this.ht.size() + 1);
    return new Cursor<>(this.ht, index, this.ht.modCount());
  }

  public Cursor<K, V> begin() {
    return this.cursor(0);
  }

  public Cursor<K, V> end() {
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

  /**
   * Sets the load factor past which the index table grows, in {@code (0, 1]}. A lower value
   * than the current load factor rebuilds the index table right away.
   *
   * @throws IllegalArgumentException if the factor is out of range, or the current entries
   *   would need more than {@link #maxBucketCount()} buckets under it
   */
  public void maxLoadFactor(float maxLoadFactor) {
    this.ht.maxLoadFactor(maxLoadFactor);
  }

  /**
   * Rebuilds the index table with at least {@code count} buckets, and at least enough for the
   * current size under the max load factor. May shrink the table.
   */
  public void rehash(int count) {
    this.ht.rehash(count);
  }

  /** Makes room for {@code count} entries without growing the index table or the value store. */
  public void reserve(int count) {
    this.ht.reserve(count);
  }

  /** Number of entries the value store holds before it has to allocate. */
  public int capacity() {
    return this.ht.capacity();
  }

  /** Releases value store space beyond the current size. */
  public void trimToSize() {
    this.ht.trimToSize();
  }

  // ---- observers

  public Hasher hashFunction() {
    return this.ht.hasher();
  }

  public KeyEquality<? super K> keyEq() {
    return this.ht.keyEquality();
  }

  /** Read-only, random-access view of the value store: the entries in insertion order. */
  public List<Map.Entry<K, V>> valuesContainer() {
    return new EntryList<>(this.ht);
  }

  /** Exchanges the contents, hashing strategy and settings of the two maps in O(1). */
  public void swap(OrderedMap<K, V> other) {
    this.ht.swap(other.ht);
  }

  /** Whether both maps hold equal entries in the same order. */
  public boolean equalsInOrder(OrderedMap<?, ?> other) {
    if (other.size() != this.size()) {
      return false;
    }
    for (int i = 0; i < this.ht.size(); i++) {
      Node<K, V> a = this.ht.get(i);
      Node<?, ?> b = other.ht.get(i);
      if (!Objects.equals(a.key, b.key) || !Objects.equals(a.value, b.value)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Set<K> keySet() {
    return new KeySet<>(this);
  }

  @Override
  public Collection<V> values() {
    return new Values<>(this);
  }

  @Override
  public Set<Map.Entry<K, V>> entrySet() {
    return new EntrySet<>(this);
  }

  /** Iterates over the entries from newest to oldest. {@code remove()} is supported. */
  public Iterator<Map.Entry<K, V>> descendingIterator() {
    return new OrderedIterator<>(this.ht, true, this.ht::get);
  }

  /**
   * Creates a copy of this map with the same order and settings. Keys and values themselves
   * are not cloned.
   */
  @Override
  public OrderedMap<K, V> clone() {
    return new OrderedMap<>(this.ht.copy(n -> new Node<>(n.key, n.value)));
  }

  /** Throws {@link AssertionError} if the index table is inconsistent. */
  void verify() {
    this.ht.verify();
  }

  static final class Node<K, V> implements Map.Entry<K, V> {
    final K key;
    V value;

    Node(K key, V value) {
      this.key = key;
      this.value = value;
    }

    @Override
    public K getKey() {
      return this.key;
    }

    @Override
    public V getValue() {
      return this.value;
    }

    @Override
    public V setValue(V value) {
      V prev = this.value;
      this.value = value;
      return prev;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.key, e.getKey()) && Objects.equals(this.value, e.getValue());
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(this.key) ^ Objects.hashCode(this.value);
    }

    @Override
    public String toString() {
      return this.key + "=" + this.value;
    }
  }

  /**
   * Random-access position in a map's insertion order. The key is read-only; the value can be
   * replaced through {@link #setValue}.
   */
  public static final class Cursor<K, V> extends AbstractCursor<Cursor<K, V>> {
    private final OrderedHash<K, Node<K, V>> owner;

    Cursor(final OrderedHash<K, Node<K, V>> owner, int index, int expectedModCount) {
      super(owner, index, expectedModCount);
      this.owner = owner;
    }

    @Override
    Cursor<K, V> at(int index) {
      return new Cursor<>(this.owner, index, this.expectedModCount);
    }

    public K key() {
      return this.owner.get(this.checkDereferenceable()).key;
    }

    public V value() {
      return this.owner.get(this.checkDereferenceable()).value;
    }

    public V setValue(V value) {
      return this.owner.get(this.checkDereferenceable()).setValue(value);
    }

    public Map.Entry<K, V> entry() {
      return this.owner.get(this.checkDereferenceable());
    }

    @Override
    public String toString() {
      return "Cursor[" + this.index + "]";
    }
  }

  // start of section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static class KeySet<K> extends AbstractSet<K> {
    private final OrderedMap<K, ?> owner;
    protected KeySet(final OrderedMap<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<K> iterator() {
      return new OrderedIterator<>(owner.ht, false, owner::keyAt);
    }
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }
    public final boolean remove(Object key) {
      return owner.erase(key) == 1;
    }

    public final void forEach(Consumer<? super K> action) {
      if (action == null) {
        throw new NullPointerException();
      }
      int mc = owner.ht.modCount();
      for (int src = 0; src < owner.ht.size(); src++) {
        action.accept(owner.ht.keyAt(src));
        if (owner.ht.modCount() != mc) {
          throw new ConcurrentModificationException();
        }
      }
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final OrderedMap<?, V> owner;
    protected Values(final OrderedMap<?, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<V> iterator() {
      return new OrderedIterator<>(owner.ht, false, owner::valueAt);
    }
    public final boolean contains(Object o) {
      return owner.containsValue(o);
    }

    public final void forEach(Consumer<? super V> action) {
      if (action == null) {
        throw new NullPointerException();
      }
      int mc = owner.ht.modCount();
      for (int src = 0; src < owner.ht.size(); src++) {
        action.accept(owner.ht.get(src).value);
        if (owner.ht.modCount() != mc) {
          throw new ConcurrentModificationException();
        }
      }
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final OrderedMap<K, V> owner;
    protected EntrySet(final OrderedMap<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      return new OrderedIterator<>(owner.ht, false, owner.ht::get);
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      int idx = owner.ht.find(e.getKey());
      return idx >= 0 && Objects.equals(owner.ht.get(idx).value, e.getValue());
    }
    public final boolean remove(Object o) {
      if (o instanceof Map.Entry<?, ?>) {
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
        return owner.remove(e.getKey(), e.getValue());
      }
      return false;
    }
    public final void forEach(Consumer<? super Map.Entry<K, V>> action) {
      if (action == null) {
        throw new NullPointerException();
      }
      int mc = owner.ht.modCount();
      for (int src = 0; src < owner.ht.size(); src++) {
        action.accept(owner.ht.get(src));
        if (owner.ht.modCount() != mc) {
          throw new ConcurrentModificationException();
        }
      }
    }
  }

  // end section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  private static final class EntryList<K, V> extends AbstractList<Map.Entry<K, V>> implements RandomAccess {
    private final OrderedHash<K, Node<K, V>> ht;

    EntryList(final OrderedHash<K, Node<K, V>> ht) {
      this.ht = ht;
    }

    @Override
    public Map.Entry<K, V> get(int index) {
      Objects.checkIndex(index, this.ht.size());
      return new AbstractMap.SimpleImmutableEntry<>(this.ht.get(index));
    }

    @Override
    public int size() {
      return this.ht.size();
    }
  }
}
