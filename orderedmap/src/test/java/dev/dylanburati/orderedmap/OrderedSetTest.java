package dev.dylanburati.orderedmap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.Set;

import static dev.dylanburati.orderedmap.Helpers.*;

class OrderedSetTest {
  @Test void testAddKeepsFirstPosition() {
    OrderedSet<String> s = new OrderedSet<>();
    assertTrue(s.add("b"));
    assertTrue(s.add("a"));
    assertFalse(s.add("b"));
    assertTrue(s.add("c"));
    assertEquals(List.of("b", "a", "c"), new ArrayList<>(s));
    assertEquals(new InsertResult(1, false), s.insert("a"));
    assertEquals(new InsertResult(3, true), s.insert("d"));
    s.verify();
  }

  @Test void testAddAll() {
    OrderedSet<Integer> s = new OrderedSet<>(List.of(3, 1, 2));
    assertFalse(s.addAll(List.of(1, 2)));
    assertTrue(s.addAll(List.of(2, 4)));
    assertEquals(List.of(3, 1, 2, 4), new ArrayList<>(s));
    assertEquals(Set.of(1, 2, 3, 4), s);
  }

  @ParameterizedTest
  @EnumSource(StorageLayout.class)
  void testOrderedAndUnorderedErase(StorageLayout layout) {
    OrderedSet<Integer> s = new OrderedSet<>(4, Hasher.defaultHasher(), KeyEquality.natural(), layout);
    for (int i = 0; i < 2000; i++) {
      s.add(i);
    }
    for (int i = 0; i < 2000; i += 2) {
      assertTrue(s.remove(i));
    }
    assertFalse(s.remove(0));
    assertEquals(1000, s.size());
    assertEquals(1, s.get(0));
    assertEquals(1999, s.last());
    s.verify();

    assertEquals(0, s.unorderedEraseAt(0));
    assertEquals(1999, s.first());
    assertEquals(1997, s.last());
    assertEquals(1, s.unorderedErase(3));
    assertEquals(1997, s.get(1));
    assertEquals(0, s.unorderedErase(3));
    assertEquals(0, s.erase(3, s.hashFunction().hash(3)));
    assertEquals(1, s.erase(5));
    s.verify();
  }

  @Test void testRemoveIf() {
    OrderedSet<Integer> s = new OrderedSet<>(16, CLUSTERING, KeyEquality.natural());
    for (int i = 0; i < 100; i++) {
      s.add(i);
    }
    assertTrue(s.removeIf(i -> i % 10 < 3 || i > 90));
    assertFalse(s.removeIf(i -> i > 90));
    List<Integer> expected = new ArrayList<>();
    for (int i = 0; i <= 90; i++) {
      if (i % 10 >= 3) {
        expected.add(i);
      }
    }
    assertEquals(expected, new ArrayList<>(s));
    for (int i = 0; i < expected.size(); i++) {
      assertEquals(OptionalInt.of(i), s.find(expected.get(i)));
    }
    s.verify();
  }

  @Test void testLookup() {
    OrderedSet<String> s = new OrderedSet<>();
    s.add("x");
    s.add("y");
    assertTrue(s.contains("y"));
    assertFalse(s.contains("z"));
    assertEquals(OptionalInt.of(1), s.find("y"));
    assertEquals(OptionalInt.of(1), s.find("y", s.hashFunction().hash("y")));
    assertEquals(OptionalInt.empty(), s.find("z"));
    assertEquals("x", s.at("x"));
    assertThrows(NoSuchElementException.class, () -> s.at("z"));
    assertEquals(1, s.count("x"));
    assertEquals(0, s.count("z"));
    assertEquals(List.of("y"), s.equalRange("y"));
    assertEquals(List.of(), s.equalRange("z"));
  }

  @Test void testPositionalAccess() {
    OrderedSet<String> s = new OrderedSet<>();
    assertThrows(NoSuchElementException.class, s::first);
    assertThrows(NoSuchElementException.class, s::last);
    assertNull(s.pollLast());
    s.add("a");
    s.add("b");
    s.add("c");
    assertEquals("a", s.first());
    assertEquals("c", s.last());
    assertEquals("b", s.get(1));
    assertThrows(IndexOutOfBoundsException.class, () -> s.get(3));
    assertEquals("c", s.pollLast());
    assertEquals(List.of("a", "b"), s.valuesContainer());
    assertEquals(0, s.eraseRange(0, 1));
    assertEquals(List.of("b"), new ArrayList<>(s));
    assertEquals(0, s.eraseAt(0));
    assertTrue(s.isEmpty());
  }

  @Test void testIterators() {
    OrderedSet<Integer> s = new OrderedSet<>();
    for (int i = 0; i < 6; i++) {
      s.add(i);
    }
    assertEquals(List.of(5, 4, 3, 2, 1, 0), drain(s.descendingIterator()));
    for (Iterator<Integer> it = s.iterator(); it.hasNext(); ) {
      if (it.next() % 2 == 1) {
        it.remove();
      }
    }
    assertEquals(List.of(0, 2, 4), new ArrayList<>(s));

    Iterator<Integer> it = s.iterator();
    s.add(6);
    assertThrows(ConcurrentModificationException.class, it::next);
    assertThrows(ConcurrentModificationException.class, () -> s.forEach(i -> s.remove(6)));
    s.verify();
  }

  @Test void testCursors() {
    OrderedSet<String> s = new OrderedSet<>();
    s.add("a");
    s.add("b");
    OrderedSet.Cursor<String> c = s.begin();
    assertEquals("a", c.get());
    assertEquals("b", c.next().get());
    assertTrue(c.plus(2).isEnd());
    assertEquals(s.end(), c.plus(2));
    assertEquals(2, s.end().distanceFrom(c));
    assertThrows(NoSuchElementException.class, () -> s.end().get());
    s.add("c");
    assertThrows(ConcurrentModificationException.class, c::get);
  }

  @Test void testGrowthAndHashPolicy() {
    OrderedSet<Integer> s = new OrderedSet<>();
    assertEquals(16, s.bucketCount());
    s.reserve(100);
    assertEquals(128, s.bucketCount());
    assertTrue(s.capacity() >= 100);
    for (int i = 0; i < 100; i++) {
      s.add(i);
    }
    assertEquals(128, s.bucketCount());
    assertEquals(100 / 128.0f, s.loadFactor());
    s.maxLoadFactor(0.5f);
    assertEquals(0.5f, s.maxLoadFactor());
    // 100 elements need 200 buckets at 0.5
    assertEquals(256, s.bucketCount());
    s.verify();
    s.add(100);
    assertEquals(256, s.bucketCount());
    s.rehash(0);
    assertEquals(256, s.bucketCount());
    s.trimToSize();
    assertEquals(101, s.capacity());
    assertEquals(1 << 30, s.maxBucketCount());
    s.verify();
  }

  @Test void testMaxSize() {
    OrderedSet<Integer> s = OrderedSet.withMaxSize(4, 2);
    s.add(1);
    s.add(2);
    assertFalse(s.add(2));
    assertThrows(IllegalStateException.class, () -> s.add(3));
    assertEquals(2, s.maxSize());
    assertEquals(List.of(1, 2), new ArrayList<>(s));

    OrderedSet<Integer> small = OrderedSet.withLimits(4, Hasher.defaultHasher(), Integer.MAX_VALUE - 8, 8);
    // (int) (8 * 0.9)
    assertEquals(7, small.maxSize());
    for (int i = 0; i < 7; i++) {
      assertTrue(small.add(i));
    }
    assertEquals(8, small.bucketCount());
    assertThrows(IllegalStateException.class, () -> small.add(7));
    small.verify();
  }

  @Test void testCloneSwapAndEquality() {
    OrderedSet<String> a = new OrderedSet<>(List.of("x", "y", "z"));
    OrderedSet<String> b = a.clone();
    assertTrue(b.equalsInOrder(a));
    b.remove("x");
    b.add("x");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertFalse(b.equalsInOrder(a));

    OrderedSet<String> c = new OrderedSet<>(List.of("q"));
    a.swap(c);
    assertEquals(List.of("q"), new ArrayList<>(a));
    assertEquals(List.of("x", "y", "z"), new ArrayList<>(c));
    assertSame(KeyEquality.natural(), a.keyEq());
    a.verify();
    c.verify();
  }

  @Test void testCollidingHasher() {
    OrderedSet<String> s = new OrderedSet<>(256, COLLIDING, KeyEquality.natural(), StorageLayout.CHUNKED);
    for (int i = 0; i < 100; i++) {
      s.add("e" + i);
    }
    for (int i = 0; i < 100; i += 5) {
      assertEquals(1, s.unorderedErase("e" + i));
      s.verify();
    }
    assertEquals(80, s.size());
    for (int i = 0; i < 100; i++) {
      assertEquals(i % 5 != 0, s.contains("e" + i));
    }
  }
}
