package dev.dylanburati.orderedmap;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;

@State(Scope.Benchmark)
public class OrderedMapBenchmark {
  private static final int WORDS = 20_000_000;
  private static final int KEYS = 1_000_000;

  private String[] keys;

  @Setup(Level.Trial)
  public void setup() {
    this.keys = new String[KEYS];
    Random r = new Random(1L);
    for (int i = 0; i < KEYS; i++) {
      this.keys[i] = Long.toHexString(r.nextLong());
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountOrderedMap(Blackhole bh) {
    bh.consume(wordcount(new OrderedMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountLinkedHashMap(Blackhole bh) {
    bh.consume(wordcount(new LinkedHashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountHashMap(Blackhole bh) {
    bh.consume(wordcount(new HashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountObject2IntLinkedMap(Blackhole bh) {
    bh.consume(wordcount(new Object2IntLinkedOpenHashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnOrderedMap(Blackhole bh) {
    OrderedMap<String, Integer> m = new OrderedMap<>();
    m.reserve(KEYS);
    for (int i = 0; i < KEYS; i++) {
      m.put(this.keys[i], i);
    }
    // ordered erase would be quadratic here
    for (int i = 0; i < KEYS; i += 2) {
      m.unorderedErase(this.keys[i]);
    }
    bh.consume(iterate(m));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnLinkedHashMap(Blackhole bh) {
    Map<String, Integer> m = new LinkedHashMap<>(KEYS * 2);
    for (int i = 0; i < KEYS; i++) {
      m.put(this.keys[i], i);
    }
    for (int i = 0; i < KEYS; i += 2) {
      m.remove(this.keys[i]);
    }
    bh.consume(iterate(m));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnObject2IntLinkedMap(Blackhole bh) {
    Object2IntLinkedOpenHashMap<String> m = new Object2IntLinkedOpenHashMap<>(KEYS);
    for (int i = 0; i < KEYS; i++) {
      m.put(this.keys[i], i);
    }
    for (int i = 0; i < KEYS; i += 2) {
      m.removeInt(this.keys[i]);
    }
    bh.consume(iterate(m));
  }

  private static long iterate(Map<String, Integer> m) {
    long sum = 0;
    for (Iterator<Map.Entry<String, Integer>> it = m.entrySet().iterator(); it.hasNext(); ) {
      Map.Entry<String, Integer> e = it.next();
      sum += e.getKey().length() + e.getValue();
    }
    return sum;
  }

  // Word ids follow a power law with exponent close to 1, like word frequencies in English text.
  // Inverting the cdf of (x+1) ** -1.01 on [0, 2**24] gives this closed form.
  private static int wordId(double uniform) {
    return (int) Math.pow(1.0 - 0.1531 * uniform, -100.0) - 1;
  }

  static int wordcount(Map<String, Integer> m) {
    byte[] alph = "etaoinsh".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[16];
    Random r = new Random(0L);
    for (int i = 0; i < WORDS; i++) {
      int id = wordId(r.nextDouble());
      int len = 0;
      do {
        wbuf[len++] = alph[id & 7];
        id >>>= 3;
      } while (id != 0);
      m.merge(new String(wbuf, 0, len, StandardCharsets.US_ASCII), 1, Integer::sum);
    }
    System.out.println("Size: " + m.size());
    return m.size();
  }
}
