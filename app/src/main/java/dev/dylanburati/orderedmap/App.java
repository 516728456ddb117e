package dev.dylanburati.orderedmap;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Counts simulated words with the chosen map, then prints the number of distinct words and the
 * first ones seen.
 *
 * <pre>
 *   App [orderedmap|java.util|fastutil] [wordCount]
 * </pre>
 */
public class App {
  private static final int SHOWN = 10;

  // power law over [0, 2**24], see OrderedMapBenchmark
  private static int wordId(double uniform) {
    return (int) Math.pow(1.0 - 0.1531 * uniform, -100.0) - 1;
  }

  public static Map<String, Integer> wordcount(Map<String, Integer> m, int wordCount) {
    byte[] alph = "etaoinsh".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[16];
    Random r = new Random(0L);
    for (int i = 0; i < wordCount; i++) {
      int id = wordId(r.nextDouble());
      int len = 0;
      do {
        wbuf[len++] = alph[id & 7];
        id >>>= 3;
      } while (id != 0);
      m.merge(new String(wbuf, 0, len, StandardCharsets.US_ASCII), 1, Integer::sum);
    }
    return m;
  }

  public static void main(String[] args) {
    Map<String, Integer> m;
    switch (args.length > 0 ? args[0] : "") {
      case "java.util":
        m = new LinkedHashMap<String, Integer>();
        break;
      case "fastutil":
        m = new Object2IntLinkedOpenHashMap<String>();
        break;
      default:
        m = new OrderedMap<String, Integer>();
        break;
    }
    int wordCount = args.length > 1 ? Integer.parseInt(args[1]) : 10_000_000;
    wordcount(m, wordCount);
    System.out.println("Size: " + m.size());

    StringBuilder first = new StringBuilder("First:");
    Iterator<Map.Entry<String, Integer>> it = m.entrySet().iterator();
    for (int i = 0; i < SHOWN && it.hasNext(); i++) {
      Map.Entry<String, Integer> e = it.next();
      first.append(' ').append(e.getKey()).append('=').append(e.getValue());
    }
    System.out.println(first);
  }
}
