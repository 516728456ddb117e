package dev.dylanburati.orderedmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  public static <T> List<T> drain(Iterator<T> it) {
    List<T> result = new ArrayList<>();
    it.forEachRemaining(result::add);
    return result;
  }

  /** Sends every key to the same bucket. */
  public static final Hasher COLLIDING = key -> 0;

  /** Few distinct hashes, so probe chains overlap and wrap around. */
  public static final Hasher CLUSTERING = key -> key == null ? 0 : Math.floorMod(key.hashCode(), 5) * 3;
}
