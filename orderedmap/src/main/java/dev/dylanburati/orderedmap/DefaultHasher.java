package dev.dylanburati.orderedmap;

/* package-private */ final class DefaultHasher implements Hasher {
  private static final DefaultHasher INSTANCE = new DefaultHasher();

  private DefaultHasher() {}

  static DefaultHasher instance() {
    return INSTANCE;
  }

  @Override
  public int hash(Object key) {
    // https://github.com/cbreeden/fxhash/blob/master/lib.rs, folded so the high bits reach the mask
    int h = (key == null ? 0 : key.hashCode()) * 0x9E3779B9;
    return h ^ (h >>> 16);
  }

  @Override
  public String toString() {
    return "DefaultHasher";
  }
}
