package dev.dylanburati.orderedmap;

/**
 * Outcome of an insertion: the position of the entry with the given key in insertion order,
 * and whether that entry was created by the call.
 */
public final class InsertResult {
  private final int index;
  private final boolean inserted;

  InsertResult(int index, boolean inserted) {
    this.index = index;
    this.inserted = inserted;
  }

  // decodes the return value of OrderedHash.insert
  static InsertResult fromEncoded(int encoded) {
    return encoded >= 0 ? new InsertResult(encoded, true) : new InsertResult(-encoded - 1, false);
  }

  public int index() {
    return this.index;
  }

  public boolean inserted() {
    return this.inserted;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof InsertResult)) {
      return false;
    }
    InsertResult other = (InsertResult) o;
    return this.index == other.index && this.inserted == other.inserted;
  }

  @Override
  public int hashCode() {
    return 31 * this.index + (this.inserted ? 1 : 0);
  }

  @Override
  public String toString() {
    return "InsertResult[index=" + this.index + ", inserted=" + this.inserted + "]";
  }
}
