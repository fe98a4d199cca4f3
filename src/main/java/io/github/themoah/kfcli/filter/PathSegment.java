package io.github.themoah.kfcli.filter;

/**
 * One step of a field path: an object key or an array index.
 */
public interface PathSegment {

  /**
   * Selects a member of an object by name.
   */
  record Key(String name) implements PathSegment {

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Selects an element of an array by position.
   */
  record Index(int position) implements PathSegment {

    public Index {
      if (position < 0) {
        throw new IllegalArgumentException("position must be >= 0, got " + position);
      }
    }

    @Override
    public String toString() {
      return "[" + position + "]";
    }
  }
}
