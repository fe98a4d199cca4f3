package io.github.themoah.kfcli.filter;

import java.util.List;

/**
 * Ordered path into a payload tree, e.g. {@code data.items[0].name}.
 */
public record FieldPath(List<PathSegment> segments) {

  public FieldPath {
    segments = List.copyOf(segments);
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("path must have at least one segment");
    }
    if (!(segments.get(0) instanceof PathSegment.Key)) {
      throw new IllegalArgumentException("path must start with a key");
    }
  }

  /**
   * Renders the path in filter syntax: keys joined by dots, indices in brackets.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (PathSegment segment : segments) {
      if (segment instanceof PathSegment.Key && sb.length() > 0) {
        sb.append('.');
      }
      sb.append(segment);
    }
    return sb.toString();
  }
}
