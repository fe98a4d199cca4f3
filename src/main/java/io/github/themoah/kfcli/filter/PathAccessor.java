package io.github.themoah.kfcli.filter;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.Optional;

/**
 * Resolves field paths against decoded payload trees.
 *
 * <p>Missing keys, out of bounds indices, a key applied to an array, an index applied to an
 * object, and any segment applied to a scalar all resolve to empty. A JSON null found at the
 * path resolves to {@link JsonNull#INSTANCE}.
 */
public final class PathAccessor {

  /**
   * Marker for a JSON null present in the payload.
   */
  public enum JsonNull {
    INSTANCE;

    @Override
    public String toString() {
      return "null";
    }
  }

  private PathAccessor() {}

  /**
   * Resolves the path against a payload tree.
   *
   * @param root decoded payload, as returned by {@link PayloadDecoder#decode(byte[])}
   * @param path the path to follow
   * @return the value at the path, or empty if the path does not resolve
   */
  public static Optional<Object> resolve(Object root, FieldPath path) {
    Object current = wrapNull(root);
    for (PathSegment segment : path.segments()) {
      Optional<Object> next = step(current, segment);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    return Optional.of(current);
  }

  private static Optional<Object> step(Object node, PathSegment segment) {
    if (segment instanceof PathSegment.Key key) {
      return member(node, key.name());
    }
    if (segment instanceof PathSegment.Index index) {
      return element(node, index.position());
    }
    return Optional.empty();
  }

  private static Optional<Object> member(Object node, String name) {
    if (node instanceof JsonObject object) {
      return object.containsKey(name) ? Optional.of(wrapNull(object.getValue(name))) : Optional.empty();
    }
    return Optional.empty();
  }

  private static Optional<Object> element(Object node, int position) {
    if (node instanceof JsonArray array) {
      return position < array.size() ? Optional.of(wrapNull(array.getValue(position))) : Optional.empty();
    }
    return Optional.empty();
  }

  private static Object wrapNull(Object value) {
    return value == null ? JsonNull.INSTANCE : value;
  }
}
