package io.github.themoah.kfcli.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PathAccessor.
 */
public class PathAccessorTest {

  private static final Object PAYLOAD = PayloadDecoder.decode((
    "{\"data\":{\"attributes\":{\"name\":\"alice\",\"age\":19,\"nickname\":null},"
      + "\"items\":[{\"sku\":\"a-1\"},{\"sku\":\"b-2\",\"tags\":[\"x\",\"y\"]}]}}"
  ).getBytes(StandardCharsets.UTF_8));

  private static Optional<Object> resolve(String path) {
    return PathAccessor.resolve(PAYLOAD, FilterExpressionParser.parsePath(path, 0));
  }

  @Test
  void resolve_nestedKeys() {
    assertEquals(Optional.of("alice"), resolve("data.attributes.name"));
    assertEquals(Optional.of(19), resolve("data.attributes.age"));
  }

  @Test
  void resolve_arrayIndices() {
    assertEquals(Optional.of("a-1"), resolve("data.items[0].sku"));
    assertEquals(Optional.of("y"), resolve("data.items[1].tags[1]"));
  }

  @Test
  void resolve_containerValues() {
    assertTrue(resolve("data.attributes").orElseThrow() instanceof JsonObject);
    assertTrue(resolve("data.items").orElseThrow() instanceof JsonArray);
  }

  @Test
  void resolve_containersInsideArrays_areJsonTypes() {
    assertTrue(resolve("data.items[0]").orElseThrow() instanceof JsonObject);
    assertTrue(resolve("data.items[1].tags").orElseThrow() instanceof JsonArray);
  }

  @Test
  void resolve_jsonNull_isDistinctFromMissing() {
    assertEquals(Optional.of(PathAccessor.JsonNull.INSTANCE), resolve("data.attributes.nickname"));
    assertEquals(Optional.empty(), resolve("data.attributes.email"));
  }

  @Test
  void resolve_missingKey_isEmpty() {
    assertEquals(Optional.empty(), resolve("data.missing.name"));
  }

  @Test
  void resolve_indexOutOfBounds_isEmpty() {
    assertEquals(Optional.empty(), resolve("data.items[2].sku"));
  }

  @Test
  void resolve_keyOnArray_isEmpty() {
    assertEquals(Optional.empty(), resolve("data.items.sku"));
  }

  @Test
  void resolve_indexOnObject_isEmpty() {
    assertEquals(Optional.empty(), resolve("data.attributes[0]"));
  }

  @Test
  void resolve_throughScalar_isEmpty() {
    assertEquals(Optional.empty(), resolve("data.attributes.name.first"));
    assertEquals(Optional.empty(), resolve("data.attributes.nickname.first"));
  }

  @Test
  void resolve_scalarRoot_isEmpty() {
    Object root = PayloadDecoder.decode("42".getBytes(StandardCharsets.UTF_8));

    assertEquals(Optional.empty(), PathAccessor.resolve(root, FilterExpressionParser.parsePath("a", 0)));
  }
}
