package io.github.themoah.kfcli.filter;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Comparison between a value found in a payload and the literal of a filter.
 */
public enum ComparisonOperator {

  /**
   * Numeric equality when both sides are numbers, string equality otherwise.
   * {@code 19} therefore matches both the number 19 and the string "19".
   */
  EQUALS("=") {
    @Override
    public boolean test(Object value, String literal) {
      Optional<BigDecimal> number = toNumber(value);
      Optional<BigDecimal> literalNumber = toNumber(literal);
      if (number.isPresent() && literalNumber.isPresent()) {
        return number.get().compareTo(literalNumber.get()) == 0;
      }
      return toText(value).equals(literal);
    }
  };

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /**
   * Compares a resolved payload value with the literal text of a filter.
   *
   * @param value a JSON value: JsonObject, JsonArray, String, Number, Boolean or
   *              {@link PathAccessor.JsonNull}
   * @param literal the literal as written in the filter
   */
  public abstract boolean test(Object value, String literal);

  static Optional<BigDecimal> toNumber(Object value) {
    if (value instanceof Number || value instanceof String) {
      try {
        return Optional.of(new BigDecimal(value.toString()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  static String toText(Object value) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof JsonObject object) {
      return object.encode();
    }
    if (value instanceof JsonArray array) {
      return array.encode();
    }
    return String.valueOf(value);
  }
}
