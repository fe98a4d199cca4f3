package io.github.themoah.kfcli.filter;

import java.util.Objects;

/**
 * A parsed filter: a field path, an operator and a literal.
 *
 * @param literal literal text, unquoted; never coerced at parse time
 */
public record FilterExpression(
  FieldPath path,
  ComparisonOperator operator,
  String literal
) {

  public FilterExpression {
    Objects.requireNonNull(path, "path cannot be null");
    Objects.requireNonNull(operator, "operator cannot be null");
    Objects.requireNonNull(literal, "literal cannot be null");
  }

  @Override
  public String toString() {
    return path + operator.symbol() + literal;
  }
}
