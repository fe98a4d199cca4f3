package io.github.themoah.kfcli.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Single pass parser for filter expressions.
 *
 * <pre>
 * expression := path "=" literal
 * path       := segment ("." segment)*
 * segment    := identifier ("[" integer "]")*
 * literal    := quoted-string | bare-token
 * </pre>
 *
 * Whitespace around the operator is ignored. Quoted strings support {@code \"} and
 * {@code \\} escapes and may contain {@code =}; bare tokens may not.
 */
public final class FilterExpressionParser {

  private static final char OPERATOR = '=';
  private static final char QUOTE = '"';

  private FilterExpressionParser() {}

  /**
   * Parses a filter expression.
   *
   * @param input the expression, e.g. {@code data.attributes.name=19}
   * @return the parsed expression
   * @throws FilterSyntaxException if the expression is malformed
   */
  public static FilterExpression parse(String input) {
    if (input == null || input.isBlank()) {
      throw new FilterSyntaxException("empty expression", "", 0);
    }

    int operatorIndex = input.indexOf(OPERATOR);
    if (operatorIndex < 0) {
      throw new FilterSyntaxException("missing operator '='", input.trim(), input.length());
    }
    if (operatorIndex > 0 && "!<>".indexOf(input.charAt(operatorIndex - 1)) >= 0) {
      throw new FilterSyntaxException("unsupported operator",
        input.substring(operatorIndex - 1, operatorIndex + 1), operatorIndex - 1);
    }

    String left = input.substring(0, operatorIndex);
    String right = input.substring(operatorIndex + 1);

    int pathStart = leadingWhitespace(left);
    String pathText = left.trim();
    if (pathText.isEmpty()) {
      throw new FilterSyntaxException("empty path", "=", operatorIndex);
    }

    int literalStart = operatorIndex + 1 + leadingWhitespace(right);
    String literalText = right.trim();
    if (literalText.isEmpty()) {
      throw new FilterSyntaxException("empty literal", "", input.length());
    }

    FieldPath path = parsePath(pathText, pathStart);
    String literal = parseLiteral(literalText, literalStart);
    return new FilterExpression(path, ComparisonOperator.EQUALS, literal);
  }

  /**
   * Parses a dotted field path such as {@code items[2].name}.
   *
   * @param text the path
   * @param offset position of the path in the whole expression, for error reporting
   */
  static FieldPath parsePath(String text, int offset) {
    List<PathSegment> segments = new ArrayList<>();
    int length = text.length();
    int i = 0;

    while (true) {
      int start = i;
      while (i < length && !isPathDelimiter(text.charAt(i))) {
        i++;
      }
      if (i == start) {
        String token = i < length ? String.valueOf(text.charAt(i)) : "";
        throw new FilterSyntaxException("empty path segment", token, offset + i);
      }
      segments.add(new PathSegment.Key(text.substring(start, i)));

      while (i < length && text.charAt(i) == '[') {
        int close = text.indexOf(']', i);
        if (close < 0) {
          throw new FilterSyntaxException("unclosed '['", text.substring(i), offset + i);
        }
        String digits = text.substring(i + 1, close);
        segments.add(new PathSegment.Index(parseIndex(digits, offset + i)));
        i = close + 1;
      }

      if (i == length) {
        break;
      }
      char c = text.charAt(i);
      if (c != '.') {
        throw new FilterSyntaxException("unexpected character", String.valueOf(c), offset + i);
      }
      i++;
      if (i == length) {
        throw new FilterSyntaxException("empty path segment", ".", offset + i - 1);
      }
    }
    return new FieldPath(segments);
  }

  private static int parseIndex(String digits, int position) {
    if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
      throw new FilterSyntaxException("invalid array index", "[" + digits + "]", position);
    }
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw new FilterSyntaxException("array index out of range", "[" + digits + "]", position);
    }
  }

  private static String parseLiteral(String text, int offset) {
    if (text.charAt(0) != QUOTE) {
      int extraOperator = text.indexOf(OPERATOR);
      if (extraOperator >= 0) {
        throw new FilterSyntaxException("more than one operator", "=", offset + extraOperator);
      }
      return text;
    }

    StringBuilder value = new StringBuilder();
    int i = 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        char escaped = text.charAt(i + 1);
        if (escaped != QUOTE && escaped != '\\') {
          throw new FilterSyntaxException("invalid escape", "\\" + escaped, offset + i);
        }
        value.append(escaped);
        i += 2;
        continue;
      }
      if (c == QUOTE) {
        if (i != text.length() - 1) {
          throw new FilterSyntaxException("unexpected text after quoted literal",
            text.substring(i + 1), offset + i + 1);
        }
        if (value.length() == 0) {
          throw new FilterSyntaxException("empty literal", "\"\"", offset);
        }
        return value.toString();
      }
      value.append(c);
      i++;
    }
    throw new FilterSyntaxException("unterminated quoted string", text, offset);
  }

  private static boolean isPathDelimiter(char c) {
    return c == '.' || c == '[' || c == ']' || c == QUOTE || Character.isWhitespace(c);
  }

  private static int leadingWhitespace(String text) {
    int i = 0;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }
}
