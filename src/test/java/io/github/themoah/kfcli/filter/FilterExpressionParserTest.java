package io.github.themoah.kfcli.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FilterExpressionParser.
 */
public class FilterExpressionParserTest {

  @Test
  void parse_dottedPath() {
    FilterExpression expression = FilterExpressionParser.parse("data.attributes.name=19");

    assertEquals(List.of(
      new PathSegment.Key("data"),
      new PathSegment.Key("attributes"),
      new PathSegment.Key("name")
    ), expression.path().segments());
    assertEquals(ComparisonOperator.EQUALS, expression.operator());
    assertEquals("19", expression.literal());
  }

  @Test
  void parse_indexedPath() {
    FilterExpression expression = FilterExpressionParser.parse("items[0].tags[12][3].name=foo");

    assertEquals(List.of(
      new PathSegment.Key("items"),
      new PathSegment.Index(0),
      new PathSegment.Key("tags"),
      new PathSegment.Index(12),
      new PathSegment.Index(3),
      new PathSegment.Key("name")
    ), expression.path().segments());
  }

  @Test
  void path_reserializesToOriginalForm() {
    for (String path : List.of("a", "data.attributes.name", "items[0].name", "matrix[1][2]", "a.b[3].c")) {
      FilterExpression expression = FilterExpressionParser.parse(path + "=x");
      assertEquals(path, expression.path().toString());
      assertEquals(path + "=x", expression.toString());
    }
  }

  @Test
  void parse_ignoresWhitespaceAroundOperator() {
    FilterExpression expression = FilterExpressionParser.parse("  user.id =  42 ");

    assertEquals("user.id", expression.path().toString());
    assertEquals("42", expression.literal());
  }

  @Test
  void parse_quotedLiteral_keepsSpacesAndOperator() {
    FilterExpression expression = FilterExpressionParser.parse("name=\"John = Smith\"");

    assertEquals("John = Smith", expression.literal());
  }

  @Test
  void parse_quotedLiteral_unescapesQuotesAndBackslashes() {
    FilterExpression expression = FilterExpressionParser.parse("msg=\"say \\\"hi\\\" \\\\o/\"");

    assertEquals("say \"hi\" \\o/", expression.literal());
  }

  @Test
  void parse_literalIsNotCoerced() {
    assertEquals("019", FilterExpressionParser.parse("a=019").literal());
    assertEquals("true", FilterExpressionParser.parse("a=true").literal());
  }

  @Test
  void parse_emptyExpression_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("  "));

    assertEquals(0, e.getPosition());
  }

  @Test
  void parse_missingOperator_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("data.name"));

    assertTrue(e.getMessage().contains("missing operator"));
    assertEquals("data.name", e.getToken());
  }

  @Test
  void parse_emptyPath_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("=5"));

    assertTrue(e.getMessage().contains("empty path"));
  }

  @Test
  void parse_emptyLiteral_fails() {
    assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("a.b="));
    assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("a.b=   "));
    assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("a.b=\"\""));
  }

  @Test
  void parse_emptySegment_reportsPosition() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("a..b=1"));

    assertEquals(2, e.getPosition());
    assertEquals(".", e.getToken());
  }

  @Test
  void parse_trailingDot_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("a.=1"));

    assertEquals(1, e.getPosition());
  }

  @Test
  void parse_invalidIndex_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("items[x]=1"));

    assertEquals("[x]", e.getToken());
    assertEquals(5, e.getPosition());
  }

  @Test
  void parse_negativeIndex_fails() {
    assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("items[-1]=1"));
  }

  @Test
  void parse_unclosedBracket_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("items[1=2"));

    assertTrue(e.getMessage().contains("unclosed"));
  }

  @Test
  void parse_pathStartingWithIndex_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("[0]=1"));

    assertEquals(0, e.getPosition());
    assertEquals("[", e.getToken());
  }

  @Test
  void parse_whitespaceInsidePath_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("user name=1"));

    assertEquals(4, e.getPosition());
  }

  @Test
  void parse_unsupportedOperator_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("a!=1"));

    assertEquals("!=", e.getToken());
    assertEquals(1, e.getPosition());
  }

  @Test
  void parse_secondOperator_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("a=1=2"));

    assertEquals(3, e.getPosition());
  }

  @Test
  void parse_unterminatedQuote_fails() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("a=\"abc"));

    assertTrue(e.getMessage().contains("unterminated"));
    assertEquals(2, e.getPosition());
  }

  @Test
  void parse_textAfterQuotedLiteral_fails() {
    assertThrows(FilterSyntaxException.class, () -> FilterExpressionParser.parse("a=\"x\"y"));
  }

  @Test
  void exceptionMessage_namesTokenAndPosition() {
    FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
      () -> FilterExpressionParser.parse("a..b=1"));

    assertEquals("Invalid filter: empty path segment at position 2 near '.'", e.getMessage());
  }
}
