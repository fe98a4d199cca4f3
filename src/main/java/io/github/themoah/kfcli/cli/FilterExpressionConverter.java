package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.filter.FilterExpression;
import io.github.themoah.kfcli.filter.FilterExpressionParser;
import io.github.themoah.kfcli.filter.FilterSyntaxException;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Parses {@code --filter} while the command line is parsed, before any command runs.
 */
public class FilterExpressionConverter implements ITypeConverter<FilterExpression> {

  @Override
  public FilterExpression convert(String value) {
    try {
      return FilterExpressionParser.parse(value);
    } catch (FilterSyntaxException e) {
      throw new TypeConversionException(e.getMessage());
    }
  }
}
