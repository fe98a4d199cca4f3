package io.github.themoah.kfcli.filter;

/**
 * Raised when a filter expression cannot be parsed.
 */
public class FilterSyntaxException extends RuntimeException {

  private final String token;
  private final int position;

  /**
   * @param reason what is wrong
   * @param token the offending token, empty when the input ended early
   * @param position zero based position of the token in the expression
   */
  public FilterSyntaxException(String reason, String token, int position) {
    super("Invalid filter: " + reason + " at position " + position
      + (token.isEmpty() ? "" : " near '" + token + "'"));
    this.token = token;
    this.position = position;
  }

  public String getToken() {
    return token;
  }

  public int getPosition() {
    return position;
  }
}
