package io.github.themoah.kfcli.filter;

/**
 * Outcome of evaluating a filter against one message.
 */
public enum FilterResult {
  MATCHED,
  UNMATCHED,
  /** Payload was not valid JSON; treated as a non-match. */
  UNDECODABLE;

  public boolean isMatch() {
    return this == MATCHED;
  }
}
