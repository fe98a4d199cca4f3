package io.github.themoah.kfcli.kafka;

/**
 * Raised when the broker cannot be reached or a metadata request fails.
 * Fatal for the current invocation.
 */
public class BrokerUnavailableException extends RuntimeException {

  public BrokerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Wraps a failure, keeping it as is if it already is a BrokerUnavailableException.
   */
  public static BrokerUnavailableException wrap(String message, Throwable cause) {
    if (cause instanceof BrokerUnavailableException unavailable) {
      return unavailable;
    }
    return new BrokerUnavailableException(message, cause);
  }
}
