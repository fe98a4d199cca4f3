package io.github.themoah.kfcli.kafka;

/**
 * Raised when offsets for a topic cannot be retrieved.
 * Isolated to the affected partitions; never aborts a whole lag aggregation.
 */
public class OffsetUnavailableException extends RuntimeException {

  private final String topic;

  public OffsetUnavailableException(String topic, Throwable cause) {
    super("Offsets unavailable for topic " + topic, cause);
    this.topic = topic;
  }

  public String getTopic() {
    return topic;
  }
}
