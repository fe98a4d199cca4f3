package io.github.themoah.kfcli.model;

/**
 * Possible consumer group states.
 * Mirrors org.apache.kafka.common.ConsumerGroupState.
 */
public enum ConsumerGroupState {
  UNKNOWN("Unknown"),
  PREPARING_REBALANCE("PreparingRebalance"),
  COMPLETING_REBALANCE("CompletingRebalance"),
  STABLE("Stable"),
  DEAD("Dead"),
  EMPTY("Empty");

  private final String displayName;

  ConsumerGroupState(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Converts from Kafka's ConsumerGroupState to this enum.
   *
   * @param kafkaState the Kafka consumer group state
   * @return the corresponding state, UNKNOWN for null or unmapped states
   */
  public static ConsumerGroupState fromKafkaState(org.apache.kafka.common.ConsumerGroupState kafkaState) {
    if (kafkaState == null) {
      return UNKNOWN;
    }
    return switch (kafkaState) {
      case PREPARING_REBALANCE -> PREPARING_REBALANCE;
      case COMPLETING_REBALANCE -> COMPLETING_REBALANCE;
      case STABLE -> STABLE;
      case DEAD -> DEAD;
      case EMPTY -> EMPTY;
      default -> UNKNOWN;
    };
  }

  /**
   * Returns the name the broker uses for this state, as shown to operators.
   */
  public String displayName() {
    return displayName;
  }
}
