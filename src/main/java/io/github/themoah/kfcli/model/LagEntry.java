package io.github.themoah.kfcli.model;

import java.util.OptionalLong;

/**
 * Lag of a consumer group on a single partition.
 *
 * <p>Lag is only known when both the end offset and the committed offset are known.
 * An unknown lag is never reported as zero.
 */
public record LagEntry(
  String topic,
  int partition,
  OptionalLong endOffset,
  OptionalLong committedOffset,
  OptionalLong lag
) {

  /**
   * Creates an entry, computing lag as end offset minus committed offset (never negative).
   */
  public static LagEntry of(String topic, int partition, OptionalLong endOffset, OptionalLong committedOffset) {
    OptionalLong lag = endOffset.isPresent() && committedOffset.isPresent()
      ? OptionalLong.of(Math.max(0, endOffset.getAsLong() - committedOffset.getAsLong()))
      : OptionalLong.empty();
    return new LagEntry(topic, partition, endOffset, committedOffset, lag);
  }

  public boolean isLagKnown() {
    return lag.isPresent();
  }
}
