package io.github.themoah.kfcli.tail;

import io.github.themoah.kfcli.filter.FilterExpression;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * What to tail.
 *
 * @param topic the topic name
 * @param before number of messages per partition to replay before the live tail, empty for live only
 * @param filter filter applied to each message, empty to print everything
 */
public record TailRequest(
  String topic,
  OptionalLong before,
  Optional<FilterExpression> filter
) {

  public TailRequest {
    Objects.requireNonNull(topic, "topic cannot be null");
    Objects.requireNonNull(before, "before cannot be null");
    Objects.requireNonNull(filter, "filter cannot be null");
    if (topic.isBlank()) {
      throw new IllegalArgumentException("topic cannot be blank");
    }
    if (before.isPresent() && before.getAsLong() < 0) {
      throw new IllegalArgumentException("before must be >= 0, got " + before.getAsLong());
    }
  }

  public static TailRequest live(String topic) {
    return new TailRequest(topic, OptionalLong.empty(), Optional.empty());
  }
}
