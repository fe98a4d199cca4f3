package io.github.themoah.kfcli.model;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Committed offsets for a consumer group.
 *
 * <p>Only partitions with an actual commit are present in {@code offsets}.
 */
public record ConsumerGroupOffsets(
  String groupId,
  Map<TopicPartitionKey, Long> offsets
) {

  /**
   * Returns the committed offset for a partition, or empty if the group never committed to it.
   * A negative offset is the broker's marker for "no commit".
   */
  public OptionalLong committedOffset(TopicPartitionKey key) {
    Long offset = offsets.get(key);
    return offset == null || offset < 0 ? OptionalLong.empty() : OptionalLong.of(offset);
  }

  /**
   * Key identifying a topic-partition pair.
   */
  public record TopicPartitionKey(String topic, int partition) {

    @Override
    public String toString() {
      return topic + "-" + partition;
    }
  }
}
