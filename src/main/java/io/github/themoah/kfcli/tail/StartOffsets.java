package io.github.themoah.kfcli.tail;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.PartitionOffsets;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Resolves where each partition loop starts reading.
 */
public final class StartOffsets {

  private StartOffsets() {}

  /**
   * Computes the start offset of every partition: {@code max(0, end - before)} when
   * {@code before} is set, the end offset otherwise. Depends only on its arguments.
   *
   * @param endOffsets end offsets of the topic's partitions
   * @param before messages to replay per partition
   * @return start offset per partition, in partition order
   */
  public static Map<TopicPartitionKey, Long> resolve(List<PartitionOffsets> endOffsets, OptionalLong before) {
    Map<TopicPartitionKey, Long> starts = new LinkedHashMap<>();
    endOffsets.stream()
      .sorted(Comparator.comparing(PartitionOffsets::topic).thenComparingInt(PartitionOffsets::partition))
      .forEach(po -> starts.put(
        new TopicPartitionKey(po.topic(), po.partition()),
        startOffset(po.logEndOffset(), before)
      ));
    return starts;
  }

  static long startOffset(long endOffset, OptionalLong before) {
    if (before.isEmpty()) {
      return endOffset;
    }
    return Math.max(0, endOffset - before.getAsLong());
  }
}
