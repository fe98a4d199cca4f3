package io.github.themoah.kfcli.tail;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.PartitionOffsets;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StartOffsets.
 */
public class StartOffsetsTest {

  private static final List<PartitionOffsets> END_OFFSETS = List.of(
    new PartitionOffsets("orders", 0, 10, 0),
    new PartitionOffsets("orders", 1, 20, 0),
    new PartitionOffsets("orders", 2, 5, 0)
  );

  @Test
  void resolve_withBefore_subtractsFromEnd() {
    Map<TopicPartitionKey, Long> starts = StartOffsets.resolve(END_OFFSETS, OptionalLong.of(3));

    assertEquals(List.of(7L, 17L, 2L), List.copyOf(starts.values()));
  }

  @Test
  void resolve_beforeLargerThanEnd_clampsToZero() {
    Map<TopicPartitionKey, Long> starts = StartOffsets.resolve(END_OFFSETS, OptionalLong.of(15));

    assertEquals(List.of(0L, 5L, 0L), List.copyOf(starts.values()));
  }

  @Test
  void resolve_withoutBefore_startsAtEnd() {
    Map<TopicPartitionKey, Long> starts = StartOffsets.resolve(END_OFFSETS, OptionalLong.empty());

    assertEquals(List.of(10L, 20L, 5L), List.copyOf(starts.values()));
  }

  @Test
  void resolve_beforeZero_startsAtEnd() {
    Map<TopicPartitionKey, Long> starts = StartOffsets.resolve(END_OFFSETS, OptionalLong.of(0));

    assertEquals(List.of(10L, 20L, 5L), List.copyOf(starts.values()));
  }

  @Test
  void resolve_ordersByPartition() {
    List<PartitionOffsets> unordered = List.of(
      new PartitionOffsets("orders", 2, 5, 0),
      new PartitionOffsets("orders", 0, 10, 0),
      new PartitionOffsets("orders", 1, 20, 0)
    );

    Map<TopicPartitionKey, Long> starts = StartOffsets.resolve(unordered, OptionalLong.of(3));

    assertEquals(List.of(
      new TopicPartitionKey("orders", 0),
      new TopicPartitionKey("orders", 1),
      new TopicPartitionKey("orders", 2)
    ), List.copyOf(starts.keySet()));
  }

  @Test
  void resolve_isIdempotent() {
    assertEquals(
      StartOffsets.resolve(END_OFFSETS, OptionalLong.of(4)),
      StartOffsets.resolve(END_OFFSETS, OptionalLong.of(4))
    );
  }
}
