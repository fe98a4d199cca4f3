package io.github.themoah.kfcli.model;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;

/**
 * A message read from a topic partition while tailing.
 *
 * @param key message key, null if the message has none
 * @param payload message value, null for tombstones
 * @param timestamp broker or producer timestamp in epoch milliseconds
 */
public record TailMessage(
  String topic,
  int partition,
  long offset,
  byte[] key,
  byte[] payload,
  long timestamp
) {

  public TopicPartitionKey topicPartition() {
    return new TopicPartitionKey(topic, partition);
  }
}
