package io.github.themoah.kfcli.kafka;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.TailMessage;
import io.vertx.core.Future;
import java.util.Collection;
import java.util.List;

/**
 * Fetches batches of messages from individual partitions, starting at a given offset.
 *
 * <p>Read only: implementations never join a consumer group and never commit offsets.
 * Fetches for different partitions may run concurrently.
 */
public interface MessageFetcher {

  /**
   * Prepares the fetcher to read the given partitions.
   *
   * @param partitions partitions that will be fetched
   * @return Future that completes when the partitions are assigned
   */
  Future<Void> assign(Collection<TopicPartitionKey> partitions);

  /**
   * Fetches the next batch of a partition.
   * Waits up to the configured poll timeout when no data is available.
   *
   * @param partition an assigned partition
   * @param fromOffset offset of the first message wanted
   * @return Future containing messages in partition order, empty when nothing new arrived
   */
  Future<List<TailMessage>> fetch(TopicPartitionKey partition, long fromOffset);

  /**
   * Releases all partition subscriptions.
   *
   * @return Future that completes when every underlying consumer is closed
   */
  Future<Void> close();
}
