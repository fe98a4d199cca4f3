package io.github.themoah.kfcli.kafka;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.TailMessage;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.kafka.client.common.TopicPartition;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import io.vertx.kafka.client.consumer.KafkaConsumerRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MessageFetcher backed by Vert.x Kafka consumers, one consumer per partition.
 * Partitions are assigned manually, so no consumer group is joined.
 */
public class KafkaMessageFetcher implements MessageFetcher {

  private static final Logger log = LoggerFactory.getLogger(KafkaMessageFetcher.class);

  private final Map<String, String> consumerProperties;
  private final Function<Map<String, String>, KafkaConsumer<byte[], byte[]>> consumerFactory;
  private final Duration pollTimeout;
  private final Map<TopicPartitionKey, PartitionReader> readers = new ConcurrentHashMap<>();

  /**
   * Creates a new KafkaMessageFetcher.
   *
   * @param vertx the Vert.x instance
   * @param config the Kafka client configuration
   * @param pollTimeout how long a fetch waits for new data
   * @param maxPollRecords maximum batch size
   */
  public KafkaMessageFetcher(Vertx vertx, KafkaClientConfig config, Duration pollTimeout, int maxPollRecords) {
    this(config, pollTimeout, maxPollRecords, consumerFactory(vertx));
  }

  /**
   * Creates a new KafkaMessageFetcher whose partition consumers come from the given factory.
   *
   * @param consumerFactory creates a consumer from the tail consumer properties
   */
  KafkaMessageFetcher(KafkaClientConfig config, Duration pollTimeout, int maxPollRecords,
                      Function<Map<String, String>, KafkaConsumer<byte[], byte[]>> consumerFactory) {
    this.consumerProperties = Objects.requireNonNull(config, "config cannot be null")
      .toConsumerProperties(maxPollRecords);
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout cannot be null");
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory cannot be null");
  }

  private static Function<Map<String, String>, KafkaConsumer<byte[], byte[]>> consumerFactory(Vertx vertx) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    return properties -> KafkaConsumer.create(vertx, properties, byte[].class, byte[].class);
  }

  @Override
  public Future<Void> assign(Collection<TopicPartitionKey> partitions) {
    log.debug("Assigning {} partitions", partitions.size());

    List<Future<Void>> assignments = partitions.stream()
      .map(key -> {
        KafkaConsumer<byte[], byte[]> consumer = consumerFactory.apply(consumerProperties);
        PartitionReader reader = new PartitionReader(key, consumer);
        readers.put(key, reader);
        return consumer.assign(reader.topicPartition);
      })
      .collect(Collectors.toList());

    return Future.all(assignments)
      .<Void>mapEmpty()
      .onSuccess(v -> log.info("Assigned partitions: {}", partitions))
      .onFailure(err -> log.error("Failed to assign partitions: {}", partitions, err));
  }

  @Override
  public Future<List<TailMessage>> fetch(TopicPartitionKey partition, long fromOffset) {
    PartitionReader reader = readers.get(partition);
    if (reader == null) {
      return Future.failedFuture(new IllegalStateException("Partition not assigned: " + partition));
    }
    return reader.fetch(fromOffset);
  }

  @Override
  public Future<Void> close() {
    if (readers.isEmpty()) {
      return Future.succeededFuture();
    }
    log.info("Closing {} partition consumers", readers.size());
    List<Future<Void>> closing = readers.values().stream()
      .map(reader -> reader.consumer.close())
      .collect(Collectors.toList());
    readers.clear();
    return Future.join(closing)
      .<Void>mapEmpty()
      .onSuccess(v -> log.info("Partition consumers closed"))
      .onFailure(err -> log.error("Failed to close partition consumers", err));
  }

  /**
   * Reads a single partition, seeking only when the requested offset differs from the
   * consumer position.
   */
  private final class PartitionReader {

    private final TopicPartitionKey key;
    private final TopicPartition topicPartition;
    private final KafkaConsumer<byte[], byte[]> consumer;
    private long position = -1;

    PartitionReader(TopicPartitionKey key, KafkaConsumer<byte[], byte[]> consumer) {
      this.key = key;
      this.topicPartition = new TopicPartition(key.topic(), key.partition());
      this.consumer = consumer;
    }

    Future<List<TailMessage>> fetch(long fromOffset) {
      Future<Void> positioned = position == fromOffset
        ? Future.succeededFuture()
        : consumer.seek(topicPartition, fromOffset);

      return positioned
        .compose(v -> consumer.poll(pollTimeout))
        .map(records -> {
          List<TailMessage> batch = new ArrayList<>(records.size());
          for (int i = 0; i < records.size(); i++) {
            batch.add(toMessage(records.recordAt(i)));
          }
          position = batch.isEmpty() ? fromOffset : batch.get(batch.size() - 1).offset() + 1;
          log.debug("Fetched {} messages from {} at offset {}", batch.size(), key, fromOffset);
          return batch;
        });
    }

    private TailMessage toMessage(KafkaConsumerRecord<byte[], byte[]> record) {
      return new TailMessage(
        record.topic(),
        record.partition(),
        record.offset(),
        record.key(),
        record.value(),
        record.timestamp()
      );
    }
  }
}
