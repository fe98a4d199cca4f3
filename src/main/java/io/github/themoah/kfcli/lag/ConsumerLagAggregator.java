package io.github.themoah.kfcli.lag;

import io.github.themoah.kfcli.kafka.BrokerUnavailableException;
import io.github.themoah.kfcli.kafka.KafkaClientService;
import io.github.themoah.kfcli.kafka.OffsetUnavailableException;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.LagEntry;
import io.github.themoah.kfcli.model.LagReport;
import io.github.themoah.kfcli.model.PartitionOffsets;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes per-partition and total lag of a consumer group.
 *
 * <p>Covers every partition of every topic the group has committed to. A topic whose end
 * offsets cannot be fetched does not fail the report; its partitions get an unknown lag.
 */
public class ConsumerLagAggregator {

  private static final Logger log = LoggerFactory.getLogger(ConsumerLagAggregator.class);

  private final KafkaClientService kafkaClient;

  public ConsumerLagAggregator(KafkaClientService kafkaClient) {
    this.kafkaClient = Objects.requireNonNull(kafkaClient, "kafkaClient cannot be null");
  }

  /**
   * Builds the lag report of a group.
   *
   * @param groupId the consumer group ID
   * @return Future containing the report, failed with {@link BrokerUnavailableException}
   *         if the committed offsets cannot be fetched
   */
  public Future<LagReport> aggregate(String groupId) {
    log.debug("Aggregating lag for group {}", groupId);

    return kafkaClient.getConsumerGroupOffsets(groupId)
      .recover(err -> Future.failedFuture(
        BrokerUnavailableException.wrap("Failed to fetch committed offsets for group " + groupId, err)))
      .compose(offsets -> {
        Set<String> topics = offsets.offsets().keySet().stream()
          .map(TopicPartitionKey::topic)
          .collect(Collectors.toCollection(TreeSet::new));

        List<Future<List<LagEntry>>> perTopic = topics.stream()
          .map(topic -> topicEntries(topic, offsets))
          .collect(Collectors.toList());

        return Future.all(perTopic).map(composite -> {
          List<LagEntry> entries = new ArrayList<>();
          for (int i = 0; i < perTopic.size(); i++) {
            List<LagEntry> topicEntries = composite.resultAt(i);
            entries.addAll(topicEntries);
          }
          return LagReport.fromEntries(groupId, entries);
        });
      })
      .onSuccess(report -> log.debug("Group {}: {} partitions, total lag {}",
        groupId, report.entries().size(), report.totalLagDisplay()))
      .onFailure(err -> log.error("Failed to aggregate lag for group {}", groupId, err));
  }

  private Future<List<LagEntry>> topicEntries(String topic, ConsumerGroupOffsets offsets) {
    return kafkaClient.getLogEndOffsets(topic)
      .map(endOffsets -> withEndOffsets(topic, endOffsets, offsets))
      .recover(err -> {
        OffsetUnavailableException unavailable = new OffsetUnavailableException(topic, err);
        log.warn("{}, reporting lag as unknown: {}", unavailable.getMessage(), err.getMessage());
        return Future.succeededFuture(withoutEndOffsets(topic, offsets));
      });
  }

  static List<LagEntry> withEndOffsets(String topic, List<PartitionOffsets> endOffsets,
                                       ConsumerGroupOffsets offsets) {
    List<LagEntry> entries = new ArrayList<>();
    Set<Integer> seen = new HashSet<>();
    for (PartitionOffsets po : endOffsets) {
      TopicPartitionKey key = new TopicPartitionKey(topic, po.partition());
      seen.add(po.partition());
      entries.add(LagEntry.of(topic, po.partition(), OptionalLong.of(po.logEndOffset()),
        offsets.committedOffset(key)));
    }
    // Committed partitions the broker did not report, e.g. after the topic shrank or was recreated
    offsets.offsets().keySet().forEach(key -> {
      if (key.topic().equals(topic) && !seen.contains(key.partition())) {
        entries.add(LagEntry.of(topic, key.partition(), OptionalLong.empty(), offsets.committedOffset(key)));
      }
    });
    return entries;
  }

  static List<LagEntry> withoutEndOffsets(String topic, ConsumerGroupOffsets offsets) {
    return offsets.offsets().entrySet().stream()
      .filter(e -> e.getKey().topic().equals(topic))
      .map(e -> LagEntry.of(topic, e.getKey().partition(), OptionalLong.empty(), offsets.committedOffset(e.getKey())))
      .collect(Collectors.toList());
  }
}
