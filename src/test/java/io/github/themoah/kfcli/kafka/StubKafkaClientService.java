package io.github.themoah.kfcli.kafka;

import io.github.themoah.kfcli.model.BrokerInfo;
import io.github.themoah.kfcli.model.ConsumerGroupDetails;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets;
import io.github.themoah.kfcli.model.PartitionInfo;
import io.github.themoah.kfcli.model.PartitionOffsets;
import io.github.themoah.kfcli.model.TopicDetails;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * In-memory KafkaClientService for tests. Unknown topics and groups fail like a broker would.
 */
public class StubKafkaClientService implements KafkaClientService {

  private final Map<String, List<PartitionOffsets>> endOffsets = new HashMap<>();
  private final Map<String, ConsumerGroupOffsets> groupOffsets = new HashMap<>();
  private final Map<String, ConsumerGroupDetails> groups = new HashMap<>();
  private final List<BrokerInfo> brokers = new ArrayList<>();
  private final Set<String> failingTopics = new HashSet<>();
  private final List<String> createdTopics = new ArrayList<>();
  private final List<String> deletedTopics = new ArrayList<>();
  private final AtomicInteger endOffsetRequests = new AtomicInteger();
  private boolean unavailable;
  private boolean closed;

  /**
   * Adds a topic whose partitions have the given end offsets and a log start of 0.
   */
  public StubKafkaClientService withTopic(String topic, long... partitionEndOffsets) {
    endOffsets.put(topic, IntStream.range(0, partitionEndOffsets.length)
      .mapToObj(p -> new PartitionOffsets(topic, p, partitionEndOffsets[p], 0))
      .collect(Collectors.toList()));
    return this;
  }

  /**
   * Makes end offset requests for the topic fail.
   */
  public StubKafkaClientService withFailingTopic(String topic) {
    failingTopics.add(topic);
    return this;
  }

  public StubKafkaClientService withGroupOffsets(ConsumerGroupOffsets offsets) {
    groupOffsets.put(offsets.groupId(), offsets);
    return this;
  }

  public StubKafkaClientService withGroup(ConsumerGroupDetails details) {
    groups.put(details.groupId(), details);
    return this;
  }

  public StubKafkaClientService withBroker(BrokerInfo broker) {
    brokers.add(broker);
    return this;
  }

  /**
   * Makes every request fail as if no broker could be reached.
   */
  public StubKafkaClientService unavailable() {
    this.unavailable = true;
    return this;
  }

  public List<String> createdTopics() {
    return createdTopics;
  }

  public List<String> deletedTopics() {
    return deletedTopics;
  }

  public int endOffsetRequests() {
    return endOffsetRequests.get();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public Future<Set<String>> listTopics() {
    if (unavailable) {
      return unavailableFuture();
    }
    return Future.succeededFuture(new HashSet<>(endOffsets.keySet()));
  }

  @Override
  public Future<TopicDetails> describeTopic(String topic) {
    return describeTopics(Set.of(topic)).map(details -> details.get(topic));
  }

  @Override
  public Future<Map<String, TopicDetails>> describeTopics(Set<String> topics) {
    if (unavailable) {
      return unavailableFuture();
    }
    Map<String, TopicDetails> result = new HashMap<>();
    for (String topic : topics) {
      List<PartitionOffsets> offsets = endOffsets.get(topic);
      if (offsets == null) {
        return Future.failedFuture(new IllegalArgumentException("Unknown topic " + topic));
      }
      List<PartitionInfo> partitions = offsets.stream()
        .map(po -> new PartitionInfo(topic, po.partition(), 1, List.of(1), List.of(1)))
        .collect(Collectors.toList());
      result.put(topic, new TopicDetails(topic, false, partitions));
    }
    return Future.succeededFuture(result);
  }

  @Override
  public Future<List<PartitionOffsets>> getLogEndOffsets(String topic) {
    endOffsetRequests.incrementAndGet();
    if (unavailable) {
      return unavailableFuture();
    }
    if (failingTopics.contains(topic)) {
      return Future.failedFuture(new IllegalStateException("Leader not available for " + topic));
    }
    List<PartitionOffsets> offsets = endOffsets.get(topic);
    if (offsets == null) {
      return Future.failedFuture(new IllegalArgumentException("Unknown topic " + topic));
    }
    return Future.succeededFuture(List.copyOf(offsets));
  }

  @Override
  public Future<ConsumerGroupOffsets> getConsumerGroupOffsets(String groupId) {
    if (unavailable) {
      return unavailableFuture();
    }
    return Future.succeededFuture(groupOffsets.getOrDefault(groupId, new ConsumerGroupOffsets(groupId, Map.of())));
  }

  @Override
  public Future<List<BrokerInfo>> listBrokers() {
    return unavailable ? unavailableFuture() : Future.succeededFuture(List.copyOf(brokers));
  }

  @Override
  public Future<Set<String>> listConsumerGroups() {
    return unavailable ? unavailableFuture() : Future.succeededFuture(new HashSet<>(groups.keySet()));
  }

  @Override
  public Future<Map<String, ConsumerGroupDetails>> describeConsumerGroups(Set<String> groupIds) {
    if (unavailable) {
      return unavailableFuture();
    }
    Map<String, ConsumerGroupDetails> result = new HashMap<>();
    groupIds.stream().filter(groups::containsKey).forEach(id -> result.put(id, groups.get(id)));
    return Future.succeededFuture(result);
  }

  @Override
  public Future<Void> createTopic(String topic, int partitions, short replicationFactor) {
    if (unavailable) {
      return unavailableFuture();
    }
    createdTopics.add(topic + ":" + partitions + ":" + replicationFactor);
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> deleteTopic(String topic) {
    if (unavailable) {
      return unavailableFuture();
    }
    deletedTopics.add(topic);
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    closed = true;
    return Future.succeededFuture();
  }

  private static <T> Future<T> unavailableFuture() {
    return Future.failedFuture(new IllegalStateException("Connection to node -1 could not be established"));
  }
}
