package io.github.themoah.kfcli.kafka;

import io.github.themoah.kfcli.model.BrokerInfo;
import io.github.themoah.kfcli.model.ConsumerGroupDetails;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets;
import io.github.themoah.kfcli.model.PartitionOffsets;
import io.github.themoah.kfcli.model.TopicDetails;
import io.vertx.core.Future;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service interface for Kafka administrative operations.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface KafkaClientService {

  /**
   * Lists all topics in the Kafka cluster.
   *
   * @return Future containing set of topic names
   */
  Future<Set<String>> listTopics();

  /**
   * Describes a topic and its partitions.
   *
   * @param topic the topic name
   * @return Future containing the topic details
   */
  Future<TopicDetails> describeTopic(String topic);

  /**
   * Describes several topics at once.
   *
   * @param topics the topic names
   * @return Future containing map of topic name to details
   */
  Future<Map<String, TopicDetails>> describeTopics(Set<String> topics);

  /**
   * Gets the log end and log start offsets for all partitions of a topic.
   *
   * @param topic the topic name
   * @return Future containing list of partition offsets, ordered by partition
   */
  Future<List<PartitionOffsets>> getLogEndOffsets(String topic);

  /**
   * Gets the committed offsets for a consumer group.
   *
   * @param groupId the consumer group ID
   * @return Future containing the consumer group offsets
   */
  Future<ConsumerGroupOffsets> getConsumerGroupOffsets(String groupId);

  /**
   * Lists the broker nodes of the cluster.
   *
   * @return Future containing brokers ordered by id
   */
  Future<List<BrokerInfo>> listBrokers();

  /**
   * Lists all consumer groups in the Kafka cluster.
   *
   * @return Future containing set of consumer group IDs
   */
  Future<Set<String>> listConsumerGroups();

  /**
   * Describes consumer groups with their state and members.
   *
   * @param groupIds set of consumer group IDs to describe
   * @return Future containing map of group ID to details
   */
  Future<Map<String, ConsumerGroupDetails>> describeConsumerGroups(Set<String> groupIds);

  /**
   * Creates a topic.
   *
   * @param topic the topic name
   * @param partitions number of partitions
   * @param replicationFactor number of replicas per partition
   * @return Future that completes when the broker accepted the topic
   */
  Future<Void> createTopic(String topic, int partitions, short replicationFactor);

  /**
   * Deletes a topic.
   *
   * @param topic the topic name
   * @return Future that completes when the broker accepted the deletion
   */
  Future<Void> deleteTopic(String topic);

  /**
   * Closes the underlying Kafka admin client and releases resources.
   *
   * @return Future that completes when the client is closed
   */
  Future<Void> close();
}
