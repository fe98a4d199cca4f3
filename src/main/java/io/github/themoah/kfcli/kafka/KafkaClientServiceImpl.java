package io.github.themoah.kfcli.kafka;

import io.github.themoah.kfcli.model.BrokerInfo;
import io.github.themoah.kfcli.model.ConsumerGroupDetails;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.ConsumerGroupState;
import io.github.themoah.kfcli.model.PartitionInfo;
import io.github.themoah.kfcli.model.PartitionOffsets;
import io.github.themoah.kfcli.model.TopicDetails;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.kafka.admin.ConsumerGroupDescription;
import io.vertx.kafka.admin.KafkaAdminClient;
import io.vertx.kafka.admin.ListOffsetsResultInfo;
import io.vertx.kafka.admin.MemberDescription;
import io.vertx.kafka.admin.NewTopic;
import io.vertx.kafka.admin.OffsetSpec;
import io.vertx.kafka.admin.TopicDescription;
import io.vertx.kafka.client.common.Node;
import io.vertx.kafka.client.common.TopicPartition;
import io.vertx.kafka.client.common.TopicPartitionInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of KafkaClientService using Vert.x KafkaAdminClient.
 */
public class KafkaClientServiceImpl implements KafkaClientService {

  private static final Logger log = LoggerFactory.getLogger(KafkaClientServiceImpl.class);

  private final KafkaAdminClient adminClient;

  /**
   * Creates a new KafkaClientServiceImpl.
   *
   * @param vertx  the Vert.x instance
   * @param config the Kafka client configuration
   */
  public KafkaClientServiceImpl(Vertx vertx, KafkaClientConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    Objects.requireNonNull(config, "config cannot be null");
    log.info("Creating Kafka admin client with bootstrap servers: {}", config.getBootstrapServers());
    this.adminClient = KafkaAdminClient.create(vertx, config.toProperties());
  }

  /**
   * Creates a new KafkaClientServiceImpl with an existing admin client.
   *
   * @param adminClient the Kafka admin client
   */
  KafkaClientServiceImpl(KafkaAdminClient adminClient) {
    this.adminClient = Objects.requireNonNull(adminClient, "adminClient cannot be null");
  }

  @Override
  public Future<Set<String>> listTopics() {
    log.debug("Listing all topics");
    return adminClient.listTopics()
      .onSuccess(topics -> log.info("Listed {} topics", topics.size()))
      .onFailure(err -> log.error("Failed to list topics", err));
  }

  @Override
  public Future<TopicDetails> describeTopic(String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    return describeTopics(Set.of(topic))
      .map(details -> {
        TopicDetails description = details.get(topic);
        if (description == null) {
          throw new IllegalArgumentException("Topic not found: " + topic);
        }
        return description;
      });
  }

  @Override
  public Future<Map<String, TopicDetails>> describeTopics(Set<String> topics) {
    if (topics == null || topics.isEmpty()) {
      return Future.succeededFuture(Map.of());
    }
    log.debug("Describing {} topics", topics.size());

    return adminClient.describeTopics(new ArrayList<>(topics))
      .map(descriptions -> {
        Map<String, TopicDetails> result = new HashMap<>();
        descriptions.forEach((name, description) -> result.put(name, toTopicDetails(description)));
        log.info("Described {} topics", result.size());
        return result;
      })
      .onFailure(err -> log.error("Failed to describe topics: {}", topics, err));
  }

  @Override
  public Future<List<PartitionOffsets>> getLogEndOffsets(String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    log.debug("Getting log end offsets for topic: {}", topic);

    return describeTopic(topic)
      .compose(details -> {
        List<PartitionInfo> partitions = details.partitions();
        Map<TopicPartition, OffsetSpec> latestRequest = new HashMap<>();
        Map<TopicPartition, OffsetSpec> earliestRequest = new HashMap<>();

        for (PartitionInfo partition : partitions) {
          TopicPartition tp = new TopicPartition(topic, partition.partition());
          latestRequest.put(tp, OffsetSpec.LATEST);
          earliestRequest.put(tp, OffsetSpec.EARLIEST);
        }

        Future<Map<TopicPartition, ListOffsetsResultInfo>> latestFuture =
          adminClient.listOffsets(latestRequest);
        Future<Map<TopicPartition, ListOffsetsResultInfo>> earliestFuture =
          adminClient.listOffsets(earliestRequest);

        return Future.all(latestFuture, earliestFuture)
          .map(composite -> {
            Map<TopicPartition, ListOffsetsResultInfo> latestOffsets = composite.resultAt(0);
            Map<TopicPartition, ListOffsetsResultInfo> earliestOffsets = composite.resultAt(1);

            List<PartitionOffsets> result = partitions.stream()
              .map(partition -> {
                TopicPartition tp = new TopicPartition(topic, partition.partition());
                long logEndOffset = latestOffsets.get(tp).getOffset();
                long logStartOffset = earliestOffsets.get(tp).getOffset();
                log.debug("Topic {} partition {}: logStart={}, logEnd={}",
                  topic, partition.partition(), logStartOffset, logEndOffset);
                return new PartitionOffsets(topic, partition.partition(), logEndOffset, logStartOffset);
              })
              .sorted(Comparator.comparingInt(PartitionOffsets::partition))
              .collect(Collectors.toList());

            log.info("Retrieved offsets for {} partitions of topic {}", result.size(), topic);
            return result;
          });
      })
      .onFailure(err -> log.error("Failed to get log end offsets for topic: {}", topic, err));
  }

  @Override
  public Future<ConsumerGroupOffsets> getConsumerGroupOffsets(String groupId) {
    Objects.requireNonNull(groupId, "groupId cannot be null");
    log.debug("Getting committed offsets for consumer group: {}", groupId);

    return adminClient.listConsumerGroupOffsets(groupId)
      .map(offsets -> {
        Map<TopicPartitionKey, Long> offsetMap = new HashMap<>();
        offsets.forEach((tp, offsetAndMetadata) -> {
          // a negative offset or missing metadata means no commit for the partition
          if (offsetAndMetadata == null || offsetAndMetadata.getOffset() < 0) {
            log.debug("Consumer group {} topic {} partition {}: no committed offset",
              groupId, tp.getTopic(), tp.getPartition());
            return;
          }
          TopicPartitionKey key = new TopicPartitionKey(tp.getTopic(), tp.getPartition());
          offsetMap.put(key, offsetAndMetadata.getOffset());
          log.debug("Consumer group {} topic {} partition {}: offset={}",
            groupId, tp.getTopic(), tp.getPartition(), offsetAndMetadata.getOffset());
        });
        log.info("Retrieved {} partition offsets for consumer group {}", offsetMap.size(), groupId);
        return new ConsumerGroupOffsets(groupId, offsetMap);
      })
      .onFailure(err -> log.error("Failed to get offsets for consumer group: {}", groupId, err));
  }

  @Override
  public Future<List<BrokerInfo>> listBrokers() {
    log.debug("Listing brokers");
    return adminClient.describeCluster()
      .map(description -> {
        Node controller = description.getController();
        int controllerId = controller != null ? controller.getId() : -1;
        return description.getNodes().stream()
          .map(node -> toBrokerInfo(node, controllerId))
          .sorted(Comparator.comparingInt(BrokerInfo::id))
          .collect(Collectors.toList());
      })
      .onSuccess(brokers -> log.info("Listed {} brokers", brokers.size()))
      .onFailure(err -> log.error("Failed to list brokers", err));
  }

  @Override
  public Future<Set<String>> listConsumerGroups() {
    log.debug("Listing consumer groups");
    return adminClient.listConsumerGroups()
      .map(listings -> listings.stream()
        .map(listing -> listing.getGroupId())
        .collect(Collectors.toSet()))
      .onSuccess(groups -> log.info("Listed {} consumer groups", groups.size()))
      .onFailure(err -> log.error("Failed to list consumer groups", err));
  }

  @Override
  public Future<Map<String, ConsumerGroupDetails>> describeConsumerGroups(Set<String> groupIds) {
    if (groupIds == null || groupIds.isEmpty()) {
      log.debug("No consumer groups to describe");
      return Future.succeededFuture(Map.of());
    }

    log.debug("Describing {} consumer groups", groupIds.size());

    return adminClient.describeConsumerGroups(new ArrayList<>(groupIds))
      .map(descriptions -> {
        Map<String, ConsumerGroupDetails> result = new HashMap<>();
        descriptions.forEach((groupId, description) -> {
          ConsumerGroupDetails details = toGroupDetails(description);
          result.put(groupId, details);
          log.debug("Consumer group {} state: {}, members: {}",
            groupId, details.state(), details.members().size());
        });
        log.info("Described {} consumer groups", result.size());
        return result;
      })
      .onFailure(err -> log.error("Failed to describe consumer groups", err));
  }

  @Override
  public Future<Void> createTopic(String topic, int partitions, short replicationFactor) {
    Objects.requireNonNull(topic, "topic cannot be null");
    log.debug("Creating topic {} with {} partitions, replication factor {}", topic, partitions, replicationFactor);
    return adminClient.createTopics(Collections.singletonList(new NewTopic(topic, partitions, replicationFactor)))
      .onSuccess(v -> log.info("Created topic {}", topic))
      .onFailure(err -> log.error("Failed to create topic: {}", topic, err));
  }

  @Override
  public Future<Void> deleteTopic(String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    log.debug("Deleting topic {}", topic);
    return adminClient.deleteTopics(Collections.singletonList(topic))
      .onSuccess(v -> log.info("Deleted topic {}", topic))
      .onFailure(err -> log.error("Failed to delete topic: {}", topic, err));
  }

  @Override
  public Future<Void> close() {
    log.info("Closing Kafka admin client");
    return adminClient.close()
      .onSuccess(v -> log.info("Kafka admin client closed"))
      .onFailure(err -> log.error("Failed to close Kafka admin client", err));
  }

  private TopicDetails toTopicDetails(TopicDescription description) {
    List<PartitionInfo> partitions = description.getPartitions().stream()
      .map(partition -> toPartitionInfo(description.getName(), partition))
      .sorted(Comparator.comparingInt(PartitionInfo::partition))
      .collect(Collectors.toList());
    return new TopicDetails(description.getName(), description.isInternal(), partitions);
  }

  static BrokerInfo toBrokerInfo(Node node, int controllerId) {
    return new BrokerInfo(
      node.getId(),
      node.getHost(),
      node.getPort(),
      node.hasRack() ? node.rack() : null,
      node.getId() == controllerId
    );
  }

  private PartitionInfo toPartitionInfo(String topic, TopicPartitionInfo tpi) {
    return new PartitionInfo(
      topic,
      tpi.getPartition(),
      tpi.getLeader() != null ? tpi.getLeader().getId() : PartitionInfo.NO_LEADER,
      tpi.getReplicas().stream().map(Node::getId).collect(Collectors.toList()),
      tpi.getIsr().stream().map(Node::getId).collect(Collectors.toList())
    );
  }

  private ConsumerGroupDetails toGroupDetails(ConsumerGroupDescription description) {
    List<ConsumerGroupDetails.Member> members = description.getMembers().stream()
      .map(this::toMember)
      .collect(Collectors.toList());
    Node coordinator = description.getCoordinator();
    return new ConsumerGroupDetails(
      description.getGroupId(),
      ConsumerGroupState.fromKafkaState(description.getState()),
      description.getPartitionAssignor(),
      coordinator != null ? coordinator.getId() : -1,
      description.isSimpleConsumerGroup(),
      members
    );
  }

  private ConsumerGroupDetails.Member toMember(MemberDescription member) {
    Set<TopicPartitionKey> assignment = member.getAssignment() == null
      ? Set.of()
      : member.getAssignment().getTopicPartitions().stream()
        .map(tp -> new TopicPartitionKey(tp.getTopic(), tp.getPartition()))
        .collect(Collectors.toSet());
    return new ConsumerGroupDetails.Member(
      member.getConsumerId(),
      member.getClientId(),
      member.getHost(),
      assignment
    );
  }
}
