package io.github.themoah.kfcli.model;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import java.util.List;
import java.util.Set;

/**
 * Description of a consumer group and its current members.
 *
 * @param partitionAssignor assignment strategy (protocol) negotiated by the group
 * @param coordinator broker id of the group coordinator, -1 if unknown
 */
public record ConsumerGroupDetails(
  String groupId,
  ConsumerGroupState state,
  String partitionAssignor,
  int coordinator,
  boolean simpleConsumerGroup,
  List<Member> members
) {

  /**
   * Returns true if any member of the group is assigned a partition of the topic.
   */
  public boolean isAssigned(String topic) {
    return members.stream()
      .flatMap(member -> member.assignment().stream())
      .anyMatch(tp -> tp.topic().equals(topic));
  }

  /**
   * A member of the group with its partition assignment.
   */
  public record Member(
    String memberId,
    String clientId,
    String host,
    Set<TopicPartitionKey> assignment
  ) {}
}
