package io.github.themoah.kfcli.model;

import java.util.List;

/**
 * Description of a topic and its partitions.
 */
public record TopicDetails(
  String name,
  boolean internal,
  List<PartitionInfo> partitions
) {

  public int partitionCount() {
    return partitions.size();
  }

  /**
   * Replica count of the first partition, 0 for a topic without partitions.
   */
  public int replicationFactor() {
    return partitions.isEmpty() ? 0 : partitions.get(0).replicas().size();
  }
}
