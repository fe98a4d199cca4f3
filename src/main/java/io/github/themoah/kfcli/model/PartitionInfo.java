package io.github.themoah.kfcli.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Leadership and replica placement of a topic partition.
 *
 * @param leader broker id of the leader, {@link #NO_LEADER} while the partition is offline
 * @param replicas broker ids of all replicas, preferred leader first
 * @param inSyncReplicas broker ids of the replicas caught up with the leader
 */
public record PartitionInfo(
  String topic,
  int partition,
  int leader,
  List<Integer> replicas,
  List<Integer> inSyncReplicas
) {

  public static final int NO_LEADER = -1;

  public PartitionInfo {
    replicas = List.copyOf(replicas);
    inSyncReplicas = List.copyOf(inSyncReplicas);
  }

  public String leaderDisplay() {
    return leader == NO_LEADER ? "none" : String.valueOf(leader);
  }

  public String replicasDisplay() {
    return join(replicas);
  }

  public String inSyncReplicasDisplay() {
    return join(inSyncReplicas);
  }

  private static String join(List<Integer> brokerIds) {
    return brokerIds.stream().map(String::valueOf).collect(Collectors.joining(","));
  }
}
