package io.github.themoah.kfcli.model;

import java.util.Comparator;
import java.util.List;

/**
 * Lag of a consumer group across all partitions it has committed to.
 *
 * @param entries per-partition lag sorted by topic, then partition
 * @param totalLag sum of all known per-partition lags
 * @param lowerBound true if at least one partition lag is unknown, so totalLag undercounts
 */
public record LagReport(
  String groupId,
  List<LagEntry> entries,
  long totalLag,
  boolean lowerBound
) {

  static final Comparator<LagEntry> ENTRY_ORDER =
    Comparator.comparing(LagEntry::topic).thenComparingInt(LagEntry::partition);

  /**
   * Builds a report from unordered entries.
   */
  public static LagReport fromEntries(String groupId, List<LagEntry> entries) {
    List<LagEntry> sorted = entries.stream().sorted(ENTRY_ORDER).toList();
    long total = sorted.stream()
      .filter(LagEntry::isLagKnown)
      .mapToLong(entry -> entry.lag().getAsLong())
      .sum();
    boolean anyUnknown = sorted.stream().anyMatch(entry -> !entry.isLagKnown());
    return new LagReport(groupId, sorted, total, anyUnknown);
  }

  public long unknownPartitions() {
    return entries.stream().filter(entry -> !entry.isLagKnown()).count();
  }

  /**
   * Total lag as shown to operators: {@code ≥N} when it is a lower bound.
   */
  public String totalLagDisplay() {
    return lowerBound ? "≥" + totalLag : String.valueOf(totalLag);
  }
}
