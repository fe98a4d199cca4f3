package io.github.themoah.kfcli.model;

/**
 * Offset information for a topic partition.
 *
 * @param logEndOffset offset of the next message to be written (high-watermark)
 * @param logStartOffset first offset still retained (low-water mark)
 */
public record PartitionOffsets(
  String topic,
  int partition,
  long logEndOffset,
  long logStartOffset
) {

  /**
   * Number of messages currently retained in the partition.
   */
  public long retainedMessages() {
    return Math.max(0, logEndOffset - logStartOffset);
  }
}
