package io.github.themoah.kfcli.tail;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning for the tail.
 *
 * @param pollTimeoutMs how long one fetch waits for new data
 * @param idleBackoffMs pause of a partition loop after an empty batch
 * @param channelCapacity size of the output channel
 * @param drainBackoffMs pause before retrying a full output channel
 * @param maxPollRecords maximum batch size per fetch
 */
public record TailConfig(
  long pollTimeoutMs,
  long idleBackoffMs,
  int channelCapacity,
  long drainBackoffMs,
  int maxPollRecords
) {

  private static final Logger log = LoggerFactory.getLogger(TailConfig.class);

  private static final long DEFAULT_POLL_TIMEOUT_MS = 500;
  private static final long DEFAULT_IDLE_BACKOFF_MS = 200;
  private static final int DEFAULT_CHANNEL_CAPACITY = 1024;
  private static final long DEFAULT_DRAIN_BACKOFF_MS = 20;
  private static final int DEFAULT_MAX_POLL_RECORDS = 500;

  public Duration pollTimeout() {
    return Duration.ofMillis(pollTimeoutMs);
  }

  public static TailConfig defaults() {
    return new TailConfig(DEFAULT_POLL_TIMEOUT_MS, DEFAULT_IDLE_BACKOFF_MS, DEFAULT_CHANNEL_CAPACITY,
      DEFAULT_DRAIN_BACKOFF_MS, DEFAULT_MAX_POLL_RECORDS);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>KFCLI_TAIL_POLL_TIMEOUT_MS - Fetch wait time (default: 500)</li>
   *   <li>KFCLI_TAIL_IDLE_BACKOFF_MS - Pause after an empty batch (default: 200)</li>
   *   <li>KFCLI_TAIL_CHANNEL_CAPACITY - Output channel size (default: 1024)</li>
   *   <li>KFCLI_TAIL_DRAIN_BACKOFF_MS - Pause before retrying a full channel (default: 20)</li>
   *   <li>KFCLI_TAIL_MAX_POLL_RECORDS - Maximum batch size (default: 500)</li>
   * </ul>
   * Values below 1 fall back to the default.
   */
  public static TailConfig fromEnvironment() {
    long pollTimeoutMs = atLeastOne("KFCLI_TAIL_POLL_TIMEOUT_MS",
      parseLong("KFCLI_TAIL_POLL_TIMEOUT_MS", DEFAULT_POLL_TIMEOUT_MS), DEFAULT_POLL_TIMEOUT_MS);
    long idleBackoffMs = atLeastOne("KFCLI_TAIL_IDLE_BACKOFF_MS",
      parseLong("KFCLI_TAIL_IDLE_BACKOFF_MS", DEFAULT_IDLE_BACKOFF_MS), DEFAULT_IDLE_BACKOFF_MS);
    int channelCapacity = (int) atLeastOne("KFCLI_TAIL_CHANNEL_CAPACITY",
      parseLong("KFCLI_TAIL_CHANNEL_CAPACITY", DEFAULT_CHANNEL_CAPACITY), DEFAULT_CHANNEL_CAPACITY);
    long drainBackoffMs = atLeastOne("KFCLI_TAIL_DRAIN_BACKOFF_MS",
      parseLong("KFCLI_TAIL_DRAIN_BACKOFF_MS", DEFAULT_DRAIN_BACKOFF_MS), DEFAULT_DRAIN_BACKOFF_MS);
    int maxPollRecords = (int) atLeastOne("KFCLI_TAIL_MAX_POLL_RECORDS",
      parseLong("KFCLI_TAIL_MAX_POLL_RECORDS", DEFAULT_MAX_POLL_RECORDS), DEFAULT_MAX_POLL_RECORDS);

    TailConfig config = new TailConfig(pollTimeoutMs, idleBackoffMs, channelCapacity, drainBackoffMs, maxPollRecords);
    log.info("Tail config: pollTimeoutMs={}, idleBackoffMs={}, channelCapacity={}, drainBackoffMs={}, maxPollRecords={}",
      pollTimeoutMs, idleBackoffMs, channelCapacity, drainBackoffMs, maxPollRecords);
    return config;
  }

  private static long atLeastOne(String envVar, long value, long defaultValue) {
    if (value < 1 || value > Integer.MAX_VALUE) {
      log.warn("{} must be between 1 and {}, using default: {}", envVar, Integer.MAX_VALUE, defaultValue);
      return defaultValue;
    }
    return value;
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
