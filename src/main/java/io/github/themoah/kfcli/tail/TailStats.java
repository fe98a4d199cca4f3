package io.github.themoah.kfcli.tail;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counters of a single tail run.
 */
public class TailStats {

  private static final Logger log = LoggerFactory.getLogger(TailStats.class);

  private static final String METRIC_MESSAGES = "kfcli.tail.messages";
  private static final String TAG_OUTCOME = "outcome";

  private final Counter consumed;
  private final Counter matched;
  private final Counter undecodable;
  private final Counter emitted;

  public TailStats() {
    this(new SimpleMeterRegistry());
  }

  public TailStats(MeterRegistry registry) {
    this.consumed = counter(registry, "consumed", "Messages fetched from the broker");
    this.matched = counter(registry, "matched", "Messages accepted by the filter");
    this.undecodable = counter(registry, "undecodable", "Messages whose payload could not be decoded");
    this.emitted = counter(registry, "emitted", "Messages handed to the output channel");
  }

  private static Counter counter(MeterRegistry registry, String outcome, String description) {
    return Counter.builder(METRIC_MESSAGES)
      .tag(TAG_OUTCOME, outcome)
      .description(description)
      .register(registry);
  }

  void recordConsumed(int count) {
    consumed.increment(count);
  }

  void recordMatched() {
    matched.increment();
  }

  void recordUndecodable() {
    undecodable.increment();
  }

  void recordEmitted() {
    emitted.increment();
  }

  public long consumed() {
    return (long) consumed.count();
  }

  public long matched() {
    return (long) matched.count();
  }

  public long undecodable() {
    return (long) undecodable.count();
  }

  public long emitted() {
    return (long) emitted.count();
  }

  void logSummary(String topic) {
    log.info("Tail of {} stopped: consumed={}, matched={}, undecodable={}, emitted={}",
      topic, consumed(), matched(), undecodable(), emitted());
  }
}
