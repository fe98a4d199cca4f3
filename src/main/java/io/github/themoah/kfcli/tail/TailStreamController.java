package io.github.themoah.kfcli.tail;

import io.github.themoah.kfcli.filter.FilterEvaluator;
import io.github.themoah.kfcli.kafka.BrokerUnavailableException;
import io.github.themoah.kfcli.kafka.KafkaClientService;
import io.github.themoah.kfcli.kafka.MessageFetcher;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.TailMessage;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tails every partition of one topic into a single output channel.
 *
 * <p>One loop per partition fetches a batch, filters it, and offers the matches to the
 * channel in partition order. All loops run on one Vert.x context, so filtering and
 * channel offers never interleave. Cancellation is checked before every fetch; a batch
 * already fetched is always emitted completely.
 */
public class TailStreamController {

  private static final Logger log = LoggerFactory.getLogger(TailStreamController.class);

  private final Vertx vertx;
  private final KafkaClientService kafkaClient;
  private final MessageFetcher fetcher;
  private final OutputChannel<TailMessage> channel;
  private final TailConfig config;
  private final TailStats stats;

  private final AtomicReference<TailState> state = new AtomicReference<>(TailState.IDLE);
  private final AtomicBoolean started = new AtomicBoolean();
  private final Promise<Void> stopped = Promise.promise();

  // Confined to the controller context
  private Context context;
  private String topic;
  private FilterEvaluator evaluator;
  private CancellationToken token;
  private int activeLoops;
  private Throwable failure;

  public TailStreamController(
    Vertx vertx,
    KafkaClientService kafkaClient,
    MessageFetcher fetcher,
    OutputChannel<TailMessage> channel,
    TailConfig config,
    TailStats stats
  ) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.kafkaClient = Objects.requireNonNull(kafkaClient, "kafkaClient cannot be null");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
    this.channel = Objects.requireNonNull(channel, "channel cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.stats = Objects.requireNonNull(stats, "stats cannot be null");
  }

  /**
   * Starts tailing. May be called once.
   *
   * @param request topic, replay count and filter
   * @param token cancellation signal checked at every poll boundary
   * @return Future that completes when the tail stopped and the channel is closed,
   *         failed with {@link BrokerUnavailableException} if the broker could not be read
   */
  public Future<Void> start(TailRequest request, CancellationToken token) {
    if (!started.compareAndSet(false, true)) {
      return Future.failedFuture(new IllegalStateException("Tail already started"));
    }
    this.topic = request.topic();
    this.evaluator = FilterEvaluator.of(request.filter().orElse(null));
    this.token = Objects.requireNonNull(token, "token cannot be null");
    this.context = vertx.getOrCreateContext();
    context.runOnContext(v -> subscribe(request));
    return stopped.future();
  }

  public TailState state() {
    return state.get();
  }

  /**
   * Completes when the tail reached {@link TailState#STOPPED}.
   */
  public Future<Void> stopped() {
    return stopped.future();
  }

  private void subscribe(TailRequest request) {
    log.debug("Resolving start offsets for topic {}", topic);

    kafkaClient.getLogEndOffsets(topic)
      .recover(err -> Future.failedFuture(
        BrokerUnavailableException.wrap("Failed to fetch end offsets for topic " + topic, err)))
      .compose(endOffsets -> {
        if (endOffsets.isEmpty()) {
          return Future.failedFuture(
            new BrokerUnavailableException("Topic " + topic + " has no partitions", null));
        }
        Map<TopicPartitionKey, Long> starts = StartOffsets.resolve(endOffsets, request.before());
        return fetcher.assign(starts.keySet())
          .recover(err -> Future.failedFuture(
            BrokerUnavailableException.wrap("Failed to assign partitions of topic " + topic, err)))
          .map(v -> starts);
      })
      .onComplete(onContext(ar -> {
        if (ar.failed()) {
          log.error("Failed to start tail of topic {}", topic, ar.cause());
          failure = ar.cause();
          finish();
          return;
        }
        Map<TopicPartitionKey, Long> starts = ar.result();
        transition(TailState.SUBSCRIBED);
        log.info("Tailing {} partitions of {} from offsets {}", starts.size(), topic, starts);
        activeLoops = starts.size();
        starts.forEach((key, offset) -> poll(new PartitionLoop(key, offset)));
      }));
  }

  private void poll(PartitionLoop loop) {
    if (token.isCancelled() || failure != null) {
      log.debug("Partition loop {} exiting at offset {}", loop.key, loop.nextOffset);
      loopExited();
      return;
    }
    transition(TailState.POLLING);

    fetcher.fetch(loop.key, loop.nextOffset)
      .onComplete(onContext(ar -> {
        if (ar.failed()) {
          log.error("Failed to fetch {} at offset {}", loop.key, loop.nextOffset, ar.cause());
          if (failure == null) {
            failure = BrokerUnavailableException.wrap("Failed to fetch messages from " + loop.key, ar.cause());
          }
          loopExited();
          return;
        }
        List<TailMessage> batch = ar.result();
        if (batch.isEmpty()) {
          vertx.setTimer(config.idleBackoffMs(), id -> poll(loop));
          return;
        }
        loop.nextOffset = batch.get(batch.size() - 1).offset() + 1;
        stats.recordConsumed(batch.size());
        emit(loop, filter(batch), 0);
      }));
  }

  private List<TailMessage> filter(List<TailMessage> batch) {
    List<TailMessage> matches = new ArrayList<>();
    for (TailMessage message : batch) {
      switch (evaluator.evaluate(message)) {
        case MATCHED -> {
          stats.recordMatched();
          matches.add(message);
        }
        case UNDECODABLE -> stats.recordUndecodable();
        default -> {
        }
      }
    }
    return matches;
  }

  private void emit(PartitionLoop loop, List<TailMessage> matches, int from) {
    transition(TailState.EMITTING);
    int next = from;
    while (next < matches.size() && channel.offer(matches.get(next))) {
      stats.recordEmitted();
      next++;
    }
    if (next < matches.size()) {
      int resumeAt = next;
      log.trace("Output channel full, {} messages of {} waiting", matches.size() - resumeAt, loop.key);
      vertx.setTimer(config.drainBackoffMs(), id -> emit(loop, matches, resumeAt));
      return;
    }
    poll(loop);
  }

  private void loopExited() {
    activeLoops--;
    if (activeLoops == 0) {
      finish();
    }
  }

  private void finish() {
    fetcher.close()
      .onComplete(onContext(ar -> {
        if (ar.failed()) {
          log.warn("Failed to close fetcher for topic {}: {}", topic, ar.cause().getMessage());
        }
        state.set(TailState.STOPPED);
        channel.close();
        stats.logSummary(topic);
        if (failure != null) {
          stopped.fail(failure);
        } else {
          stopped.complete();
        }
      }));
  }

  private void transition(TailState next) {
    state.getAndUpdate(current -> current == TailState.STOPPED ? current : next);
  }

  private <T> Handler<AsyncResult<T>> onContext(Handler<AsyncResult<T>> handler) {
    return ar -> context.runOnContext(v -> handler.handle(ar));
  }

  private static final class PartitionLoop {

    private final TopicPartitionKey key;
    private long nextOffset;

    PartitionLoop(TopicPartitionKey key, long startOffset) {
      this.key = key;
      this.nextOffset = startOffset;
    }
  }
}
