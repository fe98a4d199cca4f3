package io.github.themoah.kfcli.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.TailMessage;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for KafkaMessageFetcher, driven through a Kafka MockConsumer.
 */
@ExtendWith(VertxExtension.class)
public class KafkaMessageFetcherTest {

  private static final String TOPIC = "orders";
  private static final TopicPartitionKey KEY = new TopicPartitionKey(TOPIC, 0);
  private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

  private SeekRecordingConsumer mock;
  private List<Map<String, String>> createdWith;
  private KafkaMessageFetcher fetcher;

  /**
   * MockConsumer that remembers every explicit seek.
   */
  private static final class SeekRecordingConsumer extends MockConsumer<byte[], byte[]> {

    private final List<Long> seeks = new CopyOnWriteArrayList<>();

    SeekRecordingConsumer() {
      super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void seek(TopicPartition partition, long offset) {
      seeks.add(offset);
      super.seek(partition, offset);
    }
  }

  @BeforeEach
  void setUp(Vertx vertx) {
    mock = new SeekRecordingConsumer();
    mock.updateBeginningOffsets(Map.of(TP, 0L));
    createdWith = new CopyOnWriteArrayList<>();

    KafkaClientConfig config = KafkaClientConfig.builder()
      .bootstrapServers("localhost:9092")
      .property(ConsumerConfig.GROUP_ID_CONFIG, "shared-group")
      .build();
    fetcher = new KafkaMessageFetcher(config, Duration.ofMillis(50), 100, properties -> {
      createdWith.add(properties);
      return KafkaConsumer.create(vertx, mock);
    });
  }

  @AfterEach
  void tearDown(VertxTestContext ctx) {
    fetcher.close().onComplete(ctx.succeedingThenComplete());
  }

  private void append(long offset, String value) {
    mock.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, null, value.getBytes(StandardCharsets.UTF_8)));
  }

  private static List<Long> offsets(List<TailMessage> batch) {
    return batch.stream().map(TailMessage::offset).collect(Collectors.toList());
  }

  @Test
  void fetch_consecutiveOffsets_seeksOnlyOnce(VertxTestContext ctx) throws Exception {
    fetcher.assign(List.of(KEY))
      .compose(v -> {
        append(0, "a");
        append(1, "b");
        return fetcher.fetch(KEY, 0);
      })
      .compose(first -> {
        ctx.verify(() -> assertEquals(List.of(0L, 1L), offsets(first)));
        append(2, "c");
        return fetcher.fetch(KEY, 2);
      })
      .onComplete(ctx.succeeding(second -> ctx.verify(() -> {
        assertEquals(List.of(2L), offsets(second));
        assertEquals("c", new String(second.get(0).payload(), StandardCharsets.UTF_8));
        assertEquals(List.of(0L), mock.seeks);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void fetch_emptyBatch_keepsPosition(VertxTestContext ctx) throws Exception {
    fetcher.assign(List.of(KEY))
      .compose(v -> fetcher.fetch(KEY, 0))
      .compose(empty -> {
        ctx.verify(() -> assertTrue(empty.isEmpty()));
        append(0, "a");
        return fetcher.fetch(KEY, 0);
      })
      .onComplete(ctx.succeeding(batch -> ctx.verify(() -> {
        assertEquals(List.of(0L), offsets(batch));
        assertEquals(List.of(0L), mock.seeks);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void fetch_offsetGap_seeksAgain(VertxTestContext ctx) throws Exception {
    fetcher.assign(List.of(KEY))
      .compose(v -> {
        append(0, "a");
        return fetcher.fetch(KEY, 0);
      })
      .compose(first -> {
        append(5, "f");
        return fetcher.fetch(KEY, 5);
      })
      .onComplete(ctx.succeeding(second -> ctx.verify(() -> {
        assertEquals(List.of(5L), offsets(second));
        assertEquals(List.of(0L, 5L), mock.seeks);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void fetch_neverJoinsGroupOrCommits(VertxTestContext ctx) throws Exception {
    fetcher.assign(List.of(KEY))
      .compose(v -> {
        append(0, "a");
        append(1, "b");
        return fetcher.fetch(KEY, 0);
      })
      .onComplete(ctx.succeeding(batch -> ctx.verify(() -> {
        assertEquals(1, createdWith.size());
        Map<String, String> properties = createdWith.get(0);
        assertFalse(properties.containsKey(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("false", properties.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals(Set.of(TP), mock.assignment());
        assertTrue(mock.subscription().isEmpty());
        assertTrue(mock.committed(Set.of(TP)).isEmpty());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void fetch_unassignedPartition_fails(VertxTestContext ctx) throws Exception {
    fetcher.fetch(new TopicPartitionKey(TOPIC, 3), 0).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertInstanceOf(IllegalStateException.class, err);
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void close_closesPartitionConsumers(VertxTestContext ctx) throws Exception {
    fetcher.assign(List.of(KEY))
      .compose(v -> fetcher.close())
      .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        assertTrue(mock.closed());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }
}
