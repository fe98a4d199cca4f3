package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.config.AppConfig;
import io.github.themoah.kfcli.config.EnvironmentConfig;
import io.github.themoah.kfcli.config.VertxConfig;
import io.github.themoah.kfcli.kafka.BrokerUnavailableException;
import io.github.themoah.kfcli.kafka.KafkaClientConfig;
import io.github.themoah.kfcli.kafka.KafkaClientService;
import io.github.themoah.kfcli.kafka.KafkaClientServiceImpl;
import io.github.themoah.kfcli.kafka.KafkaMessageFetcher;
import io.github.themoah.kfcli.kafka.MessageFetcher;
import io.github.themoah.kfcli.tail.TailConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker clients of one command invocation, plus a blocking bridge from Vert.x futures
 * to the command thread.
 */
public class BrokerSession implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(BrokerSession.class);

  // Slack on top of the client request timeout so the client reports its own timeout first
  private static final long AWAIT_MARGIN_MS = 5_000;

  private final Vertx vertx;
  private final KafkaClientService kafkaClient;
  private final KafkaClientConfig clientConfig;
  private final long awaitTimeoutMs;

  public BrokerSession(Vertx vertx, KafkaClientService kafkaClient, KafkaClientConfig clientConfig,
                       long requestTimeoutMs) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.kafkaClient = Objects.requireNonNull(kafkaClient, "kafkaClient cannot be null");
    this.clientConfig = Objects.requireNonNull(clientConfig, "clientConfig cannot be null");
    this.awaitTimeoutMs = requestTimeoutMs + AWAIT_MARGIN_MS;
  }

  /**
   * Creates Vert.x and an admin client for an environment.
   */
  public static BrokerSession open(EnvironmentConfig environment, AppConfig appConfig) {
    KafkaClientConfig clientConfig = KafkaClientConfig.forEnvironment(environment, appConfig.requestTimeoutMs());
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());
    try {
      return new BrokerSession(vertx, new KafkaClientServiceImpl(vertx, clientConfig), clientConfig,
        appConfig.requestTimeoutMs());
    } catch (RuntimeException e) {
      vertx.close();
      throw BrokerUnavailableException.wrap("Failed to create Kafka client for environment " + environment.name(), e);
    }
  }

  public Vertx vertx() {
    return vertx;
  }

  public KafkaClientService kafkaClient() {
    return kafkaClient;
  }

  /**
   * Creates a fetcher for tailing, sharing this session's client configuration.
   */
  public MessageFetcher newFetcher(TailConfig tailConfig) {
    return new KafkaMessageFetcher(vertx, clientConfig, tailConfig.pollTimeout(), tailConfig.maxPollRecords());
  }

  /**
   * Blocks until the future completes.
   *
   * @param future the asynchronous operation
   * @param operation what the operation does, used in error messages
   * @return the result
   * @throws BrokerUnavailableException if the operation fails or times out
   */
  public <T> T await(Future<T> future, String operation) {
    try {
      return future.toCompletionStage().toCompletableFuture().get(awaitTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw BrokerUnavailableException.wrap("Failed to " + operation, e.getCause());
    } catch (TimeoutException e) {
      throw new BrokerUnavailableException("Timed out after " + awaitTimeoutMs + "ms trying to " + operation, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerUnavailableException("Interrupted while trying to " + operation, e);
    }
  }

  @Override
  public void close() {
    Future<Void> closed = kafkaClient.close()
      .recover(err -> Future.succeededFuture())
      .compose(v -> vertx.close());
    try {
      closed.toCompletionStage().toCompletableFuture().get(awaitTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException e) {
      log.warn("Failed to close broker session cleanly: {}", e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while closing broker session");
    }
  }
}
