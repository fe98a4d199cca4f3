package io.github.themoah.kfcli.kafka;

import io.github.themoah.kfcli.config.EnvironmentConfig;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration holder for the Kafka admin and consumer clients of one environment.
 */
public class KafkaClientConfig {

  private static final Logger log = LoggerFactory.getLogger(KafkaClientConfig.class);

  private static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
  private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;
  private static final String CLIENT_ID = "kfcli";

  private final String bootstrapServers;
  private final int requestTimeoutMs;
  private final Map<String, String> additionalProperties;

  private KafkaClientConfig(Builder builder) {
    this.bootstrapServers = builder.bootstrapServers;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.additionalProperties = new HashMap<>(builder.additionalProperties);
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public int getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  /**
   * Properties for the admin client.
   */
  public Map<String, String> toProperties() {
    Map<String, String> props = new HashMap<>();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, CLIENT_ID + "-admin");
    props.putAll(additionalProperties);
    return props;
  }

  /**
   * Properties for a read-only tail consumer.
   *
   * <p>No group id is set and auto commit is disabled: partitions are assigned manually
   * and offsets are never committed. Seeking below the log start falls back to the earliest
   * retained offset.
   *
   * @param maxPollRecords maximum number of records returned by a single fetch
   */
  public Map<String, String> toConsumerProperties(int maxPollRecords) {
    Map<String, String> props = new HashMap<>();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, CLIENT_ID + "-tail");
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(maxPollRecords));
    props.putAll(additionalProperties);
    props.remove(ConsumerConfig.GROUP_ID_CONFIG);
    return props;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates configuration for a stored environment.
   *
   * @param environment the environment to connect to
   * @param requestTimeoutMs request timeout applied to every broker call
   * @return KafkaClientConfig for the environment
   */
  public static KafkaClientConfig forEnvironment(EnvironmentConfig environment, int requestTimeoutMs) {
    Builder builder = builder()
      .bootstrapServers(environment.brokers())
      .requestTimeoutMs(requestTimeoutMs);
    environment.clientProperties().forEach(builder::property);

    log.info("Kafka client config for environment {}: bootstrapServers={}, extraProperties={}",
      environment.name(), environment.brokers(), environment.clientProperties().keySet());
    return builder.build();
  }

  public static class Builder {

    private String bootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private final Map<String, String> additionalProperties = new HashMap<>();

    public Builder bootstrapServers(String bootstrapServers) {
      this.bootstrapServers = Objects.requireNonNull(bootstrapServers, "bootstrapServers cannot be null");
      return this;
    }

    public Builder requestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder property(String key, String value) {
      this.additionalProperties.put(key, value);
      return this;
    }

    public KafkaClientConfig build() {
      return new KafkaClientConfig(this);
    }
  }
}
