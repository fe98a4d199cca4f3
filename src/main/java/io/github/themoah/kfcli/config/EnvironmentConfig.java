package io.github.themoah.kfcli.config;

import java.util.Map;

/**
 * A named broker connection profile.
 *
 * @param name environment name
 * @param brokers bootstrap servers, comma separated
 * @param active true if this is the environment used when none is given explicitly
 * @param clientProperties extra Kafka client properties passed through verbatim
 */
public record EnvironmentConfig(
  String name,
  String brokers,
  boolean active,
  Map<String, String> clientProperties
) {

  public EnvironmentConfig {
    clientProperties = Map.copyOf(clientProperties);
  }

  public static EnvironmentConfig of(String name, String brokers) {
    return new EnvironmentConfig(name, brokers, false, Map.of());
  }

  public EnvironmentConfig withActive(boolean active) {
    return new EnvironmentConfig(name, brokers, active, clientProperties);
  }
}
