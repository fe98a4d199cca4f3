package io.github.themoah.kfcli.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists broker environments in a properties file.
 *
 * <p>File layout:
 * <pre>
 * active=dev
 * environment.dev.brokers=localhost:9092
 * environment.dev.kafka.client.dns.lookup=use_all_dns_ips
 * </pre>
 * Keys below {@code environment.<name>.kafka.} are passed to the Kafka clients with the
 * prefix removed. At most one environment is active.
 */
public class EnvironmentStore {

  private static final Logger log = LoggerFactory.getLogger(EnvironmentStore.class);

  private static final String PROP_ACTIVE = "active";
  private static final String PROP_PREFIX = "environment.";
  private static final String PROP_BROKERS = "brokers";
  private static final String PROP_CLIENT_PREFIX = "kafka.";

  private final Path file;

  public EnvironmentStore(Path file) {
    this.file = Objects.requireNonNull(file, "file cannot be null");
  }

  public Path getFile() {
    return file;
  }

  /**
   * Lists all stored environments, sorted by name. Empty if the file does not exist yet.
   *
   * @throws IOException if the file cannot be read
   */
  public List<EnvironmentConfig> list() throws IOException {
    Properties props = load();
    String active = props.getProperty(PROP_ACTIVE);

    Map<String, String> brokers = new TreeMap<>();
    Map<String, Map<String, String>> clientProperties = new HashMap<>();

    for (String key : props.stringPropertyNames()) {
      if (!key.startsWith(PROP_PREFIX)) {
        continue;
      }
      String rest = key.substring(PROP_PREFIX.length());
      int dot = rest.indexOf('.');
      if (dot <= 0) {
        log.warn("Ignoring malformed configuration key: {}", key);
        continue;
      }
      String name = rest.substring(0, dot);
      String attribute = rest.substring(dot + 1);
      if (attribute.equals(PROP_BROKERS)) {
        brokers.put(name, props.getProperty(key));
      } else if (attribute.startsWith(PROP_CLIENT_PREFIX)) {
        clientProperties.computeIfAbsent(name, k -> new HashMap<>())
          .put(attribute.substring(PROP_CLIENT_PREFIX.length()), props.getProperty(key));
      } else {
        log.warn("Ignoring unknown configuration key: {}", key);
      }
    }

    List<EnvironmentConfig> environments = new ArrayList<>();
    brokers.forEach((name, servers) -> environments.add(new EnvironmentConfig(
      name,
      servers,
      name.equals(active),
      clientProperties.getOrDefault(name, Map.of())
    )));
    environments.sort(Comparator.comparing(EnvironmentConfig::name));
    return environments;
  }

  /**
   * Adds an environment or replaces the one with the same name.
   * The active environment does not change.
   *
   * @throws IOException if the file cannot be read or written
   */
  public void save(EnvironmentConfig environment) throws IOException {
    Objects.requireNonNull(environment, "environment cannot be null");
    validateName(environment.name());

    Properties props = load();
    String prefix = PROP_PREFIX + environment.name() + ".";
    props.stringPropertyNames().stream()
      .filter(key -> key.startsWith(prefix))
      .forEach(props::remove);

    props.setProperty(prefix + PROP_BROKERS, environment.brokers());
    environment.clientProperties().forEach((key, value) ->
      props.setProperty(prefix + PROP_CLIENT_PREFIX + key, value));

    store(props);
    log.info("Saved environment {} to {}", environment.name(), file);
  }

  /**
   * Makes the named environment the active one.
   *
   * @throws ConfigException if the environment does not exist
   * @throws IOException if the file cannot be read or written
   */
  public void activate(String name) throws IOException {
    Properties props = load();
    if (props.getProperty(PROP_PREFIX + name + "." + PROP_BROKERS) == null) {
      throw ConfigException.environmentNotFound(name);
    }
    props.setProperty(PROP_ACTIVE, name);
    store(props);
    log.info("Activated environment {}", name);
  }

  /**
   * Returns the active environment.
   *
   * @throws ConfigException if no environment is active
   * @throws IOException if the file cannot be read
   */
  public EnvironmentConfig active() throws IOException {
    return list().stream()
      .filter(EnvironmentConfig::active)
      .findFirst()
      .orElseThrow(ConfigException::noActiveEnvironment);
  }

  /**
   * Returns the named environment.
   *
   * @throws ConfigException if the environment does not exist
   * @throws IOException if the file cannot be read
   */
  public EnvironmentConfig get(String name) throws IOException {
    return list().stream()
      .filter(environment -> environment.name().equals(name))
      .findFirst()
      .orElseThrow(() -> ConfigException.environmentNotFound(name));
  }

  private Properties load() throws IOException {
    Properties props = new Properties();
    if (!Files.exists(file)) {
      log.debug("Configuration file {} does not exist yet", file);
      return props;
    }
    try (InputStream is = Files.newInputStream(file)) {
      props.load(is);
    }
    return props;
  }

  /**
   * Writes a sibling temp file and moves it over the configuration file, so a failed write
   * leaves the previous file intact.
   */
  private void store(Properties props) throws IOException {
    Path target = file.toAbsolutePath();
    Path parent = target.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream os = Files.newOutputStream(temp)) {
        props.store(os, "kfcli environments");
      }
      moveIntoPlace(temp, target);
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(temp);
      throw e;
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, replacing in place", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void validateName(String name) {
    if (name == null || name.isBlank() || name.contains(".") || name.chars().anyMatch(Character::isWhitespace)) {
      throw new ConfigException("Invalid environment name: '" + name + "'");
    }
  }
}
