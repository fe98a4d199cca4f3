package io.github.themoah.kfcli.config;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param configFile location of the environments file
 * @param requestTimeoutMs timeout for every broker request in milliseconds
 */
public record AppConfig(
  Path configFile,
  int requestTimeoutMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final String DEFAULT_CONFIG_DIR = ".config/kfcli";
  private static final String DEFAULT_CONFIG_FILE = "config.properties";
  private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30_000;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    Path configFile = resolveConfigFile(System.getenv("KFCLI_CONFIG_FILE"), System.getProperty("user.home"));
    int timeout = getEnvInt("KFCLI_REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS);

    log.info("AppConfig loaded: configFile={}, requestTimeoutMs={}", configFile, timeout);
    return new AppConfig(configFile, timeout);
  }

  static Path resolveConfigFile(String override, String home) {
    if (override != null && !override.isBlank()) {
      return Path.of(override);
    }
    return Path.of(home, DEFAULT_CONFIG_DIR, DEFAULT_CONFIG_FILE);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
