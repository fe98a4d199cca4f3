package io.github.themoah.kfcli.config;

/**
 * Raised for invalid or incomplete environment configuration.
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }

  public static ConfigException environmentNotFound(String name) {
    return new ConfigException("Environment " + name + " not found");
  }

  public static ConfigException noActiveEnvironment() {
    return new ConfigException("No active environment found, run 'kfcli config active <environment>'");
  }
}
