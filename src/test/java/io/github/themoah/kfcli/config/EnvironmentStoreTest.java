package io.github.themoah.kfcli.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for EnvironmentStore.
 */
public class EnvironmentStoreTest {

  @TempDir
  Path tempDir;

  private EnvironmentStore store() {
    return new EnvironmentStore(tempDir.resolve("nested/kfcli/config.properties"));
  }

  @Test
  void list_missingFile_isEmpty() throws IOException {
    assertTrue(store().list().isEmpty());
  }

  @Test
  void save_createsFileAndParentDirectories() throws IOException {
    EnvironmentStore store = store();
    store.save(EnvironmentConfig.of("dev", "localhost:9092"));

    assertTrue(Files.exists(store.getFile()));
    assertEquals(List.of(EnvironmentConfig.of("dev", "localhost:9092")), store.list());
  }

  @Test
  void save_repeatedWrites_leaveOnlyTheConfigFile() throws IOException {
    EnvironmentStore store = store();
    store.save(EnvironmentConfig.of("dev", "dev:9092"));
    store.save(EnvironmentConfig.of("prod", "prod:9092"));
    store.activate("prod");

    try (Stream<Path> files = Files.list(store.getFile().getParent())) {
      assertEquals(List.of(store.getFile().getFileName()),
        files.map(Path::getFileName).collect(Collectors.toList()));
    }
    assertEquals("prod", store.active().name());
  }

  @Test
  void save_replacesExistingFileContents() throws IOException {
    EnvironmentStore store = store();
    Files.createDirectories(store.getFile().getParent());
    Files.writeString(store.getFile(), "environment.legacy.brokers=legacy:9092\n");

    store.save(EnvironmentConfig.of("dev", "dev:9092"));

    assertEquals(List.of("dev", "legacy"), store.list().stream().map(EnvironmentConfig::name).toList());
    assertTrue(Files.readString(store.getFile()).contains("environment.dev.brokers=dev\\:9092"));
  }

  @Test
  void list_sortsByName() throws IOException {
    EnvironmentStore store = store();
    store.save(EnvironmentConfig.of("prod", "prod:9092"));
    store.save(EnvironmentConfig.of("dev", "dev:9092"));

    assertEquals(List.of("dev", "prod"), store.list().stream().map(EnvironmentConfig::name).toList());
  }

  @Test
  void activate_marksExactlyOneEnvironment() throws IOException {
    EnvironmentStore store = store();
    store.save(EnvironmentConfig.of("dev", "dev:9092"));
    store.save(EnvironmentConfig.of("prod", "prod:9092"));

    store.activate("dev");
    store.activate("prod");

    assertEquals("prod", store.active().name());
    assertEquals(1, store.list().stream().filter(EnvironmentConfig::active).count());
  }

  @Test
  void save_replacesEnvironmentAndKeepsActive() throws IOException {
    EnvironmentStore store = store();
    store.save(new EnvironmentConfig("dev", "old:9092", false, Map.of("security.protocol", "SSL")));
    store.activate("dev");

    store.save(EnvironmentConfig.of("dev", "new:9092"));

    EnvironmentConfig dev = store.active();
    assertEquals("new:9092", dev.brokers());
    assertTrue(dev.clientProperties().isEmpty());
  }

  @Test
  void save_roundTripsClientProperties() throws IOException {
    EnvironmentStore store = store();
    store.save(new EnvironmentConfig("dev", "dev:9092", false,
      Map.of("security.protocol", "SASL_SSL", "client.dns.lookup", "use_all_dns_ips")));

    assertEquals(Map.of("security.protocol", "SASL_SSL", "client.dns.lookup", "use_all_dns_ips"),
      store.get("dev").clientProperties());
  }

  @Test
  void activate_unknownEnvironment_fails() throws IOException {
    EnvironmentStore store = store();
    store.save(EnvironmentConfig.of("dev", "dev:9092"));

    ConfigException e = assertThrows(ConfigException.class, () -> store.activate("staging"));
    assertEquals("Environment staging not found", e.getMessage());
  }

  @Test
  void active_noneActive_fails() throws IOException {
    EnvironmentStore store = store();
    store.save(EnvironmentConfig.of("dev", "dev:9092"));

    assertThrows(ConfigException.class, store::active);
    assertFalse(store.get("dev").active());
  }

  @Test
  void save_invalidName_fails() {
    assertThrows(ConfigException.class, () -> store().save(EnvironmentConfig.of("my.env", "x:9092")));
    assertThrows(ConfigException.class, () -> store().save(EnvironmentConfig.of("my env", "x:9092")));
    assertThrows(ConfigException.class, () -> store().save(EnvironmentConfig.of(" ", "x:9092")));
  }
}
