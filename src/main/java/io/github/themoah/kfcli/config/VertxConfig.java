package io.github.themoah.kfcli.config;

import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration for short-lived command invocations.
 * Worker pool size can be set via VERTX_WORKER_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";
  private static final int DEFAULT_EVENT_LOOP_POOL_SIZE = 1;

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    // every tail loop shares a single context, more event loops would stay idle
    options.setEventLoopPoolSize(DEFAULT_EVENT_LOOP_POOL_SIZE);
    Integer workerPoolSize = workerPoolSize();
    if (workerPoolSize != null) {
      log.info("Using worker pool size {}", workerPoolSize);
      options.setWorkerPoolSize(workerPoolSize);
    }
    return options;
  }

  static Integer workerPoolSize() {
    String value = System.getenv(ENV_WORKER_POOL_SIZE);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default", ENV_WORKER_POOL_SIZE, value);
      return null;
    }
  }
}
