package io.github.kgov.console.config;

import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options. {@code VERTX_EVENT_LOOP_POOL_SIZE} overrides the event-loop pool size.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOP_POOL_SIZE = "VERTX_EVENT_LOOP_POOL_SIZE";

  private VertxConfig() {}

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);

    String poolSize = System.getenv(ENV_EVENT_LOOP_POOL_SIZE);
    if (poolSize != null && !poolSize.isBlank()) {
      try {
        int size = Integer.parseInt(poolSize.trim());
        if (size > 0) {
          options.setEventLoopPoolSize(size);
          log.info("Event-loop pool size set to {}", size);
        } else {
          log.warn("{} must be positive, got {}", ENV_EVENT_LOOP_POOL_SIZE, size);
        }
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default", ENV_EVENT_LOOP_POOL_SIZE, poolSize);
      }
    }
    return options;
  }
}
