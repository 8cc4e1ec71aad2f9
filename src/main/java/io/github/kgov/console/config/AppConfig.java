package io.github.kgov.console.config;

import io.github.kgov.console.watch.WatchTarget;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console service configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param healthCheckIntervalMs backend health check interval in milliseconds
 * @param watchTargets consumer groups to keep live channels open for
 */
public record AppConfig(
  int httpPort,
  long healthCheckIntervalMs,
  List<WatchTarget> watchTargets
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = getEnvLong("CONSOLE_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);
    List<WatchTarget> targets = parseTargets(System.getenv("CONSOLE_WATCH_TARGETS"));

    log.info("AppConfig loaded: httpPort={}, healthCheckIntervalMs={}, watchTargets={}",
      port, interval, targets);
    return new AppConfig(port, interval, targets);
  }

  static List<WatchTarget> parseTargets(String value) {
    try {
      return WatchTarget.parseList(value);
    } catch (IllegalArgumentException e) {
      log.warn("Invalid CONSOLE_WATCH_TARGETS: {}, watching nothing", e.getMessage());
      return List.of();
    }
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
