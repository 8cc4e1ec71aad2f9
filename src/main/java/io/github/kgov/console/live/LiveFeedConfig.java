package io.github.kgov.console.live;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live feed configuration loaded from environment variables.
 *
 * @param intervalSeconds snapshot interval requested from the backend
 * @param historySize number of points kept in the lag history
 * @param stuckLagThreshold partitions with a lag above this are reported as stuck
 * @param recentEventCount number of event messages kept per session
 * @param reconnect reconnect backoff
 */
public record LiveFeedConfig(
  int intervalSeconds,
  int historySize,
  long stuckLagThreshold,
  int recentEventCount,
  ReconnectPolicy reconnect
) {
  private static final Logger log = LoggerFactory.getLogger(LiveFeedConfig.class);

  public static final int DEFAULT_INTERVAL_SECONDS = 10;
  public static final int DEFAULT_HISTORY_SIZE = 30;
  public static final long DEFAULT_STUCK_LAG_THRESHOLD = 10_000L;
  public static final int DEFAULT_RECENT_EVENT_COUNT = 5;

  public LiveFeedConfig {
    if (intervalSeconds <= 0) {
      throw new IllegalArgumentException("intervalSeconds must be positive: " + intervalSeconds);
    }
    if (historySize <= 0) {
      throw new IllegalArgumentException("historySize must be positive: " + historySize);
    }
    if (recentEventCount <= 0) {
      throw new IllegalArgumentException("recentEventCount must be positive: " + recentEventCount);
    }
    if (reconnect == null) {
      reconnect = ReconnectPolicy.DEFAULT;
    }
  }

  public static LiveFeedConfig defaults() {
    return new LiveFeedConfig(DEFAULT_INTERVAL_SECONDS, DEFAULT_HISTORY_SIZE,
      DEFAULT_STUCK_LAG_THRESHOLD, DEFAULT_RECENT_EVENT_COUNT, ReconnectPolicy.DEFAULT);
  }

  public static LiveFeedConfig fromEnvironment() {
    int interval = positiveInt("CONSOLE_LIVE_INTERVAL_SECONDS", DEFAULT_INTERVAL_SECONDS);
    int historySize = positiveInt("CONSOLE_LIVE_HISTORY_SIZE", DEFAULT_HISTORY_SIZE);
    long base = getEnvLong("CONSOLE_RECONNECT_BASE_DELAY_MS", ReconnectPolicy.DEFAULT.baseDelayMs());
    long max = getEnvLong("CONSOLE_RECONNECT_MAX_DELAY_MS", ReconnectPolicy.DEFAULT.maxDelayMs());
    int attempts = getEnvInt("CONSOLE_RECONNECT_MAX_ATTEMPTS", ReconnectPolicy.DEFAULT.maxAttempts());

    ReconnectPolicy reconnect;
    try {
      reconnect = new ReconnectPolicy(base, max, attempts);
    } catch (IllegalArgumentException e) {
      log.warn("{}, using default reconnect policy", e.getMessage());
      reconnect = ReconnectPolicy.DEFAULT;
    }

    log.info("LiveFeedConfig loaded: intervalSeconds={}, historySize={}, reconnect={}",
      interval, historySize, reconnect);
    return new LiveFeedConfig(interval, historySize, DEFAULT_STUCK_LAG_THRESHOLD,
      DEFAULT_RECENT_EVENT_COUNT, reconnect);
  }

  private static int positiveInt(String name, int defaultValue) {
    int value = getEnvInt(name, defaultValue);
    if (value <= 0) {
      log.warn("{} must be positive, got {}, using default: {}", name, value, defaultValue);
      return defaultValue;
    }
    return value;
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
