package io.github.kgov.console.metrics;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics settings loaded from environment variables.
 *
 * @param enabled whether live snapshots are exported as gauges
 * @param reporterType {@code prometheus} or {@code datadog}
 * @param jvmMetricsEnabled whether JVM binders are registered
 * @param partitionGaugesEnabled whether per-partition lag gauges are exported
 * @param stepSeconds push interval of the Datadog registry
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled,
  boolean partitionGaugesEnabled,
  int stepSeconds
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";
  private static final int DEFAULT_STEP_SECONDS = 60;

  public boolean isEnabled() {
    return enabled;
  }

  public static MetricsConfig fromEnvironment() {
    boolean enabled = getEnvBoolean("METRICS_ENABLED", true);
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER)
      .trim().toLowerCase(Locale.ROOT);
    boolean jvm = getEnvBoolean("METRICS_JVM_ENABLED", false);
    boolean partitions = getEnvBoolean("METRICS_PARTITION_GAUGES_ENABLED", true);
    int step = getEnvInt("METRICS_STEP_SECONDS", DEFAULT_STEP_SECONDS);

    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}, partitionGauges={}, step={}s",
      enabled, reporter, jvm, partitions, step);
    return new MetricsConfig(enabled, reporter, jvm, partitions, step);
  }

  private static boolean getEnvBoolean(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    if ("true".equalsIgnoreCase(value.trim())) {
      return true;
    }
    if ("false".equalsIgnoreCase(value.trim())) {
      return false;
    }
    log.warn("Invalid boolean for {}: {}, using default: {}", name, value, defaultValue);
    return defaultValue;
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
      log.warn("{} must be positive, got {}, using default: {}", name, parsed, defaultValue);
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
    }
    return defaultValue;
  }
}
