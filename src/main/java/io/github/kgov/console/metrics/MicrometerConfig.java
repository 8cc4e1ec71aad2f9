package io.github.kgov.console.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the console's meter registry. Every meter carries {@code application=kgov-console}.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String APPLICATION_TAG = "application";
  static final String APPLICATION = "kgov-console";

  private MicrometerConfig() {}

  /**
   * @return the registry, or null if the reporter type is unknown
   */
  public static MeterRegistry createRegistry(MetricsConfig config) {
    MeterRegistry registry = switch (config.reporterType()) {
      case "datadog" -> createDatadogRegistry(Duration.ofSeconds(config.stepSeconds()));
      case "prometheus" -> createPrometheusRegistry();
      default -> null;
    };
    if (registry == null) {
      log.warn("Unknown reporter type: {}", config.reporterType());
      return null;
    }

    registry.config().commonTags(APPLICATION_TAG, APPLICATION);
    if (!config.partitionGaugesEnabled()) {
      log.info("Per-partition lag gauges disabled");
      registry.config().meterFilter(MeterFilter.denyNameStartsWith(MicrometerReporter.PARTITION_LAG));
    }
    if (config.jvmMetricsEnabled()) {
      bindJvmMetrics(registry);
    }
    return registry;
  }

  /**
   * Datadog registry configured from DD_API_KEY, DD_APP_KEY and DD_SITE.
   */
  static MeterRegistry createDatadogRegistry(Duration step) {
    log.info("Creating Datadog meter registry, pushing every {}s", step.toSeconds());

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return System.getenv("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + System.getenv().getOrDefault("DD_SITE", "datadoghq.com");
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new ClassLoaderMetrics().bindTo(registry);
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
    new UptimeMetrics().bindTo(registry);
  }
}
