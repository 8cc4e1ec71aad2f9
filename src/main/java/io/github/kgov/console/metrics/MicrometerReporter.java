package io.github.kgov.console.metrics;

import io.github.kgov.console.model.LagStats;
import io.github.kgov.console.model.LiveSnapshot;
import io.github.kgov.console.model.LiveSnapshot.PartitionLag;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records live snapshots as Micrometer gauges.
 * Works with any Micrometer-supported backend (Prometheus, Datadog).
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String LAG_SUM = "kgov.consumer.lag.sum";
  static final String LAG_P50 = "kgov.consumer.lag.p50";
  static final String LAG_P95 = "kgov.consumer.lag.p95";
  static final String LAG_MAX = "kgov.consumer.lag.max";
  static final String FAIRNESS_GINI = "kgov.consumer.fairness.gini";
  static final String MEMBERS = "kgov.consumer.members";
  static final String STUCK_PARTITIONS = "kgov.consumer.stuck.partitions";
  static final String REBALANCING = "kgov.consumer.rebalancing";
  static final String PARTITION_LAG = "kgov.consumer.partition.lag";

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Map<String, Meter> meters = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> groupKeys = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> markedForDeletion = new ConcurrentHashMap<>();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public Future<Void> reportSnapshot(String clusterId, String groupId, LiveSnapshot snapshot) {
    String group = groupKey(clusterId, groupId);
    log.debug("Reporting snapshot for {} ({} partitions)", group, snapshot.partitions().size());

    Set<String> activeKeys = new HashSet<>();
    Tags groupTags = Tags.of("cluster_id", clusterId, "consumer_group", groupId);
    LagStats stats = snapshot.lagStats();

    activeKeys.add(recordGauge(LAG_SUM, groupTags, stats.totalLag()));
    activeKeys.add(recordGauge(LAG_P50, groupTags, stats.p50Lag()));
    activeKeys.add(recordGauge(LAG_P95, groupTags, stats.p95Lag()));
    activeKeys.add(recordGauge(LAG_MAX, groupTags, stats.maxLag()));
    // Scaled x1000 to keep three decimals in a long gauge
    activeKeys.add(recordGauge(FAIRNESS_GINI, groupTags, Math.round(snapshot.fairnessGini() * 1000)));
    activeKeys.add(recordGauge(MEMBERS, groupTags, snapshot.memberCount()));
    activeKeys.add(recordGauge(STUCK_PARTITIONS, groupTags, snapshot.stuckCount()));
    activeKeys.add(recordGauge(REBALANCING, groupTags, snapshot.rebalancing() ? 1 : 0));

    for (PartitionLag p : snapshot.partitions()) {
      Tags partitionTags = groupTags.and(
        "topic", nullSafe(p.topic()),
        "partition", String.valueOf(p.partition())
      );
      activeKeys.add(recordGauge(PARTITION_LAG, partitionTags, p.lag()));
    }

    groupKeys.computeIfAbsent(group, k -> ConcurrentHashMap.newKeySet()).addAll(activeKeys);
    cleanupStaleGauges(group, activeKeys);
    return Future.succeededFuture();
  }

  @Override
  public void removeGroup(String clusterId, String groupId) {
    String group = groupKey(clusterId, groupId);
    Set<String> keys = groupKeys.remove(group);
    markedForDeletion.remove(group);
    if (keys != null) {
      keys.forEach(this::removeGauge);
      log.info("Removed {} gauges for {}", keys.size(), group);
    }
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  /**
   * Current value of a gauge, null if it is not registered.
   */
  Long gaugeValue(String name, Tags tags) {
    AtomicLong value = gaugeValues.get(name + tags.toString());
    return value != null ? value.get() : null;
  }

  private String recordGauge(String name, Tags tags, long value) {
    String key = name + tags.toString();
    AtomicLong atomicValue = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(value);
      meters.put(k, Gauge.builder(name, newValue, AtomicLong::get)
        .tags(tags)
        .register(registry));
      return newValue;
    });
    atomicValue.set(value);
    return key;
  }

  /**
   * Two-phase cleanup, scoped to one group: a gauge missing from one snapshot is marked,
   * and removed if it is still missing from the next one.
   */
  private void cleanupStaleGauges(String group, Set<String> activeKeys) {
    Set<String> known = groupKeys.getOrDefault(group, Set.of());
    Set<String> marked = markedForDeletion.computeIfAbsent(group, k -> ConcurrentHashMap.newKeySet());

    Set<String> toDelete = new HashSet<>(marked);
    toDelete.removeAll(activeKeys);
    for (String key : toDelete) {
      removeGauge(key);
      known.remove(key);
      marked.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Cleaned up {} stale gauges for {}", toDelete.size(), group);
    }

    Set<String> missing = new HashSet<>(known);
    missing.removeAll(activeKeys);
    marked.retainAll(missing);
    for (String key : missing) {
      if (marked.add(key)) {
        log.debug("Marked gauge for deletion: {}", key);
      }
    }
  }

  private void removeGauge(String key) {
    gaugeValues.remove(key);
    Meter meter = meters.remove(key);
    if (meter != null) {
      registry.remove(meter);
      log.debug("Removed stale gauge: {}", key);
    }
  }

  private static String groupKey(String clusterId, String groupId) {
    return clusterId + "/" + groupId;
  }

  private static String nullSafe(String value) {
    return value != null ? value : "unknown";
  }
}
