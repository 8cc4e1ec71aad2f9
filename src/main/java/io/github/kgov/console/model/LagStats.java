package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * Lag distribution over the partitions of a consumer group.
 */
public record LagStats(
  long totalLag,
  double meanLag,
  long p50Lag,
  long p95Lag,
  long maxLag,
  int partitionCount
) {

  public static final LagStats EMPTY = new LagStats(0, 0.0, 0, 0, 0, 0);

  public static LagStats fromJson(JsonObject json) {
    if (json == null) {
      return EMPTY;
    }
    return new LagStats(
      JsonFields.longOrZero(json, "total_lag"),
      JsonFields.doubleOrZero(json, "mean_lag"),
      JsonFields.longOrZero(json, "p50_lag"),
      JsonFields.longOrZero(json, "p95_lag"),
      JsonFields.longOrZero(json, "max_lag"),
      JsonFields.intOrZero(json, "partition_count")
    );
  }
}
