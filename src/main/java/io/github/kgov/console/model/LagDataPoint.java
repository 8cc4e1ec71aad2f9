package io.github.kgov.console.model;

/**
 * One point of the lag history chart.
 */
public record LagDataPoint(String timestamp, long totalLag, long p95Lag) {

  public static LagDataPoint of(LiveSnapshot snapshot) {
    return new LagDataPoint(snapshot.timestamp(), snapshot.lagStats().totalLag(),
      snapshot.lagStats().p95Lag());
  }
}
