package io.github.kgov.console.metrics;

import io.github.kgov.console.model.LiveSnapshot;
import io.vertx.core.Future;

/**
 * Publishes live consumer-group state to a metrics backend.
 */
public interface MetricsReporter {

  /**
   * Records the latest snapshot of a consumer group, replacing what was recorded before.
   * Values are keyed by the given ids, not by the ids inside the snapshot, so that
   * {@link #removeGroup} finds them again.
   *
   * @param clusterId cluster the group was subscribed on
   * @param groupId subscribed group
   * @param snapshot the snapshot to record
   * @return Future that completes when the values are recorded
   */
  Future<Void> reportSnapshot(String clusterId, String groupId, LiveSnapshot snapshot);

  /**
   * Drops every value recorded for a group, e.g. when it is no longer watched.
   */
  default void removeGroup(String clusterId, String groupId) {
    // Nothing to drop for reporters without state
  }

  Future<Void> start();

  Future<Void> close();
}
