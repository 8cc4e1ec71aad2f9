package io.github.kgov.console.watch;

import io.github.kgov.console.live.LiveMonitorSession;
import io.github.kgov.console.live.LiveSnapshotSubscriber;
import io.github.kgov.console.metrics.MetricsReporter;
import io.github.kgov.console.model.LiveSnapshot;
import io.vertx.core.Future;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one live session open per watched group and forwards every snapshot to the
 * metrics reporter.
 */
public class LiveLagWatcher {

  private static final Logger log = LoggerFactory.getLogger(LiveLagWatcher.class);

  private final LiveSnapshotSubscriber subscriber;
  private final List<WatchTarget> targets;
  private final MetricsReporter reporter;
  private final Map<WatchTarget, LiveMonitorSession> sessions = new LinkedHashMap<>();

  /**
   * @param reporter receives snapshots, null when metrics are disabled
   */
  public LiveLagWatcher(LiveSnapshotSubscriber subscriber, List<WatchTarget> targets, MetricsReporter reporter) {
    this.subscriber = Objects.requireNonNull(subscriber, "subscriber cannot be null");
    this.targets = List.copyOf(targets);
    this.reporter = reporter;
  }

  public Future<Void> start() {
    if (targets.isEmpty()) {
      log.info("No consumer groups configured for watching");
      return Future.succeededFuture();
    }
    log.info("Watching {} consumer group(s): {}", targets.size(), targets);
    for (WatchTarget target : targets) {
      LiveMonitorSession session = new LiveMonitorSession(subscriber, target.clusterId(), target.groupId(),
        snapshot -> report(target, snapshot));
      sessions.put(target, session);
      session.setLiveMode(true);
    }
    return Future.succeededFuture();
  }

  public Future<Void> stop() {
    log.info("Stopping live lag watcher");
    sessions.forEach((target, session) -> {
      session.close();
      if (reporter != null) {
        reporter.removeGroup(target.clusterId(), target.groupId());
      }
    });
    sessions.clear();
    return Future.succeededFuture();
  }

  /**
   * Channel status per watched group, keyed by {@code cluster:group}.
   */
  public Map<String, String> statuses() {
    Map<String, String> statuses = new LinkedHashMap<>();
    sessions.forEach((target, session) -> statuses.put(target.toString(), session.status().name()));
    return statuses;
  }

  LiveMonitorSession session(WatchTarget target) {
    return sessions.get(target);
  }

  private void report(WatchTarget target, LiveSnapshot snapshot) {
    log.debug("Snapshot for {}: totalLag={}, state={}", target, snapshot.totalLag(), snapshot.state());
    if (reporter == null) {
      return;
    }
    reporter.reportSnapshot(target.clusterId(), target.groupId(), snapshot)
      .onFailure(err -> log.warn("Failed to report snapshot for {}: {}", target, err.getMessage()));
  }
}
