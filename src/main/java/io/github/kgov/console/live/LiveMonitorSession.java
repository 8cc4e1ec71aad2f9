package io.github.kgov.console.live;

import io.github.kgov.console.model.LagDataPoint;
import io.github.kgov.console.model.LiveSnapshot;
import io.github.kgov.console.model.LiveSnapshot.PartitionLag;
import io.github.kgov.console.model.LiveStreamEvent;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live monitoring state of one consumer group: latest snapshot, lag history,
 * stuck partitions and recent event messages.
 *
 * <p>While live mode is off the session holds no subscription and ignores any snapshot
 * still in flight, so its state does not change. Turning live mode back on resubscribes
 * and keeps the existing history.
 */
public class LiveMonitorSession {

  private static final Logger log = LoggerFactory.getLogger(LiveMonitorSession.class);

  private final LiveSnapshotSubscriber subscriber;
  private final String clusterId;
  private final String groupId;
  private final long stuckLagThreshold;
  private final int recentEventCount;
  private final LagHistoryBuffer history;
  private final ArrayDeque<String> recentEvents;
  private final Consumer<LiveSnapshot> onUpdate;

  private Subscription subscription;
  private volatile boolean liveMode;
  private volatile boolean closed;
  private LiveSnapshot latest;
  private List<PartitionLag> stuckPartitions = List.of();
  private String lastError;

  public LiveMonitorSession(LiveSnapshotSubscriber subscriber, String clusterId, String groupId) {
    this(subscriber, clusterId, groupId, snapshot -> { });
  }

  /**
   * @param onUpdate called after each accepted snapshot has been applied to the session
   */
  public LiveMonitorSession(LiveSnapshotSubscriber subscriber, String clusterId, String groupId,
      Consumer<LiveSnapshot> onUpdate) {
    this.subscriber = Objects.requireNonNull(subscriber, "subscriber cannot be null");
    this.clusterId = clusterId;
    this.groupId = groupId;
    this.onUpdate = Objects.requireNonNull(onUpdate, "onUpdate cannot be null");
    LiveFeedConfig config = subscriber.config();
    this.stuckLagThreshold = config.stuckLagThreshold();
    this.recentEventCount = config.recentEventCount();
    this.history = new LagHistoryBuffer(config.historySize());
    this.recentEvents = new ArrayDeque<>(recentEventCount);
  }

  /**
   * Turns live mode on or off. Idempotent.
   *
   * @throws IllegalStateException if the session was closed
   */
  public void setLiveMode(boolean enabled) {
    if (closed) {
      throw new IllegalStateException("Session closed for group " + groupId);
    }
    if (enabled == liveMode) {
      return;
    }
    liveMode = enabled;
    if (enabled) {
      log.info("Live mode on for {}/{}", clusterId, groupId);
      subscription = subscriber.subscribe(clusterId, groupId, new SessionListener());
    } else {
      log.info("Live mode off for {}/{}", clusterId, groupId);
      unsubscribe();
    }
  }

  public boolean isLiveMode() {
    return liveMode;
  }

  /**
   * Ends the session and drops its state.
   */
  public void close() {
    if (closed) {
      return;
    }
    liveMode = false;
    closed = true;
    unsubscribe();
    latest = null;
    stuckPartitions = List.of();
    recentEvents.clear();
    log.debug("Closed monitor session for {}/{}", clusterId, groupId);
  }

  void accept(LiveSnapshot snapshot, String message) {
    if (!liveMode || closed) {
      log.debug("Ignoring snapshot for {} received while live mode is off", groupId);
      return;
    }
    latest = snapshot;
    history.add(LagDataPoint.of(snapshot));
    stuckPartitions = snapshot.partitionsAbove(stuckLagThreshold);
    if (message != null) {
      if (recentEvents.size() >= recentEventCount) {
        recentEvents.removeFirst();
      }
      recentEvents.addLast(message);
    }
    onUpdate.accept(snapshot);
  }

  /**
   * Latest snapshot, null until the first one arrives.
   */
  public LiveSnapshot latest() {
    return latest;
  }

  public List<LagDataPoint> history() {
    return history.points();
  }

  public List<PartitionLag> stuckPartitions() {
    return stuckPartitions;
  }

  public List<String> recentEvents() {
    return List.copyOf(recentEvents);
  }

  /**
   * Message of the last error event, null if none was received.
   */
  public String lastError() {
    return lastError;
  }

  public ConnectionStatus status() {
    return subscription != null ? subscription.status() : ConnectionStatus.DISCONNECTED;
  }

  public String clusterId() {
    return clusterId;
  }

  public String groupId() {
    return groupId;
  }

  private void unsubscribe() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
  }

  private final class SessionListener implements LiveFeedListener {

    @Override
    public void onSnapshot(LiveSnapshot snapshot, LiveStreamEvent event) {
      accept(snapshot, event.message());
    }

    @Override
    public void onError(String message) {
      lastError = message;
    }

    @Override
    public void onStatus(ConnectionStatus status) {
      log.debug("Live channel for {}/{} is {}", clusterId, groupId, status);
    }
  }
}
