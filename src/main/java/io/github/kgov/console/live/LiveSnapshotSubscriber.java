package io.github.kgov.console.live;

import io.github.kgov.console.model.LiveSnapshot;
import io.github.kgov.console.model.LiveStreamEvent;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.DecodeException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens live consumer-group channels on the backend WebSocket endpoint.
 *
 * <p>Frames are handed to the listener in arrival order without dedup or reordering.
 * An unexpected close is followed by reconnects according to {@link ReconnectPolicy}.
 */
public class LiveSnapshotSubscriber {

  private static final Logger log = LoggerFactory.getLogger(LiveSnapshotSubscriber.class);

  private final Vertx vertx;
  private final WebSocketClient client;
  private final String wsBaseUrl;
  private final LiveFeedConfig config;

  public LiveSnapshotSubscriber(Vertx vertx, String wsBaseUrl, LiveFeedConfig config) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.wsBaseUrl = stripTrailingSlash(Objects.requireNonNull(wsBaseUrl, "wsBaseUrl cannot be null"));
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.client = vertx.createWebSocketClient(new WebSocketClientOptions());
  }

  public LiveFeedConfig config() {
    return config;
  }

  /**
   * Subscribes to snapshots only.
   */
  public Subscription subscribe(String clusterId, String groupId, Consumer<LiveSnapshot> onSnapshot) {
    Objects.requireNonNull(onSnapshot, "onSnapshot cannot be null");
    return subscribe(clusterId, groupId, (snapshot, event) -> onSnapshot.accept(snapshot));
  }

  /**
   * Opens a channel for one consumer group.
   *
   * @param clusterId cluster of the group
   * @param groupId consumer group id
   * @param listener receives snapshots, error events and status changes
   * @return handle to close the channel
   * @throws IllegalArgumentException if either id is blank
   */
  public Subscription subscribe(String clusterId, String groupId, LiveFeedListener listener) {
    if (clusterId == null || clusterId.isBlank() || groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("clusterId and groupId are required");
    }
    Objects.requireNonNull(listener, "listener cannot be null");
    LiveChannel channel = new LiveChannel(channelUri(clusterId, groupId), groupId, listener);
    channel.connect();
    return channel;
  }

  String channelUri(String clusterId, String groupId) {
    return wsBaseUrl + "/ws/consumers/groups/" + encode(groupId) + "/live"
      + "?cluster_id=" + encode(clusterId)
      + "&interval=" + config.intervalSeconds();
  }

  public void close() {
    client.close();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private final class LiveChannel implements Subscription {

    private final String uri;
    private final String groupId;
    private final LiveFeedListener listener;
    private final AtomicReference<ConnectionStatus> status =
      new AtomicReference<>(ConnectionStatus.DISCONNECTED);

    private volatile boolean closed;
    private volatile WebSocket socket;
    private Long reconnectTimerId;
    private int attempt;

    LiveChannel(String uri, String groupId, LiveFeedListener listener) {
      this.uri = uri;
      this.groupId = groupId;
      this.listener = listener;
    }

    void connect() {
      if (closed) {
        return;
      }
      updateStatus(ConnectionStatus.CONNECTING);
      log.debug("Connecting live channel {}", uri);
      client.connect(new WebSocketConnectOptions().setAbsoluteURI(uri))
        .onSuccess(ws -> {
          if (closed) {
            ws.close();
            return;
          }
          socket = ws;
          attempt = 0;
          ws.textMessageHandler(this::onFrame);
          ws.exceptionHandler(err -> log.warn("Live channel error for group {}: {}", groupId, err.getMessage()));
          ws.closeHandler(v -> onClosed());
          log.info("Live channel open for group {}", groupId);
          updateStatus(ConnectionStatus.CONNECTED);
        })
        .onFailure(err -> {
          log.warn("Failed to open live channel for group {}: {}", groupId, err.getMessage());
          scheduleReconnect();
        });
    }

    private void onFrame(String frame) {
      if (closed) {
        return;
      }
      LiveStreamEvent event;
      try {
        event = LiveStreamEvent.parse(frame);
      } catch (DecodeException | ClassCastException e) {
        log.warn("Dropping malformed frame on group {}: {}", groupId, e.getMessage());
        return;
      }

      switch (event.type()) {
        case SNAPSHOT -> {
          if (event.data() == null) {
            log.debug("Snapshot event without data on group {}", groupId);
            return;
          }
          deliver(event);
        }
        case CONNECTED -> log.info("Live feed handshake for group {}: {}", groupId, event.message());
        case ERROR -> {
          log.warn("Live feed error for group {}: {}", groupId, event.message());
          listener.onError(event.message() != null ? event.message() : "Unknown error");
        }
        case HEARTBEAT -> log.trace("Heartbeat on group {}", groupId);
        default -> log.debug("Ignoring unknown event type on group {}: {}", groupId, frame);
      }
    }

    private void deliver(LiveStreamEvent event) {
      LiveSnapshot snapshot;
      try {
        snapshot = event.snapshot();
      } catch (ClassCastException e) {
        log.warn("Dropping malformed snapshot on group {}: {}", groupId, e.getMessage());
        return;
      }
      listener.onSnapshot(snapshot, event);
    }

    private void onClosed() {
      socket = null;
      if (closed) {
        return;
      }
      log.info("Live channel closed for group {}", groupId);
      updateStatus(ConnectionStatus.DISCONNECTED);
      scheduleReconnect();
    }

    private void scheduleReconnect() {
      if (closed) {
        return;
      }
      ReconnectPolicy policy = config.reconnect();
      if (!policy.canRetry(attempt)) {
        log.error("Giving up on live channel for group {} after {} reconnect attempts", groupId, attempt);
        updateStatus(ConnectionStatus.FAILED);
        return;
      }
      long delay = policy.delayFor(attempt);
      attempt++;
      log.info("Reconnecting live channel for group {} in {}ms (attempt {}/{})",
        groupId, delay, attempt, policy.maxAttempts());
      updateStatus(ConnectionStatus.DISCONNECTED);
      reconnectTimerId = vertx.setTimer(delay, id -> {
        reconnectTimerId = null;
        connect();
      });
    }

    @Override
    public void unsubscribe() {
      if (closed) {
        return;
      }
      closed = true;
      if (reconnectTimerId != null) {
        vertx.cancelTimer(reconnectTimerId);
        reconnectTimerId = null;
      }
      WebSocket ws = socket;
      socket = null;
      if (ws != null) {
        ws.close();
      }
      log.info("Unsubscribed live channel for group {}", groupId);
      updateStatus(ConnectionStatus.DISCONNECTED);
    }

    @Override
    public ConnectionStatus status() {
      return status.get();
    }

    @Override
    public boolean isActive() {
      return !closed && status.get() != ConnectionStatus.FAILED;
    }

    private void updateStatus(ConnectionStatus next) {
      ConnectionStatus previous = status.getAndSet(next);
      if (previous != next) {
        listener.onStatus(next);
      }
    }
  }
}
