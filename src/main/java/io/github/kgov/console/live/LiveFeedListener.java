package io.github.kgov.console.live;

import io.github.kgov.console.model.LiveSnapshot;
import io.github.kgov.console.model.LiveStreamEvent;

/**
 * Receives live channel callbacks, in arrival order, on the Vert.x context.
 */
@FunctionalInterface
public interface LiveFeedListener {

  void onSnapshot(LiveSnapshot snapshot, LiveStreamEvent event);

  default void onError(String message) {
  }

  default void onStatus(ConnectionStatus status) {
  }
}
