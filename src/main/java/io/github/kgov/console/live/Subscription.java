package io.github.kgov.console.live;

/**
 * Handle of an open live channel.
 */
public interface Subscription {

  /**
   * Closes the channel and cancels any pending reconnect. Idempotent.
   */
  void unsubscribe();

  ConnectionStatus status();

  boolean isActive();
}
