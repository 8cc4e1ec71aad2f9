package io.github.kgov.console.live;

/**
 * State of a live channel. FAILED is terminal: reconnect attempts are exhausted.
 */
public enum ConnectionStatus {
  CONNECTING,
  CONNECTED,
  DISCONNECTED,
  FAILED
}
