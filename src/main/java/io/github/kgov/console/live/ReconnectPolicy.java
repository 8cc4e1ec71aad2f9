package io.github.kgov.console.live;

/**
 * Exponential reconnect backoff: {@code min(baseDelayMs * 2^attempt, maxDelayMs)}.
 *
 * @param baseDelayMs delay before the first reconnect
 * @param maxDelayMs upper bound of any delay
 * @param maxAttempts reconnects tried before giving up, 0 disables reconnecting
 */
public record ReconnectPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {

  public static final ReconnectPolicy DEFAULT = new ReconnectPolicy(1_000L, 30_000L, 5);

  public ReconnectPolicy {
    if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
        "Invalid reconnect delays: base=" + baseDelayMs + ", max=" + maxDelayMs);
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts cannot be negative: " + maxAttempts);
    }
  }

  /**
   * @param attempt zero based number of reconnects already tried
   */
  public long delayFor(int attempt) {
    if (attempt >= 31) {
      return maxDelayMs;
    }
    long factor = 1L << attempt;
    if (baseDelayMs > maxDelayMs / factor) {
      return maxDelayMs;
    }
    return Math.min(baseDelayMs * factor, maxDelayMs);
  }

  public boolean canRetry(int attempt) {
    return attempt < maxAttempts;
  }
}
