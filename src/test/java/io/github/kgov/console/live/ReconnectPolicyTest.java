package io.github.kgov.console.live;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ReconnectPolicy backoff.
 */
public class ReconnectPolicyTest {

  @Test
  void defaultPolicy_doublesUpToCap() {
    ReconnectPolicy policy = ReconnectPolicy.DEFAULT;

    assertEquals(1_000, policy.delayFor(0));
    assertEquals(2_000, policy.delayFor(1));
    assertEquals(4_000, policy.delayFor(2));
    assertEquals(8_000, policy.delayFor(3));
    assertEquals(16_000, policy.delayFor(4));
    assertEquals(30_000, policy.delayFor(5));
  }

  @Test
  void delayFor_largeAttemptDoesNotOverflow() {
    ReconnectPolicy policy = new ReconnectPolicy(1_000, 30_000, 100);

    assertEquals(30_000, policy.delayFor(40));
    assertEquals(30_000, policy.delayFor(62));
    assertEquals(30_000, policy.delayFor(Integer.MAX_VALUE));
  }

  @Test
  void canRetry_boundedByMaxAttempts() {
    ReconnectPolicy policy = ReconnectPolicy.DEFAULT;

    assertTrue(policy.canRetry(0));
    assertTrue(policy.canRetry(4));
    assertFalse(policy.canRetry(5));
  }

  @Test
  void zeroAttempts_neverRetries() {
    assertFalse(new ReconnectPolicy(10, 10, 0).canRetry(0));
  }

  @Test
  void invalidDelays_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(0, 100, 1));
    assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(200, 100, 1));
    assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(100, 100, -1));
  }
}
