package io.github.kgov.console.live;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.LagDataPoint;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LagHistoryBuffer.
 */
public class LagHistoryBufferTest {

  private static LagDataPoint point(int second, long totalLag) {
    return new LagDataPoint(String.format("2025-10-20T10:00:%02dZ", second % 60), totalLag, totalLag / 2);
  }

  @Test
  void emptyBuffer() {
    LagHistoryBuffer buffer = new LagHistoryBuffer(30);

    assertTrue(buffer.isEmpty());
    assertNull(buffer.latest());
    assertTrue(buffer.points().isEmpty());
  }

  @Test
  void keepsArrivalOrder() {
    LagHistoryBuffer buffer = new LagHistoryBuffer(30);

    buffer.add(point(1, 100));
    buffer.add(point(2, 200));
    buffer.add(point(3, 150));

    List<Long> lags = buffer.points().stream().map(LagDataPoint::totalLag).toList();
    assertEquals(List.of(100L, 200L, 150L), lags);
    assertEquals(150, buffer.latest().totalLag());
  }

  @Test
  void evictsOldestBeyondCapacity() {
    LagHistoryBuffer buffer = new LagHistoryBuffer(30);

    for (int i = 0; i < 45; i++) {
      buffer.add(point(i, i));
    }

    assertEquals(30, buffer.size());
    assertEquals(15, buffer.points().get(0).totalLag());
    assertEquals(44, buffer.latest().totalLag());
  }

  @Test
  void pointsIsACopy() {
    LagHistoryBuffer buffer = new LagHistoryBuffer(2);
    buffer.add(point(1, 1));

    List<LagDataPoint> before = buffer.points();
    buffer.add(point(2, 2));

    assertEquals(1, before.size());
    assertEquals(2, buffer.size());
  }

  @Test
  void sizeBoundedByCapacity() {
    LagHistoryBuffer buffer = new LagHistoryBuffer(3);
    for (int i = 0; i < 10; i++) {
      buffer.add(point(i, i * 10L));
    }

    assertEquals(3, buffer.capacity());
    assertEquals(buffer.capacity(), buffer.size());
  }

  @Test
  void invalidCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new LagHistoryBuffer(0));
  }
}
