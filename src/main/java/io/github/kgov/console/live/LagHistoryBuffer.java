package io.github.kgov.console.live;

import io.github.kgov.console.model.LagDataPoint;
import java.util.ArrayDeque;
import java.util.List;

/**
 * Bounded lag history, oldest first. Appending beyond capacity evicts the oldest point.
 * Not thread-safe; confined to the context that receives snapshots.
 */
public class LagHistoryBuffer {

  private final ArrayDeque<LagDataPoint> points;
  private final int capacity;

  public LagHistoryBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.points = new ArrayDeque<>(capacity);
  }

  public void add(LagDataPoint point) {
    if (points.size() >= capacity) {
      points.removeFirst();
    }
    points.addLast(point);
  }

  public List<LagDataPoint> points() {
    return List.copyOf(points);
  }

  public LagDataPoint latest() {
    return points.peekLast();
  }

  public int size() {
    return points.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }
}
