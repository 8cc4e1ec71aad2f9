package io.github.kgov.console.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.LiveStreamEvent.EventType;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for live snapshot and stream event parsing.
 */
public class LiveSnapshotTest {

  static JsonObject snapshotJson(long totalLag, long p95Lag, long... partitionLags) {
    JsonArray partitions = new JsonArray();
    for (int i = 0; i < partitionLags.length; i++) {
      partitions.add(new JsonObject()
        .put("topic", "orders")
        .put("partition", i)
        .put("lag", partitionLags[i])
        .put("committed_offset", 100L)
        .put("latest_offset", 100L + partitionLags[i])
        .put("assigned_member_id", i == 0 ? null : "member-1"));
    }
    return new JsonObject()
      .put("timestamp", "2025-10-20T10:00:00Z")
      .put("cluster_id", "local")
      .put("group_id", "orders-consumer")
      .put("state", "Stable")
      .put("member_count", 2)
      .put("topic_count", 1)
      .put("partition_assignor", "range")
      .put("lag_stats", new JsonObject()
        .put("total_lag", totalLag)
        .put("mean_lag", 12.5)
        .put("p50_lag", 10L)
        .put("p95_lag", p95Lag)
        .put("max_lag", 40L)
        .put("partition_count", partitionLags.length))
      .put("partitions", partitions)
      .put("members", new JsonArray().add(new JsonObject()
        .put("member_id", "member-1")
        .put("client_id", "client-a")
        .put("partition_count", 3)))
      .put("fairness_gini", 0.25)
      .put("stuck_count", 0)
      .put("is_rebalancing", true)
      .put("has_lag_spike", false);
  }

  @Test
  void fromJson_allFields() {
    LiveSnapshot snapshot = LiveSnapshot.fromJson(snapshotJson(50, 30, 10, 40));

    assertEquals("2025-10-20T10:00:00Z", snapshot.timestamp());
    assertEquals("local", snapshot.clusterId());
    assertEquals("orders-consumer", snapshot.groupId());
    assertEquals("Stable", snapshot.state());
    assertEquals(2, snapshot.memberCount());
    assertEquals(50, snapshot.totalLag());
    assertEquals(30, snapshot.lagStats().p95Lag());
    assertEquals(2, snapshot.partitions().size());
    assertNull(snapshot.partitions().get(0).assignedMemberId());
    assertEquals("member-1", snapshot.partitions().get(1).assignedMemberId());
    assertEquals(140L, snapshot.partitions().get(1).latestOffset());
    assertEquals("client-a", snapshot.members().get(0).clientId());
    assertEquals(0.25, snapshot.fairnessGini(), 0.0001);
    assertTrue(snapshot.rebalancing());
    assertFalse(snapshot.lagSpike());
  }

  @Test
  void fromJson_missingLagStats_usesEmpty() {
    LiveSnapshot snapshot = LiveSnapshot.fromJson(new JsonObject().put("group_id", "g"));

    assertSame(LagStats.EMPTY, snapshot.lagStats());
    assertEquals(0, snapshot.totalLag());
    assertTrue(snapshot.partitions().isEmpty());
    assertTrue(snapshot.members().isEmpty());
  }

  @Test
  void partitionsAbove_isStrict() {
    LiveSnapshot snapshot = LiveSnapshot.fromJson(snapshotJson(25_001, 15_000, 10_000, 15_000, 1));

    List<LiveSnapshot.PartitionLag> stuck = snapshot.partitionsAbove(10_000);

    assertEquals(1, stuck.size());
    assertEquals(1, stuck.get(0).partition());
    assertEquals(15_000, stuck.get(0).lag());
  }

  @Test
  void lagDataPoint_takesTotalAndP95() {
    LagDataPoint point = LagDataPoint.of(LiveSnapshot.fromJson(snapshotJson(200, 150, 200)));

    assertEquals("2025-10-20T10:00:00Z", point.timestamp());
    assertEquals(200, point.totalLag());
    assertEquals(150, point.p95Lag());
  }

  @Test
  void streamEvent_snapshot() {
    String frame = new JsonObject()
      .put("type", "snapshot")
      .put("data", snapshotJson(7, 5, 7))
      .put("message", "Lag updated")
      .encode();

    LiveStreamEvent event = LiveStreamEvent.parse(frame);

    assertEquals(EventType.SNAPSHOT, event.type());
    assertEquals("Lag updated", event.message());
    assertEquals(7, event.snapshot().totalLag());
  }

  @Test
  void streamEvent_unknownType() {
    LiveStreamEvent event = LiveStreamEvent.parse("{\"type\":\"pong\"}");

    assertEquals(EventType.UNKNOWN, event.type());
    assertThrows(IllegalStateException.class, event::snapshot);
  }

  @Test
  void streamEvent_errorCarriesMessage() {
    LiveStreamEvent event = LiveStreamEvent.parse("{\"type\":\"error\",\"message\":\"group not found\"}");

    assertEquals(EventType.ERROR, event.type());
    assertEquals("group not found", event.message());
  }

  @Test
  void streamEvent_malformedFrame() {
    assertThrows(DecodeException.class, () -> LiveStreamEvent.parse("not json"));
  }
}
