package io.github.kgov.console.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for catalog resource parsing.
 */
public class ResourceModelTest {

  @Test
  void topic_ownersList() {
    Topic topic = Topic.fromJson(new JsonObject()
      .put("name", "dev.orders.created")
      .put("owners", new JsonArray().add("team-a").add("team-b"))
      .put("partition_count", 6)
      .put("environment", "dev"));

    assertEquals(List.of("team-a", "team-b"), topic.owners());
    assertEquals(6, topic.partitionCount());
    assertNull(topic.replicationFactor());
  }

  @Test
  void topic_singleOwnerFallback() {
    Topic topic = Topic.fromJson(new JsonObject().put("name", "t").put("owner", "team-a"));

    assertEquals(List.of("team-a"), topic.owners());
    assertTrue(topic.tags().isEmpty());
  }

  @Test
  void policy_defaults() {
    Policy policy = Policy.fromJson(new JsonObject()
      .put("policy_id", "p-1")
      .put("policy_type", "naming")
      .put("name", "balanced")
      .put("version", 2)
      .put("status", "active"));

    assertEquals(PolicyStatus.ACTIVE, policy.status());
    assertEquals(2, policy.version());
    assertEquals("", policy.description());
    assertEquals("total", policy.targetEnvironment());
    assertTrue(policy.content().isEmpty());
  }

  @Test
  void policyStatus_unknownValues() {
    assertEquals(PolicyStatus.UNKNOWN, PolicyStatus.fromString(null));
    assertEquals(PolicyStatus.UNKNOWN, PolicyStatus.fromString("retired"));
    assertEquals(PolicyStatus.DRAFT, PolicyStatus.fromString("DRAFT"));
  }

  @Test
  void activePolicies_missingSide() {
    ActivePolicies active = ActivePolicies.fromJson(new JsonObject()
      .put("environment", "prod")
      .put("naming_policy", new JsonObject().put("policy_id", "n-1").put("status", "ACTIVE")));

    assertEquals("prod", active.environment());
    assertEquals("n-1", active.naming().policyId());
    assertNull(active.guardrail());
  }

  @Test
  void policyDraft_defaultsAndJson() {
    PolicyDraft draft = new PolicyDraft("guardrail", "prod-rules", null,
      new JsonObject().put("min_replication", 3), "alice", null);

    JsonObject json = draft.toJson();

    assertEquals("guardrail", json.getString("policy_type"));
    assertEquals("", json.getString("description"));
    assertEquals("total", json.getString("target_environment"));
    assertEquals(3, json.getJsonObject("content").getInteger("min_replication"));
    assertEquals("alice", json.getString("created_by"));
  }

  @Test
  void connectorStatus_running() {
    ConnectorStatus status = ConnectorStatus.fromJson(new JsonObject()
      .put("name", "sink")
      .put("connector", new JsonObject().put("state", "RUNNING").put("worker_id", "w1"))
      .put("tasks", new JsonArray()
        .add(new JsonObject().put("id", 0).put("state", "RUNNING"))
        .add(new JsonObject().put("id", 1).put("state", "FAILED"))));

    assertTrue(status.isRunning());
    assertEquals(2, status.tasks().size());
    assertEquals("FAILED", status.tasks().get(1).state());
  }

  @Test
  void connector_configValuesAsStrings() {
    Connector connector = Connector.fromJson(new JsonObject()
      .put("name", "sink")
      .put("config", new JsonObject().put("tasks.max", 2).put("topics", "orders")));

    assertEquals("2", connector.config().get("tasks.max"));
    assertEquals("orders", connector.config().get("topics"));
  }

  @Test
  void auditLog_fromJson() {
    AuditLog log = AuditLog.fromJson(new JsonObject()
      .put("activity_type", "topic")
      .put("action", "APPLY")
      .put("target", "dev.orders.created")
      .put("message", "applied")
      .put("actor", "alice")
      .put("timestamp", "2025-10-20T10:00:00Z"));

    assertEquals("topic", log.activityType());
    assertEquals("APPLY", log.action());
    assertEquals("alice", log.actor());
  }
}
