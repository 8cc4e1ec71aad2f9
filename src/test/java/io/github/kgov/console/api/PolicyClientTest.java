package io.github.kgov.console.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.ActivePolicies;
import io.github.kgov.console.model.Policy;
import io.github.kgov.console.model.PolicyDraft;
import io.github.kgov.console.model.PolicyStatus;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PolicyClient.
 */
public class PolicyClientTest {

  private final FakeApiTransport transport = new FakeApiTransport();
  private final PolicyClient policies = new PolicyClient(transport);

  private static JsonObject policyJson(String id, int version, String status) {
    return new JsonObject()
      .put("policy_id", id)
      .put("policy_type", "naming")
      .put("name", "balanced")
      .put("version", version)
      .put("status", status);
  }

  @Test
  void list_unwrapsPolicies() {
    transport.respond(HttpMethod.GET, "/api/v1/policies", new JsonObject()
      .put("policies", new JsonArray().add(policyJson("p-1", 1, "DRAFT")).add(policyJson("p-2", 3, "ACTIVE")))
      .put("total", 2));

    List<Policy> result = policies.list().result();

    assertEquals(2, result.size());
    assertEquals(PolicyStatus.ACTIVE, result.get(1).status());
  }

  @Test
  void create_unwrapsPolicyFromMessageEnvelope() {
    transport.respond(HttpMethod.POST, "/api/v1/policies", new JsonObject()
      .put("policy", policyJson("p-9", 1, "DRAFT"))
      .put("message", "Policy created"));
    PolicyDraft draft = new PolicyDraft("naming", "balanced", "desc", new JsonObject().put("pattern", "x"),
      "alice", "dev");

    Policy created = policies.create(draft).result();

    assertEquals("p-9", created.policyId());
    assertEquals(PolicyStatus.DRAFT, created.status());
    JsonObject body = assertInstanceOf(JsonObject.class, transport.lastCall().body());
    assertEquals("dev", body.getString("target_environment"));
  }

  @Test
  void get_latestVersionSendsNoVersion() {
    transport.respond(HttpMethod.GET, "/api/v1/policies/p-1", new JsonObject().put("policy", policyJson("p-1", 4, "ACTIVE")));

    Policy policy = policies.get("p-1", null).result();

    assertEquals(4, policy.version());
    assertNull(transport.lastCall().queryParam("version"));
  }

  @Test
  void activate_withVersion() {
    transport.respond(HttpMethod.POST, "/api/v1/policies/p-1/activate",
      new JsonObject().put("policy", policyJson("p-1", 2, "ACTIVE")));

    Policy policy = policies.activate("p-1", 2).result();

    assertEquals(PolicyStatus.ACTIVE, policy.status());
    JsonObject body = assertInstanceOf(JsonObject.class, transport.lastCall().body());
    assertEquals(2, body.getInteger("version"));
  }

  @Test
  void delete_specificVersion() {
    transport.respond(HttpMethod.DELETE, "/api/v1/policies/p-1", null);

    assertTrue(policies.delete("p-1", 3).succeeded());
    assertEquals("3", transport.lastCall().queryParam("version"));
  }

  @Test
  void versions_unwrapsVersions() {
    transport.respond(HttpMethod.GET, "/api/v1/policies/p-1/versions", new JsonObject()
      .put("versions", new JsonArray().add(policyJson("p-1", 1, "ARCHIVED")).add(policyJson("p-1", 2, "ACTIVE"))));

    assertEquals(2, policies.versions("p-1").result().size());
  }

  @Test
  void activeForEnvironment() {
    transport.respond(HttpMethod.GET, "/api/v1/policies/active/environment", new JsonObject()
      .put("environment", "prod")
      .put("naming_policy", policyJson("n-1", 1, "ACTIVE"))
      .put("guardrail_policy", null));

    ActivePolicies active = policies.activeForEnvironment("prod").result();

    assertEquals("n-1", active.naming().policyId());
    assertNull(active.guardrail());
    assertEquals("prod", transport.lastCall().queryParam("environment"));
  }

  @Test
  void activeForEnvironment_rejectsUnknownEnvironment() {
    assertThrows(IllegalArgumentException.class, () -> policies.activeForEnvironment("qa"));
    assertTrue(transport.calls().isEmpty());
  }
}
