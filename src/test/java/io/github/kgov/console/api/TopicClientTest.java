package io.github.kgov.console.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.BulkDeleteResult;
import io.github.kgov.console.model.DryRunResult;
import io.github.kgov.console.model.Topic;
import io.github.kgov.console.model.TopicMetadata;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TopicClient request shapes and response decoding.
 */
public class TopicClientTest {

  private final FakeApiTransport transport = new FakeApiTransport();
  private final TopicClient topics = new TopicClient(transport);

  @Test
  void list_pagedResponse() {
    transport.respond(HttpMethod.GET, "/api/v1/topics", new JsonObject()
      .put("items", new JsonArray().add(new JsonObject().put("name", "dev.orders.created")))
      .put("total", 1));

    List<Topic> result = topics.list("local").result();

    assertEquals(1, result.size());
    assertEquals("dev.orders.created", result.get(0).name());
    assertEquals("local", transport.lastCall().queryParam("cluster_id"));
  }

  @Test
  void list_legacyResponse() {
    transport.respond(HttpMethod.GET, "/api/v1/topics", new JsonObject()
      .put("topics", new JsonArray()
        .add(new JsonObject().put("name", "a"))
        .add(new JsonObject().put("name", "b"))));

    assertEquals(2, topics.list("local").result().size());
  }

  @Test
  void list_blankCluster() {
    assertThrows(IllegalArgumentException.class, () -> topics.list(" "));
  }

  @Test
  void delete_encodesName() {
    transport.respond(HttpMethod.DELETE, "/api/v1/topics/dev%20orders", null);

    assertTrue(topics.delete("local", "dev orders").succeeded());
  }

  @Test
  void bulkDelete_sendsNameArray() {
    transport.respond(HttpMethod.POST, "/api/v1/topics/bulk-delete", new JsonObject()
      .put("succeeded", new JsonArray().add("a"))
      .put("failed", new JsonArray().add("b"))
      .put("message", "1 of 2 deleted"));

    BulkDeleteResult result = topics.bulkDelete("local", List.of("a", "b")).result();

    assertEquals(List.of("a"), result.succeeded());
    assertEquals(List.of("b"), result.failed());
    JsonArray body = assertInstanceOf(JsonArray.class, transport.lastCall().body());
    assertEquals(new JsonArray().add("a").add("b"), body);
  }

  @Test
  void dryRun_wrapsYaml() {
    transport.respond(HttpMethod.POST, "/api/v1/topics/batch/dry-run", new JsonObject()
      .put("env", "dev")
      .put("change_id", "c-1")
      .put("plan", new JsonArray().add(new JsonObject().put("name", "dev.a").put("action", "CREATE"))));

    DryRunResult result = topics.dryRun("local", "env: dev").result();

    assertEquals(List.of("dev.a"), result.plannedNames());
    JsonObject body = assertInstanceOf(JsonObject.class, transport.lastCall().body());
    assertEquals("env: dev", body.getString("yaml_content"));
  }

  @Test
  void apply_failurePropagates() {
    transport.fail(HttpMethod.POST, "/api/v1/topics/batch/apply-yaml",
      ApiException.fromResponse(500, new JsonObject().put("detail", "boom")));

    Throwable cause = topics.applyYaml("local", "env: dev").cause();

    assertEquals("HTTP 500: boom", cause.getMessage());
  }

  @Test
  void updateMetadata_patch() {
    transport.respond(HttpMethod.PATCH, "/api/v1/topics/dev.a/metadata",
      new JsonObject().put("message", "updated"));

    String message = topics.updateMetadata("local", "dev.a",
      new TopicMetadata(List.of("team-a"), "Orders", List.of("pii"), "dev", null, null)).result();

    assertEquals("updated", message);
    assertEquals(HttpMethod.PATCH, transport.lastCall().method());
  }
}
