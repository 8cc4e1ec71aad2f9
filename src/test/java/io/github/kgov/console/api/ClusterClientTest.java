package io.github.kgov.console.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.ConnectionTestResult;
import io.github.kgov.console.model.ConsumerGroupInfo;
import io.github.kgov.console.model.ConsumerGroupSummary;
import io.github.kgov.console.model.KafkaCluster;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ClusterClient and ConsumerClient.
 */
public class ClusterClientTest {

  private final FakeApiTransport transport = new FakeApiTransport();
  private final ClusterClient clusters = new ClusterClient(transport);
  private final ConsumerClient consumers = new ConsumerClient(transport);

  @Test
  void listKafka_bareArray() {
    transport.respond(HttpMethod.GET, "/api/v1/clusters/kafka", new JsonArray()
      .add(new JsonObject().put("cluster_id", "local").put("bootstrap_servers", "localhost:9092")));

    List<KafkaCluster> result = clusters.listKafka().result();

    assertEquals("localhost:9092", result.get(0).bootstrapServers());
    assertTrue(result.get(0).active());
  }

  @Test
  void testKafka_result() {
    transport.respond(HttpMethod.POST, "/api/v1/clusters/kafka/local/test", new JsonObject()
      .put("success", false)
      .put("message", "timeout"));

    ConnectionTestResult result = clusters.testKafka("local").result();

    assertFalse(result.success());
    assertEquals("timeout", result.message());
    assertNull(result.latencyMs());
  }

  @Test
  void health_status() {
    transport.respond(HttpMethod.GET, "/health", new JsonObject().put("status", "healthy"));

    assertEquals("healthy", clusters.health().result());
  }

  @Test
  void health_unreachable() {
    transport.fail(HttpMethod.GET, "/health", ApiException.network("GET /health", new RuntimeException("refused")));

    assertTrue(clusters.health().failed());
  }

  @Test
  void listGroups_wrapped() {
    transport.respond(HttpMethod.GET, "/api/v1/consumers/groups", new JsonObject()
      .put("groups", new JsonArray().add(new JsonObject()
        .put("group_id", "orders-consumer")
        .put("state", "Stable")
        .put("member_count", 3)
        .put("lag_stats", new JsonObject().put("total_lag", 120).put("p95_lag", 80))))
      .put("total", 1));

    List<ConsumerGroupInfo> groups = consumers.listGroups("local").result();

    assertEquals(1, groups.size());
    assertEquals(120, groups.get(0).lagStats().totalLag());
    assertEquals("local", transport.lastCall().queryParam("cluster_id"));
  }

  @Test
  void summary_fields() {
    transport.respond(HttpMethod.GET, "/api/v1/consumers/groups/orders-consumer/summary", new JsonObject()
      .put("group_id", "orders-consumer")
      .put("state", "Stable")
      .put("lag", new JsonObject().put("p50", 10).put("p95", 90).put("max", 200).put("total", 400))
      .put("rebalance_score", 87.5)
      .put("fairness_gini", 0.1)
      .put("stuck", new JsonArray().add(new JsonObject().put("topic", "orders").put("partition", 2))));

    ConsumerGroupSummary summary = consumers.summary("local", "orders-consumer").result();

    assertEquals(400, summary.lag().get("total"));
    assertEquals(87.5, summary.rebalanceScore(), 0.001);
    assertEquals(1, summary.stuck().size());
  }
}
