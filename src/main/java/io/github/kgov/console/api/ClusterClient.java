package io.github.kgov.console.api;

import static io.github.kgov.console.api.ApiResults.requireText;
import static io.github.kgov.console.api.ApiResults.segment;

import io.github.kgov.console.model.ConnectionTestResult;
import io.github.kgov.console.model.KafkaCluster;
import io.github.kgov.console.model.ServiceEndpoint;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registered infrastructure endpoints and backend liveness.
 */
public class ClusterClient {

  private static final String BASE = "/api/v1/clusters";

  private final ApiTransport transport;

  public ClusterClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  public Future<List<KafkaCluster>> listKafka() {
    return transport.get(BASE + "/kafka", Map.of())
      .map(body -> ApiResults.list(body, "clusters", KafkaCluster::fromJson));
  }

  public Future<List<ServiceEndpoint>> listSchemaRegistries() {
    return transport.get(BASE + "/schema-registries", Map.of())
      .map(body -> ApiResults.list(body, "registries", ServiceEndpoint::registryFromJson));
  }

  public Future<List<ServiceEndpoint>> listConnects() {
    return transport.get(BASE + "/connects", Map.of())
      .map(body -> ApiResults.list(body, "connects", ServiceEndpoint::connectFromJson));
  }

  public Future<List<ServiceEndpoint>> listStorages() {
    return transport.get(BASE + "/storages", Map.of())
      .map(body -> ApiResults.list(body, "storages", ServiceEndpoint::storageFromJson));
  }

  public Future<ConnectionTestResult> testKafka(String clusterId) {
    requireText(clusterId, "clusterId");
    return transport.post(BASE + "/kafka/" + segment(clusterId) + "/test", Map.of(), null)
      .map(body -> ConnectionTestResult.fromJson(ApiResults.object(body)));
  }

  /**
   * Backend liveness. Succeeds with the reported status, {@code healthy} when the backend is up.
   */
  public Future<String> health() {
    return transport.get("/health", Map.of())
      .map(body -> {
        JsonObject json = ApiResults.object(body);
        return json.getString("status", "unknown");
      });
  }
}
