package io.github.kgov.console.api;

import static io.github.kgov.console.api.ApiResults.query;
import static io.github.kgov.console.api.ApiResults.requireText;
import static io.github.kgov.console.api.ApiResults.segment;

import io.github.kgov.console.model.BulkDeleteResult;
import io.github.kgov.console.model.DryRunResult;
import io.github.kgov.console.model.Topic;
import io.github.kgov.console.model.TopicApplyResponse;
import io.github.kgov.console.model.TopicMetadata;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topic catalog and batch operations.
 */
public class TopicClient {

  private static final Logger log = LoggerFactory.getLogger(TopicClient.class);

  private static final String BASE = "/api/v1/topics";
  private static final String CLUSTER_ID = "cluster_id";

  private final ApiTransport transport;

  public TopicClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  /**
   * Lists the topics registered for a cluster. Accepts both the paged ({@code items})
   * and the legacy ({@code topics}) response shape.
   */
  public Future<List<Topic>> list(String clusterId) {
    requireText(clusterId, "clusterId");
    return transport.get(BASE, query(CLUSTER_ID, clusterId))
      .map(body -> {
        if (body instanceof JsonObject json && json.containsKey("items")) {
          return ApiResults.list(body, "items", Topic::fromJson);
        }
        return ApiResults.list(body, "topics", Topic::fromJson);
      })
      .onSuccess(topics -> log.debug("Listed {} topics on cluster {}", topics.size(), clusterId))
      .onFailure(err -> log.warn("Failed to list topics on cluster {}: {}", clusterId, err.getMessage()));
  }

  public Future<Void> delete(String clusterId, String name) {
    requireText(clusterId, "clusterId");
    requireText(name, "name");
    return transport.delete(BASE + "/" + segment(name), query(CLUSTER_ID, clusterId))
      .<Void>mapEmpty()
      .onSuccess(v -> log.info("Deleted topic {} on cluster {}", name, clusterId))
      .onFailure(err -> log.warn("Failed to delete topic {}: {}", name, err.getMessage()));
  }

  public Future<BulkDeleteResult> bulkDelete(String clusterId, List<String> names) {
    requireText(clusterId, "clusterId");
    Objects.requireNonNull(names, "names cannot be null");
    return transport.post(BASE + "/bulk-delete", query(CLUSTER_ID, clusterId), new JsonArray(List.copyOf(names)))
      .map(body -> BulkDeleteResult.fromJson(ApiResults.object(body)))
      .onSuccess(result -> log.info("Bulk delete on {}: {} succeeded, {} failed",
        clusterId, result.succeeded().size(), result.failed().size()));
  }

  /**
   * Validates a single YAML batch document without changing anything.
   */
  public Future<DryRunResult> dryRun(String clusterId, String yaml) {
    requireText(clusterId, "clusterId");
    return transport.post(BASE + "/batch/dry-run", query(CLUSTER_ID, clusterId), yamlBody(yaml))
      .map(body -> DryRunResult.fromJson(ApiResults.object(body)));
  }

  /**
   * Applies a single YAML batch document.
   */
  public Future<TopicApplyResponse> applyYaml(String clusterId, String yaml) {
    requireText(clusterId, "clusterId");
    return transport.post(BASE + "/batch/apply-yaml", query(CLUSTER_ID, clusterId), yamlBody(yaml))
      .map(body -> TopicApplyResponse.fromJson(ApiResults.object(body)));
  }

  /**
   * Applies a batch given as the JSON request form ({@code env}, {@code change_id}, {@code items}).
   */
  public Future<TopicApplyResponse> apply(String clusterId, JsonObject batch) {
    requireText(clusterId, "clusterId");
    Objects.requireNonNull(batch, "batch cannot be null");
    return transport.post(BASE + "/batch/apply", query(CLUSTER_ID, clusterId), batch)
      .map(body -> TopicApplyResponse.fromJson(ApiResults.object(body)));
  }

  public Future<String> updateMetadata(String clusterId, String name, TopicMetadata metadata) {
    requireText(clusterId, "clusterId");
    requireText(name, "name");
    Objects.requireNonNull(metadata, "metadata cannot be null");
    return transport.patch(BASE + "/" + segment(name) + "/metadata", query(CLUSTER_ID, clusterId),
        metadata.toJson())
      .map(body -> ApiResults.object(body).getString("message", ""));
  }

  private static JsonObject yamlBody(String yaml) {
    return new JsonObject().put("yaml_content", Objects.requireNonNull(yaml, "yaml cannot be null"));
  }
}
