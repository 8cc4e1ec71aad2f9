package io.github.kgov.console.api;

import static io.github.kgov.console.api.ApiResults.query;
import static io.github.kgov.console.api.ApiResults.requireText;
import static io.github.kgov.console.api.ApiResults.segment;

import io.github.kgov.console.model.SchemaArtifact;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SchemaClient {

  private static final Logger log = LoggerFactory.getLogger(SchemaClient.class);

  private static final String BASE = "/api/v1/schemas";
  private static final String REGISTRY_ID = "registry_id";

  private final ApiTransport transport;

  public SchemaClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  public Future<List<SchemaArtifact>> listArtifacts() {
    return transport.get(BASE + "/artifacts", Map.of())
      .map(body -> ApiResults.list(body, "artifacts", SchemaArtifact::fromJson));
  }

  /**
   * Uploads one schema file to a registry.
   *
   * @param registryId target schema registry
   * @param env environment the upload is recorded under
   * @param changeId change id the upload is recorded under
   * @param fileName file name, the extension selects the schema type on the backend
   * @param content file content
   * @return Future with the raw upload report
   */
  public Future<JsonObject> upload(String registryId, String env, String changeId, String fileName,
      Buffer content) {
    requireText(registryId, "registryId");
    requireText(fileName, "fileName");
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("env", requireText(env, "env"));
    attributes.put("change_id", requireText(changeId, "changeId"));
    return transport.upload(BASE + "/upload", query(REGISTRY_ID, registryId), attributes, fileName, content)
      .map(ApiResults::object)
      .onSuccess(report -> log.info("Uploaded {} to registry {}", fileName, registryId));
  }

  public Future<JsonObject> delete(String registryId, String subject) {
    requireText(registryId, "registryId");
    requireText(subject, "subject");
    return transport.delete(BASE + "/delete/" + segment(subject), query(REGISTRY_ID, registryId))
      .map(ApiResults::object);
  }

  /**
   * Reports what deleting a subject would affect, without deleting it.
   */
  public Future<JsonObject> analyzeDelete(String registryId, String subject) {
    requireText(registryId, "registryId");
    requireText(subject, "subject");
    return transport.post(BASE + "/delete/analyze", query(REGISTRY_ID, registryId, "subject", subject), null)
      .map(ApiResults::object);
  }

  public Future<JsonObject> sync(String registryId) {
    requireText(registryId, "registryId");
    return transport.post(BASE + "/sync", query(REGISTRY_ID, registryId), null)
      .map(ApiResults::object)
      .onSuccess(result -> log.info("Synced schemas from registry {}", registryId));
  }
}
