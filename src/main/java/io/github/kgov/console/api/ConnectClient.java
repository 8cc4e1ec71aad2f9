package io.github.kgov.console.api;

import static io.github.kgov.console.api.ApiResults.requireText;
import static io.github.kgov.console.api.ApiResults.segment;

import io.github.kgov.console.model.Connector;
import io.github.kgov.console.model.ConnectorStatus;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka Connect operations, proxied through the backend per connect cluster.
 */
public class ConnectClient {

  private static final Logger log = LoggerFactory.getLogger(ConnectClient.class);

  private final ApiTransport transport;

  public ConnectClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  /**
   * Lists connector names. The backend returns a bare array of names.
   */
  public Future<List<String>> list(String connectId) {
    return transport.get(connectors(connectId), Map.of())
      .map(ConnectClient::names);
  }

  public Future<Connector> get(String connectId, String name) {
    return transport.get(connector(connectId, name), Map.of())
      .map(body -> Connector.fromJson(ApiResults.object(body)));
  }

  /**
   * Creates a connector.
   *
   * @param connectId connect cluster
   * @param name connector name
   * @param config connector configuration, must contain {@code connector.class}
   */
  public Future<Connector> create(String connectId, String name, Map<String, String> config) {
    requireText(name, "name");
    Objects.requireNonNull(config, "config cannot be null");
    JsonObject body = new JsonObject()
      .put("name", name)
      .put("config", toJson(config));
    return transport.post(connectors(connectId), Map.of(), body)
      .map(response -> Connector.fromJson(ApiResults.object(response)))
      .onSuccess(c -> log.info("Created connector {} on {}", name, connectId));
  }

  public Future<Connector> updateConfig(String connectId, String name, Map<String, String> config) {
    Objects.requireNonNull(config, "config cannot be null");
    return transport.put(connector(connectId, name) + "/config", Map.of(), toJson(config))
      .map(response -> Connector.fromJson(ApiResults.object(response)));
  }

  public Future<Void> delete(String connectId, String name) {
    return transport.delete(connector(connectId, name), Map.of())
      .<Void>mapEmpty()
      .onSuccess(v -> log.info("Deleted connector {} on {}", name, connectId));
  }

  public Future<ConnectorStatus> status(String connectId, String name) {
    return transport.get(connector(connectId, name) + "/status", Map.of())
      .map(body -> ConnectorStatus.fromJson(ApiResults.object(body)));
  }

  public Future<Void> pause(String connectId, String name) {
    return control(connectId, name, "pause");
  }

  public Future<Void> resume(String connectId, String name) {
    return control(connectId, name, "resume");
  }

  public Future<Void> restart(String connectId, String name) {
    return control(connectId, name, "restart");
  }

  /**
   * Lists installed connector plugins as raw objects ({@code class}, {@code type}, {@code version}).
   */
  public Future<List<JsonObject>> plugins(String connectId) {
    requireText(connectId, "connectId");
    return transport.get("/api/v1/connect/" + segment(connectId) + "/connector-plugins", Map.of())
      .map(body -> ApiResults.list(body, "plugins", plugin -> plugin));
  }

  private Future<Void> control(String connectId, String name, String action) {
    return transport.post(connector(connectId, name) + "/" + action, Map.of(), null)
      .<Void>mapEmpty()
      .onSuccess(v -> log.info("Connector {} on {}: {}", name, connectId, action))
      .onFailure(err -> log.warn("Failed to {} connector {}: {}", action, name, err.getMessage()));
  }

  private static String connectors(String connectId) {
    return "/api/v1/connect/" + segment(requireText(connectId, "connectId")) + "/connectors";
  }

  private static String connector(String connectId, String name) {
    return connectors(connectId) + "/" + segment(requireText(name, "name"));
  }

  private static JsonObject toJson(Map<String, String> config) {
    return new JsonObject(new LinkedHashMap<String, Object>(config));
  }

  private static List<String> names(Object body) {
    if (!(body instanceof JsonArray array)) {
      return List.of();
    }
    List<String> names = new ArrayList<>(array.size());
    for (Object item : array) {
      if (item instanceof String name) {
        names.add(name);
      } else if (item instanceof JsonObject json && json.getString("name") != null) {
        names.add(json.getString("name"));
      }
    }
    return List.copyOf(names);
  }
}
