package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * A registered schema registry, Kafka Connect cluster or object storage.
 *
 * @param id registry_id, connect_id or storage_id depending on the kind
 * @param name display name
 * @param url endpoint url
 * @param description free text, may be null
 * @param active whether the backend routes requests to this endpoint
 */
public record ServiceEndpoint(String id, String name, String url, String description, boolean active) {

  public static ServiceEndpoint registryFromJson(JsonObject json) {
    return of(json, json.getString("registry_id"), json.getString("url"));
  }

  public static ServiceEndpoint connectFromJson(JsonObject json) {
    return of(json, json.getString("connect_id"), json.getString("url"));
  }

  public static ServiceEndpoint storageFromJson(JsonObject json) {
    return of(json, json.getString("storage_id"), json.getString("endpoint_url"));
  }

  private static ServiceEndpoint of(JsonObject json, String id, String url) {
    return new ServiceEndpoint(id, json.getString("name"), url,
      json.getString("description"), json.getBoolean("is_active", true));
  }
}
