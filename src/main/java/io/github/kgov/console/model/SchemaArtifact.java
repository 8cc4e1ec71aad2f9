package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * A registered schema version tracked by the governance catalog.
 */
public record SchemaArtifact(
  String subject,
  int version,
  String storageUrl,
  String checksum,
  String schemaType,
  String compatibilityMode,
  String owner
) {

  public static SchemaArtifact fromJson(JsonObject json) {
    return new SchemaArtifact(
      json.getString("subject"),
      JsonFields.intOrZero(json, "version"),
      json.getString("storage_url"),
      json.getString("checksum"),
      json.getString("schema_type"),
      json.getString("compatibility_mode"),
      json.getString("owner")
    );
  }
}
