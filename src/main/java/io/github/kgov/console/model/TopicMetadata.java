package io.github.kgov.console.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Editable catalog metadata of a topic.
 */
public record TopicMetadata(
  List<String> owners,
  String doc,
  List<String> tags,
  String environment,
  String slo,
  String sla
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("owners", new JsonArray(owners))
      .put("doc", doc)
      .put("tags", new JsonArray(tags))
      .put("environment", environment)
      .put("slo", slo)
      .put("sla", sla);
  }
}
