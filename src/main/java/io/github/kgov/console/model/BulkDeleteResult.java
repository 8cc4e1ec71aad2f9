package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;

public record BulkDeleteResult(List<String> succeeded, List<String> failed, String message) {

  public static BulkDeleteResult fromJson(JsonObject json) {
    return new BulkDeleteResult(
      JsonFields.strings(json, "succeeded"),
      JsonFields.strings(json, "failed"),
      json.getString("message", "")
    );
  }
}
