package io.github.kgov.console.api;

import io.github.kgov.console.model.JsonFields;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Helpers for turning decoded response bodies into models.
 */
final class ApiResults {

  private ApiResults() {}

  static JsonObject object(Object body) {
    if (body instanceof JsonObject json) {
      return json;
    }
    if (body == null) {
      return new JsonObject();
    }
    throw ApiException.unexpectedBody("a JSON object", body);
  }

  /**
   * Reads a list that the backend returns either bare or wrapped in an object under {@code key}.
   */
  static <T> List<T> list(Object body, String key, Function<JsonObject, T> decoder) {
    if (body instanceof JsonArray array) {
      return JsonFields.objects(array, decoder);
    }
    if (body instanceof JsonObject json) {
      return JsonFields.objects(json.getJsonArray(key), decoder);
    }
    return List.of();
  }

  static String segment(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  static Map<String, String> query(String... pairs) {
    if (pairs.length % 2 != 0) {
      throw new IllegalArgumentException("Query parameters must be name/value pairs");
    }
    Map<String, String> query = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      query.put(pairs[i], pairs[i + 1]);
    }
    return query;
  }

  static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
    return value;
  }
}
