package io.github.kgov.console.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Lenient accessors for backend payloads. Missing keys decode to empty collections.
 */
public final class JsonFields {

  private JsonFields() {}

  public static List<String> strings(JsonObject json, String key) {
    JsonArray array = json.getJsonArray(key);
    if (array == null) {
      return List.of();
    }
    List<String> values = new ArrayList<>(array.size());
    for (Object value : array) {
      if (value != null) {
        values.add(String.valueOf(value));
      }
    }
    return List.copyOf(values);
  }

  public static <T> List<T> objects(JsonObject json, String key, Function<JsonObject, T> decoder) {
    return objects(json.getJsonArray(key), decoder);
  }

  public static <T> List<T> objects(JsonArray array, Function<JsonObject, T> decoder) {
    if (array == null) {
      return List.of();
    }
    List<T> values = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonObject item = array.getJsonObject(i);
      if (item != null) {
        values.add(decoder.apply(item));
      }
    }
    return List.copyOf(values);
  }

  public static Map<String, Integer> counters(JsonObject json, String key) {
    JsonObject counters = json.getJsonObject(key);
    if (counters == null) {
      return Map.of();
    }
    Map<String, Integer> values = new LinkedHashMap<>();
    for (String name : counters.fieldNames()) {
      Object value = counters.getValue(name);
      if (value instanceof Number number) {
        values.put(name, number.intValue());
      }
    }
    return Collections.unmodifiableMap(values);
  }

  public static long longOrZero(JsonObject json, String key) {
    Long value = json.getLong(key);
    return value != null ? value : 0L;
  }

  public static int intOrZero(JsonObject json, String key) {
    Integer value = json.getInteger(key);
    return value != null ? value : 0;
  }

  public static double doubleOrZero(JsonObject json, String key) {
    Double value = json.getDouble(key);
    return value != null ? value : 0.0;
  }

  public static JsonObject objectOrEmpty(JsonObject json, String key) {
    JsonObject value = json.getJsonObject(key);
    return value != null ? value : new JsonObject();
  }
}
