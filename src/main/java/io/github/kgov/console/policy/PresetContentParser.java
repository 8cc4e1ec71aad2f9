package io.github.kgov.console.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import java.util.Map;

/**
 * Converts policy content written as YAML (or JSON, which is valid YAML) to a JSON object.
 */
public final class PresetContentParser {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private PresetContentParser() {}

  /**
   * @throws IllegalArgumentException if the content is not valid YAML or its root is not a mapping
   */
  public static JsonObject toJson(String yaml) {
    if (yaml == null || yaml.isBlank()) {
      throw new IllegalArgumentException("Policy content is empty");
    }
    try {
      JsonNode root = YAML_MAPPER.readTree(yaml);
      if (root == null || !root.isObject()) {
        throw new IllegalArgumentException("Policy content must be a mapping");
      }
      return new JsonObject(YAML_MAPPER.convertValue(root, MAP_TYPE));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid policy YAML: " + e.getOriginalMessage(), e);
    }
  }
}
