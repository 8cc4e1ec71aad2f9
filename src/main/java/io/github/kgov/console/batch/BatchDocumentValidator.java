package io.github.kgov.console.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.kgov.console.model.FailureDetail;
import io.github.kgov.console.model.FailureType;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the shape of a topic batch document before anything is sent:
 * a mapping with {@code env}, {@code change_id} and an {@code items} list.
 */
public class BatchDocumentValidator {

  private static final Logger log = LoggerFactory.getLogger(BatchDocumentValidator.class);

  private static final String GENERIC_HINT =
    "A batch document needs the top-level fields env, change_id and items";
  private static final String ITEM_HINT =
    "items is a list; each entry needs name, action, config and metadata";

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  public BatchDocument validate(int index, String text) {
    JsonNode root;
    try {
      root = yamlMapper.readTree(text);
    } catch (JsonProcessingException e) {
      log.debug("Document {} is not valid YAML: {}", index, e.getOriginalMessage());
      return invalid(index, text, null, null,
        "Invalid YAML: " + e.getOriginalMessage(), List.of(GENERIC_HINT));
    }

    if (root == null || !root.isObject()) {
      return invalid(index, text, null, null,
        "Document root must be a mapping", List.of(GENERIC_HINT, ITEM_HINT));
    }

    String env = text(root, "env");
    String changeId = text(root, "change_id");
    List<String> missing = new ArrayList<>();
    List<String> suggestions = new ArrayList<>();

    if (env == null) {
      missing.add("env");
      suggestions.add("Add 'env: dev' (or stg/prod) at the top level");
    }
    if (changeId == null) {
      missing.add("change_id");
      suggestions.add("Add 'change_id: 2025-10-20_001' at the top level");
    }

    JsonNode items = root.get("items");
    if (items == null || items.isNull()) {
      missing.add("items");
      if (root.has("topics")) {
        suggestions.add("Use 'items:' instead of 'topics:'");
      } else {
        suggestions.add(ITEM_HINT);
      }
    } else if (!items.isArray()) {
      return invalid(index, text, env, changeId, "Field 'items' must be a list", List.of(ITEM_HINT));
    }

    if (!missing.isEmpty()) {
      return invalid(index, text, env, changeId,
        "Missing required field(s): " + String.join(", ", missing), suggestions);
    }
    return new BatchDocument(index, text, env, changeId, items.size(), null);
  }

  private static BatchDocument invalid(int index, String text, String env, String changeId,
      String message, List<String> suggestions) {
    FailureDetail failure = FailureDetail.of(FailureType.VALIDATION_ERROR, message, suggestions);
    return new BatchDocument(index, text, env, changeId, 0, failure);
  }

  private static String text(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    String value = node.asText();
    return value.isBlank() ? null : value;
  }
}
