package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Why one item (or a whole document) of a batch failed.
 *
 * @param name the topic name, null when the document itself could not be processed
 * @param failureType failure category, see {@link FailureType} for the values this client produces
 * @param errorMessage primary error message
 * @param suggestions hints for fixing the input
 * @param violations policy violations behind the failure, if any
 */
public record FailureDetail(
  String name,
  String failureType,
  String errorMessage,
  List<String> suggestions,
  List<PolicyViolation> violations
) {

  public FailureDetail {
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public static FailureDetail of(FailureType type, String errorMessage, List<String> suggestions) {
    return new FailureDetail(null, type.value(), errorMessage, suggestions, List.of());
  }

  public static FailureDetail fromJson(JsonObject json) {
    return new FailureDetail(
      json.getString("topic_name", json.getString("name")),
      json.getString("failure_type", "unknown"),
      json.getString("error_message", ""),
      JsonFields.strings(json, "suggestions"),
      JsonFields.objects(json, "violations", PolicyViolation::fromJson)
    );
  }
}
