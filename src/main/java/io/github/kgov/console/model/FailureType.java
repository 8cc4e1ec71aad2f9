package io.github.kgov.console.model;

/**
 * Category of a failed batch document or item, as shown in failure reports.
 */
public enum FailureType {
  VALIDATION_ERROR("validation_error"),
  HTTP_ERROR("http_error"),
  NETWORK_ERROR("network_error"),
  POLICY_VIOLATION("policy_violation");

  private final String value;

  FailureType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
