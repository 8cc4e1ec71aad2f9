package io.github.kgov.console.model;

import java.util.Locale;

public enum PolicyStatus {
  DRAFT,
  ACTIVE,
  ARCHIVED,
  UNKNOWN;

  public static PolicyStatus fromString(String status) {
    if (status == null) {
      return UNKNOWN;
    }
    try {
      return valueOf(status.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }
}
