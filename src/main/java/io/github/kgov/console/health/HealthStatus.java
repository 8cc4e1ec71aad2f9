package io.github.kgov.console.health;

public enum HealthStatus {
  UP(200),
  DOWN(503);

  private final int httpStatus;

  HealthStatus(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
