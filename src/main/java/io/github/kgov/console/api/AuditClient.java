package io.github.kgov.console.api;

import io.github.kgov.console.model.AuditLog;
import io.vertx.core.Future;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class AuditClient {

  static final int MIN_LIMIT = 1;
  static final int MAX_LIMIT = 100;

  private final ApiTransport transport;

  public AuditClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  /**
   * Most recent activities, newest first. The limit is clamped to 1..100.
   */
  public Future<List<AuditLog>> recent(int limit) {
    int clamped = Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));
    return transport.get("/api/v1/audit/recent", Map.of("limit", String.valueOf(clamped)))
      .map(body -> ApiResults.list(body, "activities", AuditLog::fromJson));
  }

  public Future<List<AuditLog>> history(AuditQuery query) {
    Objects.requireNonNull(query, "query cannot be null");
    return transport.get("/api/v1/audit/history", query.toQuery())
      .map(body -> ApiResults.list(body, "activities", AuditLog::fromJson));
  }
}
