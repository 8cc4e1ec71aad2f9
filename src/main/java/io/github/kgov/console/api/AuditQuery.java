package io.github.kgov.console.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for the audit history. Null fields are not sent.
 *
 * @param from ISO-8601 lower bound
 * @param to ISO-8601 upper bound
 * @param activityType topic, schema, connector or policy
 * @param action e.g. CREATE, DELETE, APPLY
 * @param actor who performed the action
 * @param limit maximum number of entries
 */
public record AuditQuery(String from, String to, String activityType, String action, String actor,
    Integer limit) {

  public static AuditQuery all() {
    return new AuditQuery(null, null, null, null, null, null);
  }

  Map<String, String> toQuery() {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("from", from);
    query.put("to", to);
    query.put("activity_type", activityType);
    query.put("action", action);
    query.put("actor", actor);
    query.put("limit", limit != null ? limit.toString() : null);
    return query;
  }
}
