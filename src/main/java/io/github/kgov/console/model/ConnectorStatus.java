package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Runtime state of a connector and its tasks.
 */
public record ConnectorStatus(String name, String type, String state, String workerId, List<TaskState> tasks) {

  public record TaskState(int id, String state, String workerId) {

    static TaskState fromJson(JsonObject json) {
      return new TaskState(JsonFields.intOrZero(json, "id"), json.getString("state"),
        json.getString("worker_id"));
    }
  }

  public boolean isRunning() {
    return "RUNNING".equalsIgnoreCase(state);
  }

  public static ConnectorStatus fromJson(JsonObject json) {
    JsonObject connector = JsonFields.objectOrEmpty(json, "connector");
    return new ConnectorStatus(
      json.getString("name"),
      json.getString("type"),
      connector.getString("state"),
      connector.getString("worker_id"),
      JsonFields.objects(json, "tasks", TaskState::fromJson)
    );
  }
}
