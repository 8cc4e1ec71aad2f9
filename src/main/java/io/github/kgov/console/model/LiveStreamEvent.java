package io.github.kgov.console.model;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.util.Locale;

/**
 * Frame received on the live consumer channel.
 *
 * @param type event type, {@link EventType#UNKNOWN} for types this client does not know
 * @param data payload, present for snapshot events
 * @param message text of connected and error events
 */
public record LiveStreamEvent(EventType type, JsonObject data, String message) {

  public enum EventType {
    CONNECTED,
    SNAPSHOT,
    ERROR,
    HEARTBEAT,
    UNKNOWN;

    static EventType fromString(String type) {
      if (type == null) {
        return UNKNOWN;
      }
      try {
        return valueOf(type.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        return UNKNOWN;
      }
    }
  }

  /**
   * Parses a text frame.
   *
   * @throws DecodeException if the frame is not a JSON object
   */
  public static LiveStreamEvent parse(String frame) {
    JsonObject json = new JsonObject(frame);
    return new LiveStreamEvent(
      EventType.fromString(json.getString("type")),
      json.getJsonObject("data"),
      json.getString("message")
    );
  }

  public LiveSnapshot snapshot() {
    if (type != EventType.SNAPSHOT || data == null) {
      throw new IllegalStateException("Not a snapshot event: " + type);
    }
    return LiveSnapshot.fromJson(data);
  }
}
