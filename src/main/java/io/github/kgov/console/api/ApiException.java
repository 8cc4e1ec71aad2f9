package io.github.kgov.console.api;

import io.github.kgov.console.model.FailureType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Failed call to the governance backend.
 * A status code of 0 means no response was received.
 */
public class ApiException extends RuntimeException {

  public static final int OK = 200;
  public static final int UNPROCESSABLE_ENTITY = 422;

  private final int statusCode;
  private final transient Object body;
  private final FailureType kind;

  private ApiException(String message, int statusCode, Object body, FailureType kind, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.body = body;
    this.kind = kind;
  }

  /**
   * Creates an exception for an error response.
   *
   * @param statusCode HTTP status, expected to be 400 or above
   * @param body decoded response body, may be null
   */
  public static ApiException fromResponse(int statusCode, Object body) {
    FailureType kind = statusCode == UNPROCESSABLE_ENTITY
      ? FailureType.VALIDATION_ERROR
      : FailureType.HTTP_ERROR;
    String detail = detailMessage(body);
    String message = detail.isEmpty()
      ? "HTTP " + statusCode
      : "HTTP " + statusCode + ": " + detail;
    return new ApiException(message, statusCode, body, kind, null);
  }

  /**
   * Creates an exception for a successful response whose body has the wrong shape,
   * e.g. an HTML page served by a proxy. Reported with status 200.
   *
   * @param expected what the caller expected, e.g. {@code "a JSON object"}
   * @param body decoded response body
   */
  public static ApiException unexpectedBody(String expected, Object body) {
    String actual = body != null ? body.getClass().getSimpleName() : "nothing";
    return new ApiException("Unexpected response body: expected " + expected + " but got " + actual,
      OK, body, FailureType.HTTP_ERROR, null);
  }

  public static ApiException network(String target, Throwable cause) {
    String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    return new ApiException("Request to " + target + " failed: " + reason, 0, null,
      FailureType.NETWORK_ERROR, cause);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Object getBody() {
    return body;
  }

  public FailureType getKind() {
    return kind;
  }

  /**
   * Messages of the backend's {@code detail} field, one per validation error.
   */
  public List<String> detailMessages() {
    return collectDetails(body);
  }

  static String detailMessage(Object body) {
    return String.join("; ", collectDetails(body));
  }

  private static List<String> collectDetails(Object body) {
    List<String> messages = new ArrayList<>();
    if (body instanceof JsonObject json) {
      Object detail = json.getValue("detail");
      if (detail instanceof String text) {
        messages.add(text);
      } else if (detail instanceof JsonArray errors) {
        for (Object error : errors) {
          if (error instanceof JsonObject item) {
            messages.add(describeValidationError(item));
          } else if (error != null) {
            messages.add(String.valueOf(error));
          }
        }
      } else if (detail instanceof JsonObject nested) {
        messages.add(nested.getString("message", nested.encode()));
      } else if (json.getString("message") != null) {
        messages.add(json.getString("message"));
      }
    } else if (body instanceof String text && !text.isBlank()) {
      messages.add(text.trim());
    }
    return messages;
  }

  private static String describeValidationError(JsonObject error) {
    String msg = error.getString("msg", error.encode());
    JsonArray loc = error.getJsonArray("loc");
    if (loc == null || loc.isEmpty()) {
      return msg;
    }
    List<String> path = new ArrayList<>();
    for (Object part : loc) {
      path.add(String.valueOf(part));
    }
    return String.join(".", path) + ": " + msg;
  }
}
