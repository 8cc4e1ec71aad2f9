package io.github.kgov.console.api;

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import java.util.Map;

/**
 * JSON request/response channel to the governance backend.
 *
 * <p>Successful calls complete with the decoded body: a {@code JsonObject}, a {@code JsonArray},
 * a scalar, or null for an empty body. Failed calls fail with {@link ApiException}.
 */
public interface ApiTransport {

  /**
   * Sends a request.
   *
   * @param method HTTP method
   * @param path path below the base url, starting with {@code /}
   * @param query query parameters, null values are skipped
   * @param body JSON body, null for none
   * @return Future with the decoded response body
   */
  Future<Object> request(HttpMethod method, String path, Map<String, String> query, Object body);

  /**
   * Sends a multipart form with text attributes and one file part named {@code files}.
   */
  Future<Object> upload(String path, Map<String, String> query, Map<String, String> attributes,
      String fileName, Buffer content);

  void close();

  default Future<Object> get(String path, Map<String, String> query) {
    return request(HttpMethod.GET, path, query, null);
  }

  default Future<Object> post(String path, Map<String, String> query, Object body) {
    return request(HttpMethod.POST, path, query, body);
  }

  default Future<Object> put(String path, Map<String, String> query, Object body) {
    return request(HttpMethod.PUT, path, query, body);
  }

  default Future<Object> patch(String path, Map<String, String> query, Object body) {
    return request(HttpMethod.PATCH, path, query, body);
  }

  default Future<Object> delete(String path, Map<String, String> query) {
    return request(HttpMethod.DELETE, path, query, null);
  }
}
