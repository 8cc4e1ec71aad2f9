package io.github.kgov.console.api;

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * In-memory transport that records requests and answers from registered routes.
 * Unrouted requests fail with a 404.
 */
public class FakeApiTransport implements ApiTransport {

  public record Call(HttpMethod method, String path, Map<String, String> query, Object body) {

    public String queryParam(String name) {
      return query != null ? query.get(name) : null;
    }
  }

  private final List<Call> calls = new ArrayList<>();
  private final Map<String, Function<Call, Future<Object>>> routes = new HashMap<>();
  private boolean closed;

  public FakeApiTransport respond(HttpMethod method, String path, Object body) {
    return route(method, path, call -> Future.succeededFuture(body));
  }

  public FakeApiTransport fail(HttpMethod method, String path, Throwable error) {
    return route(method, path, call -> Future.failedFuture(error));
  }

  public FakeApiTransport route(HttpMethod method, String path, Function<Call, Future<Object>> handler) {
    routes.put(method.name() + " " + path, handler);
    return this;
  }

  @Override
  public Future<Object> request(HttpMethod method, String path, Map<String, String> query, Object body) {
    Call call = new Call(method, path, query, body);
    calls.add(call);
    Function<Call, Future<Object>> handler = routes.get(method.name() + " " + path);
    if (handler == null) {
      return Future.failedFuture(ApiException.fromResponse(404, new JsonObject().put("detail", "Not Found")));
    }
    return handler.apply(call);
  }

  @Override
  public Future<Object> upload(String path, Map<String, String> query, Map<String, String> attributes,
      String fileName, Buffer content) {
    JsonObject form = new JsonObject()
      .put("file_name", fileName)
      .put("content", content.toString());
    attributes.forEach(form::put);
    return request(HttpMethod.POST, path, query, form);
  }

  @Override
  public void close() {
    closed = true;
  }

  public List<Call> calls() {
    return calls;
  }

  public Call lastCall() {
    return calls.get(calls.size() - 1);
  }

  public boolean isClosed() {
    return closed;
  }
}
