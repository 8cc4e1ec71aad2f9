package io.github.kgov.console.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.FailureType;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests WebClientApiTransport against an in-process HTTP server.
 */
@ExtendWith(VertxExtension.class)
public class WebClientApiTransportTest {

  private HttpServer server;
  private WebClientApiTransport transport;

  @BeforeEach
  void startServer(Vertx vertx, VertxTestContext ctx) {
    vertx.createHttpServer()
      .requestHandler(this::handle)
      .listen(0)
      .onComplete(ctx.succeeding(started -> {
        server = started;
        transport = new WebClientApiTransport(vertx, ApiConfig.builder()
          .baseUrl("http://localhost:" + started.actualPort())
          .timeoutMs(5000)
          .build());
        ctx.completeNow();
      }));
  }

  @AfterEach
  void stopServer() {
    if (transport != null) {
      transport.close();
    }
  }

  private void handle(HttpServerRequest req) {
    switch (req.path()) {
      case "/echo" -> req.body().onSuccess(body -> req.response()
        .putHeader("content-type", "application/json")
        .end(new JsonObject()
          .put("method", req.method().name())
          .put("cluster_id", req.getParam("cluster_id"))
          .put("has_skipped", req.params().contains("skipped"))
          .put("body", body.length() > 0 ? body.toJsonObject() : null)
          .encode()));
      case "/list" -> req.response().end(new JsonArray().add("a").add("b").encode());
      case "/empty" -> req.response().setStatusCode(204).end();
      case "/text" -> req.response().end("pong");
      case "/silent" -> {
        // never answers
      }
      case "/invalid" -> req.response().setStatusCode(422)
        .end(new JsonObject().put("detail", new JsonArray()
          .add(new JsonObject().put("loc", new JsonArray().add("body").add("env")).put("msg", "field required")))
          .encode());
      case "/upload" -> {
        req.setExpectMultipart(true);
        StringBuilder file = new StringBuilder();
        req.uploadHandler(upload -> upload.handler(chunk -> file.append(chunk.toString()))
          .endHandler(v -> file.insert(0, upload.name() + ":" + upload.filename() + ":")));
        req.endHandler(v -> req.response().end(new JsonObject()
          .put("env", req.getFormAttribute("env"))
          .put("change_id", req.getFormAttribute("change_id"))
          .put("file", file.toString())
          .encode()));
      }
      default -> req.response().setStatusCode(404).end(new JsonObject().put("detail", "Not Found").encode());
    }
  }

  @Test
  void request_sendsQueryAndJsonBody(VertxTestContext ctx) throws Exception {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("cluster_id", "local");
    query.put("skipped", null);

    transport.post("/echo", query, new JsonObject().put("yaml_content", "env: dev"))
      .onComplete(ctx.succeeding(body -> ctx.verify(() -> {
        JsonObject json = assertInstanceOf(JsonObject.class, body);
        assertEquals("POST", json.getString("method"));
        assertEquals("local", json.getString("cluster_id"));
        assertFalse(json.getBoolean("has_skipped"));
        assertEquals("env: dev", json.getJsonObject("body").getString("yaml_content"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void request_decodesArray(VertxTestContext ctx) throws Exception {
    transport.get("/list", Map.of())
      .onComplete(ctx.succeeding(body -> ctx.verify(() -> {
        JsonArray array = assertInstanceOf(JsonArray.class, body);
        assertEquals(2, array.size());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void request_emptyBodyIsNull(VertxTestContext ctx) throws Exception {
    transport.delete("/empty", Map.of())
      .onComplete(ctx.succeeding(body -> ctx.verify(() -> {
        assertNull(body);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void request_nonJsonBodyIsText(VertxTestContext ctx) throws Exception {
    transport.get("/text", Map.of())
      .onComplete(ctx.succeeding(body -> ctx.verify(() -> {
        assertEquals("pong", body);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void request_validationError(VertxTestContext ctx) throws Exception {
    transport.request(HttpMethod.POST, "/invalid", Map.of(), new JsonObject())
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        ApiException error = assertInstanceOf(ApiException.class, err);
        assertEquals(422, error.getStatusCode());
        assertEquals(FailureType.VALIDATION_ERROR, error.getKind());
        assertEquals("HTTP 422: body.env: field required", error.getMessage());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void request_notFound(VertxTestContext ctx) throws Exception {
    transport.get("/missing", Map.of())
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        ApiException error = assertInstanceOf(ApiException.class, err);
        assertEquals(404, error.getStatusCode());
        assertEquals(FailureType.HTTP_ERROR, error.getKind());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void request_unreachableBackend(Vertx vertx, VertxTestContext ctx) throws Exception {
    int port = server.actualPort();
    server.close().onComplete(ctx.succeeding(v -> {
      WebClientApiTransport offline = new WebClientApiTransport(vertx, ApiConfig.builder()
        .baseUrl("http://localhost:" + port)
        .timeoutMs(2000)
        .build());
      offline.get("/list", Map.of())
        .onComplete(ctx.failing(err -> ctx.verify(() -> {
          ApiException error = assertInstanceOf(ApiException.class, err);
          assertEquals(0, error.getStatusCode());
          assertEquals(FailureType.NETWORK_ERROR, error.getKind());
          offline.close();
          ctx.completeNow();
        })));
    }));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void request_idleTimeout(Vertx vertx, VertxTestContext ctx) throws Exception {
    WebClientApiTransport impatient = new WebClientApiTransport(vertx, ApiConfig.builder()
      .baseUrl("http://localhost:" + server.actualPort())
      .timeoutMs(200)
      .build());

    impatient.get("/silent", Map.of())
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        ApiException error = assertInstanceOf(ApiException.class, err);
        assertEquals(FailureType.NETWORK_ERROR, error.getKind());
        impatient.close();
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void upload_sendsMultipartForm(VertxTestContext ctx) throws Exception {
    transport.upload("/upload", Map.of("registry_id", "sr-1"), Map.of("env", "dev", "change_id", "c-1"),
        "orders.avsc", Buffer.buffer("{\"type\":\"record\"}"))
      .onComplete(ctx.succeeding(body -> ctx.verify(() -> {
        JsonObject json = assertInstanceOf(JsonObject.class, body);
        assertEquals("dev", json.getString("env"));
        assertEquals("c-1", json.getString("change_id"));
        assertEquals("files:orders.avsc:{\"type\":\"record\"}", json.getString("file"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void decode_emptyBuffer() {
    assertNull(WebClientApiTransport.decode(Buffer.buffer()));
    assertNull(WebClientApiTransport.decode(null));
  }
}
