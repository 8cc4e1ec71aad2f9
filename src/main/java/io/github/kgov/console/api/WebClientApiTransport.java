package io.github.kgov.console.api;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.ext.web.multipart.MultipartForm;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ApiTransport} backed by the Vert.x {@link WebClient}. No retries.
 */
public class WebClientApiTransport implements ApiTransport {

  private static final Logger log = LoggerFactory.getLogger(WebClientApiTransport.class);

  private static final String FILE_PART = "files";
  private static final String YAML_MEDIA_TYPE = "application/x-yaml";

  private final WebClient client;
  private final ApiConfig config;

  public WebClientApiTransport(Vertx vertx, ApiConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.client = WebClient.create(vertx, new WebClientOptions()
      .setUserAgent("kgov-console")
      .setFollowRedirects(true));
    log.info("Created API client for {}", config.getBaseUrl());
  }

  @Override
  public Future<Object> request(HttpMethod method, String path, Map<String, String> query, Object body) {
    HttpRequest<Buffer> request = prepare(method, path, query);
    log.debug("{} {}", method, path);
    Future<HttpResponse<Buffer>> sent = body == null ? request.send() : request.sendJson(body);
    return handle(method + " " + path, sent);
  }

  @Override
  public Future<Object> upload(String path, Map<String, String> query, Map<String, String> attributes,
      String fileName, Buffer content) {
    MultipartForm form = MultipartForm.create();
    attributes.forEach(form::attribute);
    form.binaryFileUpload(FILE_PART, fileName, content, YAML_MEDIA_TYPE);
    log.debug("POST {} (multipart, file={})", path, fileName);
    return handle("POST " + path, prepare(HttpMethod.POST, path, query).sendMultipartForm(form));
  }

  @Override
  public void close() {
    client.close();
  }

  private HttpRequest<Buffer> prepare(HttpMethod method, String path, Map<String, String> query) {
    HttpRequest<Buffer> request = client.requestAbs(method, config.getBaseUrl() + path);
    if (query != null) {
      query.forEach((name, value) -> {
        if (value != null) {
          request.addQueryParam(name, value);
        }
      });
    }
    if (config.getTimeoutMs() > 0) {
      request.idleTimeout(config.getTimeoutMs());
    }
    return request;
  }

  private Future<Object> handle(String target, Future<HttpResponse<Buffer>> sent) {
    return sent
      .recover(err -> Future.failedFuture(ApiException.network(target, err)))
      .compose(response -> {
        Object decoded = decode(response.body());
        if (response.statusCode() >= 400) {
          ApiException error = ApiException.fromResponse(response.statusCode(), decoded);
          log.debug("{} -> {}", target, error.getMessage());
          return Future.failedFuture(error);
        }
        return Future.succeededFuture(decoded);
      });
  }

  static Object decode(Buffer body) {
    if (body == null || body.length() == 0) {
      return null;
    }
    try {
      return Json.decodeValue(body);
    } catch (DecodeException e) {
      return body.toString();
    }
  }
}
