package io.github.kgov.console.api;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings for the governance backend.
 */
public class ApiConfig {

  private static final Logger log = LoggerFactory.getLogger(ApiConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_BASE_URL = "kgov.api.base-url";
  private static final String PROP_WS_BASE_URL = "kgov.ws.base-url";
  private static final String PROP_TIMEOUT_MS = "kgov.api.timeout-ms";

  private static final String ENV_BASE_URL = "CONSOLE_API_BASE_URL";
  private static final String ENV_WS_BASE_URL = "CONSOLE_WS_BASE_URL";
  private static final String ENV_TIMEOUT_MS = "CONSOLE_API_TIMEOUT_MS";

  private static final String DEFAULT_BASE_URL = "http://localhost:8000";
  private static final long DEFAULT_TIMEOUT_MS = 0L;

  private final String baseUrl;
  private final String wsBaseUrl;
  private final long timeoutMs;

  private ApiConfig(Builder builder) {
    this.baseUrl = stripTrailingSlash(builder.baseUrl);
    this.wsBaseUrl = builder.wsBaseUrl != null
      ? stripTrailingSlash(builder.wsBaseUrl)
      : toWebSocketUrl(this.baseUrl);
    this.timeoutMs = builder.timeoutMs;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getWsBaseUrl() {
    return wsBaseUrl;
  }

  /**
   * Per-request idle timeout, 0 when requests may wait indefinitely.
   */
  public long getTimeoutMs() {
    return timeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the classpath defaults and applies environment overrides on top.
   */
  public static ApiConfig load() {
    Properties props = new Properties();
    try (InputStream is = ApiConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
      if (is != null) {
        props.load(is);
      } else {
        log.debug("No {} on classpath, using defaults", DEFAULT_CONFIG_FILE);
      }
    } catch (IOException e) {
      log.warn("Failed to read {}, using defaults", DEFAULT_CONFIG_FILE, e);
    }
    return fromSources(props, System.getenv());
  }

  /**
   * Builds configuration from properties, with environment values taking precedence.
   *
   * @param props kgov.* properties
   * @param env environment variables
   * @return the resolved configuration
   */
  static ApiConfig fromSources(Properties props, Map<String, String> env) {
    Builder builder = builder();

    String baseUrl = firstNonBlank(env.get(ENV_BASE_URL), props.getProperty(PROP_BASE_URL));
    if (baseUrl != null) {
      builder.baseUrl(baseUrl);
    }

    String wsBaseUrl = firstNonBlank(env.get(ENV_WS_BASE_URL), props.getProperty(PROP_WS_BASE_URL));
    if (wsBaseUrl != null) {
      builder.wsBaseUrl(wsBaseUrl);
    }

    String timeout = firstNonBlank(env.get(ENV_TIMEOUT_MS), props.getProperty(PROP_TIMEOUT_MS));
    if (timeout != null) {
      try {
        builder.timeoutMs(Long.parseLong(timeout.trim()));
      } catch (NumberFormatException e) {
        log.warn("Invalid timeout: {}, using default: {}", timeout, DEFAULT_TIMEOUT_MS);
      }
    }

    ApiConfig config = builder.build();
    log.info("API configuration loaded: baseUrl={}, wsBaseUrl={}, timeoutMs={}",
      config.baseUrl, config.wsBaseUrl, config.timeoutMs);
    return config;
  }

  static String toWebSocketUrl(String httpUrl) {
    if (httpUrl.startsWith("https://")) {
      return "wss://" + httpUrl.substring("https://".length());
    }
    if (httpUrl.startsWith("http://")) {
      return "ws://" + httpUrl.substring("http://".length());
    }
    return httpUrl;
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  public static class Builder {

    private String baseUrl = DEFAULT_BASE_URL;
    private String wsBaseUrl;
    private long timeoutMs = DEFAULT_TIMEOUT_MS;

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
      return this;
    }

    public Builder wsBaseUrl(String wsBaseUrl) {
      this.wsBaseUrl = wsBaseUrl;
      return this;
    }

    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = Math.max(0, timeoutMs);
      return this;
    }

    public ApiConfig build() {
      return new ApiConfig(this);
    }
  }
}
