package io.github.kgov.console.api;

import static io.github.kgov.console.api.ApiResults.query;
import static io.github.kgov.console.api.ApiResults.requireText;
import static io.github.kgov.console.api.ApiResults.segment;

import io.github.kgov.console.model.ActivePolicies;
import io.github.kgov.console.model.Policy;
import io.github.kgov.console.model.PolicyDraft;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Naming and guardrail policy lifecycle: draft, activate, archive.
 */
public class PolicyClient {

  private static final Logger log = LoggerFactory.getLogger(PolicyClient.class);

  private static final String BASE = "/api/v1/policies";
  private static final Set<String> ENVIRONMENTS = Set.of("dev", "stg", "prod");

  private final ApiTransport transport;

  public PolicyClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  public Future<List<Policy>> list() {
    return transport.get(BASE, Map.of())
      .map(body -> ApiResults.list(body, "policies", Policy::fromJson));
  }

  /**
   * Fetches a policy.
   *
   * @param policyId policy id
   * @param version version to fetch, null for the latest
   */
  public Future<Policy> get(String policyId, Integer version) {
    return transport.get(policy(policyId), query("version", version != null ? version.toString() : null))
      .map(PolicyClient::unwrap);
  }

  public Future<Policy> create(PolicyDraft draft) {
    Objects.requireNonNull(draft, "draft cannot be null");
    return transport.post(BASE, Map.of(), draft.toJson())
      .map(PolicyClient::unwrap)
      .onSuccess(p -> log.info("Created {} policy {} ({})", p.policyType(), p.name(), p.policyId()));
  }

  /**
   * Updates the draft of a policy. Only non-null fields of {@code changes} are sent.
   */
  public Future<Policy> update(String policyId, JsonObject changes) {
    Objects.requireNonNull(changes, "changes cannot be null");
    return transport.put(policy(policyId), Map.of(), changes)
      .map(PolicyClient::unwrap);
  }

  /**
   * Deletes a draft version, or every draft when {@code version} is null.
   */
  public Future<Void> delete(String policyId, Integer version) {
    return transport.delete(policy(policyId), query("version", version != null ? version.toString() : null))
      .<Void>mapEmpty()
      .onSuccess(v -> log.info("Deleted policy {} version {}", policyId, version == null ? "drafts" : version));
  }

  /**
   * Activates a version, the latest draft when {@code version} is null.
   */
  public Future<Policy> activate(String policyId, Integer version) {
    JsonObject body = new JsonObject();
    if (version != null) {
      body.put("version", version);
    }
    return transport.post(policy(policyId) + "/activate", Map.of(), body)
      .map(PolicyClient::unwrap)
      .onSuccess(p -> log.info("Activated policy {} version {}", policyId, p.version()));
  }

  public Future<Policy> archive(String policyId) {
    return transport.post(policy(policyId) + "/archive", Map.of(), null)
      .map(PolicyClient::unwrap);
  }

  public Future<List<Policy>> versions(String policyId) {
    return transport.get(policy(policyId) + "/versions", Map.of())
      .map(body -> ApiResults.list(body, "versions", Policy::fromJson));
  }

  public Future<ActivePolicies> activeForEnvironment(String environment) {
    if (environment == null || !ENVIRONMENTS.contains(environment)) {
      throw new IllegalArgumentException("environment must be one of " + ENVIRONMENTS + ": " + environment);
    }
    return transport.get(BASE + "/active/environment", query("environment", environment))
      .map(body -> ActivePolicies.fromJson(ApiResults.object(body)));
  }

  private static String policy(String policyId) {
    return BASE + "/" + segment(requireText(policyId, "policyId"));
  }

  private static Policy unwrap(Object body) {
    JsonObject json = ApiResults.object(body);
    JsonObject policy = json.getJsonObject("policy");
    return Policy.fromJson(policy != null ? policy : json);
  }
}
