package io.github.kgov.console.api;

import io.vertx.core.Vertx;
import java.util.Objects;

/**
 * Entry point to the governance backend: one client per resource over a shared transport.
 */
public class GovernanceApi implements AutoCloseable {

  private final ApiTransport transport;
  private final TopicClient topics;
  private final SchemaClient schemas;
  private final ConnectClient connect;
  private final PolicyClient policies;
  private final AuditClient audit;
  private final ClusterClient clusters;
  private final ConsumerClient consumers;

  public GovernanceApi(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.topics = new TopicClient(transport);
    this.schemas = new SchemaClient(transport);
    this.connect = new ConnectClient(transport);
    this.policies = new PolicyClient(transport);
    this.audit = new AuditClient(transport);
    this.clusters = new ClusterClient(transport);
    this.consumers = new ConsumerClient(transport);
  }

  public static GovernanceApi create(Vertx vertx, ApiConfig config) {
    return new GovernanceApi(new WebClientApiTransport(vertx, config));
  }

  public TopicClient topics() {
    return topics;
  }

  public SchemaClient schemas() {
    return schemas;
  }

  public ConnectClient connect() {
    return connect;
  }

  public PolicyClient policies() {
    return policies;
  }

  public AuditClient audit() {
    return audit;
  }

  public ClusterClient clusters() {
    return clusters;
  }

  public ConsumerClient consumers() {
    return consumers;
  }

  @Override
  public void close() {
    transport.close();
  }
}
