package io.github.kgov.console.api;

import static io.github.kgov.console.api.ApiResults.query;
import static io.github.kgov.console.api.ApiResults.requireText;
import static io.github.kgov.console.api.ApiResults.segment;

import io.github.kgov.console.model.ConsumerGroupInfo;
import io.github.kgov.console.model.ConsumerGroupSummary;
import io.vertx.core.Future;
import java.util.List;
import java.util.Objects;

public class ConsumerClient {

  private static final String BASE = "/api/v1/consumers/groups";

  private final ApiTransport transport;

  public ConsumerClient(ApiTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
  }

  public Future<List<ConsumerGroupInfo>> listGroups(String clusterId) {
    requireText(clusterId, "clusterId");
    return transport.get(BASE, query("cluster_id", clusterId))
      .map(body -> ApiResults.list(body, "groups", ConsumerGroupInfo::fromJson));
  }

  public Future<ConsumerGroupSummary> summary(String clusterId, String groupId) {
    requireText(clusterId, "clusterId");
    requireText(groupId, "groupId");
    return transport.get(BASE + "/" + segment(groupId) + "/summary", query("cluster_id", clusterId))
      .map(body -> ConsumerGroupSummary.fromJson(ApiResults.object(body)));
  }
}
