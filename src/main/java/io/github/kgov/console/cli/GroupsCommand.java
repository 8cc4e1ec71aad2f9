package io.github.kgov.console.cli;

import io.github.kgov.console.model.ConsumerGroupInfo;
import io.github.kgov.console.model.ConsumerGroupSummary;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
  name = "groups",
  description = "Consumer groups",
  mixinStandardHelpOptions = true
)
public class GroupsCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(parent.out());
    return 0;
  }

  @Command(name = "list", description = "List consumer groups of a cluster")
  int list(
      @Option(names = {"-c", "--cluster"}, required = true, description = "Cluster id") String clusterId)
      throws Exception {
    List<ConsumerGroupInfo> groups = parent.await(parent.api().consumers().listGroups(clusterId));
    PrintWriter out = parent.out();
    for (ConsumerGroupInfo group : groups) {
      out.printf("%-40s %-20s members=%d lag=%d p95=%d%n", group.groupId(), group.state(),
        group.memberCount(), group.lagStats().totalLag(), group.lagStats().p95Lag());
    }
    out.printf("%d group(s)%n", groups.size());
    return 0;
  }

  @Command(name = "show", description = "Summary of one consumer group")
  int show(
      @Option(names = {"-c", "--cluster"}, required = true, description = "Cluster id") String clusterId,
      @Parameters(paramLabel = "GROUP", description = "Group id") String groupId)
      throws Exception {
    ConsumerGroupSummary summary = parent.await(parent.api().consumers().summary(clusterId, groupId));
    PrintWriter out = parent.out();
    out.printf("group:     %s%n", summary.groupId());
    out.printf("state:     %s%n", summary.state());
    out.printf("members:   %d%n", summary.memberCount());
    out.printf("topics:    %d%n", summary.topicCount());
    out.printf("lag:       %s%n", summary.lag());
    out.printf("fairness:  %.3f%n", summary.fairnessGini());
    out.printf("rebalance: %s%n", summary.rebalanceScore() != null ? summary.rebalanceScore() : "-");
    out.printf("stuck:     %d partition(s)%n", summary.stuck().size());
    return 0;
  }
}
