package io.github.kgov.console.cli;

import io.github.kgov.console.model.BulkDeleteResult;
import io.github.kgov.console.model.Topic;
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
  name = "topics",
  description = "List and delete topics",
  mixinStandardHelpOptions = true
)
public class TopicsCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(parent.out());
    return 0;
  }

  @Command(name = "list", description = "List topics of a cluster")
  int list(
      @Option(names = {"-c", "--cluster"}, required = true, description = "Cluster id") String clusterId)
      throws Exception {
    List<Topic> topics = parent.await(parent.api().topics().list(clusterId));
    PrintWriter out = parent.out();
    for (Topic topic : topics) {
      out.printf("%-50s %-6s partitions=%s owners=%s%n", topic.name(),
        topic.environment() != null ? topic.environment() : "-",
        topic.partitionCount() != null ? topic.partitionCount() : "-",
        String.join(",", topic.owners()));
    }
    out.printf("%d topic(s)%n", topics.size());
    return 0;
  }

  @Command(name = "delete", description = "Delete one or more topics")
  int delete(
      @Option(names = {"-c", "--cluster"}, required = true, description = "Cluster id") String clusterId,
      @Parameters(arity = "1..*", paramLabel = "TOPIC", description = "Topic names") List<String> names)
      throws Exception {
    PrintWriter out = parent.out();
    if (names.size() == 1) {
      parent.await(parent.api().topics().delete(clusterId, names.get(0)));
      out.printf("Deleted %s%n", names.get(0));
      return 0;
    }

    BulkDeleteResult result = parent.await(parent.api().topics().bulkDelete(clusterId, names));
    for (String name : result.succeeded()) {
      out.printf("Deleted %s%n", name);
    }
    for (String name : result.failed()) {
      out.printf("Failed  %s%n", name);
    }
    if (!result.message().isBlank()) {
      out.println(result.message());
    }
    return result.failed().isEmpty() ? 0 : 1;
  }
}
