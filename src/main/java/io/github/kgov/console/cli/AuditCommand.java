package io.github.kgov.console.cli;

import io.github.kgov.console.api.AuditQuery;
import io.github.kgov.console.model.AuditLog;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
  name = "audit",
  description = "Audit trail of governance actions",
  mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(parent.out());
    return 0;
  }

  @Command(name = "recent", description = "Most recent activities")
  int recent(
      @Option(names = {"-n", "--limit"}, defaultValue = "20", description = "1-100 (default: ${DEFAULT-VALUE})")
      int limit)
      throws Exception {
    print(parent.await(parent.api().audit().recent(limit)));
    return 0;
  }

  @Command(name = "history", description = "Filtered activity history")
  int history(
      @Option(names = {"--from"}, description = "ISO-8601 lower bound") String from,
      @Option(names = {"--to"}, description = "ISO-8601 upper bound") String to,
      @Option(names = {"--type"}, description = "topic, schema, connector or policy") String activityType,
      @Option(names = {"--action"}, description = "e.g. CREATE, DELETE, APPLY") String action,
      @Option(names = {"--actor"}, description = "Who performed the action") String actor,
      @Option(names = {"-n", "--limit"}, description = "Maximum entries") Integer limit)
      throws Exception {
    print(parent.await(parent.api().audit().history(new AuditQuery(from, to, activityType, action, actor, limit))));
    return 0;
  }

  private void print(List<AuditLog> logs) {
    PrintWriter out = parent.out();
    for (AuditLog entry : logs) {
      out.printf("%s %-9s %-8s %-40s %s%n", entry.timestamp(), entry.activityType(), entry.action(),
        entry.target(), entry.actor() != null ? entry.actor() : "-");
    }
    out.printf("%d entr%s%n", logs.size(), logs.size() == 1 ? "y" : "ies");
  }
}
