package io.github.kgov.console.cli;

import io.github.kgov.console.model.ConnectorStatus;
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
  name = "connectors",
  description = "Kafka Connect connectors",
  mixinStandardHelpOptions = true
)
public class ConnectorsCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(parent.out());
    return 0;
  }

  @Command(name = "list", description = "List connectors of a Connect cluster")
  int list(
      @Option(names = {"--connect"}, required = true, description = "Connect cluster id") String connectId)
      throws Exception {
    List<String> names = parent.await(parent.api().connect().list(connectId));
    PrintWriter out = parent.out();
    names.forEach(out::println);
    out.printf("%d connector(s)%n", names.size());
    return 0;
  }

  @Command(name = "status", description = "Show connector and task states")
  int status(
      @Option(names = {"--connect"}, required = true, description = "Connect cluster id") String connectId,
      @Parameters(paramLabel = "NAME", description = "Connector name") String name)
      throws Exception {
    ConnectorStatus status = parent.await(parent.api().connect().status(connectId, name));
    PrintWriter out = parent.out();
    out.printf("%s %s%n", status.name(), status.state());
    for (ConnectorStatus.TaskState task : status.tasks()) {
      out.printf("  task %d %s%n", task.id(), task.state());
    }
    return status.isRunning() ? 0 : 1;
  }

  @Command(name = "pause", description = "Pause a connector")
  int pause(
      @Option(names = {"--connect"}, required = true, description = "Connect cluster id") String connectId,
      @Parameters(paramLabel = "NAME", description = "Connector name") String name)
      throws Exception {
    parent.await(parent.api().connect().pause(connectId, name));
    parent.out().printf("Paused %s%n", name);
    return 0;
  }

  @Command(name = "resume", description = "Resume a connector")
  int resume(
      @Option(names = {"--connect"}, required = true, description = "Connect cluster id") String connectId,
      @Parameters(paramLabel = "NAME", description = "Connector name") String name)
      throws Exception {
    parent.await(parent.api().connect().resume(connectId, name));
    parent.out().printf("Resumed %s%n", name);
    return 0;
  }

  @Command(name = "restart", description = "Restart a connector")
  int restart(
      @Option(names = {"--connect"}, required = true, description = "Connect cluster id") String connectId,
      @Parameters(paramLabel = "NAME", description = "Connector name") String name)
      throws Exception {
    parent.await(parent.api().connect().restart(connectId, name));
    parent.out().printf("Restarted %s%n", name);
    return 0;
  }
}
