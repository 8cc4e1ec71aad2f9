package io.github.kgov.console.cli;

import io.github.kgov.console.batch.BatchApplyOptions;
import io.github.kgov.console.batch.BatchApplyOrchestrator;
import io.github.kgov.console.batch.BatchReport;
import io.github.kgov.console.batch.YamlDocuments;
import io.github.kgov.console.model.BatchApplyResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Applies one or more multi-document topic YAML files, one document at a time.
 * Exits with 1 when any document failed.
 */
@Command(
  name = "apply",
  description = "Dry-run and apply topic YAML batches",
  mixinStandardHelpOptions = true
)
public class ApplyCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Parameters(arity = "1..*", paramLabel = "FILE", description = "YAML files, documents separated by ---")
  List<Path> files;

  @Option(names = {"-c", "--cluster"}, required = true, description = "Cluster id")
  String clusterId;

  @Option(names = {"--dry-run"}, description = "Only plan, never apply")
  boolean dryRun;

  @Option(names = {"--force"}, description = "Apply documents despite blocking policy violations")
  boolean force;

  @Override
  public Integer call() throws Exception {
    List<String> contents = new ArrayList<>(files.size());
    for (Path file : files) {
      contents.add(Files.readString(file, StandardCharsets.UTF_8));
    }

    BatchApplyOrchestrator orchestrator = new BatchApplyOrchestrator(parent.api().topics());
    List<BatchApplyResult> results = parent.await(
      orchestrator.run(clusterId, YamlDocuments.join(contents), new BatchApplyOptions(dryRun, force)),
      parent.waitSeconds * Math.max(1, contents.size()));

    BatchReport report = BatchReport.of(results);
    parent.out().print(report.render());
    parent.out().flush();
    return report.allSucceeded() ? 0 : 1;
  }
}
