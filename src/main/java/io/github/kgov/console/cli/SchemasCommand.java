package io.github.kgov.console.cli;

import io.github.kgov.console.model.SchemaArtifact;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
  name = "schemas",
  description = "Schema registry artifacts",
  mixinStandardHelpOptions = true
)
public class SchemasCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(parent.out());
    return 0;
  }

  @Command(name = "list", description = "List registered schema artifacts")
  int list() throws Exception {
    List<SchemaArtifact> artifacts = parent.await(parent.api().schemas().listArtifacts());
    PrintWriter out = parent.out();
    for (SchemaArtifact artifact : artifacts) {
      out.printf("%-50s v%-4d %-8s %s%n", artifact.subject(), artifact.version(),
        artifact.schemaType() != null ? artifact.schemaType() : "-",
        artifact.compatibilityMode() != null ? artifact.compatibilityMode() : "-");
    }
    out.printf("%d artifact(s)%n", artifacts.size());
    return 0;
  }

  @Command(name = "upload", description = "Upload a schema file")
  int upload(
      @Option(names = {"-r", "--registry"}, required = true, description = "Registry id") String registryId,
      @Option(names = {"--env"}, required = true, description = "dev, stg or prod") String env,
      @Option(names = {"--change-id"}, required = true, description = "Change id") String changeId,
      @Parameters(paramLabel = "FILE", description = "Schema file (.avsc, .proto, .json)") Path file)
      throws Exception {
    Buffer content = Buffer.buffer(Files.readAllBytes(file));
    JsonObject report = parent.await(parent.api().schemas()
      .upload(registryId, env, changeId, file.getFileName().toString(), content));
    parent.out().println(report.encodePrettily());
    return 0;
  }

  @Command(name = "delete", description = "Delete a subject, analyzing impact first")
  int delete(
      @Option(names = {"-r", "--registry"}, required = true, description = "Registry id") String registryId,
      @Option(names = {"--analyze-only"}, description = "Only print the impact analysis") boolean analyzeOnly,
      @Parameters(paramLabel = "SUBJECT", description = "Subject name") String subject)
      throws Exception {
    PrintWriter out = parent.out();
    JsonObject analysis = parent.await(parent.api().schemas().analyzeDelete(registryId, subject));
    out.println(analysis.encodePrettily());
    if (analyzeOnly) {
      return 0;
    }
    JsonObject result = parent.await(parent.api().schemas().delete(registryId, subject));
    out.println(result.encodePrettily());
    return 0;
  }

  @Command(name = "sync", description = "Sync artifacts from a registry into the catalog")
  int sync(
      @Option(names = {"-r", "--registry"}, required = true, description = "Registry id") String registryId)
      throws Exception {
    JsonObject result = parent.await(parent.api().schemas().sync(registryId));
    parent.out().println(result.encodePrettily());
    return 0;
  }
}
