package io.github.kgov.console.cli;

import io.github.kgov.console.api.ApiConfig;
import io.github.kgov.console.api.ApiException;
import io.github.kgov.console.api.GovernanceApi;
import io.github.kgov.console.live.LiveFeedConfig;
import io.github.kgov.console.live.LiveSnapshotSubscriber;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.io.PrintWriter;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Command line for the governance backend.
 */
@Command(
  name = "kgov",
  description = "Kafka governance console",
  mixinStandardHelpOptions = true,
  version = "1.0.0",
  subcommands = {
    TopicsCommand.class,
    ApplyCommand.class,
    SchemasCommand.class,
    ConnectorsCommand.class,
    PoliciesCommand.class,
    PresetsCommand.class,
    AuditCommand.class,
    GroupsCommand.class,
    WatchCommand.class,
    CommandLine.HelpCommand.class
  }
)
public class KgovCli implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(KgovCli.class);

  @Spec
  CommandSpec spec;

  @Option(
    names = {"--api-url"},
    description = "Backend base URL (default: from CONSOLE_API_BASE_URL or application.properties)"
  )
  String apiUrl;

  @Option(
    names = {"--wait"},
    description = "Seconds to wait for a backend call (default: ${DEFAULT-VALUE})",
    defaultValue = "30"
  )
  long waitSeconds;

  private Vertx vertx;
  private GovernanceApi api;
  private LiveSnapshotSubscriber subscriber;

  public KgovCli() {
  }

  KgovCli(GovernanceApi api) {
    this.api = api;
  }

  public static int run(String... args) {
    KgovCli cli = new KgovCli();
    try {
      return commandLine(cli).execute(args);
    } finally {
      cli.shutdown();
    }
  }

  static CommandLine commandLine(KgovCli cli) {
    CommandLine commandLine = new CommandLine(cli);
    commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
      cmd.getErr().println(cmd.getColorScheme().errorText(describe(ex)));
      log.debug("Command failed", ex);
      return 1;
    });
    return commandLine;
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }

  ApiConfig apiConfig() {
    ApiConfig loaded = ApiConfig.load();
    if (apiUrl == null || apiUrl.isBlank()) {
      return loaded;
    }
    return ApiConfig.builder()
      .baseUrl(apiUrl)
      .timeoutMs(loaded.getTimeoutMs())
      .build();
  }

  GovernanceApi api() {
    if (api == null) {
      api = GovernanceApi.create(vertx(), apiConfig());
    }
    return api;
  }

  LiveSnapshotSubscriber subscriber() {
    if (subscriber == null) {
      subscriber = new LiveSnapshotSubscriber(vertx(), apiConfig().getWsBaseUrl(),
        LiveFeedConfig.fromEnvironment());
    }
    return subscriber;
  }

  Vertx vertx() {
    if (vertx == null) {
      vertx = Vertx.vertx();
    }
    return vertx;
  }

  PrintWriter out() {
    return spec.commandLine().getOut();
  }

  /**
   * Blocks the calling thread until the future completes.
   */
  <T> T await(Future<T> future) throws Exception {
    return await(future, waitSeconds);
  }

  <T> T await(Future<T> future, long seconds) throws Exception {
    try {
      return future.toCompletionStage().toCompletableFuture().get(seconds, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof Exception cause) {
        throw cause;
      }
      throw e;
    } catch (TimeoutException e) {
      throw new TimeoutException("No response within " + seconds + "s");
    }
  }

  void shutdown() {
    if (subscriber != null) {
      subscriber.close();
    }
    if (api != null) {
      api.close();
    }
    if (vertx != null) {
      try {
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
      } catch (Exception e) {
        log.warn("Failed to close Vert.x cleanly: {}", e.getMessage());
      }
    }
  }

  static String describe(Exception ex) {
    if (ex instanceof ApiException api) {
      StringBuilder message = new StringBuilder(api.getMessage());
      for (String detail : api.detailMessages()) {
        message.append(System.lineSeparator()).append("  - ").append(detail);
      }
      return message.toString();
    }
    return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
  }
}
