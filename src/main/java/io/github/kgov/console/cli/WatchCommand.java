package io.github.kgov.console.cli;

import io.github.kgov.console.live.LiveFeedConfig;
import io.github.kgov.console.live.LiveMonitorSession;
import io.github.kgov.console.model.LiveSnapshot;
import io.github.kgov.console.model.LiveSnapshot.PartitionLag;
import io.vertx.core.Context;
import io.vertx.core.Promise;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Follows the live lag feed of one consumer group and prints a line per snapshot.
 */
@Command(
  name = "watch",
  description = "Stream live lag snapshots of a consumer group",
  mixinStandardHelpOptions = true
)
public class WatchCommand implements Callable<Integer> {

  private static final long CLOSE_WAIT_SECONDS = 5;

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Option(names = {"-c", "--cluster"}, required = true, description = "Cluster id")
  String clusterId;

  @Option(names = {"-g", "--group"}, required = true, description = "Consumer group id")
  String groupId;

  @Option(names = {"-n", "--samples"}, defaultValue = "10", description = "Snapshots to print (default: ${DEFAULT-VALUE})")
  int samples;

  /**
   * Session state is touched on the subscriber's event loop only, so live mode is
   * switched and the session closed through the same context.
   */
  @Override
  public Integer call() throws Exception {
    if (samples < 1) {
      throw new ParameterException(spec.commandLine(), "--samples must be at least 1, got " + samples);
    }
    PrintWriter out = parent.out();
    Promise<Void> done = Promise.promise();
    AtomicInteger received = new AtomicInteger();

    LiveFeedConfig config = parent.subscriber().config();
    LiveMonitorSession session = new LiveMonitorSession(parent.subscriber(), clusterId, groupId, snapshot -> {
      print(out, snapshot, config.stuckLagThreshold());
      if (received.incrementAndGet() >= samples) {
        done.tryComplete();
      }
    });

    long intervalSeconds = config.intervalSeconds();
    Context context = parent.vertx().getOrCreateContext();
    context.runOnContext(v -> session.setLiveMode(true));
    try {
      parent.await(done.future(), parent.waitSeconds + intervalSeconds * samples);
    } finally {
      Promise<Void> closed = Promise.promise();
      context.runOnContext(v -> {
        session.close();
        closed.complete();
      });
      parent.await(closed.future(), CLOSE_WAIT_SECONDS);
    }
    return 0;
  }

  private static void print(PrintWriter out, LiveSnapshot snapshot, long stuckThreshold) {
    List<PartitionLag> stuck = snapshot.partitionsAbove(stuckThreshold);
    out.printf("%s state=%s members=%d lag=%d p95=%d max=%d stuck=%d%n", snapshot.timestamp(), snapshot.state(),
      snapshot.memberCount(), snapshot.totalLag(), snapshot.lagStats().p95Lag(), snapshot.lagStats().maxLag(),
      stuck.size());
    for (PartitionLag partition : stuck) {
      out.printf("  stuck %s-%d lag=%d%n", partition.topic(), partition.partition(), partition.lag());
    }
    out.flush();
  }
}
