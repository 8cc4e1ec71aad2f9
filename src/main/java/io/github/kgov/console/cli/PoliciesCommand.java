package io.github.kgov.console.cli;

import io.github.kgov.console.model.ActivePolicies;
import io.github.kgov.console.model.Policy;
import io.github.kgov.console.policy.PolicyPreset;
import io.github.kgov.console.policy.PolicyPresets;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
  name = "policies",
  description = "Naming and guardrail policies",
  mixinStandardHelpOptions = true
)
public class PoliciesCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(parent.out());
    return 0;
  }

  @Command(name = "list", description = "List policies")
  int list() throws Exception {
    List<Policy> policies = parent.await(parent.api().policies().list());
    PrintWriter out = parent.out();
    for (Policy policy : policies) {
      print(out, policy);
    }
    out.printf("%d policy(ies)%n", policies.size());
    return 0;
  }

  @Command(name = "active", description = "Show the active policies of an environment")
  int active(@Parameters(paramLabel = "ENV", description = "dev, stg or prod") String env) throws Exception {
    ActivePolicies active = parent.await(parent.api().policies().activeForEnvironment(env));
    PrintWriter out = parent.out();
    out.printf("environment: %s%n", active.environment());
    out.print("naming:    ");
    printOrNone(out, active.naming());
    out.print("guardrail: ");
    printOrNone(out, active.guardrail());
    return 0;
  }

  @Command(name = "create", description = "Create a draft policy from a preset")
  int create(
      @Option(names = {"--preset"}, required = true, description = "Preset key, see 'kgov presets'") String presetKey,
      @Option(names = {"--name"}, required = true, description = "Policy name") String name,
      @Option(names = {"--env"}, defaultValue = "total", description = "Target environment (default: ${DEFAULT-VALUE})")
      String env,
      @Option(names = {"--author"}, defaultValue = "${sys:user.name}", description = "Author (default: ${DEFAULT-VALUE})")
      String author)
      throws Exception {
    PolicyPreset preset = PolicyPresets.find(presetKey)
      .orElseThrow(() -> new ParameterException(spec.commandLine(), "Unknown preset: " + presetKey));
    Policy created = parent.await(parent.api().policies().create(preset.toDraft(name, author, env)));
    parent.out().printf("Created %s (%s v%d, %s)%n", created.policyId(), created.policyType(),
      created.version(), created.status());
    return 0;
  }

  @Command(name = "activate", description = "Activate a policy version")
  int activate(
      @Parameters(paramLabel = "POLICY_ID", description = "Policy id") String policyId,
      @Option(names = {"--version"}, description = "Version, latest when omitted") Integer version)
      throws Exception {
    Policy policy = parent.await(parent.api().policies().activate(policyId, version));
    parent.out().printf("Activated %s v%d%n", policy.policyId(), policy.version());
    return 0;
  }

  @Command(name = "archive", description = "Archive a policy")
  int archive(@Parameters(paramLabel = "POLICY_ID", description = "Policy id") String policyId) throws Exception {
    Policy policy = parent.await(parent.api().policies().archive(policyId));
    parent.out().printf("Archived %s v%d%n", policy.policyId(), policy.version());
    return 0;
  }

  private static void printOrNone(PrintWriter out, Policy policy) {
    if (policy == null) {
      out.println("none");
    } else {
      print(out, policy);
    }
  }

  private static void print(PrintWriter out, Policy policy) {
    out.printf("%-36s %-9s v%-3d %-8s %s%n", policy.policyId(), policy.policyType(), policy.version(),
      policy.status(), policy.name());
  }
}
