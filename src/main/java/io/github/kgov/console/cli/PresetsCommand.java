package io.github.kgov.console.cli;

import io.github.kgov.console.policy.PolicyPreset;
import io.github.kgov.console.policy.PolicyPresets;
import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(
  name = "presets",
  description = "List built-in policy presets or print one",
  mixinStandardHelpOptions = true
)
public class PresetsCommand implements Callable<Integer> {

  @ParentCommand
  KgovCli parent;

  @Parameters(arity = "0..1", paramLabel = "KEY", description = "Preset to print")
  String key;

  @Override
  public Integer call() {
    PrintWriter out = parent.out();
    if (key == null) {
      for (PolicyPreset preset : PolicyPresets.all()) {
        out.printf("%-10s %-11s %s%n", preset.key(), preset.kind().policyType(), preset.description());
      }
      return 0;
    }

    Optional<PolicyPreset> preset = PolicyPresets.find(key);
    if (preset.isEmpty()) {
      parent.spec.commandLine().getErr().printf("Unknown preset: %s%n", key);
      return 2;
    }
    out.print(preset.get().content());
    out.flush();
    return 0;
  }
}
