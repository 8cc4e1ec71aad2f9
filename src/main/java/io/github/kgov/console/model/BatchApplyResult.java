package io.github.kgov.console.model;

import java.util.List;

/**
 * Outcome of one document of a multi-document batch.
 *
 * @param index zero based position of the document in the input
 * @param success true when nothing failed and no blocking violation stopped the document
 * @param environment target environment, {@code unknown} when the document could not be read
 * @param changeId change id of the document, may be null
 * @param planned topic names the dry-run planned to change
 * @param applied topics created or altered
 * @param skipped topics left untouched
 * @param failed failures, empty on success
 * @param violations every violation the dry-run reported, including forced and non-blocking ones
 */
public record BatchApplyResult(
  int index,
  boolean success,
  String environment,
  String changeId,
  List<String> planned,
  List<String> applied,
  List<String> skipped,
  List<FailureDetail> failed,
  List<PolicyViolation> violations
) {

  private static final String UNKNOWN_ENV = "unknown";

  public BatchApplyResult {
    environment = environment == null ? UNKNOWN_ENV : environment;
    planned = List.copyOf(planned);
    applied = List.copyOf(applied);
    skipped = List.copyOf(skipped);
    failed = List.copyOf(failed);
    violations = List.copyOf(violations);
  }

  public static BatchApplyResult failure(
      int index, String environment, String changeId, FailureDetail failure) {
    return new BatchApplyResult(index, false, environment, changeId,
      List.of(), List.of(), List.of(), List.of(failure), failure.violations());
  }

  public static BatchApplyResult fromDryRun(int index, DryRunResult plan) {
    return new BatchApplyResult(index, true, plan.environment(), plan.changeId(),
      plan.plannedNames(), List.of(), List.of(), List.of(), plan.violations());
  }

  public static BatchApplyResult fromApply(int index, DryRunResult plan, TopicApplyResponse response) {
    return new BatchApplyResult(
      index,
      response.failed().isEmpty(),
      response.environment() != null ? response.environment() : plan.environment(),
      response.changeId() != null ? response.changeId() : plan.changeId(),
      plan.plannedNames(),
      response.applied(),
      response.skipped(),
      response.failed(),
      plan.violations()
    );
  }
}
