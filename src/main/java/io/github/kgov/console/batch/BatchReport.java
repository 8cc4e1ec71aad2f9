package io.github.kgov.console.batch;

import io.github.kgov.console.model.BatchApplyResult;
import io.github.kgov.console.model.FailureDetail;
import io.github.kgov.console.model.PolicyViolation;
import java.util.List;

/**
 * Totals over the results of one batch run, with a plain-text rendering.
 */
public record BatchReport(
  List<BatchApplyResult> results,
  int succeededDocuments,
  int failedDocuments,
  int appliedItems,
  int skippedItems,
  int failedItems
) {

  public static BatchReport of(List<BatchApplyResult> results) {
    int succeeded = 0;
    int applied = 0;
    int skipped = 0;
    int failedItems = 0;
    for (BatchApplyResult result : results) {
      if (result.success()) {
        succeeded++;
      }
      applied += result.applied().size();
      skipped += result.skipped().size();
      failedItems += result.failed().size();
    }
    return new BatchReport(List.copyOf(results), succeeded, results.size() - succeeded,
      applied, skipped, failedItems);
  }

  public boolean allSucceeded() {
    return failedDocuments == 0;
  }

  public String render() {
    StringBuilder out = new StringBuilder();
    out.append(String.format("%d document(s): %d succeeded, %d failed%n",
      results.size(), succeededDocuments, failedDocuments));
    out.append(String.format("items: %d applied, %d skipped, %d failed%n",
      appliedItems, skippedItems, failedItems));

    for (BatchApplyResult result : results) {
      out.append(String.format("%n[%d] %s env=%s change_id=%s%n", result.index() + 1,
        result.success() ? "OK" : "FAILED", result.environment(),
        result.changeId() != null ? result.changeId() : "-"));
      if (!result.planned().isEmpty() && result.applied().isEmpty() && result.success()) {
        out.append("  planned: ").append(String.join(", ", result.planned())).append('\n');
      }
      if (!result.applied().isEmpty()) {
        out.append("  applied: ").append(String.join(", ", result.applied())).append('\n');
      }
      if (!result.skipped().isEmpty()) {
        out.append("  skipped: ").append(String.join(", ", result.skipped())).append('\n');
      }
      for (FailureDetail failure : result.failed()) {
        out.append("  ").append(failure.failureType());
        if (failure.name() != null) {
          out.append(" [").append(failure.name()).append(']');
        }
        out.append(": ").append(failure.errorMessage()).append('\n');
        for (PolicyViolation violation : failure.violations()) {
          out.append("    - ").append(violation.rule()).append(": ").append(violation.message());
          if (violation.name() != null) {
            out.append(" (").append(violation.name()).append(')');
          }
          out.append('\n');
        }
        for (String suggestion : failure.suggestions()) {
          out.append("    hint: ").append(suggestion).append('\n');
        }
      }
    }
    return out.toString();
  }
}
