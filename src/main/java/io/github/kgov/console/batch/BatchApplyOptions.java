package io.github.kgov.console.batch;

/**
 * @param dryRunOnly stop after the dry-run, nothing is applied
 * @param force apply even when the dry-run reports blocking violations
 */
public record BatchApplyOptions(boolean dryRunOnly, boolean force) {

  public static final BatchApplyOptions APPLY = new BatchApplyOptions(false, false);
  public static final BatchApplyOptions DRY_RUN = new BatchApplyOptions(true, false);
}
