package io.github.kgov.console.batch;

import io.github.kgov.console.api.ApiException;
import io.github.kgov.console.api.TopicClient;
import io.github.kgov.console.model.BatchApplyResult;
import io.github.kgov.console.model.DryRunResult;
import io.github.kgov.console.model.FailureDetail;
import io.github.kgov.console.model.FailureType;
import io.github.kgov.console.model.PolicyViolation;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a multi-document topic batch: each document is dry-run, checked for blocking
 * violations, then applied. Documents are processed one after the other in input order
 * and a failing document never stops the ones after it.
 */
public class BatchApplyOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(BatchApplyOrchestrator.class);

  private final TopicClient topics;
  private final BatchDocumentValidator validator;

  public BatchApplyOrchestrator(TopicClient topics) {
    this(topics, new BatchDocumentValidator());
  }

  BatchApplyOrchestrator(TopicClient topics, BatchDocumentValidator validator) {
    this.topics = Objects.requireNonNull(topics, "topics cannot be null");
    this.validator = Objects.requireNonNull(validator, "validator cannot be null");
  }

  /**
   * Processes every document of {@code text}.
   *
   * @param clusterId target cluster
   * @param text one or more YAML documents separated by {@code ---} lines
   * @param options dry-run only and force flags
   * @return Future with exactly one result per document, in input order; never fails
   *     because of a document, only on invalid arguments
   */
  public Future<List<BatchApplyResult>> run(String clusterId, String text, BatchApplyOptions options) {
    if (clusterId == null || clusterId.isBlank()) {
      return Future.failedFuture(new IllegalArgumentException("clusterId cannot be blank"));
    }
    Objects.requireNonNull(options, "options cannot be null");
    List<String> documents = YamlDocuments.split(text);
    log.info("Processing {} batch document(s) on cluster {} (dryRunOnly={}, force={})",
      documents.size(), clusterId, options.dryRunOnly(), options.force());

    List<BatchApplyResult> results = new ArrayList<>(documents.size());
    Future<Void> chain = Future.succeededFuture();
    for (int i = 0; i < documents.size(); i++) {
      final int index = i;
      final String document = documents.get(i);
      chain = chain.compose(v -> processDocument(clusterId, index, document, options)
        .<Void>map(result -> {
          results.add(result);
          return null;
        }));
    }

    return chain.map(v -> {
      long failed = results.stream().filter(r -> !r.success()).count();
      log.info("Batch finished on cluster {}: {} succeeded, {} failed",
        clusterId, results.size() - failed, failed);
      return List.copyOf(results);
    });
  }

  /**
   * Always succeeds: errors are turned into a failed result.
   */
  private Future<BatchApplyResult> processDocument(
      String clusterId, int index, String text, BatchApplyOptions options) {
    BatchDocument document = validator.validate(index, text);
    if (!document.isValid()) {
      log.warn("Document {} rejected before sending: {}", index, document.failure().errorMessage());
      return Future.succeededFuture(
        BatchApplyResult.failure(index, document.environment(), document.changeId(), document.failure()));
    }

    return topics.dryRun(clusterId, document.text())
      .compose(plan -> afterDryRun(clusterId, document, plan, options))
      .recover(err -> {
        FailureDetail failure = toFailure(err);
        log.warn("Document {} ({}) failed: {}", index, document.changeId(), failure.errorMessage());
        return Future.succeededFuture(
          BatchApplyResult.failure(index, document.environment(), document.changeId(), failure));
      });
  }

  private Future<BatchApplyResult> afterDryRun(
      String clusterId, BatchDocument document, DryRunResult plan, BatchApplyOptions options) {
    int index = document.index();
    List<PolicyViolation> blocking = plan.blockingViolations();

    if (!blocking.isEmpty() && (options.dryRunOnly() || !options.force())) {
      log.info("Document {} ({}) blocked by {} violation(s)", index, plan.changeId(), blocking.size());
      FailureDetail failure = new FailureDetail(null, FailureType.POLICY_VIOLATION.value(),
        blocking.size() + " policy violation(s) block this batch",
        List.of("Fix the violations or rerun with force to apply anyway"), plan.violations());
      return Future.succeededFuture(BatchApplyResult.failure(index,
        orElse(plan.environment(), document.environment()),
        orElse(plan.changeId(), document.changeId()), failure));
    }

    if (options.dryRunOnly()) {
      log.info("Document {} ({}) dry-run planned {} change(s)", index, plan.changeId(), plan.plan().size());
      return Future.succeededFuture(BatchApplyResult.fromDryRun(index, plan));
    }

    if (!blocking.isEmpty()) {
      log.warn("Applying document {} ({}) despite {} blocking violation(s)",
        index, plan.changeId(), blocking.size());
    }
    return topics.applyYaml(clusterId, document.text())
      .map(response -> BatchApplyResult.fromApply(index, plan, response))
      .onSuccess(result -> log.info("Document {} ({}) applied: {} applied, {} skipped, {} failed",
        index, result.changeId(), result.applied().size(), result.skipped().size(), result.failed().size()));
  }

  static FailureDetail toFailure(Throwable err) {
    if (err instanceof ApiException api) {
      return FailureDetail.of(api.getKind(), api.getMessage(), suggestionsFor(api));
    }
    // Transport failures arrive as ApiException; anything else happened after a response
    return FailureDetail.of(FailureType.HTTP_ERROR,
      err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName(), List.of());
  }

  private static List<String> suggestionsFor(ApiException api) {
    return switch (api.getKind()) {
      case VALIDATION_ERROR -> List.of("Check the document against the batch format: env, change_id, items");
      case NETWORK_ERROR -> List.of("Check that the backend is reachable");
      default -> List.of();
    };
  }

  private static String orElse(String value, String fallback) {
    return value != null ? value : fallback;
  }
}
