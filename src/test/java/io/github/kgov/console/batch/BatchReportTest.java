package io.github.kgov.console.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.kgov.console.model.BatchApplyResult;
import io.github.kgov.console.model.FailureDetail;
import io.github.kgov.console.model.FailureType;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BatchReport totals and rendering.
 */
public class BatchReportTest {

  private static BatchApplyResult applied(int index, List<String> topics) {
    return new BatchApplyResult(index, true, "dev", "c-" + index, topics, topics, List.of(), List.of(), List.of());
  }

  @Test
  void totals() {
    BatchReport report = BatchReport.of(List.of(
      applied(0, List.of("dev.a", "dev.b")),
      BatchApplyResult.failure(1, "dev", "c-1",
        FailureDetail.of(FailureType.VALIDATION_ERROR, "Missing required field(s): items",
          List.of("Use 'items:' instead of 'topics:'")))));

    assertEquals(1, report.succeededDocuments());
    assertEquals(1, report.failedDocuments());
    assertEquals(2, report.appliedItems());
    assertEquals(1, report.failedItems());
    assertFalse(report.allSucceeded());
  }

  @Test
  void render_listsFailuresWithHints() {
    BatchReport report = BatchReport.of(List.of(
      BatchApplyResult.failure(0, null, null,
        FailureDetail.of(FailureType.VALIDATION_ERROR, "Invalid YAML: bad indent", List.of("Check indentation")))));

    String text = report.render();

    assertTrue(text.contains("1 document(s): 0 succeeded, 1 failed"));
    assertTrue(text.contains("[1] FAILED env=unknown change_id=-"));
    assertTrue(text.contains("validation_error: Invalid YAML: bad indent"));
    assertTrue(text.contains("hint: Check indentation"));
  }

  @Test
  void emptyReport_succeeds() {
    assertTrue(BatchReport.of(List.of()).allSucceeded());
  }
}
