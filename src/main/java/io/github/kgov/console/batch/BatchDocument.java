package io.github.kgov.console.batch;

import io.github.kgov.console.model.FailureDetail;

/**
 * One document of a batch after local validation.
 *
 * @param index zero based position in the input
 * @param text the YAML text sent to the backend
 * @param environment value of {@code env}, null when missing
 * @param changeId value of {@code change_id}, null when missing
 * @param itemCount number of entries under {@code items}
 * @param failure why the document cannot be sent, null when it is valid
 */
public record BatchDocument(
  int index,
  String text,
  String environment,
  String changeId,
  int itemCount,
  FailureDetail failure
) {

  public boolean isValid() {
    return failure == null;
  }
}
