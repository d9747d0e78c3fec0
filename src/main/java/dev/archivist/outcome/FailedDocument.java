package dev.archivist.outcome;

import dev.archivist.failure.ErrorClass;

/**
 * A failed document as listed in a run summary.
 *
 * @param documentKey key of the document, still pending at the source
 * @param errorClass classification of the failure
 * @param message failure message
 * @param attempts attempts made before giving up
 */
public record FailedDocument(
    String documentKey, ErrorClass errorClass, String message, int attempts) {

  static FailedDocument from(DocumentOutcome outcome) {
    return new FailedDocument(
        outcome.documentKey(),
        outcome.errorClass(),
        outcome.detail() == null ? "" : outcome.detail(),
        outcome.attempts());
  }
}
