package dev.archivist.run;

import dev.archivist.failure.AttemptObserver;
import dev.archivist.failure.ErrorClass;
import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.DocumentState;
import dev.archivist.outcome.DocumentStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Mutable processing state of one document, owned by the worker processing it.
 *
 * <p>Enforces the sequential state machine of {@link DocumentState} and keeps the highest
 * attempt number any stage call reached.
 */
final class DocumentTracker implements AttemptObserver {

  private final String documentKey;
  private final Clock clock;
  private final Instant startedAt;
  private DocumentState state = DocumentState.PENDING;
  private int attempts = 1;

  DocumentTracker(String documentKey, Clock clock) {
    this.documentKey = documentKey;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  @Override
  public void attempted(int attempt) {
    attempts = Math.max(attempts, attempt);
  }

  void advance(DocumentState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Illegal transition " + state + " -> " + next + " for " + documentKey);
    }
    state = next;
  }

  DocumentState state() {
    return state;
  }

  DocumentOutcome completed(int chunkCount, int vectorsStored) {
    advance(DocumentState.COMPLETED);
    return new DocumentOutcome(documentKey, DocumentStatus.COMPLETED, state, attempts,
        chunkCount, vectorsStored, null, null, elapsed());
  }

  DocumentOutcome failed(ErrorClass errorClass, String message, int chunkCount) {
    DocumentState reached = state;
    if (state.canTransitionTo(DocumentState.FAILED)) {
      state = DocumentState.FAILED;
    }
    return new DocumentOutcome(documentKey, DocumentStatus.FAILED, reached, attempts,
        chunkCount, 0, errorClass, message, elapsed());
  }

  DocumentOutcome skipped(String reason, int chunkCount) {
    return new DocumentOutcome(documentKey, DocumentStatus.SKIPPED, state, attempts,
        chunkCount, 0, null, reason, elapsed());
  }

  /** Error class for an unclassified failure in the current stage. */
  ErrorClass currentStageErrorClass() {
    return switch (state) {
      case EXTRACTING -> ErrorClass.EXTRACTION;
      case CHUNKING -> ErrorClass.CHUNKING;
      case EMBEDDING -> ErrorClass.EMBEDDING;
      case WRITING -> ErrorClass.VECTOR_WRITE;
      case TRANSITIONING -> ErrorClass.TRANSITION;
      default -> ErrorClass.UNEXPECTED;
    };
  }

  private Duration elapsed() {
    return Duration.between(startedAt, clock.instant());
  }
}
