package dev.archivist.outcome;

import dev.archivist.failure.ErrorClass;
import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Final record of one document's processing within a run.
 *
 * @param documentKey key of the document
 * @param status terminal status
 * @param lastState last stage the document reached
 * @param attempts highest attempt number reached by any stage call; 1 when nothing was retried
 * @param chunkCount chunks produced
 * @param vectorsStored records written to the vector store
 * @param errorClass classification of the failure; null unless {@link DocumentStatus#FAILED}
 * @param detail failure message, or the reason a document was skipped; null for completions
 * @param duration wall-clock processing time
 */
public record DocumentOutcome(
    String documentKey,
    DocumentStatus status,
    DocumentState lastState,
    int attempts,
    int chunkCount,
    int vectorsStored,
    @Nullable ErrorClass errorClass,
    @Nullable String detail,
    Duration duration) {

  public DocumentOutcome {
    Objects.requireNonNull(documentKey, "documentKey must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(lastState, "lastState must not be null");
    Objects.requireNonNull(duration, "duration must not be null");
    if (status == DocumentStatus.FAILED && errorClass == null) {
      throw new IllegalArgumentException("Failed outcomes must carry an error class");
    }
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be at least 1, got: " + attempts);
    }
  }

  public boolean isFailed() {
    return status == DocumentStatus.FAILED;
  }
}
