package dev.archivist.failure;

/**
 * Classification of a failure by the pipeline stage that produced it.
 *
 * <p>The {@link #value()} is the label reported in document outcomes, run summaries and
 * notifications (e.g. {@code "ExtractionError"}).
 */
public enum ErrorClass {
  LISTING("ListingError"),
  EXTRACTION("ExtractionError"),
  CHUNKING("ChunkingError"),
  EMBEDDING("EmbeddingError"),
  VECTOR_WRITE("VectorWriteError"),
  TRANSITION("TransitionError"),
  NOTIFICATION("NotificationError"),
  UNEXPECTED("UnexpectedError");

  private final String value;

  ErrorClass(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
