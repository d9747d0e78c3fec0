package dev.archivist.failure;

/**
 * Base class of every failure raised by the indexing pipeline.
 *
 * <p>Carries the {@link ErrorClass} of the stage that failed. Subclasses decide whether the
 * failure is worth retrying.
 */
public abstract class IndexingException extends RuntimeException {

  private final ErrorClass errorClass;

  protected IndexingException(ErrorClass errorClass, String message, Throwable cause) {
    super(message, cause);
    this.errorClass = errorClass;
  }

  protected IndexingException(ErrorClass errorClass, String message) {
    super(message);
    this.errorClass = errorClass;
  }

  public ErrorClass errorClass() {
    return errorClass;
  }

  /** Whether retrying the same operation unchanged may succeed. */
  public abstract boolean isTransient();
}
