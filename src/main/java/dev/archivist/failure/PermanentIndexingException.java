package dev.archivist.failure;

/**
 * A failure that will recur on every attempt with the same input, such as a corrupt payload or a
 * schema mismatch.
 */
public class PermanentIndexingException extends IndexingException {

  public PermanentIndexingException(ErrorClass errorClass, String message) {
    super(errorClass, message);
  }

  public PermanentIndexingException(ErrorClass errorClass, String message, Throwable cause) {
    super(errorClass, message, cause);
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}
