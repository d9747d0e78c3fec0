package dev.archivist.failure;

/** A failure that may clear on retry (rate limit, timeout, temporary unavailability). */
public class TransientIndexingException extends IndexingException {

  public TransientIndexingException(ErrorClass errorClass, String message) {
    super(errorClass, message);
  }

  public TransientIndexingException(ErrorClass errorClass, String message, Throwable cause) {
    super(errorClass, message, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
