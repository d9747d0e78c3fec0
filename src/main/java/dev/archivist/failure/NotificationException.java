package dev.archivist.failure;

/** A notification sink could not deliver. Logged only, never propagated into the run outcome. */
public class NotificationException extends IndexingException {

  public NotificationException(String message, Throwable cause) {
    super(ErrorClass.NOTIFICATION, message, cause);
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}
