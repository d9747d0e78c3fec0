package dev.archivist.failure;

/**
 * The pending documents could not be enumerated. Fatal for the run: no document is processed and
 * the run is reported as aborted.
 */
public class ListingException extends IndexingException {

  public ListingException(String message, Throwable cause) {
    super(ErrorClass.LISTING, message, cause);
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}
