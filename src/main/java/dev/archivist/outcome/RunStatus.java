package dev.archivist.outcome;

/** Overall status of a run. */
public enum RunStatus {
  COMPLETED,
  COMPLETED_WITH_FAILURES,
  CANCELLED,
  DEADLINE_EXCEEDED,
  /** The pending documents could not be listed; nothing was processed. */
  ABORTED;

  /** Process exit code when a run is triggered from the command line. */
  public int exitCode() {
    return switch (this) {
      case COMPLETED -> 0;
      case COMPLETED_WITH_FAILURES -> 2;
      case CANCELLED, DEADLINE_EXCEEDED -> 3;
      case ABORTED -> 1;
    };
  }
}
