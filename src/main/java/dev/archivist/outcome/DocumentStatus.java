package dev.archivist.outcome;

/** Terminal status of a document within one run. */
public enum DocumentStatus {
  /** Indexed and moved to the processed prefix. */
  COMPLETED,
  /** Gave up after a permanent failure or exhausted retries; still pending at the source. */
  FAILED,
  /** Not processed because the run was cancelled; still pending at the source. */
  SKIPPED
}
