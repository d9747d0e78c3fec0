package dev.archivist.run;

/**
 * Immutable snapshot of a run's progress.
 *
 * @param total documents in the work set
 * @param inFlight documents currently being processed
 * @param peakInFlight highest value {@code inFlight} reached
 * @param completed documents completed
 * @param failed documents failed
 * @param skipped documents skipped
 */
public record RunProgress(
    int total, int inFlight, int peakInFlight, int completed, int failed, int skipped) {

  public int finished() {
    return completed + failed + skipped;
  }
}
