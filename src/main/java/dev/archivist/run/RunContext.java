package dev.archivist.run;

/**
 * Per-run values every worker needs.
 *
 * @param runId identifier of the run
 * @param collection vector collection documents are written to
 * @param cancellation cancellation token of the run
 */
public record RunContext(String runId, String collection, RunCancellation cancellation) {}
