package dev.archivist.outcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Aggregate result of one run, published once at run end.
 *
 * <p>{@code completed + failed + skipped == totalDocuments} always holds.
 *
 * @param runId identifier of the run
 * @param status overall run status
 * @param startedAt run start
 * @param finishedAt run end
 * @param totalDocuments documents in the work set
 * @param completed documents indexed and moved
 * @param failed documents that failed
 * @param skipped documents skipped
 * @param failures failed documents with their error classes, ordered by key
 * @param outcomes every document outcome, ordered by key
 * @param totalChunks chunks produced across all documents
 * @param vectorsStored records written across all documents
 * @param peakConcurrency highest number of documents processed simultaneously
 * @param abortReason why the run was aborted; null unless {@link RunStatus#ABORTED}
 */
public record RunSummary(
    String runId,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    int totalDocuments,
    int completed,
    int failed,
    int skipped,
    List<FailedDocument> failures,
    List<DocumentOutcome> outcomes,
    long totalChunks,
    long vectorsStored,
    int peakConcurrency,
    @Nullable String abortReason) {

  public RunSummary {
    Objects.requireNonNull(runId, "runId must not be null");
    Objects.requireNonNull(status, "status must not be null");
    failures = List.copyOf(failures);
    outcomes = List.copyOf(outcomes);
    if (completed + failed + skipped != totalDocuments) {
      throw new IllegalArgumentException(
          "completed + failed + skipped must equal totalDocuments, got "
              + completed + " + " + failed + " + " + skipped + " != " + totalDocuments);
    }
  }

  /**
   * Summarise the outcomes of a run.
   *
   * @param runId identifier of the run
   * @param status overall run status
   * @param startedAt run start
   * @param finishedAt run end
   * @param outcomes one outcome per document of the work set
   * @param peakConcurrency highest number of documents processed simultaneously
   */
  public static RunSummary of(String runId, RunStatus status, Instant startedAt,
                              Instant finishedAt, List<DocumentOutcome> outcomes,
                              int peakConcurrency) {
    int completed = 0;
    int failed = 0;
    int skipped = 0;
    long chunks = 0;
    long vectors = 0;
    for (DocumentOutcome outcome : outcomes) {
      switch (outcome.status()) {
        case COMPLETED -> completed++;
        case FAILED -> failed++;
        case SKIPPED -> skipped++;
      }
      chunks += outcome.chunkCount();
      vectors += outcome.vectorsStored();
    }
    List<DocumentOutcome> ordered = outcomes.stream()
        .sorted(Comparator.comparing(DocumentOutcome::documentKey))
        .toList();
    List<FailedDocument> failures = ordered.stream()
        .filter(DocumentOutcome::isFailed)
        .map(FailedDocument::from)
        .toList();
    return new RunSummary(runId, status, startedAt, finishedAt, outcomes.size(), completed,
        failed, skipped, failures, ordered, chunks, vectors, peakConcurrency, null);
  }

  /** Summary of a run that stopped before processing anything. */
  public static RunSummary aborted(String runId, Instant startedAt, Instant finishedAt,
                                   String reason) {
    return new RunSummary(runId, RunStatus.ABORTED, startedAt, finishedAt, 0, 0, 0, 0,
        List.of(), List.of(), 0, 0, 0, reason);
  }

  /** Outcome of the document with {@code documentKey}, if it was part of the work set. */
  public Optional<DocumentOutcome> outcome(String documentKey) {
    return outcomes.stream().filter(o -> o.documentKey().equals(documentKey)).findFirst();
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }

  /** Share of completed documents in percent; 100 for an empty work set. */
  public double successRate() {
    return totalDocuments == 0 ? 100.0 : completed * 100.0 / totalDocuments;
  }
}
