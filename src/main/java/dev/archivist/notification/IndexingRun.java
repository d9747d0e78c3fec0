package dev.archivist.notification;

import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted summary of one indexing run, with its failed documents.
 *
 * <p>Maps to the {@code indexing_runs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "indexing_runs")
public class IndexingRun {

  @Id
  @Column(name = "run_id", nullable = false, length = 64)
  private String runId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private RunStatus status;

  @Column(name = "started_at", nullable = false)
  private Instant startedAt;

  @Column(name = "finished_at", nullable = false)
  private Instant finishedAt;

  @Column(name = "total_documents", nullable = false)
  private int totalDocuments;

  @Column(name = "completed", nullable = false)
  private int completed;

  @Column(name = "failed", nullable = false)
  private int failed;

  @Column(name = "skipped", nullable = false)
  private int skipped;

  @Column(name = "total_chunks", nullable = false)
  private long totalChunks;

  @Column(name = "vectors_stored", nullable = false)
  private long vectorsStored;

  @Column(name = "peak_concurrency", nullable = false)
  private int peakConcurrency;

  @Column(name = "abort_reason", columnDefinition = "text")
  private String abortReason;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "indexing_run_failures", joinColumns = @JoinColumn(name = "run_id"))
  private List<IndexingRunFailure> failures = new ArrayList<>();

  protected IndexingRun() {
    // JPA requires no-arg constructor
  }

  /** Creates the persistent form of a run summary. */
  public static IndexingRun from(RunSummary summary) {
    IndexingRun run = new IndexingRun();
    run.runId = summary.runId();
    run.status = summary.status();
    run.startedAt = summary.startedAt();
    run.finishedAt = summary.finishedAt();
    run.totalDocuments = summary.totalDocuments();
    run.completed = summary.completed();
    run.failed = summary.failed();
    run.skipped = summary.skipped();
    run.totalChunks = summary.totalChunks();
    run.vectorsStored = summary.vectorsStored();
    run.peakConcurrency = summary.peakConcurrency();
    run.abortReason = summary.abortReason();
    summary.failures().forEach(f -> run.failures.add(new IndexingRunFailure(
        f.documentKey(), f.errorClass().value(), f.message(), f.attempts())));
    return run;
  }

  public String getRunId() {
    return runId;
  }

  public RunStatus getStatus() {
    return status;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public int getTotalDocuments() {
    return totalDocuments;
  }

  public int getCompleted() {
    return completed;
  }

  public int getFailed() {
    return failed;
  }

  public int getSkipped() {
    return skipped;
  }

  public long getTotalChunks() {
    return totalChunks;
  }

  public long getVectorsStored() {
    return vectorsStored;
  }

  public int getPeakConcurrency() {
    return peakConcurrency;
  }

  public String getAbortReason() {
    return abortReason;
  }

  public List<IndexingRunFailure> getFailures() {
    return failures;
  }
}
