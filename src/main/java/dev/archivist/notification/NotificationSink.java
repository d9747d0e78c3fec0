package dev.archivist.notification;

import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.RunSummary;

/**
 * Receives failure records and run summaries.
 *
 * <p>Implementations may throw; the {@link NotificationDispatcher} isolates every sink so a
 * delivery failure never reaches the run.
 */
public interface NotificationSink {

  /** Short name used in log lines. */
  String name();

  /** Called once per run, after every document reached a terminal status. */
  void runCompleted(RunSummary summary);

  /** Called as soon as a document fails. */
  default void documentFailed(String runId, DocumentOutcome outcome) {}
}
