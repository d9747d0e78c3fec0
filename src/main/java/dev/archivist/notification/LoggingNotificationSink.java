package dev.archivist.notification;

import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.FailedDocument;
import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes failures and run summaries to the application log. Always active. */
@Component
public class LoggingNotificationSink implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

  @Override
  public String name() {
    return "log";
  }

  @Override
  public void runCompleted(RunSummary summary) {
    if (summary.status() == RunStatus.ABORTED) {
      log.error("Run {} aborted: {}", summary.runId(), summary.abortReason());
      return;
    }
    log.info("Run {} finished with status {} in {}s: {} documents, {} completed, {} failed, "
            + "{} skipped, {} chunks, {} vectors stored, success rate {}%, peak concurrency {}",
        summary.runId(), summary.status(), summary.duration().toSeconds(),
        summary.totalDocuments(), summary.completed(), summary.failed(), summary.skipped(),
        summary.totalChunks(), summary.vectorsStored(),
        String.format("%.1f", summary.successRate()), summary.peakConcurrency());
    for (FailedDocument failure : summary.failures()) {
      log.warn("  {} [{}] after {} attempt(s): {}", failure.documentKey(),
          failure.errorClass().value(), failure.attempts(), failure.message());
    }
  }

  @Override
  public void documentFailed(String runId, DocumentOutcome outcome) {
    log.warn("Run {}: {} failed in {} with {}: {}", runId, outcome.documentKey(),
        outcome.lastState(), outcome.errorClass() == null ? "?" : outcome.errorClass().value(),
        outcome.detail());
  }
}
