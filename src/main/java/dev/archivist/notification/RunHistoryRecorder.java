package dev.archivist.notification;

import dev.archivist.outcome.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Persists every run summary, failed documents included, as {@link IndexingRun} history. */
@Component
@ConditionalOnProperty(prefix = "archivist.notification", name = "history-enabled",
    havingValue = "true", matchIfMissing = true)
public class RunHistoryRecorder implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(RunHistoryRecorder.class);

  private final IndexingRunRepository repository;

  public RunHistoryRecorder(IndexingRunRepository repository) {
    this.repository = repository;
  }

  @Override
  public String name() {
    return "history";
  }

  @Override
  public void runCompleted(RunSummary summary) {
    repository.save(IndexingRun.from(summary));
    log.debug("Recorded run {} in history", summary.runId());
  }
}
