package dev.archivist.run;

import dev.archivist.failure.ListingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Starts a run on the {@code archivist.run.schedule} cron expression. Overlapping triggers are
 * skipped.
 */
@Component
@ConditionalOnProperty(prefix = "archivist.run", name = "schedule")
public class ScheduledIndexingTrigger {

  private static final Logger log = LoggerFactory.getLogger(ScheduledIndexingTrigger.class);

  private final RunOrchestrator orchestrator;

  public ScheduledIndexingTrigger(RunOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Scheduled(cron = "${archivist.run.schedule}")
  public void trigger() {
    if (orchestrator.isRunning()) {
      log.warn("Previous indexing run still active, skipping scheduled trigger");
      return;
    }
    try {
      orchestrator.run();
    } catch (ListingException e) {
      log.error("Scheduled indexing run aborted: {}", e.getMessage());
    } catch (IllegalStateException e) {
      log.warn("Scheduled trigger skipped: {}", e.getMessage());
    }
  }
}
