package dev.archivist.run;

import dev.archivist.failure.ListingException;
import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one indexing run when the application starts.
 *
 * <p>The exit code reflects the run status (see {@link RunStatus#exitCode()}), so a scheduler
 * invoking the application as a batch job can tell success from failure.
 */
@Component
@ConditionalOnProperty(prefix = "archivist.run", name = "on-startup", havingValue = "true",
    matchIfMissing = true)
public class IndexingRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(IndexingRunner.class);

  private final RunOrchestrator orchestrator;
  private volatile int exitCode;

  public IndexingRunner(RunOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Override
  public void run(ApplicationArguments args) {
    try {
      RunSummary summary = orchestrator.run();
      exitCode = summary.status().exitCode();
    } catch (ListingException e) {
      log.error("Indexing run aborted: {}", e.getMessage());
      exitCode = RunStatus.ABORTED.exitCode();
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
