package dev.archivist.run;

import dev.archivist.outcome.DocumentOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single collection point for the outcomes of one run.
 *
 * <p>Workers report here and nowhere else. Progress is kept as an immutable {@link RunProgress}
 * snapshot replaced atomically on every update, so readers always see consistent counts.
 */
public class OutcomeCollector {

  private final AtomicReference<RunProgress> progress;
  private final ConcurrentLinkedQueue<DocumentOutcome> outcomes = new ConcurrentLinkedQueue<>();

  public OutcomeCollector(int total) {
    this.progress = new AtomicReference<>(new RunProgress(total, 0, 0, 0, 0, 0));
  }

  /** Record that a worker picked up a document. */
  public RunProgress documentStarted() {
    return progress.updateAndGet(p -> new RunProgress(
        p.total(),
        p.inFlight() + 1,
        Math.max(p.peakInFlight(), p.inFlight() + 1),
        p.completed(),
        p.failed(),
        p.skipped()));
  }

  /** Record the terminal outcome of a document. */
  public RunProgress documentFinished(DocumentOutcome outcome) {
    outcomes.add(outcome);
    return progress.updateAndGet(p -> switch (outcome.status()) {
      case COMPLETED -> new RunProgress(p.total(), p.inFlight() - 1, p.peakInFlight(),
          p.completed() + 1, p.failed(), p.skipped());
      case FAILED -> new RunProgress(p.total(), p.inFlight() - 1, p.peakInFlight(),
          p.completed(), p.failed() + 1, p.skipped());
      case SKIPPED -> new RunProgress(p.total(), p.inFlight() - 1, p.peakInFlight(),
          p.completed(), p.failed(), p.skipped() + 1);
    });
  }

  public RunProgress progress() {
    return progress.get();
  }

  /** Outcomes reported so far, in reporting order. */
  public List<DocumentOutcome> outcomes() {
    return new ArrayList<>(outcomes);
  }
}
