package dev.archivist.run;

import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.ListingException;
import dev.archivist.ingestion.store.VectorStoreProperties;
import dev.archivist.notification.NotificationDispatcher;
import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.DocumentState;
import dev.archivist.outcome.DocumentStatus;
import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import dev.archivist.source.DocumentDescriptor;
import dev.archivist.source.ListingResult;
import dev.archivist.source.SourceLister;
import dev.archivist.transition.StateTransitioner;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives an indexing run: list, fan out over a bounded worker pool, fan in, notify.
 *
 * <p>Each run lists the pending documents, finishes moves interrupted by an earlier run, then
 * processes the work set on a fixed pool of at most {@link RunProperties#maxConcurrency()}
 * threads. Documents are independent: a failure is recorded in that document's outcome and never
 * stops the others. Every worker reports to one {@link OutcomeCollector}; the run summary is
 * built from it once all documents reached a terminal status.
 *
 * <p>Only one run may be active at a time. {@link #cancel()} (also invoked on shutdown) and the
 * optional deadline stop the run: workers finish their current stage, unstarted documents are
 * skipped, and the summary is still published.
 */
@Service
public class RunOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

  private static final long POLL_INTERVAL_MS = 250;

  private final SourceLister sourceLister;
  private final StateTransitioner transitioner;
  private final DocumentPipeline pipeline;
  private final NotificationDispatcher dispatcher;
  private final RunProperties properties;
  private final String collection;
  private final Clock clock;
  private final AtomicReference<RunCancellation> activeRun = new AtomicReference<>();

  public RunOrchestrator(SourceLister sourceLister,
                         StateTransitioner transitioner,
                         DocumentPipeline pipeline,
                         NotificationDispatcher dispatcher,
                         RunProperties properties,
                         VectorStoreProperties vectorStoreProperties,
                         Clock clock) {
    this.sourceLister = sourceLister;
    this.transitioner = transitioner;
    this.pipeline = pipeline;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.collection = vectorStoreProperties.collection();
    this.clock = clock;
  }

  /**
   * Execute one run to completion.
   *
   * @return summary of the run, also published to the notification sinks
   * @throws ListingException if the pending documents cannot be listed; an aborted summary is
   *     published first
   * @throws IllegalStateException if another run is in progress
   */
  public RunSummary run() {
    String runId = UUID.randomUUID().toString();
    Instant startedAt = clock.instant();
    Duration deadline = properties.deadline();
    RunCancellation cancellation =
        new RunCancellation(clock, deadline == null ? null : startedAt.plus(deadline));
    if (!activeRun.compareAndSet(null, cancellation)) {
      throw new IllegalStateException("An indexing run is already in progress");
    }
    try {
      return execute(new RunContext(runId, collection, cancellation), startedAt);
    } finally {
      activeRun.set(null);
    }
  }

  /**
   * Cancel the active run, if any.
   *
   * @return whether a run was active
   */
  public boolean cancel() {
    RunCancellation cancellation = activeRun.get();
    if (cancellation == null) {
      return false;
    }
    cancellation.cancel();
    return true;
  }

  public boolean isRunning() {
    return activeRun.get() != null;
  }

  @PreDestroy
  void onShutdown() {
    if (cancel()) {
      log.warn("Shutdown requested, cancelling the active indexing run");
    }
  }

  private RunSummary execute(RunContext run, Instant startedAt) {
    log.info("Starting indexing run {}", run.runId());
    ListingResult listing;
    try {
      listing = sourceLister.list();
    } catch (ListingException e) {
      dispatcher.runCompleted(
          RunSummary.aborted(run.runId(), startedAt, clock.instant(), e.getMessage()));
      throw e;
    }

    for (DocumentDescriptor interrupted : listing.interrupted()) {
      if (transitioner.completeInterrupted(interrupted)) {
        log.info("Finished interrupted move of {}", interrupted.key());
      }
    }

    List<DocumentDescriptor> workSet = listing.pending();
    OutcomeCollector collector = new OutcomeCollector(workSet.size());
    if (!workSet.isEmpty()) {
      processAll(workSet, run, collector);
    }

    RunSummary summary = RunSummary.of(run.runId(), status(collector, run.cancellation()),
        startedAt, clock.instant(), collector.outcomes(), collector.progress().peakInFlight());
    dispatcher.runCompleted(summary);
    return summary;
  }

  private void processAll(List<DocumentDescriptor> workSet, RunContext run,
                          OutcomeCollector collector) {
    int poolSize = Math.min(properties.maxConcurrency(), workSet.size());
    log.info("Processing {} documents with {} workers", workSet.size(), poolSize);
    ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads(run.runId()));
    boolean interrupted = false;
    try {
      List<Future<?>> futures = new ArrayList<>(workSet.size());
      for (DocumentDescriptor document : workSet) {
        futures.add(pool.submit(() -> processOne(document, run, collector)));
      }
      for (Future<?> future : futures) {
        interrupted |= await(future, run.cancellation());
      }
    } finally {
      pool.shutdown();
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void processOne(DocumentDescriptor document, RunContext run,
                          OutcomeCollector collector) {
    collector.documentStarted();
    DocumentOutcome outcome;
    try {
      outcome = pipeline.process(document, run);
    } catch (RuntimeException e) {
      log.error("Worker failed on {}", document.key(), e);
      outcome = new DocumentOutcome(document.key(), DocumentStatus.FAILED, DocumentState.PENDING,
          1, 0, 0, ErrorClass.UNEXPECTED, e.toString(), Duration.ZERO);
    }
    RunProgress progress = collector.documentFinished(outcome);
    log.info("[{}/{}] {} {} ({} chunks, {} attempt(s))", progress.finished(), progress.total(),
        outcome.status(), document.key(), outcome.chunkCount(), outcome.attempts());
    if (outcome.isFailed()) {
      dispatcher.documentFailed(run.runId(), outcome);
    }
  }

  /**
   * Wait for one document, polling the cancellation token so a passed deadline is noticed while
   * waiting. Returns whether the waiting thread was interrupted; an interrupt cancels the run
   * but the wait continues so every outcome is collected.
   */
  private static boolean await(Future<?> future, RunCancellation cancellation) {
    boolean interrupted = false;
    while (true) {
      try {
        future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
        return interrupted;
      } catch (TimeoutException e) {
        cancellation.checkDeadline();
      } catch (InterruptedException e) {
        interrupted = true;
        cancellation.cancel();
      } catch (ExecutionException e) {
        log.error("Worker task failed", e.getCause());
        return interrupted;
      }
    }
  }

  private static RunStatus status(OutcomeCollector collector, RunCancellation cancellation) {
    if (cancellation.reason().isPresent()) {
      return cancellation.reason().get() == RunCancellation.Reason.DEADLINE
          ? RunStatus.DEADLINE_EXCEEDED
          : RunStatus.CANCELLED;
    }
    return collector.progress().failed() > 0
        ? RunStatus.COMPLETED_WITH_FAILURES
        : RunStatus.COMPLETED;
  }

  private static ThreadFactory workerThreads(String runId) {
    AtomicInteger counter = new AtomicInteger();
    String prefix = "archivist-worker-" + runId.substring(0, 8) + "-";
    return runnable -> new Thread(runnable, prefix + counter.incrementAndGet());
  }
}
