package dev.archivist.notification;

import dev.archivist.failure.NotificationException;
import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.RunSummary;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget delivery of notifications to every {@link NotificationSink}.
 *
 * <p>Deliveries run on one background thread in submission order, so a failure event is always
 * delivered before the summary of its run. A sink failure is logged as a {@link
 * NotificationException} and does not affect other sinks. Pending deliveries are drained on
 * shutdown.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<NotificationSink> sinks;
  private final NotificationProperties properties;
  private final ExecutorService executor;

  public NotificationDispatcher(List<NotificationSink> sinks, NotificationProperties properties) {
    this.sinks = List.copyOf(sinks);
    this.properties = properties;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "archivist-notifier");
      thread.setDaemon(true);
      return thread;
    });
  }

  public void runCompleted(RunSummary summary) {
    dispatch(sink -> sink.runCompleted(summary));
  }

  public void documentFailed(String runId, DocumentOutcome outcome) {
    dispatch(sink -> sink.documentFailed(runId, outcome));
  }

  private void dispatch(Consumer<NotificationSink> delivery) {
    for (NotificationSink sink : sinks) {
      try {
        executor.execute(() -> deliver(sink, delivery));
      } catch (RejectedExecutionException e) {
        deliver(sink, delivery);
      }
    }
  }

  private static void deliver(NotificationSink sink, Consumer<NotificationSink> delivery) {
    try {
      delivery.accept(sink);
    } catch (RuntimeException e) {
      NotificationException failure =
          new NotificationException("Notification sink " + sink.name() + " failed", e);
      log.warn("{}: {}", failure.getMessage(), e.getMessage(), failure);
    }
  }

  /** Wait for pending deliveries, up to the configured drain timeout. */
  @PreDestroy
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(properties.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Notifications still pending after {}, dropping them", properties.drainTimeout());
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
