package dev.archivist.notification;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.failure.ErrorClass;
import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.DocumentState;
import dev.archivist.outcome.DocumentStatus;
import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class NotificationDispatcherTest {

  private static final NotificationProperties PROPERTIES =
      new NotificationProperties(null, true, Duration.ofSeconds(5));

  private final List<String> events = new CopyOnWriteArrayList<>();

  @Test
  void deliversEventsInSubmissionOrder() {
    NotificationDispatcher dispatcher =
        new NotificationDispatcher(List.of(recording("log")), PROPERTIES);

    dispatcher.documentFailed("run-1", failure("source/b.pdf"));
    dispatcher.runCompleted(summary());
    dispatcher.shutdown();

    assertThat(events).containsExactly("log:failed:source/b.pdf", "log:summary:run-1");
  }

  @Test
  void failingSinkDoesNotStopOthers() {
    NotificationSink broken = new NotificationSink() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public void runCompleted(RunSummary summary) {
        throw new IllegalStateException("SNS topic not found");
      }
    };
    NotificationDispatcher dispatcher =
        new NotificationDispatcher(List.of(broken, recording("history")), PROPERTIES);

    dispatcher.runCompleted(summary());
    dispatcher.shutdown();

    assertThat(events).containsExactly("history:summary:run-1");
  }

  @Test
  void slowSinkDoesNotBlockCaller() throws InterruptedException {
    CountDownLatch release = new CountDownLatch(1);
    NotificationSink slow = new NotificationSink() {
      @Override
      public String name() {
        return "slow";
      }

      @Override
      public void runCompleted(RunSummary summary) {
        try {
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        events.add("slow:done");
      }
    };
    NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(slow), PROPERTIES);

    dispatcher.runCompleted(summary());

    assertThat(events).isEmpty();
    release.countDown();
    dispatcher.shutdown();
    assertThat(events).containsExactly("slow:done");
  }

  @Test
  void deliveriesAfterShutdownRunInline() {
    NotificationDispatcher dispatcher =
        new NotificationDispatcher(List.of(recording("log")), PROPERTIES);
    dispatcher.shutdown();

    dispatcher.runCompleted(summary());

    assertThat(events).containsExactly("log:summary:run-1");
  }

  private NotificationSink recording(String name) {
    return new NotificationSink() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public void runCompleted(RunSummary summary) {
        events.add(name + ":summary:" + summary.runId());
      }

      @Override
      public void documentFailed(String runId, DocumentOutcome outcome) {
        events.add(name + ":failed:" + outcome.documentKey());
      }
    };
  }

  static DocumentOutcome failure(String key) {
    return new DocumentOutcome(key, DocumentStatus.FAILED, DocumentState.EXTRACTING, 1, 0, 0,
        ErrorClass.EXTRACTION, "Failed to parse PDF", Duration.ofMillis(20));
  }

  static RunSummary summary() {
    Instant start = Instant.parse("2026-03-01T08:00:00Z");
    return RunSummary.of("run-1", RunStatus.COMPLETED_WITH_FAILURES, start, start.plusSeconds(42),
        List.of(
            failure("source/b.pdf"),
            new DocumentOutcome("source/a.txt", DocumentStatus.COMPLETED, DocumentState.COMPLETED,
                1, 3, 3, null, null, Duration.ofMillis(40))),
        2);
  }
}
