package dev.archivist.run;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class RunCancellationTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void passedDeadlineIsRecordedWhenChecked() {
    RunCancellation cancellation = new RunCancellation(clock, NOW.minusSeconds(1));

    assertThat(cancellation.reason()).isEmpty();
    cancellation.checkDeadline();

    assertThat(cancellation.reason()).contains(RunCancellation.Reason.DEADLINE);
    assertThat(cancellation.isCancelled()).isTrue();
  }

  @Test
  void futureDeadlineLeavesRunActive() {
    RunCancellation cancellation = new RunCancellation(clock, NOW.plusSeconds(60));

    cancellation.checkDeadline();

    assertThat(cancellation.reason()).isEmpty();
    assertThat(cancellation.isCancelled()).isFalse();
  }

  @Test
  void operatorCancelIsKeptWhenDeadlinePassesLater() {
    RunCancellation cancellation = new RunCancellation(clock, NOW);

    cancellation.cancel();
    cancellation.checkDeadline();

    assertThat(cancellation.reason()).contains(RunCancellation.Reason.OPERATOR);
  }

  @Test
  void noDeadlineMeansOnlyOperatorCancels() {
    RunCancellation cancellation = new RunCancellation(clock, null);

    assertThat(cancellation.isCancelled()).isFalse();
    cancellation.cancel();

    assertThat(cancellation.isCancelled()).isTrue();
  }
}
