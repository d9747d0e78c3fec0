package dev.archivist.notification;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.outcome.RunStatus;
import org.junit.jupiter.api.Test;

class IndexingRunTest {

  @Test
  void copiesSummaryAndFailures() {
    IndexingRun run = IndexingRun.from(NotificationDispatcherTest.summary());

    assertThat(run.getRunId()).isEqualTo("run-1");
    assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED_WITH_FAILURES);
    assertThat(run.getTotalDocuments()).isEqualTo(2);
    assertThat(run.getCompleted()).isEqualTo(1);
    assertThat(run.getFailed()).isEqualTo(1);
    assertThat(run.getTotalChunks()).isEqualTo(3);
    assertThat(run.getFailures()).singleElement().satisfies(failure -> {
      assertThat(failure.getDocumentKey()).isEqualTo("source/b.pdf");
      assertThat(failure.getErrorClass()).isEqualTo("ExtractionError");
      assertThat(failure.getAttempts()).isEqualTo(1);
    });
  }
}
