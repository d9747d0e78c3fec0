package dev.archivist.run;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.BaseIntegrationTest;
import dev.archivist.failure.ErrorClass;
import dev.archivist.ingestion.store.VectorRecord;
import dev.archivist.notification.IndexingRun;
import dev.archivist.notification.IndexingRunFailure;
import dev.archivist.notification.IndexingRunRepository;
import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RunOrchestratorIT extends BaseIntegrationTest {

  @Autowired
  RunOrchestrator orchestrator;

  @Autowired
  EmbeddingModel embeddingModel;

  @Autowired
  IndexingRunRepository runRepository;

  @Test
  void indexesDocumentsEndToEnd() throws InterruptedException {
    objectStore
        .put("source/travel.md", """
            # Travel Policy

            Employees must book flights through the corporate travel portal.
            Economy class is required for flights shorter than six hours.
            """)
        .put("source/broken.pdf", "not a pdf".getBytes(StandardCharsets.US_ASCII), Map.of())
        .put("source/security.txt",
            "Laptops must use full disk encryption. Report lost devices within one hour.");

    RunSummary summary = orchestrator.run();

    assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED_WITH_FAILURES);
    assertThat(summary.completed()).isEqualTo(2);
    assertThat(summary.failures()).singleElement().satisfies(failure -> {
      assertThat(failure.documentKey()).isEqualTo("source/broken.pdf");
      assertThat(failure.errorClass()).isEqualTo(ErrorClass.EXTRACTION);
    });
    assertThat(objectStore.keys()).containsExactly(
        "processed/security.txt", "processed/travel.md", "source/broken.pdf");

    List<EmbeddingMatch<TextSegment>> matches = vectorCollections
        .collection(vectorStoreProperties.collection())
        .search(EmbeddingSearchRequest.builder()
            .queryEmbedding(embeddingModel.embed("Which class should I fly?").content())
            .maxResults(1)
            .build())
        .matches();
    assertThat(matches).singleElement().satisfies(match -> assertThat(
        match.embedded().metadata().getString(VectorRecord.DOCUMENT_KEY))
        .isEqualTo("source/travel.md"));

    IndexingRun recorded = awaitRecorded(summary.runId());
    assertThat(recorded.getFailed()).isEqualTo(1);
    assertThat(recorded.getFailures()).extracting(IndexingRunFailure::getErrorClass)
        .containsExactly("ExtractionError");
  }

  @Test
  void rerunAfterFixingDocumentIndexesOnlyThatDocument() {
    objectStore.put("source/a.txt", "Alpha onboarding guide.")
        .put("source/b.pdf", "corrupt".getBytes(StandardCharsets.US_ASCII), Map.of());
    orchestrator.run();

    objectStore.put("source/b.txt", "Bravo replacement document.");
    objectStore.delete("source/b.pdf");
    RunSummary second = orchestrator.run();

    assertThat(second.totalDocuments()).isEqualTo(1);
    assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
    assertThat(objectStore.keys()).allMatch(key -> key.startsWith("processed/"));
  }

  private IndexingRun awaitRecorded(String runId) throws InterruptedException {
    for (int i = 0; i < 100; i++) {
      Optional<IndexingRun> run = runRepository.findById(runId);
      if (run.isPresent()) {
        return run.get();
      }
      Thread.sleep(100);
    }
    throw new AssertionError("Run " + runId + " was not recorded");
  }
}
