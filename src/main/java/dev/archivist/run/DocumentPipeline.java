package dev.archivist.run;

import dev.archivist.extraction.ExtractedText;
import dev.archivist.extraction.TextExtractionService;
import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.IndexingException;
import dev.archivist.failure.PermanentIndexingException;
import dev.archivist.failure.StageRetrier;
import dev.archivist.ingestion.chunking.Chunk;
import dev.archivist.ingestion.chunking.TextChunker;
import dev.archivist.ingestion.embedding.EmbeddedChunk;
import dev.archivist.ingestion.embedding.EmbeddingGenerator;
import dev.archivist.ingestion.store.RecordRejection;
import dev.archivist.ingestion.store.VectorRecord;
import dev.archivist.ingestion.store.VectorStoreProperties;
import dev.archivist.ingestion.store.VectorStoreProperties.RejectionPolicy;
import dev.archivist.ingestion.store.VectorWriter;
import dev.archivist.ingestion.store.WriteResult;
import dev.archivist.outcome.DocumentOutcome;
import dev.archivist.outcome.DocumentState;
import dev.archivist.source.DocumentDescriptor;
import dev.archivist.source.ObjectStore;
import dev.archivist.transition.StateTransitioner;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Takes one document through extract, chunk, embed, write and transition.
 *
 * <p>Never throws: every failure ends as a {@code FAILED} outcome carrying the error class of the
 * stage that failed. Cancellation is checked between stages; a cancelled document keeps its
 * source object and is reported as skipped. Documents without extractable text complete with
 * zero chunks and are moved like any other.
 */
@Component
public class DocumentPipeline {

  private static final Logger log = LoggerFactory.getLogger(DocumentPipeline.class);

  static final String CANCELLED = "Run cancelled";

  private final ObjectStore objectStore;
  private final StageRetrier retrier;
  private final TextExtractionService extractionService;
  private final TextChunker chunker;
  private final EmbeddingGenerator embeddingGenerator;
  private final VectorWriter vectorWriter;
  private final StateTransitioner transitioner;
  private final RejectionPolicy rejectionPolicy;
  private final Clock clock;

  public DocumentPipeline(ObjectStore objectStore,
                          StageRetrier retrier,
                          TextExtractionService extractionService,
                          TextChunker chunker,
                          EmbeddingGenerator embeddingGenerator,
                          VectorWriter vectorWriter,
                          StateTransitioner transitioner,
                          VectorStoreProperties vectorStoreProperties,
                          Clock clock) {
    this.objectStore = objectStore;
    this.retrier = retrier;
    this.extractionService = extractionService;
    this.chunker = chunker;
    this.embeddingGenerator = embeddingGenerator;
    this.vectorWriter = vectorWriter;
    this.transitioner = transitioner;
    this.rejectionPolicy = vectorStoreProperties.rejectedRecords();
    this.clock = clock;
  }

  /**
   * Process one document.
   *
   * @param document the document to index
   * @param run the run it belongs to
   * @return the document's terminal outcome
   */
  public DocumentOutcome process(DocumentDescriptor document, RunContext run) {
    DocumentTracker tracker = new DocumentTracker(document.key(), clock);
    int chunkCount = 0;
    try {
      if (run.cancellation().isCancelled()) {
        return tracker.skipped(CANCELLED, 0);
      }

      tracker.advance(DocumentState.EXTRACTING);
      byte[] content = retrier.execute(ErrorClass.EXTRACTION, document.key(), tracker,
          () -> objectStore.get(document.key()));
      ExtractedText extracted = extractionService.extract(document.key(), content);
      if (run.cancellation().isCancelled()) {
        return tracker.skipped(CANCELLED, 0);
      }

      tracker.advance(DocumentState.CHUNKING);
      List<Chunk> chunks = chunk(document, extracted);
      chunkCount = chunks.size();
      if (chunks.isEmpty()) {
        log.warn("{} has no extractable text, it will be moved without vectors", document.key());
      }

      tracker.advance(DocumentState.EMBEDDING);
      List<EmbeddedChunk> embedded = embeddingGenerator.embed(chunks, tracker);
      if (run.cancellation().isCancelled()) {
        return tracker.skipped(CANCELLED, chunkCount);
      }

      tracker.advance(DocumentState.WRITING);
      int vectorsStored = write(document, extracted, embedded, run.collection(), tracker);
      if (run.cancellation().isCancelled()) {
        return tracker.skipped(CANCELLED, chunkCount);
      }

      tracker.advance(DocumentState.TRANSITIONING);
      transitioner.markProcessed(document, run.runId(), vectorsStored, tracker);
      return tracker.completed(chunkCount, vectorsStored);
    } catch (IndexingException e) {
      return tracker.failed(e.errorClass(), e.getMessage(), chunkCount);
    } catch (RuntimeException e) {
      log.error("Unexpected failure processing {} in {}", document.key(), tracker.state(), e);
      return tracker.failed(tracker.currentStageErrorClass(), e.toString(), chunkCount);
    }
  }

  private List<Chunk> chunk(DocumentDescriptor document, ExtractedText extracted) {
    try {
      return chunker.chunk(document.key(), document.fingerprint(), extracted.text());
    } catch (RuntimeException e) {
      throw new PermanentIndexingException(ErrorClass.CHUNKING,
          "Chunking failed for " + document.key() + ": " + e.getMessage(), e);
    }
  }

  private int write(DocumentDescriptor document, ExtractedText extracted,
                    List<EmbeddedChunk> embedded, String collection, DocumentTracker tracker) {
    List<VectorRecord> records = embedded.stream()
        .map(e -> VectorRecord.of(e, document.fingerprint(), extracted.mediaType().mimeType(),
            extracted.sectionCount(), embedded.size()))
        .toList();
    if (rejectionPolicy == RejectionPolicy.FAIL_DOCUMENT) {
      List<RecordRejection> rejected = vectorWriter.rejections(records);
      if (!rejected.isEmpty()) {
        throw new PermanentIndexingException(ErrorClass.VECTOR_WRITE,
            rejected.size() + " of " + records.size() + " records rejected: "
                + rejected.get(0).reason());
      }
    }
    WriteResult result = vectorWriter.write(collection, records, tracker);
    if (result.hasRejections()) {
      log.warn("Skipped {} rejected records of {}: {}", result.rejected().size(), document.key(),
          result.rejected());
    }
    vectorWriter.removeStaleVersions(collection, document.key(), document.fingerprint(), tracker);
    return result.written().size();
  }
}
