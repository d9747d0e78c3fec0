package dev.archivist.ingestion.embedding;

import dev.archivist.failure.AttemptObserver;
import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.PermanentIndexingException;
import dev.archivist.failure.StageRetrier;
import dev.archivist.ingestion.chunking.Chunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces one embedding per chunk, in chunk order.
 *
 * <p>Chunks are sent in batches of at most {@link EmbeddingProperties#batchSize()} texts. Each
 * batch passes the shared {@link EmbeddingRateLimiter} and is retried as a whole on transient
 * provider failures (rate limits, timeouts); a batch whose response size differs from its input
 * size fails permanently.
 */
@Service
public class EmbeddingGenerator {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingGenerator.class);

  private final EmbeddingModel embeddingModel;
  private final EmbeddingRateLimiter rateLimiter;
  private final StageRetrier retrier;
  private final int batchSize;

  public EmbeddingGenerator(EmbeddingModel embeddingModel,
                            EmbeddingRateLimiter rateLimiter,
                            StageRetrier retrier,
                            EmbeddingProperties properties) {
    this.embeddingModel = embeddingModel;
    this.rateLimiter = rateLimiter;
    this.retrier = retrier;
    this.batchSize = properties.batchSize();
  }

  /**
   * Embed the chunks of one document.
   *
   * @param chunks chunks in source order
   * @param observer receives the attempt number of every provider call
   * @return embedded chunks, same order and size as {@code chunks}
   * @throws dev.archivist.failure.IndexingException once a batch fails permanently or exhausts
   *     its retries
   */
  public List<EmbeddedChunk> embed(List<Chunk> chunks, AttemptObserver observer) {
    List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i += batchSize) {
      List<Chunk> batch = chunks.subList(i, Math.min(i + batchSize, chunks.size()));
      List<Embedding> vectors = retrier.execute(
          ErrorClass.EMBEDDING, batch.get(0).documentKey(), observer, () -> embedBatch(batch));
      for (int j = 0; j < batch.size(); j++) {
        embedded.add(new EmbeddedChunk(batch.get(j), vectors.get(j)));
      }
      log.debug("Embedded batch {}-{} of {} for {}", i, i + batch.size(), chunks.size(),
          batch.get(0).documentKey());
    }
    return embedded;
  }

  private List<Embedding> embedBatch(List<Chunk> batch) {
    List<TextSegment> segments = batch.stream().map(c -> TextSegment.from(c.text())).toList();
    rateLimiter.acquire(batch.stream().mapToLong(Chunk::length).sum());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> vectors = response == null ? null : response.content();
    if (vectors == null || vectors.size() != batch.size()) {
      throw new PermanentIndexingException(ErrorClass.EMBEDDING,
          "Embedding provider returned " + (vectors == null ? 0 : vectors.size())
              + " vectors for " + batch.size() + " texts");
    }
    return vectors;
  }
}
