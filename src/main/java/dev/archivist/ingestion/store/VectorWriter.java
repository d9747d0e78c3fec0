package dev.archivist.ingestion.store;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.archivist.failure.AttemptObserver;
import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.StageRetrier;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Upserts vector records into a named collection.
 *
 * <p>Records are keyed by chunk identifier, so writing a record twice leaves one entry. Every
 * record is validated first (dimension, finite components, non-blank text); invalid records are
 * rejected individually and never sent. Accepted records are written in batches, each batch
 * retried as a whole on transient store failures.
 */
@Service
public class VectorWriter {

  private static final Logger log = LoggerFactory.getLogger(VectorWriter.class);

  private final VectorCollections collections;
  private final StageRetrier retrier;
  private final int dimension;
  private final int batchSize;

  public VectorWriter(VectorCollections collections,
                      StageRetrier retrier,
                      VectorStoreProperties properties) {
    this.collections = collections;
    this.retrier = retrier;
    this.dimension = properties.dimension();
    this.batchSize = properties.batchSize();
  }

  /**
   * Write records to {@code collection}.
   *
   * @param collection target collection name
   * @param records records to upsert
   * @param observer receives the attempt number of every store call
   * @return identifiers written and records rejected
   * @throws dev.archivist.failure.IndexingException if a batch fails permanently or exhausts its
   *     retries
   */
  public WriteResult write(String collection, List<VectorRecord> records,
                           AttemptObserver observer) {
    List<VectorRecord> accepted = new ArrayList<>(records.size());
    List<RecordRejection> rejected = new ArrayList<>();
    for (VectorRecord record : records) {
      String reason = validate(record);
      if (reason == null) {
        accepted.add(record);
      } else {
        rejected.add(new RecordRejection(record.id(), reason));
      }
    }
    if (!rejected.isEmpty()) {
      log.warn("Rejected {} of {} records for {}: {}", rejected.size(), records.size(),
          collection, rejected.get(0).reason());
    }

    EmbeddingStore<TextSegment> store = collections.collection(collection);
    List<String> written = new ArrayList<>(accepted.size());
    for (int i = 0; i < accepted.size(); i += batchSize) {
      List<VectorRecord> batch = accepted.subList(i, Math.min(i + batchSize, accepted.size()));
      List<String> ids = batch.stream().map(VectorRecord::id).toList();
      List<Embedding> embeddings = batch.stream().map(VectorRecord::vector).toList();
      List<TextSegment> segments = batch.stream().map(VectorRecord::toTextSegment).toList();
      retrier.run(ErrorClass.VECTOR_WRITE, batch.get(0).documentKey(), observer,
          () -> store.addAll(ids, embeddings, segments));
      written.addAll(ids);
    }
    log.debug("Wrote {} records to {}", written.size(), collection);
    return new WriteResult(written, rejected);
  }

  /**
   * Remove the records of earlier versions of a document: same key, different fingerprint.
   *
   * @param collection collection to clean
   * @param documentKey key of the document
   * @param fingerprint fingerprint of the version to keep
   * @param observer receives the attempt number of every store call
   */
  public void removeStaleVersions(String collection, String documentKey, String fingerprint,
                                  AttemptObserver observer) {
    EmbeddingStore<TextSegment> store = collections.collection(collection);
    Filter staleVersions = metadataKey(VectorRecord.DOCUMENT_KEY).isEqualTo(documentKey)
        .and(metadataKey(VectorRecord.CONTENT_FINGERPRINT).isNotEqualTo(fingerprint));
    retrier.run(ErrorClass.VECTOR_WRITE, documentKey, observer,
        () -> store.removeAll(staleVersions));
  }

  /**
   * Records {@link #write} would refuse, without writing anything.
   *
   * @param records records to check
   * @return one rejection per invalid record, in input order
   */
  public List<RecordRejection> rejections(List<VectorRecord> records) {
    List<RecordRejection> rejected = new ArrayList<>();
    for (VectorRecord record : records) {
      String reason = validate(record);
      if (reason != null) {
        rejected.add(new RecordRejection(record.id(), reason));
      }
    }
    return rejected;
  }

  private @Nullable String validate(VectorRecord record) {
    float[] vector = record.vector().vector();
    if (vector.length != dimension) {
      return "dimension " + vector.length + " does not match collection dimension " + dimension;
    }
    for (float component : vector) {
      if (!Float.isFinite(component)) {
        return "vector contains a non-finite component";
      }
    }
    if (record.text().isBlank()) {
      return "text is blank";
    }
    return null;
  }
}
