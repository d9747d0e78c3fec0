package dev.archivist.transition;

import dev.archivist.failure.AttemptObserver;
import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.StageRetrier;
import dev.archivist.source.DocumentDescriptor;
import dev.archivist.source.ObjectStore;
import dev.archivist.source.SourceLister;
import dev.archivist.source.StorageProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves a successfully indexed document from the source prefix to the processed prefix.
 *
 * <p>The move has two phases: copy with processing metadata, then delete the source. Until the
 * copy succeeds nothing changes, so a failed transition leaves the document pending. A crash
 * between the phases leaves both objects; the next listing recognises the processed copy by its
 * fingerprint metadata and {@link #completeInterrupted} finishes the move.
 */
@Service
public class StateTransitioner {

  private static final Logger log = LoggerFactory.getLogger(StateTransitioner.class);

  public static final String RUN_ID_METADATA = "archivist-run-id";
  public static final String PROCESSED_AT_METADATA = "archivist-processed-at";
  public static final String SOURCE_KEY_METADATA = "source-key";
  public static final String CHUNK_COUNT_METADATA = "chunk-count";

  private final ObjectStore objectStore;
  private final StorageProperties properties;
  private final StageRetrier retrier;
  private final Clock clock;

  public StateTransitioner(ObjectStore objectStore,
                           StorageProperties properties,
                           StageRetrier retrier,
                           Clock clock) {
    this.objectStore = objectStore;
    this.properties = properties;
    this.retrier = retrier;
    this.clock = clock;
  }

  /**
   * Mark a document processed.
   *
   * @param document the indexed document
   * @param runId identifier of the run that indexed it
   * @param chunkCount chunks stored for it
   * @param observer receives the attempt number of every store call
   * @return key of the processed copy
   * @throws dev.archivist.failure.IndexingException with {@link ErrorClass#TRANSITION} if the
   *     copy cannot be made; the source is untouched in that case
   */
  public String markProcessed(DocumentDescriptor document, String runId, int chunkCount,
                              AttemptObserver observer) {
    String targetKey = properties.processedKeyFor(document.key());
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(RUN_ID_METADATA, runId);
    metadata.put(PROCESSED_AT_METADATA, clock.instant().toString());
    metadata.put(SourceLister.FINGERPRINT_METADATA, document.fingerprint());
    metadata.put(SOURCE_KEY_METADATA, document.key());
    metadata.put(CHUNK_COUNT_METADATA, Integer.toString(chunkCount));

    retrier.run(ErrorClass.TRANSITION, document.key(), observer,
        () -> objectStore.copy(document.key(), targetKey, metadata));
    deleteSource(document.key(), observer);
    log.debug("Moved {} to {}", document.key(), targetKey);
    return targetKey;
  }

  /**
   * Finish a move whose copy completed in an earlier run.
   *
   * @param document a document reported as interrupted by the lister
   * @return whether the leftover source was deleted
   */
  public boolean completeInterrupted(DocumentDescriptor document) {
    String targetKey = properties.processedKeyFor(document.key());
    Optional<String> recorded;
    try {
      recorded = objectStore.metadata(targetKey)
          .map(m -> m.get(SourceLister.FINGERPRINT_METADATA));
    } catch (RuntimeException e) {
      log.warn("Could not verify processed copy {}: {}", targetKey, e.getMessage());
      return false;
    }
    if (!recorded.filter(document.fingerprint()::equals).isPresent()) {
      log.warn("Processed copy {} no longer matches {}, leaving source in place",
          targetKey, document.key());
      return false;
    }
    return deleteSource(document.key(), AttemptObserver.NONE);
  }

  private boolean deleteSource(String key, AttemptObserver observer) {
    try {
      retrier.run(ErrorClass.TRANSITION, key, observer, () -> objectStore.delete(key));
      return true;
    } catch (RuntimeException e) {
      log.warn("Copied {} but could not delete the source, the next run will finish the move: {}",
          key, e.getMessage());
      return false;
    }
  }
}
