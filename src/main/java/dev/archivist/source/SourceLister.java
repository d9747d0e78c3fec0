package dev.archivist.source;

import dev.archivist.extraction.DocumentMediaType;
import dev.archivist.failure.ListingException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Enumerates the documents awaiting indexing.
 *
 * <p>A source object is pending unless the processed prefix holds the same relative key and that
 * processed object records the source's current fingerprint under {@link #FINGERPRINT_METADATA}.
 * A re-uploaded document with new content is therefore pending again even though an older
 * version was processed.
 *
 * <p>When the processed twin already carries the current fingerprint, the previous run copied
 * the document but did not delete the source; such documents are reported as interrupted so the
 * orchestrator can finish the move without reprocessing.
 *
 * <p>Any failure to enumerate is fatal for the run and surfaces as a {@link ListingException}.
 */
@Service
public class SourceLister {

  private static final Logger log = LoggerFactory.getLogger(SourceLister.class);

  /** User metadata key carrying the content fingerprint of a processed object. */
  public static final String FINGERPRINT_METADATA = "content-fingerprint";

  private final ObjectStore objectStore;
  private final StorageProperties properties;
  private final Clock clock;

  public SourceLister(ObjectStore objectStore, StorageProperties properties, Clock clock) {
    this.objectStore = objectStore;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * List the pending documents.
   *
   * @return pending and interrupted documents with listing totals
   * @throws ListingException if the store cannot be enumerated
   */
  public ListingResult list() {
    try {
      return doList();
    } catch (ListingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ListingException(
          "Failed to list s3://" + properties.bucket() + "/" + properties.sourcePrefix()
              + ": " + e.getMessage(), e);
    }
  }

  private ListingResult doList() {
    Instant discoveredAt = clock.instant();
    List<StoredObject> sources = objectStore.list(properties.sourcePrefix()).stream()
        .filter(o -> !o.isDirectoryMarker())
        .toList();
    Map<String, StoredObject> processed = objectStore.list(properties.processedPrefix()).stream()
        .filter(o -> !o.isDirectoryMarker())
        .collect(Collectors.toMap(StoredObject::key, Function.identity(), (a, b) -> a,
            LinkedHashMap::new));

    List<DocumentDescriptor> pending = new ArrayList<>();
    List<DocumentDescriptor> interrupted = new ArrayList<>();
    int ignored = 0;
    int alreadyProcessed = 0;
    for (StoredObject source : sources) {
      if (!included(source.key())) {
        ignored++;
        continue;
      }
      DocumentDescriptor descriptor = new DocumentDescriptor(
          source.key(), source.size(), source.fingerprint(), discoveredAt);
      String processedKey = properties.processedKeyFor(source.key());
      if (processed.containsKey(processedKey)
          && source.fingerprint().equals(processedFingerprint(processedKey).orElse(null))) {
        interrupted.add(descriptor);
        alreadyProcessed++;
      } else {
        pending.add(descriptor);
      }
    }
    pending.sort(Comparator.comparing(DocumentDescriptor::key));

    log.info("Found {} source objects: {} pending, {} already processed, {} ignored",
        sources.size(), pending.size(), alreadyProcessed, ignored);
    if (!interrupted.isEmpty()) {
      log.warn("{} documents were copied by an interrupted run and still await source deletion",
          interrupted.size());
    }
    return new ListingResult(pending, interrupted, sources.size(), ignored);
  }

  private Optional<String> processedFingerprint(String processedKey) {
    return objectStore.metadata(processedKey).map(m -> m.get(FINGERPRINT_METADATA));
  }

  private boolean included(String key) {
    List<String> extensions = properties.includeExtensions();
    return extensions.isEmpty() || extensions.contains(DocumentMediaType.extensionOf(key));
  }
}
