package dev.archivist.ingestion.store;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Registry of named vector collections. Each collection is opened once, on first use, and shared
 * by all workers.
 */
@Component
public class VectorCollections {

  /** Collection names double as table names: lower-case identifiers only. */
  public static final String NAME_PATTERN = "[a-z_][a-z0-9_]{0,62}";

  private final EmbeddingStoreFactory factory;
  private final ConcurrentHashMap<String, EmbeddingStore<TextSegment>> collections =
      new ConcurrentHashMap<>();

  public VectorCollections(EmbeddingStoreFactory factory) {
    this.factory = factory;
  }

  /**
   * The store backing {@code name}.
   *
   * @throws IllegalArgumentException if {@code name} is not a valid collection name
   */
  public EmbeddingStore<TextSegment> collection(String name) {
    if (!name.matches(NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid collection name: " + name);
    }
    return collections.computeIfAbsent(name, factory::open);
  }
}
