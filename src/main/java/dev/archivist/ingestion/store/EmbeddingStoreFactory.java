package dev.archivist.ingestion.store;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;

/** Opens the embedding store backing a named collection, creating it if needed. */
@FunctionalInterface
public interface EmbeddingStoreFactory {

  EmbeddingStore<TextSegment> open(String collection);
}
