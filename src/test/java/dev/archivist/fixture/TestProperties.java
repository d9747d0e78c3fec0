package dev.archivist.fixture;

import dev.archivist.failure.RetryProperties;
import dev.archivist.ingestion.embedding.EmbeddingProperties;
import dev.archivist.ingestion.store.VectorStoreProperties;
import dev.archivist.source.StorageProperties;
import java.time.Duration;
import java.util.List;

/** Property records with test-friendly defaults: tiny backoffs, small dimensions. */
public final class TestProperties {

  public static final int DIMENSION = 8;

  private TestProperties() {
    // utility class
  }

  public static RetryProperties retry(int maxAttempts) {
    return new RetryProperties(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(4), 2.0);
  }

  public static StorageProperties storage() {
    return new StorageProperties("test-bucket", "source/", "processed/", null, "us-east-1",
        false, List.of(), Duration.ofSeconds(5), new StorageProperties.ListingRetry(1, 1, 1.0));
  }

  public static EmbeddingProperties embedding(int batchSize) {
    return new EmbeddingProperties(EmbeddingProperties.Provider.LOCAL, "test-model", null, null,
        batchSize, Duration.ofSeconds(5), 100_000, 100_000_000L);
  }

  public static VectorStoreProperties vectorStore() {
    return vectorStore(VectorStoreProperties.RejectionPolicy.FAIL_DOCUMENT);
  }

  public static VectorStoreProperties vectorStore(VectorStoreProperties.RejectionPolicy policy) {
    return new VectorStoreProperties("test_collection", DIMENSION, 50, policy);
  }
}
