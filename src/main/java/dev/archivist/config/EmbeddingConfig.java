package dev.archivist.config;

import dev.archivist.ingestion.embedding.EmbeddingProperties;
import dev.archivist.ingestion.store.EmbeddingStoreFactory;
import dev.archivist.ingestion.store.VectorStoreProperties;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and the vector collections.
 *
 * <p>The model is either OpenAI's embeddings API or the in-process ONNX bge-small-en-v1.5
 * quantized model (384 dimensions), selected by {@code archivist.embedding.provider}. Client-side
 * retries of the OpenAI client are disabled: the pipeline's retry policy governs, so attempt
 * counts stay accurate.
 *
 * <p>Collections are pgvector tables sharing the application's HikariCP {@link DataSource}. A
 * collection's table is created on first use with the configured dimension.
 */
@Configuration
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  static final int LOCAL_MODEL_DIMENSION = 384;

  /**
   * Provides the embedding model selected by {@code archivist.embedding.provider}.
   *
   * @throws IllegalStateException if the provider's dimension cannot match the collection
   */
  @Bean
  public EmbeddingModel embeddingModel(EmbeddingProperties properties,
                                       VectorStoreProperties vectorProperties) {
    if (properties.provider() == EmbeddingProperties.Provider.LOCAL) {
      if (vectorProperties.dimension() != LOCAL_MODEL_DIMENSION) {
        throw new IllegalStateException("archivist.vector.dimension must be "
            + LOCAL_MODEL_DIMENSION + " for the local embedding provider, got: "
            + vectorProperties.dimension());
      }
      log.info("Using in-process bge-small-en-v1.5 embedding model");
      return new BgeSmallEnV15QuantizedEmbeddingModel();
    }
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new IllegalStateException(
          "archivist.embedding.api-key must be set for the openai embedding provider");
    }
    log.info("Using OpenAI embedding model {}", properties.modelName());
    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .timeout(properties.timeout())
        .maxRetries(0);
    if (properties.baseUrl() != null) {
      builder.baseUrl(properties.baseUrl());
    }
    return builder.build();
  }

  /**
   * Opens named collections as pgvector tables.
   *
   * @param dataSource the shared HikariCP data source (no duplicate pool)
   * @param properties vector store settings providing the dimension
   */
  @Bean
  public EmbeddingStoreFactory embeddingStoreFactory(DataSource dataSource,
                                                     VectorStoreProperties properties) {
    return collection -> {
      log.info("Opening vector collection {} ({} dimensions)", collection,
          properties.dimension());
      return PgVectorEmbeddingStore.datasourceBuilder()
          .datasource(dataSource)
          .table(collection)
          .dimension(properties.dimension())
          .createTable(true)
          .useIndex(false)
          .build();
    };
  }
}
