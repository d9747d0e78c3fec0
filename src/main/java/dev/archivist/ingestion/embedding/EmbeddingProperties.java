package dev.archivist.ingestion.embedding;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Embedding provider settings ({@code archivist.embedding.*}).
 *
 * @param provider remote OpenAI model or in-process ONNX model
 * @param modelName provider model identifier
 * @param apiKey remote provider API key
 * @param baseUrl remote provider endpoint override
 * @param batchSize maximum texts per provider request
 * @param timeout per-request timeout of the remote provider
 * @param requestsPerMinute provider request quota shared by all workers
 * @param tokensPerMinute provider token quota shared by all workers
 */
@Validated
@ConfigurationProperties(prefix = "archivist.embedding")
public record EmbeddingProperties(
    @DefaultValue("openai") @NotNull Provider provider,
    @DefaultValue("text-embedding-3-small") String modelName,
    @Nullable String apiKey,
    @Nullable String baseUrl,
    @DefaultValue("20") @Min(1) @Max(2048) int batchSize,
    @DefaultValue("60s") @NotNull Duration timeout,
    @DefaultValue("500") @Min(1) int requestsPerMinute,
    @DefaultValue("1000000") @Min(1) long tokensPerMinute) {

  public enum Provider {
    /** OpenAI embeddings API. */
    OPENAI,
    /** bge-small-en-v1.5 quantized, 384 dimensions, running in-process. */
    LOCAL
  }
}
