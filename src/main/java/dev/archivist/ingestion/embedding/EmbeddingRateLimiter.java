package dev.archivist.ingestion.embedding;

import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.TransientIndexingException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Token-bucket limiter for the embedding provider, shared by all workers of a run.
 *
 * <p>Two buckets refill greedily every minute: one for requests, one for estimated tokens. A
 * request first takes one request token, then its token estimate, blocking until both are
 * available. Estimates larger than the per-minute quota are clamped to it.
 */
@Component
public class EmbeddingRateLimiter {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingRateLimiter.class);

  private static final int CHARS_PER_TOKEN = 4;

  private final Bucket requestBucket;
  private final Bucket tokenBucket;
  private final long tokensPerMinute;

  public EmbeddingRateLimiter(EmbeddingProperties properties) {
    this.tokensPerMinute = properties.tokensPerMinute();
    this.requestBucket = perMinute(properties.requestsPerMinute());
    this.tokenBucket = perMinute(properties.tokensPerMinute());
  }

  private static Bucket perMinute(long limit) {
    return Bucket.builder()
        .addLimit(Bandwidth.builder()
            .capacity(limit)
            .refillGreedy(limit, Duration.ofMinutes(1))
            .build())
        .build();
  }

  /**
   * Block until a request carrying {@code characters} characters of input may be sent.
   *
   * @throws TransientIndexingException if the waiting thread is interrupted
   */
  public void acquire(long characters) {
    long tokens = Math.min(Math.max(1, estimateTokens(characters)), tokensPerMinute);
    try {
      if (!requestBucket.tryConsume(1)) {
        log.debug("Embedding request quota exhausted, waiting");
        requestBucket.asBlocking().consume(1);
      }
      if (!tokenBucket.tryConsume(tokens)) {
        log.debug("Embedding token quota exhausted, waiting for {} tokens", tokens);
        tokenBucket.asBlocking().consume(tokens);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientIndexingException(ErrorClass.EMBEDDING,
          "Interrupted while waiting for embedding quota", e);
    }
  }

  /** Rough token estimate used against the provider's token quota. */
  static long estimateTokens(long characters) {
    return characters / CHARS_PER_TOKEN;
  }
}
