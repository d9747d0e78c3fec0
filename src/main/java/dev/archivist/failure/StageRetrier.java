package dev.archivist.failure;

import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Runs a single stage operation under the shared retry policy.
 *
 * <p>Every failure is first classified by {@link FailureClassifier}; only {@link
 * TransientIndexingException}s are retried, with exponential backoff capped at {@link
 * RetryProperties#maxBackoff()}. When attempts are exhausted the last transient failure
 * propagates, so callers always receive an {@link IndexingException}.
 *
 * <p>Each invocation reports its attempt number to the supplied {@link AttemptObserver}; the
 * orchestrator derives the per-document attempt count from it.
 */
@Component
public class StageRetrier {

  private static final Logger log = LoggerFactory.getLogger(StageRetrier.class);

  private final RetryTemplate retryTemplate;
  private final FailureClassifier classifier;
  private final int maxAttempts;

  public StageRetrier(RetryProperties properties, FailureClassifier classifier) {
    this.classifier = classifier;
    this.maxAttempts = properties.maxAttempts();
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(properties.maxAttempts())
            .exponentialBackoff(
                properties.initialBackoff().toMillis(),
                properties.multiplier(),
                properties.maxBackoff().toMillis())
            .retryOn(TransientIndexingException.class)
            .build();
  }

  /**
   * Execute {@code operation}, retrying transient failures.
   *
   * @param errorClass stage the operation belongs to, used when classifying raw failures
   * @param description short label for log lines (e.g. the document key)
   * @param observer receives each attempt number
   * @param operation the operation to run
   * @return the operation's result
   * @throws IndexingException the classified failure of the last attempt
   */
  public <T> T execute(
      ErrorClass errorClass, String description, AttemptObserver observer, Callable<T> operation) {
    return retryTemplate.execute(
        context -> {
          int attempt = context.getRetryCount() + 1;
          observer.attempted(attempt);
          try {
            return operation.call();
          } catch (Exception e) {
            IndexingException classified = classifier.classify(errorClass, e);
            if (classified.isTransient() && attempt < maxAttempts) {
              log.warn("{} attempt {}/{} for {} failed, retrying: {}",
                  errorClass.value(), attempt, maxAttempts, description, classified.getMessage());
            }
            throw classified;
          }
        });
  }

  /** Variant of {@link #execute} for operations without a result. */
  public void run(
      ErrorClass errorClass, String description, AttemptObserver observer, Runnable operation) {
    execute(
        errorClass,
        description,
        observer,
        () -> {
          operation.run();
          return null;
        });
  }
}
