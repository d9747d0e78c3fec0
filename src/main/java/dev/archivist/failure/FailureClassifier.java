package dev.archivist.failure;

import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Maps exceptions thrown by external clients onto the pipeline's failure taxonomy.
 *
 * <p>Classification walks the cause chain, so a timeout wrapped by a store or HTTP client is still
 * recognised. Anything not recognised as transient is permanent: retrying an unknown failure only
 * delays the outcome.
 *
 * <ul>
 *   <li>LangChain4j {@link RetriableException}s (rate limit, timeout, 5xx) are transient, {@link
 *       NonRetriableException}s (invalid request, authentication) permanent
 *   <li>AWS SDK client errors, throttling, 408 and 5xx service errors are transient
 *   <li>JDBC transient, recoverable and connection-class errors (SQLState 08, 40, 53, 57) are
 *       transient
 *   <li>socket and HTTP timeouts and I/O errors are transient
 * </ul>
 */
@Component
public class FailureClassifier {

  private static final Set<String> TRANSIENT_SQL_STATE_CLASSES = Set.of("08", "40", "53", "57");
  private static final int MAX_CAUSE_DEPTH = 16;

  /**
   * Classify a failure raised while performing a stage operation.
   *
   * @param errorClass the stage the failure is attributed to
   * @param failure the raw failure
   * @return the failure itself if already classified, otherwise a new transient or permanent
   *     exception wrapping it
   */
  public IndexingException classify(ErrorClass errorClass, Throwable failure) {
    if (failure instanceof IndexingException indexingException) {
      return indexingException;
    }
    String message = describe(failure);
    if (isTransient(failure)) {
      return new TransientIndexingException(errorClass, message, failure);
    }
    return new PermanentIndexingException(errorClass, message, failure);
  }

  /** Whether any exception in the cause chain indicates a transient condition. */
  public boolean isTransient(Throwable failure) {
    Throwable current = failure;
    int depth = 0;
    while (current != null && depth++ < MAX_CAUSE_DEPTH) {
      Boolean verdict = verdictFor(current);
      if (verdict != null) {
        return verdict;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  private static @Nullable Boolean verdictFor(Throwable t) {
    if (t instanceof TransientIndexingException) {
      return true;
    }
    if (t instanceof PermanentIndexingException) {
      return false;
    }
    if (t instanceof RetriableException) {
      return true;
    }
    if (t instanceof NonRetriableException) {
      return false;
    }
    if (t instanceof SdkServiceException serviceException) {
      int status = serviceException.statusCode();
      return status >= 500 || status == 408 || status == 429
          || serviceException.isThrottlingException();
    }
    if (t instanceof SdkClientException) {
      return true;
    }
    if (t instanceof TransientDataAccessException || t instanceof RecoverableDataAccessException) {
      return true;
    }
    if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
      return true;
    }
    if (t instanceof SQLException sqlException) {
      String state = sqlException.getSQLState();
      if (state != null && state.length() >= 2) {
        return TRANSIENT_SQL_STATE_CLASSES.contains(state.substring(0, 2));
      }
      return null;
    }
    if (t instanceof SocketTimeoutException
        || t instanceof HttpTimeoutException
        || t instanceof TimeoutException) {
      return true;
    }
    if (t instanceof IOException || t instanceof UncheckedIOException) {
      return true;
    }
    return null;
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    if (message == null || message.isBlank()) {
      return failure.getClass().getSimpleName();
    }
    return failure.getClass().getSimpleName() + ": " + message;
  }
}
