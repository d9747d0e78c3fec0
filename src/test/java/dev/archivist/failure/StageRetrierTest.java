package dev.archivist.failure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.archivist.fixture.TestProperties;
import dev.langchain4j.exception.RateLimitException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class StageRetrierTest {

  private final StageRetrier retrier =
      new StageRetrier(TestProperties.retry(3), new FailureClassifier());

  private final List<Integer> attempts = new ArrayList<>();
  private final AttemptObserver observer = attempts::add;

  @Test
  void transientFailuresAreRetriedUntilSuccess() {
    AtomicInteger calls = new AtomicInteger();

    String result = retrier.execute(ErrorClass.EMBEDDING, "doc", observer, () -> {
      if (calls.incrementAndGet() < 3) {
        throw new RateLimitException("slow down");
      }
      return "ok";
    });

    assertThat(result).isEqualTo("ok");
    assertThat(attempts).containsExactly(1, 2, 3);
  }

  @Test
  void permanentFailureIsNotRetried() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> retrier.run(ErrorClass.EXTRACTION, "doc", observer, () -> {
      calls.incrementAndGet();
      throw new IllegalArgumentException("not a PDF");
    }))
        .isInstanceOf(PermanentIndexingException.class)
        .hasMessageContaining("not a PDF")
        .extracting(e -> ((IndexingException) e).errorClass())
        .isEqualTo(ErrorClass.EXTRACTION);
    assertThat(calls).hasValue(1);
    assertThat(attempts).containsExactly(1);
  }

  @Test
  void exhaustedRetriesSurfaceLastTransientFailure() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> retrier.run(ErrorClass.VECTOR_WRITE, "doc", observer, () -> {
      calls.incrementAndGet();
      throw new RateLimitException("still throttled");
    }))
        .isInstanceOf(TransientIndexingException.class)
        .hasMessageContaining("still throttled");
    assertThat(calls).hasValue(3);
    assertThat(attempts).containsExactly(1, 2, 3);
  }

  @Test
  void checkedExceptionsAreClassified() {
    assertThatThrownBy(() -> retrier.execute(ErrorClass.TRANSITION, "doc", AttemptObserver.NONE,
        () -> {
          throw new java.sql.SQLException("duplicate", "23505");
        }))
        .isInstanceOf(PermanentIndexingException.class);
  }
}
