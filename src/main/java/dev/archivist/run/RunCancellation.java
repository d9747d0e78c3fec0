package dev.archivist.run;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;

/**
 * Cancellation token shared by the workers of one run.
 *
 * <p>A run is cancelled explicitly through {@link #cancel()} or implicitly once its deadline has
 * passed. The first reason observed sticks.
 */
public final class RunCancellation {

  public enum Reason {
    OPERATOR,
    DEADLINE
  }

  private final Clock clock;
  private final @Nullable Instant deadline;
  private final AtomicReference<Reason> reason = new AtomicReference<>();

  public RunCancellation(Clock clock, @Nullable Instant deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  public void cancel() {
    reason.compareAndSet(null, Reason.OPERATOR);
  }

  public boolean isCancelled() {
    checkDeadline();
    return reason.get() != null;
  }

  /** Records {@link Reason#DEADLINE} once the deadline has passed, unless a reason is set. */
  public void checkDeadline() {
    if (deadline != null && reason.get() == null && !clock.instant().isBefore(deadline)) {
      reason.compareAndSet(null, Reason.DEADLINE);
    }
  }

  public Optional<Reason> reason() {
    return Optional.ofNullable(reason.get());
  }
}
