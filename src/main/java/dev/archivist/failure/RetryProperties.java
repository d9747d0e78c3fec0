package dev.archivist.failure;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy shared by every per-document stage call ({@code archivist.retry.*}).
 *
 * @param maxAttempts total attempts per stage call, including the first
 * @param initialBackoff delay before the first retry
 * @param maxBackoff upper bound of any single delay
 * @param multiplier growth factor between consecutive delays
 */
@Validated
@ConfigurationProperties(prefix = "archivist.retry")
public record RetryProperties(
    @DefaultValue("5") @Min(1) @Max(20) int maxAttempts,
    @DefaultValue("500ms") @NotNull Duration initialBackoff,
    @DefaultValue("30s") @NotNull Duration maxBackoff,
    @DefaultValue("2.0") @DecimalMin("1.0") double multiplier) {

  public RetryProperties {
    if (initialBackoff != null && maxBackoff != null && maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalStateException(
          "archivist.retry.max-backoff must not be shorter than initial-backoff, got: "
              + maxBackoff + " < " + initialBackoff);
    }
  }
}
