package dev.archivist.run;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Run settings ({@code archivist.run.*}).
 *
 * @param maxConcurrency maximum documents processed simultaneously
 * @param deadline optional limit on a run's duration; unfinished documents are skipped
 * @param onStartup run once when the application starts, then exit
 * @param schedule cron expression for recurring runs; the application keeps running when set
 */
@Validated
@ConfigurationProperties(prefix = "archivist.run")
public record RunProperties(
    @DefaultValue("5") @Min(1) @Max(64) int maxConcurrency,
    @Nullable Duration deadline,
    @DefaultValue("true") boolean onStartup,
    @Nullable String schedule) {}
