package dev.archivist.source;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Object storage layout and client settings ({@code archivist.storage.*}).
 *
 * <p>Pending documents live under {@code sourcePrefix}, processed ones under {@code
 * processedPrefix} with the same relative key. Prefixes must be distinct and neither may contain
 * the other.
 */
@ConfigurationProperties(prefix = "archivist.storage")
public record StorageProperties(
    @DefaultValue("enterprise-data") String bucket,
    @DefaultValue("source/") String sourcePrefix,
    @DefaultValue("processed/") String processedPrefix,
    @Nullable URI endpoint,
    @DefaultValue("us-east-1") String region,
    @DefaultValue("false") boolean pathStyleAccess,
    @DefaultValue List<String> includeExtensions,
    @DefaultValue("30s") Duration timeout,
    @DefaultValue ListingRetry listingRetry) {

  public StorageProperties {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException("archivist.storage.bucket must be set");
    }
    if (sourcePrefix.startsWith(processedPrefix) || processedPrefix.startsWith(sourcePrefix)) {
      throw new IllegalStateException(
          "archivist.storage.source-prefix and processed-prefix must not contain each other, got: "
              + sourcePrefix + ", " + processedPrefix);
    }
    includeExtensions = includeExtensions == null
        ? List.of()
        : includeExtensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
            .toList();
  }

  /** Key under the processed prefix matching the given source key. */
  public String processedKeyFor(String sourceKey) {
    return processedPrefix + relativeKey(sourceKey);
  }

  /** Key relative to the source prefix. */
  public String relativeKey(String sourceKey) {
    if (!sourceKey.startsWith(sourcePrefix)) {
      throw new IllegalArgumentException(
          "Key " + sourceKey + " is outside source prefix " + sourcePrefix);
    }
    return sourceKey.substring(sourcePrefix.length());
  }

  public record ListingRetry(
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("500") long delayMs,
      @DefaultValue("2.0") double multiplier) {}
}
