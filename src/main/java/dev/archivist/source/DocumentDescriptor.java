package dev.archivist.source;

import java.time.Instant;
import java.util.Objects;

/**
 * A pending document discovered by the {@link SourceLister}. Immutable for the run.
 *
 * @param key full object key under the source prefix
 * @param size payload size in bytes
 * @param fingerprint content fingerprint; identical content yields the identical fingerprint
 * @param discoveredAt when the lister saw the document
 */
public record DocumentDescriptor(String key, long size, String fingerprint, Instant discoveredAt) {
  public DocumentDescriptor {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    Objects.requireNonNull(discoveredAt, "discoveredAt must not be null");
  }
}
