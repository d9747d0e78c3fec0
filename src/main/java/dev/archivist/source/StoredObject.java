package dev.archivist.source;

import java.time.Instant;

/**
 * An object as reported by an object store listing.
 *
 * @param key full object key
 * @param size payload size in bytes
 * @param fingerprint store-provided content hash (ETag without quotes)
 * @param lastModified last modification time
 */
public record StoredObject(String key, long size, String fingerprint, Instant lastModified) {

  public boolean isDirectoryMarker() {
    return key.endsWith("/");
  }
}
