package dev.archivist.fixture;

import dev.archivist.source.DocumentDescriptor;
import java.time.Instant;

/**
 * Lightweight test builder for {@link DocumentDescriptor}. Provides sensible defaults so tests
 * only override what they care about.
 */
public final class DocumentDescriptorBuilder {

  private String key = "source/report.txt";
  private long size = 100;
  private String fingerprint = "0cc175b9c0f1b6a831c399e269772661";
  private Instant discoveredAt = Instant.parse("2026-01-01T00:00:00Z");

  public DocumentDescriptorBuilder key(String key) {
    this.key = key;
    return this;
  }

  public DocumentDescriptorBuilder size(long size) {
    this.size = size;
    return this;
  }

  public DocumentDescriptorBuilder fingerprint(String fingerprint) {
    this.fingerprint = fingerprint;
    return this;
  }

  public DocumentDescriptorBuilder discoveredAt(Instant discoveredAt) {
    this.discoveredAt = discoveredAt;
    return this;
  }

  public DocumentDescriptor build() {
    return new DocumentDescriptor(key, size, fingerprint, discoveredAt);
  }
}
