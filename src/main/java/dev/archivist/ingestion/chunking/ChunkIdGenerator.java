package dev.archivist.ingestion.chunking;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Static utility deriving stable chunk identifiers.
 *
 * <p>A chunk identifier is a function of the document's content fingerprint and the chunk's
 * index only, so reprocessing the same content always yields the same identifiers and the vector
 * store upsert replaces rather than duplicates.
 */
public final class ChunkIdGenerator {

  private ChunkIdGenerator() {
    // utility class
  }

  /**
   * Identifier of chunk {@code index} of the document whose content has {@code fingerprint}.
   *
   * <p>The first 16 bytes of {@code SHA-256(fingerprint + "#" + index)} with RFC 4122 version
   * (name-based) and variant bits applied, so the result is usable as a UUID primary key.
   */
  public static String chunkId(String fingerprint, int index) {
    byte[] hash = digest(fingerprint + "#" + index);
    hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
    hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);
    ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
    return new UUID(buffer.getLong(), buffer.getLong()).toString();
  }

  private static byte[] digest(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(content.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
