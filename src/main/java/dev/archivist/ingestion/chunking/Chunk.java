package dev.archivist.ingestion.chunking;

import java.util.Objects;

/**
 * A contiguous span of a document's extracted text.
 *
 * @param chunkId deterministic identifier, see {@link ChunkIdGenerator#chunkId(String, int)}
 * @param documentKey key of the source document
 * @param index zero-based position within the document
 * @param text {@code source.substring(startOffset, endOffset)}
 * @param startOffset inclusive character offset into the extracted text
 * @param endOffset exclusive character offset into the extracted text
 */
public record Chunk(
    String chunkId, String documentKey, int index, String text, int startOffset, int endOffset) {
  public Chunk {
    Objects.requireNonNull(chunkId, "chunkId must not be null");
    Objects.requireNonNull(documentKey, "documentKey must not be null");
    Objects.requireNonNull(text, "text must not be null");
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative, got: " + index);
    }
    if (startOffset < 0 || endOffset < startOffset) {
      throw new IllegalArgumentException(
          "invalid offsets [" + startOffset + ", " + endOffset + ")");
    }
    if (text.length() != endOffset - startOffset) {
      throw new IllegalArgumentException("text length does not match offsets");
    }
  }

  public int length() {
    return endOffset - startOffset;
  }
}
