package dev.archivist.ingestion.store;

import dev.archivist.ingestion.embedding.EmbeddedChunk;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a vector collection: chunk identifier, vector, chunk text and payload.
 *
 * <p>The payload carries only values derived from the document content and its key, so writing
 * the record of the same chunk again leaves the collection unchanged.
 */
public record VectorRecord(String id, Embedding vector, String text, Map<String, Object> payload) {

  public static final String DOCUMENT_KEY = "document_key";
  public static final String CONTENT_FINGERPRINT = "content_fingerprint";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String START_OFFSET = "start_offset";
  public static final String END_OFFSET = "end_offset";
  public static final String MEDIA_TYPE = "media_type";
  public static final String SECTION_COUNT = "section_count";
  public static final String TOTAL_CHUNKS = "total_chunks";

  public VectorRecord {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(vector, "vector must not be null");
    Objects.requireNonNull(text, "text must not be null");
    payload = Map.copyOf(payload);
  }

  /**
   * Build the record of an embedded chunk.
   *
   * @param embedded the chunk and its vector
   * @param fingerprint content fingerprint of the document
   * @param mediaType MIME type the text was extracted from
   * @param sectionCount sections of the source document
   * @param totalChunks chunks of the document
   */
  public static VectorRecord of(EmbeddedChunk embedded, String fingerprint, String mediaType,
                                int sectionCount, int totalChunks) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(DOCUMENT_KEY, embedded.chunk().documentKey());
    payload.put(CONTENT_FINGERPRINT, fingerprint);
    payload.put(CHUNK_INDEX, embedded.chunk().index());
    payload.put(START_OFFSET, embedded.chunk().startOffset());
    payload.put(END_OFFSET, embedded.chunk().endOffset());
    payload.put(MEDIA_TYPE, mediaType);
    payload.put(SECTION_COUNT, sectionCount);
    payload.put(TOTAL_CHUNKS, totalChunks);
    return new VectorRecord(embedded.chunkId(), embedded.embedding(), embedded.chunk().text(),
        payload);
  }

  public String documentKey() {
    return String.valueOf(payload.get(DOCUMENT_KEY));
  }

  /** Converts this record to a langchain4j {@link TextSegment} carrying the payload as metadata. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, Metadata.from(payload));
  }
}
