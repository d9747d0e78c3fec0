package dev.archivist.ingestion.embedding;

import dev.archivist.ingestion.chunking.Chunk;
import dev.langchain4j.data.embedding.Embedding;

/** A chunk paired with its embedding vector. */
public record EmbeddedChunk(Chunk chunk, Embedding embedding) {

  public String chunkId() {
    return chunk.chunkId();
  }
}
