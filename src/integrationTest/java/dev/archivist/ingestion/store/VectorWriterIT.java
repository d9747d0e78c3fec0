package dev.archivist.ingestion.store;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.BaseIntegrationTest;
import dev.archivist.failure.AttemptObserver;
import dev.archivist.ingestion.chunking.Chunk;
import dev.archivist.ingestion.chunking.ChunkIdGenerator;
import dev.archivist.ingestion.embedding.EmbeddedChunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

class VectorWriterIT extends BaseIntegrationTest {

  @Autowired
  VectorWriter vectorWriter;

  @Autowired
  JdbcTemplate jdbcTemplate;

  @Test
  void writingSameRecordsTwiceLeavesOneEntryPerChunk() {
    String collection = vectorStoreProperties.collection();
    List<VectorRecord> records = records("source/policy.txt", "fp-1", 3);

    vectorWriter.write(collection, records, AttemptObserver.NONE);
    vectorWriter.write(collection, records, AttemptObserver.NONE);

    assertThat(rowCount(collection)).isEqualTo(3);
  }

  @Test
  void newVersionReplacesRecordsOfOldVersion() {
    String collection = vectorStoreProperties.collection();
    vectorWriter.write(collection, records("source/policy.txt", "fp-1", 3), AttemptObserver.NONE);
    vectorWriter.write(collection, records("source/other.txt", "fp-9", 1), AttemptObserver.NONE);

    vectorWriter.write(collection, records("source/policy.txt", "fp-2", 2), AttemptObserver.NONE);
    vectorWriter.removeStaleVersions(collection, "source/policy.txt", "fp-2",
        AttemptObserver.NONE);

    assertThat(rowCount(collection)).isEqualTo(3);
  }

  @Test
  void storedRecordsCarryPayload() {
    String collection = vectorStoreProperties.collection();
    List<VectorRecord> records = records("source/policy.txt", "fp-1", 1);
    vectorWriter.write(collection, records, AttemptObserver.NONE);

    EmbeddingSearchResult<TextSegment> result = vectorCollections.collection(collection)
        .search(EmbeddingSearchRequest.builder()
            .queryEmbedding(records.get(0).vector())
            .maxResults(1)
            .build());

    assertThat(result.matches()).singleElement().satisfies(match -> {
      assertThat(match.embeddingId()).isEqualTo(records.get(0).id());
      assertThat(match.embedded().text()).isEqualTo("chunk 0 of source/policy.txt");
      assertThat(match.embedded().metadata().getString(VectorRecord.DOCUMENT_KEY))
          .isEqualTo("source/policy.txt");
      assertThat(match.embedded().metadata().getString(VectorRecord.CONTENT_FINGERPRINT))
          .isEqualTo("fp-1");
    });
  }

  private long rowCount(String collection) {
    Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM " + collection, Long.class);
    return count == null ? 0 : count;
  }

  private List<VectorRecord> records(String documentKey, String fingerprint, int count) {
    List<VectorRecord> records = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      String text = "chunk " + i + " of " + documentKey;
      Chunk chunk = new Chunk(ChunkIdGenerator.chunkId(fingerprint, i), documentKey, i, text,
          i * 100, i * 100 + text.length());
      records.add(VectorRecord.of(new EmbeddedChunk(chunk, vector(i, fingerprint)), fingerprint,
          "text/plain", 1, count));
    }
    return records;
  }

  private Embedding vector(int index, String fingerprint) {
    float[] vector = new float[vectorStoreProperties.dimension()];
    vector[index % vector.length] = 1f;
    vector[Math.abs(fingerprint.hashCode()) % vector.length] += 0.5f;
    Embedding embedding = Embedding.from(vector);
    embedding.normalize();
    return embedding;
  }
}
