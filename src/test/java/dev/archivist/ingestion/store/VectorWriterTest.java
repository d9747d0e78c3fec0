package dev.archivist.ingestion.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.archivist.failure.AttemptObserver;
import dev.archivist.failure.FailureClassifier;
import dev.archivist.failure.PermanentIndexingException;
import dev.archivist.failure.StageRetrier;
import dev.archivist.fixture.TestProperties;
import dev.archivist.ingestion.chunking.Chunk;
import dev.archivist.ingestion.chunking.ChunkIdGenerator;
import dev.archivist.ingestion.embedding.EmbeddedChunk;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VectorWriterTest {

  private static final String COLLECTION = "test_collection";

  @Mock
  private EmbeddingStore<TextSegment> store;

  @Captor
  private ArgumentCaptor<List<String>> idsCaptor;

  @Captor
  private ArgumentCaptor<List<TextSegment>> segmentsCaptor;

  private VectorWriter writer;

  @BeforeEach
  void setUp() {
    VectorStoreProperties properties = new VectorStoreProperties(COLLECTION,
        TestProperties.DIMENSION, 2, VectorStoreProperties.RejectionPolicy.FAIL_DOCUMENT);
    writer = new VectorWriter(new VectorCollections(name -> store),
        new StageRetrier(TestProperties.retry(3), new FailureClassifier()), properties);
  }

  @Test
  void upsertsRecordsInBatchesKeyedByChunkId() {
    List<VectorRecord> records = records(5);

    WriteResult result = writer.write(COLLECTION, records, AttemptObserver.NONE);

    verify(store, times(3)).addAll(idsCaptor.capture(), anyList(), segmentsCaptor.capture());
    assertThat(idsCaptor.getAllValues()).extracting(List::size).containsExactly(2, 2, 1);
    assertThat(result.written()).containsExactlyElementsOf(
        records.stream().map(VectorRecord::id).toList());
    assertThat(result.hasRejections()).isFalse();
    TextSegment first = segmentsCaptor.getAllValues().get(0).get(0);
    assertThat(first.metadata().getString(VectorRecord.DOCUMENT_KEY)).isEqualTo("source/doc.txt");
    assertThat(first.metadata().getInteger(VectorRecord.CHUNK_INDEX)).isZero();
    assertThat(first.metadata().getString(VectorRecord.CONTENT_FINGERPRINT)).isEqualTo("fp-1");
  }

  @Test
  void invalidRecordsAreRejectedIndividually() {
    List<VectorRecord> records = new ArrayList<>(records(2));
    records.add(record(2, "wrong dimension", new float[TestProperties.DIMENSION + 1]));
    float[] notFinite = vector(0.5f);
    notFinite[3] = Float.NaN;
    records.add(record(3, "has NaN", notFinite));
    records.add(record(4, "   ", vector(0.1f)));

    WriteResult result = writer.write(COLLECTION, records, AttemptObserver.NONE);

    assertThat(result.written()).hasSize(2);
    assertThat(result.rejected()).extracting(RecordRejection::reason).containsExactly(
        "dimension 9 does not match collection dimension 8",
        "vector contains a non-finite component",
        "text is blank");
    assertThat(writer.rejections(records)).hasSize(3);
  }

  @Test
  void transientStoreFailureIsRetried() {
    doThrow(new IllegalStateException("query failed", new SocketTimeoutException("timeout")))
        .doAnswer(invocation -> null)
        .when(store).addAll(anyList(), anyList(), anyList());
    List<Integer> attempts = new ArrayList<>();

    WriteResult result = writer.write(COLLECTION, records(1), attempts::add);

    assertThat(result.written()).hasSize(1);
    assertThat(attempts).containsExactly(1, 2);
  }

  @Test
  void permanentStoreFailureIsNotRetried() {
    doThrow(new IllegalArgumentException("column \"embedding\" has wrong type"))
        .when(store).addAll(anyList(), anyList(), anyList());

    assertThatThrownBy(() -> writer.write(COLLECTION, records(1), AttemptObserver.NONE))
        .isInstanceOf(PermanentIndexingException.class);
    verify(store, times(1)).addAll(anyList(), anyList(), anyList());
  }

  @Test
  void nothingIsSentWhenEveryRecordIsRejected() {
    writer.write(COLLECTION, List.of(record(0, "", vector(0.2f))), AttemptObserver.NONE);

    verify(store, never()).addAll(anyList(), anyList(), anyList());
  }

  @Test
  void staleVersionFilterMatchesOnlyOlderFingerprintsOfTheDocument() {
    ArgumentCaptor<Filter> filterCaptor = ArgumentCaptor.forClass(Filter.class);

    writer.removeStaleVersions(COLLECTION, "source/doc.txt", "fp-2", AttemptObserver.NONE);

    verify(store).removeAll(filterCaptor.capture());
    Filter filter = filterCaptor.getValue();
    assertThat(filter.test(metadata("source/doc.txt", "fp-1"))).isTrue();
    assertThat(filter.test(metadata("source/doc.txt", "fp-2"))).isFalse();
    assertThat(filter.test(metadata("source/other.txt", "fp-1"))).isFalse();
  }

  @Test
  void invalidCollectionNamesAreRefused() {
    VectorCollections collections = new VectorCollections(name -> store);

    assertThatThrownBy(() -> collections.collection("Enterprise-KB"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(collections.collection("enterprise_kb")).isSameAs(store);
  }

  @Test
  void removeAllIsNotCalledForWrites() {
    writer.write(COLLECTION, records(1), AttemptObserver.NONE);

    verify(store, never()).removeAll(any(Filter.class));
  }

  private static Metadata metadata(String documentKey, String fingerprint) {
    return Metadata.from(Map.of(
        VectorRecord.DOCUMENT_KEY, documentKey,
        VectorRecord.CONTENT_FINGERPRINT, fingerprint));
  }

  private static List<VectorRecord> records(int count) {
    List<VectorRecord> records = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      records.add(record(i, "chunk " + i, vector(0.1f * (i + 1))));
    }
    return records;
  }

  private static VectorRecord record(int index, String text, float[] vector) {
    Chunk chunk = new Chunk(ChunkIdGenerator.chunkId("fp-1", index), "source/doc.txt", index,
        text, index * 100, index * 100 + text.length());
    return VectorRecord.of(new EmbeddedChunk(chunk, Embedding.from(vector)), "fp-1",
        "text/plain", 1, 5);
  }

  private static float[] vector(float value) {
    float[] vector = new float[TestProperties.DIMENSION];
    Arrays.fill(vector, value);
    return vector;
  }
}
