package dev.archivist.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  private static final String KEY = "source/handbook.txt";
  private static final String FINGERPRINT = "9e107d9d372bb6826bd81d3542a419d6";

  private final TextChunker chunker = new TextChunker(ChunkingProperties.of(1000, 200));

  @Test
  void textWithoutBoundariesIsCutAtFixedStride() {
    String text = "a".repeat(2500);

    List<Chunk> chunks = chunker.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).extracting(Chunk::startOffset).containsExactly(0, 800, 1600, 2400);
    assertThat(chunks).extracting(Chunk::endOffset).containsExactly(1000, 1800, 2500, 2500);
    assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2, 3);
  }

  @Test
  void emptyTextProducesNoChunks() {
    assertThat(chunker.chunk(KEY, FINGERPRINT, "")).isEmpty();
  }

  @Test
  void shortTextBecomesSingleChunk() {
    String text = "Quarterly revenue grew by four percent.";

    List<Chunk> chunks = chunker.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).hasSize(1);
    Chunk chunk = chunks.get(0);
    assertThat(chunk.text()).isEqualTo(text);
    assertThat(chunk.startOffset()).isZero();
    assertThat(chunk.endOffset()).isEqualTo(text.length());
    assertThat(chunk.documentKey()).isEqualTo(KEY);
    assertThat(chunk.chunkId()).isEqualTo(ChunkIdGenerator.chunkId(FINGERPRINT, 0));
  }

  @Test
  void textOfExactlyChunkSizeIsNotSplit() {
    assertThat(chunker.chunk(KEY, FINGERPRINT, "b".repeat(1000))).hasSize(1);
  }

  @Test
  void chunksEndOnParagraphBoundaries() {
    String text = "a".repeat(600) + "\n\n" + "b".repeat(600) + "\n\n" + "c".repeat(600);

    List<Chunk> chunks = chunker.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).extracting(Chunk::endOffset).containsExactly(602, 1204, 1804);
    assertThat(chunks).extracting(Chunk::startOffset).containsExactly(0, 402, 1004);
    assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(1000));
  }

  @Test
  void overlappingChunksDoNotStartWithWhitespace() {
    TextChunker small = new TextChunker(ChunkingProperties.of(100, 20));
    String text = "word ".repeat(500);

    List<Chunk> chunks = small.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).hasSizeGreaterThan(20);
    assertThat(chunks).allSatisfy(c -> {
      assertThat(Character.isWhitespace(c.text().charAt(0))).isFalse();
      assertThat(c.length()).isLessThanOrEqualTo(100);
    });
  }

  @Test
  void longPaddingIsCarriedByTheChunkAfterIt() {
    String text = "Intro." + " ".repeat(1500) + "End.";

    List<Chunk> chunks = chunker.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).extracting(Chunk::startOffset).containsExactly(0, 1000);
    assertThat(chunks).extracting(Chunk::endOffset).containsExactly(1000, 1510);
    assertThat(chunks).noneMatch(c -> c.text().isBlank());
  }

  @Test
  void paddingLongerThanTwoChunksLeavesOnlyWhitespaceUncovered() {
    String text = "Intro." + " ".repeat(2500) + "End.";

    List<Chunk> chunks = chunker.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).noneMatch(c -> c.text().isBlank());
    assertThat(chunks.get(0).text()).startsWith("Intro.");
    assertThat(chunks.get(chunks.size() - 1).text()).endsWith("End.");
    assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(text.length());
    assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1);
  }

  @Test
  void blankTextProducesNoChunks() {
    assertThat(chunker.chunk(KEY, FINGERPRINT, " \n\n\t ")).isEmpty();
    assertThat(chunker.chunk(KEY, FINGERPRINT, "\n".repeat(3000))).isEmpty();
  }

  @Test
  void hardCutsNeverSplitSurrogatePairs() {
    TextChunker small = new TextChunker(ChunkingProperties.of(101, 20));
    String text = "😀".repeat(1000);

    List<Chunk> chunks = small.chunk(KEY, FINGERPRINT, text);

    assertThat(chunks).allSatisfy(c -> {
      assertThat(Character.isLowSurrogate(c.text().charAt(0))).isFalse();
      assertThat(Character.isHighSurrogate(c.text().charAt(c.length() - 1))).isFalse();
      assertThat(c.length()).isLessThanOrEqualTo(101);
    });
    assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(text.length());
  }

  @Test
  void sameInputYieldsSameChunks() {
    String text = "Section one.\n\n" + "Lorem ipsum dolor sit amet. ".repeat(120);

    assertThat(chunker.chunk(KEY, FINGERPRINT, text))
        .isEqualTo(chunker.chunk(KEY, FINGERPRINT, text));
  }

  @Test
  void chunkIdsDependOnFingerprint() {
    String text = "z".repeat(1500);

    List<Chunk> first = chunker.chunk(KEY, FINGERPRINT, text);
    List<Chunk> second = chunker.chunk(KEY, "another-fingerprint", text);

    assertThat(first).extracting(Chunk::chunkId)
        .doesNotContainAnyElementsOf(second.stream().map(Chunk::chunkId).toList());
  }

  @Test
  void rejectsOverlapNotSmallerThanChunkSize() {
    assertThatThrownBy(() -> ChunkingProperties.of(500, 500))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("chunk-overlap");
  }

  @Test
  void rejectsTinyChunkSize() {
    assertThatThrownBy(() -> ChunkingProperties.of(8, 0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("chunk-size");
  }
}
