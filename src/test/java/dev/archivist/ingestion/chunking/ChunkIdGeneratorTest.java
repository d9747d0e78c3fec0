package dev.archivist.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class ChunkIdGeneratorTest {

  @Test
  void sameFingerprintAndIndexGiveSameId() {
    assertThat(ChunkIdGenerator.chunkId("abc", 3)).isEqualTo(ChunkIdGenerator.chunkId("abc", 3));
  }

  @Test
  void differentIndexOrFingerprintGiveDifferentIds() {
    String id = ChunkIdGenerator.chunkId("abc", 0);

    assertThat(ChunkIdGenerator.chunkId("abc", 1)).isNotEqualTo(id);
    assertThat(ChunkIdGenerator.chunkId("abd", 0)).isNotEqualTo(id);
  }

  @Test
  void idIsNameBasedUuid() {
    UUID uuid = UUID.fromString(ChunkIdGenerator.chunkId("9e107d9d372bb6826bd81d3542a419d6", 7));

    assertThat(uuid.version()).isEqualTo(5);
    assertThat(uuid.variant()).isEqualTo(2);
  }
}
