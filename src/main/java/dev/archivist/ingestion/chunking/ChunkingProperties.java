package dev.archivist.ingestion.chunking;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the chunker.
 *
 * <p>Properties are bound from {@code archivist.chunking.*}.
 *
 * <ul>
 *   <li>{@code chunk-size} - maximum chunk length in characters (default 1000, at least 16)
 *   <li>{@code chunk-overlap} - characters shared by consecutive chunks (default 200, must be
 *       smaller than the chunk size)
 *   <li>{@code boundaries} - boundary levels tried in order before hard cuts
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "archivist.chunking")
public class ChunkingProperties {

  static final int MIN_CHUNK_SIZE = 16;

  private int chunkSize = 1000;
  private int chunkOverlap = 200;
  private List<BoundaryLevel> boundaries =
      new ArrayList<>(
          List.of(
              BoundaryLevel.SECTION,
              BoundaryLevel.PARAGRAPH,
              BoundaryLevel.SENTENCE,
              BoundaryLevel.LINE,
              BoundaryLevel.WORD));

  /** Validated properties with the given size and overlap and the default boundaries. */
  public static ChunkingProperties of(int chunkSize, int chunkOverlap) {
    ChunkingProperties properties = new ChunkingProperties();
    properties.setChunkSize(chunkSize);
    properties.setChunkOverlap(chunkOverlap);
    properties.validate();
    return properties;
  }

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (chunkSize < MIN_CHUNK_SIZE) {
      throw new IllegalStateException(
          "archivist.chunking.chunk-size must be at least " + MIN_CHUNK_SIZE + ", got: "
              + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalStateException(
          "archivist.chunking.chunk-overlap must be in [0, chunk-size), got: " + chunkOverlap);
    }
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public void setChunkSize(int chunkSize) {
    this.chunkSize = chunkSize;
  }

  public int getChunkOverlap() {
    return chunkOverlap;
  }

  public void setChunkOverlap(int chunkOverlap) {
    this.chunkOverlap = chunkOverlap;
  }

  public List<BoundaryLevel> getBoundaries() {
    return boundaries;
  }

  public void setBoundaries(List<BoundaryLevel> boundaries) {
    this.boundaries = boundaries;
  }
}
