package dev.archivist.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits extracted text into overlapping chunks bounded by a maximum size.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Text no longer than the chunk size becomes a single chunk.
 *   <li>Otherwise the text is segmented by the first configured {@link BoundaryLevel} that splits
 *       it; every segment still larger than the chunk size is segmented again by the following
 *       levels. Segments no level can split become hard-cut regions.
 *   <li>Natural segments are packed greedily into chunks of at most {@code chunkSize} characters.
 *       Each new chunk starts {@code chunkOverlap} characters before the previous chunk's end,
 *       moved forward past whitespace and shortened if needed to respect the size bound.
 *   <li>Hard-cut regions are cut at a fixed stride of {@code chunkSize - chunkOverlap}; every
 *       stride start before the region end opens a chunk.
 * </ol>
 *
 * <p>Chunks are ordered by start offset and never consist of whitespace alone. Together they cover
 * every non-whitespace character; only whitespace that cannot share a bounded chunk with content
 * (a blank run longer than the chunk size, blank text) falls between or outside them. Cuts never
 * separate a UTF-16 surrogate pair. The output is a pure function of the input text and the
 * configuration.
 */
@Component
public class TextChunker {

  private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

  private final int chunkSize;
  private final int chunkOverlap;
  private final List<BoundaryLevel> boundaries;

  public TextChunker(ChunkingProperties properties) {
    this.chunkSize = properties.getChunkSize();
    this.chunkOverlap = properties.getChunkOverlap();
    this.boundaries = List.copyOf(properties.getBoundaries());
  }

  /**
   * Chunk a document's extracted text.
   *
   * @param documentKey key of the document the text belongs to
   * @param fingerprint content fingerprint of the document, seeds the chunk identifiers
   * @param text the extracted text
   * @return chunks in source order; empty for empty text
   */
  public List<Chunk> chunk(String documentKey, String fingerprint, String text) {
    if (text.isEmpty()) {
      return List.of();
    }
    List<int[]> spans = spans(text);
    List<Chunk> chunks = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      int start = spans.get(i)[0];
      int end = spans.get(i)[1];
      chunks.add(new Chunk(
          ChunkIdGenerator.chunkId(fingerprint, i),
          documentKey,
          i,
          text.substring(start, end),
          start,
          end));
    }
    log.debug("Chunked {} ({} chars) into {} chunks", documentKey, text.length(), chunks.size());
    return chunks;
  }

  private List<int[]> spans(String text) {
    List<int[]> spans;
    if (text.length() <= chunkSize) {
      spans = List.of(new int[] {0, text.length()});
    } else {
      List<Segment> segments = new ArrayList<>();
      segment(text, 0, text.length(), 0, segments);
      spans = pack(text, segments);
    }
    return spans.stream().filter(span -> !isBlank(text, span[0], span[1])).toList();
  }

  private void segment(String text, int start, int end, int levelIndex, List<Segment> out) {
    if (end - start <= chunkSize) {
      out.add(new Segment(start, end, false));
      return;
    }
    for (int i = levelIndex; i < boundaries.size(); i++) {
      List<Integer> cuts = cutPoints(text, start, end, boundaries.get(i));
      if (!cuts.isEmpty()) {
        int pieceStart = start;
        for (int cut : cuts) {
          segment(text, pieceStart, cut, i + 1, out);
          pieceStart = cut;
        }
        segment(text, pieceStart, end, i + 1, out);
        return;
      }
    }
    out.add(new Segment(start, end, true));
  }

  private static List<Integer> cutPoints(String text, int start, int end, BoundaryLevel level) {
    Matcher matcher = level.marker().matcher(text);
    matcher.region(start, end);
    matcher.useTransparentBounds(true);
    matcher.useAnchoringBounds(false);
    List<Integer> cuts = new ArrayList<>();
    while (matcher.find()) {
      int cut = matcher.end();
      if (cut > start && cut < end) {
        cuts.add(cut);
      }
    }
    return cuts;
  }

  private List<int[]> pack(String text, List<Segment> segments) {
    List<int[]> chunks = new ArrayList<>();
    int currentStart = -1;
    int currentEnd = -1;
    for (Segment segment : segments) {
      if (segment.hard()) {
        if (currentStart >= 0) {
          chunks.add(new int[] {currentStart, currentEnd});
          currentStart = -1;
        }
        hardCut(text, segment, chunks);
      } else if (currentStart < 0) {
        currentStart = chunks.isEmpty()
            ? segment.start()
            : overlapStart(text, last(chunks)[0], last(chunks)[1], segment.end());
        currentEnd = segment.end();
      } else if (segment.end() - currentStart <= chunkSize) {
        currentEnd = segment.end();
      } else {
        chunks.add(new int[] {currentStart, currentEnd});
        currentStart = overlapStart(text, currentStart, currentEnd, segment.end());
        currentEnd = segment.end();
      }
    }
    if (currentStart >= 0) {
      chunks.add(new int[] {currentStart, currentEnd});
    }
    return chunks;
  }

  private void hardCut(String text, Segment region, List<int[]> chunks) {
    int stride = chunkSize - chunkOverlap;
    int start = chunks.isEmpty()
        ? region.start()
        : overlapStart(text, last(chunks)[0], last(chunks)[1], last(chunks)[1]);
    while (start < region.end() && !isBlank(text, start, region.end())) {
      int end = Math.min(start + chunkSize, region.end());
      if (end < region.end() && splitsSurrogatePair(text, end)) {
        end--;
      }
      chunks.add(new int[] {start, end});
      int next = start + stride;
      if (splitsSurrogatePair(text, next)) {
        next = next - 1 > start ? next - 1 : next + 1;
      }
      start = Math.min(next, end);
    }
  }

  /**
   * Start of the chunk following {@code [previousStart, previousEnd)}: {@code chunkOverlap}
   * characters before the previous end, never at or before the previous start, never so early
   * that a chunk ending at {@code nextEnd} would exceed the size bound, and moved forward past
   * whitespace.
   */
  private int overlapStart(String text, int previousStart, int previousEnd, int nextEnd) {
    int start = Math.max(previousEnd - chunkOverlap, previousStart + 1);
    start = Math.max(start, nextEnd - chunkSize);
    while (start < previousEnd && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    if (start < previousEnd && splitsSurrogatePair(text, start)) {
      start++;
    }
    return start;
  }

  /**
   * Whether {@code text[start, end)} holds nothing but whitespace or control characters, the
   * characters an embedding segment trims away.
   */
  static boolean isBlank(String text, int start, int end) {
    for (int i = start; i < end; i++) {
      char c = text.charAt(i);
      if (c > ' ' && !Character.isWhitespace(c)) {
        return false;
      }
    }
    return true;
  }

  private static boolean splitsSurrogatePair(String text, int index) {
    return index > 0
        && index < text.length()
        && Character.isHighSurrogate(text.charAt(index - 1))
        && Character.isLowSurrogate(text.charAt(index));
  }

  private static int[] last(List<int[]> chunks) {
    return chunks.get(chunks.size() - 1);
  }

  private record Segment(int start, int end, boolean hard) {}
}
