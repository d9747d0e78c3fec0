package dev.archivist.ingestion.chunking;

import java.util.regex.Pattern;

/**
 * Natural text boundaries the chunker may cut at, from coarsest to finest.
 *
 * <p>Each level is a marker pattern; a cut is placed at the end of a marker so the marker stays
 * with the preceding text. Sections are delimited by form feeds, which extractors emit between
 * pages and headed sections.
 */
public enum BoundaryLevel {
  SECTION(Pattern.compile("\\f\\s*")),
  PARAGRAPH(Pattern.compile("\\n[ \\t]*\\n\\s*")),
  SENTENCE(Pattern.compile("(?<=[.!?])[ \\t\\n]+")),
  CLAUSE(Pattern.compile("(?<=[;:])[ \\t\\n]+")),
  LINE(Pattern.compile("\\n+")),
  WORD(Pattern.compile("[ \\t]+"));

  private final Pattern marker;

  BoundaryLevel(Pattern marker) {
    this.marker = marker;
  }

  Pattern marker() {
    return marker;
  }
}
