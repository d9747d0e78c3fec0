package dev.archivist.extraction;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Plain text extracted from a document, with sections separated by form feeds.
 *
 * @param text extracted text; empty when the document holds no extractable text
 * @param mediaType format the text was extracted from
 * @param sectionCount pages (PDF) or headed sections (Markdown) in the document
 * @param extractedSections sections that contributed text
 * @param title document title when the format carries one; null otherwise
 */
public record ExtractedText(
    String text,
    DocumentMediaType mediaType,
    int sectionCount,
    int extractedSections,
    @Nullable String title) {

  /** Separator placed between sections of the extracted text. */
  public static final String SECTION_SEPARATOR = "\n\f";

  public ExtractedText {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(mediaType, "mediaType must not be null");
  }
}
