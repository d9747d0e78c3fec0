package dev.archivist.extraction;

import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.PermanentIndexingException;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Routes a document to the {@link TextExtractor} supporting its media type.
 *
 * <p>Extraction is a pure function of the bytes: the same payload always yields the same text.
 * A media type no extractor supports is a permanent failure.
 */
@Service
public class TextExtractionService {

  private final List<TextExtractor> extractors;

  public TextExtractionService(List<TextExtractor> extractors) {
    this.extractors = List.copyOf(extractors);
  }

  /**
   * Extract the text of a document.
   *
   * @param documentKey key of the document; its extension selects the extractor
   * @param content raw document bytes
   * @return the extracted text
   * @throws PermanentIndexingException if the format is unsupported or the payload corrupt
   */
  public ExtractedText extract(String documentKey, byte[] content) {
    DocumentMediaType mediaType = DocumentMediaType.fromKey(documentKey);
    for (TextExtractor extractor : extractors) {
      if (extractor.supports(mediaType)) {
        return extractor.extract(documentKey, content);
      }
    }
    throw new PermanentIndexingException(ErrorClass.EXTRACTION,
        "Unsupported document format (" + mediaType.mimeType() + "): " + documentKey);
  }
}
