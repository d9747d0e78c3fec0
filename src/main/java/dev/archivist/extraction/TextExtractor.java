package dev.archivist.extraction;

/** Converts the raw bytes of one document format into plain text. */
public interface TextExtractor {

  /** Whether this extractor handles {@code mediaType}. */
  boolean supports(DocumentMediaType mediaType);

  /**
   * Extract the text of a document.
   *
   * @param documentKey key of the document, for error messages
   * @param content raw document bytes
   * @return the extracted text, possibly empty
   * @throws dev.archivist.failure.PermanentIndexingException if the payload is corrupt, encrypted
   *     or not of the expected format
   */
  ExtractedText extract(String documentKey, byte[] content);
}
