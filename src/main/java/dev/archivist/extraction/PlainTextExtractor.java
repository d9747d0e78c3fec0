package dev.archivist.extraction;

import org.springframework.stereotype.Component;

/** {@link TextExtractor} for UTF-8 plain text. Form feeds in the input delimit sections. */
@Component
public class PlainTextExtractor implements TextExtractor {

  @Override
  public boolean supports(DocumentMediaType mediaType) {
    return mediaType == DocumentMediaType.PLAIN_TEXT;
  }

  @Override
  public ExtractedText extract(String documentKey, byte[] content) {
    String text = StrictUtf8.decode(documentKey, content).strip();
    int sections = text.isEmpty() ? 0 : text.split("\f", -1).length;
    return new ExtractedText(text, DocumentMediaType.PLAIN_TEXT, sections, sections, null);
  }
}
