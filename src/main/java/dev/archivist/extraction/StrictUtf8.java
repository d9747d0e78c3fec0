package dev.archivist.extraction;

import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.PermanentIndexingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/** Strict UTF-8 decoding for text formats: malformed input is a corrupt document. */
final class StrictUtf8 {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private StrictUtf8() {
    // utility class
  }

  /**
   * Decode {@code content}, dropping a leading byte order mark and normalising line endings to
   * {@code \n}.
   */
  static String decode(String documentKey, byte[] content) {
    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(content))
          .toString();
    } catch (CharacterCodingException e) {
      throw new PermanentIndexingException(ErrorClass.EXTRACTION,
          "Document is not valid UTF-8 text: " + documentKey, e);
    }
    if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
      text = text.substring(1);
    }
    return text.replace("\r\n", "\n").replace('\r', '\n');
  }
}
