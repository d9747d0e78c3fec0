package dev.archivist.extraction;

import java.util.Locale;
import java.util.Set;

/** Document formats the pipeline can extract text from, recognised by file extension. */
public enum DocumentMediaType {
  PDF("application/pdf", Set.of("pdf")),
  MARKDOWN("text/markdown", Set.of("md", "markdown")),
  PLAIN_TEXT("text/plain", Set.of("txt", "text")),
  UNKNOWN("application/octet-stream", Set.of());

  private final String mimeType;
  private final Set<String> extensions;

  DocumentMediaType(String mimeType, Set<String> extensions) {
    this.mimeType = mimeType;
    this.extensions = extensions;
  }

  public String mimeType() {
    return mimeType;
  }

  /**
   * Resolve the media type of an object from its key.
   *
   * @param key object key, e.g. {@code "source/reports/q3.pdf"}
   * @return the matching media type, or {@link #UNKNOWN}
   */
  public static DocumentMediaType fromKey(String key) {
    String extension = extensionOf(key);
    for (DocumentMediaType type : values()) {
      if (type.extensions.contains(extension)) {
        return type;
      }
    }
    return UNKNOWN;
  }

  /** Lower-cased extension of the last path segment of {@code key}, or {@code ""}. */
  public static String extensionOf(String key) {
    String name = key.substring(key.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
