package dev.archivist.extraction;

import java.util.ArrayList;
import java.util.List;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Document;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for Markdown, backed by CommonMark with GFM tables.
 *
 * <p>The document is split into sections at every H1-H3 heading; each section is rendered to plain
 * text (markup removed, heading text kept as the first line). The first H1 is the title.
 */
@Component
public class MarkdownTextExtractor implements TextExtractor {

  private static final int MAX_SECTION_HEADING_LEVEL = 3;

  private final Parser parser;
  private final TextContentRenderer renderer;

  public MarkdownTextExtractor() {
    List<Extension> extensions = List.of(TablesExtension.create());
    this.parser = Parser.builder().extensions(extensions).build();
    this.renderer = TextContentRenderer.builder().extensions(extensions).build();
  }

  @Override
  public boolean supports(DocumentMediaType mediaType) {
    return mediaType == DocumentMediaType.MARKDOWN;
  }

  @Override
  public ExtractedText extract(String documentKey, byte[] content) {
    Node document = parser.parse(StrictUtf8.decode(documentKey, content));

    List<Document> sections = new ArrayList<>();
    Document current = new Document();
    String title = null;
    Node node = document.getFirstChild();
    while (node != null) {
      Node next = node.getNext();
      if (node instanceof Heading heading && heading.getLevel() <= MAX_SECTION_HEADING_LEVEL) {
        if (current.getFirstChild() != null) {
          sections.add(current);
        }
        current = new Document();
        if (title == null && heading.getLevel() == 1) {
          title = renderer.render(heading).strip();
        }
      }
      node.unlink();
      current.appendChild(node);
      node = next;
    }
    if (current.getFirstChild() != null) {
      sections.add(current);
    }

    List<String> rendered = new ArrayList<>();
    for (Document section : sections) {
      String text = renderer.render(section).strip();
      if (!text.isEmpty()) {
        rendered.add(text);
      }
    }
    return new ExtractedText(
        String.join(ExtractedText.SECTION_SEPARATOR, rendered),
        DocumentMediaType.MARKDOWN,
        sections.size(),
        rendered.size(),
        emptyToNull(title));
  }

  private static @Nullable String emptyToNull(@Nullable String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
