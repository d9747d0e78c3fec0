package dev.archivist.extraction;

import dev.archivist.failure.ErrorClass;
import dev.archivist.failure.PermanentIndexingException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for PDF documents, backed by Apache PDFBox 3.x.
 *
 * <p>Text is extracted page by page; every page with text becomes one section. Pages without
 * text (scans, blank pages) are skipped. Password-protected and unreadable files are permanent
 * failures.
 */
@Component
public class PdfTextExtractor implements TextExtractor {

  private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

  @Override
  public boolean supports(DocumentMediaType mediaType) {
    return mediaType == DocumentMediaType.PDF;
  }

  @Override
  public ExtractedText extract(String documentKey, byte[] content) {
    try (PDDocument document = Loader.loadPDF(content)) {
      return extractPages(documentKey, document);
    } catch (InvalidPasswordException e) {
      throw new PermanentIndexingException(ErrorClass.EXTRACTION,
          "PDF is encrypted: " + documentKey, e);
    } catch (IOException e) {
      throw new PermanentIndexingException(ErrorClass.EXTRACTION,
          "Failed to parse PDF " + documentKey + ": " + e.getMessage(), e);
    }
  }

  private ExtractedText extractPages(String documentKey, PDDocument document) throws IOException {
    int pageCount = document.getNumberOfPages();
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);

    List<String> pages = new ArrayList<>();
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      String text = stripper.getText(document).strip();
      if (!text.isEmpty()) {
        pages.add(text);
      }
    }
    if (pages.isEmpty()) {
      log.warn("No extractable text in {} ({} pages)", documentKey, pageCount);
    } else {
      log.debug("Extracted {}/{} pages from {}", pages.size(), pageCount, documentKey);
    }
    return new ExtractedText(
        String.join(ExtractedText.SECTION_SEPARATOR, pages),
        DocumentMediaType.PDF,
        pageCount,
        pages.size(),
        title(document));
  }

  private static @Nullable String title(PDDocument document) {
    PDDocumentInformation information = document.getDocumentInformation();
    if (information == null) {
      return null;
    }
    String title = information.getTitle();
    return title == null || title.isBlank() ? null : title.strip();
  }
}
