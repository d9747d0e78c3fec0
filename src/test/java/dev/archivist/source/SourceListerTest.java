package dev.archivist.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.archivist.failure.ListingException;
import dev.archivist.fixture.InMemoryObjectStore;
import dev.archivist.fixture.TestProperties;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;

class SourceListerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

  private InMemoryObjectStore store;
  private SourceLister lister;

  @BeforeEach
  void setUp() {
    store = new InMemoryObjectStore();
    lister = new SourceLister(store, TestProperties.storage(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void listsPendingDocumentsInKeyOrder() {
    store.put("source/b.txt", "beta")
        .put("source/a.pdf", "alpha")
        .put("source/reports/", "")
        .put("source/reports/q3.md", "# Q3");

    ListingResult result = lister.list();

    assertThat(result.pending()).extracting(DocumentDescriptor::key)
        .containsExactly("source/a.pdf", "source/b.txt", "source/reports/q3.md");
    assertThat(result.sourceObjects()).isEqualTo(3);
    assertThat(result.interrupted()).isEmpty();
    DocumentDescriptor first = result.pending().get(0);
    assertThat(first.size()).isEqualTo(5);
    assertThat(first.fingerprint()).isEqualTo(store.fingerprint("source/a.pdf"));
    assertThat(first.discoveredAt()).isEqualTo(NOW);
  }

  @Test
  void emptySourceYieldsEmptyWorkSet() {
    assertThat(lister.list().pending()).isEmpty();
  }

  @Test
  void processedCopyWithCurrentFingerprintIsReportedInterrupted() {
    store.put("source/a.txt", "alpha");
    store.put("processed/a.txt", "alpha".getBytes(StandardCharsets.UTF_8),
        Map.of(SourceLister.FINGERPRINT_METADATA, store.fingerprint("source/a.txt")));

    ListingResult result = lister.list();

    assertThat(result.pending()).isEmpty();
    assertThat(result.interrupted()).extracting(DocumentDescriptor::key)
        .containsExactly("source/a.txt");
  }

  @Test
  void reuploadedDocumentWithNewContentIsPendingAgain() {
    store.put("source/a.txt", "alpha v2");
    store.put("processed/a.txt", "alpha".getBytes(StandardCharsets.UTF_8),
        Map.of(SourceLister.FINGERPRINT_METADATA, "fingerprint-of-v1"));

    ListingResult result = lister.list();

    assertThat(result.pending()).extracting(DocumentDescriptor::key)
        .containsExactly("source/a.txt");
    assertThat(result.interrupted()).isEmpty();
  }

  @Test
  void excludedExtensionsAreIgnored() {
    StorageProperties pdfOnly = new StorageProperties("test-bucket", "source/", "processed/",
        null, "us-east-1", false, List.of(".PDF"), Duration.ofSeconds(5),
        new StorageProperties.ListingRetry(1, 1, 1.0));
    SourceLister filtering = new SourceLister(store, pdfOnly, Clock.systemUTC());
    store.put("source/a.pdf", "alpha").put("source/b.docx", "beta");

    ListingResult result = filtering.list();

    assertThat(result.pending()).extracting(DocumentDescriptor::key)
        .containsExactly("source/a.pdf");
    assertThat(result.ignored()).isEqualTo(1);
  }

  @Test
  void storeFailureSurfacesAsListingException() {
    store.failListing(SdkClientException.create("Unable to execute HTTP request"));

    assertThatThrownBy(() -> lister.list())
        .isInstanceOf(ListingException.class)
        .hasMessageContaining("s3://test-bucket/source/")
        .hasCauseInstanceOf(SdkClientException.class);
  }

  @Test
  void nestedPrefixesAreRejected() {
    assertThatThrownBy(() -> new StorageProperties("bucket", "docs/", "docs/processed/", null,
        "us-east-1", false, List.of(), Duration.ofSeconds(5),
        new StorageProperties.ListingRetry(1, 1, 1.0)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void processedKeyKeepsRelativePath() {
    assertThat(TestProperties.storage().processedKeyFor("source/reports/q3.pdf"))
        .isEqualTo("processed/reports/q3.pdf");
  }
}
