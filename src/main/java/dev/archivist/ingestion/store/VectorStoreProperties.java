package dev.archivist.ingestion.store;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Vector store settings ({@code archivist.vector.*}).
 *
 * @param collection collection documents are indexed into
 * @param dimension dimension every stored vector must have
 * @param batchSize records per upsert call
 * @param rejectedRecords what a document run does when some of its records are rejected
 */
@Validated
@ConfigurationProperties(prefix = "archivist.vector")
public record VectorStoreProperties(
    @DefaultValue("enterprise_knowledge_base") @Pattern(regexp = VectorCollections.NAME_PATTERN)
        String collection,
    @DefaultValue("1536") @Min(1) @Max(16000) int dimension,
    @DefaultValue("50") @Min(1) int batchSize,
    @DefaultValue("FAIL_DOCUMENT") @NotNull RejectionPolicy rejectedRecords) {

  public enum RejectionPolicy {
    /** Any rejected record fails the whole document. */
    FAIL_DOCUMENT,
    /** Rejected records are dropped and logged; the document succeeds with the rest. */
    SKIP_RECORDS
  }
}
