package dev.archivist.ingestion.store;

/**
 * A record refused by the {@link VectorWriter} before it reached the store.
 *
 * @param recordId identifier of the refused record
 * @param reason why it was refused
 */
public record RecordRejection(String recordId, String reason) {}
