package dev.archivist.ingestion.store;

import java.util.List;

/**
 * Per-record outcome of a write.
 *
 * @param written identifiers of records stored
 * @param rejected records refused, each with its reason
 */
public record WriteResult(List<String> written, List<RecordRejection> rejected) {

  public WriteResult {
    written = List.copyOf(written);
    rejected = List.copyOf(rejected);
  }

  public boolean hasRejections() {
    return !rejected.isEmpty();
  }
}
