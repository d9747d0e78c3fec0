package dev.archivist.source;

import java.util.List;

/**
 * Outcome of enumerating the source prefix.
 *
 * @param pending documents to process this run, in key order, without duplicates
 * @param interrupted documents already copied to the processed prefix with their current
 *     fingerprint but still present at the source; only the source delete is outstanding
 * @param sourceObjects objects seen under the source prefix, directory markers excluded
 * @param ignored objects skipped because their extension is not included
 */
public record ListingResult(
    List<DocumentDescriptor> pending,
    List<DocumentDescriptor> interrupted,
    int sourceObjects,
    int ignored) {

  public ListingResult {
    pending = List.copyOf(pending);
    interrupted = List.copyOf(interrupted);
  }
}
