package dev.archivist.source;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal object storage contract used by the pipeline.
 *
 * <p>Implementations throw their client's native exceptions; callers classify them.
 */
public interface ObjectStore {

  /** All objects whose key starts with {@code prefix}, in key order. */
  List<StoredObject> list(String prefix);

  /** Full payload of the object at {@code key}. */
  byte[] get(String key);

  /** User metadata of the object at {@code key}, or empty if no such object exists. */
  Optional<Map<String, String>> metadata(String key);

  /** Copy {@code sourceKey} to {@code targetKey}, replacing the target's metadata. */
  void copy(String sourceKey, String targetKey, Map<String, String> metadata);

  /** Delete {@code key}. Deleting a missing object is not an error. */
  void delete(String key);
}
