package dev.archivist.source;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.MetadataDirective;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * {@link ObjectStore} backed by an S3 (or S3-compatible) bucket via the AWS SDK v2.
 *
 * <p>Listing calls retry on any SDK failure with exponential backoff; payload, copy and delete
 * calls are retried by the pipeline under its own policy.
 */
@Component
public class S3ObjectStore implements ObjectStore {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

  private final S3Client s3;
  private final String bucket;

  public S3ObjectStore(S3Client s3, StorageProperties properties) {
    this.s3 = s3;
    this.bucket = properties.bucket();
  }

  @Override
  @Retryable(
      retryFor = SdkException.class,
      maxAttemptsExpression = "${archivist.storage.listing-retry.max-attempts:3}",
      backoff = @Backoff(
          delayExpression = "${archivist.storage.listing-retry.delay-ms:500}",
          multiplierExpression = "${archivist.storage.listing-retry.multiplier:2.0}"))
  public List<StoredObject> list(String prefix) {
    ListObjectsV2Request request = ListObjectsV2Request.builder()
        .bucket(bucket)
        .prefix(prefix)
        .build();
    List<StoredObject> objects = s3.listObjectsV2Paginator(request).contents().stream()
        .map(o -> new StoredObject(o.key(), o.size(), unquote(o.eTag()), o.lastModified()))
        .toList();
    log.debug("Listed {} objects under s3://{}/{}", objects.size(), bucket, prefix);
    return objects;
  }

  @Override
  public byte[] get(String key) {
    return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
        .asByteArray();
  }

  @Override
  @Retryable(
      retryFor = SdkException.class,
      maxAttemptsExpression = "${archivist.storage.listing-retry.max-attempts:3}",
      backoff = @Backoff(
          delayExpression = "${archivist.storage.listing-retry.delay-ms:500}",
          multiplierExpression = "${archivist.storage.listing-retry.multiplier:2.0}"))
  public Optional<Map<String, String>> metadata(String key) {
    try {
      return Optional.of(
          s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build()).metadata());
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public void copy(String sourceKey, String targetKey, Map<String, String> metadata) {
    s3.copyObject(CopyObjectRequest.builder()
        .sourceBucket(bucket)
        .sourceKey(sourceKey)
        .destinationBucket(bucket)
        .destinationKey(targetKey)
        .metadata(metadata)
        .metadataDirective(MetadataDirective.REPLACE)
        .build());
  }

  @Override
  public void delete(String key) {
    s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
  }

  static String unquote(@Nullable String eTag) {
    if (eTag == null) {
      return "";
    }
    return eTag.replace("\"", "");
  }
}
