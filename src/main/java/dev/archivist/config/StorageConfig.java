package dev.archivist.config;

import dev.archivist.source.StorageProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.sns.SnsClient;

/**
 * Configures the AWS SDK clients for object storage and notifications.
 *
 * <p>Credentials come from the SDK's default provider chain. An endpoint override with path-style
 * access targets S3-compatible stores such as MinIO. Every API call is bounded by {@code
 * archivist.storage.timeout}.
 */
@Configuration
public class StorageConfig {

  @Bean(destroyMethod = "close")
  public S3Client s3Client(StorageProperties properties) {
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(properties.region()))
        .forcePathStyle(properties.pathStyleAccess())
        .overrideConfiguration(overrides(properties));
    if (properties.endpoint() != null) {
      builder.endpointOverride(properties.endpoint());
    }
    return builder.build();
  }

  /**
   * SNS client for run summary notifications, only created when a topic is configured.
   *
   * @see dev.archivist.notification.SnsNotificationSink
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "archivist.notification", name = "sns-topic-arn")
  public SnsClient snsClient(StorageProperties properties) {
    return SnsClient.builder()
        .region(Region.of(properties.region()))
        .overrideConfiguration(overrides(properties))
        .build();
  }

  private static ClientOverrideConfiguration overrides(StorageProperties properties) {
    return ClientOverrideConfiguration.builder()
        .apiCallTimeout(properties.timeout())
        .build();
  }
}
