package dev.archivist.notification;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Notification settings ({@code archivist.notification.*}).
 *
 * @param snsTopicArn topic run summaries are published to; SNS publishing is off when unset
 * @param historyEnabled whether run summaries are persisted
 * @param drainTimeout how long shutdown waits for pending notifications
 */
@ConfigurationProperties(prefix = "archivist.notification")
public record NotificationProperties(
    @Nullable String snsTopicArn,
    @DefaultValue("true") boolean historyEnabled,
    @DefaultValue("30s") Duration drainTimeout) {}
