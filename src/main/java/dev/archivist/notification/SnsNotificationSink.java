package dev.archivist.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.outcome.RunStatus;
import dev.archivist.outcome.RunSummary;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;

/**
 * Publishes run summaries as JSON to an SNS topic. Active only when {@code
 * archivist.notification.sns-topic-arn} is set.
 */
@Component
@ConditionalOnProperty(prefix = "archivist.notification", name = "sns-topic-arn")
public class SnsNotificationSink implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(SnsNotificationSink.class);

  private static final int MAX_SUBJECT_LENGTH = 100;

  private final SnsClient sns;
  private final ObjectMapper objectMapper;
  private final String topicArn;

  public SnsNotificationSink(SnsClient sns, ObjectMapper objectMapper,
                             NotificationProperties properties) {
    this.sns = sns;
    this.objectMapper = objectMapper;
    this.topicArn = properties.snsTopicArn();
  }

  @Override
  public String name() {
    return "sns";
  }

  @Override
  public void runCompleted(RunSummary summary) {
    PublishRequest request = PublishRequest.builder()
        .topicArn(topicArn)
        .subject(subject(summary))
        .message(message(summary))
        .build();
    String messageId = sns.publish(request).messageId();
    log.debug("Published summary of run {} to SNS ({})", summary.runId(), messageId);
  }

  static String subject(RunSummary summary) {
    String subject = summary.status() == RunStatus.ABORTED
        ? "Document indexing run aborted"
        : "Document indexing run "
            + summary.status().name().toLowerCase(Locale.ROOT).replace('_', ' ')
            + ": " + summary.completed() + "/" + summary.totalDocuments() + " indexed";
    return subject.length() > MAX_SUBJECT_LENGTH
        ? subject.substring(0, MAX_SUBJECT_LENGTH)
        : subject;
  }

  private String message(RunSummary summary) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("runId", summary.runId());
    body.put("status", summary.status());
    body.put("startedAt", summary.startedAt().toString());
    body.put("finishedAt", summary.finishedAt().toString());
    body.put("totalDocuments", summary.totalDocuments());
    body.put("completed", summary.completed());
    body.put("failed", summary.failed());
    body.put("skipped", summary.skipped());
    body.put("totalChunks", summary.totalChunks());
    body.put("vectorsStored", summary.vectorsStored());
    body.put("successRate", summary.successRate());
    body.put("failures", summary.failures().stream()
        .map(f -> Map.of(
            "documentKey", f.documentKey(),
            "errorClass", f.errorClass().value(),
            "attempts", f.attempts(),
            "message", f.message()))
        .toList());
    if (summary.abortReason() != null) {
      body.put("abortReason", summary.abortReason());
    }
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialise run summary " + summary.runId(), e);
    }
  }
}
