package dev.archivist.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/** A failed document of a persisted run. Maps to {@code indexing_run_failures}. */
@Embeddable
public class IndexingRunFailure {

  @Column(name = "document_key", nullable = false, length = 1024)
  private String documentKey;

  @Column(name = "error_class", nullable = false)
  private String errorClass;

  @Column(name = "message", columnDefinition = "text")
  private String message;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  protected IndexingRunFailure() {
    // JPA requires no-arg constructor
  }

  public IndexingRunFailure(String documentKey, String errorClass, String message, int attempts) {
    this.documentKey = documentKey;
    this.errorClass = errorClass;
    this.message = message;
    this.attempts = attempts;
  }

  public String getDocumentKey() {
    return documentKey;
  }

  public String getErrorClass() {
    return errorClass;
  }

  public String getMessage() {
    return message;
  }

  public int getAttempts() {
    return attempts;
  }
}
