package io.b2mash.b2b.gobdvault.retention;

import io.b2mash.b2b.gobdvault.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Deletion workflow of one expired document. A document only reaches {@link
 * DeletionReviewStatus#DELETED} after a named person confirmed it; transitions that skip a step
 * are rejected.
 */
@Entity
@Table(name = "deletion_reviews")
public class DeletionReview {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false, updatable = false, unique = true)
  private UUID documentId;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 100)
  private String tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private DeletionReviewStatus status;

  @Column(name = "marked_at", nullable = false, updatable = false)
  private Instant markedAt;

  @Column(name = "confirmed_by", length = 255)
  private String confirmedBy;

  @Column(name = "confirmed_at")
  private Instant confirmedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "reason", length = 1000)
  private String reason;

  protected DeletionReview() {}

  public DeletionReview(UUID documentId, String tenantId, Instant markedAt) {
    this.documentId = documentId;
    this.tenantId = tenantId;
    this.markedAt = markedAt;
    this.status = DeletionReviewStatus.PENDING_REVIEW;
  }

  public void confirm(String confirmedBy, String reason, Instant now) {
    requireStatus(DeletionReviewStatus.PENDING_REVIEW, DeletionReviewStatus.CONFIRMED);
    if (confirmedBy == null || confirmedBy.isBlank()) {
      throw new InvalidStateException(
          "Confirmation required", "Deletion of document " + documentId + " needs a confirmer");
    }
    this.status = DeletionReviewStatus.CONFIRMED;
    this.confirmedBy = confirmedBy;
    this.confirmedAt = now;
    this.reason = reason;
  }

  public void markDeleted(Instant now) {
    requireStatus(DeletionReviewStatus.CONFIRMED, DeletionReviewStatus.DELETED);
    this.status = DeletionReviewStatus.DELETED;
    this.deletedAt = now;
  }

  private void requireStatus(DeletionReviewStatus expected, DeletionReviewStatus target) {
    if (status != expected) {
      throw new InvalidStateException(
          "Invalid deletion review transition",
          "Cannot move review of document "
              + documentId
              + " from "
              + status
              + " to "
              + target);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public DeletionReviewStatus getStatus() {
    return status;
  }

  public Instant getMarkedAt() {
    return markedAt;
  }

  public String getConfirmedBy() {
    return confirmedBy;
  }

  public Instant getConfirmedAt() {
    return confirmedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public String getReason() {
    return reason;
  }
}
