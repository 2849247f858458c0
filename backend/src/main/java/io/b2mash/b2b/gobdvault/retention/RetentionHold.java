package io.b2mash.b2b.gobdvault.retention;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Legal hold blocking deletion of a document regardless of retention expiry. A hold is active while
 * {@code releasedAt} is null; a partial unique index allows one active hold per document.
 */
@Entity
@Table(name = "retention_holds")
public class RetentionHold {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false, updatable = false)
  private UUID documentId;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 100)
  private String tenantId;

  @Column(name = "reason", nullable = false, updatable = false, length = 1000)
  private String reason;

  @Column(name = "placed_by", nullable = false, updatable = false, length = 255)
  private String placedBy;

  @Column(name = "placed_at", nullable = false, updatable = false)
  private Instant placedAt;

  @Column(name = "released_at")
  private Instant releasedAt;

  @Column(name = "released_by", length = 255)
  private String releasedBy;

  protected RetentionHold() {}

  public RetentionHold(
      UUID documentId, String tenantId, String reason, String placedBy, Instant placedAt) {
    this.documentId = documentId;
    this.tenantId = tenantId;
    this.reason = reason;
    this.placedBy = placedBy;
    this.placedAt = placedAt;
  }

  public void release(String releasedBy, Instant now) {
    if (releasedAt != null) {
      throw new IllegalStateException("Hold " + id + " is already released");
    }
    this.releasedBy = releasedBy;
    this.releasedAt = now;
  }

  public boolean isActive() {
    return releasedAt == null;
  }

  /** Whole days the hold was in place; null while active. */
  public Long durationDays() {
    return releasedAt == null ? null : Duration.between(placedAt, releasedAt).toDays();
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

  public String getReason() {
    return reason;
  }

  public String getPlacedBy() {
    return placedBy;
  }

  public Instant getPlacedAt() {
    return placedAt;
  }

  public Instant getReleasedAt() {
    return releasedAt;
  }

  public String getReleasedBy() {
    return releasedBy;
  }
}
