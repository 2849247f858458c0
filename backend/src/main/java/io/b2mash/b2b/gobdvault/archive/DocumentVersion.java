package io.b2mash.b2b.gobdvault.archive;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Append-only record of a document being archived again with identical content. */
@Entity
@Table(name = "document_versions")
public class DocumentVersion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false, updatable = false)
  private UUID documentId;

  @Column(name = "version", nullable = false, updatable = false)
  private int version;

  @Column(name = "change_reason", updatable = false, length = 500)
  private String changeReason;

  @Column(name = "previous_hash", nullable = false, updatable = false, length = 64)
  private String previousHash;

  @Column(name = "content_hash", nullable = false, updatable = false, length = 64)
  private String contentHash;

  @Column(name = "archived_by", updatable = false, length = 255)
  private String archivedBy;

  @Column(name = "retention_date", nullable = false, updatable = false)
  private Instant retentionDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DocumentVersion() {}

  public DocumentVersion(
      UUID documentId,
      int version,
      String changeReason,
      String previousHash,
      String contentHash,
      String archivedBy,
      Instant retentionDate,
      Instant createdAt) {
    this.documentId = documentId;
    this.version = version;
    this.changeReason = changeReason;
    this.previousHash = previousHash;
    this.contentHash = contentHash;
    this.archivedBy = archivedBy;
    this.retentionDate = retentionDate;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public int getVersion() {
    return version;
  }

  public String getChangeReason() {
    return changeReason;
  }

  public String getPreviousHash() {
    return previousHash;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getArchivedBy() {
    return archivedBy;
  }

  public Instant getRetentionDate() {
    return retentionDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
