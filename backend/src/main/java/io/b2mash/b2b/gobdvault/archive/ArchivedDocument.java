package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Catalog row of an encrypted, content-addressed document. The ciphertext lives in object storage
 * under {@link #getStoragePath()}; this row carries the IV and GCM tag needed to open it. Rows are
 * never hard-deleted: retention sets the status to {@link ArchiveStatus#DELETED}.
 */
@Entity
@Table(name = "archived_documents")
public class ArchivedDocument {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 100)
  private String tenantId;

  @Column(name = "original_filename", nullable = false, length = 500)
  private String originalFilename;

  @Column(name = "mime_type", nullable = false, length = 255)
  private String mimeType;

  @Column(name = "file_size_bytes", nullable = false, updatable = false)
  private long fileSizeBytes;

  @Column(name = "content_hash", nullable = false, updatable = false, unique = true, length = 64)
  private String contentHash;

  @Column(name = "storage_path", nullable = false, updatable = false, length = 1000)
  private String storagePath;

  @Column(name = "encryption_iv", nullable = false, updatable = false)
  private byte[] encryptionIv;

  @Column(name = "encryption_tag", nullable = false, updatable = false)
  private byte[] encryptionTag;

  @Enumerated(EnumType.STRING)
  @Column(name = "key_scheme", nullable = false, updatable = false, length = 20)
  private KeyScheme keyScheme;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ArchiveStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "retention_category", nullable = false, updatable = false, length = 30)
  private RetentionCategory retentionCategory;

  @Column(name = "retention_end_date", nullable = false, updatable = false)
  private Instant retentionEndDate;

  @Column(name = "entity_type", length = 50)
  private String entityType;

  @Column(name = "entity_id", length = 255)
  private String entityId;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "archived_document_tags",
      joinColumns = @JoinColumn(name = "document_id"))
  @Column(name = "tag", nullable = false, length = 100)
  private Set<String> tags = new LinkedHashSet<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private Map<String, Object> metadata;

  @Column(name = "uploaded_by", length = 255)
  private String uploadedBy;

  @Column(name = "archived_at", nullable = false, updatable = false)
  private Instant archivedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "last_accessed_at")
  private Instant lastAccessedAt;

  @Column(name = "last_verified_at")
  private Instant lastVerifiedAt;

  @Column(name = "verification_result", length = 50)
  private String verificationResult;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected ArchivedDocument() {}

  public ArchivedDocument(
      String tenantId,
      String originalFilename,
      String mimeType,
      long fileSizeBytes,
      String contentHash,
      String storagePath,
      byte[] encryptionIv,
      byte[] encryptionTag,
      KeyScheme keyScheme,
      RetentionCategory retentionCategory,
      Instant archivedAt,
      Instant retentionEndDate) {
    this.tenantId = tenantId;
    this.originalFilename = originalFilename;
    this.mimeType = mimeType;
    this.fileSizeBytes = fileSizeBytes;
    this.contentHash = contentHash;
    this.storagePath = storagePath;
    this.encryptionIv = encryptionIv.clone();
    this.encryptionTag = encryptionTag.clone();
    this.keyScheme = keyScheme;
    this.retentionCategory = retentionCategory;
    this.archivedAt = archivedAt;
    this.retentionEndDate = retentionEndDate;
    this.updatedAt = archivedAt;
    this.status = ArchiveStatus.ACTIVE;
  }

  public void linkEntity(String entityType, String entityId) {
    this.entityType = entityType;
    this.entityId = entityId;
  }

  public void uploadedBy(String uploadedBy) {
    this.uploadedBy = uploadedBy;
  }

  /** Replaces tags and metadata when the given values are non-null. */
  public void updateDescriptors(Set<String> tags, Map<String, Object> metadata, Instant now) {
    if (tags != null) {
      this.tags.clear();
      this.tags.addAll(tags);
    }
    if (metadata != null) {
      this.metadata = new LinkedHashMap<>(metadata);
    }
    this.updatedAt = now;
  }

  public void recordAccess(Instant now) {
    this.lastAccessedAt = now;
  }

  public void markVerified(Instant now) {
    this.lastVerifiedAt = now;
    this.verificationResult = "VALID";
  }

  public void markCorrupted(CorruptionType type, Instant now) {
    this.status = ArchiveStatus.CORRUPTED;
    this.lastVerifiedAt = now;
    this.verificationResult = type.verificationResult();
    this.updatedAt = now;
  }

  public void markDeleted(Instant now) {
    this.status = ArchiveStatus.DELETED;
    this.deletedAt = now;
    this.updatedAt = now;
  }

  public boolean isActive() {
    return status == ArchiveStatus.ACTIVE;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getOriginalFilename() {
    return originalFilename;
  }

  public String getMimeType() {
    return mimeType;
  }

  public long getFileSizeBytes() {
    return fileSizeBytes;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getStoragePath() {
    return storagePath;
  }

  public byte[] getEncryptionIv() {
    return encryptionIv.clone();
  }

  public byte[] getEncryptionTag() {
    return encryptionTag.clone();
  }

  public KeyScheme getKeyScheme() {
    return keyScheme;
  }

  public ArchiveStatus getStatus() {
    return status;
  }

  public RetentionCategory getRetentionCategory() {
    return retentionCategory;
  }

  public Instant getRetentionEndDate() {
    return retentionEndDate;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public Set<String> getTags() {
    return tags;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public String getUploadedBy() {
    return uploadedBy;
  }

  public Instant getArchivedAt() {
    return archivedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getLastAccessedAt() {
    return lastAccessedAt;
  }

  public Instant getLastVerifiedAt() {
    return lastVerifiedAt;
  }

  public String getVerificationResult() {
    return verificationResult;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
