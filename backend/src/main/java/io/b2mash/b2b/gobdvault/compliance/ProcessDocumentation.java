package io.b2mash.b2b.gobdvault.compliance;

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
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One version of a tenant's process documentation (Verfahrensdokumentation). Versions are never
 * edited once superseded: a new version archives its predecessor.
 */
@Entity
@Table(name = "process_documentations")
public class ProcessDocumentation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 100)
  private String tenantId;

  @Column(name = "version", nullable = false, updatable = false)
  private int version;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProcessDocumentationStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "content", columnDefinition = "jsonb", nullable = false, updatable = false)
  private Map<String, Object> content;

  @Column(name = "created_by", length = 255)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "approved_by", length = 255)
  private String approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  protected ProcessDocumentation() {}

  public ProcessDocumentation(
      String tenantId,
      int version,
      Map<String, Object> content,
      String createdBy,
      Instant createdAt) {
    this.tenantId = tenantId;
    this.version = version;
    this.content = content;
    this.createdBy = createdBy;
    this.createdAt = createdAt;
    this.status = ProcessDocumentationStatus.DRAFT;
  }

  public void approve(String approvedBy, Instant now) {
    if (status != ProcessDocumentationStatus.DRAFT) {
      throw new InvalidStateException(
          "Invalid process documentation state",
          "Cannot approve version " + version + " in status " + status);
    }
    this.status = ProcessDocumentationStatus.APPROVED;
    this.approvedBy = approvedBy;
    this.approvedAt = now;
  }

  public void archive() {
    this.status = ProcessDocumentationStatus.ARCHIVED;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public int getVersion() {
    return version;
  }

  public ProcessDocumentationStatus getStatus() {
    return status;
  }

  public Map<String, Object> getContent() {
    return content;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getApprovedBy() {
    return approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }
}
