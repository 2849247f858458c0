package io.b2mash.b2b.gobdvault.audit;

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
 * Immutable, hash-chained ledger entry persisted to {@code audit_entries}. Once created an entry
 * cannot be updated or deleted (enforced by a database trigger). There are no setters; every
 * column is {@code updatable = false}.
 *
 * <p>{@link #getHash()} is {@code SHA-256(previousHash || canonical(entry without hash))}, see
 * {@link ChainHasher}. The first entry of a tenant links to the tenant's genesis hash.
 *
 * @see AuditEntryRecord
 */
@Entity
@Table(name = "audit_entries")
public class AuditEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 100)
  private String tenantId;

  @Column(name = "entity_type", nullable = false, updatable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false, updatable = false, length = 255)
  private String entityId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, updatable = false, length = 20)
  private AuditAction action;

  @Enumerated(EnumType.STRING)
  @Column(name = "actor_type", nullable = false, updatable = false, length = 20)
  private AuditActorType actorType;

  @Column(name = "actor_id", updatable = false, length = 255)
  private String actorId;

  @Column(name = "timestamp", nullable = false, updatable = false)
  private Instant timestamp;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "previous_state", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> previousState;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "new_state", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> newState;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> metadata;

  @Column(name = "sequence", nullable = false, updatable = false)
  private long sequence;

  @Column(name = "hash", nullable = false, updatable = false, length = 64)
  private String hash;

  @Column(name = "previous_hash", nullable = false, updatable = false, length = 64)
  private String previousHash;

  /** Protected no-arg constructor required by JPA. */
  protected AuditEntry() {}

  /**
   * Creates a chained entry. The caller is responsible for having computed {@code hash} over
   * exactly these field values.
   */
  AuditEntry(
      AuditEntryRecord record,
      Instant timestamp,
      long sequence,
      String previousHash,
      String hash) {
    this.tenantId = record.tenantId();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.action = record.action();
    this.actorType = record.actorType();
    this.actorId = record.actorId();
    this.previousState = record.previousState();
    this.newState = record.newState();
    this.metadata = record.metadata();
    this.timestamp = timestamp;
    this.sequence = sequence;
    this.previousHash = previousHash;
    this.hash = hash;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public AuditAction getAction() {
    return action;
  }

  public AuditActorType getActorType() {
    return actorType;
  }

  public String getActorId() {
    return actorId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public Map<String, Object> getPreviousState() {
    return previousState;
  }

  public Map<String, Object> getNewState() {
    return newState;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public long getSequence() {
    return sequence;
  }

  public String getHash() {
    return hash;
  }

  public String getPreviousHash() {
    return previousHash;
  }
}
