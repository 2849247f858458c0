package io.b2mash.b2b.gobdvault.audit;

import java.util.Map;
import java.util.Objects;

/**
 * Builder that constructs an {@link AuditEntryRecord}.
 *
 * <p>Required fields: {@code tenantId}, {@code entityType}, {@code entityId}, {@code action}. If
 * no actor is given the entry is attributed to {@link AuditActorType#SYSTEM}; setting an {@code
 * actorId} without an explicit type attributes it to {@link AuditActorType#USER}.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEntryRecord record = AuditEntryBuilder.builder()
 *     .tenantId(tenantId)
 *     .entityType(AuditEntityTypes.DOCUMENT)
 *     .entityId(document.getId())
 *     .action(AuditAction.CREATE)
 *     .actorId(uploadedBy)
 *     .newState(Map.of("filename", document.getOriginalFilename()))
 *     .build();
 * }</pre>
 */
public class AuditEntryBuilder {

  private String tenantId;
  private String entityType;
  private String entityId;
  private AuditAction action;
  private AuditActorType actorType;
  private String actorId;
  private Map<String, Object> previousState;
  private Map<String, Object> newState;
  private Map<String, Object> metadata;

  private AuditEntryBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEntryBuilder builder() {
    return new AuditEntryBuilder();
  }

  public AuditEntryBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public AuditEntryBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEntryBuilder entityId(Object entityId) {
    this.entityId = entityId != null ? entityId.toString() : null;
    return this;
  }

  public AuditEntryBuilder action(AuditAction action) {
    this.action = action;
    return this;
  }

  public AuditEntryBuilder actorType(AuditActorType actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEntryBuilder actorId(String actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEntryBuilder previousState(Map<String, Object> previousState) {
    this.previousState = previousState;
    return this;
  }

  public AuditEntryBuilder newState(Map<String, Object> newState) {
    this.newState = newState;
    return this;
  }

  public AuditEntryBuilder metadata(Map<String, Object> metadata) {
    this.metadata = metadata;
    return this;
  }

  public AuditEntryRecord build() {
    Objects.requireNonNull(tenantId, "tenantId is required");
    Objects.requireNonNull(entityType, "entityType is required");
    Objects.requireNonNull(entityId, "entityId is required");
    Objects.requireNonNull(action, "action is required");

    AuditActorType resolvedActorType = actorType;
    if (resolvedActorType == null) {
      resolvedActorType = actorId != null ? AuditActorType.USER : AuditActorType.SYSTEM;
    }

    return new AuditEntryRecord(
        tenantId,
        entityType,
        entityId,
        action,
        resolvedActorType,
        actorId,
        previousState,
        newState,
        metadata);
  }
}
