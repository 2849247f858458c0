package io.b2mash.b2b.gobdvault.audit;

import java.util.Map;

/**
 * Non-JPA DTO passed to {@link HashChainService#createEntry(AuditEntryRecord)}. Constructed by
 * {@link AuditEntryBuilder}.
 *
 * @param tenantId owning tenant; each tenant has its own chain
 * @param entityType the kind of entity being audited (e.g. "DOCUMENT", "RETENTION_HOLD")
 * @param entityId ID of the affected entity (not a FK, the entity may be deleted later)
 * @param action what happened
 * @param actorType USER or SYSTEM
 * @param actorId acting user; null for system-initiated entries
 * @param previousState snapshot before the change; metadata only, never document content
 * @param newState snapshot after the change; metadata only, never document content
 * @param metadata operation details
 */
public record AuditEntryRecord(
    String tenantId,
    String entityType,
    String entityId,
    AuditAction action,
    AuditActorType actorType,
    String actorId,
    Map<String, Object> previousState,
    Map<String, Object> newState,
    Map<String, Object> metadata) {}
