package io.b2mash.b2b.gobdvault.audit;

import java.time.Instant;

/**
 * Query filter for ledger entries of one tenant. All fields except {@code tenantId} are optional;
 * null means "no filter on this field".
 *
 * @param tenantId owning tenant (required)
 * @param entityType exact match on entity type
 * @param entityId exact match on entity ID
 * @param action exact match on action
 * @param actorId exact match on actor ID
 * @param from inclusive lower bound on timestamp
 * @param to exclusive upper bound on timestamp
 */
public record AuditEntryFilter(
    String tenantId,
    String entityType,
    String entityId,
    AuditAction action,
    String actorId,
    Instant from,
    Instant to) {

  public static AuditEntryFilter forTenant(String tenantId) {
    return new AuditEntryFilter(tenantId, null, null, null, null, null, null);
  }

  public static AuditEntryFilter forPeriod(String tenantId, Instant from, Instant to) {
    return new AuditEntryFilter(tenantId, null, null, null, null, from, to);
  }
}
