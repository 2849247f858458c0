package io.b2mash.b2b.gobdvault.retention;

import java.time.Instant;
import java.util.UUID;

/**
 * An ACTIVE document whose retention period has ended.
 *
 * @param legalHoldReason reason of the active hold, null without one
 * @param canDelete no active hold and the grace period has passed
 */
public record ExpiredDocument(
    UUID id,
    String tenantId,
    String originalFilename,
    RetentionCategory retentionCategory,
    Instant retentionEndDate,
    long daysOverdue,
    boolean hasLegalHold,
    String legalHoldReason,
    String entityType,
    String entityId,
    Instant archivedAt,
    Instant lastAccessedAt,
    long fileSizeBytes,
    Instant gracePeriodEndsAt,
    boolean canDelete) {}
