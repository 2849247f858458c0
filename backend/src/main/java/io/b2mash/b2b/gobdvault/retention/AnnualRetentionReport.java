package io.b2mash.b2b.gobdvault.retention;

import java.time.Instant;
import java.util.Map;

/**
 * Retention activity of one calendar year (UTC). Deletions and freed storage are taken from the
 * ledger's per-document DELETE entries.
 */
public record AnnualRetentionReport(
    String tenantId,
    int year,
    Instant generatedAt,
    Instant periodStart,
    Instant periodEnd,
    long documentsArchived,
    long documentsDeleted,
    long documentsOnHold,
    long totalStorageUsed,
    long storageFreed,
    Map<RetentionCategory, CategoryYear> byCategory,
    HoldStatistics legalHolds) {

  /**
   * @param active documents of the category that are ACTIVE now
   * @param averageRetentionDays mean age in days of those active documents
   */
  public record CategoryYear(long archived, long deleted, long active, long averageRetentionDays) {}

  /** Holds placed during the year. */
  public record HoldStatistics(long total, long active, long released, long averageDurationDays) {}
}
