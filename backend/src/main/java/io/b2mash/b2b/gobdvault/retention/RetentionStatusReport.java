package io.b2mash.b2b.gobdvault.retention;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Retention inventory of one tenant. Deleted documents are only counted in {@link
 * Summary#deletedDocuments()}; every other bucket covers catalog rows that still exist.
 */
public record RetentionStatusReport(
    String tenantId,
    Instant generatedAt,
    Summary summary,
    Map<RetentionCategory, CategoryStats> byCategory,
    boolean compliant,
    List<String> issues,
    List<String> warnings) {

  public record Summary(
      long totalDocuments,
      long activeDocuments,
      long expiredDocuments,
      long documentsOnHold,
      long documentsInGracePeriod,
      long documentsNearingExpiration,
      long corruptedDocuments,
      long deletedDocuments,
      long pendingDeletionReview) {}

  /**
   * @param active retention not yet ended
   * @param expired retention ended, in or past the grace period
   */
  public record CategoryStats(
      long total,
      long active,
      long expired,
      long onHold,
      long nearingExpiration,
      long inGracePeriod) {}
}
