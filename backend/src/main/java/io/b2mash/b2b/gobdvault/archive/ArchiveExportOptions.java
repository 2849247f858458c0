package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import java.time.Instant;
import java.util.Set;

/**
 * @param retentionCategories restrict to these categories; null or empty means all
 * @param archivedFrom inclusive lower bound on archivedAt
 * @param archivedTo exclusive upper bound on archivedAt
 * @param requestedBy user requesting the export
 */
public record ArchiveExportOptions(
    Set<RetentionCategory> retentionCategories,
    Instant archivedFrom,
    Instant archivedTo,
    String requestedBy) {

  public static ArchiveExportOptions all(String requestedBy) {
    return new ArchiveExportOptions(null, null, null, requestedBy);
  }

  boolean includes(ArchivedDocument document) {
    if (retentionCategories != null
        && !retentionCategories.isEmpty()
        && !retentionCategories.contains(document.getRetentionCategory())) {
      return false;
    }
    if (archivedFrom != null && document.getArchivedAt().isBefore(archivedFrom)) {
      return false;
    }
    return archivedTo == null || document.getArchivedAt().isBefore(archivedTo);
  }
}
