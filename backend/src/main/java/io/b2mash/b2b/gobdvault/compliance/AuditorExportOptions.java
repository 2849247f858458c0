package io.b2mash.b2b.gobdvault.compliance;

import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * What goes into an auditor export package.
 *
 * @param periodStart inclusive start of the audited period
 * @param periodEnd exclusive end of the audited period
 * @param includeDocumentContent add decrypted document content under {@code documents/}; the
 *     inventory is included with {@code includeDocuments} alone
 * @param retentionCategories restrict documents to these categories; null or empty means all
 */
public record AuditorExportOptions(
    Instant periodStart,
    Instant periodEnd,
    boolean includeAuditLog,
    boolean includeDocuments,
    boolean includeDocumentContent,
    boolean includeProcessDocs,
    boolean includeSystemConfig,
    Set<RetentionCategory> retentionCategories,
    String requestedBy) {

  public AuditorExportOptions {
    Objects.requireNonNull(periodStart, "periodStart is required");
    Objects.requireNonNull(periodEnd, "periodEnd is required");
    retentionCategories = retentionCategories == null ? Set.of() : Set.copyOf(retentionCategories);
  }

  /** Everything except decrypted document content. */
  public static AuditorExportOptions standard(
      Instant periodStart, Instant periodEnd, String requestedBy) {
    return new AuditorExportOptions(
        periodStart, periodEnd, true, true, false, true, true, null, requestedBy);
  }

  boolean includesCategory(RetentionCategory category) {
    return retentionCategories.isEmpty() || retentionCategories.contains(category);
  }
}
