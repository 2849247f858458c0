package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;
import java.util.Map;

/**
 * A stored auditor export package.
 *
 * @param storageKey object key of the ZIP
 * @param checksumKey object key of the {@code .sha256} file next to it
 * @param checksum SHA-256 hex of the ZIP bytes
 * @param manifest contents of {@code manifest.json}
 */
public record AuditorExportResult(
    String exportId,
    String tenantId,
    Instant generatedAt,
    Instant periodStart,
    Instant periodEnd,
    String storageKey,
    String checksumKey,
    String fileName,
    long fileSize,
    String checksum,
    String checksumAlgorithm,
    Map<String, Object> manifest,
    Instant expiresAt,
    int documentsIncluded,
    long auditEntriesIncluded) {}
