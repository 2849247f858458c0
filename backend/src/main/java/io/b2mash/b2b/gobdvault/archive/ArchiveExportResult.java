package io.b2mash.b2b.gobdvault.archive;

import java.time.Instant;

/**
 * @param storageKey key of the ZIP bundle in object storage
 * @param checksum SHA-256 hex of the bundle bytes
 */
public record ArchiveExportResult(
    String exportId,
    String tenantId,
    String storageKey,
    long fileSizeBytes,
    int documentCount,
    long totalVersions,
    String checksum,
    Instant exportedAt,
    Instant expiresAt) {}
