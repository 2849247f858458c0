package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;

public record ComplianceStatistics(
    long totalAuditEntries,
    String latestChainHash,
    Instant oldestAuditEntry,
    Instant newestAuditEntry,
    long totalArchivedDocuments,
    long totalDocumentVersions,
    long documentsVerified,
    long documentsCorrupted,
    long documentsInRetention,
    long documentsExpiringSoon,
    long documentsOverdue) {}
