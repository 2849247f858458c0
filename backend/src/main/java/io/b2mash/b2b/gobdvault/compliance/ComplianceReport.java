package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;
import java.util.List;

/**
 * Machine-readable GoBD compliance report of one tenant and period.
 *
 * @param periodEnd exclusive end of the reporting period
 */
public record ComplianceReport(
    String reportId,
    String tenantId,
    Instant reportDate,
    Instant periodStart,
    Instant periodEnd,
    int complianceScore,
    List<ComplianceCheck> checks,
    List<ComplianceIssue> issues,
    List<String> recommendations,
    boolean certificationReady,
    ComplianceStatistics statistics) {}
