package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;

/** Lightweight status computed from the critical checks only. */
public record ComplianceStatus(
    String tenantId,
    OverallStatus overallStatus,
    int complianceScore,
    Instant lastCheckDate,
    long criticalIssues,
    long highIssues,
    long mediumIssues,
    long lowIssues,
    boolean certificationReady) {

  public enum OverallStatus {
    COMPLIANT,
    WARNING,
    NON_COMPLIANT
  }
}
