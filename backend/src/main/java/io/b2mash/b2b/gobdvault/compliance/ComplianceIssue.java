package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;
import java.util.List;

/** An unresolved finding derived from a non-PASSED check. */
public record ComplianceIssue(
    String id,
    ComplianceCheckType checkType,
    IssueSeverity severity,
    String title,
    String description,
    Instant detectedAt,
    List<String> remediation) {}
