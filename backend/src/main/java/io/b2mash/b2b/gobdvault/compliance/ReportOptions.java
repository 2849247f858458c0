package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * @param periodStart overrides the start of the report year
 * @param periodEnd overrides the end of the report year (exclusive)
 * @param checksToPerform subset of checks to run; null or empty runs all ten
 */
public record ReportOptions(
    Instant periodStart, Instant periodEnd, Set<ComplianceCheckType> checksToPerform) {

  public static ReportOptions defaults() {
    return new ReportOptions(null, null, null);
  }

  Set<ComplianceCheckType> checks() {
    if (checksToPerform == null || checksToPerform.isEmpty()) {
      return EnumSet.allOf(ComplianceCheckType.class);
    }
    return EnumSet.copyOf(checksToPerform);
  }
}
