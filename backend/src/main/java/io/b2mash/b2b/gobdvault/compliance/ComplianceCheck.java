package io.b2mash.b2b.gobdvault.compliance;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one compliance check.
 *
 * @param score 0 to 100
 * @param weight share of the overall score, see {@link ComplianceCheckType#weight()}
 * @param details check-specific figures
 * @param error message of the failure that prevented the check from running, else null
 */
public record ComplianceCheck(
    ComplianceCheckType checkType,
    String name,
    String description,
    CheckStatus status,
    int score,
    int weight,
    Map<String, Object> details,
    Instant checkedAt,
    String error) {

  static ComplianceCheck of(
      ComplianceCheckType type,
      CheckStatus status,
      int score,
      Map<String, Object> details,
      Instant checkedAt) {
    return new ComplianceCheck(
        type,
        type.displayName(),
        type.description(),
        status,
        score,
        type.weight(),
        details,
        checkedAt,
        null);
  }

  /** A check that could not run. It counts as FAILED with score 0. */
  static ComplianceCheck failed(ComplianceCheckType type, Instant checkedAt, String error) {
    return new ComplianceCheck(
        type,
        type.displayName(),
        "Failed to execute check",
        CheckStatus.FAILED,
        0,
        type.weight(),
        Map.of(),
        checkedAt,
        error);
  }
}
