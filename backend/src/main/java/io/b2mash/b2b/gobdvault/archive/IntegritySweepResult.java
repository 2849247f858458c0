package io.b2mash.b2b.gobdvault.archive;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of verifying many documents of one tenant.
 *
 * @param sampled true when only the most recent documents were checked; a sampled sweep does not
 *     certify the whole archive
 * @param failures results of documents that did not verify
 * @param cancelled true when the sweep stopped early because the thread was interrupted
 */
public record IntegritySweepResult(
    String tenantId,
    boolean sampled,
    int checked,
    int valid,
    int invalid,
    List<IntegrityCheckResult> failures,
    boolean cancelled,
    Instant startedAt,
    Instant completedAt) {

  /** Percentage of checked documents that verified; 100 when nothing was checked. */
  public int validPercentage() {
    return checked == 0 ? 100 : (int) Math.round(valid * 100.0 / checked);
  }
}
