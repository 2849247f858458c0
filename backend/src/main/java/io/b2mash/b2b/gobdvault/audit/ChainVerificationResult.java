package io.b2mash.b2b.gobdvault.audit;

import java.util.UUID;

/**
 * Outcome of re-deriving a tenant's hash chain.
 *
 * @param valid true when every entry of the scanned prefix links and hashes correctly
 * @param verifiedEntries entries that passed before the first failure
 * @param totalEntries entries in the snapshot captured at scan start
 * @param firstInvalidEntryId the altered entry, or the entry right after it; null when valid
 * @param error human-readable reason for the first failure; null when valid
 */
public record ChainVerificationResult(
    boolean valid,
    long verifiedEntries,
    long totalEntries,
    UUID firstInvalidEntryId,
    String error) {

  static ChainVerificationResult intact(long entries) {
    return new ChainVerificationResult(true, entries, entries, null, null);
  }

  static ChainVerificationResult broken(
      long verifiedEntries, long totalEntries, UUID firstInvalidEntryId, String error) {
    return new ChainVerificationResult(
        false, verifiedEntries, totalEntries, firstInvalidEntryId, error);
  }
}
