package io.b2mash.b2b.gobdvault.archive;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of verifying one document. Stages run in order and stop at the first failure: object
 * present, decryption authenticates, content hash matches, tenant ledger intact.
 *
 * @param corruptionType set when one of the first three stages failed
 */
public record IntegrityCheckResult(
    UUID documentId,
    boolean valid,
    boolean encryptionValid,
    boolean contentHashMatch,
    boolean chainIntegrityValid,
    CorruptionType corruptionType,
    Instant verifiedAt,
    String error) {

  static IntegrityCheckResult corrupted(
      UUID documentId, CorruptionType type, Instant verifiedAt, String error) {
    boolean decrypted = type == CorruptionType.CONTENT;
    return new IntegrityCheckResult(
        documentId, false, decrypted, false, false, type, verifiedAt, error);
  }

  static IntegrityCheckResult failed(UUID documentId, Instant verifiedAt, String error) {
    return new IntegrityCheckResult(
        documentId, false, false, false, false, null, verifiedAt, error);
  }
}
