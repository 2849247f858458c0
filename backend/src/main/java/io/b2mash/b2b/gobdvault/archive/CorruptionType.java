package io.b2mash.b2b.gobdvault.archive;

/** Why a document failed integrity verification. */
public enum CorruptionType {
  /** The ciphertext object is gone from storage. */
  MISSING,
  /** Decryption failed, usually a GCM authentication tag mismatch. */
  ENCRYPTION,
  /** Decrypted content does not hash to the stored content hash. */
  CONTENT;

  public String verificationResult() {
    return "CORRUPTED_" + name();
  }
}
