package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.exception.IntegrityViolationException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM with a fresh random IV per document. The JCA appends the authentication tag to the
 * ciphertext; it is split off and stored separately on the catalog row.
 */
@Component
public class ArchiveCipher {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  static final int GCM_TAG_LENGTH = 128; // bits
  static final int IV_LENGTH = 12; // bytes (96 bits)
  private static final int TAG_BYTES = GCM_TAG_LENGTH / 8;

  private final SecureRandom secureRandom = new SecureRandom();

  /** Ciphertext without tag, the IV and the detached GCM tag. */
  public record Sealed(byte[] ciphertext, byte[] iv, byte[] tag) {}

  public Sealed encrypt(byte[] plaintext, SecretKeySpec key) {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] sealed = cipher.doFinal(plaintext);
      int split = sealed.length - TAG_BYTES;
      return new Sealed(
          Arrays.copyOfRange(sealed, 0, split),
          iv,
          Arrays.copyOfRange(sealed, split, sealed.length));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  /**
   * @throws IntegrityViolationException if the tag does not authenticate the ciphertext
   */
  public byte[] decrypt(byte[] ciphertext, byte[] iv, byte[] tag, SecretKeySpec key) {
    byte[] sealed = new byte[ciphertext.length + tag.length];
    System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
    System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return cipher.doFinal(sealed);
    } catch (GeneralSecurityException e) {
      throw new IntegrityViolationException(
          "Decryption failed", "Ciphertext failed GCM authentication", e);
    }
  }
}
