package io.b2mash.b2b.gobdvault.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.gobdvault.exception.IntegrityViolationException;
import io.b2mash.b2b.gobdvault.testutil.VaultFixture;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ArchiveCipherTest {

  private final ArchiveCipher cipher = new ArchiveCipher();
  private final ArchiveKeyRing keyRing =
      new ArchiveKeyRing(new VaultProperties(VaultFixture.TEST_KEY, false, null, null));
  private final byte[] plaintext = "Rechnung 2026-0042".getBytes(StandardCharsets.UTF_8);

  @Test
  void encrypt_detachesTagAndUsesFreshIv() {
    var key = keyRing.keyFor("t1", KeyScheme.ROOT);

    var first = cipher.encrypt(plaintext, key);
    var second = cipher.encrypt(plaintext, key);

    assertThat(first.iv()).hasSize(ArchiveCipher.IV_LENGTH);
    assertThat(first.tag()).hasSize(ArchiveCipher.GCM_TAG_LENGTH / 8);
    assertThat(first.ciphertext()).hasSameSizeAs(plaintext).isNotEqualTo(plaintext);
    assertThat(first.iv()).isNotEqualTo(second.iv());
    assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
  }

  @Test
  void decrypt_restoresPlaintext() {
    var key = keyRing.keyFor("t1", KeyScheme.ROOT);
    var sealed = cipher.encrypt(plaintext, key);

    assertThat(cipher.decrypt(sealed.ciphertext(), sealed.iv(), sealed.tag(), key))
        .isEqualTo(plaintext);
  }

  @Test
  void decrypt_flippedCiphertextBitFailsAuthentication() {
    var key = keyRing.keyFor("t1", KeyScheme.ROOT);
    var sealed = cipher.encrypt(plaintext, key);
    byte[] tampered = sealed.ciphertext().clone();
    tampered[0] ^= 0x01;

    assertThatThrownBy(() -> cipher.decrypt(tampered, sealed.iv(), sealed.tag(), key))
        .isInstanceOf(IntegrityViolationException.class);
  }

  @Test
  void decrypt_wrongTenantKeyFailsAuthentication() {
    var sealed = cipher.encrypt(plaintext, keyRing.keyFor("t1", KeyScheme.TENANT_DERIVED));

    assertThatThrownBy(
            () ->
                cipher.decrypt(
                    sealed.ciphertext(),
                    sealed.iv(),
                    sealed.tag(),
                    keyRing.keyFor("t2", KeyScheme.TENANT_DERIVED)))
        .isInstanceOf(IntegrityViolationException.class);
  }
}
