package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.exception.ServiceNotConfiguredException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Owns the vault's key material. Built once from {@link VaultProperties}: a malformed key fails
 * startup, a missing key leaves the ring unconfigured and every caller of {@link
 * #requireConfigured()} is refused.
 *
 * <p>Tenant keys are derived with HKDF-SHA256 (RFC 5869), root key as input keying material and
 * {@code "gobd-vault:" + tenantId} as info.
 */
@Component
@EnableConfigurationProperties(VaultProperties.class)
public class ArchiveKeyRing {

  private static final Logger log = LoggerFactory.getLogger(ArchiveKeyRing.class);

  static final int KEY_LENGTH = 32; // bytes (256 bits)
  private static final String HMAC = "HmacSHA256";
  private static final byte[] HKDF_SALT = "gobd-vault-archive".getBytes(StandardCharsets.UTF_8);

  private final SecretKeySpec rootKey;
  private final KeyScheme defaultScheme;

  public ArchiveKeyRing(VaultProperties properties) {
    this.rootKey = parseKey(properties.encryptionKey());
    this.defaultScheme = properties.perTenantKeys() ? KeyScheme.TENANT_DERIVED : KeyScheme.ROOT;
    if (rootKey == null) {
      log.warn("Document vault is disabled: gobd.vault.encryption-key is not configured");
    } else {
      log.info("Document vault key loaded, new documents use key scheme {}", defaultScheme);
    }
  }

  private static SecretKeySpec parseKey(String encodedKey) {
    if (encodedKey == null || encodedKey.isBlank()) {
      return null;
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(encodedKey.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("gobd.vault.encryption-key is not valid Base64", e);
    }
    if (keyBytes.length != KEY_LENGTH) {
      throw new IllegalStateException(
          "gobd.vault.encryption-key must be a Base64-encoded 256-bit (32-byte) key. Got "
              + keyBytes.length
              + " bytes.");
    }
    return new SecretKeySpec(keyBytes, "AES");
  }

  public boolean isConfigured() {
    return rootKey != null;
  }

  /**
   * @throws ServiceNotConfiguredException if no key is configured
   */
  public void requireConfigured() {
    if (rootKey == null) {
      throw new ServiceNotConfiguredException(
          "Document vault", "Set gobd.vault.encryption-key to enable archiving");
    }
  }

  /** Scheme recorded on documents archived from now on. */
  public KeyScheme currentScheme() {
    return defaultScheme;
  }

  public SecretKeySpec keyFor(String tenantId, KeyScheme scheme) {
    requireConfigured();
    return switch (scheme) {
      case ROOT -> rootKey;
      case TENANT_DERIVED -> deriveTenantKey(tenantId);
    };
  }

  private SecretKeySpec deriveTenantKey(String tenantId) {
    try {
      var extract = Mac.getInstance(HMAC);
      extract.init(new SecretKeySpec(HKDF_SALT, HMAC));
      byte[] prk = extract.doFinal(rootKey.getEncoded());

      // one expand block yields exactly 32 bytes
      var expand = Mac.getInstance(HMAC);
      expand.init(new SecretKeySpec(prk, HMAC));
      expand.update(("gobd-vault:" + tenantId).getBytes(StandardCharsets.UTF_8));
      expand.update((byte) 0x01);
      return new SecretKeySpec(expand.doFinal(), "AES");
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Tenant key derivation failed", e);
    }
  }
}
