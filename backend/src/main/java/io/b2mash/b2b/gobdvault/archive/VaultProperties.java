package io.b2mash.b2b.gobdvault.archive;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vault settings bound from {@code gobd.vault.*}.
 *
 * @param encryptionKey Base64 of a 32-byte AES key; blank leaves the vault disabled
 * @param perTenantKeys derive a data key per tenant for newly archived documents
 * @param exportExpiry lifetime of an archive export bundle
 * @param sweepPageSize documents loaded per page during exhaustive verification
 */
@ConfigurationProperties("gobd.vault")
public record VaultProperties(
    String encryptionKey, boolean perTenantKeys, Duration exportExpiry, Integer sweepPageSize) {

  public VaultProperties {
    if (exportExpiry == null) {
      exportExpiry = Duration.ofDays(7);
    }
    if (sweepPageSize == null || sweepPageSize < 1) {
      sweepPageSize = 200;
    }
  }
}
