package io.b2mash.b2b.gobdvault.compliance;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Compliance auditor settings bound from {@code gobd.compliance.*}.
 *
 * @param sampleSize most recent documents verified by the archive integrity check
 * @param backupFrequency attested backup frequency reported by the backup check
 */
@ConfigurationProperties("gobd.compliance")
public record ComplianceProperties(Integer sampleSize, String backupFrequency) {

  public ComplianceProperties {
    if (sampleSize == null || sampleSize < 1) {
      sampleSize = 100;
    }
    if (backupFrequency == null || backupFrequency.isBlank()) {
      backupFrequency = "daily";
    }
  }
}
