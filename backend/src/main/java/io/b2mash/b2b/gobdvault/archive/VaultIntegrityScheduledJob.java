package io.b2mash.b2b.gobdvault.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that runs weekly (Sunday 3 AM by default) and performs a sampled integrity sweep
 * for every tenant holding ACTIVE documents. Failures are marked CORRUPTED by the sweep itself and
 * logged here; one failing tenant never stops the others.
 */
@Component
@ConditionalOnProperty(name = "gobd.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class VaultIntegrityScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(VaultIntegrityScheduledJob.class);

  private final ArchiveService archiveService;
  private final ArchivedDocumentRepository documentRepository;
  private final ArchiveKeyRing keyRing;
  private final int sampleSize;

  public VaultIntegrityScheduledJob(
      ArchiveService archiveService,
      ArchivedDocumentRepository documentRepository,
      ArchiveKeyRing keyRing,
      @Value("${gobd.jobs.vault-sample-size:100}") int sampleSize) {
    this.archiveService = archiveService;
    this.documentRepository = documentRepository;
    this.keyRing = keyRing;
    this.sampleSize = sampleSize;
  }

  @Scheduled(cron = "${gobd.jobs.vault-integrity-cron:0 0 3 * * SUN}")
  public void executeIntegritySweep() {
    if (!keyRing.isConfigured()) {
      log.warn("Vault integrity sweep skipped: document vault is not configured");
      return;
    }
    log.info("Vault integrity sweep started");
    var tenantIds = documentRepository.findTenantIdsWithStatus(ArchiveStatus.ACTIVE);
    int totalInvalid = 0;

    for (String tenantId : tenantIds) {
      try {
        var result = archiveService.verifySample(tenantId, sampleSize);
        totalInvalid += result.invalid();
        if (result.invalid() > 0) {
          log.error(
              "Vault integrity sweep: tenant {} has {} of {} sampled documents failing",
              tenantId,
              result.invalid(),
              result.checked());
        }
      } catch (Exception e) {
        log.error("Vault integrity sweep: failed to process tenant {}", tenantId, e);
      }
    }

    log.info(
        "Vault integrity sweep completed: {} tenants processed, {} invalid documents",
        tenantIds.size(),
        totalInvalid);
  }
}
