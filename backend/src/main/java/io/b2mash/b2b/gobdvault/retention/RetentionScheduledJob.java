package io.b2mash.b2b.gobdvault.retention;

import io.b2mash.b2b.gobdvault.archive.ArchiveStatus;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly retention pass (2 AM by default). Runs {@link RetentionService#processExpired} without
 * confirmation for every tenant holding ACTIVE documents, so deletable documents land in a pending
 * deletion review. Nothing is ever deleted from here.
 */
@Component
@ConditionalOnProperty(name = "gobd.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class RetentionScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(RetentionScheduledJob.class);

  private final RetentionService retentionService;
  private final ArchivedDocumentRepository documentRepository;

  public RetentionScheduledJob(
      RetentionService retentionService, ArchivedDocumentRepository documentRepository) {
    this.retentionService = retentionService;
    this.documentRepository = documentRepository;
  }

  @Scheduled(cron = "${gobd.retention.schedule:0 0 2 * * *}")
  public void executeRetentionPass() {
    log.info("Retention pass started");
    var tenantIds = documentRepository.findTenantIdsWithStatus(ArchiveStatus.ACTIVE);
    int totalMarked = 0;
    int failedTenants = 0;

    for (String tenantId : tenantIds) {
      try {
        var result = retentionService.processExpired(tenantId, false, null);
        totalMarked += result.documentsMarkedForReview();
        if (!result.errors().isEmpty()) {
          log.warn(
              "Retention pass: tenant {} had {} document errors",
              tenantId,
              result.errors().size());
        }
      } catch (Exception e) {
        failedTenants++;
        log.error("Retention pass: failed to process tenant {}", tenantId, e);
      }
    }

    log.info(
        "Retention pass completed: {} tenants processed, {} failed, {} documents awaiting review",
        tenantIds.size(),
        failedTenants,
        totalMarked);
  }
}
