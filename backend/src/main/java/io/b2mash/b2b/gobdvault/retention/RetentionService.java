package io.b2mash.b2b.gobdvault.retention;

import io.b2mash.b2b.gobdvault.archive.ArchiveStatus;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocument;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocumentRepository;
import io.b2mash.b2b.gobdvault.archive.DocumentSnapshots;
import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditActorType;
import io.b2mash.b2b.gobdvault.audit.AuditEntityTypes;
import io.b2mash.b2b.gobdvault.audit.AuditEntry;
import io.b2mash.b2b.gobdvault.audit.AuditEntryBuilder;
import io.b2mash.b2b.gobdvault.audit.AuditEntryFilter;
import io.b2mash.b2b.gobdvault.audit.HashChainService;
import io.b2mash.b2b.gobdvault.exception.InvalidStateException;
import io.b2mash.b2b.gobdvault.exception.ResourceConflictException;
import io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.gobdvault.integration.storage.StorageService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Enforces statutory retention on archived documents.
 *
 * <p>Expired documents are never deleted on expiry alone. A document must be past its grace
 * period, free of legal holds, and named in a {@link DeletionConfirmation}; otherwise it is parked
 * in a {@link DeletionReview} awaiting a human decision. Each document of a batch is processed in
 * its own transaction so one failure does not undo the others.
 */
@Service
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionService {

  private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

  static final String DEFAULT_DELETION_REASON = "Retention period expired";
  private static final int LEDGER_PAGE_SIZE = 500;
  private static final DateTimeFormatter DAY =
      DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

  private final ArchivedDocumentRepository documentRepository;
  private final RetentionHoldRepository holdRepository;
  private final DeletionReviewRepository reviewRepository;
  private final StorageService storageService;
  private final HashChainService hashChainService;
  private final RetentionProperties properties;
  private final Clock clock;
  private final TransactionTemplate txTemplate;

  public RetentionService(
      ArchivedDocumentRepository documentRepository,
      RetentionHoldRepository holdRepository,
      DeletionReviewRepository reviewRepository,
      StorageService storageService,
      HashChainService hashChainService,
      RetentionProperties properties,
      Clock clock,
      PlatformTransactionManager txManager) {
    this.documentRepository = documentRepository;
    this.holdRepository = holdRepository;
    this.reviewRepository = reviewRepository;
    this.storageService = storageService;
    this.hashChainService = hashChainService;
    this.properties = properties;
    this.clock = clock;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  // --- Status ---

  @Transactional(readOnly = true)
  public RetentionStatusReport checkStatus(String tenantId) {
    Instant now = now();
    Duration grace = Duration.ofDays(properties.gracePeriodDays());
    Instant nearingThreshold = now.plus(Duration.ofDays(properties.nearingExpirationDays()));
    Set<UUID> held = activeHoldDocumentIds(tenantId);

    var buckets = new EnumMap<RetentionCategory, long[]>(RetentionCategory.class);
    for (RetentionCategory category : RetentionCategory.values()) {
      buckets.put(category, new long[6]);
    }
    long total = 0;
    long active = 0;
    long expired = 0;
    long onHold = 0;
    long inGrace = 0;
    long nearing = 0;
    long corrupted = 0;
    long deleted = 0;
    var issues = new ArrayList<String>();
    var warnings = new ArrayList<String>();

    for (ArchivedDocument document : documentRepository.findByTenantId(tenantId)) {
      if (document.getStatus() == ArchiveStatus.DELETED) {
        deleted++;
        continue;
      }
      long[] bucket = buckets.get(document.getRetentionCategory());
      total++;
      bucket[0]++;

      boolean hasHold = held.contains(document.getId());
      if (hasHold) {
        onHold++;
        bucket[3]++;
      }

      Instant end = document.getRetentionEndDate();
      if (!end.isAfter(now)) {
        expired++;
        bucket[2]++;
        boolean pastGrace = now.isAfter(end.plus(grace));
        if (!pastGrace) {
          inGrace++;
          bucket[5]++;
        } else if (!hasHold && document.isActive()) {
          warnings.add(
              "Document "
                  + document.getId()
                  + " ("
                  + document.getOriginalFilename()
                  + ") expired on "
                  + DAY.format(end)
                  + " and is past grace period");
        }
      } else {
        active++;
        bucket[1]++;
        if (end.isBefore(nearingThreshold)) {
          nearing++;
          bucket[4]++;
        }
      }

      if (document.getStatus() == ArchiveStatus.CORRUPTED) {
        corrupted++;
        issues.add(
            "Document "
                + document.getId()
                + " ("
                + document.getOriginalFilename()
                + ") is marked as CORRUPTED");
      }
    }

    var byCategory =
        new EnumMap<RetentionCategory, RetentionStatusReport.CategoryStats>(
            RetentionCategory.class);
    buckets.forEach(
        (category, b) ->
            byCategory.put(
                category,
                new RetentionStatusReport.CategoryStats(b[0], b[1], b[2], b[3], b[4], b[5])));
    long pendingReview =
        reviewRepository
            .findByTenantIdAndStatus(tenantId, DeletionReviewStatus.PENDING_REVIEW)
            .size();

    log.info(
        "Retention status for {}: {} total, {} expired, {} on hold",
        tenantId,
        total,
        expired,
        onHold);
    return new RetentionStatusReport(
        tenantId,
        now,
        new RetentionStatusReport.Summary(
            total, active, expired, onHold, inGrace, nearing, corrupted, deleted, pendingReview),
        byCategory,
        issues.isEmpty(),
        List.copyOf(issues),
        List.copyOf(warnings));
  }

  /** ACTIVE documents whose retention ended at or before now, oldest expiry first. */
  @Transactional(readOnly = true)
  public List<ExpiredDocument> listExpired(String tenantId) {
    Instant now = now();
    Duration grace = Duration.ofDays(properties.gracePeriodDays());
    var documents =
        documentRepository
            .findByTenantIdAndStatusAndRetentionEndDateLessThanEqualOrderByRetentionEndDateAsc(
                tenantId, ArchiveStatus.ACTIVE, now);

    var expired = new ArrayList<ExpiredDocument>(documents.size());
    for (ArchivedDocument document : documents) {
      var hold =
          holdRepository
              .findFirstByDocumentIdAndReleasedAtIsNullOrderByPlacedAtDesc(document.getId())
              .orElse(null);
      Instant end = document.getRetentionEndDate();
      Instant graceEndsAt = end.plus(grace);
      expired.add(
          new ExpiredDocument(
              document.getId(),
              document.getTenantId(),
              document.getOriginalFilename(),
              document.getRetentionCategory(),
              end,
              Duration.between(end, now).toDays(),
              hold != null,
              hold != null ? hold.getReason() : null,
              document.getEntityType(),
              document.getEntityId(),
              document.getArchivedAt(),
              document.getLastAccessedAt(),
              document.getFileSizeBytes(),
              graceEndsAt,
              hold == null && now.isAfter(graceEndsAt)));
    }
    log.debug("Found {} expired documents for tenant {}", expired.size(), tenantId);
    return expired;
  }

  // --- Processing ---

  /**
   * Walks the tenant's expired documents. Held or in-grace documents are skipped. Deletable
   * documents are deleted only when {@code autoDelete} is set and {@code confirmation} names them;
   * all others get a pending deletion review. The thread's interrupt flag stops the batch between
   * documents.
   */
  public ProcessingResult processExpired(
      String tenantId, boolean autoDelete, DeletionConfirmation confirmation) {
    Instant processedAt = now();
    var expired = listExpired(tenantId);
    var errors = new ArrayList<ProcessingResult.ProcessingError>();
    int marked = 0;
    int deleted = 0;
    int skipped = 0;
    long storageFreed = 0;
    Instant oldest = null;
    Instant newest = null;
    boolean cancelled = false;

    for (ExpiredDocument item : expired) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Retention processing for tenant {} cancelled", tenantId);
        cancelled = true;
        break;
      }
      try {
        if (item.hasLegalHold()) {
          skipped++;
          log.debug("Skipping document {}: active legal hold", item.id());
          continue;
        }
        if (!item.canDelete()) {
          skipped++;
          log.debug(
              "Skipping document {}: in grace period until {}",
              item.id(),
              item.gracePeriodEndsAt());
          continue;
        }

        if (autoDelete && confirmation != null && confirmation.confirms(item.id())) {
          boolean removed =
              deleteDocument(
                  item.id(), tenantId, confirmation.confirmedBy(), confirmation.reason());
          if (!removed) {
            skipped++;
            continue;
          }
          deleted++;
          storageFreed += item.fileSizeBytes();
          if (oldest == null || item.archivedAt().isBefore(oldest)) {
            oldest = item.archivedAt();
          }
          if (newest == null || item.archivedAt().isAfter(newest)) {
            newest = item.archivedAt();
          }
        } else {
          txTemplate.executeWithoutResult(status -> markForReview(item.id(), tenantId));
          marked++;
          log.debug("Document {} marked for deletion review", item.id());
        }
      } catch (RuntimeException e) {
        log.error("Error processing expired document {}: {}", item.id(), e.getMessage(), e);
        errors.add(
            new ProcessingResult.ProcessingError(
                item.id(), item.originalFilename(), e.getMessage(), now()));
      }
    }

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("operation", "process_expired_documents");
    metadata.put("autoDelete", autoDelete);
    metadata.put("documentsReviewed", expired.size());
    metadata.put("documentsDeleted", deleted);
    metadata.put("documentsMarkedForReview", marked);
    metadata.put("documentsSkipped", skipped);
    metadata.put("errors", errors.size());
    metadata.put("storageFreed", storageFreed);
    metadata.put("cancelled", cancelled);
    if (oldest != null) {
      metadata.put("oldestDeletedArchivedAt", oldest);
      metadata.put("newestDeletedArchivedAt", newest);
    }
    boolean confirmed = autoDelete && confirmation != null;
    txTemplate.executeWithoutResult(
        status ->
            hashChainService.createEntry(
                AuditEntryBuilder.builder()
                    .tenantId(tenantId)
                    .entityType(AuditEntityTypes.RETENTION_BATCH)
                    .entityId("retention_processing_" + processedAt.toEpochMilli())
                    .action(AuditAction.DELETE)
                    .actorType(confirmed ? AuditActorType.USER : AuditActorType.SYSTEM)
                    .actorId(confirmed ? confirmation.confirmedBy() : null)
                    .metadata(metadata)
                    .build()));

    log.info(
        "Retention batch for tenant {}: {} reviewed, {} deleted, {} marked, {} skipped, {} errors",
        tenantId,
        expired.size(),
        deleted,
        marked,
        skipped,
        errors.size());
    return new ProcessingResult(
        tenantId,
        processedAt,
        expired.size(),
        marked,
        deleted,
        skipped,
        List.copyOf(errors),
        cancelled,
        storageFreed,
        oldest,
        newest);
  }

  private DeletionReview markForReview(UUID documentId, String tenantId) {
    return reviewRepository
        .findByDocumentId(documentId)
        .orElseGet(() -> reviewRepository.save(new DeletionReview(documentId, tenantId, now())));
  }

  /**
   * Deletes one expired document after a named confirmation, in its own transaction. The document
   * row is locked and must still be ACTIVE, unheld and past its grace period; a document that was
   * deleted concurrently yields {@code false}. The ciphertext is removed after commit.
   *
   * @return true if this call deleted the document
   * @throws ResourceNotFoundException if the document does not exist for this tenant
   * @throws InvalidStateException if the document is held or still within its retention or grace
   *     period
   */
  public boolean deleteDocument(
      UUID documentId, String tenantId, String confirmedBy, String reason) {
    Boolean removed =
        txTemplate.execute(status -> deleteLocked(documentId, tenantId, confirmedBy, reason));
    return Boolean.TRUE.equals(removed);
  }

  private boolean deleteLocked(
      UUID documentId, String tenantId, String confirmedBy, String reason) {
    var document =
        documentRepository
            .findByIdAndTenantIdForUpdate(documentId, tenantId)
            .orElseThrow(() -> new ResourceNotFoundException("ArchivedDocument", documentId));
    if (!document.isActive()) {
      log.debug("Document {} is {}, nothing to delete", documentId, document.getStatus());
      return false;
    }
    Instant now = now();
    if (holdRepository
        .findFirstByDocumentIdAndReleasedAtIsNullOrderByPlacedAtDesc(documentId)
        .isPresent()) {
      throw new InvalidStateException(
          "Document on hold", "Document " + documentId + " has an active legal hold");
    }
    Instant graceEndsAt =
        document.getRetentionEndDate().plus(Duration.ofDays(properties.gracePeriodDays()));
    if (!now.isAfter(graceEndsAt)) {
      throw new InvalidStateException(
          "Retention not expired",
          "Document " + documentId + " may not be deleted before " + graceEndsAt);
    }

    var review = markForReview(documentId, tenantId);
    if (review.getStatus() == DeletionReviewStatus.PENDING_REVIEW) {
      review.confirm(confirmedBy, reason, now);
    }

    var previousState = DocumentSnapshots.of(document);
    document.markDeleted(now);
    documentRepository.save(document);
    review.markDeleted(now);
    reviewRepository.save(review);

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("operation", "delete_expired_document");
    metadata.put("reason", reason != null ? reason : DEFAULT_DELETION_REASON);
    metadata.put("fileSizeBytes", document.getFileSizeBytes());
    metadata.put("retentionCategory", document.getRetentionCategory().name());
    metadata.put("reviewId", review.getId());
    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.DOCUMENT)
            .entityId(documentId)
            .action(AuditAction.DELETE)
            .actorId(confirmedBy)
            .previousState(previousState)
            .metadata(metadata)
            .build());

    deleteCiphertextAfterCommit(document.getStoragePath());
    log.info(
        "Deleted document {} ({}) confirmed by {}",
        documentId,
        document.getOriginalFilename(),
        confirmedBy);
    return true;
  }

  private void deleteCiphertextAfterCommit(String storagePath) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      deleteCiphertext(storagePath);
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            deleteCiphertext(storagePath);
          }
        });
  }

  private void deleteCiphertext(String storagePath) {
    try {
      if (!storageService.delete(storagePath)) {
        log.warn("Failed to delete archived file {}", storagePath);
      }
    } catch (RuntimeException e) {
      log.warn("Failed to delete archived file {}: {}", storagePath, e.getMessage());
    }
  }

  // --- Legal holds ---

  /**
   * Places a legal hold on an ACTIVE document.
   *
   * @throws ResourceNotFoundException if the document does not exist for this tenant
   * @throws InvalidStateException if the document is not ACTIVE
   * @throws ResourceConflictException if the document already has an active hold
   */
  @Transactional
  public RetentionHold setHold(UUID documentId, String tenantId, String reason, String placedBy) {
    var document =
        documentRepository
            .findByIdAndTenantIdForUpdate(documentId, tenantId)
            .orElseThrow(() -> new ResourceNotFoundException("ArchivedDocument", documentId));
    if (!document.isActive()) {
      throw new InvalidStateException(
          "Document not active",
          "Cannot place hold on document with status " + document.getStatus());
    }
    if (holdRepository
        .findFirstByDocumentIdAndReleasedAtIsNullOrderByPlacedAtDesc(documentId)
        .isPresent()) {
      throw new ResourceConflictException(
          "Hold already active", "Document " + documentId + " already has an active legal hold");
    }

    RetentionHold hold;
    try {
      hold =
          holdRepository.saveAndFlush(
              new RetentionHold(documentId, tenantId, reason, placedBy, now()));
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Hold already active",
          "Document " + documentId + " already has an active legal hold",
          e);
    }

    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.DOCUMENT)
            .entityId(documentId)
            .action(AuditAction.UPDATE)
            .actorId(placedBy)
            .metadata(
                Map.of(
                    "operation", "set_retention_hold",
                    "holdId", hold.getId().toString(),
                    "reason", reason))
            .build());

    log.info("Retention hold {} placed on document {}", hold.getId(), documentId);
    return hold;
  }

  /**
   * Releases the active legal hold of a document, whatever the document's status.
   *
   * @throws ResourceNotFoundException if the document or an active hold does not exist
   */
  @Transactional
  public RetentionHold releaseHold(UUID documentId, String tenantId, String releasedBy) {
    documentRepository
        .findByIdAndTenantId(documentId, tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("ArchivedDocument", documentId));
    var hold =
        holdRepository
            .findFirstByDocumentIdAndReleasedAtIsNullOrderByPlacedAtDesc(documentId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "No active hold",
                        "No active retention hold found for document " + documentId));

    hold.release(releasedBy, now());
    holdRepository.save(hold);

    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.DOCUMENT)
            .entityId(documentId)
            .action(AuditAction.UPDATE)
            .actorId(releasedBy)
            .metadata(
                Map.of(
                    "operation", "remove_retention_hold",
                    "holdId", hold.getId().toString(),
                    "holdDurationDays", hold.durationDays()))
            .build());

    log.info("Retention hold {} released from document {}", hold.getId(), documentId);
    return hold;
  }

  // --- Annual report ---

  /** Retention activity of one UTC calendar year. The report itself is logged as an EXPORT. */
  @Transactional
  public AnnualRetentionReport annualReport(String tenantId, int year) {
    Instant now = now();
    Instant start = LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant end = LocalDate.of(year + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();

    long documentsArchived =
        documentRepository.countByTenantIdAndArchivedAtGreaterThanEqualAndArchivedAtLessThan(
            tenantId, start, end);

    var deletedByCategory = new EnumMap<RetentionCategory, Long>(RetentionCategory.class);
    long documentsDeleted = 0;
    long storageFreed = 0;
    var deletions =
        new AuditEntryFilter(
            tenantId, AuditEntityTypes.DOCUMENT, null, AuditAction.DELETE, null, start, end);
    int page = 0;
    Page<AuditEntry> entries;
    do {
      entries = hashChainService.findEntries(deletions, PageRequest.of(page++, LEDGER_PAGE_SIZE));
      for (AuditEntry entry : entries) {
        documentsDeleted++;
        Map<String, Object> metadata = entry.getMetadata() != null ? entry.getMetadata() : Map.of();
        if (metadata.get("fileSizeBytes") instanceof Number size) {
          storageFreed += size.longValue();
        }
        RetentionCategory category = deletedCategory(entry);
        if (category != null) {
          deletedByCategory.merge(category, 1L, Long::sum);
        }
      }
    } while (entries.hasNext());

    var holds =
        holdRepository.findByTenantIdAndPlacedAtGreaterThanEqualAndPlacedAtLessThan(
            tenantId, start, end);
    var released = holds.stream().filter(h -> !h.isActive()).toList();
    long activeHolds = holds.size() - released.size();
    long averageHoldDays =
        Math.round(
            released.stream().mapToLong(RetentionHold::durationDays).average().orElse(0));

    var documents = documentRepository.findByTenantId(tenantId);
    var byCategory =
        new EnumMap<RetentionCategory, AnnualRetentionReport.CategoryYear>(RetentionCategory.class);
    Map<RetentionCategory, List<ArchivedDocument>> grouped =
        documents.stream().collect(Collectors.groupingBy(ArchivedDocument::getRetentionCategory));
    for (RetentionCategory category : RetentionCategory.values()) {
      var inCategory = grouped.getOrDefault(category, List.of());
      long archivedInYear =
          inCategory.stream()
              .filter(d -> !d.getArchivedAt().isBefore(start) && d.getArchivedAt().isBefore(end))
              .count();
      var active = inCategory.stream().filter(ArchivedDocument::isActive).toList();
      long averageDays =
          Math.round(
              active.stream()
                  .mapToLong(d -> Duration.between(d.getArchivedAt(), now).toDays())
                  .average()
                  .orElse(0));
      byCategory.put(
          category,
          new AnnualRetentionReport.CategoryYear(
              archivedInYear,
              deletedByCategory.getOrDefault(category, 0L),
              active.size(),
              averageDays));
    }

    var report =
        new AnnualRetentionReport(
            tenantId,
            year,
            now,
            start,
            end,
            documentsArchived,
            documentsDeleted,
            activeHolds,
            documentRepository.sumStoredBytes(tenantId),
            storageFreed,
            byCategory,
            new AnnualRetentionReport.HoldStatistics(
                holds.size(), activeHolds, released.size(), averageHoldDays));

    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.RETENTION_REPORT)
            .entityId("retention_report_" + year)
            .action(AuditAction.EXPORT)
            .metadata(
                Map.of(
                    "operation", "generate_retention_report",
                    "year", year,
                    "documentsArchived", documentsArchived,
                    "documentsDeleted", documentsDeleted,
                    "storageFreed", storageFreed))
            .build());

    log.info("Generated retention report for tenant {}, year {}", tenantId, year);
    return report;
  }

  private static RetentionCategory deletedCategory(AuditEntry entry) {
    Object value = null;
    if (entry.getMetadata() != null) {
      value = entry.getMetadata().get("retentionCategory");
    }
    if (value == null && entry.getPreviousState() != null) {
      value = entry.getPreviousState().get("retentionCategory");
    }
    if (value == null) {
      return null;
    }
    try {
      return RetentionCategory.valueOf(value.toString());
    } catch (IllegalArgumentException e) {
      log.warn("Unknown retention category '{}' in ledger entry {}", value, entry.getId());
      return null;
    }
  }

  private Set<UUID> activeHoldDocumentIds(String tenantId) {
    var ids = new HashSet<UUID>();
    for (RetentionHold hold : holdRepository.findByTenantIdAndReleasedAtIsNull(tenantId)) {
      ids.add(hold.getDocumentId());
    }
    return ids;
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
