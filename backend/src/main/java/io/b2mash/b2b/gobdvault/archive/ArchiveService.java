package io.b2mash.b2b.gobdvault.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditEntityTypes;
import io.b2mash.b2b.gobdvault.audit.AuditEntryBuilder;
import io.b2mash.b2b.gobdvault.audit.ChainVerificationResult;
import io.b2mash.b2b.gobdvault.audit.HashChainService;
import io.b2mash.b2b.gobdvault.crypto.Sha256;
import io.b2mash.b2b.gobdvault.exception.IntegrityViolationException;
import io.b2mash.b2b.gobdvault.exception.InvalidStateException;
import io.b2mash.b2b.gobdvault.exception.ResourceConflictException;
import io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.gobdvault.export.ZipBundleWriter;
import io.b2mash.b2b.gobdvault.integration.storage.StorageService;
import io.b2mash.b2b.gobdvault.retention.RetentionProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Encrypted, content-addressed document vault. Every mutating operation is recorded in the tenant's
 * hash-chained ledger.
 *
 * <p>Content is identified by the SHA-256 of its plaintext, which is globally unique: archiving
 * identical bytes again appends a {@link DocumentVersion} instead of a second ciphertext. The
 * unique {@code content_hash} constraint makes the exists-check-then-insert atomic; the writer that
 * loses a concurrent race retries once through the version path.
 *
 * <p>All operations refuse to run while {@link ArchiveKeyRing} has no key.
 */
@Service
public class ArchiveService {

  private static final Logger log = LoggerFactory.getLogger(ArchiveService.class);

  static final String CIPHERTEXT_CONTENT_TYPE = "application/octet-stream";
  static final String REARCHIVE_REASON = "Document re-archived with same content";

  private static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9_-]{1,100}");
  private static final DateTimeFormatter YEAR_MONTH =
      DateTimeFormatter.ofPattern("uuuu/MM").withZone(ZoneOffset.UTC);

  private final ArchivedDocumentRepository documentRepository;
  private final DocumentVersionRepository versionRepository;
  private final ArchiveSearchRepository searchRepository;
  private final StorageService storageService;
  private final ArchiveKeyRing keyRing;
  private final ArchiveCipher cipher;
  private final HashChainService hashChainService;
  private final RetentionProperties retentionProperties;
  private final VaultProperties vaultProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final TransactionTemplate txTemplate;

  public ArchiveService(
      ArchivedDocumentRepository documentRepository,
      DocumentVersionRepository versionRepository,
      ArchiveSearchRepository searchRepository,
      StorageService storageService,
      ArchiveKeyRing keyRing,
      ArchiveCipher cipher,
      HashChainService hashChainService,
      RetentionProperties retentionProperties,
      VaultProperties vaultProperties,
      ObjectMapper objectMapper,
      Clock clock,
      PlatformTransactionManager txManager) {
    this.documentRepository = documentRepository;
    this.versionRepository = versionRepository;
    this.searchRepository = searchRepository;
    this.storageService = storageService;
    this.keyRing = keyRing;
    this.cipher = cipher;
    this.hashChainService = hashChainService;
    this.retentionProperties = retentionProperties;
    this.vaultProperties = vaultProperties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  // --- Archive ---

  /**
   * Archives plaintext content. Returns the new document, or the existing document when the same
   * bytes were archived before.
   *
   * @throws ResourceConflictException if identical content belongs to another tenant, or a
   *     concurrent archive of the same content has not committed yet
   * @throws InvalidStateException if identical content belongs to a document that is no longer
   *     active
   */
  public ArchivedDocument archive(ArchiveRequest request) {
    keyRing.requireConfigured();
    requireValidTenant(request.tenantId());
    String contentHash = Sha256.hex(request.content());

    try {
      return txTemplate.execute(
          status ->
              documentRepository
                  .findByContentHash(contentHash)
                  .map(existing -> appendVersion(existing, request))
                  .orElseGet(() -> storeNew(request, contentHash)));
    } catch (DataIntegrityViolationException | ResourceConflictException e) {
      log.info(
          "Concurrent archive of content {} detected, retrying as version",
          contentHash.substring(0, 16));
      return txTemplate.execute(
          status ->
              documentRepository
                  .findByContentHash(contentHash)
                  .map(existing -> appendVersion(existing, request))
                  .orElseThrow(
                      () ->
                          new ResourceConflictException(
                              "Archive in progress",
                              "Identical content is being archived concurrently, retry later",
                              e)));
    }
  }

  private ArchivedDocument storeNew(ArchiveRequest request, String contentHash) {
    Instant now = now();
    String tenantId = request.tenantId();
    KeyScheme scheme = keyRing.currentScheme();
    var sealed = cipher.encrypt(request.content(), keyRing.keyFor(tenantId, scheme));
    String storagePath = storagePath(tenantId, contentHash, now);

    storageService.upload(storagePath, sealed.ciphertext(), CIPHERTEXT_CONTENT_TYPE);
    deleteOnRollback(storagePath);

    var document =
        new ArchivedDocument(
            tenantId,
            request.originalFilename(),
            request.mimeType(),
            request.content().length,
            contentHash,
            storagePath,
            sealed.iv(),
            sealed.tag(),
            scheme,
            request.retentionCategory(),
            now,
            retentionProperties.retentionEndDate(request.retentionCategory(), now));
    document.linkEntity(request.entityType(), request.entityId());
    document.uploadedBy(request.uploadedBy());
    document.updateDescriptors(request.tags(), request.metadata(), now);
    var saved = documentRepository.saveAndFlush(document);

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("operation", "archive_document");
    metadata.put("keyScheme", scheme.name());
    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.DOCUMENT)
            .entityId(saved.getId())
            .action(AuditAction.CREATE)
            .actorId(request.uploadedBy())
            .newState(DocumentSnapshots.of(saved))
            .metadata(metadata)
            .build());

    log.info(
        "Archived document {} (hash: {}...) for tenant {}",
        saved.getId(),
        contentHash.substring(0, 16),
        tenantId);
    return saved;
  }

  private ArchivedDocument appendVersion(ArchivedDocument existing, ArchiveRequest request) {
    if (!existing.getTenantId().equals(request.tenantId())) {
      throw new ResourceConflictException(
          "Content not archivable", "This content cannot be archived for the requesting tenant");
    }
    if (!existing.isActive()) {
      throw new InvalidStateException(
          "Document not active",
          "Identical content belongs to document "
              + existing.getId()
              + " with status "
              + existing.getStatus());
    }
    Instant now = now();
    int nextVersion =
        versionRepository
            .findTopByDocumentIdOrderByVersionDesc(existing.getId())
            .map(v -> v.getVersion() + 1)
            .orElse(1);
    versionRepository.save(
        new DocumentVersion(
            existing.getId(),
            nextVersion,
            REARCHIVE_REASON,
            existing.getContentHash(),
            existing.getContentHash(),
            request.uploadedBy(),
            retentionProperties.retentionEndDate(request.retentionCategory(), now),
            now));

    var previousState = DocumentSnapshots.of(existing);
    existing.updateDescriptors(request.tags(), request.metadata(), now);
    var saved = documentRepository.save(existing);

    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(request.tenantId())
            .entityType(AuditEntityTypes.DOCUMENT)
            .entityId(existing.getId())
            .action(AuditAction.UPDATE)
            .actorId(request.uploadedBy())
            .previousState(previousState)
            .newState(DocumentSnapshots.of(saved))
            .metadata(Map.of("operation", "create_version", "version", nextVersion))
            .build());

    log.info("Recorded version {} of document {}", nextVersion, existing.getId());
    return saved;
  }

  /** {@code {tenantId}/{yyyy}/{MM}/{hash[0..4]}/{contentHash}.enc} */
  static String storagePath(String tenantId, String contentHash, Instant archivedAt) {
    return tenantId
        + "/"
        + YEAR_MONTH.format(archivedAt)
        + "/"
        + contentHash.substring(0, 4)
        + "/"
        + contentHash
        + ".enc";
  }

  private void deleteOnRollback(String storagePath) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            if (status == STATUS_ROLLED_BACK) {
              log.debug("Removing ciphertext {} after rollback", storagePath);
              storageService.delete(storagePath);
            }
          }
        });
  }

  // --- Retrieve ---

  /**
   * Loads a document of {@code tenantId}, optionally decrypting it.
   *
   * @throws ResourceNotFoundException if the document does not exist for this tenant
   * @throws InvalidStateException if the document is not ACTIVE
   * @throws IntegrityViolationException if the stored content fails authentication or hashing
   */
  @Transactional
  public RetrievedDocument retrieve(UUID id, String tenantId, RetrieveOptions options) {
    keyRing.requireConfigured();
    var document = requireActive(id, tenantId);

    byte[] content = options.decrypt() ? readContent(document) : null;
    List<DocumentVersion> versions =
        options.includeVersions() ? versionRepository.findByDocumentIdOrderByVersionDesc(id) : null;

    if (options.updateAccessTime()) {
      document.recordAccess(now());
      documentRepository.save(document);
      hashChainService.createEntry(
          AuditEntryBuilder.builder()
              .tenantId(tenantId)
              .entityType(AuditEntityTypes.DOCUMENT)
              .entityId(id)
              .action(AuditAction.VIEW)
              .actorId(options.actorId())
              .metadata(Map.of("operation", "retrieve_document", "decrypted", options.decrypt()))
              .build());
    }

    log.debug("Retrieved document {} for tenant {}", id, tenantId);
    return new RetrievedDocument(document, content, versions);
  }

  @Transactional(readOnly = true)
  public List<DocumentVersion> getVersionHistory(UUID id, String tenantId) {
    keyRing.requireConfigured();
    documentRepository
        .findByIdAndTenantId(id, tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("ArchivedDocument", id));
    return versionRepository.findByDocumentIdOrderByVersionDesc(id);
  }

  /**
   * Downloads, decrypts and hash-checks a document's content.
   *
   * @throws IntegrityViolationException if the ciphertext is missing, fails GCM authentication, or
   *     does not hash to the stored content hash
   */
  public byte[] readContent(ArchivedDocument document) {
    keyRing.requireConfigured();
    byte[] ciphertext;
    try {
      ciphertext = storageService.download(document.getStoragePath());
    } catch (ResourceNotFoundException e) {
      throw new IntegrityViolationException(
          "Archived content missing",
          "Ciphertext of document " + document.getId() + " is missing from storage",
          e);
    }
    byte[] plaintext =
        cipher.decrypt(
            ciphertext,
            document.getEncryptionIv(),
            document.getEncryptionTag(),
            keyRing.keyFor(document.getTenantId(), document.getKeyScheme()));
    if (!Sha256.hex(plaintext).equals(document.getContentHash())) {
      throw new IntegrityViolationException(
          "Content hash mismatch",
          "Decrypted content of document " + document.getId() + " does not match its hash",
          null);
    }
    return plaintext;
  }

  private ArchivedDocument requireActive(UUID id, String tenantId) {
    var document =
        documentRepository
            .findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new ResourceNotFoundException("ArchivedDocument", id));
    if (!document.isActive()) {
      throw new InvalidStateException(
          "Document not active", "Document " + id + " has status " + document.getStatus());
    }
    return document;
  }

  // --- Integrity ---

  /**
   * Verifies one document. Never throws: every outcome, including unexpected errors, is reported
   * in the result. A failed storage, decryption or hash stage marks the document CORRUPTED.
   */
  public IntegrityCheckResult verifyIntegrity(UUID id) {
    keyRing.requireConfigured();
    var document = documentRepository.findById(id).orElse(null);
    if (document == null) {
      return IntegrityCheckResult.failed(id, now(), "Document not found");
    }
    return verifyDocument(
        document, () -> hashChainService.verifyChainIntegrity(document.getTenantId()));
  }

  /**
   * Fast sampled sweep over the {@code sampleSize} most recently archived ACTIVE documents. The
   * result is flagged as sampled and does not certify the rest of the archive.
   */
  public IntegritySweepResult verifySample(String tenantId, int sampleSize) {
    keyRing.requireConfigured();
    Instant startedAt = now();
    var sample =
        documentRepository.findByTenantIdAndStatusOrderByArchivedAtDesc(
            tenantId, ArchiveStatus.ACTIVE, Pageable.ofSize(Math.max(1, sampleSize)));
    var sweep = new Sweep(tenantId);
    for (ArchivedDocument document : sample) {
      if (Thread.currentThread().isInterrupted()) {
        sweep.cancelled = true;
        break;
      }
      sweep.record(verifyDocument(document, sweep::chain));
    }
    return sweep.result(true, startedAt, now());
  }

  /** Slow exhaustive sweep over every ACTIVE document of the tenant, paged by ID. */
  public IntegritySweepResult verifyAll(String tenantId) {
    keyRing.requireConfigured();
    Instant startedAt = now();
    var sweep = new Sweep(tenantId);
    UUID afterId = new UUID(Long.MIN_VALUE, Long.MIN_VALUE);
    var pageSize = Pageable.ofSize(vaultProperties.sweepPageSize());

    outer:
    while (true) {
      var page =
          documentRepository.findSweepPage(tenantId, ArchiveStatus.ACTIVE, afterId, pageSize);
      if (page.isEmpty()) {
        break;
      }
      for (ArchivedDocument document : page) {
        if (Thread.currentThread().isInterrupted()) {
          sweep.cancelled = true;
          break outer;
        }
        sweep.record(verifyDocument(document, sweep::chain));
        afterId = document.getId();
      }
    }
    var result = sweep.result(false, startedAt, now());
    log.info(
        "Exhaustive integrity sweep of tenant {}: {} checked, {} invalid",
        tenantId,
        result.checked(),
        result.invalid());
    return result;
  }

  private IntegrityCheckResult verifyDocument(
      ArchivedDocument document, Supplier<ChainVerificationResult> chain) {
    UUID id = document.getId();
    try {
      if (!storageService.exists(document.getStoragePath())) {
        return markCorrupted(document, CorruptionType.MISSING, "Archived file not found");
      }

      byte[] plaintext;
      try {
        byte[] ciphertext = storageService.download(document.getStoragePath());
        plaintext =
            cipher.decrypt(
                ciphertext,
                document.getEncryptionIv(),
                document.getEncryptionTag(),
                keyRing.keyFor(document.getTenantId(), document.getKeyScheme()));
      } catch (ResourceNotFoundException e) {
        return markCorrupted(document, CorruptionType.MISSING, "Archived file not found");
      } catch (IntegrityViolationException e) {
        return markCorrupted(document, CorruptionType.ENCRYPTION, "Decryption failed");
      }

      if (!Sha256.hex(plaintext).equals(document.getContentHash())) {
        return markCorrupted(
            document,
            CorruptionType.CONTENT,
            "Content hash mismatch - document may have been tampered with");
      }

      var chainResult = chain.get();
      Instant verifiedAt = now();
      if (!chainResult.valid()) {
        log.error(
            "Document {} verified but ledger of tenant {} is broken: {}",
            id,
            document.getTenantId(),
            chainResult.error());
        return new IntegrityCheckResult(
            id,
            false,
            true,
            true,
            false,
            null,
            verifiedAt,
            "Ledger integrity check failed: " + chainResult.error());
      }

      txTemplate.executeWithoutResult(
          status -> {
            document.markVerified(verifiedAt);
            documentRepository.save(document);
          });
      log.debug("Document {} integrity verified", id);
      return new IntegrityCheckResult(id, true, true, true, true, null, verifiedAt, null);
    } catch (RuntimeException e) {
      log.error("Error verifying document {}: {}", id, e.getMessage(), e);
      return IntegrityCheckResult.failed(id, now(), e.getMessage());
    }
  }

  private IntegrityCheckResult markCorrupted(
      ArchivedDocument document, CorruptionType type, String error) {
    Instant verifiedAt = now();
    txTemplate.executeWithoutResult(
        status -> {
          document.markCorrupted(type, verifiedAt);
          documentRepository.save(document);
        });
    log.error("Marked document {} as corrupted (type: {})", document.getId(), type);
    return IntegrityCheckResult.corrupted(document.getId(), type, verifiedAt, error);
  }

  /** Tallies one sweep and verifies the tenant's ledger at most once. */
  private final class Sweep {
    private final String tenantId;
    private final List<IntegrityCheckResult> failures = new ArrayList<>();
    private ChainVerificationResult chainResult;
    private int checked;
    private int valid;
    private boolean cancelled;

    private Sweep(String tenantId) {
      this.tenantId = tenantId;
    }

    private ChainVerificationResult chain() {
      if (chainResult == null) {
        chainResult = hashChainService.verifyChainIntegrity(tenantId);
      }
      return chainResult;
    }

    private void record(IntegrityCheckResult result) {
      checked++;
      if (result.valid()) {
        valid++;
      } else {
        failures.add(result);
      }
    }

    private IntegritySweepResult result(boolean sampled, Instant startedAt, Instant completedAt) {
      return new IntegritySweepResult(
          tenantId,
          sampled,
          checked,
          valid,
          checked - valid,
          List.copyOf(failures),
          cancelled,
          startedAt,
          completedAt);
    }
  }

  // --- Search & export ---

  @Transactional(readOnly = true)
  public List<ArchivedDocument> search(ArchiveSearchQuery query) {
    keyRing.requireConfigured();
    var documents = searchRepository.search(query);
    log.debug(
        "Found {} documents matching search for tenant {}", documents.size(), query.tenantId());
    return documents;
  }

  /**
   * Packages the tenant's ACTIVE documents, decrypted, with a {@code metadata.json} index into a
   * ZIP stored under {@code {tenantId}/exports/}.
   *
   * @throws CancellationException if the calling thread is interrupted while packaging
   */
  @Transactional
  public ArchiveExportResult exportBatch(String tenantId, ArchiveExportOptions options) {
    keyRing.requireConfigured();
    requireValidTenant(tenantId);
    Instant exportedAt = now();
    String exportId = UUID.randomUUID().toString();

    var documents =
        documentRepository
            .findByTenantIdAndStatusOrderByArchivedAtAsc(tenantId, ArchiveStatus.ACTIVE)
            .stream()
            .filter(options::includes)
            .toList();

    var bundle = new ZipBundleWriter();
    var index = new ArrayList<Map<String, Object>>();
    long totalVersions = 0;
    for (ArchivedDocument document : documents) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("Archive export " + exportId + " was cancelled");
      }
      String entryName =
          "documents/"
              + document.getId()
              + "/"
              + ZipBundleWriter.safeName(document.getOriginalFilename());
      bundle.add(entryName, readContent(document));
      var versions = versionRepository.findByDocumentIdOrderByVersionDesc(document.getId());
      totalVersions += versions.size();

      var entry = new LinkedHashMap<String, Object>();
      entry.put("id", document.getId());
      entry.put("path", entryName);
      entry.put("filename", document.getOriginalFilename());
      entry.put("mimeType", document.getMimeType());
      entry.put("fileSizeBytes", document.getFileSizeBytes());
      entry.put("contentHash", document.getContentHash());
      entry.put("retentionCategory", document.getRetentionCategory());
      entry.put("retentionEndDate", document.getRetentionEndDate());
      entry.put("archivedAt", document.getArchivedAt());
      entry.put("versions", versions.size());
      index.add(entry);
    }

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("exportId", exportId);
    metadata.put("tenantId", tenantId);
    metadata.put("exportedAt", exportedAt);
    metadata.put("documentCount", documents.size());
    metadata.put("retentionCategories", options.retentionCategories());
    metadata.put("archivedFrom", options.archivedFrom());
    metadata.put("archivedTo", options.archivedTo());
    metadata.put("documents", index);
    bundle.add("metadata.json", toJson(metadata));

    byte[] zipBytes = bundle.finish();
    String checksum = Sha256.hex(zipBytes);
    String storageKey = tenantId + "/exports/" + exportId + ".zip";
    storageService.upload(storageKey, zipBytes, "application/zip");

    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.ARCHIVE_EXPORT)
            .entityId(exportId)
            .action(AuditAction.EXPORT)
            .actorId(options.requestedBy())
            .metadata(
                Map.of(
                    "operation", "export_archive",
                    "documentCount", documents.size(),
                    "checksum", checksum,
                    "storageKey", storageKey))
            .build());

    log.info(
        "Created archive export {} with {} documents for tenant {}",
        exportId,
        documents.size(),
        tenantId);
    return new ArchiveExportResult(
        exportId,
        tenantId,
        storageKey,
        zipBytes.length,
        documents.size(),
        totalVersions,
        checksum,
        exportedAt,
        exportedAt.plus(vaultProperties.exportExpiry()));
  }

  private byte[] toJson(Object value) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize export metadata to JSON", e);
    }
  }

  private static void requireValidTenant(String tenantId) {
    if (tenantId == null || !TENANT_ID.matcher(tenantId).matches()) {
      throw new InvalidStateException(
          "Invalid tenant", "Tenant IDs may only contain letters, digits, '-' and '_'");
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
