package io.b2mash.b2b.gobdvault.compliance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.gobdvault.archive.ArchiveKeyRing;
import io.b2mash.b2b.gobdvault.archive.ArchiveService;
import io.b2mash.b2b.gobdvault.archive.ArchiveStatus;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocument;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocumentRepository;
import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditEntityTypes;
import io.b2mash.b2b.gobdvault.audit.AuditEntry;
import io.b2mash.b2b.gobdvault.audit.AuditEntryBuilder;
import io.b2mash.b2b.gobdvault.audit.AuditEntryFilter;
import io.b2mash.b2b.gobdvault.audit.HashChainService;
import io.b2mash.b2b.gobdvault.crypto.Sha256;
import io.b2mash.b2b.gobdvault.exception.IntegrityViolationException;
import io.b2mash.b2b.gobdvault.export.CsvTable;
import io.b2mash.b2b.gobdvault.export.ZipBundleWriter;
import io.b2mash.b2b.gobdvault.integration.storage.StorageService;
import io.b2mash.b2b.gobdvault.retention.RetentionProperties;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Assembles the checksummed package handed to a tax auditor: compliance report, ledger extract,
 * document inventory (optionally with decrypted content), process documentation, configuration
 * snapshot, README and manifest. The ZIP and a {@code .sha256} file are written to object storage
 * under {@code {tenantId}/exports/auditor/}.
 */
@Service
public class AuditorExportService {

  private static final Logger log = LoggerFactory.getLogger(AuditorExportService.class);

  static final Duration EXPORT_EXPIRY = Duration.ofDays(30);
  static final List<String> AUDIT_LOG_HEADER =
      List.of(
          "ID", "Timestamp", "EntityType", "EntityID", "Action", "ActorType", "ActorID", "Hash");
  static final List<String> INVENTORY_HEADER =
      List.of(
          "ID", "Filename", "MimeType", "Size", "Hash", "ArchivedAt", "RetentionCategory");
  private static final int LEDGER_PAGE_SIZE = 500;

  private final ComplianceReportService reportService;
  private final ProcessDocumentationService processDocumentationService;
  private final HashChainService hashChainService;
  private final ArchiveService archiveService;
  private final ArchiveKeyRing keyRing;
  private final ArchivedDocumentRepository documentRepository;
  private final StorageService storageService;
  private final RetentionProperties retentionProperties;
  private final ComplianceProperties complianceProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AuditorExportService(
      ComplianceReportService reportService,
      ProcessDocumentationService processDocumentationService,
      HashChainService hashChainService,
      ArchiveService archiveService,
      ArchiveKeyRing keyRing,
      ArchivedDocumentRepository documentRepository,
      StorageService storageService,
      RetentionProperties retentionProperties,
      ComplianceProperties complianceProperties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.reportService = reportService;
    this.processDocumentationService = processDocumentationService;
    this.hashChainService = hashChainService;
    this.archiveService = archiveService;
    this.keyRing = keyRing;
    this.documentRepository = documentRepository;
    this.storageService = storageService;
    this.retentionProperties = retentionProperties;
    this.complianceProperties = complianceProperties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  // Export DTO records keep JPA entities out of the serialized package
  private record ExportAuditEntry(
      UUID id,
      long sequence,
      Instant timestamp,
      String entityType,
      String entityId,
      String action,
      String actorType,
      String actorId,
      Map<String, Object> previousState,
      Map<String, Object> newState,
      Map<String, Object> metadata,
      String previousHash,
      String hash) {}

  private record ExportProcessDocumentation(
      int version,
      String status,
      Instant createdAt,
      String createdBy,
      String approvedBy,
      Instant approvedAt,
      Map<String, Object> content) {}

  /**
   * Builds, stores and ledger-logs an auditor package.
   *
   * @throws CancellationException if the calling thread is interrupted while packaging
   * @throws io.b2mash.b2b.gobdvault.exception.ServiceNotConfiguredException if document content is
   *     requested while the vault has no key
   */
  public AuditorExportResult exportForAuditor(String tenantId, AuditorExportOptions options) {
    if (options.includeDocumentContent()) {
      keyRing.requireConfigured();
    }
    Instant generatedAt = now();
    String exportId = "AUDIT-" + tenantId + "-" + generatedAt.toEpochMilli();
    log.info("Creating auditor export {} for tenant {}", exportId, tenantId);

    var bundle = new ZipBundleWriter();
    var manifest = new LinkedHashMap<String, Object>();
    manifest.put("exportId", exportId);
    manifest.put("tenantId", tenantId);
    manifest.put("generatedAt", generatedAt);
    manifest.put("periodStart", options.periodStart());
    manifest.put("periodEnd", options.periodEnd());

    // 1. Compliance report
    checkCancelled(exportId);
    int reportYear = LocalDate.ofInstant(options.periodStart(), ZoneOffset.UTC).getYear();
    var report =
        reportService.generateReport(
            tenantId,
            reportYear,
            new ReportOptions(options.periodStart(), options.periodEnd(), null));
    bundle.add("compliance-report.json", toJson(report));
    bundle.add("compliance-summary.csv", summaryCsv(report));
    manifest.put(
        "complianceReport",
        Map.of(
            "fileName", "compliance-report.json",
            "summaryFile", "compliance-summary.csv",
            "complianceScore", report.complianceScore(),
            "certificationReady", report.certificationReady()));

    // 2. Ledger extract
    long auditEntries = 0;
    if (options.includeAuditLog()) {
      auditEntries = addAuditLog(bundle, tenantId, options, exportId);
      manifest.put(
          "auditLog",
          Map.of(
              "fileName", "audit-log.csv",
              "jsonFile", "audit-log.json",
              "entryCount", auditEntries));
    }

    // 3. Documents
    int documentCount = 0;
    if (options.includeDocuments()) {
      var documentsSection = addDocuments(bundle, tenantId, options, exportId);
      documentCount = (int) documentsSection.get("documentCount");
      manifest.put("documents", documentsSection);
    }

    // 4. Process documentation
    if (options.includeProcessDocs()) {
      checkCancelled(exportId);
      bundle.add("process-documentation.json", toJson(processDocumentation(tenantId)));
      manifest.put("processDocumentation", Map.of("fileName", "process-documentation.json"));
    }

    // 5. Configuration snapshot
    if (options.includeSystemConfig()) {
      checkCancelled(exportId);
      bundle.add("system-configuration.json", toJson(systemConfiguration(tenantId, generatedAt)));
      manifest.put("systemConfiguration", Map.of("fileName", "system-configuration.json"));
    }

    bundle.add("README.txt", readme(generatedAt));
    manifest.put("readme", Map.of("fileName", "README.txt"));
    manifest.put("files", new ArrayList<>(bundle.entryNames()));
    bundle.add("manifest.json", toJson(manifest));

    checkCancelled(exportId);
    byte[] zipBytes = bundle.finish();
    String checksum = Sha256.hex(zipBytes);
    String fileName = exportId + ".zip";
    String storageKey = tenantId + "/exports/auditor/" + fileName;
    String checksumKey = storageKey + ".sha256";
    storageService.upload(storageKey, zipBytes, "application/zip");
    byte[] checksumFile = (checksum + "  " + fileName + "\n").getBytes(StandardCharsets.UTF_8);
    storageService.upload(checksumKey, checksumFile, "text/plain");

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("operation", "export_for_auditor");
    metadata.put("periodStart", options.periodStart());
    metadata.put("periodEnd", options.periodEnd());
    metadata.put("documentCount", documentCount);
    metadata.put("auditEntryCount", auditEntries);
    metadata.put("checksum", checksum);
    metadata.put("storageKey", storageKey);
    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.AUDITOR_EXPORT)
            .entityId(exportId)
            .action(AuditAction.EXPORT)
            .actorId(options.requestedBy())
            .metadata(metadata)
            .build());

    log.info(
        "Created auditor export {} for tenant {}: {} bytes, {} documents, {} ledger entries",
        exportId,
        tenantId,
        zipBytes.length,
        documentCount,
        auditEntries);
    return new AuditorExportResult(
        exportId,
        tenantId,
        generatedAt,
        options.periodStart(),
        options.periodEnd(),
        storageKey,
        checksumKey,
        fileName,
        zipBytes.length,
        checksum,
        "sha256",
        manifest,
        generatedAt.plus(EXPORT_EXPIRY),
        documentCount,
        auditEntries);
  }

  private long addAuditLog(
      ZipBundleWriter bundle, String tenantId, AuditorExportOptions options, String exportId) {
    var filter = AuditEntryFilter.forPeriod(tenantId, options.periodStart(), options.periodEnd());
    var csv = new CsvTable(AUDIT_LOG_HEADER);
    var json = new ArrayList<ExportAuditEntry>();
    int page = 0;
    Page<AuditEntry> entries;
    do {
      checkCancelled(exportId);
      entries = hashChainService.findEntries(filter, PageRequest.of(page++, LEDGER_PAGE_SIZE));
      for (AuditEntry entry : entries) {
        csv.addRow(
            List.of(
                entry.getId(),
                entry.getTimestamp(),
                entry.getEntityType(),
                entry.getEntityId(),
                entry.getAction(),
                entry.getActorType(),
                entry.getActorId() != null ? entry.getActorId() : "",
                entry.getHash()));
        json.add(
            new ExportAuditEntry(
                entry.getId(),
                entry.getSequence(),
                entry.getTimestamp(),
                entry.getEntityType(),
                entry.getEntityId(),
                entry.getAction().name(),
                entry.getActorType().name(),
                entry.getActorId(),
                entry.getPreviousState(),
                entry.getNewState(),
                entry.getMetadata(),
                entry.getPreviousHash(),
                entry.getHash()));
      }
    } while (entries.hasNext());
    bundle.add("audit-log.csv", csv.toBytes());
    bundle.add("audit-log.json", toJson(json));
    return csv.rowCount();
  }

  private Map<String, Object> addDocuments(
      ZipBundleWriter bundle, String tenantId, AuditorExportOptions options, String exportId) {
    var documents =
        documentRepository
            .findByTenantIdAndArchivedAtGreaterThanEqualAndArchivedAtLessThan(
                tenantId, options.periodStart(), options.periodEnd())
            .stream()
            .filter(d -> d.getStatus() != ArchiveStatus.DELETED)
            .filter(d -> options.includesCategory(d.getRetentionCategory()))
            .toList();

    var inventory = new CsvTable(INVENTORY_HEADER);
    var unreadable = new ArrayList<String>();
    long totalSize = 0;
    int contentIncluded = 0;
    for (ArchivedDocument document : documents) {
      checkCancelled(exportId);
      inventory.addRow(
          List.of(
              document.getId(),
              document.getOriginalFilename(),
              document.getMimeType(),
              document.getFileSizeBytes(),
              document.getContentHash(),
              document.getArchivedAt(),
              document.getRetentionCategory()));
      totalSize += document.getFileSizeBytes();

      if (options.includeDocumentContent() && document.isActive()) {
        try {
          bundle.add(
              "documents/"
                  + document.getId()
                  + "/"
                  + ZipBundleWriter.safeName(document.getOriginalFilename()),
              archiveService.readContent(document));
          contentIncluded++;
        } catch (IntegrityViolationException e) {
          log.warn(
              "Auditor export {}: document {} left out, content failed verification",
              exportId,
              document.getId());
          unreadable.add(document.getId().toString());
        }
      }
    }
    bundle.add("document-inventory.csv", inventory.toBytes());

    var section = new LinkedHashMap<String, Object>();
    section.put("inventoryFile", "document-inventory.csv");
    section.put("documentCount", documents.size());
    section.put("totalSize", totalSize);
    if (options.includeDocumentContent()) {
      section.put("directoryName", "documents");
      section.put("contentIncluded", contentIncluded);
      section.put("unreadableDocuments", unreadable);
    }
    return section;
  }

  private Object processDocumentation(String tenantId) {
    return processDocumentationService
        .findCurrent(tenantId)
        .<Object>map(
            doc ->
                new ExportProcessDocumentation(
                    doc.getVersion(),
                    doc.getStatus().name(),
                    doc.getCreatedAt(),
                    doc.getCreatedBy(),
                    doc.getApprovedBy(),
                    doc.getApprovedAt(),
                    doc.getContent()))
        .orElseGet(() -> Map.of("exists", false));
  }

  private Map<String, Object> systemConfiguration(String tenantId, Instant capturedAt) {
    var chain = hashChainService.getChainStats(tenantId);
    var config = new LinkedHashMap<String, Object>();
    config.put("tenantId", tenantId);
    config.put("capturedAt", capturedAt);
    config.put("retentionPeriodsYears", retentionProperties.periods());
    config.put("gracePeriodDays", retentionProperties.gracePeriodDays());
    config.put("encryptionEnabled", keyRing.isConfigured());
    config.put("encryptionAlgorithm", "AES-256-GCM");
    config.put("keyScheme", keyRing.currentScheme().name());
    config.put("hashChainEnabled", true);
    config.put("hashAlgorithm", "SHA-256");
    config.put("ledgerEntries", chain.totalEntries());
    config.put("ledgerHeadSequence", chain.latestSequence());
    config.put("ledgerHeadHash", chain.latestHash());
    config.put("backupFrequency", complianceProperties.backupFrequency());
    return config;
  }

  static byte[] summaryCsv(ComplianceReport report) {
    var csv = new CsvTable(List.of("Check", "Name", "Status", "Score", "Weight", "Error"));
    for (ComplianceCheck check : report.checks()) {
      csv.addRow(
          List.of(
              check.checkType(),
              check.name(),
              check.status(),
              check.score(),
              check.weight(),
              check.error() != null ? check.error() : ""));
    }
    csv.addRow(
        List.of(
            "OVERALL",
            "Compliance Score",
            report.certificationReady() ? "CERTIFICATION_READY" : "NOT_READY",
            report.complianceScore(),
            100,
            ""));
    return csv.toBytes();
  }

  private static String readme(Instant generatedAt) {
    return """
        GOBD COMPLIANCE EXPORT PACKAGE
        ==============================

        This package contains the data and documents relevant for a tax audit.

        CONTENTS:
        - compliance-report.json: GoBD compliance report for machine processing
        - compliance-summary.csv: Check results as CSV
        - audit-log.csv: Ledger entries of the audited period
        - audit-log.json: The same entries including state snapshots and hashes
        - document-inventory.csv: Inventory of archived documents
        - documents/: Decrypted documents, when requested
        - process-documentation.json: Current process documentation
        - system-configuration.json: Snapshot of the system configuration
        - manifest.json: Overview of all included files

        CHECKSUM:
        The integrity of this package can be verified with the SHA-256 checksum stored
        next to it (<export-id>.zip.sha256).

        Generated: %s
        """
        .formatted(generatedAt);
  }

  private static void checkCancelled(String exportId) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Auditor export " + exportId + " was cancelled");
    }
  }

  private byte[] toJson(Object value) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize auditor export content to JSON", e);
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
