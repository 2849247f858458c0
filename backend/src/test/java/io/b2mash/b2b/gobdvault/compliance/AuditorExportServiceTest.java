package io.b2mash.b2b.gobdvault.compliance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.gobdvault.archive.ArchiveRequest;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocument;
import io.b2mash.b2b.gobdvault.archive.VaultProperties;
import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditEntityTypes;
import io.b2mash.b2b.gobdvault.audit.AuditEntry;
import io.b2mash.b2b.gobdvault.crypto.Sha256;
import io.b2mash.b2b.gobdvault.exception.ServiceNotConfiguredException;
import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import io.b2mash.b2b.gobdvault.testutil.MutableClock;
import io.b2mash.b2b.gobdvault.testutil.VaultFixture;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuditorExportServiceTest {

  private static final String TENANT = "tenant_export";
  private static final Instant NOW = Instant.parse("2026-09-01T08:00:00Z");
  private static final Instant PERIOD_START = Instant.parse("2026-01-01T00:00:00Z");
  private static final Instant PERIOD_END = Instant.parse("2027-01-01T00:00:00Z");

  @TempDir Path storageRoot;

  private VaultFixture vault;
  private ComplianceReportService reportService;
  private ProcessDocumentationService processDocumentationService;
  private AuditorExportService service;

  @BeforeEach
  void setUp() {
    vault = new VaultFixture(storageRoot, new MutableClock(NOW));
    reportService = mock(ComplianceReportService.class);
    processDocumentationService = mock(ProcessDocumentationService.class);
    when(reportService.generateReport(anyString(), any(), any())).thenReturn(report(92, true));
    when(processDocumentationService.findCurrent(anyString())).thenReturn(Optional.empty());
    service = exportService(vault);
  }

  @Test
  void exportForAuditor_packagesStandardContents() throws IOException {
    var invoice = archive("invoice.pdf", "invoice 1", RetentionCategory.TAX_RELEVANT);
    archive("letter.txt", "dear sir", RetentionCategory.CORRESPONDENCE);

    var result = service.exportForAuditor(TENANT, standardOptions());

    var files = unzip(vault.storage.download(result.storageKey()));
    assertThat(files.keySet())
        .containsExactlyInAnyOrder(
            "compliance-report.json",
            "compliance-summary.csv",
            "audit-log.csv",
            "audit-log.json",
            "document-inventory.csv",
            "process-documentation.json",
            "system-configuration.json",
            "README.txt",
            "manifest.json");
    assertThat(text(files, "document-inventory.csv"))
        .startsWith("ID,Filename,MimeType,Size,Hash,ArchivedAt,RetentionCategory")
        .contains(invoice.getId().toString())
        .contains("letter.txt");
    assertThat(text(files, "audit-log.csv").lines()).hasSize(3);
    assertThat(text(files, "compliance-summary.csv")).contains("OVERALL,Compliance Score");
    assertThat(text(files, "process-documentation.json")).contains("\"exists\" : false");
    assertThat(text(files, "manifest.json")).contains(result.exportId());
    assertThat(result.documentsIncluded()).isEqualTo(2);
    assertThat(result.auditEntriesIncluded()).isEqualTo(2);
    assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
  }

  @Test
  void exportForAuditor_storesChecksumFileNextToZip() {
    archive("invoice.pdf", "invoice 1", RetentionCategory.TAX_RELEVANT);

    var result = service.exportForAuditor(TENANT, standardOptions());

    byte[] zip = vault.storage.download(result.storageKey());
    assertThat(result.storageKey())
        .isEqualTo(TENANT + "/exports/auditor/" + result.exportId() + ".zip");
    assertThat(result.checksum()).isEqualTo(Sha256.hex(zip));
    assertThat(result.fileSize()).isEqualTo(zip.length);
    assertThat(new String(vault.storage.download(result.checksumKey()), StandardCharsets.UTF_8))
        .isEqualTo(result.checksum() + "  " + result.fileName() + "\n");
  }

  @Test
  void exportForAuditor_logsExportEntry() {
    archive("invoice.pdf", "invoice 1", RetentionCategory.TAX_RELEVANT);

    var result = service.exportForAuditor(TENANT, standardOptions());

    List<AuditEntry> chain = vault.ledger.chain(TENANT);
    AuditEntry last = chain.get(chain.size() - 1);
    assertThat(last.getEntityType()).isEqualTo(AuditEntityTypes.AUDITOR_EXPORT);
    assertThat(last.getEntityId()).isEqualTo(result.exportId());
    assertThat(last.getAction()).isEqualTo(AuditAction.EXPORT);
    assertThat(last.getActorId()).isEqualTo("auditor@tax-office.de");
    assertThat(last.getMetadata())
        .containsEntry("operation", "export_for_auditor")
        .containsEntry("checksum", result.checksum())
        .containsEntry("documentCount", 1);
    assertThat(vault.ledger.service().verifyChainIntegrity(TENANT).valid()).isTrue();
  }

  @Test
  void exportForAuditor_includesDecryptedContentAndListsUnreadableDocuments()
      throws IOException {
    var readable = archive("invoice.pdf", "invoice 1", RetentionCategory.TAX_RELEVANT);
    var lost = archive("lost.pdf", "lost content", RetentionCategory.TAX_RELEVANT);
    vault.storage.delete(lost.getStoragePath());
    var options =
        new AuditorExportOptions(
            PERIOD_START, PERIOD_END, false, true, true, false, false, null, "auditor");

    var result = service.exportForAuditor(TENANT, options);

    var files = unzip(vault.storage.download(result.storageKey()));
    assertThat(files.get("documents/" + readable.getId() + "/invoice.pdf"))
        .isEqualTo("invoice 1".getBytes(StandardCharsets.UTF_8));
    assertThat(files).doesNotContainKey("documents/" + lost.getId() + "/lost.pdf");
    assertThat(files).doesNotContainKey("audit-log.csv");
    @SuppressWarnings("unchecked")
    var documents = (Map<String, Object>) result.manifest().get("documents");
    assertThat(documents)
        .containsEntry("contentIncluded", 1)
        .containsEntry("unreadableDocuments", List.of(lost.getId().toString()));
  }

  @Test
  void exportForAuditor_filtersDocumentsByCategory() throws IOException {
    archive("invoice.pdf", "invoice 1", RetentionCategory.TAX_RELEVANT);
    archive("contract.pdf", "contract", RetentionCategory.LEGAL);
    var options =
        new AuditorExportOptions(
            PERIOD_START,
            PERIOD_END,
            false,
            true,
            false,
            false,
            false,
            Set.of(RetentionCategory.LEGAL),
            "auditor");

    var result = service.exportForAuditor(TENANT, options);

    var files = unzip(vault.storage.download(result.storageKey()));
    var inventory = text(files, "document-inventory.csv");
    assertThat(inventory).contains("contract.pdf").doesNotContain("invoice.pdf");
    assertThat(result.documentsIncluded()).isEqualTo(1);
  }

  @Test
  void exportForAuditor_documentContentNeedsConfiguredVault() {
    var unconfigured =
        new VaultFixture(
            storageRoot.resolve("plain"),
            new MutableClock(NOW),
            new VaultProperties(null, false, null, null));
    var options =
        new AuditorExportOptions(
            PERIOD_START, PERIOD_END, true, true, true, true, true, null, "auditor");

    assertThatThrownBy(() -> exportService(unconfigured).exportForAuditor(TENANT, options))
        .isInstanceOf(ServiceNotConfiguredException.class);
    assertThat(unconfigured.ledger.chain(TENANT)).isEmpty();
  }

  @Test
  void exportForAuditor_interruptedThreadCancelsWithoutStoring() {
    archive("invoice.pdf", "invoice 1", RetentionCategory.TAX_RELEVANT);
    int entriesBefore = vault.ledger.chain(TENANT).size();

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> service.exportForAuditor(TENANT, standardOptions()))
          .isInstanceOf(CancellationException.class);
    } finally {
      Thread.interrupted();
    }

    assertThat(vault.ledger.chain(TENANT)).hasSize(entriesBefore);
    assertThat(storageRoot.resolve(TENANT).resolve("exports")).doesNotExist();
  }

  @Test
  void summaryCsv_endsWithOverallRow() {
    var csv =
        new String(AuditorExportService.summaryCsv(report(85, false)), StandardCharsets.UTF_8);

    assertThat(csv.lines().toList())
        .first()
        .isEqualTo("Check,Name,Status,Score,Weight,Error");
    assertThat(csv.lines().toList())
        .last()
        .isEqualTo("OVERALL,Compliance Score,NOT_READY,85,100,");
  }

  private AuditorExportService exportService(VaultFixture fixture) {
    return new AuditorExportService(
        reportService,
        processDocumentationService,
        fixture.ledger.service(),
        fixture.archiveService,
        fixture.keyRing,
        fixture.documents.repository(),
        fixture.storage,
        fixture.retentionProperties,
        new ComplianceProperties(null, null),
        fixture.objectMapper,
        fixture.clock);
  }

  private ArchivedDocument archive(String filename, String content, RetentionCategory category) {
    return vault.archiveService.archive(
        ArchiveRequest.of(
            TENANT,
            content.getBytes(StandardCharsets.UTF_8),
            filename,
            "application/pdf",
            category,
            "alice"));
  }

  private static AuditorExportOptions standardOptions() {
    return AuditorExportOptions.standard(PERIOD_START, PERIOD_END, "auditor@tax-office.de");
  }

  private static ComplianceReport report(int score, boolean certificationReady) {
    var check =
        ComplianceCheck.of(
            ComplianceCheckType.AUDIT_LOG_INTEGRITY, CheckStatus.PASSED, 100, Map.of(), NOW);
    return new ComplianceReport(
        "GOBD-" + TENANT + "-2026-1",
        TENANT,
        NOW,
        PERIOD_START,
        PERIOD_END,
        score,
        List.of(check),
        List.of(),
        List.of(),
        certificationReady,
        null);
  }

  private static String text(Map<String, byte[]> files, String name) {
    return new String(files.get(name), StandardCharsets.UTF_8);
  }

  private static Map<String, byte[]> unzip(byte[] zip) throws IOException {
    var files = new HashMap<String, byte[]>();
    try (var in = new ZipInputStream(new ByteArrayInputStream(zip))) {
      for (var entry = in.getNextEntry(); entry != null; entry = in.getNextEntry()) {
        files.put(entry.getName(), in.readAllBytes());
      }
    }
    return files;
  }
}
