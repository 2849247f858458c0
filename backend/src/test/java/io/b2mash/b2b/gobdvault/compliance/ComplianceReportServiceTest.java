package io.b2mash.b2b.gobdvault.compliance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.gobdvault.archive.ArchiveKeyRing;
import io.b2mash.b2b.gobdvault.archive.ArchiveService;
import io.b2mash.b2b.gobdvault.archive.ArchiveStatus;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocumentRepository;
import io.b2mash.b2b.gobdvault.archive.DocumentVersionRepository;
import io.b2mash.b2b.gobdvault.archive.IntegritySweepResult;
import io.b2mash.b2b.gobdvault.archive.KeyScheme;
import io.b2mash.b2b.gobdvault.audit.AuditEntryFilter;
import io.b2mash.b2b.gobdvault.audit.AuditEntryRepository;
import io.b2mash.b2b.gobdvault.audit.ChainStats;
import io.b2mash.b2b.gobdvault.audit.ChainVerificationResult;
import io.b2mash.b2b.gobdvault.audit.HashChainService;
import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import io.b2mash.b2b.gobdvault.retention.RetentionProperties;
import io.b2mash.b2b.gobdvault.retention.RetentionService;
import io.b2mash.b2b.gobdvault.testutil.MutableClock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ComplianceReportServiceTest {

  private static final String TENANT = "tenant_audit";
  private static final Instant NOW = Instant.parse("2026-07-15T10:00:00Z");

  @Mock private HashChainService hashChainService;
  @Mock private AuditEntryRepository auditEntryRepository;
  @Mock private ArchiveService archiveService;
  @Mock private ArchiveKeyRing keyRing;
  @Mock private ArchivedDocumentRepository documentRepository;
  @Mock private DocumentVersionRepository versionRepository;
  @Mock private RetentionService retentionService;
  @Mock private ProcessDocumentationService processDocumentationService;

  private ComplianceReportService service;

  @BeforeEach
  void setUp() {
    service =
        new ComplianceReportService(
            hashChainService,
            auditEntryRepository,
            archiveService,
            keyRing,
            documentRepository,
            versionRepository,
            retentionService,
            RetentionProperties.defaults(),
            processDocumentationService,
            new ComplianceProperties(25, null),
            new MutableClock(NOW));

    lenient()
        .when(hashChainService.verifyChainIntegrity(TENANT))
        .thenReturn(new ChainVerificationResult(true, 0, 0, null, null));
    lenient().when(archiveService.verifySample(eq(TENANT), anyInt())).thenReturn(sweep(0, 0));
    lenient().when(retentionService.listExpired(TENANT)).thenReturn(List.of());
    lenient().when(hashChainService.countEntries(any(AuditEntryFilter.class))).thenReturn(0L);
    lenient().when(processDocumentationService.findCurrent(TENANT)).thenReturn(Optional.empty());
    lenient().when(keyRing.isConfigured()).thenReturn(true);
    lenient().when(keyRing.currentScheme()).thenReturn(KeyScheme.ROOT);
    lenient()
        .when(hashChainService.getChainStats(TENANT))
        .thenReturn(new ChainStats(TENANT, 0, null, null, 0, null));
  }

  // --- scoring ---

  @Test
  void generateReport_emptyTenantDegradesWithoutFailing() {
    var report = service.generateReport(TENANT, 2026, null);

    assertThat(report.checks()).hasSize(10);
    assertThat(report.complianceScore()).isEqualTo(78);
    assertThat(report.certificationReady()).isFalse();
    assertThat(check(report, ComplianceCheckType.JOURNAL_COMPLETENESS))
        .satisfies(
            c -> {
              assertThat(c.status()).isEqualTo(CheckStatus.WARNING);
              assertThat(c.score()).isEqualTo(50);
            });
    assertThat(check(report, ComplianceCheckType.PROCESS_DOCUMENTATION).status())
        .isEqualTo(CheckStatus.FAILED);
    assertThat(check(report, ComplianceCheckType.DATA_BACKUP).score()).isEqualTo(80);
    assertThat(check(report, ComplianceCheckType.TAX_DOCUMENT_ARCHIVAL).score()).isEqualTo(50);
    assertThat(report.periodStart()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    assertThat(report.periodEnd()).isEqualTo(Instant.parse("2027-01-01T00:00:00Z"));
    assertThat(report.reportId()).startsWith("GOBD-" + TENANT + "-2026-");
  }

  @Test
  void generateReport_runsOnlyRequestedChecks() {
    var options =
        new ReportOptions(null, null, Set.of(ComplianceCheckType.AUDIT_LOG_INTEGRITY));

    var report = service.generateReport(TENANT, 2026, options);

    assertThat(report.checks())
        .extracting(ComplianceCheck::checkType)
        .containsExactly(ComplianceCheckType.AUDIT_LOG_INTEGRITY);
    assertThat(report.complianceScore()).isEqualTo(100);
    verify(archiveService, never()).verifySample(anyString(), anyInt());
  }

  @Test
  void calculateComplianceScore_isWeightedAndOrderInvariant() {
    var checks =
        new ArrayList<>(
            List.of(
                check(ComplianceCheckType.AUDIT_LOG_INTEGRITY, 100),
                check(ComplianceCheckType.JOURNAL_COMPLETENESS, 50),
                check(ComplianceCheckType.SYSTEM_CONFIGURATION, 0)));

    int score = ComplianceReportService.calculateComplianceScore(checks);
    Collections.reverse(checks);

    // (100 * 15 + 50 * 15 + 0 * 3) / 33
    assertThat(score).isEqualTo(68);
    assertThat(ComplianceReportService.calculateComplianceScore(checks)).isEqualTo(score);
    assertThat(ComplianceReportService.calculateComplianceScore(List.of())).isZero();
  }

  @Test
  void isCertificationReady_allowsAtMostTwoHighIssues() {
    var twoHigh = List.of(issue(IssueSeverity.HIGH), issue(IssueSeverity.HIGH));
    var threeHigh =
        List.of(issue(IssueSeverity.HIGH), issue(IssueSeverity.HIGH), issue(IssueSeverity.HIGH));

    assertThat(ComplianceReportService.isCertificationReady(90, twoHigh)).isTrue();
    assertThat(ComplianceReportService.isCertificationReady(90, threeHigh)).isFalse();
    assertThat(ComplianceReportService.isCertificationReady(89, List.of())).isFalse();
    assertThat(
            ComplianceReportService.isCertificationReady(
                100, List.of(issue(IssueSeverity.CRITICAL))))
        .isFalse();
  }

  @Test
  void generateReport_throwingCheckIsFailedWithZeroScore() {
    when(hashChainService.verifyChainIntegrity(TENANT))
        .thenThrow(new IllegalStateException("connection reset"));

    var report = service.generateReport(TENANT, 2026, null);

    var failed = check(report, ComplianceCheckType.AUDIT_LOG_INTEGRITY);
    assertThat(failed.status()).isEqualTo(CheckStatus.FAILED);
    assertThat(failed.score()).isZero();
    assertThat(failed.error()).isEqualTo("connection reset");
    assertThat(report.issues())
        .filteredOn(i -> i.checkType() == ComplianceCheckType.AUDIT_LOG_INTEGRITY)
        .singleElement()
        .satisfies(
            i -> {
              assertThat(i.severity()).isEqualTo(IssueSeverity.HIGH);
              assertThat(i.description()).isEqualTo("connection reset");
            });
  }

  // --- individual checks ---

  @Test
  void archiveCheck_isTieredBySampledValidity() {
    when(archiveService.verifySample(TENANT, 25)).thenReturn(sweep(20, 19));

    var report =
        service.generateReport(
            TENANT, 2026, only(ComplianceCheckType.DOCUMENT_ARCHIVE_INTEGRITY));

    var check = check(report, ComplianceCheckType.DOCUMENT_ARCHIVE_INTEGRITY);
    assertThat(check.score()).isEqualTo(95);
    assertThat(check.status()).isEqualTo(CheckStatus.WARNING);
    assertThat(check.details()).containsEntry("sampled", true).containsEntry("failed", 1);
  }

  @Test
  void archiveCheck_belowNinetyFails() {
    when(archiveService.verifySample(TENANT, 25)).thenReturn(sweep(10, 8));

    var report =
        service.generateReport(
            TENANT, 2026, only(ComplianceCheckType.DOCUMENT_ARCHIVE_INTEGRITY));

    assertThat(check(report, ComplianceCheckType.DOCUMENT_ARCHIVE_INTEGRITY).status())
        .isEqualTo(CheckStatus.FAILED);
  }

  @Test
  void processDocumentationCheck_draftWarnsAndApprovedPasses() {
    var draft = new ProcessDocumentation(TENANT, 1, Map.of("scope", "all"), "cfo", NOW);
    when(processDocumentationService.findCurrent(TENANT)).thenReturn(Optional.of(draft));
    var options = only(ComplianceCheckType.PROCESS_DOCUMENTATION);

    var draftCheck = processDocumentationCheck(service.generateReport(TENANT, 2026, options));
    draft.approve("ceo", NOW);
    var approvedCheck = processDocumentationCheck(service.generateReport(TENANT, 2026, options));

    assertThat(draftCheck.status()).isEqualTo(CheckStatus.WARNING);
    assertThat(draftCheck.score()).isEqualTo(70);
    assertThat(approvedCheck.status()).isEqualTo(CheckStatus.PASSED);
    assertThat(approvedCheck.score()).isEqualTo(100);
  }

  @Test
  void accessControlCheck_scoresAttributedShare() {
    when(auditEntryRepository.countUserEntries(eq(TENANT), any(), any())).thenReturn(200L);
    when(auditEntryRepository.countAnonymousUserEntries(eq(TENANT), any(), any()))
        .thenReturn(10L);

    var report = service.generateReport(TENANT, 2026, only(ComplianceCheckType.ACCESS_CONTROL));

    var check = check(report, ComplianceCheckType.ACCESS_CONTROL);
    assertThat(check.status()).isEqualTo(CheckStatus.WARNING);
    assertThat(check.score()).isEqualTo(95);
  }

  @Test
  void taxCheck_passesWithTaxDocuments() {
    when(documentRepository.countByTenantIdAndRetentionCategoryAndStatusNot(
            TENANT, RetentionCategory.TAX_RELEVANT, ArchiveStatus.DELETED))
        .thenReturn(3L);

    var report =
        service.generateReport(TENANT, 2026, only(ComplianceCheckType.TAX_DOCUMENT_ARCHIVAL));

    assertThat(check(report, ComplianceCheckType.TAX_DOCUMENT_ARCHIVAL).status())
        .isEqualTo(CheckStatus.PASSED);
  }

  @Test
  void systemConfigurationCheck_failsWithoutEncryptionKey() {
    when(keyRing.isConfigured()).thenReturn(false);

    var report =
        service.generateReport(TENANT, 2026, only(ComplianceCheckType.SYSTEM_CONFIGURATION));

    var check = check(report, ComplianceCheckType.SYSTEM_CONFIGURATION);
    assertThat(check.status()).isEqualTo(CheckStatus.FAILED);
    assertThat(check.details()).containsEntry("encryptionEnabled", false);
  }

  // --- status, issues, recommendations ---

  @Test
  void checkStatus_runsCriticalChecksOnly() {
    var status = service.checkStatus(TENANT);

    assertThat(status.overallStatus()).isEqualTo(ComplianceStatus.OverallStatus.COMPLIANT);
    assertThat(status.complianceScore()).isEqualTo(100);
    verify(processDocumentationService, never()).findCurrent(anyString());
  }

  @Test
  void checkStatus_highIssueIsWarning() {
    when(hashChainService.verifyChainIntegrity(TENANT))
        .thenReturn(new ChainVerificationResult(false, 3, 10, UUID.randomUUID(), "broken"));

    var status = service.checkStatus(TENANT);

    assertThat(status.overallStatus()).isEqualTo(ComplianceStatus.OverallStatus.WARNING);
    assertThat(status.highIssues()).isEqualTo(1);
    assertThat(status.complianceScore()).isEqualTo(63);
  }

  @Test
  void getIssues_mapsStatusToSeverity() {
    var issues = service.getIssues(TENANT);

    assertThat(issues)
        .extracting(ComplianceIssue::checkType, ComplianceIssue::severity)
        .containsExactlyInAnyOrder(
            tuple(
                ComplianceCheckType.JOURNAL_COMPLETENESS, IssueSeverity.MEDIUM),
            tuple(
                ComplianceCheckType.PROCESS_DOCUMENTATION, IssueSeverity.HIGH),
            tuple(
                ComplianceCheckType.DATA_BACKUP, IssueSeverity.MEDIUM),
            tuple(
                ComplianceCheckType.TAX_DOCUMENT_ARCHIVAL, IssueSeverity.MEDIUM));
    assertThat(issues)
        .filteredOn(i -> i.checkType() == ComplianceCheckType.PROCESS_DOCUMENTATION)
        .singleElement()
        .satisfies(i -> assertThat(i.remediation()).isNotEmpty());
  }

  @Test
  void recommendations_flagLowScoreAndMissingDocumentation() {
    var report = service.generateReport(TENANT, 2026, null);

    assertThat(report.recommendations())
        .containsExactly(
            "Improve the compliance score through regular reviews.",
            "Create and approve a complete process documentation.");
  }

  @Test
  void statistics_areNullWhenGatheringFails() {
    when(hashChainService.getChainStats(TENANT)).thenThrow(new IllegalStateException("down"));

    var report = service.generateReport(TENANT, 2026, null);

    assertThat(report.statistics()).isNull();
    assertThat(report.checks()).hasSize(10);
  }

  private static ReportOptions only(ComplianceCheckType type) {
    return new ReportOptions(null, null, EnumSet.of(type));
  }

  private static ComplianceCheck check(ComplianceReport report, ComplianceCheckType type) {
    return report.checks().stream()
        .filter(c -> c.checkType() == type)
        .findFirst()
        .orElseThrow();
  }

  private static ComplianceCheck processDocumentationCheck(ComplianceReport report) {
    return check(report, ComplianceCheckType.PROCESS_DOCUMENTATION);
  }

  private static ComplianceCheck check(ComplianceCheckType type, int score) {
    return ComplianceCheck.of(type, CheckStatus.PASSED, score, Map.of(), NOW);
  }

  private static ComplianceIssue issue(IssueSeverity severity) {
    return new ComplianceIssue(
        "ISSUE-" + UUID.randomUUID(),
        ComplianceCheckType.CHANGE_TRACKING,
        severity,
        "title",
        "description",
        NOW,
        List.of());
  }

  private static IntegritySweepResult sweep(int checked, int valid) {
    return new IntegritySweepResult(
        TENANT, true, checked, valid, checked - valid, List.of(), false, NOW, NOW);
  }
}
