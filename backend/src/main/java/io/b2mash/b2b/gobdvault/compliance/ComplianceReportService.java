package io.b2mash.b2b.gobdvault.compliance;

import io.b2mash.b2b.gobdvault.archive.ArchiveKeyRing;
import io.b2mash.b2b.gobdvault.archive.ArchiveService;
import io.b2mash.b2b.gobdvault.archive.ArchiveStatus;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocument;
import io.b2mash.b2b.gobdvault.archive.ArchivedDocumentRepository;
import io.b2mash.b2b.gobdvault.archive.DocumentVersionRepository;
import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditEntityTypes;
import io.b2mash.b2b.gobdvault.audit.AuditEntryFilter;
import io.b2mash.b2b.gobdvault.audit.AuditEntryRepository;
import io.b2mash.b2b.gobdvault.audit.HashChainService;
import io.b2mash.b2b.gobdvault.retention.ExpiredDocument;
import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import io.b2mash.b2b.gobdvault.retention.RetentionProperties;
import io.b2mash.b2b.gobdvault.retention.RetentionService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Scores a tenant against ten weighted GoBD checks and derives issues and recommendations.
 *
 * <p>A check that throws is recorded as FAILED with score 0; the report itself always completes.
 * Checks only read, except that the sampled archive check records each document's verification
 * outcome.
 */
@Service
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceReportService {

  private static final Logger log = LoggerFactory.getLogger(ComplianceReportService.class);

  static final Set<ComplianceCheckType> CRITICAL_CHECKS =
      EnumSet.of(
          ComplianceCheckType.AUDIT_LOG_INTEGRITY,
          ComplianceCheckType.DOCUMENT_ARCHIVE_INTEGRITY,
          ComplianceCheckType.RETENTION_POLICY);

  static final int CERTIFICATION_THRESHOLD = 90;
  static final int MAX_HIGH_ISSUES_FOR_CERTIFICATION = 2;
  private static final int COMPLIANT_THRESHOLD = 80;

  private final HashChainService hashChainService;
  private final AuditEntryRepository auditEntryRepository;
  private final ArchiveService archiveService;
  private final ArchiveKeyRing keyRing;
  private final ArchivedDocumentRepository documentRepository;
  private final DocumentVersionRepository versionRepository;
  private final RetentionService retentionService;
  private final RetentionProperties retentionProperties;
  private final ProcessDocumentationService processDocumentationService;
  private final ComplianceProperties properties;
  private final Clock clock;

  public ComplianceReportService(
      HashChainService hashChainService,
      AuditEntryRepository auditEntryRepository,
      ArchiveService archiveService,
      ArchiveKeyRing keyRing,
      ArchivedDocumentRepository documentRepository,
      DocumentVersionRepository versionRepository,
      RetentionService retentionService,
      RetentionProperties retentionProperties,
      ProcessDocumentationService processDocumentationService,
      ComplianceProperties properties,
      Clock clock) {
    this.hashChainService = hashChainService;
    this.auditEntryRepository = auditEntryRepository;
    this.archiveService = archiveService;
    this.keyRing = keyRing;
    this.documentRepository = documentRepository;
    this.versionRepository = versionRepository;
    this.retentionService = retentionService;
    this.retentionProperties = retentionProperties;
    this.processDocumentationService = processDocumentationService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Full report over a calendar year (UTC) unless {@code options} narrows the period.
   *
   * @param year report year; null means the current year
   */
  public ComplianceReport generateReport(String tenantId, Integer year, ReportOptions options) {
    var opts = options != null ? options : ReportOptions.defaults();
    Instant now = now();
    int reportYear = year != null ? year : LocalDate.ofInstant(now, ZoneOffset.UTC).getYear();
    Instant periodStart = opts.periodStart() != null ? opts.periodStart() : yearStart(reportYear);
    Instant periodEnd = opts.periodEnd() != null ? opts.periodEnd() : yearStart(reportYear + 1);
    String reportId = "GOBD-" + tenantId + "-" + reportYear + "-" + now.toEpochMilli();

    var checks = runChecks(tenantId, periodStart, periodEnd, opts.checks());
    int score = calculateComplianceScore(checks);
    var issues = extractIssues(checks);
    var recommendations = recommendations(checks, issues);
    boolean certificationReady = isCertificationReady(score, issues);

    var report =
        new ComplianceReport(
            reportId,
            tenantId,
            now,
            periodStart,
            periodEnd,
            score,
            checks,
            issues,
            recommendations,
            certificationReady,
            gatherStatistics(tenantId, now));

    log.info(
        "Generated compliance report {}: score {}%, certification ready: {}",
        reportId,
        score,
        certificationReady);
    return report;
  }

  /** Runs the critical checks over the year to date. */
  public ComplianceStatus checkStatus(String tenantId) {
    Instant now = now();
    var checks =
        runChecks(
            tenantId,
            yearStart(LocalDate.ofInstant(now, ZoneOffset.UTC).getYear()),
            now,
            CRITICAL_CHECKS);
    int score = calculateComplianceScore(checks);
    var issues = extractIssues(checks);

    long critical = countSeverity(issues, IssueSeverity.CRITICAL);
    long high = countSeverity(issues, IssueSeverity.HIGH);
    ComplianceStatus.OverallStatus overall;
    if (critical > 0) {
      overall = ComplianceStatus.OverallStatus.NON_COMPLIANT;
    } else if (high > 0 || score < COMPLIANT_THRESHOLD) {
      overall = ComplianceStatus.OverallStatus.WARNING;
    } else {
      overall = ComplianceStatus.OverallStatus.COMPLIANT;
    }

    log.debug("Compliance status of tenant {}: {} ({}%)", tenantId, overall, score);
    return new ComplianceStatus(
        tenantId,
        overall,
        score,
        now,
        critical,
        high,
        countSeverity(issues, IssueSeverity.MEDIUM),
        countSeverity(issues, IssueSeverity.LOW),
        isCertificationReady(score, issues));
  }

  /** Issues of all ten checks over the year to date. */
  public List<ComplianceIssue> getIssues(String tenantId) {
    Instant now = now();
    var checks =
        runChecks(
            tenantId,
            yearStart(LocalDate.ofInstant(now, ZoneOffset.UTC).getYear()),
            now,
            EnumSet.allOf(ComplianceCheckType.class));
    return extractIssues(checks);
  }

  /**
   * Weighted mean of the check scores, rounded half up; 0 without checks. Depends only on the
   * (score, weight) pairs, not on their order.
   */
  public static int calculateComplianceScore(List<ComplianceCheck> checks) {
    long weightedScore = 0;
    long totalWeight = 0;
    for (ComplianceCheck check : checks) {
      weightedScore += (long) check.score() * check.weight();
      totalWeight += check.weight();
    }
    return totalWeight > 0 ? (int) Math.round((double) weightedScore / totalWeight) : 0;
  }

  /** Score of at least 90, no CRITICAL issue and at most two HIGH issues. */
  public static boolean isCertificationReady(int score, List<ComplianceIssue> issues) {
    return score >= CERTIFICATION_THRESHOLD
        && countSeverity(issues, IssueSeverity.CRITICAL) == 0
        && countSeverity(issues, IssueSeverity.HIGH) <= MAX_HIGH_ISSUES_FOR_CERTIFICATION;
  }

  // --- Checks ---

  List<ComplianceCheck> runChecks(
      String tenantId, Instant from, Instant to, Set<ComplianceCheckType> types) {
    var checks = new ArrayList<ComplianceCheck>(types.size());
    for (ComplianceCheckType type : ComplianceCheckType.values()) {
      if (!types.contains(type)) {
        continue;
      }
      try {
        checks.add(runCheck(type, tenantId, from, to));
      } catch (RuntimeException e) {
        log.error("Compliance check {} failed for tenant {}", type, tenantId, e);
        checks.add(ComplianceCheck.failed(type, now(), e.getMessage()));
      }
    }
    return checks;
  }

  private ComplianceCheck runCheck(
      ComplianceCheckType type, String tenantId, Instant from, Instant to) {
    return switch (type) {
      case AUDIT_LOG_INTEGRITY -> checkAuditLogIntegrity(tenantId);
      case DOCUMENT_ARCHIVE_INTEGRITY -> checkArchiveIntegrity(tenantId);
      case RETENTION_POLICY -> checkRetentionPolicy(tenantId);
      case JOURNAL_COMPLETENESS -> checkJournalCompleteness(tenantId, from, to);
      case PROCESS_DOCUMENTATION -> checkProcessDocumentation(tenantId);
      case CHANGE_TRACKING -> checkChangeTracking(tenantId, from, to);
      case ACCESS_CONTROL -> checkAccessControl(tenantId, from, to);
      case DATA_BACKUP -> checkDataBackup();
      case TAX_DOCUMENT_ARCHIVAL -> checkTaxDocumentArchival(tenantId);
      case SYSTEM_CONFIGURATION -> checkSystemConfiguration();
    };
  }

  private ComplianceCheck checkAuditLogIntegrity(String tenantId) {
    var result = hashChainService.verifyChainIntegrity(tenantId);
    var details = new LinkedHashMap<String, Object>();
    details.put("totalEntries", result.totalEntries());
    details.put("verifiedEntries", result.verifiedEntries());
    details.put("firstInvalidEntryId", result.firstInvalidEntryId());
    Instant checkedAt = now();
    var type = ComplianceCheckType.AUDIT_LOG_INTEGRITY;
    return new ComplianceCheck(
        type,
        type.displayName(),
        type.description(),
        result.valid() ? CheckStatus.PASSED : CheckStatus.FAILED,
        result.valid() ? 100 : 0,
        type.weight(),
        details,
        checkedAt,
        result.error());
  }

  private ComplianceCheck checkArchiveIntegrity(String tenantId) {
    var sweep = archiveService.verifySample(tenantId, properties.sampleSize());
    int score = sweep.validPercentage();
    var details = new LinkedHashMap<String, Object>();
    details.put("sampled", true);
    details.put("sampleSize", properties.sampleSize());
    details.put("totalSampled", sweep.checked());
    details.put("verified", sweep.valid());
    details.put("failed", sweep.invalid());
    return ComplianceCheck.of(
        ComplianceCheckType.DOCUMENT_ARCHIVE_INTEGRITY, tiered(score), score, details, now());
  }

  private ComplianceCheck checkRetentionPolicy(String tenantId) {
    List<ExpiredDocument> expired = retentionService.listExpired(tenantId);
    long total = documentRepository.countByTenantIdAndStatusNot(tenantId, ArchiveStatus.DELETED);
    long violations = expired.stream().filter(ExpiredDocument::canDelete).count();
    int score = total > 0 ? (int) Math.round((total - violations) * 100.0 / total) : 100;
    return ComplianceCheck.of(
        ComplianceCheckType.RETENTION_POLICY,
        violations == 0 ? CheckStatus.PASSED : CheckStatus.WARNING,
        score,
        Map.of(
            "totalDocuments", total,
            "expiredDocuments", expired.size(),
            "violations", violations),
        now());
  }

  private ComplianceCheck checkJournalCompleteness(String tenantId, Instant from, Instant to) {
    long entries = hashChainService.countEntries(AuditEntryFilter.forPeriod(tenantId, from, to));
    return ComplianceCheck.of(
        ComplianceCheckType.JOURNAL_COMPLETENESS,
        entries > 0 ? CheckStatus.PASSED : CheckStatus.WARNING,
        entries > 0 ? 100 : 50,
        Map.of("auditEntries", entries),
        now());
  }

  private ComplianceCheck checkProcessDocumentation(String tenantId) {
    var current = processDocumentationService.findCurrent(tenantId);
    var details = new LinkedHashMap<String, Object>();
    details.put("exists", current.isPresent());
    CheckStatus status = CheckStatus.FAILED;
    int score = 0;
    if (current.isPresent()) {
      var doc = current.get();
      details.put("version", doc.getVersion());
      details.put("status", doc.getStatus().name());
      details.put("approvedAt", doc.getApprovedAt());
      if (doc.getStatus() == ProcessDocumentationStatus.APPROVED) {
        status = CheckStatus.PASSED;
        score = 100;
      } else {
        status = CheckStatus.WARNING;
        score = 70;
      }
    }
    return ComplianceCheck.of(
        ComplianceCheckType.PROCESS_DOCUMENTATION, status, score, details, now());
  }

  private ComplianceCheck checkChangeTracking(String tenantId, Instant from, Instant to) {
    long archived =
        documentRepository.countByTenantIdAndArchivedAtGreaterThanEqualAndArchivedAtLessThan(
            tenantId, from, to);
    long tracked = documentRepository.countWithCreateEntry(tenantId, from, to);
    int coverage = archived > 0 ? (int) Math.round(tracked * 100.0 / archived) : 100;
    long changeEntries =
        hashChainService.countEntries(
                new AuditEntryFilter(
                    tenantId, AuditEntityTypes.DOCUMENT, null, AuditAction.UPDATE, null, from, to))
            + hashChainService.countEntries(
                new AuditEntryFilter(
                    tenantId, AuditEntityTypes.DOCUMENT, null, AuditAction.DELETE, null, from, to));
    return ComplianceCheck.of(
        ComplianceCheckType.CHANGE_TRACKING,
        tiered(coverage),
        coverage,
        Map.of(
            "documentsArchived", archived,
            "documentsWithCreateEntry", tracked,
            "changeEntries", changeEntries),
        now());
  }

  private ComplianceCheck checkAccessControl(String tenantId, Instant from, Instant to) {
    long userEntries = auditEntryRepository.countUserEntries(tenantId, from, to);
    long anonymous = auditEntryRepository.countAnonymousUserEntries(tenantId, from, to);
    int score =
        userEntries > 0 ? (int) Math.round((userEntries - anonymous) * 100.0 / userEntries) : 100;
    return ComplianceCheck.of(
        ComplianceCheckType.ACCESS_CONTROL,
        anonymous == 0 ? CheckStatus.PASSED : CheckStatus.WARNING,
        anonymous == 0 ? 100 : score,
        Map.of("userEntries", userEntries, "unattributedUserEntries", anonymous),
        now());
  }

  // Attestation only: there are no backup logs to inspect.
  private ComplianceCheck checkDataBackup() {
    var details = new LinkedHashMap<String, Object>();
    details.put("backupFrequency", properties.backupFrequency());
    details.put("lastBackup", null);
    details.put("verified", false);
    return ComplianceCheck.of(
        ComplianceCheckType.DATA_BACKUP, CheckStatus.WARNING, 80, details, now());
  }

  private ComplianceCheck checkTaxDocumentArchival(String tenantId) {
    long taxDocuments =
        documentRepository.countByTenantIdAndRetentionCategoryAndStatusNot(
            tenantId, RetentionCategory.TAX_RELEVANT, ArchiveStatus.DELETED);
    return ComplianceCheck.of(
        ComplianceCheckType.TAX_DOCUMENT_ARCHIVAL,
        taxDocuments > 0 ? CheckStatus.PASSED : CheckStatus.WARNING,
        taxDocuments > 0 ? 100 : 50,
        Map.of("taxDocuments", taxDocuments),
        now());
  }

  private ComplianceCheck checkSystemConfiguration() {
    boolean encryption = keyRing.isConfigured();
    var details = new LinkedHashMap<String, Object>();
    details.put("encryptionEnabled", encryption);
    details.put("keyScheme", keyRing.currentScheme().name());
    details.put("hashChainEnabled", true);
    return ComplianceCheck.of(
        ComplianceCheckType.SYSTEM_CONFIGURATION,
        encryption ? CheckStatus.PASSED : CheckStatus.FAILED,
        encryption ? 100 : 0,
        details,
        now());
  }

  /** 100 passes, 90 or more warns, anything lower fails. */
  private static CheckStatus tiered(int score) {
    if (score == 100) {
      return CheckStatus.PASSED;
    }
    return score >= 90 ? CheckStatus.WARNING : CheckStatus.FAILED;
  }

  // --- Issues & recommendations ---

  static List<ComplianceIssue> extractIssues(List<ComplianceCheck> checks) {
    var issues = new ArrayList<ComplianceIssue>();
    for (ComplianceCheck check : checks) {
      if (check.status() == CheckStatus.PASSED) {
        continue;
      }
      boolean failed = check.status() == CheckStatus.FAILED;
      issues.add(
          new ComplianceIssue(
              "ISSUE-" + check.checkType() + "-" + check.checkedAt().toEpochMilli(),
              check.checkType(),
              failed ? IssueSeverity.HIGH : IssueSeverity.MEDIUM,
              check.name() + (failed ? " failed" : " needs attention"),
              check.error() != null
                  ? check.error()
                  : "Check did not pass: " + check.description(),
              check.checkedAt(),
              check.checkType().remediation()));
    }
    return issues;
  }

  static List<String> recommendations(
      List<ComplianceCheck> checks, List<ComplianceIssue> issues) {
    var recommendations = new ArrayList<String>();
    if (countSeverity(issues, IssueSeverity.CRITICAL) > 0) {
      recommendations.add("Resolve critical issues immediately to restore GoBD compliance.");
    }
    double averageScore =
        checks.stream().mapToInt(ComplianceCheck::score).average().orElse(100);
    if (averageScore < CERTIFICATION_THRESHOLD) {
      recommendations.add("Improve the compliance score through regular reviews.");
    }
    boolean processDocumentationMissing =
        checks.stream()
            .anyMatch(
                c ->
                    c.checkType() == ComplianceCheckType.PROCESS_DOCUMENTATION
                        && c.status() != CheckStatus.PASSED);
    if (processDocumentationMissing) {
      recommendations.add("Create and approve a complete process documentation.");
    }
    return recommendations;
  }

  private static long countSeverity(List<ComplianceIssue> issues, IssueSeverity severity) {
    return issues.stream().filter(i -> i.severity() == severity).count();
  }

  // --- Statistics ---

  private ComplianceStatistics gatherStatistics(String tenantId, Instant now) {
    try {
      var chain = hashChainService.getChainStats(tenantId);
      var documents =
          documentRepository.findByTenantId(tenantId).stream()
              .filter(d -> d.getStatus() != ArchiveStatus.DELETED)
              .toList();
      Instant soon = now.plus(Duration.ofDays(retentionProperties.nearingExpirationDays()));
      long versions =
          documents.isEmpty()
              ? 0
              : versionRepository.countByDocumentIdIn(
                  documents.stream().map(ArchivedDocument::getId).toList());
      long verified = documents.stream().filter(d -> d.getLastVerifiedAt() != null).count();
      long corrupted =
          documents.stream().filter(d -> d.getStatus() == ArchiveStatus.CORRUPTED).count();
      long inRetention =
          documents.stream().filter(d -> d.getRetentionEndDate().isAfter(now)).count();
      long expiringSoon =
          documents.stream()
              .filter(d -> d.getRetentionEndDate().isAfter(now))
              .filter(d -> !d.getRetentionEndDate().isAfter(soon))
              .count();
      return new ComplianceStatistics(
          chain.totalEntries(),
          chain.latestHash(),
          chain.firstEntryAt(),
          chain.lastEntryAt(),
          documents.size(),
          versions,
          verified,
          corrupted,
          inRetention,
          expiringSoon,
          documents.size() - inRetention);
    } catch (RuntimeException e) {
      log.error("Failed to gather compliance statistics for tenant {}", tenantId, e);
      return null;
    }
  }

  private static Instant yearStart(int year) {
    return LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
