package io.b2mash.b2b.gobdvault.compliance;

import java.util.List;

/** The ten GoBD checks with their fixed weights, which sum to 100. */
public enum ComplianceCheckType {
  AUDIT_LOG_INTEGRITY(
      15,
      "Audit Log Integrity",
      "Hash chain integrity verification",
      List.of(
          "Inspect the ledger hash chain for inconsistencies",
          "Contact support if ledger data is damaged",
          "Make sure no manual changes were made to the database")),
  DOCUMENT_ARCHIVE_INTEGRITY(
      15,
      "Document Archive Integrity",
      "Verification of archived documents",
      List.of(
          "Run an exhaustive document verification",
          "Inspect corrupted documents individually",
          "Restore documents from backups")),
  RETENTION_POLICY(
      10,
      "Retention Policy",
      "Compliance with retention periods",
      List.of(
          "Review retention rules of the affected documents",
          "Confirm deletion of documents past their retention and grace period")),
  JOURNAL_COMPLETENESS(
      15,
      "Journal Completeness",
      "No gaps in journal entries",
      List.of("Check for missing journal entries", "Import the missing data")),
  PROCESS_DOCUMENTATION(
      10,
      "Process Documentation",
      "Process documentation exists and is approved",
      List.of("Create a process documentation", "Have the documentation approved")),
  CHANGE_TRACKING(
      10,
      "Change Tracking",
      "All changes are tracked",
      List.of("Enable audit logging for every document change")),
  ACCESS_CONTROL(
      8,
      "Access Control",
      "Every user action is attributable",
      List.of("Configure user roles and make sure every user action carries an actor")),
  DATA_BACKUP(
      7,
      "Data Backup",
      "Backup procedures documented",
      List.of("Set up automated backups", "Test the restore procedure")),
  TAX_DOCUMENT_ARCHIVAL(
      7,
      "Tax Document Archival",
      "Tax documents properly archived",
      List.of("Archive all tax-relevant documents")),
  SYSTEM_CONFIGURATION(
      3,
      "System Configuration",
      "System meets GoBD requirements",
      List.of("Adjust the system configuration"));

  private final int weight;
  private final String displayName;
  private final String description;
  private final List<String> remediation;

  ComplianceCheckType(
      int weight, String displayName, String description, List<String> remediation) {
    this.weight = weight;
    this.displayName = displayName;
    this.description = description;
    this.remediation = remediation;
  }

  public int weight() {
    return weight;
  }

  public String displayName() {
    return displayName;
  }

  public String description() {
    return description;
  }

  public List<String> remediation() {
    return remediation;
  }
}
