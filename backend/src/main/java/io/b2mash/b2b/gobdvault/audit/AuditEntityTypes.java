package io.b2mash.b2b.gobdvault.audit;

/** Entity type labels written to the ledger. */
public final class AuditEntityTypes {

  public static final String DOCUMENT = "DOCUMENT";
  public static final String RETENTION_BATCH = "RETENTION_BATCH";
  public static final String RETENTION_REPORT = "RETENTION_REPORT";
  public static final String ARCHIVE_EXPORT = "ARCHIVE_EXPORT";
  public static final String AUDITOR_EXPORT = "AUDITOR_EXPORT";
  public static final String PROCESS_DOCUMENTATION = "PROCESS_DOCUMENTATION";

  private AuditEntityTypes() {}
}
