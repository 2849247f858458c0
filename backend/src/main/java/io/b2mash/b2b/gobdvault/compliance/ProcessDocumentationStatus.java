package io.b2mash.b2b.gobdvault.compliance;

public enum ProcessDocumentationStatus {
  DRAFT,
  APPROVED,
  ARCHIVED
}
