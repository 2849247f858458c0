package io.b2mash.b2b.gobdvault.audit;

public enum AuditAction {
  CREATE,
  UPDATE,
  DELETE,
  VIEW,
  EXPORT
}
