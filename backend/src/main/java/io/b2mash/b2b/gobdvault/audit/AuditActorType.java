package io.b2mash.b2b.gobdvault.audit;

public enum AuditActorType {
  USER,
  SYSTEM
}
