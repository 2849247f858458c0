package io.b2mash.b2b.gobdvault.compliance;

public enum IssueSeverity {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW
}
