package io.b2mash.b2b.gobdvault.compliance;

public enum CheckStatus {
  PASSED,
  WARNING,
  FAILED
}
