package io.b2mash.b2b.gobdvault.archive;

public enum ArchiveStatus {
  ACTIVE,
  CORRUPTED,
  DELETED
}
