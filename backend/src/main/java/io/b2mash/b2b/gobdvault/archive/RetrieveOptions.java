package io.b2mash.b2b.gobdvault.archive;

/**
 * @param decrypt read and decrypt the content
 * @param updateAccessTime stamp {@code lastAccessedAt} and log a VIEW entry
 * @param includeVersions load the version history
 * @param actorId user retrieving the document; null for system access
 */
public record RetrieveOptions(
    boolean decrypt, boolean updateAccessTime, boolean includeVersions, String actorId) {

  public static RetrieveOptions defaults(String actorId) {
    return new RetrieveOptions(true, true, false, actorId);
  }

  /** Decrypts without touching access time or the ledger. */
  public static RetrieveOptions systemRead() {
    return new RetrieveOptions(true, false, false, null);
  }
}
