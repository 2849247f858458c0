package io.b2mash.b2b.gobdvault.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Append-only, hash-chained audit ledger. Every tenant owns an independent chain whose first entry
 * links to {@link ChainHasher#genesisHash(String)}.
 */
public interface HashChainService {

  /**
   * Appends an entry to the tenant's chain within the current transaction. Appends of one tenant
   * are serialized. If the enclosing transaction rolls back, the entry rolls back too.
   *
   * @param record the entry data
   * @return the persisted entry with its sequence and hash
   * @throws io.b2mash.b2b.gobdvault.exception.ResourceConflictException if another writer claimed
   *     the same sequence
   */
  AuditEntry createEntry(AuditEntryRecord record);

  /**
   * Re-derives every hash of the tenant's chain over the snapshot visible at scan start. Tampering
   * is reported in the result, never thrown.
   */
  ChainVerificationResult verifyChainIntegrity(String tenantId);

  ChainStats getChainStats(String tenantId);

  /** Entries matching the filter, ordered by sequence ascending. */
  Page<AuditEntry> findEntries(AuditEntryFilter filter, Pageable pageable);

  long countEntries(AuditEntryFilter filter);
}
