package io.b2mash.b2b.gobdvault.audit;

import io.b2mash.b2b.gobdvault.exception.ResourceConflictException;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link HashChainService}.
 *
 * <p>Transaction semantics: {@code createEntry()} participates in the caller's transaction (no
 * REQUIRES_NEW). The tenant's append lock is held until that transaction completes, and the unique
 * {@code (tenant_id, sequence)} constraint rejects any append that slipped past the lock (e.g. from
 * another node).
 */
@Service
public class DatabaseHashChainService implements HashChainService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseHashChainService.class);

  static final int VERIFY_PAGE_SIZE = 500;

  private final AuditEntryRepository auditEntryRepository;
  private final ChainHasher chainHasher;
  private final TenantAppendLocks appendLocks;
  private final Clock clock;

  public DatabaseHashChainService(
      AuditEntryRepository auditEntryRepository,
      ChainHasher chainHasher,
      TenantAppendLocks appendLocks,
      Clock clock) {
    this.auditEntryRepository = auditEntryRepository;
    this.chainHasher = chainHasher;
    this.appendLocks = appendLocks;
    this.clock = clock;
  }

  @Override
  @Transactional
  public AuditEntry createEntry(AuditEntryRecord record) {
    var normalized = chainHasher.normalize(record);
    // Pending writes of the caller take their row locks before the tenant lock is requested;
    // waiting on a row lock while holding the tenant lock would deadlock against a holder of
    // that row queued on the tenant lock.
    auditEntryRepository.flush();
    return appendLocks.callLocked(record.tenantId(), () -> append(normalized));
  }

  private AuditEntry append(AuditEntryRecord record) {
    var head = auditEntryRepository.findTopByTenantIdOrderBySequenceDesc(record.tenantId());
    long sequence = head.map(e -> e.getSequence() + 1).orElse(1L);
    String previousHash =
        head.map(AuditEntry::getHash).orElseGet(() -> ChainHasher.genesisHash(record.tenantId()));
    var timestamp = ChainHasher.ledgerTimestamp(clock.instant());
    String hash = chainHasher.computeHash(record, timestamp, sequence, previousHash);

    AuditEntry saved;
    try {
      saved =
          auditEntryRepository.saveAndFlush(
              new AuditEntry(record, timestamp, sequence, previousHash, hash));
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Ledger append conflict",
          "Sequence " + sequence + " of tenant " + record.tenantId() + " was claimed concurrently",
          e);
    }
    log.debug(
        "Appended ledger entry: tenant={}, seq={}, action={}, entity={}/{}",
        record.tenantId(),
        sequence,
        record.action(),
        record.entityType(),
        record.entityId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public ChainVerificationResult verifyChainIntegrity(String tenantId) {
    var head = auditEntryRepository.findTopByTenantIdOrderBySequenceDesc(tenantId);
    if (head.isEmpty()) {
      return ChainVerificationResult.intact(0);
    }
    long upTo = head.get().getSequence();
    long total = auditEntryRepository.countByTenantIdAndSequenceLessThanEqual(tenantId, upTo);

    String expectedPreviousHash = ChainHasher.genesisHash(tenantId);
    long expectedSequence = 1;
    long verified = 0;
    long after = 0;

    while (after < upTo) {
      List<AuditEntry> page =
          auditEntryRepository.findChainSlice(
              tenantId, after, upTo, Pageable.ofSize(VERIFY_PAGE_SIZE));
      if (page.isEmpty()) {
        break;
      }
      for (AuditEntry entry : page) {
        String error = checkEntry(entry, expectedSequence, expectedPreviousHash);
        if (error != null) {
          log.error(
              "Ledger integrity violation: tenant={}, entry={}, seq={}: {}",
              tenantId,
              entry.getId(),
              entry.getSequence(),
              error);
          return ChainVerificationResult.broken(verified, total, entry.getId(), error);
        }
        verified++;
        expectedSequence = entry.getSequence() + 1;
        expectedPreviousHash = entry.getHash();
        after = entry.getSequence();
      }
    }

    log.info("Verified ledger of tenant {}: {} entries intact", tenantId, verified);
    return new ChainVerificationResult(true, verified, total, null, null);
  }

  private String checkEntry(AuditEntry entry, long expectedSequence, String expectedPreviousHash) {
    if (entry.getSequence() != expectedSequence) {
      return "Sequence gap: expected " + expectedSequence + " but found " + entry.getSequence();
    }
    if (!expectedPreviousHash.equals(entry.getPreviousHash())) {
      return "Previous hash does not match the preceding entry";
    }
    if (!chainHasher.computeHash(entry).equals(entry.getHash())) {
      return "Stored hash does not match recomputed hash";
    }
    return null;
  }

  @Override
  @Transactional(readOnly = true)
  public ChainStats getChainStats(String tenantId) {
    long count = auditEntryRepository.countByTenantId(tenantId);
    var first = auditEntryRepository.findTopByTenantIdOrderBySequenceAsc(tenantId);
    var last = auditEntryRepository.findTopByTenantIdOrderBySequenceDesc(tenantId);
    return new ChainStats(
        tenantId,
        count,
        first.map(AuditEntry::getTimestamp).orElse(null),
        last.map(AuditEntry::getTimestamp).orElse(null),
        last.map(AuditEntry::getSequence).orElse(0L),
        last.map(AuditEntry::getHash).orElse(ChainHasher.genesisHash(tenantId)));
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEntry> findEntries(AuditEntryFilter filter, Pageable pageable) {
    return auditEntryRepository.findByFilter(
        filter.tenantId(),
        filter.entityType(),
        filter.entityId(),
        filter.action(),
        filter.actorId(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public long countEntries(AuditEntryFilter filter) {
    return auditEntryRepository.countByFilter(
        filter.tenantId(), filter.entityType(), filter.action(), filter.from(), filter.to());
  }
}
