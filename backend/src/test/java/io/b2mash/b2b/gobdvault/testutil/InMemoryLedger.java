package io.b2mash.b2b.gobdvault.testutil;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditActorType;
import io.b2mash.b2b.gobdvault.audit.AuditEntry;
import io.b2mash.b2b.gobdvault.audit.AuditEntryRepository;
import io.b2mash.b2b.gobdvault.audit.ChainHasher;
import io.b2mash.b2b.gobdvault.audit.DatabaseHashChainService;
import io.b2mash.b2b.gobdvault.audit.TenantAppendLocks;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * A {@link DatabaseHashChainService} over a list-backed {@link AuditEntryRepository} mock. The
 * unique {@code (tenant_id, sequence)} constraint is enforced on save.
 */
public final class InMemoryLedger {

  private final List<AuditEntry> entries = new ArrayList<>();
  private final AuditEntryRepository repository;
  private final DatabaseHashChainService service;

  public InMemoryLedger(Clock clock) {
    repository = mock(AuditEntryRepository.class, withSettings().strictness(Strictness.LENIENT));
    when(repository.saveAndFlush(any(AuditEntry.class)))
        .thenAnswer(inv -> save(inv.getArgument(0)));
    when(repository.findTopByTenantIdOrderBySequenceDesc(anyString()))
        .thenAnswer(inv -> last(chain(inv.getArgument(0))));
    when(repository.findTopByTenantIdOrderBySequenceAsc(anyString()))
        .thenAnswer(inv -> chain(inv.getArgument(0)).stream().findFirst());
    when(repository.countByTenantId(anyString()))
        .thenAnswer(inv -> (long) chain(inv.getArgument(0)).size());
    when(repository.countByTenantIdAndSequenceLessThanEqual(anyString(), anyLong()))
        .thenAnswer(
            inv -> {
              long upTo = inv.getArgument(1);
              return chain(inv.getArgument(0)).stream()
                  .filter(e -> e.getSequence() <= upTo)
                  .count();
            });
    when(repository.findChainSlice(anyString(), anyLong(), anyLong(), any(Pageable.class)))
        .thenAnswer(
            inv -> {
              long after = inv.getArgument(1);
              long upTo = inv.getArgument(2);
              Pageable pageable = inv.getArgument(3);
              return chain(inv.getArgument(0)).stream()
                  .filter(e -> e.getSequence() > after && e.getSequence() <= upTo)
                  .limit(pageable.getPageSize())
                  .toList();
            });
    when(repository.findByFilter(any(), any(), any(), any(), any(), any(), any(), any()))
        .thenAnswer(
            inv -> {
              Predicate<AuditEntry> matches =
                  filter(
                      inv.getArgument(0),
                      inv.getArgument(1),
                      inv.getArgument(2),
                      inv.getArgument(3),
                      inv.getArgument(4),
                      inv.getArgument(5),
                      inv.getArgument(6));
              List<AuditEntry> all = chain(inv.getArgument(0)).stream().filter(matches).toList();
              Pageable pageable = inv.getArgument(7);
              int from = (int) Math.min(pageable.getOffset(), all.size());
              int to = Math.min(from + pageable.getPageSize(), all.size());
              return new PageImpl<>(all.subList(from, to), pageable, all.size());
            });
    when(repository.countByFilter(any(), any(), any(), any(), any()))
        .thenAnswer(
            inv ->
                chain(inv.getArgument(0)).stream()
                    .filter(
                        filter(
                            inv.getArgument(0),
                            inv.getArgument(1),
                            null,
                            inv.getArgument(2),
                            null,
                            inv.getArgument(3),
                            inv.getArgument(4)))
                    .count());
    when(repository.countUserEntries(anyString(), any(), any()))
        .thenAnswer(
            inv ->
                chain(inv.getArgument(0)).stream()
                    .filter(inPeriod(inv.getArgument(1), inv.getArgument(2)))
                    .filter(e -> e.getActorType() == AuditActorType.USER)
                    .count());
    when(repository.countAnonymousUserEntries(anyString(), any(), any()))
        .thenAnswer(
            inv ->
                chain(inv.getArgument(0)).stream()
                    .filter(inPeriod(inv.getArgument(1), inv.getArgument(2)))
                    .filter(e -> e.getActorType() == AuditActorType.USER)
                    .filter(e -> e.getActorId() == null)
                    .count());

    service =
        new DatabaseHashChainService(repository, new ChainHasher(), new TenantAppendLocks(), clock);
  }

  public DatabaseHashChainService service() {
    return service;
  }

  public AuditEntryRepository repository() {
    return repository;
  }

  /** Entries of one tenant in sequence order. */
  public synchronized List<AuditEntry> chain(String tenantId) {
    return entries.stream()
        .filter(e -> e.getTenantId().equals(tenantId))
        .sorted(Comparator.comparingLong(AuditEntry::getSequence))
        .toList();
  }

  /** Overwrites a persisted field, bypassing the ledger, the way a direct SQL update would. */
  public void tamper(AuditEntry entry, String field, Object value) {
    ReflectionTestUtils.setField(entry, field, value);
  }

  public synchronized void remove(AuditEntry entry) {
    entries.remove(entry);
  }

  private synchronized AuditEntry save(AuditEntry entry) {
    boolean taken =
        entries.stream()
            .anyMatch(
                e ->
                    e.getTenantId().equals(entry.getTenantId())
                        && e.getSequence() == entry.getSequence());
    if (taken) {
      throw new DataIntegrityViolationException(
          "duplicate key value violates unique constraint uq_audit_entries_tenant_sequence");
    }
    if (entry.getId() == null) {
      ReflectionTestUtils.setField(entry, "id", UUID.randomUUID());
    }
    entries.add(entry);
    return entry;
  }

  private static Optional<AuditEntry> last(List<AuditEntry> chain) {
    return chain.isEmpty() ? Optional.empty() : Optional.of(chain.get(chain.size() - 1));
  }

  private static Predicate<AuditEntry> filter(
      String tenantId,
      String entityType,
      String entityId,
      AuditAction action,
      String actorId,
      Instant from,
      Instant to) {
    return e ->
        e.getTenantId().equals(tenantId)
            && (entityType == null || entityType.equals(e.getEntityType()))
            && (entityId == null || entityId.equals(e.getEntityId()))
            && (action == null || action == e.getAction())
            && (actorId == null || Objects.equals(actorId, e.getActorId()))
            && inPeriod(from, to).test(e);
  }

  private static Predicate<AuditEntry> inPeriod(Instant from, Instant to) {
    return e ->
        (from == null || !e.getTimestamp().isBefore(from))
            && (to == null || e.getTimestamp().isBefore(to));
  }
}
