package io.b2mash.b2b.gobdvault.audit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, UUID> {

  /** Current chain head of a tenant, i.e. the entry with the highest sequence. */
  Optional<AuditEntry> findTopByTenantIdOrderBySequenceDesc(String tenantId);

  Optional<AuditEntry> findTopByTenantIdOrderBySequenceAsc(String tenantId);

  long countByTenantId(String tenantId);

  long countByTenantIdAndSequenceLessThanEqual(String tenantId, long sequence);

  /**
   * Keyset page of the chain: entries with {@code afterSequence < sequence <= upToSequence} in
   * ascending order. Callers pass {@code Pageable.ofSize(n)} and advance {@code afterSequence} to
   * the last sequence seen.
   */
  @Query(
      """
      SELECT e FROM AuditEntry e
      WHERE e.tenantId = :tenantId
        AND e.sequence > :afterSequence
        AND e.sequence <= :upToSequence
      ORDER BY e.sequence ASC
      """)
  List<AuditEntry> findChainSlice(
      @Param("tenantId") String tenantId,
      @Param("afterSequence") long afterSequence,
      @Param("upToSequence") long upToSequence,
      Pageable pageable);

  /**
   * Multi-parameter JPQL query with nullable filters. Each parameter uses the nullable pattern:
   * {@code (:param IS NULL OR e.field = :param)}. Results ordered by sequence ascending.
   */
  @Query(
      """
      SELECT e FROM AuditEntry e
      WHERE e.tenantId = :tenantId
        AND (CAST(:entityType AS string) IS NULL OR e.entityType = :entityType)
        AND (CAST(:entityId AS string) IS NULL OR e.entityId = :entityId)
        AND (:action IS NULL OR e.action = :action)
        AND (CAST(:actorId AS string) IS NULL OR e.actorId = :actorId)
        AND (CAST(:from AS timestamp) IS NULL OR e.timestamp >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.timestamp < :to)
      ORDER BY e.sequence ASC
      """)
  Page<AuditEntry> findByFilter(
      @Param("tenantId") String tenantId,
      @Param("entityType") String entityType,
      @Param("entityId") String entityId,
      @Param("action") AuditAction action,
      @Param("actorId") String actorId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  @Query(
      """
      SELECT COUNT(e) FROM AuditEntry e
      WHERE e.tenantId = :tenantId
        AND (CAST(:entityType AS string) IS NULL OR e.entityType = :entityType)
        AND (:action IS NULL OR e.action = :action)
        AND (CAST(:from AS timestamp) IS NULL OR e.timestamp >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.timestamp < :to)
      """)
  long countByFilter(
      @Param("tenantId") String tenantId,
      @Param("entityType") String entityType,
      @Param("action") AuditAction action,
      @Param("from") Instant from,
      @Param("to") Instant to);

  /** Entries attributed to a USER actor but carrying no actor ID. */
  @Query(
      """
      SELECT COUNT(e) FROM AuditEntry e
      WHERE e.tenantId = :tenantId
        AND e.actorType = io.b2mash.b2b.gobdvault.audit.AuditActorType.USER
        AND e.actorId IS NULL
        AND e.timestamp >= :from AND e.timestamp < :to
      """)
  long countAnonymousUserEntries(
      @Param("tenantId") String tenantId, @Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT COUNT(e) FROM AuditEntry e
      WHERE e.tenantId = :tenantId
        AND e.actorType = io.b2mash.b2b.gobdvault.audit.AuditActorType.USER
        AND e.timestamp >= :from AND e.timestamp < :to
      """)
  long countUserEntries(
      @Param("tenantId") String tenantId, @Param("from") Instant from, @Param("to") Instant to);
}
