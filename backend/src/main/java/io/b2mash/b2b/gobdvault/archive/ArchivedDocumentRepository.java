package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ArchivedDocumentRepository extends JpaRepository<ArchivedDocument, UUID> {

  Optional<ArchivedDocument> findByContentHash(String contentHash);

  Optional<ArchivedDocument> findByIdAndTenantId(UUID id, String tenantId);

  /** Row-locks the document so status checks and the DELETED transition are atomic. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT d FROM ArchivedDocument d WHERE d.id = :id AND d.tenantId = :tenantId")
  Optional<ArchivedDocument> findByIdAndTenantIdForUpdate(
      @Param("id") UUID id, @Param("tenantId") String tenantId);

  List<ArchivedDocument> findByTenantId(String tenantId);

  List<ArchivedDocument> findByTenantIdOrderByArchivedAtAsc(String tenantId);

  List<ArchivedDocument> findByTenantIdAndStatusOrderByArchivedAtAsc(
      String tenantId, ArchiveStatus status);

  /** Documents whose retention ended at or before {@code now}. */
  List<ArchivedDocument>
      findByTenantIdAndStatusAndRetentionEndDateLessThanEqualOrderByRetentionEndDateAsc(
          String tenantId, ArchiveStatus status, Instant now);

  /** Most recently archived documents first, used for sampled verification. */
  List<ArchivedDocument> findByTenantIdAndStatusOrderByArchivedAtDesc(
      String tenantId, ArchiveStatus status, Pageable pageable);

  /** Keyset page by ID for exhaustive sweeps; callers advance {@code afterId}. */
  @Query(
      """
      SELECT d FROM ArchivedDocument d
      WHERE d.tenantId = :tenantId
        AND d.status = :status
        AND d.id > :afterId
      ORDER BY d.id ASC
      """)
  List<ArchivedDocument> findSweepPage(
      @Param("tenantId") String tenantId,
      @Param("status") ArchiveStatus status,
      @Param("afterId") UUID afterId,
      Pageable pageable);

  @Query("SELECT DISTINCT d.tenantId FROM ArchivedDocument d WHERE d.status = :status")
  List<String> findTenantIdsWithStatus(@Param("status") ArchiveStatus status);

  List<ArchivedDocument> findByTenantIdAndArchivedAtGreaterThanEqualAndArchivedAtLessThan(
      String tenantId, Instant from, Instant to);

  long countByTenantIdAndArchivedAtGreaterThanEqualAndArchivedAtLessThan(
      String tenantId, Instant from, Instant to);

  long countByTenantIdAndStatus(String tenantId, ArchiveStatus status);

  long countByTenantIdAndStatusNot(String tenantId, ArchiveStatus status);

  long countByTenantIdAndRetentionCategoryAndStatusNot(
      String tenantId, RetentionCategory category, ArchiveStatus status);

  @Query(
      """
      SELECT COALESCE(SUM(d.fileSizeBytes), 0) FROM ArchivedDocument d
      WHERE d.tenantId = :tenantId
        AND d.status <> io.b2mash.b2b.gobdvault.archive.ArchiveStatus.DELETED
      """)
  long sumStoredBytes(@Param("tenantId") String tenantId);

  /**
   * Documents archived in {@code [from, to)} that have a CREATE entry in the ledger. Ledger entity
   * IDs are text, so the document ID is cast for the comparison.
   */
  @Query(
      """
      SELECT COUNT(d) FROM ArchivedDocument d
      WHERE d.tenantId = :tenantId
        AND d.archivedAt >= :from AND d.archivedAt < :to
        AND EXISTS (
          SELECT 1 FROM AuditEntry a
          WHERE a.tenantId = d.tenantId
            AND a.entityType = 'DOCUMENT'
            AND a.action = io.b2mash.b2b.gobdvault.audit.AuditAction.CREATE
            AND a.entityId = CAST(d.id AS String))
      """)
  long countWithCreateEntry(
      @Param("tenantId") String tenantId, @Param("from") Instant from, @Param("to") Instant to);
}
