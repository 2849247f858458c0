package io.b2mash.b2b.gobdvault.retention;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RetentionHoldRepository extends JpaRepository<RetentionHold, UUID> {

  Optional<RetentionHold> findFirstByDocumentIdAndReleasedAtIsNullOrderByPlacedAtDesc(
      UUID documentId);

  List<RetentionHold> findByTenantIdAndReleasedAtIsNull(String tenantId);

  List<RetentionHold> findByTenantIdAndPlacedAtGreaterThanEqualAndPlacedAtLessThan(
      String tenantId, Instant from, Instant to);
}
