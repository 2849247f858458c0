package io.b2mash.b2b.gobdvault.retention;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeletionReviewRepository extends JpaRepository<DeletionReview, UUID> {

  Optional<DeletionReview> findByDocumentId(UUID documentId);

  List<DeletionReview> findByTenantIdAndStatus(String tenantId, DeletionReviewStatus status);
}
