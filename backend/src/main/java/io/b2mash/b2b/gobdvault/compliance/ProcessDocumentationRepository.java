package io.b2mash.b2b.gobdvault.compliance;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProcessDocumentationRepository
    extends JpaRepository<ProcessDocumentation, UUID> {

  /** The current version: the newest one that is not ARCHIVED. */
  Optional<ProcessDocumentation> findFirstByTenantIdAndStatusNotOrderByVersionDesc(
      String tenantId, ProcessDocumentationStatus status);

  Optional<ProcessDocumentation> findTopByTenantIdOrderByVersionDesc(String tenantId);

  Optional<ProcessDocumentation> findByTenantIdAndVersion(String tenantId, int version);
}
