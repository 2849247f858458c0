package io.b2mash.b2b.gobdvault.archive;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DocumentVersionRepository extends JpaRepository<DocumentVersion, UUID> {

  List<DocumentVersion> findByDocumentIdOrderByVersionDesc(UUID documentId);

  Optional<DocumentVersion> findTopByDocumentIdOrderByVersionDesc(UUID documentId);

  long countByDocumentIdIn(List<UUID> documentIds);
}
