package io.b2mash.b2b.gobdvault.retention;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Human-supplied allow-list for retention deletion. Only documents listed here can be deleted by
 * {@link RetentionService#processExpired}.
 */
public record DeletionConfirmation(Set<UUID> documentIds, String confirmedBy, String reason) {

  public DeletionConfirmation {
    documentIds = documentIds == null ? Set.of() : Set.copyOf(documentIds);
    Objects.requireNonNull(confirmedBy, "confirmedBy is required");
  }

  public boolean confirms(UUID documentId) {
    return documentIds.contains(documentId);
  }
}
