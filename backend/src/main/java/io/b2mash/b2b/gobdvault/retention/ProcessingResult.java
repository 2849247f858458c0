package io.b2mash.b2b.gobdvault.retention;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one {@link RetentionService#processExpired} batch.
 *
 * @param documentsMarkedForReview deletable documents now awaiting a human confirmation
 * @param cancelled the batch stopped early because the thread was interrupted
 * @param oldestDeletedArchivedAt earliest archivedAt among deleted documents
 * @param newestDeletedArchivedAt latest archivedAt among deleted documents
 */
public record ProcessingResult(
    String tenantId,
    Instant processedAt,
    int documentsReviewed,
    int documentsMarkedForReview,
    int documentsDeleted,
    int documentsSkipped,
    List<ProcessingError> errors,
    boolean cancelled,
    long storageFreed,
    Instant oldestDeletedArchivedAt,
    Instant newestDeletedArchivedAt) {

  public record ProcessingError(
      UUID documentId, String filename, String error, Instant timestamp) {}
}
