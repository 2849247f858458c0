package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Input of {@link ArchiveService#archive(ArchiveRequest)}.
 *
 * @param content plaintext bytes; may be empty but not null
 * @param entityType optional type of the business entity the document belongs to
 * @param entityId optional ID of that entity
 * @param tags optional labels; null keeps existing tags when the content is already archived
 * @param metadata optional descriptors; null keeps existing metadata likewise
 */
public record ArchiveRequest(
    String tenantId,
    byte[] content,
    String originalFilename,
    String mimeType,
    RetentionCategory retentionCategory,
    String entityType,
    String entityId,
    Set<String> tags,
    Map<String, Object> metadata,
    String uploadedBy) {

  public ArchiveRequest {
    Objects.requireNonNull(tenantId, "tenantId is required");
    Objects.requireNonNull(content, "content is required");
    Objects.requireNonNull(originalFilename, "originalFilename is required");
    Objects.requireNonNull(retentionCategory, "retentionCategory is required");
    if (mimeType == null || mimeType.isBlank()) {
      mimeType = "application/octet-stream";
    }
  }

  public static ArchiveRequest of(
      String tenantId,
      byte[] content,
      String originalFilename,
      String mimeType,
      RetentionCategory retentionCategory,
      String uploadedBy) {
    return new ArchiveRequest(
        tenantId,
        content,
        originalFilename,
        mimeType,
        retentionCategory,
        null,
        null,
        null,
        null,
        uploadedBy);
  }
}
