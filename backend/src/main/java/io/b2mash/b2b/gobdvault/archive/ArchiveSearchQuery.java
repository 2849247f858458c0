package io.b2mash.b2b.gobdvault.archive;

import io.b2mash.b2b.gobdvault.retention.RetentionCategory;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Archive search filter. Only {@code tenantId} is required; null fields do not filter. Results are
 * ordered by archivedAt descending.
 *
 * @param filename case-insensitive substring of the original filename
 * @param tags matches documents carrying any of these tags
 * @param archivedAfter inclusive
 * @param archivedBefore inclusive
 * @param minSize inclusive, plaintext bytes
 * @param maxSize inclusive, plaintext bytes
 */
public record ArchiveSearchQuery(
    String tenantId,
    String filename,
    String mimeType,
    RetentionCategory retentionCategory,
    ArchiveStatus status,
    String entityType,
    String entityId,
    Set<String> tags,
    String uploadedBy,
    Instant archivedAfter,
    Instant archivedBefore,
    Long minSize,
    Long maxSize,
    int limit,
    int offset) {

  public static final int DEFAULT_LIMIT = 100;

  public ArchiveSearchQuery {
    Objects.requireNonNull(tenantId, "tenantId is required");
    if (limit <= 0) {
      limit = DEFAULT_LIMIT;
    }
    if (offset < 0) {
      offset = 0;
    }
  }

  public static Builder forTenant(String tenantId) {
    return new Builder(tenantId);
  }

  public static class Builder {
    private final String tenantId;
    private String filename;
    private String mimeType;
    private RetentionCategory retentionCategory;
    private ArchiveStatus status;
    private String entityType;
    private String entityId;
    private Set<String> tags;
    private String uploadedBy;
    private Instant archivedAfter;
    private Instant archivedBefore;
    private Long minSize;
    private Long maxSize;
    private int limit;
    private int offset;

    private Builder(String tenantId) {
      this.tenantId = tenantId;
    }

    public Builder filename(String filename) {
      this.filename = filename;
      return this;
    }

    public Builder mimeType(String mimeType) {
      this.mimeType = mimeType;
      return this;
    }

    public Builder retentionCategory(RetentionCategory retentionCategory) {
      this.retentionCategory = retentionCategory;
      return this;
    }

    public Builder status(ArchiveStatus status) {
      this.status = status;
      return this;
    }

    public Builder entity(String entityType, String entityId) {
      this.entityType = entityType;
      this.entityId = entityId;
      return this;
    }

    public Builder tags(Set<String> tags) {
      this.tags = tags;
      return this;
    }

    public Builder uploadedBy(String uploadedBy) {
      this.uploadedBy = uploadedBy;
      return this;
    }

    public Builder archivedBetween(Instant after, Instant before) {
      this.archivedAfter = after;
      this.archivedBefore = before;
      return this;
    }

    public Builder sizeBetween(Long minSize, Long maxSize) {
      this.minSize = minSize;
      this.maxSize = maxSize;
      return this;
    }

    public Builder page(int limit, int offset) {
      this.limit = limit;
      this.offset = offset;
      return this;
    }

    public ArchiveSearchQuery build() {
      return new ArchiveSearchQuery(
          tenantId,
          filename,
          mimeType,
          retentionCategory,
          status,
          entityType,
          entityId,
          tags,
          uploadedBy,
          archivedAfter,
          archivedBefore,
          minSize,
          maxSize,
          limit,
          offset);
    }
  }
}
