package io.b2mash.b2b.gobdvault.archive;

import java.util.LinkedHashMap;
import java.util.Map;

/** Ledger snapshots of a document. Descriptive metadata only, never content or key material. */
public final class DocumentSnapshots {

  private DocumentSnapshots() {}

  public static Map<String, Object> of(ArchivedDocument document) {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("filename", document.getOriginalFilename());
    snapshot.put("mimeType", document.getMimeType());
    snapshot.put("fileSizeBytes", document.getFileSizeBytes());
    snapshot.put("contentHash", document.getContentHash());
    snapshot.put("status", document.getStatus().name());
    snapshot.put("retentionCategory", document.getRetentionCategory().name());
    snapshot.put("retentionEndDate", document.getRetentionEndDate());
    snapshot.put("archivedAt", document.getArchivedAt());
    snapshot.put("entityType", document.getEntityType());
    snapshot.put("entityId", document.getEntityId());
    return snapshot;
  }
}
