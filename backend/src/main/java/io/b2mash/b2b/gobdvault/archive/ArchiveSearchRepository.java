package io.b2mash.b2b.gobdvault.archive;

import jakarta.persistence.EntityManager;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Builds the JPQL for {@link ArchiveSearchQuery}, adding a predicate per non-null filter. */
@Component
public class ArchiveSearchRepository {

  private final EntityManager entityManager;

  public ArchiveSearchRepository(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public List<ArchivedDocument> search(ArchiveSearchQuery query) {
    var predicates = new ArrayList<String>();
    var parameters = new LinkedHashMap<String, Object>();

    predicates.add("d.tenantId = :tenantId");
    parameters.put("tenantId", query.tenantId());

    if (query.filename() != null && !query.filename().isBlank()) {
      predicates.add("LOWER(d.originalFilename) LIKE :filename ESCAPE '\\'");
      parameters.put("filename", "%" + escapeLike(query.filename().toLowerCase()) + "%");
    }
    addEquals(predicates, parameters, "mimeType", query.mimeType());
    addEquals(predicates, parameters, "retentionCategory", query.retentionCategory());
    addEquals(predicates, parameters, "status", query.status());
    addEquals(predicates, parameters, "entityType", query.entityType());
    addEquals(predicates, parameters, "entityId", query.entityId());
    addEquals(predicates, parameters, "uploadedBy", query.uploadedBy());
    if (query.tags() != null && !query.tags().isEmpty()) {
      predicates.add(
          "EXISTS (SELECT 1 FROM ArchivedDocument t JOIN t.tags tag"
              + " WHERE t.id = d.id AND tag IN :tags)");
      parameters.put("tags", query.tags());
    }
    if (query.archivedAfter() != null) {
      predicates.add("d.archivedAt >= :archivedAfter");
      parameters.put("archivedAfter", query.archivedAfter());
    }
    if (query.archivedBefore() != null) {
      predicates.add("d.archivedAt <= :archivedBefore");
      parameters.put("archivedBefore", query.archivedBefore());
    }
    if (query.minSize() != null) {
      predicates.add("d.fileSizeBytes >= :minSize");
      parameters.put("minSize", query.minSize());
    }
    if (query.maxSize() != null) {
      predicates.add("d.fileSizeBytes <= :maxSize");
      parameters.put("maxSize", query.maxSize());
    }

    var jpql =
        "SELECT d FROM ArchivedDocument d WHERE "
            + String.join(" AND ", predicates)
            + " ORDER BY d.archivedAt DESC";
    var typed = entityManager.createQuery(jpql, ArchivedDocument.class);
    for (Map.Entry<String, Object> parameter : parameters.entrySet()) {
      typed.setParameter(parameter.getKey(), parameter.getValue());
    }
    return typed.setFirstResult(query.offset()).setMaxResults(query.limit()).getResultList();
  }

  private static void addEquals(
      List<String> predicates, Map<String, Object> parameters, String field, Object value) {
    if (value != null) {
      predicates.add("d." + field + " = :" + field);
      parameters.put(field, value);
    }
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
