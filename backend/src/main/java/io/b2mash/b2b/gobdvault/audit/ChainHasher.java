package io.b2mash.b2b.gobdvault.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.b2mash.b2b.gobdvault.crypto.Sha256;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Computes ledger hashes over a canonical JSON form of an entry.
 *
 * <p>Canonical form: a JSON object of every persisted field except {@code id} and {@code hash},
 * keys sorted recursively, enums by name, the timestamp as ISO-8601 UTC with exactly six fraction
 * digits. Snapshot maps are {@linkplain #normalize normalized} before they are stored so that the
 * values read back from JSONB serialize to the same text that was hashed.
 */
@Component
public class ChainHasher {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper canonicalMapper;

  public ChainHasher() {
    this.canonicalMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
  }

  /** The {@code previousHash} of a tenant's first entry. */
  public static String genesisHash(String tenantId) {
    return Sha256.hex(tenantId + "genesis");
  }

  /** Ledger timestamps are stored with microsecond precision, matching PostgreSQL. */
  public static Instant ledgerTimestamp(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MICROS);
  }

  /** Recomputes the hash of a stored entry from its fields. */
  public String computeHash(AuditEntry entry) {
    return computeHash(
        entry.getPreviousHash(),
        canonicalFields(
            entry.getTenantId(),
            entry.getEntityType(),
            entry.getEntityId(),
            entry.getAction(),
            entry.getActorType(),
            entry.getActorId(),
            entry.getTimestamp(),
            entry.getPreviousState(),
            entry.getNewState(),
            entry.getMetadata(),
            entry.getSequence(),
            entry.getPreviousHash()));
  }

  /** Hash of a not yet persisted entry. {@code record} must already be normalized. */
  String computeHash(
      AuditEntryRecord record, Instant timestamp, long sequence, String previousHash) {
    return computeHash(
        previousHash,
        canonicalFields(
            record.tenantId(),
            record.entityType(),
            record.entityId(),
            record.action(),
            record.actorType(),
            record.actorId(),
            timestamp,
            record.previousState(),
            record.newState(),
            record.metadata(),
            sequence,
            previousHash));
  }

  /**
   * Converts a snapshot map into plain JSON types (strings, numbers, booleans, lists, maps), e.g.
   * {@code Instant} and {@code UUID} values become strings.
   */
  public Map<String, Object> normalize(Map<String, Object> snapshot) {
    if (snapshot == null) {
      return null;
    }
    try {
      return canonicalMapper.readValue(canonicalMapper.writeValueAsString(snapshot), MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Ledger snapshot is not JSON-serializable", e);
    }
  }

  AuditEntryRecord normalize(AuditEntryRecord record) {
    return new AuditEntryRecord(
        record.tenantId(),
        record.entityType(),
        record.entityId(),
        record.action(),
        record.actorType(),
        record.actorId(),
        normalize(record.previousState()),
        normalize(record.newState()),
        normalize(record.metadata()));
  }

  String canonicalJson(Map<String, Object> fields) {
    try {
      return canonicalMapper.writeValueAsString(fields);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to canonicalize ledger entry", e);
    }
  }

  private String computeHash(String previousHash, Map<String, Object> fields) {
    return Sha256.hex(previousHash + canonicalJson(fields));
  }

  private Map<String, Object> canonicalFields(
      String tenantId,
      String entityType,
      String entityId,
      AuditAction action,
      AuditActorType actorType,
      String actorId,
      Instant timestamp,
      Map<String, Object> previousState,
      Map<String, Object> newState,
      Map<String, Object> metadata,
      long sequence,
      String previousHash) {
    var fields = new TreeMap<String, Object>();
    fields.put("tenantId", tenantId);
    fields.put("entityType", entityType);
    fields.put("entityId", entityId);
    fields.put("action", action != null ? action.name() : null);
    fields.put("actorType", actorType != null ? actorType.name() : null);
    fields.put("actorId", actorId);
    fields.put("timestamp", timestamp != null ? TIMESTAMP_FORMAT.format(timestamp) : null);
    fields.put("previousState", previousState);
    fields.put("newState", newState);
    fields.put("metadata", metadata);
    fields.put("sequence", sequence);
    fields.put("previousHash", previousHash);
    return fields;
  }
}
