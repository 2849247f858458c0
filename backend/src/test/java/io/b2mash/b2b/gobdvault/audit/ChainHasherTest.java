package io.b2mash.b2b.gobdvault.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.gobdvault.crypto.Sha256;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ChainHasherTest {

  private static final Instant NOW = Instant.parse("2026-03-01T08:15:30.123456Z");

  private final ChainHasher hasher = new ChainHasher();

  @Test
  void genesisHash_isSha256OfTenantAndGenesis() {
    assertThat(ChainHasher.genesisHash("tenant_a")).isEqualTo(Sha256.hex("tenant_agenesis"));
    assertThat(ChainHasher.genesisHash("tenant_a"))
        .isNotEqualTo(ChainHasher.genesisHash("tenant_b"));
  }

  @Test
  void ledgerTimestamp_truncatesToMicros() {
    var precise = Instant.parse("2026-03-01T08:15:30.123456789Z");

    assertThat(ChainHasher.ledgerTimestamp(precise)).isEqualTo(NOW);
  }

  @Test
  void computeHash_ignoresSnapshotKeyOrder() {
    var first = new LinkedHashMap<String, Object>();
    first.put("filename", "invoice.pdf");
    first.put("fileSizeBytes", 2048);
    var second = new LinkedHashMap<String, Object>();
    second.put("fileSizeBytes", 2048);
    second.put("filename", "invoice.pdf");

    String a = hasher.computeHash(record(first), NOW, 1, ChainHasher.genesisHash("t1"));
    String b = hasher.computeHash(record(second), NOW, 1, ChainHasher.genesisHash("t1"));

    assertThat(a).isEqualTo(b).hasSize(64);
  }

  @Test
  void computeHash_changesWithAnyField() {
    String base = hasher.computeHash(record(Map.of("k", "v")), NOW, 1, "prev");

    assertThat(hasher.computeHash(record(Map.of("k", "w")), NOW, 1, "prev")).isNotEqualTo(base);
    assertThat(hasher.computeHash(record(Map.of("k", "v")), NOW, 2, "prev")).isNotEqualTo(base);
    assertThat(hasher.computeHash(record(Map.of("k", "v")), NOW, 1, "other")).isNotEqualTo(base);
    assertThat(hasher.computeHash(record(Map.of("k", "v")), NOW.plusNanos(1000), 1, "prev"))
        .isNotEqualTo(base);
  }

  @Test
  void normalize_convertsInstantsAndIdsToStrings() {
    var id = UUID.randomUUID();
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("archivedAt", NOW);
    snapshot.put("documentId", id);
    snapshot.put("tags", List.of("a", "b"));

    var normalized = hasher.normalize(snapshot);

    assertThat(normalized.get("archivedAt")).isEqualTo("2026-03-01T08:15:30.123456Z");
    assertThat(normalized.get("documentId")).isEqualTo(id.toString());
    assertThat(normalized.get("tags")).isEqualTo(List.of("a", "b"));
  }

  @Test
  void normalize_nullSnapshotStaysNull() {
    assertThat(hasher.normalize((Map<String, Object>) null)).isNull();
  }

  @Test
  void canonicalJson_sortsNestedKeys() {
    var nested = new LinkedHashMap<String, Object>();
    nested.put("z", 1);
    nested.put("a", 2);
    var fields = new LinkedHashMap<String, Object>();
    fields.put("outer", nested);
    fields.put("first", true);

    assertThat(hasher.canonicalJson(fields))
        .isEqualTo("{\"first\":true,\"outer\":{\"a\":2,\"z\":1}}");
  }

  private static AuditEntryRecord record(Map<String, Object> newState) {
    return new AuditEntryRecord(
        "t1",
        AuditEntityTypes.DOCUMENT,
        "doc-1",
        AuditAction.CREATE,
        AuditActorType.USER,
        "alice",
        null,
        newState,
        null);
  }
}
