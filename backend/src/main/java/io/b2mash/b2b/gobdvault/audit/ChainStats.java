package io.b2mash.b2b.gobdvault.audit;

import java.time.Instant;

/**
 * Summary of a tenant's ledger. {@code latestHash} is the chain head an operator can anchor in an
 * external immutable log.
 */
public record ChainStats(
    String tenantId,
    long totalEntries,
    Instant firstEntryAt,
    Instant lastEntryAt,
    long latestSequence,
    String latestHash) {}
