package io.b2mash.b2b.gobdvault.compliance;

import io.b2mash.b2b.gobdvault.audit.AuditAction;
import io.b2mash.b2b.gobdvault.audit.AuditEntityTypes;
import io.b2mash.b2b.gobdvault.audit.AuditEntryBuilder;
import io.b2mash.b2b.gobdvault.audit.HashChainService;
import io.b2mash.b2b.gobdvault.exception.InvalidStateException;
import io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Versioned process documentation per tenant. Creating and approving are ledger-logged. */
@Service
public class ProcessDocumentationService {

  private static final Logger log = LoggerFactory.getLogger(ProcessDocumentationService.class);

  private final ProcessDocumentationRepository repository;
  private final HashChainService hashChainService;
  private final Clock clock;

  public ProcessDocumentationService(
      ProcessDocumentationRepository repository, HashChainService hashChainService, Clock clock) {
    this.repository = repository;
    this.hashChainService = hashChainService;
    this.clock = clock;
  }

  /**
   * Stores {@code content} as a new DRAFT version. The previous current version, draft or
   * approved, is archived.
   *
   * @throws InvalidStateException if {@code content} is empty
   */
  @Transactional
  public ProcessDocumentation createVersion(
      String tenantId, Map<String, Object> content, String createdBy) {
    if (content == null || content.isEmpty()) {
      throw new InvalidStateException(
          "Empty process documentation", "Process documentation content must not be empty");
    }
    var previous =
        repository.findFirstByTenantIdAndStatusNotOrderByVersionDesc(
            tenantId, ProcessDocumentationStatus.ARCHIVED);
    previous.ifPresent(
        doc -> {
          doc.archive();
          repository.save(doc);
        });
    int version =
        repository
                .findTopByTenantIdOrderByVersionDesc(tenantId)
                .map(ProcessDocumentation::getVersion)
                .orElse(0)
            + 1;

    var saved =
        repository.save(
            new ProcessDocumentation(
                tenantId, version, new LinkedHashMap<>(content), createdBy, now()));

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("operation", "create_process_documentation");
    previous.ifPresent(doc -> metadata.put("supersededVersion", doc.getVersion()));
    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.PROCESS_DOCUMENTATION)
            .entityId(saved.getId())
            .action(AuditAction.CREATE)
            .actorId(createdBy)
            .newState(Map.of("version", version, "status", saved.getStatus().name()))
            .metadata(metadata)
            .build());

    log.info("Created process documentation v{} for tenant {}", version, tenantId);
    return saved;
  }

  /**
   * Approves the current version.
   *
   * @throws ResourceNotFoundException if the tenant has no current version
   * @throws InvalidStateException if the current version is not a DRAFT
   */
  @Transactional
  public ProcessDocumentation approve(String tenantId, String approvedBy) {
    var doc =
        findCurrent(tenantId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Process documentation not found",
                        "No process documentation found for tenant " + tenantId));
    var previousStatus = doc.getStatus();
    doc.approve(approvedBy, now());
    var saved = repository.save(doc);

    hashChainService.createEntry(
        AuditEntryBuilder.builder()
            .tenantId(tenantId)
            .entityType(AuditEntityTypes.PROCESS_DOCUMENTATION)
            .entityId(saved.getId())
            .action(AuditAction.UPDATE)
            .actorId(approvedBy)
            .previousState(Map.of("status", previousStatus.name()))
            .newState(Map.of("version", saved.getVersion(), "status", saved.getStatus().name()))
            .metadata(Map.of("operation", "approve_process_documentation"))
            .build());

    log.info(
        "Approved process documentation v{} for tenant {}", saved.getVersion(), tenantId);
    return saved;
  }

  @Transactional(readOnly = true)
  public Optional<ProcessDocumentation> findCurrent(String tenantId) {
    return repository.findFirstByTenantIdAndStatusNotOrderByVersionDesc(
        tenantId, ProcessDocumentationStatus.ARCHIVED);
  }

  @Transactional(readOnly = true)
  public ProcessDocumentation getVersion(String tenantId, int version) {
    return repository
        .findByTenantIdAndVersion(tenantId, version)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Process documentation not found",
                    "No process documentation version " + version + " for tenant " + tenantId));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
