package io.b2mash.b2b.gobdvault.archive;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VaultIntegrityScheduledJobTest {

  @Mock private ArchiveService archiveService;
  @Mock private ArchivedDocumentRepository documentRepository;
  @Mock private ArchiveKeyRing keyRing;

  private VaultIntegrityScheduledJob job;

  @BeforeEach
  void setUp() {
    job = new VaultIntegrityScheduledJob(archiveService, documentRepository, keyRing, 50);
  }

  @Test
  void executeIntegritySweep_unconfiguredVault_skips() {
    when(keyRing.isConfigured()).thenReturn(false);

    job.executeIntegritySweep();

    verify(documentRepository, never()).findTenantIdsWithStatus(ArchiveStatus.ACTIVE);
    verify(archiveService, never()).verifySample(anyString(), anyInt());
  }

  @Test
  void executeIntegritySweep_samplesEveryTenant() {
    when(keyRing.isConfigured()).thenReturn(true);
    when(documentRepository.findTenantIdsWithStatus(ArchiveStatus.ACTIVE))
        .thenReturn(List.of("tenant_a", "tenant_b"));
    when(archiveService.verifySample("tenant_a", 50))
        .thenThrow(new IllegalStateException("storage down"));
    when(archiveService.verifySample("tenant_b", 50)).thenReturn(sweep("tenant_b", 1));

    job.executeIntegritySweep();

    verify(archiveService).verifySample("tenant_a", 50);
    verify(archiveService).verifySample("tenant_b", 50);
  }

  private static IntegritySweepResult sweep(String tenantId, int invalid) {
    Instant now = Instant.now();
    return new IntegritySweepResult(
        tenantId, true, 10, 10 - invalid, invalid, List.of(), false, now, now);
  }
}
