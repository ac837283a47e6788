package com.claimvoyant.integration;

import com.claimvoyant.client.ContentIndexClient;
import com.claimvoyant.client.ImageAnalysisClient;
import com.claimvoyant.client.ObjectStorageClient;
import com.claimvoyant.client.PolicySearchClient;
import com.claimvoyant.client.ReasoningEngine;
import com.claimvoyant.client.TextExtractionClient;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.model.PipelineState;
import com.claimvoyant.model.audit.AuditEntry;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimDecision;
import com.claimvoyant.model.claim.DetectedLabel;
import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.model.dto.ClaimProcessingStatus;
import com.claimvoyant.model.dto.ClaimStatusResponse;
import com.claimvoyant.model.record.ClaimRecord;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.service.ClaimQueryService;
import com.claimvoyant.service.ClaimRecordService;
import com.claimvoyant.service.ClaimWorkflowService;
import com.claimvoyant.workflow.pipeline.PipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Full pipeline run against the H2 database with external capabilities mocked.
 *
 * Verifies the audit trail, record versioning and status projection for
 * decided, not-found and failed runs.
 */
@SpringBootTest
@ActiveProfiles("test")
class ClaimPipelineEndToEndTest {

    private static final String RAW_BUCKET = "claimvoyant-test-raw-claims";

    private static final String APPROVED = """
            {"decision": "APPROVED", "reasoning": "Collision covered, deductible applies.",
             "confidence": 0.88, "estimated_payout": 2000.0, "deductible_applies": true,
             "required_actions": [], "risk_factors": []}
            """;

    @Autowired
    private ClaimWorkflowService workflowService;
    @Autowired
    private AuditLoggingService auditService;
    @Autowired
    private ClaimRecordService claimRecordService;
    @Autowired
    private ClaimQueryService queryService;

    @MockBean
    private TextExtractionClient textExtractionClient;
    @MockBean
    private ImageAnalysisClient imageAnalysisClient;
    @MockBean
    private PolicySearchClient policySearchClient;
    @MockBean
    private ContentIndexClient contentIndexClient;
    @MockBean
    private ReasoningEngine reasoningEngine;
    @MockBean
    private ObjectStorageClient objectStorageClient;

    @BeforeEach
    void setUp() {
        when(textExtractionClient.extractText(anyString(), anyString()))
                .thenReturn(new TextExtractionClient.ExtractedText("Policy: AUTO-042. Rear-ended on 2025-10-20.", "job-1"));
        when(imageAnalysisClient.detectLabels(anyString(), anyString(), anyInt(), anyFloat()))
                .thenReturn(List.of(new DetectedLabel("Car", 99.1), new DetectedLabel("Damage", 87.4)));
        when(imageAnalysisClient.detectText(anyString(), anyString())).thenReturn("");
        when(policySearchClient.hybridSearch(eq("AUTO-042"), anyInt())).thenReturn(List.of(Map.of(
                "policy_id", "AUTO-042",
                "coverage_type", "collision",
                "deductible", 500.0,
                "coverage_limit", 50000.0,
                "filing_deadline_days", 30)));
        when(reasoningEngine.invoke(anyString(), anyInt(), anyDouble())).thenReturn(APPROVED);
    }

    @Test
    @DisplayName("PDF claim runs all five stages and is decided")
    void pdfClaim_ShouldBeDecided() {
        // Given
        String claimId = newClaimId();

        // When
        PipelineResult result = workflowService.processClaim(new StorageLocation(RAW_BUCKET, claimId + "/report.pdf"), claimId);

        // Then
        assertThat(result.getState()).isEqualTo(PipelineState.TERMINAL_DECIDED);
        assertThat(result.getContext().getDecisionData().getDecision()).isEqualTo(ClaimDecision.APPROVED);

        List<AuditEntry> trail = auditService.getClaimAuditTrail(claimId);
        assertThat(trail).extracting(AuditEntry::getAgent)
                .containsExactly("intake", "policy", "damage", "valuation", "decision");
        assertThat(trail).extracting(AuditEntry::getStatus).containsOnly(AuditStatus.SUCCESS);

        ClaimRecord record = claimRecordService.findLatest(claimId).orElseThrow();
        assertThat(record.getVersion()).isEqualTo(1L);
        assertThat(record.getStatus()).isEqualTo("APPROVED");

        ClaimStatusResponse status = queryService.getClaimStatus(claimId);
        assertThat(status.getProcessingStatus()).isEqualTo(ClaimProcessingStatus.DECIDED);
        assertThat(status.getEstimatedPayout()).isEqualTo(2000.0);

        verify(objectStorageClient).put(eq("claimvoyant-test-reports"), eq(claimId + "/final_decision.json"),
                any(byte[].class), eq("application/json"));
        System.out.println("✅ Claim " + claimId + " decided: " + status.getDecision());
    }

    @Test
    @DisplayName("Unknown policy is audited as not_found and the claim is still decided")
    void unknownPolicy_ShouldStillDecide() {
        // Given
        String claimId = newClaimId();
        when(textExtractionClient.extractText(anyString(), anyString()))
                .thenReturn(new TextExtractionClient.ExtractedText("Policy: POL-999 hail damage", "job-2"));
        when(policySearchClient.hybridSearch(eq("POL-999"), anyInt())).thenReturn(List.of());

        // When
        PipelineResult result = workflowService.processClaim(new StorageLocation(RAW_BUCKET, claimId + "/report.pdf"), claimId);

        // Then
        assertThat(result.isDecided()).isTrue();
        assertThat(auditService.getClaimAuditTrail(claimId))
                .extracting(AuditEntry::getStatus)
                .containsExactly(AuditStatus.SUCCESS, AuditStatus.NOT_FOUND, AuditStatus.SUCCESS,
                        AuditStatus.SUCCESS, AuditStatus.SUCCESS);
    }

    @Test
    @DisplayName("Policy lookup fault halts the run and the status reports the failed stage")
    void policyFault_ShouldHalt() {
        // Given
        String claimId = newClaimId();
        when(policySearchClient.hybridSearch(anyString(), anyInt()))
                .thenThrow(new CapabilityException(ServiceType.WEAVIATE, "hybridSearch", "connection refused"));

        // When
        PipelineResult result = workflowService.processClaim(new StorageLocation(RAW_BUCKET, claimId + "/report.pdf"), claimId);

        // Then
        assertThat(result.getState()).isEqualTo(PipelineState.TERMINAL_FAILED);
        assertThat(auditService.getClaimAuditTrail(claimId)).extracting(AuditEntry::getAgent)
                .containsExactly("intake", "policy");
        assertThat(claimRecordService.findLatest(claimId)).isEmpty();

        ClaimStatusResponse status = queryService.getClaimStatus(claimId);
        assertThat(status.getProcessingStatus()).isEqualTo(ClaimProcessingStatus.FAILED);
        assertThat(status.getFailedStage()).isEqualTo("policy");
        assertThat(status.getError()).contains("connection refused");
    }

    @Test
    @DisplayName("Re-running a claim appends a new version")
    void rerun_ShouldAppendVersion() {
        String claimId = newClaimId();
        StorageLocation location = new StorageLocation(RAW_BUCKET, claimId + "/photo.png");

        workflowService.processClaim(location, claimId);
        workflowService.processClaim(location, claimId);

        assertThat(claimRecordService.getHistory(claimId)).extracting(ClaimRecord::getVersion).containsExactly(1L, 2L);
        assertThat(auditService.getClaimAuditTrail(claimId)).hasSize(10);
        assertThat(result(claimId).getDamageAssessment()).contains("\"damage_detected\":true");
    }

    @Test
    @DisplayName("Claims started asynchronously run concurrently and are decided independently")
    void asyncClaims_ShouldAllBeDecided() throws Exception {
        // Given
        List<String> claimIds = List.of(newClaimId(), newClaimId(), newClaimId());

        // When
        List<CompletableFuture<PipelineResult>> futures = claimIds.stream()
                .map(id -> workflowService.startClaim(new StorageLocation(RAW_BUCKET, id + "/report.pdf"), id))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);

        // Then
        for (CompletableFuture<PipelineResult> future : futures) {
            assertThat(future.get().isDecided()).isTrue();
        }
        for (String claimId : claimIds) {
            assertThat(claimRecordService.getHistory(claimId)).hasSize(1);
        }
    }

    private ClaimRecord result(String claimId) {
        return claimRecordService.findLatest(claimId).orElseThrow();
    }

    private static String newClaimId() {
        return "CLAIM-IT-" + UUID.randomUUID();
    }
}
