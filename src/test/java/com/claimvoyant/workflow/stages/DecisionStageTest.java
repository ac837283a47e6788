package com.claimvoyant.workflow.stages;

import com.claimvoyant.client.ObjectStorageClient;
import com.claimvoyant.client.ReasoningEngine;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.ClaimDecision;
import com.claimvoyant.model.claim.ClaimEntities;
import com.claimvoyant.model.claim.DamageAssessment;
import com.claimvoyant.model.claim.DamageSeverity;
import com.claimvoyant.model.claim.ExtractedData;
import com.claimvoyant.model.claim.FileType;
import com.claimvoyant.model.claim.PolicyData;
import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.model.claim.Valuation;
import com.claimvoyant.model.record.ClaimRecord;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.service.ClaimRecordService;
import com.claimvoyant.service.PromptLibraryService;
import com.claimvoyant.workflow.assessment.DecisionResponseParser;
import com.claimvoyant.workflow.pipeline.StageResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Decision Stage Tests")
class DecisionStageTest {

    private static final String CLAIM_ID = "CLAIM-20251022103000";

    private static final String APPROVED_RESPONSE = """
            {"decision": "APPROVED", "reasoning": "Covered collision within the filing window.",
             "confidence": 0.9, "estimated_payout": 2000.0, "deductible_applies": true,
             "required_actions": ["Pay claimant"], "risk_factors": []}
            """;

    @Mock
    private AuditLoggingService auditService;
    @Mock
    private ReasoningEngine reasoningEngine;
    @Mock
    private ClaimRecordService claimRecordService;
    @Mock
    private ObjectStorageClient objectStorageClient;

    @Captor
    private ArgumentCaptor<Map<String, Object>> detailsCaptor;
    @Captor
    private ArgumentCaptor<ClaimContext> contextCaptor;
    @Captor
    private ArgumentCaptor<byte[]> bodyCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DecisionStage stage;

    @BeforeEach
    void setUp() {
        PromptLibraryService promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
        stage = new DecisionStage(auditService, promptLibrary, reasoningEngine,
                new DecisionResponseParser(objectMapper), claimRecordService, objectStorageClient,
                new AppProperties(), objectMapper);
    }

    @Test
    @DisplayName("Prompt carries the claim id and every upstream result as JSON")
    void buildPrompt_ShouldEmbedAllInputs() {
        String prompt = stage.buildPrompt(readyForDecision());

        assertThat(prompt)
                .contains("CLAIM ID: " + CLAIM_ID)
                .contains("\"policy_id\" : \"AUTO-042\"")
                .contains("\"estimated_repair_cost\" : 2500.0")
                .contains("\"vehicle_value\" : 25000.0")
                .contains("APPROVED|DENIED|PENDING")
                .doesNotContain("&quot;");
    }

    @Test
    @DisplayName("Valid answer is committed, audited and reported")
    void execute_ValidAnswer_ShouldCommitDecision() throws Exception {
        // Given
        when(reasoningEngine.invoke(anyString(), eq(2048), eq(0.3))).thenReturn(APPROVED_RESPONSE);
        when(claimRecordService.commit(any(), eq("APPROVED"))).thenReturn(record(1));

        // When
        StageResult result = stage.execute(readyForDecision());

        // Then
        assertThat(result).isInstanceOf(StageResult.Completed.class);
        assertThat(result.context().getDecisionData().getDecision()).isEqualTo(ClaimDecision.APPROVED);

        verify(claimRecordService).commit(contextCaptor.capture(), eq("APPROVED"));
        assertThat(contextCaptor.getValue().getDecisionData().getEstimatedPayout()).isEqualTo(2000.0);

        verify(objectStorageClient).put(eq("claimvoyant-reports"), eq(CLAIM_ID + "/final_decision.json"),
                bodyCaptor.capture(), eq("application/json"));
        JsonNode report = objectMapper.readTree(bodyCaptor.getValue());
        assertThat(report.path("claim_id").asText()).isEqualTo(CLAIM_ID);
        assertThat(report.path("version").asLong()).isEqualTo(1L);
        assertThat(report.path("decision").asText()).isEqualTo("APPROVED");
        assertThat(report.path("policy_data").path("policy_id").asText()).isEqualTo("AUTO-042");

        verify(auditService).recordStage(eq(CLAIM_ID), eq(PipelineStage.DECISION), eq(AuditStatus.SUCCESS), detailsCaptor.capture());
        assertThat(detailsCaptor.getValue())
                .containsEntry("decision", "APPROVED")
                .containsEntry("version", 1L)
                .containsEntry("report_status", "written");
    }

    @Test
    @DisplayName("Unparseable answer becomes an ERROR decision, still committed")
    void execute_GarbageAnswer_ShouldCommitErrorDecision() {
        // Given
        when(reasoningEngine.invoke(anyString(), anyInt(), anyDouble())).thenReturn("Looks fine to me!");
        when(claimRecordService.commit(any(), eq("ERROR"))).thenReturn(record(2));

        // When
        StageResult result = stage.execute(readyForDecision());

        // Then
        assertThat(result).isInstanceOf(StageResult.Completed.class);
        assertThat(result.context().getDecisionData().getDecision()).isEqualTo(ClaimDecision.ERROR);
        assertThat(result.context().getDecisionData().getConfidence()).isEqualTo(0.0);
        verify(auditService).recordStage(eq(CLAIM_ID), eq(PipelineStage.DECISION), eq(AuditStatus.SUCCESS), any());
    }

    @Test
    @DisplayName("Reasoning fault becomes an ERROR decision with the fault as reasoning")
    void execute_ReasoningFault_ShouldCommitErrorDecision() {
        // Given
        when(reasoningEngine.invoke(anyString(), anyInt(), anyDouble()))
                .thenThrow(new CapabilityException(ServiceType.GEMINI, "generateContent", "HTTP 503"));
        when(claimRecordService.commit(any(), eq("ERROR"))).thenReturn(record(1));

        // When
        StageResult result = stage.execute(readyForDecision());

        // Then
        assertThat(result.context().getDecisionData().getDecision()).isEqualTo(ClaimDecision.ERROR);
        assertThat(result.context().getDecisionData().getReasoning())
                .startsWith("Failed to process claim: ")
                .contains("HTTP 503");
    }

    @Test
    @DisplayName("Unexpected reasoning exception still commits an ERROR decision")
    void execute_UnexpectedReasoningException_ShouldCommitErrorDecision() {
        // Given
        when(reasoningEngine.invoke(anyString(), anyInt(), anyDouble()))
                .thenThrow(new IllegalStateException("connection reset"));
        when(claimRecordService.commit(any(), eq("ERROR"))).thenReturn(record(1));

        // When
        StageResult result = stage.execute(readyForDecision());

        // Then
        assertThat(result).isInstanceOf(StageResult.Completed.class);
        assertThat(((StageResult.Completed) result).auditStatus()).isEqualTo(AuditStatus.SUCCESS);
        assertThat(result.context().getDecisionData().getDecision()).isEqualTo(ClaimDecision.ERROR);
        assertThat(result.context().getDecisionData().getConfidence()).isEqualTo(0.0);
        assertThat(result.context().getDecisionData().getReasoning()).contains("connection reset");
        verify(claimRecordService).commit(any(), eq("ERROR"));
    }

    @Test
    @DisplayName("Commit failure fails the stage and nothing is reported")
    void execute_CommitFailure_ShouldFail() {
        // Given
        when(reasoningEngine.invoke(anyString(), anyInt(), anyDouble())).thenReturn(APPROVED_RESPONSE);
        when(claimRecordService.commit(any(), anyString()))
                .thenThrow(new CapabilityException(ServiceType.DATABASE, "commit", "version conflict"));

        // When
        StageResult result = stage.execute(readyForDecision());

        // Then
        assertThat(result).isInstanceOf(StageResult.Failed.class);
        verify(auditService).recordStage(eq(CLAIM_ID), eq(PipelineStage.DECISION), eq(AuditStatus.ERROR), any());
        verifyNoInteractions(objectStorageClient);
    }

    @Test
    @DisplayName("Report write failure does not undo the committed decision")
    void execute_ReportFailure_ShouldStillSucceed() {
        // Given
        when(reasoningEngine.invoke(anyString(), anyInt(), anyDouble())).thenReturn(APPROVED_RESPONSE);
        when(claimRecordService.commit(any(), anyString())).thenReturn(record(3));
        doThrow(new CapabilityException(ServiceType.S3, "putObject", "AccessDenied"))
                .when(objectStorageClient).put(anyString(), anyString(), any(byte[].class), anyString());

        // When
        StageResult result = stage.execute(readyForDecision());

        // Then
        assertThat(result).isInstanceOf(StageResult.Completed.class);
        verify(auditService).recordStage(eq(CLAIM_ID), eq(PipelineStage.DECISION), eq(AuditStatus.SUCCESS), detailsCaptor.capture());
        assertThat(detailsCaptor.getValue()).containsEntry("report_status", "failed").containsKey("report_error");
    }

    @Test
    @DisplayName("Missing upstream output fails before the reasoning engine is called")
    void execute_MissingValuation_ShouldFail() {
        ClaimContext incomplete = ClaimContext.start(CLAIM_ID, new StorageLocation("b", "k.pdf"))
                .withIntake(ExtractedData.builder().fileType(FileType.PDF).text("t").build(), ClaimEntities.empty())
                .withPolicyData(PolicyData.notFound("Policy not found"));

        StageResult result = stage.execute(incomplete);

        assertThat(result).isInstanceOf(StageResult.Failed.class);
        assertThat(((StageResult.Failed) result).message()).isEqualTo("Missing prerequisite 'damageAssessment'");
        verifyNoInteractions(reasoningEngine);
        verify(claimRecordService, never()).commit(any(), anyString());
    }

    private static ClaimRecord record(long version) {
        return ClaimRecord.builder()
                .claimId(CLAIM_ID)
                .version(version)
                .status("APPROVED")
                .timestamp(Instant.parse("2025-10-22T10:31:00Z"))
                .build();
    }

    private static ClaimContext readyForDecision() {
        return ClaimContext.start(CLAIM_ID, new StorageLocation("claimvoyant-raw-claims", CLAIM_ID + "/report.pdf"))
                .withIntake(ExtractedData.builder().fileType(FileType.PDF).text("Policy: AUTO-042 on 2025-10-20").build(),
                        ClaimEntities.builder().policyNumber("AUTO-042").incidentDate("2025-10-20").build())
                .withPolicyData(PolicyData.builder()
                        .found(true)
                        .policyId("AUTO-042")
                        .coverageType("collision")
                        .deductible(500.0)
                        .coverageLimit(50000.0)
                        .filingDeadlineDays(30)
                        .build())
                .withDamageAssessment(DamageAssessment.builder()
                        .damageDetected(true)
                        .severity(DamageSeverity.MODERATE)
                        .estimatedRepairCost(2500.0)
                        .damageLocations(List.of("Front bumper", "Hood"))
                        .confidence(0.75)
                        .build())
                .withValuation(Valuation.builder()
                        .vehicleValue(25000.0)
                        .vehicleInfo("Unknown")
                        .marketSource("Mock Data (KBB/NADA in production)")
                        .confidence(0.8)
                        .build());
    }
}
