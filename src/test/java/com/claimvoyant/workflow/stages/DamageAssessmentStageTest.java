package com.claimvoyant.workflow.stages;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.ClaimEntities;
import com.claimvoyant.model.claim.DamageAssessment;
import com.claimvoyant.model.claim.DamageSeverity;
import com.claimvoyant.model.claim.DetectedLabel;
import com.claimvoyant.model.claim.ExtractedData;
import com.claimvoyant.model.claim.FileType;
import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.workflow.assessment.LabelDamageAssessor;
import com.claimvoyant.workflow.pipeline.StageResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Damage Assessment Stage Tests")
class DamageAssessmentStageTest {

    private static final String CLAIM_ID = "CLAIM-20251022103000";

    @Mock
    private AuditLoggingService auditService;

    @Captor
    private ArgumentCaptor<Map<String, Object>> detailsCaptor;

    private DamageAssessmentStage stage;

    @BeforeEach
    void setUp() {
        stage = new DamageAssessmentStage(auditService, new LabelDamageAssessor(), new ObjectMapper());
    }

    @Test
    @DisplayName("Vehicle labels produce a moderate damage estimate")
    void execute_VehicleLabels_ShouldDetectDamage() {
        // Given
        ExtractedData image = ExtractedData.builder()
                .fileType(FileType.IMAGE)
                .labels(List.of(new DetectedLabel("Tree", 91.0), new DetectedLabel("CAR", 97.2)))
                .build();

        // When
        StageResult result = stage.execute(withExtracted(image));

        // Then
        DamageAssessment assessment = result.context().getDamageAssessment();
        assertThat(assessment.isDamageDetected()).isTrue();
        assertThat(assessment.getSeverity()).isEqualTo(DamageSeverity.MODERATE);
        assertThat(assessment.getEstimatedRepairCost()).isEqualTo(2500.0);
        assertThat(assessment.getDamageLocations()).containsExactly("Front bumper", "Hood");
        assertThat(assessment.getConfidence()).isEqualTo(0.75);

        verify(auditService).recordStage(eq(CLAIM_ID), eq(PipelineStage.DAMAGE), eq(AuditStatus.SUCCESS), detailsCaptor.capture());
        assertThat(detailsCaptor.getValue()).containsEntry("damage_detected", true).containsEntry("estimated_repair_cost", 2500.0);
    }

    @Test
    @DisplayName("Documents without labels report no damage")
    void execute_NoLabels_ShouldReportNone() {
        StageResult result = stage.execute(withExtracted(
                ExtractedData.builder().fileType(FileType.PDF).text("Policy: AUTO-042").build()));

        DamageAssessment assessment = result.context().getDamageAssessment();
        assertThat(assessment.isDamageDetected()).isFalse();
        assertThat(assessment.getSeverity()).isEqualTo(DamageSeverity.NONE);
        assertThat(assessment.getEstimatedRepairCost()).isEqualTo(0.0);
        assertThat(assessment.getDamageLocations()).isEmpty();
    }

    @Test
    @DisplayName("Labels unrelated to vehicles report no damage")
    void execute_UnrelatedLabels_ShouldReportNone() {
        StageResult result = stage.execute(withExtracted(ExtractedData.builder()
                .fileType(FileType.IMAGE)
                .labels(List.of(new DetectedLabel("Tree", 80.0)))
                .build()));

        assertThat(result.context().getDamageAssessment().isDamageDetected()).isFalse();
        assertThat(result.context().getDamageAssessment().getSeverity()).isEqualTo(DamageSeverity.NONE);
    }

    private static ClaimContext withExtracted(ExtractedData extracted) {
        return ClaimContext.start(CLAIM_ID, new StorageLocation("b", "k.jpg"))
                .withIntake(extracted, ClaimEntities.empty());
    }
}
