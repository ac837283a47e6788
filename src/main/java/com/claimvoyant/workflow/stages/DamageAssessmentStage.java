package com.claimvoyant.workflow.stages;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.DamageAssessment;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.workflow.assessment.DamageAssessor;
import com.claimvoyant.workflow.pipeline.AbstractClaimStage;
import com.claimvoyant.workflow.pipeline.StageResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

@Slf4j
@Component
@Order(3)
public class DamageAssessmentStage extends AbstractClaimStage {

    private final DamageAssessor damageAssessor;
    private final ObjectMapper objectMapper;

    public DamageAssessmentStage(AuditLoggingService auditService,
                                 DamageAssessor damageAssessor,
                                 ObjectMapper objectMapper) {
        super(auditService);
        this.damageAssessor = damageAssessor;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.DAMAGE;
    }

    @Override
    protected void checkPrerequisites(ClaimContext context) {
        super.checkPrerequisites(context);
        require(context.getExtractedData(), "extractedData");
    }

    @Override
    protected StageResult.Completed process(ClaimContext context) {
        DamageAssessment assessment = damageAssessor.assess(context.getExtractedData());
        log.info("🚗 Damage for {}: {} (repair ${})", context.getClaimId(),
                assessment.getSeverity(), assessment.getEstimatedRepairCost());

        return StageResult.completed(
                context.withDamageAssessment(assessment),
                AuditStatus.SUCCESS,
                objectMapper.convertValue(assessment, new TypeReference<LinkedHashMap<String, Object>>() {
                }));
    }
}
