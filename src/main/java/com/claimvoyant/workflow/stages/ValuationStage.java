package com.claimvoyant.workflow.stages;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.Valuation;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.workflow.assessment.VehicleValuator;
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
@Order(4)
public class ValuationStage extends AbstractClaimStage {

    private final VehicleValuator vehicleValuator;
    private final ObjectMapper objectMapper;

    public ValuationStage(AuditLoggingService auditService,
                          VehicleValuator vehicleValuator,
                          ObjectMapper objectMapper) {
        super(auditService);
        this.vehicleValuator = vehicleValuator;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.VALUATION;
    }

    @Override
    protected void checkPrerequisites(ClaimContext context) {
        super.checkPrerequisites(context);
        require(context.getEntities(), "entities");
    }

    @Override
    protected StageResult.Completed process(ClaimContext context) {
        Valuation valuation = vehicleValuator.value(context.getEntities());
        log.info("💰 Valuation for {}: ${} ({})", context.getClaimId(),
                valuation.getVehicleValue(), valuation.getVehicleInfo());

        return StageResult.completed(
                context.withValuation(valuation),
                AuditStatus.SUCCESS,
                objectMapper.convertValue(valuation, new TypeReference<LinkedHashMap<String, Object>>() {
                }));
    }
}
