package com.claimvoyant.workflow.stages;

import com.claimvoyant.client.PolicySearchClient;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.PolicyData;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.workflow.pipeline.AbstractClaimStage;
import com.claimvoyant.workflow.pipeline.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 2: looks up the policy named in the claim.
 *
 * Three distinct outcomes: found ({@code success}), no match ({@code not_found},
 * the pipeline continues) and lookup fault ({@code error}, the pipeline halts).
 */
@Slf4j
@Component
@Order(2)
public class PolicyResolutionStage extends AbstractClaimStage {

    static final String NOT_FOUND_REASON = "Policy not found";

    private final PolicySearchClient policySearchClient;
    private final AppProperties props;

    public PolicyResolutionStage(AuditLoggingService auditService,
                                 PolicySearchClient policySearchClient,
                                 AppProperties props) {
        super(auditService);
        this.policySearchClient = policySearchClient;
        this.props = props;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.POLICY;
    }

    @Override
    protected void checkPrerequisites(ClaimContext context) {
        super.checkPrerequisites(context);
        require(context.getEntities(), "entities");
    }

    @Override
    protected StageResult.Completed process(ClaimContext context) {
        String policyNumber = context.getEntities().getPolicyNumber();
        if (policyNumber == null || policyNumber.isBlank()) {
            policyNumber = props.getPipeline().getDefaultPolicyNumber();
            log.info("No policy number in claim {}, using default {}", context.getClaimId(), policyNumber);
        }

        List<Map<String, Object>> hits = policySearchClient.hybridSearch(policyNumber, 1);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("policy_number", policyNumber);

        if (hits.isEmpty()) {
            log.info("🔍 Policy {} not found for claim {}", policyNumber, context.getClaimId());
            details.put("found", false);
            return StageResult.completed(
                    context.withPolicyData(PolicyData.notFound(NOT_FOUND_REASON)),
                    AuditStatus.NOT_FOUND,
                    details);
        }

        PolicyData policy = toPolicyData(hits.get(0));
        log.info("🔍 Policy {} resolved to {} ({})", policyNumber, policy.getPolicyId(), policy.getCoverageType());
        details.put("found", true);
        details.put("policy_id", policy.getPolicyId());
        return StageResult.completed(context.withPolicyData(policy), AuditStatus.SUCCESS, details);
    }

    private static PolicyData toPolicyData(Map<String, Object> properties) {
        return PolicyData.builder()
                .found(true)
                .policyId(asString(properties.get("policy_id")))
                .coverageType(asString(properties.get("coverage_type")))
                .deductible(asDouble(properties.get("deductible")))
                .coverageLimit(asDouble(properties.get("coverage_limit")))
                .filingDeadlineDays(asInteger(properties.get("filing_deadline_days")))
                .content(asString(properties.get("content")))
                .build();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Double.valueOf(text.trim());
        }
        return null;
    }

    private static Integer asInteger(Object value) {
        Double number = asDouble(value);
        return number != null ? (int) Math.round(number) : null;
    }
}
