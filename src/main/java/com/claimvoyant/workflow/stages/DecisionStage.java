package com.claimvoyant.workflow.stages;

import com.claimvoyant.client.ObjectStorageClient;
import com.claimvoyant.client.ReasoningEngine;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.configuration.PipelineProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.DecisionData;
import com.claimvoyant.model.record.ClaimRecord;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.service.ClaimRecordService;
import com.claimvoyant.service.PromptLibraryService;
import com.claimvoyant.workflow.assessment.DecisionResponseParser;
import com.claimvoyant.workflow.pipeline.AbstractClaimStage;
import com.claimvoyant.workflow.pipeline.StageResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage 5: asks the reasoning engine for a decision and commits it.
 *
 * <p>A reasoning fault or an answer outside the schema becomes the ERROR
 * decision, which is committed like any other. The stage only fails when the
 * record cannot be committed. The decision report written to object storage
 * afterwards is best-effort.
 */
@Slf4j
@Component
@Order(5)
public class DecisionStage extends AbstractClaimStage {

    static final String PROMPT_TEMPLATE = "claim-decision";
    static final String REPORT_FILE = "final_decision.json";

    private final PromptLibraryService promptLibrary;
    private final ReasoningEngine reasoningEngine;
    private final DecisionResponseParser responseParser;
    private final ClaimRecordService claimRecordService;
    private final ObjectStorageClient objectStorageClient;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    public DecisionStage(AuditLoggingService auditService,
                         PromptLibraryService promptLibrary,
                         ReasoningEngine reasoningEngine,
                         DecisionResponseParser responseParser,
                         ClaimRecordService claimRecordService,
                         ObjectStorageClient objectStorageClient,
                         AppProperties props,
                         ObjectMapper objectMapper) {
        super(auditService);
        this.promptLibrary = promptLibrary;
        this.reasoningEngine = reasoningEngine;
        this.responseParser = responseParser;
        this.claimRecordService = claimRecordService;
        this.objectStorageClient = objectStorageClient;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.DECISION;
    }

    @Override
    protected void checkPrerequisites(ClaimContext context) {
        super.checkPrerequisites(context);
        require(context.getExtractedData(), "extractedData");
        require(context.getEntities(), "entities");
        require(context.getPolicyData(), "policyData");
        require(context.getDamageAssessment(), "damageAssessment");
        require(context.getValuation(), "valuation");
    }

    @Override
    protected StageResult.Completed process(ClaimContext context) {
        String prompt = buildPrompt(context);
        DecisionData decision = decide(context.getClaimId(), prompt);
        log.info("⚖️ Decision for {}: {} (confidence {})",
                context.getClaimId(), decision.getDecision(), decision.getConfidence());

        ClaimContext next = context.withDecisionData(decision);
        ClaimRecord record = claimRecordService.commit(next, decision.getDecision().name());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("decision", decision.getDecision().name());
        details.put("confidence", decision.getConfidence());
        details.put("version", record.getVersion());
        writeReport(next, record, details);

        return StageResult.completed(next, AuditStatus.SUCCESS, details);
    }

    String buildPrompt(ClaimContext context) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("claimId", context.getClaimId());
        variables.put("policyData", prettyJson(context.getPolicyData()));
        variables.put("extractedData", prettyJson(context.getExtractedData()));
        variables.put("entities", prettyJson(context.getEntities()));
        variables.put("damageAssessment", prettyJson(context.getDamageAssessment()));
        variables.put("valuation", prettyJson(context.getValuation()));
        return promptLibrary.render(PROMPT_TEMPLATE, variables);
    }

    private DecisionData decide(String claimId, String prompt) {
        PipelineProperties pipeline = props.getPipeline();
        try {
            String response = reasoningEngine.invoke(prompt, pipeline.getDecisionMaxTokens(), pipeline.getDecisionTemperature());
            return responseParser.parse(response);
        } catch (CapabilityException e) {
            log.warn("Reasoning failed for {}, recording ERROR decision: {}", claimId, e.getMessage());
            return DecisionData.fallback("Failed to process claim: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected reasoning failure for {}, recording ERROR decision", claimId, e);
            return DecisionData.fallback("Failed to process claim: " + e.getClass().getSimpleName()
                    + ": " + e.getMessage());
        }
    }

    private void writeReport(ClaimContext context, ClaimRecord record, Map<String, Object> details) {
        String reportKey = context.getClaimId() + "/" + REPORT_FILE;
        details.put("report_key", reportKey);

        DecisionData decision = context.getDecisionData();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("claim_id", context.getClaimId());
        report.put("version", record.getVersion());
        report.put("timestamp", record.getTimestamp().toString());
        report.put("decision", decision.getDecision().name());
        report.put("reasoning", decision.getReasoning());
        report.put("confidence", decision.getConfidence());
        report.put("estimated_payout", decision.getEstimatedPayout());
        report.put("deductible_applies", decision.isDeductibleApplies());
        report.put("required_actions", decision.getRequiredActions());
        report.put("risk_factors", decision.getRiskFactors());
        report.put("policy_data", context.getPolicyData());
        report.put("entities", context.getEntities());

        try {
            byte[] body = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(report)
                    .getBytes(StandardCharsets.UTF_8);
            objectStorageClient.put(props.getReportsBucket(), reportKey, body, "application/json");
            details.put("report_status", "written");
        } catch (JsonProcessingException | RuntimeException e) {
            // Decision is already committed at this point
            log.warn("Decision report for {} not written: {}", context.getClaimId(), e.getMessage());
            details.put("report_status", "failed");
            details.put("report_error", String.valueOf(e.getMessage()));
        }
    }

    private String prettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName() + " for prompt", e);
        }
    }
}
