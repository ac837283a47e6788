package com.claimvoyant.workflow.pipeline;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.PipelineState;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.service.AuditLoggingService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs the five claim stages in order on the calling thread.
 *
 * <p>The first failed stage halts the run. Work already committed by earlier
 * stages stays in place; the audit trail shows where the run stopped. There are
 * no retries at this level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimPipelineEngine {

    public static final String MDC_CLAIM_ID = "claim_id";

    /**
     * Spring injects every ClaimStage bean sorted by its @Order.
     */
    private final List<ClaimStage> stages;

    private final AuditLoggingService auditService;

    @PostConstruct
    void validateStageOrder() {
        List<PipelineStage> actual = stages.stream().map(ClaimStage::stage).toList();
        List<PipelineStage> expected = Arrays.asList(PipelineStage.values());
        if (!actual.equals(expected)) {
            throw new IllegalStateException("Claim stages must be " + expected + " but were " + actual);
        }
        log.info("✅ Claim pipeline ready: {}", actual);
    }

    public PipelineResult run(ClaimContext initial) {
        ClaimContext context = initial;
        PipelineState state = PipelineState.initial();
        putClaimId(context);
        log.info("🚀 Starting claim pipeline for {}", initial.getSourceLocation());

        try {
            for (ClaimStage stage : stages) {
                PipelineStage current = state.stage();
                log.info(">> Executing stage: {}", current.getAgentName());

                StageResult result;
                try {
                    result = stage.execute(context);
                } catch (RuntimeException e) {
                    return escaped(context, current, e);
                }

                context = result.context();
                putClaimId(context);

                if (result instanceof StageResult.Failed failed) {
                    state = state.advance(AuditStatus.ERROR);
                    log.warn("⛔ Pipeline halted at {} ({}): {}", failed.stage().getAgentName(), state, failed.message());
                    return PipelineResult.failed(context, failed.stage(), failed.message());
                }
                state = state.advance(((StageResult.Completed) result).auditStatus());
            }

            log.info("🏁 Claim {} decided: {}", context.getClaimId(),
                    context.getDecisionData() != null ? context.getDecisionData().getDecision() : "?");
            return PipelineResult.decided(context);

        } finally {
            MDC.remove(MDC_CLAIM_ID);
        }
    }

    /**
     * A stage threw instead of returning a result, typically because its audit
     * write failed. Record the error entry it could not write, then fail the run.
     */
    private PipelineResult escaped(ClaimContext context, PipelineStage stage, RuntimeException e) {
        String message = String.valueOf(e.getMessage());
        log.error("Stage {} escaped with an exception", stage.getAgentName(), e);
        if (context.hasClaimId()) {
            try {
                auditService.recordStage(context.getClaimId(), stage, AuditStatus.ERROR,
                        Map.of("error", message, "unhandled", true));
            } catch (RuntimeException auditError) {
                log.error("CRITICAL: could not audit failure of stage {} for {}",
                        stage.getAgentName(), context.getClaimId(), auditError);
            }
        }
        return PipelineResult.failed(context, stage, message);
    }

    private static void putClaimId(ClaimContext context) {
        if (context.hasClaimId()) {
            MDC.put(MDC_CLAIM_ID, context.getClaimId());
        }
    }
}
