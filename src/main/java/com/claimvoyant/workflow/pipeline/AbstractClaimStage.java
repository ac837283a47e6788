package com.claimvoyant.workflow.pipeline;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.service.AuditLoggingService;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template for pipeline stages.
 *
 * <p>Flow of {@link #execute}:
 * <ol>
 *   <li>{@link #prepare} (Intake assigns the claim id here)</li>
 *   <li>{@link #checkPrerequisites}</li>
 *   <li>{@link #process}, the stage body</li>
 *   <li>one audit entry: the completed status, or {@code error} when any step threw</li>
 * </ol>
 * A failure from the audit write itself is not converted; it escapes to the engine.
 */
@Slf4j
public abstract class AbstractClaimStage implements ClaimStage {

    protected final AuditLoggingService auditService;

    protected AbstractClaimStage(AuditLoggingService auditService) {
        this.auditService = auditService;
    }

    @Override
    public final StageResult execute(ClaimContext context) {
        ClaimContext prepared = context;
        StageResult.Completed completed;
        try {
            prepared = prepare(context);
            checkPrerequisites(prepared);
            completed = process(prepared);
        } catch (RuntimeException e) {
            return fail(prepared, e);
        }

        auditService.recordStage(completed.context().getClaimId(), stage(),
                completed.auditStatus(), completed.details());
        return completed;
    }

    /**
     * Hook run before the prerequisite check. Defaults to the identity.
     */
    protected ClaimContext prepare(ClaimContext context) {
        return context;
    }

    /**
     * Throws when a field this stage reads has not been populated by its predecessor.
     */
    protected void checkPrerequisites(ClaimContext context) {
        require(context.hasClaimId() ? context.getClaimId() : null, "claimId");
    }

    protected abstract StageResult.Completed process(ClaimContext context);

    /**
     * Audit details written for a failed attempt.
     */
    protected Map<String, Object> failureDetails(ClaimContext context, RuntimeException error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", String.valueOf(error.getMessage()));
        return details;
    }

    protected static void require(Object value, String field) {
        if (value == null) {
            throw new IllegalStateException("Missing prerequisite '" + field + "'");
        }
    }

    private StageResult fail(ClaimContext context, RuntimeException error) {
        PipelineStage stage = stage();
        String message = String.valueOf(error.getMessage());
        log.error("❌ Stage {} failed for {}: {}", stage.getAgentName(), context.getClaimId(), message, error);

        if (context.hasClaimId()) {
            auditService.recordStage(context.getClaimId(), stage, AuditStatus.ERROR, failureDetails(context, error));
        } else {
            log.error("Stage {} failed before a claim id was assigned; nothing audited", stage.getAgentName());
        }
        return StageResult.failed(context, stage, message, error);
    }
}
