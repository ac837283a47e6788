package com.claimvoyant.workflow.pipeline;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;

import java.util.Map;

/**
 * Outcome of a single stage execution.
 */
public sealed interface StageResult permits StageResult.Completed, StageResult.Failed {

    /**
     * Context after the stage: extended on completion, unchanged (apart from a
     * freshly assigned claim id) on failure.
     */
    ClaimContext context();

    static Completed completed(ClaimContext context, AuditStatus status, Map<String, Object> details) {
        return new Completed(context, status, details);
    }

    static Failed failed(ClaimContext context, PipelineStage stage, String message, Throwable cause) {
        return new Failed(context, stage, message, cause);
    }

    /**
     * Stage finished; {@code auditStatus} is SUCCESS or NOT_FOUND.
     */
    record Completed(ClaimContext context, AuditStatus auditStatus, Map<String, Object> details)
            implements StageResult {

        public Completed {
            if (auditStatus == AuditStatus.ERROR) {
                throw new IllegalArgumentException("A completed stage cannot report status error");
            }
            details = details == null ? Map.of() : details;
        }
    }

    record Failed(ClaimContext context, PipelineStage stage, String message, Throwable cause)
            implements StageResult {
    }
}
