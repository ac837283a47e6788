package com.claimvoyant.workflow.pipeline;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.PipelineState;
import com.claimvoyant.model.claim.ClaimContext;
import lombok.Builder;
import lombok.Value;

/**
 * Final state of one pipeline run.
 */
@Value
@Builder
public class PipelineResult {

    PipelineState state;
    ClaimContext context;

    /**
     * Stage that failed; null for a decided run.
     */
    PipelineStage failedStage;

    String errorMessage;

    public String getClaimId() {
        return context != null ? context.getClaimId() : null;
    }

    public boolean isDecided() {
        return state == PipelineState.TERMINAL_DECIDED;
    }

    public static PipelineResult decided(ClaimContext context) {
        return PipelineResult.builder()
                .state(PipelineState.TERMINAL_DECIDED)
                .context(context)
                .build();
    }

    public static PipelineResult failed(ClaimContext context, PipelineStage stage, String message) {
        return PipelineResult.builder()
                .state(PipelineState.TERMINAL_FAILED)
                .context(context)
                .failedStage(stage)
                .errorMessage(message)
                .build();
    }
}
