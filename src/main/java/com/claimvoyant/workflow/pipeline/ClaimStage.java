package com.claimvoyant.workflow.pipeline;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.claim.ClaimContext;

/**
 * One step of the claim pipeline.
 * Implementations are Spring beans sorted by @Order; ClaimPipelineEngine runs them in that order.
 */
public interface ClaimStage {

    PipelineStage stage();

    /**
     * Runs the stage against the accumulated context.
     *
     * <p>Writes exactly one audit entry and reports faults through
     * {@link StageResult.Failed} instead of throwing.
     */
    StageResult execute(ClaimContext context);
}
