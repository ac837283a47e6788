package com.claimvoyant.service;

import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.workflow.pipeline.PipelineResult;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for running the claim pipeline.
 */
public interface ClaimWorkflowService {

    /**
     * Runs the pipeline on the {@code pipelineExecutor} pool and returns immediately.
     *
     * @param claimId pre-assigned claim id, or null to let Intake generate one
     */
    CompletableFuture<PipelineResult> startClaim(StorageLocation location, String claimId);

    /**
     * Runs the pipeline on the calling thread.
     */
    PipelineResult processClaim(StorageLocation location, String claimId);
}
