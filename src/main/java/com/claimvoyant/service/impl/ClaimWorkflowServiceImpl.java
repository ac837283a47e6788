package com.claimvoyant.service.impl;

import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.service.ClaimWorkflowService;
import com.claimvoyant.workflow.pipeline.ClaimPipelineEngine;
import com.claimvoyant.workflow.pipeline.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimWorkflowServiceImpl implements ClaimWorkflowService {

    private final ClaimPipelineEngine pipelineEngine;

    @Override
    @Async("pipelineExecutor")
    public CompletableFuture<PipelineResult> startClaim(StorageLocation location, String claimId) {
        try {
            return CompletableFuture.completedFuture(processClaim(location, claimId));
        } catch (RuntimeException e) {
            log.error("Pipeline crashed for {} ({})", claimId, location, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public PipelineResult processClaim(StorageLocation location, String claimId) {
        PipelineResult result = pipelineEngine.run(ClaimContext.start(claimId, location));
        log.info("Pipeline finished for {}: {}{}", result.getClaimId(), result.getState(),
                result.getFailedStage() != null ? " at " + result.getFailedStage().getAgentName() : "");
        return result;
    }
}
