package com.claimvoyant.service;

import com.claimvoyant.model.dto.ClaimSubmissionResponse;
import com.claimvoyant.model.dto.ProcessClaimRequest;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Accepts new claims from the API and hands them to the pipeline.
 */
public interface ClaimSubmissionService {

    /**
     * Stores the files under {@code <claim_id>/<filename>} in the raw-claims bucket
     * and starts processing the first one.
     *
     * @throws com.claimvoyant.exception.ClaimInputException when no file was sent
     */
    ClaimSubmissionResponse uploadAndProcess(List<MultipartFile> files);

    /**
     * Starts processing a document that is already stored.
     *
     * @throws com.claimvoyant.exception.ClaimInputException when bucket or key is missing
     */
    ClaimSubmissionResponse submit(ProcessClaimRequest request);
}
