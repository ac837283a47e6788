package com.claimvoyant.service.impl;

import com.claimvoyant.client.ObjectStorageClient;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.exception.ClaimInputException;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.model.dto.ClaimSubmissionResponse;
import com.claimvoyant.model.dto.ProcessClaimRequest;
import com.claimvoyant.model.dto.UploadedFile;
import com.claimvoyant.service.ClaimIdGenerator;
import com.claimvoyant.service.ClaimSubmissionService;
import com.claimvoyant.service.ClaimWorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimSubmissionServiceImpl implements ClaimSubmissionService {

    private final ObjectStorageClient objectStorageClient;
    private final ClaimWorkflowService workflowService;
    private final ClaimIdGenerator idGenerator;
    private final AppProperties props;

    @Override
    public ClaimSubmissionResponse uploadAndProcess(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new ClaimInputException("At least one file is required");
        }

        String claimId = idGenerator.nextId();
        String bucket = props.getRawClaimsBucket();
        List<UploadedFile> uploaded = new ArrayList<>();

        for (MultipartFile file : files) {
            String filename = StringUtils.getFilename(file.getOriginalFilename());
            if (!StringUtils.hasText(filename)) {
                throw new ClaimInputException("Uploaded file has no name");
            }
            String key = claimId + "/" + filename;
            String contentType = file.getContentType() != null ? file.getContentType() : "application/octet-stream";
            try {
                objectStorageClient.put(bucket, key, file.getBytes(), contentType);
            } catch (IOException e) {
                throw new CapabilityException(ServiceType.S3, "putObject", "cannot read upload " + filename, e);
            }
            uploaded.add(UploadedFile.builder()
                    .filename(filename)
                    .key(key)
                    .size(file.getSize())
                    .build());
        }

        // Only the first file drives the pipeline; the rest are stored as supporting documents
        String firstKey = uploaded.get(0).getKey();
        workflowService.startClaim(new StorageLocation(bucket, firstKey), claimId);
        log.info("📤 Claim {} uploaded ({} files), processing {}", claimId, uploaded.size(), firstKey);

        ClaimSubmissionResponse response = ClaimSubmissionResponse.processing(claimId,
                "Claim uploaded successfully and processing started");
        response.setFiles(uploaded);
        return response;
    }

    @Override
    public ClaimSubmissionResponse submit(ProcessClaimRequest request) {
        StorageLocation location = new StorageLocation(request.getBucket(), request.getKey());
        if (!location.isComplete()) {
            throw new ClaimInputException("Missing bucket or key");
        }

        String claimId = request.getClaimId();
        if (!StringUtils.hasText(claimId)) {
            claimId = idGenerator.nextId();
        } else if (!ClaimIdGenerator.isValid(claimId)) {
            throw new ClaimInputException("claim_id must match CLAIM-yyyyMMddHHmmss");
        }
        workflowService.startClaim(location, claimId);
        log.info("Claim {} submitted for {}", claimId, location);

        ClaimSubmissionResponse response = ClaimSubmissionResponse.processing(claimId, "Claim processing started");
        response.setBucket(location.bucket());
        response.setKey(location.key());
        return response;
    }
}
