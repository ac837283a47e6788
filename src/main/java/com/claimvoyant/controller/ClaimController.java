package com.claimvoyant.controller;

import com.claimvoyant.exception.ClaimInputException;
import com.claimvoyant.model.dto.AuditLogResponse;
import com.claimvoyant.model.dto.ClaimHistoryResponse;
import com.claimvoyant.model.dto.ClaimListResponse;
import com.claimvoyant.model.dto.ClaimStatusResponse;
import com.claimvoyant.model.dto.ClaimSubmissionResponse;
import com.claimvoyant.model.dto.ErrorResponse;
import com.claimvoyant.model.dto.ProcessClaimRequest;
import com.claimvoyant.service.ClaimIdGenerator;
import com.claimvoyant.service.ClaimQueryService;
import com.claimvoyant.service.ClaimSubmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST API for submitting claims and following their progress.
 *
 * Submissions return HTTP 202 Accepted while the pipeline runs asynchronously.
 * Use {@code GET /api/v1/claims/{claimId}} to poll for the decision.
 */
@Slf4j
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("/api/v1/claims")
@RequiredArgsConstructor
public class ClaimController {

    private static final int MAX_LIST_LIMIT = 100;

    private final ClaimSubmissionService submissionService;
    private final ClaimQueryService queryService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadClaim(@RequestPart(value = "files", required = false) List<MultipartFile> files) {
        try {
            ClaimSubmissionResponse response = submissionService.uploadAndProcess(files);
            return ResponseEntity.accepted().body(response);
        } catch (ClaimInputException e) {
            log.warn("Upload rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to upload claim", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @PostMapping("/process")
    public ResponseEntity<?> processClaim(@RequestBody ProcessClaimRequest request) {
        if (StringUtils.hasText(request.getClaimId()) && !ClaimIdGenerator.isValid(request.getClaimId())) {
            log.warn("Process request rejected: malformed claim_id");
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of("claim_id must match CLAIM-yyyyMMddHHmmss"));
        }
        try {
            ClaimSubmissionResponse response = submissionService.submit(request);
            return ResponseEntity.accepted().body(response);
        } catch (ClaimInputException e) {
            log.warn("Process request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to start claim processing", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @GetMapping("/{claimId}")
    public ResponseEntity<?> getClaim(@PathVariable String claimId) {
        try {
            ClaimStatusResponse status = queryService.getClaimStatus(claimId);
            return ResponseEntity.ok(status);
        } catch (Exception e) {
            log.error("Failed to load claim {}", claimId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @GetMapping("/{claimId}/audit")
    public ResponseEntity<?> getAuditLog(@PathVariable String claimId) {
        try {
            AuditLogResponse audit = queryService.getAuditTrail(claimId);
            return ResponseEntity.ok(audit);
        } catch (Exception e) {
            log.error("Failed to load audit log for {}", claimId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @GetMapping("/{claimId}/history")
    public ResponseEntity<?> getHistory(@PathVariable String claimId) {
        try {
            ClaimHistoryResponse history = queryService.getHistory(claimId);
            return ResponseEntity.ok(history);
        } catch (Exception e) {
            log.error("Failed to load history for {}", claimId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<?> listClaims(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of("limit must be between 1 and " + MAX_LIST_LIMIT));
        }
        try {
            ClaimListResponse claims = queryService.listRecentClaims(limit);
            return ResponseEntity.ok(claims);
        } catch (Exception e) {
            log.error("Failed to list claims", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
        }
    }
}
