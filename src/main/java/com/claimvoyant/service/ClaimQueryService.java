package com.claimvoyant.service;

import com.claimvoyant.model.dto.AuditLogResponse;
import com.claimvoyant.model.dto.ClaimHistoryResponse;
import com.claimvoyant.model.dto.ClaimListResponse;
import com.claimvoyant.model.dto.ClaimStatusResponse;

/**
 * Read side of the claim store and audit trail.
 */
public interface ClaimQueryService {

    /**
     * Decided, failed or still processing.
     */
    ClaimStatusResponse getClaimStatus(String claimId);

    AuditLogResponse getAuditTrail(String claimId);

    ClaimHistoryResponse getHistory(String claimId);

    ClaimListResponse listRecentClaims(int limit);
}
