package com.claimvoyant.model.dto;

/**
 * Operator view of a claim.
 * <ul>
 *   <li>PROCESSING: no record yet and no failure in the audit trail</li>
 *   <li>FAILED: no record and the latest audit entry is an error</li>
 *   <li>DECIDED: a record exists</li>
 * </ul>
 */
public enum ClaimProcessingStatus {
    PROCESSING,
    FAILED,
    DECIDED
}
