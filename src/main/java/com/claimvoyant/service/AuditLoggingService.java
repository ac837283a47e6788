package com.claimvoyant.service;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditEntry;
import com.claimvoyant.model.audit.AuditStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only audit trail of stage attempts.
 *
 * Usage:
 * <pre>
 * auditService.recordStage(claimId, PipelineStage.POLICY, AuditStatus.NOT_FOUND,
 *         Map.of("policy_number", "AUTO-042"));
 * </pre>
 */
public interface AuditLoggingService {

    /**
     * Writes one entry for one stage attempt. Entries are never updated.
     *
     * @param details stage specific details, stored as JSON
     */
    AuditEntry recordStage(String claimId, PipelineStage stage, AuditStatus status, Map<String, Object> details);

    /**
     * Every entry of a claim ordered by (timestamp, id).
     */
    List<AuditEntry> getClaimAuditTrail(String claimId);

    Optional<AuditEntry> getLatestEntry(String claimId);
}
