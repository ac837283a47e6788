package com.claimvoyant.service.impl;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditEntry;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.repository.AuditEntryRepository;
import com.claimvoyant.service.AuditLoggingService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JPA backed audit trail.
 *
 * Read paths use the (claim_id, timestamp) index; when that query fails with a
 * data-access error they fall back to scanning the table and filtering in memory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLoggingServiceImpl implements AuditLoggingService {

    private static final Comparator<AuditEntry> CHRONOLOGICAL =
            Comparator.comparing(AuditEntry::getTimestamp).thenComparing(AuditEntry::getId);

    private final AuditEntryRepository auditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public AuditEntry recordStage(String claimId, PipelineStage stage, AuditStatus status, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .logId(claimId + "-" + stage.getAgentName())
                .claimId(claimId)
                .agent(stage.getAgentName())
                .action(stage.getAction())
                .status(status)
                .details(toJson(details))
                .timestamp(clock.instant())
                .build();

        AuditEntry saved = auditRepository.save(entry);
        log.info("📝 Audit [{}] {} → {}", claimId, stage.getAgentName(), status.getValue());
        return saved;
    }

    @Override
    public List<AuditEntry> getClaimAuditTrail(String claimId) {
        try {
            return auditRepository.findByClaimIdOrderByTimestampAscIdAsc(claimId);
        } catch (DataAccessException e) {
            log.warn("Indexed audit query failed for {}, scanning: {}", claimId, e.getMessage());
            return auditRepository.findAll().stream()
                    .filter(entry -> claimId.equals(entry.getClaimId()))
                    .sorted(CHRONOLOGICAL)
                    .toList();
        }
    }

    @Override
    public Optional<AuditEntry> getLatestEntry(String claimId) {
        try {
            return auditRepository.findFirstByClaimIdOrderByTimestampDescIdDesc(claimId);
        } catch (DataAccessException e) {
            log.warn("Indexed latest-audit query failed for {}, scanning: {}", claimId, e.getMessage());
            return auditRepository.findAll().stream()
                    .filter(entry -> claimId.equals(entry.getClaimId()))
                    .max(CHRONOLOGICAL);
        }
    }

    private String toJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            // Entry is still written, carrying the serialization error instead of the details
            log.error("Failed to serialize audit details: {}", e.getMessage(), e);
            return "{\"details_error\":\"" + String.valueOf(e.getOriginalMessage()).replace("\"", "'") + "\"}";
        }
    }
}
