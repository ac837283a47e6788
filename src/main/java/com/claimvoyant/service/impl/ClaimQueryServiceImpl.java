package com.claimvoyant.service.impl;

import com.claimvoyant.model.audit.AuditEntry;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.dto.AuditEntryView;
import com.claimvoyant.model.dto.AuditLogResponse;
import com.claimvoyant.model.dto.ClaimHistoryResponse;
import com.claimvoyant.model.dto.ClaimListResponse;
import com.claimvoyant.model.dto.ClaimProcessingStatus;
import com.claimvoyant.model.dto.ClaimRecordView;
import com.claimvoyant.model.dto.ClaimStatusResponse;
import com.claimvoyant.model.dto.ClaimSummary;
import com.claimvoyant.model.record.ClaimRecord;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.service.ClaimQueryService;
import com.claimvoyant.service.ClaimRecordService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimQueryServiceImpl implements ClaimQueryService {

    private final ClaimRecordService claimRecordService;
    private final AuditLoggingService auditService;
    private final ObjectMapper objectMapper;

    @Override
    public ClaimStatusResponse getClaimStatus(String claimId) {
        Optional<ClaimRecord> latest = claimRecordService.findLatest(claimId);
        if (latest.isPresent()) {
            return decided(latest.get());
        }

        Optional<AuditEntry> lastEntry = auditService.getLatestEntry(claimId);
        if (lastEntry.isPresent() && lastEntry.get().getStatus() == AuditStatus.ERROR) {
            AuditEntry failure = lastEntry.get();
            JsonNode details = parse(failure.getDetails());
            return ClaimStatusResponse.builder()
                    .claimId(claimId)
                    .processingStatus(ClaimProcessingStatus.FAILED)
                    .status("failed")
                    .timestamp(failure.getTimestamp())
                    .failedStage(failure.getAgent())
                    .error(details != null ? details.path("error").asText(null) : null)
                    .message("Claim processing failed at stage " + failure.getAgent())
                    .build();
        }

        return ClaimStatusResponse.builder()
                .claimId(claimId)
                .processingStatus(ClaimProcessingStatus.PROCESSING)
                .status("processing")
                .message("Claim is being processed")
                .build();
    }

    @Override
    public AuditLogResponse getAuditTrail(String claimId) {
        return AuditLogResponse.builder()
                .claimId(claimId)
                .auditLogs(auditService.getClaimAuditTrail(claimId).stream()
                        .map(entry -> AuditEntryView.builder()
                                .logId(entry.getLogId())
                                .agent(entry.getAgent())
                                .action(entry.getAction())
                                .status(entry.getStatus())
                                .details(parse(entry.getDetails()))
                                .timestamp(entry.getTimestamp())
                                .build())
                        .toList())
                .build();
    }

    @Override
    public ClaimHistoryResponse getHistory(String claimId) {
        return ClaimHistoryResponse.builder()
                .claimId(claimId)
                .versions(claimRecordService.getHistory(claimId).stream()
                        .map(this::toView)
                        .toList())
                .build();
    }

    @Override
    public ClaimListResponse listRecentClaims(int limit) {
        return new ClaimListResponse(claimRecordService.listRecent(limit).stream()
                .map(record -> {
                    JsonNode decision = parse(record.getDecisionData());
                    return ClaimSummary.builder()
                            .claimId(record.getClaimId())
                            .version(record.getVersion())
                            .status(record.getStatus())
                            .timestamp(record.getTimestamp())
                            .decision(textOrNull(decision, "decision"))
                            .confidence(numberOrNull(decision, "confidence"))
                            .build();
                })
                .toList());
    }

    private ClaimStatusResponse decided(ClaimRecord record) {
        JsonNode decision = parse(record.getDecisionData());
        return ClaimStatusResponse.builder()
                .claimId(record.getClaimId())
                .processingStatus(ClaimProcessingStatus.DECIDED)
                .status(record.getStatus())
                .version(record.getVersion())
                .timestamp(record.getTimestamp())
                .decision(textOrNull(decision, "decision"))
                .reasoning(textOrNull(decision, "reasoning"))
                .confidence(numberOrNull(decision, "confidence"))
                .estimatedPayout(numberOrNull(decision, "estimated_payout"))
                .entities(parse(record.getEntities()))
                .build();
    }

    private ClaimRecordView toView(ClaimRecord record) {
        return ClaimRecordView.builder()
                .claimId(record.getClaimId())
                .version(record.getVersion())
                .status(record.getStatus())
                .timestamp(record.getTimestamp())
                .decisionData(parse(record.getDecisionData()))
                .policyData(parse(record.getPolicyData()))
                .extractedData(parse(record.getExtractedData()))
                .entities(parse(record.getEntities()))
                .damageAssessment(parse(record.getDamageAssessment()))
                .valuation(parse(record.getValuation()))
                .build();
    }

    private JsonNode parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored JSON could not be parsed, returning it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(json);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.path(field).isTextual()) {
            return null;
        }
        return node.path(field).asText();
    }

    private static Double numberOrNull(JsonNode node, String field) {
        if (node == null || !node.path(field).isNumber()) {
            return null;
        }
        return node.path(field).asDouble();
    }
}
