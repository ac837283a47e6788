package com.claimvoyant.service.impl;

import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditEntry;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.repository.AuditEntryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Audit Logging Service Tests")
class AuditLoggingServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-10-22T10:30:05Z");

    @Mock
    private AuditEntryRepository repository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AuditLoggingServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new AuditLoggingServiceImpl(repository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Entry carries stage name, action, status and JSON details")
    void recordStage_ShouldBuildEntry() throws Exception {
        // Given
        when(repository.save(any(AuditEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("policy_number", "AUTO-042");
        details.put("found", false);

        // When
        AuditEntry entry = service.recordStage("CLAIM-1", PipelineStage.POLICY, AuditStatus.NOT_FOUND, details);

        // Then
        assertThat(entry.getLogId()).isEqualTo("CLAIM-1-policy");
        assertThat(entry.getAgent()).isEqualTo("policy");
        assertThat(entry.getAction()).isEqualTo("query_policy");
        assertThat(entry.getStatus()).isEqualTo(AuditStatus.NOT_FOUND);
        assertThat(entry.getTimestamp()).isEqualTo(NOW);
        JsonNode json = objectMapper.readTree(entry.getDetails());
        assertThat(json.path("policy_number").asText()).isEqualTo("AUTO-042");
        assertThat(json.path("found").asBoolean(true)).isFalse();
    }

    @Test
    @DisplayName("Missing details are stored as an empty object")
    void recordStage_NullDetails_ShouldStoreEmptyObject() {
        when(repository.save(any(AuditEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuditEntry entry = service.recordStage("CLAIM-1", PipelineStage.INTAKE, AuditStatus.SUCCESS, null);

        assertThat(entry.getDetails()).isEqualTo("{}");
    }

    @Test
    @DisplayName("Failed trail query falls back to a chronological scan")
    void getClaimAuditTrail_QueryFails_ShouldScan() {
        // Given
        when(repository.findByClaimIdOrderByTimestampAscIdAsc("CLAIM-1"))
                .thenThrow(new DataAccessResourceFailureException("index unavailable"));
        when(repository.findAll()).thenReturn(List.of(
                entry(3L, "CLAIM-1", PipelineStage.DAMAGE, NOW.plusSeconds(2)),
                entry(1L, "CLAIM-1", PipelineStage.INTAKE, NOW),
                entry(9L, "CLAIM-2", PipelineStage.INTAKE, NOW),
                entry(2L, "CLAIM-1", PipelineStage.POLICY, NOW.plusSeconds(1))));

        // When
        List<AuditEntry> trail = service.getClaimAuditTrail("CLAIM-1");

        // Then
        assertThat(trail).extracting(AuditEntry::getAgent).containsExactly("intake", "policy", "damage");
    }

    @Test
    @DisplayName("Ties on timestamp are broken by insertion order")
    void getLatestEntry_QueryFails_ShouldBreakTiesById() {
        when(repository.findFirstByClaimIdOrderByTimestampDescIdDesc("CLAIM-1"))
                .thenThrow(new DataAccessResourceFailureException("index unavailable"));
        when(repository.findAll()).thenReturn(List.of(
                entry(1L, "CLAIM-1", PipelineStage.INTAKE, NOW),
                entry(2L, "CLAIM-1", PipelineStage.POLICY, NOW)));

        assertThat(service.getLatestEntry("CLAIM-1")).get()
                .extracting(AuditEntry::getAgent)
                .isEqualTo("policy");
    }

    private static AuditEntry entry(Long id, String claimId, PipelineStage stage, Instant timestamp) {
        return AuditEntry.builder()
                .id(id)
                .logId(claimId + "-" + stage.getAgentName())
                .claimId(claimId)
                .agent(stage.getAgentName())
                .action(stage.getAction())
                .status(AuditStatus.SUCCESS)
                .details("{}")
                .timestamp(timestamp)
                .build();
    }
}
