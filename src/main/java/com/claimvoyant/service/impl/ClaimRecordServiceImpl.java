package com.claimvoyant.service.impl;

import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.record.ClaimRecord;
import com.claimvoyant.repository.ClaimRecordRepository;
import com.claimvoyant.service.ClaimRecordService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

/**
 * Claim record store with per-claim sequential versions.
 *
 * <p>A commit reads {@code max(version)} and inserts {@code max + 1} in its own
 * transaction. The unique (claim_id, version) constraint rejects a concurrent
 * insert of the same version; the loser backs off briefly and tries again with
 * a fresh maximum, up to {@code app.pipeline.version-max-attempts} times.
 */
@Slf4j
@Service
public class ClaimRecordServiceImpl implements ClaimRecordService {

    private static final Comparator<ClaimRecord> NEWEST_FIRST =
            Comparator.comparing(ClaimRecord::getTimestamp)
                    .thenComparing(ClaimRecord::getId)
                    .reversed();

    private final ClaimRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    private final AppProperties props;
    private final Clock clock;
    private final TransactionTemplate appendTx;

    public ClaimRecordServiceImpl(ClaimRecordRepository recordRepository,
                                  ObjectMapper objectMapper,
                                  AppProperties props,
                                  Clock clock,
                                  PlatformTransactionManager transactionManager) {
        this.recordRepository = recordRepository;
        this.objectMapper = objectMapper;
        this.props = props;
        this.clock = clock;
        this.appendTx = new TransactionTemplate(transactionManager);
        this.appendTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public ClaimRecord commit(ClaimContext context, String status) {
        String claimId = context.getClaimId();
        int maxAttempts = props.getPipeline().getVersionMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ClaimRecord saved = appendTx.execute(tx -> {
                    long next = recordRepository.findMaxVersion(claimId).orElse(0L) + 1;
                    return recordRepository.saveAndFlush(snapshot(context, status, next));
                });
                log.info("💾 Committed {} v{} ({})", claimId, saved.getVersion(), status);
                return saved;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.warn("Version collision for {} (attempt {}/{}): {}",
                        claimId, attempt, maxAttempts, e.getMostSpecificCause().getMessage());
                backOff(attempt);
            }
        }

        throw new CapabilityException(ServiceType.DATABASE, "commitRecord",
                "could not obtain a version for " + claimId + " after " + maxAttempts + " attempts");
    }

    @Override
    public Optional<ClaimRecord> findLatest(String claimId) {
        try {
            return recordRepository.findFirstByClaimIdOrderByVersionDesc(claimId);
        } catch (DataAccessException e) {
            log.warn("Indexed latest-record query failed for {}, scanning: {}", claimId, e.getMessage());
            return recordRepository.findAll().stream()
                    .filter(r -> claimId.equals(r.getClaimId()))
                    .max(Comparator.comparingLong(ClaimRecord::getVersion));
        }
    }

    @Override
    public List<ClaimRecord> getHistory(String claimId) {
        try {
            return recordRepository.findByClaimIdOrderByVersionAsc(claimId);
        } catch (DataAccessException e) {
            log.warn("Indexed history query failed for {}, scanning: {}", claimId, e.getMessage());
            return recordRepository.findAll().stream()
                    .filter(r -> claimId.equals(r.getClaimId()))
                    .sorted(Comparator.comparingLong(ClaimRecord::getVersion))
                    .toList();
        }
    }

    @Override
    public List<ClaimRecord> listRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return recordRepository.findLatestPerClaim(PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            log.warn("Grouped recent-claims query failed, scanning: {}", e.getMessage());
            return latestPerClaim(recordRepository.findAll()).stream()
                    .sorted(NEWEST_FIRST)
                    .limit(limit)
                    .toList();
        }
    }

    static Collection<ClaimRecord> latestPerClaim(List<ClaimRecord> records) {
        BinaryOperator<ClaimRecord> higherVersion = (a, b) -> a.getVersion() >= b.getVersion() ? a : b;
        Map<String, ClaimRecord> latest = records.stream()
                .collect(Collectors.toMap(ClaimRecord::getClaimId, r -> r, higherVersion));
        return latest.values();
    }

    private ClaimRecord snapshot(ClaimContext context, String status, long version) {
        return ClaimRecord.builder()
                .claimId(context.getClaimId())
                .version(version)
                .status(status)
                .decisionData(toJson(context.getDecisionData()))
                .policyData(toJson(context.getPolicyData()))
                .extractedData(toJson(context.getExtractedData()))
                .entities(toJson(context.getEntities()))
                .damageAssessment(toJson(context.getDamageAssessment()))
                .valuation(toJson(context.getValuation()))
                .timestamp(clock.instant())
                .build();
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CapabilityException(ServiceType.DATABASE, "commitRecord",
                    "cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static void backOff(int attempt) {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(5, 20L * attempt + 5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException(ServiceType.DATABASE, "commitRecord", "interrupted during retry", e);
        }
    }
}
