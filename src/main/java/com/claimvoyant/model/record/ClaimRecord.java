package com.claimvoyant.model.record;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Versioned snapshot of a claim, one row per stage commit.
 *
 * <p>Rows are keyed by (claim_id, version) and never updated or deleted. The
 * current state of a claim is the row with the highest version. Versions are a
 * per-claim sequence starting at 1, issued by ClaimRecordService.
 *
 * Table: CLAIM_RECORDS
 */
@Entity
@Immutable
@Table(name = "CLAIM_RECORDS",
        uniqueConstraints = @UniqueConstraint(name = "uk_claim_records_version", columnNames = {"claim_id", "version"}),
        indexes = {
                @Index(name = "idx_claim_records_claim", columnList = "claim_id"),
                @Index(name = "idx_claim_records_time", columnList = "committed_at")
        })
@Getter
@Builder
@ToString(exclude = {"extractedData", "policyData"})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ClaimRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "claim_id", nullable = false, length = 100)
    private String claimId;

    @Column(name = "version", nullable = false)
    private long version;

    /**
     * Stage name or terminal decision value (APPROVED, DENIED, PENDING, ERROR).
     */
    @Column(name = "status", nullable = false, length = 30)
    private String status;

    @Lob
    @Column(name = "decision_data")
    private String decisionData;

    @Lob
    @Column(name = "policy_data")
    private String policyData;

    @Lob
    @Column(name = "extracted_data")
    private String extractedData;

    @Lob
    @Column(name = "entities")
    private String entities;

    @Lob
    @Column(name = "damage_assessment")
    private String damageAssessment;

    @Lob
    @Column(name = "valuation")
    private String valuation;

    @Column(name = "committed_at", nullable = false)
    private Instant timestamp;
}
