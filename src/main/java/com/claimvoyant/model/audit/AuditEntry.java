package com.claimvoyant.model.audit;

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
 * Immutable fact about one stage attempt for one claim.
 * OBSERVABILITY: ordered by (timestamp, id) the entries of a claim replay the
 * exact sequence of stage attempts, failed ones included.
 */
@Entity
@Immutable
@Table(name = "AUDIT_LOG", indexes = {
        @Index(name = "idx_audit_claim_time", columnList = "claim_id, event_timestamp")
})
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * {@code <claim_id>-<stage>}; repeated when a stage is retried.
     */
    @Column(name = "log_id", nullable = false, length = 150)
    private String logId;

    @Column(name = "claim_id", nullable = false, length = 100)
    private String claimId;

    @Column(name = "agent", nullable = false, length = 30)
    private String agent;  // intake, policy, damage, valuation, decision

    @Column(name = "action", nullable = false, length = 50)
    private String action;

    @Column(name = "status", nullable = false, length = 20)
    private AuditStatus status;

    @Lob
    @Column(name = "details")
    private String details;  // JSON, stage specific

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;
}
