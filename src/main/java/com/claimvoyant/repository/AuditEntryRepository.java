package com.claimvoyant.repository;

import com.claimvoyant.model.audit.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only access to the audit trail.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, Long> {

    /**
     * Audit trail of a claim in chronological order.
     */
    List<AuditEntry> findByClaimIdOrderByTimestampAscIdAsc(String claimId);

    /**
     * Most recent entry written for a claim.
     */
    Optional<AuditEntry> findFirstByClaimIdOrderByTimestampDescIdDesc(String claimId);
}
