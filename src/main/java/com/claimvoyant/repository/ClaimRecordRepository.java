package com.claimvoyant.repository;

import com.claimvoyant.model.record.ClaimRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only access to claim record versions.
 *
 * Used by ClaimRecordService to:
 * - Issue the next version for a claim (max + 1)
 * - Load the current (max version) record of a claim
 * - List recent claims, one row per claim id
 */
@Repository
public interface ClaimRecordRepository extends JpaRepository<ClaimRecord, Long> {

    /**
     * Highest committed version for a claim, empty when nothing was committed yet.
     */
    @Query("SELECT MAX(r.version) FROM ClaimRecord r WHERE r.claimId = :claimId")
    Optional<Long> findMaxVersion(@Param("claimId") String claimId);

    /**
     * Current state of a claim.
     */
    Optional<ClaimRecord> findFirstByClaimIdOrderByVersionDesc(String claimId);

    /**
     * Every committed version of a claim, oldest first.
     */
    List<ClaimRecord> findByClaimIdOrderByVersionAsc(String claimId);

    /**
     * Latest version of each claim, newest commit first.
     *
     * @param pageable limit on the number of claims returned
     */
    @Query("SELECT r FROM ClaimRecord r " +
           "WHERE r.version = (SELECT MAX(r2.version) FROM ClaimRecord r2 WHERE r2.claimId = r.claimId) " +
           "ORDER BY r.timestamp DESC, r.id DESC")
    List<ClaimRecord> findLatestPerClaim(Pageable pageable);
}
