package com.claimvoyant.service;

import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.record.ClaimRecord;

import java.util.List;
import java.util.Optional;

/**
 * Versioned, append-only claim record store.
 */
public interface ClaimRecordService {

    /**
     * Appends a snapshot of the context as the claim's next version.
     *
     * <p>Versions form a per-claim sequence 1, 2, 3... Concurrent commits for the
     * same claim never share a version; the loser of a collision re-reads the
     * current maximum and retries.
     *
     * @param status stage name or decision value stored with the record
     * @return the committed record, carrying its version
     */
    ClaimRecord commit(ClaimContext context, String status);

    /**
     * Record with the highest version for the claim.
     */
    Optional<ClaimRecord> findLatest(String claimId);

    /**
     * All versions of the claim, oldest first.
     */
    List<ClaimRecord> getHistory(String claimId);

    /**
     * Latest version of up to {@code limit} claims, most recently committed first.
     */
    List<ClaimRecord> listRecent(int limit);
}
