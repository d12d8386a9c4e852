package com.nexusbounty.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.nexusbounty.model.Bounty;
import com.nexusbounty.model.BountyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface BountyRepository extends JpaRepository<Bounty, UUID> {

    List<Bounty> findByStatusOrderByCreatedAtAsc(BountyStatus status);

    long countByStatusAndDeadlineBefore(BountyStatus status, OffsetDateTime cutoff);

    /**
     * Status compare-and-swap. Returns 1 for the writer that won, 0 for everyone else.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Bounty b
               set b.status = :target, b.updatedAt = :now
             where b.bountyId = :bountyId
               and b.status = :expected
            """)
    int compareAndSetStatus(
            @Param("bountyId") UUID bountyId,
            @Param("expected") BountyStatus expected,
            @Param("target") BountyStatus target,
            @Param("now") OffsetDateTime now
    );

    /**
     * Caches the latest evaluation only while the bounty is still in the expected status.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Bounty b
               set b.consensusResultJson = :resultJson, b.updatedAt = :now
             where b.bountyId = :bountyId
               and b.status = :expected
            """)
    int cacheConsensusResult(
            @Param("bountyId") UUID bountyId,
            @Param("expected") BountyStatus expected,
            @Param("resultJson") JsonNode resultJson,
            @Param("now") OffsetDateTime now
    );
}
