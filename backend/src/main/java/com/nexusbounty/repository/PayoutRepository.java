package com.nexusbounty.repository;

import com.nexusbounty.model.Payout;
import com.nexusbounty.model.PayoutStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<Payout, UUID> {

    List<Payout> findByBountyIdOrderByCreatedAtAsc(UUID bountyId);

    boolean existsByIdempotencyKey(String idempotencyKey);

    long countByStatus(PayoutStatus status);

    @Query("""
            select p from Payout p
             where p.status = com.nexusbounty.model.PayoutStatus.PENDING
               and (p.nextAttemptAt is null or p.nextAttemptAt <= :now)
             order by p.createdAt asc
            """)
    List<Payout> findDuePending(@Param("now") OffsetDateTime now, Pageable pageable);

    @Query("""
            select p from Payout p
             where p.status = com.nexusbounty.model.PayoutStatus.PROCESSING
               and p.updatedAt < :cutoff
             order by p.updatedAt asc
            """)
    List<Payout> findStaleProcessing(@Param("cutoff") OffsetDateTime cutoff, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Payout p
               set p.status = :target, p.updatedAt = :now
             where p.payoutId = :payoutId
               and p.status = :expected
            """)
    int compareAndSetStatus(
            @Param("payoutId") UUID payoutId,
            @Param("expected") PayoutStatus expected,
            @Param("target") PayoutStatus target,
            @Param("now") OffsetDateTime now
    );
}
