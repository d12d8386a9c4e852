package com.nexusbounty.repository;

import com.nexusbounty.model.Dispute;
import com.nexusbounty.model.DisputeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, UUID> {

    List<Dispute> findByBountyIdOrderByCreatedAtAsc(UUID bountyId);

    boolean existsBySubmissionIdAndStatusIn(UUID submissionId, Collection<DisputeStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Dispute d where d.disputeId = :disputeId")
    Optional<Dispute> findByDisputeIdForUpdate(@Param("disputeId") UUID disputeId);
}
