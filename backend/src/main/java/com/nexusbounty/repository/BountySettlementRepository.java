package com.nexusbounty.repository;

import com.nexusbounty.model.BountySettlement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BountySettlementRepository extends JpaRepository<BountySettlement, UUID> {

    Optional<BountySettlement> findByBountyIdAndSettlementVersion(UUID bountyId, Integer settlementVersion);

    List<BountySettlement> findByBountyIdOrderBySettlementVersionAsc(UUID bountyId);
}
