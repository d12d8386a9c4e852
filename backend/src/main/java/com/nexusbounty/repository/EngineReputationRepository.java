package com.nexusbounty.repository;

import com.nexusbounty.model.EngineReputation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface EngineReputationRepository extends JpaRepository<EngineReputation, String> {

    List<EngineReputation> findAllByOrderByCurrentScoreDescEngineIdAsc();

    List<EngineReputation> findByLastActivityAtBefore(OffsetDateTime cutoff);
}
