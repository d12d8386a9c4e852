package com.nexusbounty.repository;

import com.nexusbounty.model.ReputationHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReputationHistoryRepository extends JpaRepository<ReputationHistory, UUID> {

    List<ReputationHistory> findBySubmissionIdOrderByCreatedAtAsc(UUID submissionId);

    List<ReputationHistory> findTop50ByEngineIdOrderByCreatedAtDesc(String engineId);
}
