package com.nexusbounty.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "reputation_history")
public class ReputationHistory {

    @Id
    @Column(name = "history_id", nullable = false, updatable = false)
    private UUID historyId;

    @Column(name = "engine_id", nullable = false, length = 128)
    private String engineId;

    @Column(name = "score_before", nullable = false)
    private Integer scoreBefore;

    @Column(name = "score_after", nullable = false)
    private Integer scoreAfter;

    @Column(name = "score_change", nullable = false)
    private Integer scoreChange;

    @Column(name = "reason", nullable = false, length = 64)
    private String reason;

    @Column(name = "bounty_id")
    private UUID bountyId;

    @Column(name = "submission_id")
    private UUID submissionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
