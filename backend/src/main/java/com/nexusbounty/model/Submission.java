package com.nexusbounty.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "submissions")
public class Submission {

    @Id
    @Column(name = "submission_id", nullable = false, updatable = false)
    private UUID submissionId;

    @Column(name = "bounty_id", nullable = false, updatable = false)
    private UUID bountyId;

    @Column(name = "engine_id", nullable = false, length = 128)
    private String engineId;

    @Column(name = "wallet_address", nullable = false, length = 64)
    private String walletAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict", nullable = false, length = 32)
    private Verdict verdict;

    @Column(name = "confidence", nullable = false, precision = 5, scale = 4)
    private BigDecimal confidence;

    @Column(name = "stake_amount", nullable = false, precision = 20, scale = 8)
    private BigDecimal stakeAmount;

    /**
     * Reputation captured at ingestion. Null when ingestion did not record one.
     */
    @Column(name = "reputation_snapshot")
    private Integer reputationSnapshot;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SubmissionStatus status = SubmissionStatus.PENDING;

    @Column(name = "accuracy_score", precision = 5, scale = 4)
    private BigDecimal accuracyScore;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private OffsetDateTime submittedAt = OffsetDateTime.now();

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
