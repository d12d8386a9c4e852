package com.nexusbounty.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "engine_reputations")
public class EngineReputation {

    @Id
    @Column(name = "engine_id", nullable = false, updatable = false, length = 128)
    private String engineId;

    @Column(name = "current_score", nullable = false)
    private Integer currentScore;

    @Column(name = "highest_score", nullable = false)
    private Integer highestScore;

    @Column(name = "lowest_score", nullable = false)
    private Integer lowestScore;

    @Column(name = "total_submissions", nullable = false)
    private Integer totalSubmissions = 0;

    @Column(name = "correct_submissions", nullable = false)
    private Integer correctSubmissions = 0;

    @Column(name = "incorrect_submissions", nullable = false)
    private Integer incorrectSubmissions = 0;

    @Column(name = "accuracy_rate", nullable = false, precision = 5, scale = 4)
    private BigDecimal accuracyRate = BigDecimal.ZERO;

    @Column(name = "current_streak", nullable = false)
    private Integer currentStreak = 0;

    @Column(name = "best_streak", nullable = false)
    private Integer bestStreak = 0;

    @Column(name = "total_earned", nullable = false, precision = 20, scale = 8)
    private BigDecimal totalEarned = BigDecimal.ZERO;

    @Column(name = "rank")
    private Integer rank;

    @Column(name = "percentile", precision = 5, scale = 2)
    private BigDecimal percentile;

    @Column(name = "last_activity_at")
    private OffsetDateTime lastActivityAt;

    @Column(name = "last_decay_at")
    private OffsetDateTime lastDecayAt;

    /**
     * Score held when the current stretch of inactivity started decaying; null while active.
     */
    @Column(name = "decay_base_score")
    private Integer decayBaseScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
