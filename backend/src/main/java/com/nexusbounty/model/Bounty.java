package com.nexusbounty.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "bounties")
public class Bounty {

    @Id
    @Column(name = "bounty_id", nullable = false, updatable = false)
    private UUID bountyId;

    @Column(name = "creator_address", nullable = false, length = 64)
    private String creatorAddress;

    @Column(name = "artifact_reference", nullable = false, length = 512)
    private String artifactReference;

    @Column(name = "reward_amount", nullable = false, precision = 20, scale = 8)
    private BigDecimal rewardAmount = BigDecimal.ZERO;

    @Column(name = "min_stake", nullable = false, precision = 20, scale = 8)
    private BigDecimal minStake = BigDecimal.ZERO;

    @Column(name = "min_submissions", nullable = false)
    private Integer minSubmissions;

    @Column(name = "consensus_threshold", nullable = false, precision = 5, scale = 4)
    private BigDecimal consensusThreshold;

    /**
     * Null means the service-wide weighted voting default applies.
     */
    @Column(name = "weighted_voting")
    private Boolean weightedVoting;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private BountyStatus status = BountyStatus.OPEN;

    @Column(name = "deadline", nullable = false)
    private OffsetDateTime deadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "final_verdict", length = 32)
    private Verdict finalVerdict;

    @Column(name = "consensus_confidence", precision = 5, scale = 4)
    private BigDecimal consensusConfidence;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "consensus_result_json", columnDefinition = "jsonb")
    private JsonNode consensusResultJson;

    @Column(name = "resolution_version", nullable = false)
    private Integer resolutionVersion = 0;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
