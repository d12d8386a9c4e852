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

/**
 * Marks that a payout plan was generated for one resolution of a bounty.
 */
@Getter
@Setter
@Entity
@Table(name = "bounty_settlements")
public class BountySettlement {

    @Id
    @Column(name = "settlement_id", nullable = false, updatable = false)
    private UUID settlementId;

    @Column(name = "bounty_id", nullable = false, updatable = false)
    private UUID bountyId;

    @Column(name = "settlement_version", nullable = false, updatable = false)
    private Integer settlementVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private SettlementKind kind;

    @Column(name = "plan_hash", nullable = false, length = 66)
    private String planHash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "plan_json", nullable = false, columnDefinition = "jsonb")
    private JsonNode planJson;

    @Column(name = "unrecoverable_amount", nullable = false, precision = 20, scale = 8)
    private BigDecimal unrecoverableAmount = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
