package com.nexusbounty.settlement;

import com.nexusbounty.model.PayoutType;
import com.nexusbounty.model.SettlementKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Ordered payout actions for one resolution of a bounty.
 *
 * @param planHash keccak-256 of the canonical JSON of every other field
 */
public record SettlementPlan(
        UUID bountyId,
        int settlementVersion,
        SettlementKind kind,
        List<PayoutAction> actions,
        String planHash
) {
    public SettlementPlan {
        actions = List.copyOf(actions);
    }

    public BigDecimal total(PayoutType type) {
        return actions.stream()
                .filter(action -> action.type() == type)
                .map(PayoutAction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
