package com.nexusbounty.events;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * @param participantIds engine ids of every submission in the bounty, in submission order
 * @param disputeId set only for {@link BountyEventType#DISPUTE_RESOLVED}
 */
public record BountyEvent(
        BountyEventType eventType,
        UUID bountyId,
        Verdict finalVerdict,
        BigDecimal confidence,
        List<String> participantIds,
        UUID disputeId,
        OffsetDateTime occurredAt
) {
    public BountyEvent {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }
}
