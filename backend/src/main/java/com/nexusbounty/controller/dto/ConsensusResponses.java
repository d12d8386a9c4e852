package com.nexusbounty.controller.dto;

import com.nexusbounty.consensus.ConsensusResult;
import com.nexusbounty.service.BountyResolutionService;

import java.util.UUID;

public final class ConsensusResponses {

    private ConsensusResponses() {
    }

    public record EvaluationResponse(
            UUID bountyId,
            BountyResolutionService.ResolutionOutcome outcome,
            ConsensusResult result
    ) {
    }
}
