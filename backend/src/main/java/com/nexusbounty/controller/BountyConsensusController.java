package com.nexusbounty.controller;

import com.nexusbounty.consensus.ConsensusResult;
import com.nexusbounty.controller.dto.ConsensusResponses;
import com.nexusbounty.controller.dto.DisputeResponses;
import com.nexusbounty.controller.dto.PayoutResponses;
import com.nexusbounty.service.BountyResolutionService;
import com.nexusbounty.service.DisputeService;
import com.nexusbounty.service.SettlementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/bounties/{bountyId}")
public class BountyConsensusController {

    private final BountyResolutionService bountyResolutionService;
    private final SettlementService settlementService;
    private final DisputeService disputeService;

    public BountyConsensusController(
            BountyResolutionService bountyResolutionService,
            SettlementService settlementService,
            DisputeService disputeService
    ) {
        this.bountyResolutionService = bountyResolutionService;
        this.settlementService = settlementService;
        this.disputeService = disputeService;
    }

    @GetMapping("/consensus")
    public ResponseEntity<ConsensusResult> getConsensus(@PathVariable UUID bountyId) {
        return ResponseEntity.ok(bountyResolutionService.getConsensus(bountyId));
    }

    /**
     * Runs the same evaluation the consensus worker runs on its next tick.
     */
    @PostMapping("/consensus/evaluate")
    public ResponseEntity<ConsensusResponses.EvaluationResponse> evaluate(@PathVariable UUID bountyId) {
        BountyResolutionService.BountyEvaluation evaluation =
                bountyResolutionService.evaluateBounty(bountyId, OffsetDateTime.now());
        return ResponseEntity.ok(new ConsensusResponses.EvaluationResponse(
                bountyId, evaluation.outcome(), evaluation.result()));
    }

    @GetMapping("/payouts")
    public ResponseEntity<List<PayoutResponses.PayoutSummary>> listPayouts(@PathVariable UUID bountyId) {
        return ResponseEntity.ok(settlementService.getPayouts(bountyId).stream()
                .map(PayoutResponses.PayoutSummary::from)
                .toList());
    }

    @GetMapping("/disputes")
    public ResponseEntity<List<DisputeResponses.DisputeDetail>> listDisputes(@PathVariable UUID bountyId) {
        return ResponseEntity.ok(disputeService.listDisputes(bountyId));
    }
}
