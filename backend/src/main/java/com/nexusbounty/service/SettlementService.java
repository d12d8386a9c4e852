package com.nexusbounty.service;

import com.nexusbounty.model.Bounty;
import com.nexusbounty.model.BountySettlement;
import com.nexusbounty.model.Dispute;
import com.nexusbounty.model.Payout;
import com.nexusbounty.model.PayoutStatus;
import com.nexusbounty.model.PayoutType;
import com.nexusbounty.model.SettlementKind;
import com.nexusbounty.model.Submission;
import com.nexusbounty.repository.BountySettlementRepository;
import com.nexusbounty.repository.PayoutRepository;
import com.nexusbounty.settlement.CorrectionPlan;
import com.nexusbounty.settlement.PayoutAction;
import com.nexusbounty.settlement.SettlementParticipant;
import com.nexusbounty.settlement.SettlementPlan;
import com.nexusbounty.settlement.SettlementPlanner;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Persists settlement plans as pending payouts.
 * Idempotent: a plan is stored at most once per (bounty, resolution version), and every payout is
 * keyed by a deterministic idempotency key. Runs inside the caller's resolution transaction.
 * <p>
 * Later versions of a bounty's settlement never claw back: pending payouts of earlier versions are
 * cancelled, payouts already in flight count as delivered, and only the shortfall is paid.
 */
@Service
@RequiredArgsConstructor
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final SettlementPlanner settlementPlanner;
    private final BountySettlementRepository bountySettlementRepository;
    private final PayoutRepository payoutRepository;
    private final ReputationService reputationService;

    /**
     * @param weights vote weight per submission from the resolving pass
     */
    @Transactional
    public BountySettlement settleResolution(Bounty bounty, List<Submission> submissions,
                                             Map<UUID, BigDecimal> weights, SettlementKind kind,
                                             OffsetDateTime now) {
        return settle(bounty, submissions, now, () -> settlementPlanner.planResolution(
                bounty.getBountyId(),
                bounty.getResolutionVersion(),
                kind,
                bounty.getCreatorAddress(),
                bounty.getRewardAmount(),
                toParticipants(submissions, weights)
        ));
    }

    @Transactional
    public BountySettlement settleExpiry(Bounty bounty, List<Submission> submissions, OffsetDateTime now) {
        return settle(bounty, submissions, now, () -> settlementPlanner.planExpiry(
                bounty.getBountyId(),
                bounty.getResolutionVersion(),
                bounty.getCreatorAddress(),
                bounty.getRewardAmount(),
                toParticipants(submissions, Map.of())
        ));
    }

    /**
     * Cancels still-pending payouts of earlier resolutions, used when a dispute reopens a bounty.
     *
     * @return number of payouts cancelled
     */
    @Transactional
    public int cancelPendingPayouts(UUID bountyId, OffsetDateTime now) {
        int cancelled = 0;
        for (Payout payout : payoutRepository.findByBountyIdOrderByCreatedAtAsc(bountyId)) {
            if (payout.getSettlementVersion() != null && payout.getStatus() == PayoutStatus.PENDING
                    && payoutRepository.compareAndSetStatus(
                    payout.getPayoutId(), PayoutStatus.PENDING, PayoutStatus.CANCELLED, now) == 1) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Returns or slashes the disputer's stake.
     */
    @Transactional
    public Payout settleDisputeStake(Dispute dispute, boolean accepted, OffsetDateTime now) {
        PayoutAction action = settlementPlanner.disputeStakeAction(
                dispute.getBountyId(),
                dispute.getDisputeId(),
                dispute.getDisputerWallet(),
                dispute.getStakeAmount(),
                accepted
        );
        if (action.amount().signum() <= 0 || payoutRepository.existsByIdempotencyKey(action.idempotencyKey())) {
            return null;
        }
        return payoutRepository.save(toPayout(dispute.getBountyId(), null, action, now));
    }

    @Transactional(readOnly = true)
    public List<Payout> getPayouts(UUID bountyId) {
        return payoutRepository.findByBountyIdOrderByCreatedAtAsc(bountyId);
    }

    @Transactional(readOnly = true)
    public List<BountySettlement> getSettlements(UUID bountyId) {
        return bountySettlementRepository.findByBountyIdOrderBySettlementVersionAsc(bountyId);
    }

    private BountySettlement settle(Bounty bounty, List<Submission> submissions, OffsetDateTime now,
                                    Supplier<SettlementPlan> targetPlan) {
        UUID bountyId = bounty.getBountyId();
        Integer version = bounty.getResolutionVersion();
        BountySettlement existing = bountySettlementRepository.findByBountyIdAndSettlementVersion(bountyId, version)
                .orElse(null);
        if (existing != null) {
            log.info("Bounty {} version {} already settled, returning existing plan {}",
                    bountyId, version, existing.getPlanHash());
            return existing;
        }

        SettlementPlan target = targetPlan.get();
        CorrectionPlan correction = settlementPlanner.correct(target, collectDelivered(bountyId, version, now));
        SettlementPlan plan = correction.plan();

        BountySettlement settlement = new BountySettlement();
        settlement.setSettlementId(UUID.randomUUID());
        settlement.setBountyId(bountyId);
        settlement.setSettlementVersion(version);
        settlement.setKind(plan.kind());
        settlement.setPlanHash(plan.planHash());
        settlement.setPlanJson(settlementPlanner.toJson(plan));
        settlement.setUnrecoverableAmount(correction.unrecoverableAmount());
        settlement.setCreatedAt(now);
        bountySettlementRepository.save(settlement);

        Map<UUID, String> engineBySubmission = submissions.stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Submission::getEngineId, (a, b) -> a));
        int created = 0;
        for (PayoutAction action : plan.actions()) {
            if (payoutRepository.existsByIdempotencyKey(action.idempotencyKey())) {
                continue;
            }
            payoutRepository.save(toPayout(bountyId, version, action, now));
            created++;
            if (action.type() == PayoutType.BOUNTY_REWARD && action.submissionId() != null) {
                String engineId = engineBySubmission.get(action.submissionId());
                if (engineId != null) {
                    reputationService.recordEarnings(engineId, action.amount(), now);
                }
            }
        }

        if (correction.unrecoverableAmount().signum() > 0) {
            log.warn("Bounty {} version {} settlement leaves {} unrecoverable from earlier payouts",
                    bountyId, version, correction.unrecoverableAmount());
        }
        log.info("Settlement planned for bounty {} version {} ({}): payouts={}, hash={}",
                bountyId, version, plan.kind(), created, plan.planHash());
        return settlement;
    }

    /**
     * Payouts of earlier versions that can no longer be stopped, summed per submission (or recipient) and type.
     * Pending ones are cancelled first; a payout claimed by the processor in the meantime counts as delivered.
     */
    private Map<String, BigDecimal> collectDelivered(UUID bountyId, Integer version, OffsetDateTime now) {
        Map<String, BigDecimal> delivered = new LinkedHashMap<>();
        for (Payout payout : payoutRepository.findByBountyIdOrderByCreatedAtAsc(bountyId)) {
            if (payout.getSettlementVersion() == null || payout.getSettlementVersion() >= version) {
                continue;
            }
            PayoutStatus status = payout.getStatus();
            if (status == PayoutStatus.PENDING && payoutRepository.compareAndSetStatus(
                    payout.getPayoutId(), PayoutStatus.PENDING, PayoutStatus.CANCELLED, now) == 1) {
                continue;
            }
            if (status == PayoutStatus.CANCELLED || status == PayoutStatus.FAILED) {
                continue;
            }
            delivered.merge(SettlementPlanner.deliveryKey(
                            payout.getSubmissionId(), payout.getRecipient(), payout.getPayoutType()),
                    payout.getAmount(), BigDecimal::add);
        }
        return delivered;
    }

    private List<SettlementParticipant> toParticipants(List<Submission> submissions, Map<UUID, BigDecimal> weights) {
        return submissions.stream()
                .map(submission -> new SettlementParticipant(
                        submission.getSubmissionId(),
                        submission.getWalletAddress(),
                        submission.getStakeAmount(),
                        submission.getStatus(),
                        weights.get(submission.getSubmissionId()),
                        submission.getSubmittedAt()
                ))
                .toList();
    }

    private Payout toPayout(UUID bountyId, Integer version, PayoutAction action, OffsetDateTime now) {
        Payout payout = new Payout();
        payout.setPayoutId(UUID.randomUUID());
        payout.setBountyId(bountyId);
        payout.setSubmissionId(action.submissionId());
        payout.setDisputeId(action.disputeId());
        payout.setRecipient(action.recipient());
        payout.setAmount(action.amount());
        payout.setPayoutType(action.type());
        payout.setStatus(PayoutStatus.PENDING);
        payout.setSettlementVersion(version);
        payout.setIdempotencyKey(action.idempotencyKey());
        payout.setAttempts(0);
        payout.setCreatedAt(now);
        payout.setUpdatedAt(now);
        return payout;
    }
}
