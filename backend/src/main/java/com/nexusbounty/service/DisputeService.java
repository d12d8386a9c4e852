package com.nexusbounty.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nexusbounty.config.SettlementProperties;
import com.nexusbounty.consensus.ConsensusEvaluation;
import com.nexusbounty.consensus.ConsensusResult;
import com.nexusbounty.consensus.ConsensusResultJsonCodec;
import com.nexusbounty.controller.dto.DisputeRequests;
import com.nexusbounty.controller.dto.DisputeResponses;
import com.nexusbounty.events.BountyEventPublisher;
import com.nexusbounty.events.BountyEventType;
import com.nexusbounty.model.Bounty;
import com.nexusbounty.model.BountyStatus;
import com.nexusbounty.model.Dispute;
import com.nexusbounty.model.DisputeResolution;
import com.nexusbounty.model.DisputeStatus;
import com.nexusbounty.model.SettlementKind;
import com.nexusbounty.model.Submission;
import com.nexusbounty.model.SubmissionStatus;
import com.nexusbounty.repository.BountyRepository;
import com.nexusbounty.repository.DisputeRepository;
import com.nexusbounty.repository.SubmissionRepository;
import com.nexusbounty.web.DisputeConflictException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Dispute lifecycle: OPEN, UNDER_REVIEW, then RESOLVED (accepted) or REJECTED.
 * <p>
 * An accepted dispute excludes the disputed submission and re-runs consensus over the rest. If the
 * remaining submissions still reach consensus the bounty is re-resolved under a new version with a
 * correcting settlement; otherwise it goes back to OPEN for the worker to pick up again.
 * A rejected dispute costs the disputer their stake and leaves the bounty untouched.
 */
@Service
@RequiredArgsConstructor
public class DisputeService {

    private static final Logger log = LoggerFactory.getLogger(DisputeService.class);
    private static final Set<DisputeStatus> ACTIVE_STATUSES = EnumSet.of(DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW);

    private final DisputeRepository disputeRepository;
    private final BountyRepository bountyRepository;
    private final SubmissionRepository submissionRepository;
    private final BountyResolutionService bountyResolutionService;
    private final ReputationService reputationService;
    private final SettlementService settlementService;
    private final BountyEventPublisher bountyEventPublisher;
    private final SettlementProperties settlementProperties;

    @Transactional
    public DisputeResponses.DisputeDetail openDispute(DisputeRequests.OpenDisputeRequest request, OffsetDateTime now) {
        Bounty bounty = bountyRepository.findById(request.bountyId())
                .orElseThrow(() -> BountyResolutionService.bountyNotFound(request.bountyId()));
        if (bounty.getStatus() != BountyStatus.COMPLETED) {
            throw DisputeConflictException.bountyNotCompleted(
                    "Bounty " + bounty.getBountyId() + " is " + bounty.getStatus() + ", disputes need a completed bounty");
        }

        Submission submission = submissionRepository.findById(request.submissionId())
                .filter(candidate -> bounty.getBountyId().equals(candidate.getBountyId()))
                .orElseThrow(() -> DisputeConflictException.invalidSubmission(
                        "Submission " + request.submissionId() + " does not belong to bounty " + bounty.getBountyId()));

        BigDecimal minimumStake = settlementProperties.getMinDisputeStake();
        if (request.stakeAmount().compareTo(minimumStake) < 0) {
            throw DisputeConflictException.insufficientStake(
                    "Dispute stake must be at least " + minimumStake.toPlainString());
        }
        if (disputeRepository.existsBySubmissionIdAndStatusIn(submission.getSubmissionId(), ACTIVE_STATUSES)) {
            throw DisputeConflictException.alreadyDisputed(
                    "Submission " + submission.getSubmissionId() + " already has an active dispute");
        }
        if (!request.adminOverride() && !isDisputeEligible(bounty)) {
            throw DisputeConflictException.notEligible(
                    "Bounty " + bounty.getBountyId() + " reached clear agreement and is not open to dispute");
        }

        Dispute dispute = new Dispute();
        dispute.setDisputeId(UUID.randomUUID());
        dispute.setBountyId(bounty.getBountyId());
        dispute.setSubmissionId(submission.getSubmissionId());
        dispute.setDisputerId(request.disputerId().trim());
        dispute.setDisputerWallet(request.disputerWallet().trim());
        dispute.setReason(request.reason().trim());
        dispute.setEvidenceJson(request.evidence());
        dispute.setStakeAmount(request.stakeAmount());
        dispute.setAdminOverride(request.adminOverride());
        dispute.setStatus(DisputeStatus.OPEN);
        dispute.setCreatedAt(now);
        dispute.setUpdatedAt(now);
        Dispute saved = disputeRepository.save(dispute);

        log.info("Dispute {} opened against submission {} of bounty {} (adminOverride={})",
                saved.getDisputeId(), submission.getSubmissionId(), bounty.getBountyId(), request.adminOverride());
        return DisputeResponses.DisputeDetail.from(saved);
    }

    @Transactional
    public DisputeResponses.DisputeDetail startReview(UUID disputeId, String reviewerId, OffsetDateTime now) {
        Dispute dispute = lockDispute(disputeId);
        if (dispute.getStatus() != DisputeStatus.OPEN) {
            throw DisputeConflictException.invalidTransition(
                    "Dispute " + disputeId + " is " + dispute.getStatus() + " and cannot move to review");
        }
        dispute.setStatus(DisputeStatus.UNDER_REVIEW);
        dispute.setResolverId(reviewerId);
        dispute.setUpdatedAt(now);
        log.info("Dispute {} under review by {}", disputeId, reviewerId);
        return DisputeResponses.DisputeDetail.from(disputeRepository.save(dispute));
    }

    @Transactional
    public DisputeResponses.DisputeDecision resolveDispute(UUID disputeId, DisputeResolution resolution,
                                                           String resolverId, OffsetDateTime now) {
        Dispute dispute = lockDispute(disputeId);
        if (!dispute.getStatus().isActive()) {
            throw DisputeConflictException.invalidTransition(
                    "Dispute " + disputeId + " is already " + dispute.getStatus());
        }

        BountyStatus bountyStatus = resolution == DisputeResolution.ACCEPTED
                ? applyAcceptedDispute(dispute, now)
                : currentBountyStatus(dispute.getBountyId());

        Dispute decided = disputeRepository.findById(disputeId)
                .orElseThrow(() -> DisputeConflictException.disputeNotFound("Dispute not found: " + disputeId));
        decided.setStatus(resolution == DisputeResolution.ACCEPTED ? DisputeStatus.RESOLVED : DisputeStatus.REJECTED);
        decided.setResolution(resolution.name());
        decided.setResolverId(resolverId);
        decided.setResolvedAt(now);
        decided.setUpdatedAt(now);
        Dispute saved = disputeRepository.save(decided);

        settlementService.settleDisputeStake(saved, resolution == DisputeResolution.ACCEPTED, now);

        Bounty bounty = bountyRepository.findById(saved.getBountyId())
                .orElseThrow(() -> BountyResolutionService.bountyNotFound(saved.getBountyId()));
        List<Submission> submissions = submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(
                bounty.getBountyId());
        bountyEventPublisher.publish(bountyResolutionService.event(
                BountyEventType.DISPUTE_RESOLVED, bounty, submissions, saved.getDisputeId(), now));

        log.info("Dispute {} {} by {}; bounty {} is {}",
                disputeId, resolution, resolverId, bounty.getBountyId(), bountyStatus);
        return new DisputeResponses.DisputeDecision(DisputeResponses.DisputeDetail.from(saved), bountyStatus);
    }

    @Transactional(readOnly = true)
    public DisputeResponses.DisputeDetail getDispute(UUID disputeId) {
        return disputeRepository.findById(disputeId)
                .map(DisputeResponses.DisputeDetail::from)
                .orElseThrow(() -> DisputeConflictException.disputeNotFound("Dispute not found: " + disputeId));
    }

    @Transactional(readOnly = true)
    public List<DisputeResponses.DisputeDetail> listDisputes(UUID bountyId) {
        return disputeRepository.findByBountyIdOrderByCreatedAtAsc(bountyId).stream()
                .map(DisputeResponses.DisputeDetail::from)
                .toList();
    }

    private BountyStatus applyAcceptedDispute(Dispute dispute, OffsetDateTime now) {
        UUID bountyId = dispute.getBountyId();
        if (bountyRepository.compareAndSetStatus(bountyId, BountyStatus.COMPLETED, BountyStatus.UNDER_REVIEW, now) == 0) {
            throw DisputeConflictException.bountyNotCompleted(
                    "Bounty " + bountyId + " is no longer completed and cannot be re-resolved");
        }

        Bounty bounty = bountyRepository.findById(bountyId)
                .orElseThrow(() -> BountyResolutionService.bountyNotFound(bountyId));
        List<Submission> submissions = submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bountyId);

        Map<UUID, SubmissionStatus> previousStatuses = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            previousStatuses.put(submission.getSubmissionId(), submission.getStatus());
            if (submission.getSubmissionId().equals(dispute.getSubmissionId())) {
                submission.setStatus(SubmissionStatus.EXCLUDED);
                submission.setAccuracyScore(null);
                submission.setUpdatedAt(now);
            }
        }
        List<Submission> current = submissionRepository.saveAll(submissions);
        Submission excluded = current.stream()
                .filter(submission -> submission.getSubmissionId().equals(dispute.getSubmissionId()))
                .findFirst()
                .orElseThrow(() -> DisputeConflictException.invalidSubmission(
                        "Submission " + dispute.getSubmissionId() + " not found in bounty " + bountyId));
        revertScored(bounty, excluded, previousStatuses.get(excluded.getSubmissionId()), now);

        List<Submission> eligible = bountyResolutionService.eligibleSubmissions(bounty, current);
        ConsensusEvaluation evaluation = bountyResolutionService.evaluate(bounty, eligible);
        ConsensusResult result = evaluation.result();
        JsonNode resultJson = ConsensusResultJsonCodec.toJson(result);

        BountyStatus target = result.consensusReached() ? BountyStatus.COMPLETED : BountyStatus.OPEN;
        if (bountyRepository.compareAndSetStatus(bountyId, BountyStatus.UNDER_REVIEW, target, now) == 0) {
            throw new IllegalStateException("Bounty " + bountyId + " left UNDER_REVIEW during dispute resolution");
        }
        Bounty reviewed = bountyRepository.findById(bountyId)
                .orElseThrow(() -> BountyResolutionService.bountyNotFound(bountyId));

        if (target == BountyStatus.COMPLETED) {
            bountyResolutionService.applyResult(reviewed, result, resultJson, now);
            bountyRepository.save(reviewed);
            List<Submission> rescored = bountyResolutionService.scoreSubmissions(
                    reviewed, eligible, result.finalVerdict(), now);
            for (Submission submission : rescored) {
                SubmissionStatus previous = previousStatuses.get(submission.getSubmissionId());
                if (previous == submission.getStatus()) {
                    continue;
                }
                if (previous == SubmissionStatus.CORRECT || previous == SubmissionStatus.INCORRECT) {
                    reputationService.reviseOutcome(submission.getEngineId(), bountyId, submission.getSubmissionId(),
                            previous == SubmissionStatus.CORRECT,
                            bountyResolutionService.reputationOutcome(reviewed, submission, true), now);
                } else {
                    reputationService.recordOutcome(submission.getEngineId(), bountyId, submission.getSubmissionId(),
                            bountyResolutionService.reputationOutcome(reviewed, submission, true), now);
                }
            }
            reputationService.refreshRankings();
            settlementService.settleResolution(
                    reviewed,
                    submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bountyId),
                    evaluation.weights(),
                    SettlementKind.DISPUTE_CORRECTION,
                    now
            );
            log.info("Bounty {} re-resolved as {} after dispute {} (version {})",
                    bountyId, result.finalVerdict(), dispute.getDisputeId(), reviewed.getResolutionVersion());
            return BountyStatus.COMPLETED;
        }

        reviewed.setFinalVerdict(null);
        reviewed.setConsensusConfidence(null);
        reviewed.setResolvedAt(null);
        reviewed.setConsensusResultJson(resultJson);
        reviewed.setUpdatedAt(now);
        bountyRepository.save(reviewed);

        for (Submission submission : eligible) {
            revertScored(reviewed, submission, previousStatuses.get(submission.getSubmissionId()), now);
            submission.setStatus(SubmissionStatus.PENDING);
            submission.setAccuracyScore(null);
            submission.setProcessedAt(null);
            submission.setUpdatedAt(now);
        }
        submissionRepository.saveAll(eligible);
        reputationService.refreshRankings();
        int cancelled = settlementService.cancelPendingPayouts(bountyId, now);
        log.info("Bounty {} reopened after dispute {}: consensus no longer holds, cancelledPayouts={}",
                bountyId, dispute.getDisputeId(), cancelled);
        return BountyStatus.OPEN;
    }

    private void revertScored(Bounty bounty, Submission submission, SubmissionStatus previous, OffsetDateTime now) {
        if (previous != SubmissionStatus.CORRECT && previous != SubmissionStatus.INCORRECT) {
            return;
        }
        reputationService.reviseOutcome(submission.getEngineId(), bounty.getBountyId(), submission.getSubmissionId(),
                previous == SubmissionStatus.CORRECT, null, now);
    }

    private boolean isDisputeEligible(Bounty bounty) {
        JsonNode json = bounty.getConsensusResultJson();
        if (json == null || json.isNull()) {
            return false;
        }
        return ConsensusResultJsonCodec.fromJson(json).disputeEligible();
    }

    private BountyStatus currentBountyStatus(UUID bountyId) {
        return bountyRepository.findById(bountyId)
                .map(Bounty::getStatus)
                .orElseThrow(() -> BountyResolutionService.bountyNotFound(bountyId));
    }

    private Dispute lockDispute(UUID disputeId) {
        return disputeRepository.findByDisputeIdForUpdate(disputeId)
                .orElseThrow(() -> DisputeConflictException.disputeNotFound("Dispute not found: " + disputeId));
    }
}
