package com.nexusbounty.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nexusbounty.config.ConsensusProperties;
import com.nexusbounty.consensus.AccuracyScorer;
import com.nexusbounty.consensus.ConsensusCalculator;
import com.nexusbounty.consensus.ConsensusEvaluation;
import com.nexusbounty.consensus.ConsensusPolicy;
import com.nexusbounty.consensus.ConsensusResult;
import com.nexusbounty.consensus.ConsensusResultJsonCodec;
import com.nexusbounty.consensus.SubmissionVote;
import com.nexusbounty.consensus.VotingWindow;
import com.nexusbounty.events.BountyEvent;
import com.nexusbounty.events.BountyEventPublisher;
import com.nexusbounty.events.BountyEventType;
import com.nexusbounty.model.Bounty;
import com.nexusbounty.model.BountyStatus;
import com.nexusbounty.model.SettlementKind;
import com.nexusbounty.model.Submission;
import com.nexusbounty.model.SubmissionStatus;
import com.nexusbounty.model.Verdict;
import com.nexusbounty.repository.BountyRepository;
import com.nexusbounty.repository.SubmissionRepository;
import com.nexusbounty.reputation.ReputationOutcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Evaluates one bounty and, when consensus is reached, resolves it: verdict, submission scoring,
 * reputation, settlement and the completion event. The Open to Completed transition is a status
 * compare-and-swap, so a bounty is resolved at most once however many evaluators race on it.
 */
@Service
@RequiredArgsConstructor
public class BountyResolutionService {

    private static final Logger log = LoggerFactory.getLogger(BountyResolutionService.class);

    private final BountyRepository bountyRepository;
    private final SubmissionRepository submissionRepository;
    private final ConsensusCalculator consensusCalculator;
    private final AccuracyScorer accuracyScorer;
    private final ReputationService reputationService;
    private final SettlementService settlementService;
    private final BountyEventPublisher bountyEventPublisher;
    private final ConsensusProperties consensusProperties;

    @Transactional
    public BountyEvaluation evaluateBounty(UUID bountyId, OffsetDateTime now) {
        Bounty bounty = bountyRepository.findById(bountyId).orElseThrow(() -> bountyNotFound(bountyId));
        if (bounty.getStatus() != BountyStatus.OPEN) {
            return new BountyEvaluation(ResolutionOutcome.SKIPPED, cachedResult(bounty));
        }

        List<Submission> submissions = submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bountyId);
        List<Submission> eligible = eligibleSubmissions(bounty, submissions);
        ConsensusEvaluation evaluation = evaluate(bounty, eligible);
        ConsensusResult result = evaluation.result();
        JsonNode resultJson = ConsensusResultJsonCodec.toJson(result);

        if (!result.consensusReached()) {
            if (bounty.getDeadline() != null && !now.isBefore(bounty.getDeadline())) {
                return expire(bounty, submissions, result, resultJson, now);
            }
            bountyRepository.cacheConsensusResult(bountyId, BountyStatus.OPEN, resultJson, now);
            log.debug("Bounty {} waiting for consensus: submissions={}, agreement={}",
                    bountyId, result.totalSubmissions(), result.agreementScore());
            return new BountyEvaluation(ResolutionOutcome.WAITING, result);
        }

        if (bountyRepository.compareAndSetStatus(bountyId, BountyStatus.OPEN, BountyStatus.COMPLETED, now) == 0) {
            log.warn("Bounty {} was resolved concurrently; discarding this evaluation", bountyId);
            return new BountyEvaluation(ResolutionOutcome.LOST_RACE, result);
        }

        Bounty completed = bountyRepository.findById(bountyId).orElseThrow(() -> bountyNotFound(bountyId));
        applyResult(completed, result, resultJson, now);
        bountyRepository.save(completed);

        List<Submission> scored = scoreSubmissions(completed, eligible, result.finalVerdict(), now);
        for (Submission submission : scored) {
            reputationService.recordOutcome(
                    submission.getEngineId(),
                    bountyId,
                    submission.getSubmissionId(),
                    reputationOutcome(completed, submission, true),
                    now
            );
        }
        reputationService.refreshRankings();

        List<Submission> settledSubmissions = submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bountyId);
        settlementService.settleResolution(completed, settledSubmissions, evaluation.weights(),
                SettlementKind.RESOLUTION, now);

        bountyEventPublisher.publish(event(BountyEventType.BOUNTY_COMPLETED, completed, settledSubmissions, null, now));
        log.info("Bounty {} resolved as {} (confidence={}, agreement={}, submissions={})",
                bountyId, result.finalVerdict(), result.confidence(), result.agreementScore(),
                result.totalSubmissions());
        return new BountyEvaluation(ResolutionOutcome.RESOLVED, result);
    }

    /**
     * Latest cached result, recomputed when the bounty has never been evaluated.
     */
    @Transactional(readOnly = true)
    public ConsensusResult getConsensus(UUID bountyId) {
        Bounty bounty = bountyRepository.findById(bountyId).orElseThrow(() -> bountyNotFound(bountyId));
        ConsensusResult cached = cachedResult(bounty);
        if (cached != null) {
            return cached;
        }
        List<Submission> submissions = submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bountyId);
        return evaluate(bounty, eligibleSubmissions(bounty, submissions)).result();
    }

    /**
     * Submissions that count towards consensus: not excluded by a dispute and staked at least the bounty minimum.
     */
    public List<Submission> eligibleSubmissions(Bounty bounty, List<Submission> submissions) {
        BigDecimal minStake = bounty.getMinStake() == null ? BigDecimal.ZERO : bounty.getMinStake();
        return submissions.stream()
                .filter(submission -> submission.getStatus() != SubmissionStatus.EXCLUDED)
                .filter(submission -> submission.getStakeAmount() != null
                        && submission.getStakeAmount().compareTo(minStake) >= 0)
                .toList();
    }

    public ConsensusEvaluation evaluate(Bounty bounty, List<Submission> eligible) {
        List<SubmissionVote> votes = eligible.stream()
                .map(submission -> new SubmissionVote(
                        submission.getSubmissionId(),
                        submission.getEngineId(),
                        submission.getVerdict(),
                        submission.getConfidence(),
                        submission.getStakeAmount(),
                        submission.getReputationSnapshot() != null
                                ? submission.getReputationSnapshot()
                                : reputationService.getScore(submission.getEngineId()),
                        submission.getSubmittedAt()
                ))
                .toList();
        return consensusCalculator.evaluate(votes, policyFor(bounty));
    }

    public ConsensusPolicy policyFor(Bounty bounty) {
        return new ConsensusPolicy(
                bounty.getConsensusThreshold() != null
                        ? bounty.getConsensusThreshold()
                        : consensusProperties.getThreshold(),
                bounty.getMinSubmissions() != null
                        ? bounty.getMinSubmissions()
                        : consensusProperties.getMinSubmissions(),
                bounty.getWeightedVoting() != null
                        ? bounty.getWeightedVoting()
                        : consensusProperties.isWeightedVoting(),
                consensusProperties.getDisputeThreshold(),
                new VotingWindow(bounty.getCreatedAt(), bounty.getDeadline())
        );
    }

    /**
     * Marks each submission correct or incorrect against the final verdict and stores its accuracy score.
     */
    public List<Submission> scoreSubmissions(Bounty bounty, List<Submission> eligible, Verdict finalVerdict,
                                             OffsetDateTime now) {
        for (Submission submission : eligible) {
            boolean correct = accuracyScorer.isCorrect(submission.getVerdict(), finalVerdict);
            submission.setStatus(correct ? SubmissionStatus.CORRECT : SubmissionStatus.INCORRECT);
            submission.setAccuracyScore(accuracyScorer.score(
                    submission.getVerdict(), finalVerdict, submission.getConfidence()));
            submission.setProcessedAt(now);
            submission.setUpdatedAt(now);
        }
        return submissionRepository.saveAll(eligible);
    }

    public ReputationOutcome reputationOutcome(Bounty bounty, Submission submission, boolean consensusReached) {
        boolean correct = submission.getStatus() == SubmissionStatus.CORRECT;
        return new ReputationOutcome(
                correct,
                submission.getConfidence(),
                correct && consensusReached,
                isEarly(bounty, submission.getSubmittedAt())
        );
    }

    /**
     * Early means inside the leading fraction of the window between bounty creation and deadline.
     * Bounties without a deadline have no early window.
     */
    boolean isEarly(Bounty bounty, OffsetDateTime submittedAt) {
        OffsetDateTime opensAt = bounty.getCreatedAt();
        OffsetDateTime closesAt = bounty.getDeadline();
        if (opensAt == null || closesAt == null || submittedAt == null || !closesAt.isAfter(opensAt)) {
            return false;
        }
        long windowMillis = Duration.between(opensAt, closesAt).toMillis();
        long earlyMillis = consensusProperties.getEarlySubmissionWindowFraction()
                .multiply(BigDecimal.valueOf(windowMillis))
                .longValue();
        return !submittedAt.isAfter(opensAt.plus(Duration.ofMillis(earlyMillis)));
    }

    void applyResult(Bounty bounty, ConsensusResult result, JsonNode resultJson, OffsetDateTime now) {
        bounty.setFinalVerdict(result.finalVerdict());
        bounty.setConsensusConfidence(result.confidence());
        bounty.setConsensusResultJson(resultJson);
        bounty.setResolvedAt(now);
        bounty.setResolutionVersion(bounty.getResolutionVersion() + 1);
        bounty.setUpdatedAt(now);
    }

    BountyEvent event(BountyEventType type, Bounty bounty, List<Submission> submissions, UUID disputeId,
                      OffsetDateTime now) {
        return new BountyEvent(
                type,
                bounty.getBountyId(),
                bounty.getFinalVerdict(),
                bounty.getConsensusConfidence(),
                submissions.stream().map(Submission::getEngineId).distinct().toList(),
                disputeId,
                now
        );
    }

    private BountyEvaluation expire(Bounty bounty, List<Submission> submissions, ConsensusResult result,
                                    JsonNode resultJson, OffsetDateTime now) {
        UUID bountyId = bounty.getBountyId();
        if (bountyRepository.compareAndSetStatus(bountyId, BountyStatus.OPEN, BountyStatus.EXPIRED, now) == 0) {
            log.warn("Bounty {} changed state before it could expire", bountyId);
            return new BountyEvaluation(ResolutionOutcome.LOST_RACE, result);
        }

        Bounty expired = bountyRepository.findById(bountyId).orElseThrow(() -> bountyNotFound(bountyId));
        expired.setFinalVerdict(null);
        expired.setConsensusConfidence(null);
        expired.setConsensusResultJson(resultJson);
        expired.setResolutionVersion(expired.getResolutionVersion() + 1);
        expired.setUpdatedAt(now);
        bountyRepository.save(expired);

        settlementService.settleExpiry(expired, submissions, now);
        bountyEventPublisher.publish(event(BountyEventType.BOUNTY_EXPIRED, expired, submissions, null, now));
        log.info("Bounty {} expired without consensus (submissions={}, agreement={})",
                bountyId, result.totalSubmissions(), result.agreementScore());
        return new BountyEvaluation(ResolutionOutcome.EXPIRED, result);
    }

    private ConsensusResult cachedResult(Bounty bounty) {
        JsonNode json = bounty.getConsensusResultJson();
        if (json == null || json.isNull()) {
            return null;
        }
        return ConsensusResultJsonCodec.fromJson(json);
    }

    static ResponseStatusException bountyNotFound(UUID bountyId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Bounty not found: " + bountyId);
    }

    public enum ResolutionOutcome {
        WAITING,
        RESOLVED,
        EXPIRED,
        SKIPPED,
        LOST_RACE
    }

    public record BountyEvaluation(ResolutionOutcome outcome, ConsensusResult result) {
    }
}
