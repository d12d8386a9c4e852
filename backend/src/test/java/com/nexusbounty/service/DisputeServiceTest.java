package com.nexusbounty.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.nexusbounty.config.ConsensusProperties;
import com.nexusbounty.config.SettlementProperties;
import com.nexusbounty.consensus.AccuracyScorer;
import com.nexusbounty.consensus.AgreementEvaluator;
import com.nexusbounty.consensus.ConsensusCalculator;
import com.nexusbounty.consensus.ConsensusResolver;
import com.nexusbounty.consensus.ConsensusResult;
import com.nexusbounty.consensus.ConsensusResultJsonCodec;
import com.nexusbounty.consensus.VerdictDistribution;
import com.nexusbounty.consensus.VerdictDistributionBuilder;
import com.nexusbounty.consensus.VoteWeightingModel;
import com.nexusbounty.consensus.WeightCoefficients;
import com.nexusbounty.controller.dto.DisputeRequests;
import com.nexusbounty.controller.dto.DisputeResponses;
import com.nexusbounty.events.BountyEvent;
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
import com.nexusbounty.model.Verdict;
import com.nexusbounty.repository.BountyRepository;
import com.nexusbounty.repository.DisputeRepository;
import com.nexusbounty.repository.SubmissionRepository;
import com.nexusbounty.web.DisputeConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DisputeServiceTest {

    private static final OffsetDateTime CREATED_AT = OffsetDateTime.parse("2026-03-01T00:00:00Z");
    private static final OffsetDateTime NOW = CREATED_AT.plusDays(1);
    private static final String WALLET = "0x3333333333333333333333333333333333333333";

    @Mock
    private DisputeRepository disputeRepository;

    @Mock
    private BountyRepository bountyRepository;

    @Mock
    private SubmissionRepository submissionRepository;

    @Mock
    private ReputationService reputationService;

    @Mock
    private SettlementService settlementService;

    @Mock
    private BountyEventPublisher bountyEventPublisher;

    private DisputeService disputeService;

    @BeforeEach
    void setUp() {
        ConsensusProperties consensusProperties = new ConsensusProperties();
        ConsensusProperties.Weights weights = consensusProperties.getWeights();
        ConsensusCalculator calculator = new ConsensusCalculator(
                new VerdictDistributionBuilder(new VoteWeightingModel(new WeightCoefficients(
                        weights.getReputation(), weights.getConfidence(), weights.getTime(), weights.getStake(),
                        weights.getStakeCeiling(), weights.isTimeDecayEnabled()))),
                new ConsensusResolver(),
                new AgreementEvaluator()
        );
        BountyResolutionService bountyResolutionService = new BountyResolutionService(
                bountyRepository, submissionRepository, calculator, new AccuracyScorer(),
                reputationService, settlementService, bountyEventPublisher, consensusProperties);
        disputeService = new DisputeService(
                disputeRepository, bountyRepository, submissionRepository, bountyResolutionService,
                reputationService, settlementService, bountyEventPublisher, new SettlementProperties());
    }

    @Test
    void acceptedDisputeReResolvesWhenRemainingVotesStillAgree() {
        Bounty bounty = completedBounty(false);
        List<Submission> submissions = new ArrayList<>(List.of(
                submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000, SubmissionStatus.CORRECT, 1),
                submission(bounty, "engine-b", Verdict.MALICIOUS, "0.85", 7500, SubmissionStatus.CORRECT, 2),
                submission(bounty, "engine-c", Verdict.MALICIOUS, "0.8", 7000, SubmissionStatus.CORRECT, 3),
                submission(bounty, "engine-d", Verdict.BENIGN, "0.6", 3000, SubmissionStatus.INCORRECT, 4)
        ));
        Dispute dispute = activeDispute(bounty, submissions.get(0), DisputeStatus.UNDER_REVIEW);
        stubDecisionPath(bounty, submissions, dispute);
        when(bountyRepository.compareAndSetStatus(bounty.getBountyId(), BountyStatus.COMPLETED,
                BountyStatus.UNDER_REVIEW, NOW)).thenReturn(1);
        when(bountyRepository.compareAndSetStatus(bounty.getBountyId(), BountyStatus.UNDER_REVIEW,
                BountyStatus.COMPLETED, NOW)).thenReturn(1);

        DisputeResponses.DisputeDecision decision = disputeService.resolveDispute(
                dispute.getDisputeId(), DisputeResolution.ACCEPTED, "admin-1", NOW);

        assertEquals(BountyStatus.COMPLETED, decision.bountyStatus());
        assertEquals(DisputeStatus.RESOLVED, decision.dispute().status());
        assertEquals("ACCEPTED", decision.dispute().resolution());
        assertEquals(SubmissionStatus.EXCLUDED, submissions.get(0).getStatus());
        assertNull(submissions.get(0).getAccuracyScore());
        assertEquals(SubmissionStatus.CORRECT, submissions.get(1).getStatus());
        assertEquals(SubmissionStatus.INCORRECT, submissions.get(3).getStatus());
        assertEquals(Verdict.MALICIOUS, bounty.getFinalVerdict());
        assertEquals(2, bounty.getResolutionVersion());

        verify(reputationService).reviseOutcome(eq("engine-a"), eq(bounty.getBountyId()),
                eq(submissions.get(0).getSubmissionId()), eq(true), isNull(), eq(NOW));
        verify(reputationService, never()).reviseOutcome(eq("engine-b"), any(), any(), anyBoolean(), any(), any());
        verify(settlementService).settleResolution(eq(bounty), anyList(), anyMap(),
                eq(SettlementKind.DISPUTE_CORRECTION), eq(NOW));
        verify(settlementService).settleDisputeStake(any(Dispute.class), eq(true), eq(NOW));
        verify(settlementService, never()).cancelPendingPayouts(any(), any());

        ArgumentCaptor<BountyEvent> eventCaptor = ArgumentCaptor.forClass(BountyEvent.class);
        verify(bountyEventPublisher).publish(eventCaptor.capture());
        assertEquals(BountyEventType.DISPUTE_RESOLVED, eventCaptor.getValue().eventType());
        assertEquals(dispute.getDisputeId(), eventCaptor.getValue().disputeId());
    }

    @Test
    void acceptedDisputeReopensBountyWhenConsensusNoLongerHolds() {
        Bounty bounty = completedBounty(false);
        List<Submission> submissions = new ArrayList<>(List.of(
                submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000, SubmissionStatus.CORRECT, 1),
                submission(bounty, "engine-b", Verdict.MALICIOUS, "0.85", 7500, SubmissionStatus.CORRECT, 2),
                submission(bounty, "engine-c", Verdict.BENIGN, "0.6", 3000, SubmissionStatus.INCORRECT, 3)
        ));
        Dispute dispute = activeDispute(bounty, submissions.get(0), DisputeStatus.OPEN);
        stubDecisionPath(bounty, submissions, dispute);
        when(bountyRepository.compareAndSetStatus(bounty.getBountyId(), BountyStatus.COMPLETED,
                BountyStatus.UNDER_REVIEW, NOW)).thenReturn(1);
        when(bountyRepository.compareAndSetStatus(bounty.getBountyId(), BountyStatus.UNDER_REVIEW,
                BountyStatus.OPEN, NOW)).thenReturn(1);

        DisputeResponses.DisputeDecision decision = disputeService.resolveDispute(
                dispute.getDisputeId(), DisputeResolution.ACCEPTED, "admin-1", NOW);

        assertEquals(BountyStatus.OPEN, decision.bountyStatus());
        assertNull(bounty.getFinalVerdict());
        assertNull(bounty.getResolvedAt());
        assertEquals(1, bounty.getResolutionVersion());
        assertEquals(SubmissionStatus.EXCLUDED, submissions.get(0).getStatus());
        assertEquals(SubmissionStatus.PENDING, submissions.get(1).getStatus());
        assertEquals(SubmissionStatus.PENDING, submissions.get(2).getStatus());

        verify(reputationService).reviseOutcome(eq("engine-a"), any(), any(), eq(true), isNull(), eq(NOW));
        verify(reputationService).reviseOutcome(eq("engine-b"), any(), any(), eq(true), isNull(), eq(NOW));
        verify(reputationService).reviseOutcome(eq("engine-c"), any(), any(), eq(false), isNull(), eq(NOW));
        verify(settlementService).cancelPendingPayouts(bounty.getBountyId(), NOW);
        verify(settlementService, never()).settleResolution(any(), anyList(), anyMap(), any(), any());
        verify(settlementService).settleDisputeStake(any(Dispute.class), eq(true), eq(NOW));
    }

    @Test
    void rejectedDisputeForfeitsStakeAndLeavesBountyAlone() {
        Bounty bounty = completedBounty(true);
        List<Submission> submissions = List.of(
                submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000, SubmissionStatus.CORRECT, 1));
        Dispute dispute = activeDispute(bounty, submissions.get(0), DisputeStatus.UNDER_REVIEW);
        when(disputeRepository.findByDisputeIdForUpdate(dispute.getDisputeId())).thenReturn(Optional.of(dispute));
        when(disputeRepository.findById(dispute.getDisputeId())).thenReturn(Optional.of(dispute));
        when(disputeRepository.save(any(Dispute.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(bountyRepository.findById(bounty.getBountyId())).thenReturn(Optional.of(bounty));
        when(submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bounty.getBountyId()))
                .thenReturn(submissions);

        DisputeResponses.DisputeDecision decision = disputeService.resolveDispute(
                dispute.getDisputeId(), DisputeResolution.REJECTED, "admin-1", NOW);

        assertEquals(BountyStatus.COMPLETED, decision.bountyStatus());
        assertEquals(DisputeStatus.REJECTED, decision.dispute().status());
        assertEquals(SubmissionStatus.CORRECT, submissions.get(0).getStatus());
        verify(settlementService).settleDisputeStake(any(Dispute.class), eq(false), eq(NOW));
        verify(bountyRepository, never()).compareAndSetStatus(any(), any(), any(), any());
        verify(reputationService, never()).reviseOutcome(any(), any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void decidedDisputeCannotBeResolvedAgain() {
        Bounty bounty = completedBounty(true);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.CORRECT, 1);
        Dispute dispute = activeDispute(bounty, submission, DisputeStatus.REJECTED);
        when(disputeRepository.findByDisputeIdForUpdate(dispute.getDisputeId())).thenReturn(Optional.of(dispute));

        DisputeConflictException ex = assertThrows(DisputeConflictException.class, () -> disputeService.resolveDispute(
                dispute.getDisputeId(), DisputeResolution.ACCEPTED, "admin-1", NOW));

        assertEquals("invalid_dispute_transition", ex.getCode());
    }

    @Test
    void startReviewMovesOpenDisputeUnderReview() {
        Bounty bounty = completedBounty(true);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.CORRECT, 1);
        Dispute dispute = activeDispute(bounty, submission, DisputeStatus.OPEN);
        when(disputeRepository.findByDisputeIdForUpdate(dispute.getDisputeId())).thenReturn(Optional.of(dispute));
        when(disputeRepository.save(dispute)).thenReturn(dispute);

        DisputeResponses.DisputeDetail detail = disputeService.startReview(dispute.getDisputeId(), "reviewer-7", NOW);

        assertEquals(DisputeStatus.UNDER_REVIEW, detail.status());
        assertEquals("reviewer-7", detail.resolverId());
    }

    @Test
    void opensDisputeOnEligibleCompletedBounty() {
        Bounty bounty = completedBounty(true);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.CORRECT, 1);
        stubOpenDispute(bounty, submission);
        when(disputeRepository.existsBySubmissionIdAndStatusIn(eq(submission.getSubmissionId()), anyCollection()))
                .thenReturn(false);
        when(disputeRepository.save(any(Dispute.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DisputeResponses.DisputeDetail detail = disputeService.openDispute(request(bounty, submission, "25", false), NOW);

        assertEquals(DisputeStatus.OPEN, detail.status());
        assertEquals(bounty.getBountyId(), detail.bountyId());
        assertEquals("auditor-1", detail.disputerId());
        assertEquals(0, new BigDecimal("25").compareTo(detail.stakeAmount()));
    }

    @Test
    void rejectsDisputeOnBountyThatIsNotCompleted() {
        Bounty bounty = completedBounty(true);
        bounty.setStatus(BountyStatus.OPEN);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.PENDING, 1);
        when(bountyRepository.findById(bounty.getBountyId())).thenReturn(Optional.of(bounty));

        DisputeConflictException ex = assertThrows(DisputeConflictException.class,
                () -> disputeService.openDispute(request(bounty, submission, "25", false), NOW));

        assertEquals("bounty_not_completed", ex.getCode());
    }

    @Test
    void rejectsDisputeStakeBelowMinimum() {
        Bounty bounty = completedBounty(true);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.CORRECT, 1);
        stubOpenDispute(bounty, submission);

        DisputeConflictException ex = assertThrows(DisputeConflictException.class,
                () -> disputeService.openDispute(request(bounty, submission, "9.99", false), NOW));

        assertEquals("insufficient_stake", ex.getCode());
        verify(disputeRepository, never()).save(any());
    }

    @Test
    void rejectsSecondActiveDisputeOnSameSubmission() {
        Bounty bounty = completedBounty(true);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.CORRECT, 1);
        stubOpenDispute(bounty, submission);
        when(disputeRepository.existsBySubmissionIdAndStatusIn(eq(submission.getSubmissionId()), anyCollection()))
                .thenReturn(true);

        DisputeConflictException ex = assertThrows(DisputeConflictException.class,
                () -> disputeService.openDispute(request(bounty, submission, "25", false), NOW));

        assertEquals("already_disputed", ex.getCode());
    }

    @Test
    void clearAgreementBlocksDisputeUnlessAdminOverrides() {
        Bounty bounty = completedBounty(false);
        Submission submission = submission(bounty, "engine-a", Verdict.MALICIOUS, "0.9", 8000,
                SubmissionStatus.CORRECT, 1);
        stubOpenDispute(bounty, submission);
        when(disputeRepository.existsBySubmissionIdAndStatusIn(eq(submission.getSubmissionId()), anyCollection()))
                .thenReturn(false);
        when(disputeRepository.save(any(Dispute.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DisputeConflictException ex = assertThrows(DisputeConflictException.class,
                () -> disputeService.openDispute(request(bounty, submission, "25", false), NOW));
        DisputeResponses.DisputeDetail overridden = disputeService.openDispute(
                request(bounty, submission, "25", true), NOW);

        assertEquals("dispute_not_eligible", ex.getCode());
        assertTrue(overridden.adminOverride());
    }

    @Test
    void rejectsSubmissionFromAnotherBounty() {
        Bounty bounty = completedBounty(true);
        Bounty other = completedBounty(true);
        Submission foreign = submission(other, "engine-z", Verdict.BENIGN, "0.5", 1000, SubmissionStatus.CORRECT, 1);
        stubOpenDispute(bounty, foreign);

        DisputeConflictException ex = assertThrows(DisputeConflictException.class,
                () -> disputeService.openDispute(request(bounty, foreign, "25", false), NOW));

        assertEquals("invalid_submission", ex.getCode());
    }

    private void stubDecisionPath(Bounty bounty, List<Submission> submissions, Dispute dispute) {
        when(disputeRepository.findByDisputeIdForUpdate(dispute.getDisputeId())).thenReturn(Optional.of(dispute));
        when(disputeRepository.findById(dispute.getDisputeId())).thenReturn(Optional.of(dispute));
        when(disputeRepository.save(any(Dispute.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(bountyRepository.findById(bounty.getBountyId())).thenReturn(Optional.of(bounty));
        when(submissionRepository.findByBountyIdOrderBySubmittedAtAscSubmissionIdAsc(bounty.getBountyId()))
                .thenReturn(submissions);
        when(submissionRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private void stubOpenDispute(Bounty bounty, Submission submission) {
        when(bountyRepository.findById(bounty.getBountyId())).thenReturn(Optional.of(bounty));
        when(submissionRepository.findById(submission.getSubmissionId())).thenReturn(Optional.of(submission));
    }

    private static DisputeRequests.OpenDisputeRequest request(Bounty bounty, Submission submission, String stake,
                                                              boolean adminOverride) {
        return new DisputeRequests.OpenDisputeRequest(
                bounty.getBountyId(),
                submission.getSubmissionId(),
                " auditor-1 ",
                WALLET,
                "Sample is a known dropper",
                JsonNodeFactory.instance.objectNode().put("sandboxReport", "https://example.test/report/1"),
                new BigDecimal(stake),
                adminOverride
        );
    }

    private static Bounty completedBounty(boolean disputeEligible) {
        Bounty bounty = new Bounty();
        bounty.setBountyId(UUID.randomUUID());
        bounty.setCreatorAddress("0x1111111111111111111111111111111111111111");
        bounty.setArtifactReference("sha256:cafebabe");
        bounty.setRewardAmount(new BigDecimal("1000"));
        bounty.setMinStake(BigDecimal.ZERO);
        bounty.setMinSubmissions(3);
        bounty.setConsensusThreshold(new BigDecimal("0.66"));
        bounty.setStatus(BountyStatus.COMPLETED);
        bounty.setFinalVerdict(Verdict.MALICIOUS);
        bounty.setResolutionVersion(1);
        bounty.setCreatedAt(CREATED_AT);
        bounty.setDeadline(CREATED_AT.plusDays(7));
        bounty.setConsensusResultJson(ConsensusResultJsonCodec.toJson(new ConsensusResult(
                Verdict.MALICIOUS,
                new BigDecimal("0.8000"),
                3,
                VerdictDistribution.empty(),
                new BigDecimal("0.7000"),
                true,
                disputeEligible ? new BigDecimal("38.0000") : new BigDecimal("75.0000"),
                disputeEligible
        )));
        return bounty;
    }

    private static Submission submission(Bounty bounty, String engineId, Verdict verdict, String confidence,
                                         int reputation, SubmissionStatus status, int minute) {
        Submission submission = new Submission();
        submission.setSubmissionId(UUID.randomUUID());
        submission.setBountyId(bounty.getBountyId());
        submission.setEngineId(engineId);
        submission.setWalletAddress("0x2222222222222222222222222222222222222222");
        submission.setVerdict(verdict);
        submission.setConfidence(new BigDecimal(confidence));
        submission.setStakeAmount(new BigDecimal("1000"));
        submission.setReputationSnapshot(reputation);
        submission.setStatus(status);
        submission.setSubmittedAt(CREATED_AT.plusMinutes(minute));
        return submission;
    }

    private static Dispute activeDispute(Bounty bounty, Submission submission, DisputeStatus status) {
        Dispute dispute = new Dispute();
        dispute.setDisputeId(UUID.randomUUID());
        dispute.setBountyId(bounty.getBountyId());
        dispute.setSubmissionId(submission.getSubmissionId());
        dispute.setDisputerId("auditor-1");
        dispute.setDisputerWallet(WALLET);
        dispute.setReason("Sample is a known dropper");
        dispute.setStakeAmount(new BigDecimal("25"));
        dispute.setStatus(status);
        dispute.setCreatedAt(CREATED_AT.plusHours(12));
        return dispute;
    }
}
