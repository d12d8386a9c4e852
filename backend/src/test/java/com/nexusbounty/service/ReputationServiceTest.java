package com.nexusbounty.service;

import com.nexusbounty.config.ReputationProperties;
import com.nexusbounty.model.EngineReputation;
import com.nexusbounty.model.ReputationHistory;
import com.nexusbounty.repository.EngineReputationRepository;
import com.nexusbounty.repository.ReputationHistoryRepository;
import com.nexusbounty.reputation.ReputationOutcome;
import com.nexusbounty.reputation.ReputationScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReputationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-02T00:00:00Z");

    @Mock
    private EngineReputationRepository engineReputationRepository;

    @Mock
    private ReputationHistoryRepository reputationHistoryRepository;

    private ReputationService reputationService;

    @BeforeEach
    void setUp() {
        reputationService = new ReputationService(
                engineReputationRepository,
                reputationHistoryRepository,
                new ReputationScorer(new ReputationProperties())
        );
    }

    @Test
    void unknownEngineStartsAtBaseScore() {
        when(engineReputationRepository.findById("engine-new")).thenReturn(Optional.empty());

        assertEquals(1000, reputationService.getScore("engine-new"));
    }

    @Test
    void firstCorrectOutcomeCreatesReputationAndHistory() {
        UUID bountyId = UUID.randomUUID();
        UUID submissionId = UUID.randomUUID();
        when(engineReputationRepository.findById("engine-a")).thenReturn(Optional.empty());

        int score = reputationService.recordOutcome("engine-a", bountyId, submissionId,
                new ReputationOutcome(true, BigDecimal.ONE, true, false), NOW);

        assertEquals(1075, score);
        ArgumentCaptor<EngineReputation> reputation = ArgumentCaptor.forClass(EngineReputation.class);
        verify(engineReputationRepository).save(reputation.capture());
        assertEquals(1, reputation.getValue().getTotalSubmissions());
        assertEquals(1, reputation.getValue().getCorrectSubmissions());
        assertEquals(1, reputation.getValue().getCurrentStreak());
        assertEquals(1075, reputation.getValue().getHighestScore());
        assertEquals(1000, reputation.getValue().getLowestScore());
        assertEquals(new BigDecimal("1.0000"), reputation.getValue().getAccuracyRate());
        assertEquals(NOW, reputation.getValue().getLastActivityAt());

        ArgumentCaptor<ReputationHistory> history = ArgumentCaptor.forClass(ReputationHistory.class);
        verify(reputationHistoryRepository).save(history.capture());
        assertEquals(75, history.getValue().getScoreChange());
        assertEquals(ReputationService.REASON_CORRECT, history.getValue().getReason());
        assertEquals(submissionId, history.getValue().getSubmissionId());
    }

    @Test
    void incorrectOutcomeBreaksStreakAndAppliesPenalty() {
        EngineReputation existing = reputation("engine-b", 2000, 3, 3);
        existing.setCurrentStreak(3);
        existing.setBestStreak(3);
        when(engineReputationRepository.findById("engine-b")).thenReturn(Optional.of(existing));

        int score = reputationService.recordOutcome("engine-b", UUID.randomUUID(), UUID.randomUUID(),
                new ReputationOutcome(false, new BigDecimal("0.5"), false, false), NOW);

        assertEquals(1950, score);
        assertEquals(0, existing.getCurrentStreak());
        assertEquals(3, existing.getBestStreak());
        assertEquals(1, existing.getIncorrectSubmissions());
        assertEquals(new BigDecimal("0.7500"), existing.getAccuracyRate());
    }

    @Test
    void revisingOutcomeRevertsRecordedDeltaAndCounters() {
        UUID submissionId = UUID.randomUUID();
        EngineReputation existing = reputation("engine-a", 1075, 1, 1);
        when(engineReputationRepository.findById("engine-a")).thenReturn(Optional.of(existing));
        ReputationHistory earlier = new ReputationHistory();
        earlier.setEngineId("engine-a");
        earlier.setSubmissionId(submissionId);
        earlier.setScoreChange(75);
        when(reputationHistoryRepository.findBySubmissionIdOrderByCreatedAtAsc(submissionId))
                .thenReturn(List.of(earlier));

        int score = reputationService.reviseOutcome("engine-a", UUID.randomUUID(), submissionId, true, null, NOW);

        assertEquals(1000, score);
        assertEquals(0, existing.getTotalSubmissions());
        assertEquals(0, existing.getCorrectSubmissions());
        ArgumentCaptor<ReputationHistory> history = ArgumentCaptor.forClass(ReputationHistory.class);
        verify(reputationHistoryRepository).save(history.capture());
        assertEquals(-75, history.getValue().getScoreChange());
        assertEquals(ReputationService.REASON_DISPUTE_REVERSAL, history.getValue().getReason());
    }

    @Test
    void decayLowersScoreOfInactiveEngine() {
        EngineReputation existing = reputation("engine-c", 1000, 0, 0);
        when(engineReputationRepository.findById("engine-c")).thenReturn(Optional.of(existing));

        boolean changed = reputationService.applyDecay("engine-c", BigDecimal.TEN, NOW);

        assertTrue(changed);
        assertEquals(990, existing.getCurrentScore());
        assertEquals(1000, existing.getDecayBaseScore());
        assertEquals(NOW, existing.getLastDecayAt());
    }

    @Test
    void repeatedDecayIsMeasuredFromScoreBeforeInactivity() {
        EngineReputation existing = reputation("engine-c", 900, 0, 0);
        existing.setDecayBaseScore(1000);
        when(engineReputationRepository.findById("engine-c")).thenReturn(Optional.of(existing));

        reputationService.applyDecay("engine-c", new BigDecimal("200"), NOW);

        assertEquals(800, existing.getCurrentScore());
        assertEquals(1000, existing.getDecayBaseScore());
    }

    @Test
    void newOutcomeEndsTheDecayStretch() {
        EngineReputation existing = reputation("engine-c", 900, 0, 0);
        existing.setDecayBaseScore(1000);
        when(engineReputationRepository.findById("engine-c")).thenReturn(Optional.of(existing));

        reputationService.recordOutcome("engine-c", UUID.randomUUID(), UUID.randomUUID(),
                new ReputationOutcome(true, BigDecimal.ONE, false, false), NOW);

        assertNull(existing.getDecayBaseScore());
        assertEquals(NOW, existing.getLastActivityAt());
    }

    @Test
    void decayOfUnknownEngineIsNoop() {
        when(engineReputationRepository.findById("ghost")).thenReturn(Optional.empty());

        assertFalse(reputationService.applyDecay("ghost", BigDecimal.TEN, NOW));
        verify(reputationHistoryRepository, never()).save(any());
    }

    @Test
    void rankingsFollowScoreOrder() {
        EngineReputation first = reputation("engine-a", 3000, 0, 0);
        EngineReputation second = reputation("engine-b", 2000, 0, 0);
        when(engineReputationRepository.findAllByOrderByCurrentScoreDescEngineIdAsc())
                .thenReturn(List.of(first, second));

        assertEquals(2, reputationService.refreshRankings());
        assertEquals(1, first.getRank());
        assertEquals(new BigDecimal("100.00"), first.getPercentile());
        assertEquals(2, second.getRank());
        assertEquals(new BigDecimal("50.00"), second.getPercentile());
    }

    @Test
    void earningsAccumulate() {
        EngineReputation existing = reputation("engine-a", 1000, 0, 0);
        when(engineReputationRepository.findById("engine-a")).thenReturn(Optional.of(existing));

        reputationService.recordEarnings("engine-a", new BigDecimal("12.5"), NOW);

        assertEquals(0, new BigDecimal("12.5").compareTo(existing.getTotalEarned()));
    }

    private static EngineReputation reputation(String engineId, int score, int total, int correct) {
        EngineReputation reputation = new EngineReputation();
        reputation.setEngineId(engineId);
        reputation.setCurrentScore(score);
        reputation.setHighestScore(score);
        reputation.setLowestScore(score);
        reputation.setTotalSubmissions(total);
        reputation.setCorrectSubmissions(correct);
        return reputation;
    }
}
