package com.nexusbounty.service;

import com.nexusbounty.model.EngineReputation;
import com.nexusbounty.model.ReputationHistory;
import com.nexusbounty.repository.EngineReputationRepository;
import com.nexusbounty.repository.ReputationHistoryRepository;
import com.nexusbounty.reputation.ReputationOutcome;
import com.nexusbounty.reputation.ReputationScorer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Engine reputation store. Every score movement is written to the history table so that
 * it can be reverted when a dispute changes the outcome it was based on.
 */
@Service
@RequiredArgsConstructor
public class ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    static final String REASON_CORRECT = "CONSENSUS_CORRECT";
    static final String REASON_INCORRECT = "CONSENSUS_INCORRECT";
    static final String REASON_DISPUTE_REVERSAL = "DISPUTE_REVERSAL";
    static final String REASON_DECAY = "INACTIVITY_DECAY";

    private final EngineReputationRepository engineReputationRepository;
    private final ReputationHistoryRepository reputationHistoryRepository;
    private final ReputationScorer reputationScorer;

    /**
     * Current score, or the base score for engines that have never been scored.
     */
    @Transactional(readOnly = true)
    public int getScore(String engineId) {
        return engineReputationRepository.findById(engineId)
                .map(EngineReputation::getCurrentScore)
                .orElseGet(reputationScorer::baseScore);
    }

    @Transactional(readOnly = true)
    public Optional<EngineReputation> getReputation(String engineId) {
        return engineReputationRepository.findById(engineId);
    }

    @Transactional(readOnly = true)
    public List<ReputationHistory> getRecentHistory(String engineId) {
        return reputationHistoryRepository.findTop50ByEngineIdOrderByCreatedAtDesc(engineId);
    }

    @Transactional(readOnly = true)
    public List<EngineReputation> getLeaderboard() {
        return engineReputationRepository.findAllByOrderByCurrentScoreDescEngineIdAsc();
    }

    /**
     * Moves an engine's score by {@code delta}, clamped to the configured range.
     *
     * @return the new score
     */
    @Transactional
    public int applyDelta(String engineId, int delta, String reason, UUID bountyId, UUID submissionId,
                          OffsetDateTime now) {
        EngineReputation reputation = loadOrCreate(engineId, now);
        int newScore = applyScore(reputation, reputationScorer.applyChange(reputation.getCurrentScore(), delta),
                reason, bountyId, submissionId, now);
        engineReputationRepository.save(reputation);
        return newScore;
    }

    /**
     * Applies the reputation effect of one scored submission and updates counters and streaks.
     */
    @Transactional
    public int recordOutcome(String engineId, UUID bountyId, UUID submissionId, ReputationOutcome outcome,
                             OffsetDateTime now) {
        EngineReputation reputation = loadOrCreate(engineId, now);
        int change = reputationScorer.scoreChange(reputation.getCurrentStreak(), outcome);

        reputation.setTotalSubmissions(reputation.getTotalSubmissions() + 1);
        if (outcome.correct()) {
            reputation.setCorrectSubmissions(reputation.getCorrectSubmissions() + 1);
            reputation.setCurrentStreak(reputation.getCurrentStreak() + 1);
            reputation.setBestStreak(Math.max(reputation.getBestStreak(), reputation.getCurrentStreak()));
        } else {
            reputation.setIncorrectSubmissions(reputation.getIncorrectSubmissions() + 1);
            reputation.setCurrentStreak(0);
        }
        reputation.setAccuracyRate(ReputationScorer.accuracyRate(
                reputation.getCorrectSubmissions(), reputation.getTotalSubmissions()));
        reputation.setLastActivityAt(now);
        reputation.setDecayBaseScore(null);

        int newScore = applyScore(reputation, reputationScorer.applyChange(reputation.getCurrentScore(), change),
                outcome.correct() ? REASON_CORRECT : REASON_INCORRECT, bountyId, submissionId, now);
        engineReputationRepository.save(reputation);
        return newScore;
    }

    /**
     * Reverts every earlier score movement recorded for a submission and, when the submission is
     * still scored after the dispute, applies its revised outcome.
     *
     * @param previouslyCorrect the outcome being reverted
     * @param revised the new outcome, or {@code null} when the submission no longer counts
     */
    @Transactional
    public int reviseOutcome(String engineId, UUID bountyId, UUID submissionId, boolean previouslyCorrect,
                             ReputationOutcome revised, OffsetDateTime now) {
        int previousDelta = reputationHistoryRepository.findBySubmissionIdOrderByCreatedAtAsc(submissionId).stream()
                .filter(history -> engineId.equals(history.getEngineId()))
                .mapToInt(ReputationHistory::getScoreChange)
                .sum();

        EngineReputation reputation = loadOrCreate(engineId, now);
        reputation.setTotalSubmissions(Math.max(0, reputation.getTotalSubmissions() - 1));
        if (previouslyCorrect) {
            reputation.setCorrectSubmissions(Math.max(0, reputation.getCorrectSubmissions() - 1));
        } else {
            reputation.setIncorrectSubmissions(Math.max(0, reputation.getIncorrectSubmissions() - 1));
        }
        reputation.setAccuracyRate(ReputationScorer.accuracyRate(
                reputation.getCorrectSubmissions(), reputation.getTotalSubmissions()));
        if (previousDelta != 0) {
            applyScore(reputation, reputationScorer.applyChange(reputation.getCurrentScore(), -previousDelta),
                    REASON_DISPUTE_REVERSAL, bountyId, submissionId, now);
            if (reputation.getDecayBaseScore() != null) {
                reputation.setDecayBaseScore(reputationScorer.applyChange(reputation.getDecayBaseScore(), -previousDelta));
            }
        }
        engineReputationRepository.save(reputation);

        if (revised == null) {
            return reputation.getCurrentScore();
        }
        return recordOutcome(engineId, bountyId, submissionId, revised, now);
    }

    @Transactional
    public void recordEarnings(String engineId, BigDecimal amount, OffsetDateTime now) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        EngineReputation reputation = loadOrCreate(engineId, now);
        reputation.setTotalEarned(reputation.getTotalEarned().add(amount));
        reputation.setUpdatedAt(now);
        engineReputationRepository.save(reputation);
    }

    /**
     * Applies inactivity decay to one engine. The decayed score is always computed from the score the
     * engine held when decay started, so repeated runs do not compound.
     *
     * @param daysInactive days of inactivity past the grace period
     * @return true if the score changed
     */
    @Transactional
    public boolean applyDecay(String engineId, BigDecimal daysInactive, OffsetDateTime now) {
        EngineReputation reputation = engineReputationRepository.findById(engineId).orElse(null);
        if (reputation == null) {
            return false;
        }
        if (reputation.getDecayBaseScore() == null) {
            reputation.setDecayBaseScore(reputation.getCurrentScore());
        }
        int decayed = reputationScorer.applyDecay(reputation.getDecayBaseScore(), daysInactive);
        reputation.setLastDecayAt(now);
        boolean changed = decayed != reputation.getCurrentScore();
        if (changed) {
            applyScore(reputation, decayed, REASON_DECAY, null, null, now);
        } else {
            reputation.setUpdatedAt(now);
        }
        engineReputationRepository.save(reputation);
        return changed;
    }

    /**
     * Recomputes rank (1 = highest score) and percentile for every engine.
     */
    @Transactional
    public int refreshRankings() {
        List<EngineReputation> ranked = engineReputationRepository.findAllByOrderByCurrentScoreDescEngineIdAsc();
        for (int i = 0; i < ranked.size(); i++) {
            EngineReputation reputation = ranked.get(i);
            reputation.setRank(i + 1);
            reputation.setPercentile(ReputationScorer.percentile(i + 1, ranked.size()));
        }
        engineReputationRepository.saveAll(ranked);
        log.debug("Refreshed reputation rankings for {} engines", ranked.size());
        return ranked.size();
    }

    private int applyScore(EngineReputation reputation, int newScore, String reason, UUID bountyId,
                           UUID submissionId, OffsetDateTime now) {
        int before = reputation.getCurrentScore();
        reputation.setCurrentScore(newScore);
        reputation.setHighestScore(Math.max(reputation.getHighestScore(), newScore));
        reputation.setLowestScore(Math.min(reputation.getLowestScore(), newScore));
        reputation.setUpdatedAt(now);

        ReputationHistory history = new ReputationHistory();
        history.setHistoryId(UUID.randomUUID());
        history.setEngineId(reputation.getEngineId());
        history.setScoreBefore(before);
        history.setScoreAfter(newScore);
        history.setScoreChange(newScore - before);
        history.setReason(reason);
        history.setBountyId(bountyId);
        history.setSubmissionId(submissionId);
        history.setCreatedAt(now);
        reputationHistoryRepository.save(history);

        if (newScore != before) {
            log.debug("Reputation of {} moved {} -> {} ({})", reputation.getEngineId(), before, newScore, reason);
        }
        return newScore;
    }

    private EngineReputation loadOrCreate(String engineId, OffsetDateTime now) {
        return engineReputationRepository.findById(engineId).orElseGet(() -> {
            int base = reputationScorer.baseScore();
            EngineReputation reputation = new EngineReputation();
            reputation.setEngineId(engineId);
            reputation.setCurrentScore(base);
            reputation.setHighestScore(base);
            reputation.setLowestScore(base);
            reputation.setCreatedAt(now);
            reputation.setUpdatedAt(now);
            return reputation;
        });
    }
}
