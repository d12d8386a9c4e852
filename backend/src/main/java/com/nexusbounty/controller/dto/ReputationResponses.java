package com.nexusbounty.controller.dto;

import com.nexusbounty.model.EngineReputation;
import com.nexusbounty.model.ReputationHistory;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class ReputationResponses {

    private ReputationResponses() {
    }

    public record EngineReputationDetail(
            String engineId,
            int currentScore,
            int highestScore,
            int lowestScore,
            int totalSubmissions,
            int correctSubmissions,
            int incorrectSubmissions,
            BigDecimal accuracyRate,
            int currentStreak,
            int bestStreak,
            BigDecimal totalEarned,
            Integer rank,
            BigDecimal percentile,
            OffsetDateTime lastActivityAt
    ) {
        public static EngineReputationDetail from(EngineReputation reputation) {
            return new EngineReputationDetail(
                    reputation.getEngineId(),
                    reputation.getCurrentScore(),
                    reputation.getHighestScore(),
                    reputation.getLowestScore(),
                    reputation.getTotalSubmissions(),
                    reputation.getCorrectSubmissions(),
                    reputation.getIncorrectSubmissions(),
                    reputation.getAccuracyRate(),
                    reputation.getCurrentStreak(),
                    reputation.getBestStreak(),
                    reputation.getTotalEarned(),
                    reputation.getRank(),
                    reputation.getPercentile(),
                    reputation.getLastActivityAt()
            );
        }
    }

    public record HistoryEntry(
            int scoreBefore,
            int scoreAfter,
            int scoreChange,
            String reason,
            UUID bountyId,
            UUID submissionId,
            OffsetDateTime createdAt
    ) {
        public static HistoryEntry from(ReputationHistory history) {
            return new HistoryEntry(
                    history.getScoreBefore(),
                    history.getScoreAfter(),
                    history.getScoreChange(),
                    history.getReason(),
                    history.getBountyId(),
                    history.getSubmissionId(),
                    history.getCreatedAt()
            );
        }
    }
}
