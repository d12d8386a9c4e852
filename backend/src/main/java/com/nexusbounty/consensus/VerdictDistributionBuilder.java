package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups votes by verdict. In weighted mode each vote contributes its model weight,
 * in simple-majority mode each vote contributes exactly one. A single pass never mixes modes.
 */
public class VerdictDistributionBuilder {

    public static final int PERCENT_SCALE = 4;
    public static final int CONFIDENCE_SCALE = 4;

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final VoteWeightingModel weightingModel;

    public VerdictDistributionBuilder(VoteWeightingModel weightingModel) {
        this.weightingModel = weightingModel;
    }

    public List<WeightedVote> weigh(List<SubmissionVote> votes, boolean weighted, VotingWindow window) {
        List<WeightedVote> weightedVotes = new ArrayList<>(votes.size());
        for (SubmissionVote vote : votes) {
            BigDecimal weight = weighted ? weightingModel.weight(vote, window) : BigDecimal.ONE;
            weightedVotes.add(new WeightedVote(vote, weight));
        }
        return weightedVotes;
    }

    public VerdictDistribution build(List<SubmissionVote> votes, boolean weighted, VotingWindow window) {
        return fromWeighted(weigh(votes, weighted, window));
    }

    public VerdictDistribution fromWeighted(List<WeightedVote> weightedVotes) {
        if (weightedVotes.isEmpty()) {
            return VerdictDistribution.empty();
        }

        Map<Verdict, List<WeightedVote>> grouped = new EnumMap<>(Verdict.class);
        BigDecimal totalWeight = BigDecimal.ZERO;
        for (WeightedVote weightedVote : weightedVotes) {
            grouped.computeIfAbsent(weightedVote.vote().verdict(), ignored -> new ArrayList<>()).add(weightedVote);
            totalWeight = totalWeight.add(weightedVote.weight());
        }

        Map<Verdict, VoteStats> categories = new EnumMap<>(Verdict.class);
        for (Map.Entry<Verdict, List<WeightedVote>> entry : grouped.entrySet()) {
            categories.put(entry.getKey(), summarize(entry.getValue(), totalWeight));
        }
        return new VerdictDistribution(categories);
    }

    private VoteStats summarize(List<WeightedVote> categoryVotes, BigDecimal totalWeight) {
        BigDecimal weightedCount = BigDecimal.ZERO;
        BigDecimal confidenceSum = BigDecimal.ZERO;
        List<String> voters = new ArrayList<>(categoryVotes.size());
        for (WeightedVote weightedVote : categoryVotes) {
            weightedCount = weightedCount.add(weightedVote.weight());
            confidenceSum = confidenceSum.add(weightedVote.vote().confidence());
            voters.add(weightedVote.vote().engineId());
        }

        BigDecimal percentage = totalWeight.signum() > 0
                ? weightedCount.multiply(ONE_HUNDRED).divide(totalWeight, PERCENT_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        BigDecimal avgConfidence = confidenceSum.divide(
                BigDecimal.valueOf(categoryVotes.size()), CONFIDENCE_SCALE, RoundingMode.HALF_UP);

        return new VoteStats(categoryVotes.size(), weightedCount, percentage, avgConfidence, voters);
    }
}
