package com.nexusbounty.consensus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs weighting, distribution, resolution and agreement for one vote set. Pure: the same votes and
 * policy always produce an identical evaluation.
 */
public class ConsensusCalculator {

    private final VerdictDistributionBuilder distributionBuilder;
    private final ConsensusResolver resolver;
    private final AgreementEvaluator agreementEvaluator;

    public ConsensusCalculator(
            VerdictDistributionBuilder distributionBuilder,
            ConsensusResolver resolver,
            AgreementEvaluator agreementEvaluator
    ) {
        this.distributionBuilder = distributionBuilder;
        this.resolver = resolver;
        this.agreementEvaluator = agreementEvaluator;
    }

    public ConsensusEvaluation evaluate(List<SubmissionVote> votes, ConsensusPolicy policy) {
        List<WeightedVote> weightedVotes = distributionBuilder.weigh(votes, policy.weightedVoting(), policy.window());
        VerdictDistribution distribution = distributionBuilder.fromWeighted(weightedVotes);

        ResolvedVerdict resolved = resolver.resolve(distribution, policy.threshold());
        boolean consensusReached = resolver.isConsensusReached(resolved, votes.size(), policy.minSubmissions());

        BigDecimal totalWeight = distribution.totalWeight();
        BigDecimal weightedScore = totalWeight.signum() > 0
                ? distribution.statsFor(resolved.verdict()).weightedCount()
                        .divide(totalWeight, VerdictDistributionBuilder.PERCENT_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        BigDecimal agreementScore = agreementEvaluator.agreement(distribution);
        boolean disputeEligible = agreementEvaluator.canDispute(agreementScore, policy.disputeThreshold());

        ConsensusResult result = new ConsensusResult(
                resolved.verdict(),
                resolved.confidence(),
                votes.size(),
                distribution,
                weightedScore,
                consensusReached,
                agreementScore,
                disputeEligible
        );

        Map<UUID, BigDecimal> weights = new LinkedHashMap<>();
        for (WeightedVote weightedVote : weightedVotes) {
            weights.put(weightedVote.vote().submissionId(), weightedVote.weight());
        }
        return new ConsensusEvaluation(result, Collections.unmodifiableMap(weights));
    }
}
