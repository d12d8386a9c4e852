package com.nexusbounty.config;

import com.nexusbounty.consensus.AccuracyScorer;
import com.nexusbounty.consensus.AgreementEvaluator;
import com.nexusbounty.consensus.ConsensusCalculator;
import com.nexusbounty.consensus.ConsensusResolver;
import com.nexusbounty.consensus.VerdictDistributionBuilder;
import com.nexusbounty.consensus.VoteWeightingModel;
import com.nexusbounty.consensus.WeightCoefficients;
import com.nexusbounty.reputation.ReputationScorer;
import com.nexusbounty.settlement.SettlementPlanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stateless scoring components from configuration.
 */
@Configuration
public class ConsensusEngineConfig {

    @Bean
    public WeightCoefficients weightCoefficients(ConsensusProperties consensusProperties) {
        ConsensusProperties.Weights weights = consensusProperties.getWeights();
        return new WeightCoefficients(
                weights.getReputation(),
                weights.getConfidence(),
                weights.getTime(),
                weights.getStake(),
                weights.getStakeCeiling(),
                weights.isTimeDecayEnabled()
        );
    }

    @Bean
    public VoteWeightingModel voteWeightingModel(WeightCoefficients weightCoefficients) {
        return new VoteWeightingModel(weightCoefficients);
    }

    @Bean
    public VerdictDistributionBuilder verdictDistributionBuilder(VoteWeightingModel voteWeightingModel) {
        return new VerdictDistributionBuilder(voteWeightingModel);
    }

    @Bean
    public ConsensusResolver consensusResolver() {
        return new ConsensusResolver();
    }

    @Bean
    public AgreementEvaluator agreementEvaluator() {
        return new AgreementEvaluator();
    }

    @Bean
    public AccuracyScorer accuracyScorer() {
        return new AccuracyScorer();
    }

    @Bean
    public ConsensusCalculator consensusCalculator(
            VerdictDistributionBuilder verdictDistributionBuilder,
            ConsensusResolver consensusResolver,
            AgreementEvaluator agreementEvaluator
    ) {
        return new ConsensusCalculator(verdictDistributionBuilder, consensusResolver, agreementEvaluator);
    }

    @Bean
    public ReputationScorer reputationScorer(ReputationProperties reputationProperties) {
        return new ReputationScorer(reputationProperties);
    }

    @Bean
    public SettlementPlanner settlementPlanner(SettlementProperties settlementProperties) {
        return new SettlementPlanner(
                settlementProperties.getSlashFraction(),
                settlementProperties.getPlatformFeeRate(),
                settlementProperties.getTreasuryAddress()
        );
    }
}
