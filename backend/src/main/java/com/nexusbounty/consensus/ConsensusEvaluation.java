package com.nexusbounty.consensus;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * @param weights per-submission weight used in this pass, keyed in input order
 */
public record ConsensusEvaluation(ConsensusResult result, Map<UUID, BigDecimal> weights) {
}
