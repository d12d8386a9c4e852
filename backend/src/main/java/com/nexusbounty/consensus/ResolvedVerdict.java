package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;

/**
 * @param thresholdMet true only when a threshold-eligible category reached the consensus threshold
 */
public record ResolvedVerdict(Verdict verdict, BigDecimal confidence, boolean thresholdMet) {
}
