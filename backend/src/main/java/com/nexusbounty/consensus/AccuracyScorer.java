package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Correct calls score {@code 0.5 + confidence * 0.5}; wrong calls score zero regardless of confidence.
 */
public class AccuracyScorer {

    public static final int SCORE_SCALE = 4;

    private static final BigDecimal HALF = new BigDecimal("0.5");

    public BigDecimal score(Verdict submissionVerdict, Verdict finalVerdict, BigDecimal confidence) {
        if (submissionVerdict != finalVerdict) {
            return BigDecimal.ZERO.setScale(SCORE_SCALE);
        }
        return HALF.add(confidence.multiply(HALF)).setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }

    public boolean isCorrect(Verdict submissionVerdict, Verdict finalVerdict) {
        return submissionVerdict == finalVerdict;
    }
}
