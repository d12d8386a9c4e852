package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AccuracyScorerTest {

    private final AccuracyScorer scorer = new AccuracyScorer();

    @Test
    void correctCallScoresBetweenHalfAndOne() {
        assertEquals(new BigDecimal("0.5000"), scorer.score(Verdict.BENIGN, Verdict.BENIGN, BigDecimal.ZERO));
        assertEquals(new BigDecimal("1.0000"), scorer.score(Verdict.BENIGN, Verdict.BENIGN, BigDecimal.ONE));
        assertEquals(new BigDecimal("0.9250"), scorer.score(Verdict.MALICIOUS, Verdict.MALICIOUS, new BigDecimal("0.85")));
    }

    @Test
    void wrongCallScoresZeroWhateverTheConfidence() {
        assertEquals(new BigDecimal("0.0000"), scorer.score(Verdict.BENIGN, Verdict.MALICIOUS, BigDecimal.ONE));
    }
}
