package com.nexusbounty.consensus;

import java.math.BigDecimal;

public record WeightedVote(SubmissionVote vote, BigDecimal weight) {
}
