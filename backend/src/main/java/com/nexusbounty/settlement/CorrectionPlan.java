package com.nexusbounty.settlement;

import java.math.BigDecimal;

/**
 * @param unrecoverableAmount value already delivered beyond what the corrected plan allows
 */
public record CorrectionPlan(SettlementPlan plan, BigDecimal unrecoverableAmount) {
}
