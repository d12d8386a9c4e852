package com.nexusbounty.config;

import com.nexusbounty.model.BountyStatus;
import com.nexusbounty.model.PayoutStatus;
import com.nexusbounty.repository.BountyRepository;
import com.nexusbounty.repository.PayoutRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Down while payouts sit in FAILED; open bounties past their deadline are reported as a detail.
 */
@Component
public class SettlementHealthIndicator implements HealthIndicator {

    private final PayoutRepository payoutRepository;
    private final BountyRepository bountyRepository;

    public SettlementHealthIndicator(PayoutRepository payoutRepository, BountyRepository bountyRepository) {
        this.payoutRepository = payoutRepository;
        this.bountyRepository = bountyRepository;
    }

    @Override
    public Health health() {
        try {
            long failedPayouts = payoutRepository.countByStatus(PayoutStatus.FAILED);
            long pendingPayouts = payoutRepository.countByStatus(PayoutStatus.PENDING);
            long processingPayouts = payoutRepository.countByStatus(PayoutStatus.PROCESSING);
            long overdueBounties = bountyRepository.countByStatusAndDeadlineBefore(BountyStatus.OPEN, OffsetDateTime.now());

            Health.Builder builder = failedPayouts == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("failedPayouts", failedPayouts)
                    .withDetail("pendingPayouts", pendingPayouts)
                    .withDetail("processingPayouts", processingPayouts)
                    .withDetail("overdueOpenBounties", overdueBounties)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
