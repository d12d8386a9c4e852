package com.nexusbounty.config;

import com.nexusbounty.model.BountyStatus;
import com.nexusbounty.model.PayoutStatus;
import com.nexusbounty.repository.BountyRepository;
import com.nexusbounty.repository.PayoutRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementHealthIndicatorTest {

    @Mock
    private PayoutRepository payoutRepository;

    @Mock
    private BountyRepository bountyRepository;

    @InjectMocks
    private SettlementHealthIndicator healthIndicator;

    @Test
    void upWhenNoPayoutHasFailed() {
        when(payoutRepository.countByStatus(PayoutStatus.FAILED)).thenReturn(0L);
        when(payoutRepository.countByStatus(PayoutStatus.PENDING)).thenReturn(4L);
        when(bountyRepository.countByStatusAndDeadlineBefore(eq(BountyStatus.OPEN), any())).thenReturn(1L);

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(4L, health.getDetails().get("pendingPayouts"));
        assertEquals(1L, health.getDetails().get("overdueOpenBounties"));
    }

    @Test
    void downWhenFailedPayoutsExist() {
        when(payoutRepository.countByStatus(PayoutStatus.FAILED)).thenReturn(2L);
        when(payoutRepository.countByStatus(PayoutStatus.PENDING)).thenReturn(0L);
        when(bountyRepository.countByStatusAndDeadlineBefore(eq(BountyStatus.OPEN), any())).thenReturn(0L);

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(2L, health.getDetails().get("failedPayouts"));
    }

    @Test
    void downWhenRepositoryThrows() {
        when(payoutRepository.countByStatus(PayoutStatus.FAILED)).thenThrow(new IllegalStateException("db offline"));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("java.lang.IllegalStateException: db offline", health.getDetails().get("error"));
    }
}
