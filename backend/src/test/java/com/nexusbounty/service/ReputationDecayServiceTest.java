package com.nexusbounty.service;

import com.nexusbounty.config.ReputationProperties;
import com.nexusbounty.model.EngineReputation;
import com.nexusbounty.repository.EngineReputationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReputationDecayServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-20T00:00:00Z");

    @Spy
    private ReputationProperties reputationProperties = new ReputationProperties();

    @Mock
    private EngineReputationRepository engineReputationRepository;

    @Mock
    private ReputationService reputationService;

    @InjectMocks
    private ReputationDecayService reputationDecayService;

    @Test
    void countsInactiveDaysFromTheEndOfTheGracePeriod() {
        EngineReputation neverDecayed = engine("engine-a", NOW.minusDays(10), null);
        EngineReputation decayedYesterday = engine("engine-b", NOW.minusDays(30), NOW.minusDays(1));
        when(engineReputationRepository.findByLastActivityAtBefore(NOW.minusDays(7)))
                .thenReturn(List.of(neverDecayed, decayedYesterday));
        when(reputationService.applyDecay(eq("engine-a"), any(), eq(NOW))).thenReturn(true);
        when(reputationService.applyDecay(eq("engine-b"), any(), eq(NOW))).thenReturn(false);

        int decayed = reputationDecayService.applyDecay(NOW);

        assertEquals(1, decayed);
        verify(reputationService).applyDecay(eq("engine-a"),
                argThat(days -> days.compareTo(new BigDecimal("3")) == 0), eq(NOW));
        verify(reputationService).applyDecay(eq("engine-b"),
                argThat(days -> days.compareTo(new BigDecimal("23")) == 0), eq(NOW));
        verify(reputationService).refreshRankings();
    }

    @Test
    void skipsRankingRefreshWhenNothingChanged() {
        when(engineReputationRepository.findByLastActivityAtBefore(NOW.minusDays(7))).thenReturn(List.of());

        assertEquals(0, reputationDecayService.applyDecay(NOW));
        verify(reputationService, never()).refreshRankings();
    }

    @Test
    void fractionalDaysAreKept() {
        assertEquals(new BigDecimal("1.500000"),
                ReputationDecayService.daysBetween(NOW.minusHours(36), NOW));
        assertEquals(BigDecimal.ZERO, ReputationDecayService.daysBetween(NOW, NOW.minusDays(1)));
    }

    private static EngineReputation engine(String engineId, OffsetDateTime lastActivity, OffsetDateTime lastDecay) {
        EngineReputation reputation = new EngineReputation();
        reputation.setEngineId(engineId);
        reputation.setCurrentScore(1000);
        reputation.setLastActivityAt(lastActivity);
        reputation.setLastDecayAt(lastDecay);
        return reputation;
    }
}
