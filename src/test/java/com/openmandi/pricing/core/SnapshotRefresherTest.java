package com.openmandi.pricing.core;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.infra.MarketDataUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SnapshotRefresherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T20:00:00Z"), ZoneId.of("UTC"));

    private MarketSnapshotRepository repository;
    private MarketSnapshotCache cache;
    private SnapshotRefresher refresher;

    @BeforeEach
    void setUp() {
        repository = mock(MarketSnapshotRepository.class);
        cache = new MarketSnapshotCache(CLOCK);
        refresher = new SnapshotRefresher(repository, cache, new PricingProperties(), CLOCK);
    }

    @Test
    void refreshLoadsLookbackWindowInMarketZone() {
        // 20:00 UTC is already the 16th in Kolkata
        LocalDate today = LocalDate.of(2024, 3, 16);
        when(repository.fetchSnapshots(today.minusDays(45), today))
                .thenReturn(List.of(MarketSnapshotCacheTest.snapshot("rice", "Pune", "2500", today)));

        refresher.refresh();

        assertEquals(1, cache.current().getGeneration());
        assertEquals(1, cache.current().size());
        verify(repository).fetchSnapshots(today.minusDays(45), today);
    }

    @Test
    void failedRefreshKeepsPreviousGeneration() {
        when(repository.fetchSnapshots(any(), any()))
                .thenReturn(List.of(MarketSnapshotCacheTest.snapshot("rice", "Pune", "2500", LocalDate.of(2024, 3, 16))))
                .thenThrow(new MarketDataUnavailableException("down"));

        assertTrue(refresher.invalidate().isPresent());
        SnapshotIndex before = cache.current();

        Optional<SnapshotIndex> result = refresher.invalidate();

        assertTrue(result.isEmpty());
        assertSame(before, cache.current());
    }

    @Test
    void emptyFeedDoesNotWipeCache() {
        when(repository.fetchSnapshots(any(), any()))
                .thenReturn(List.of(MarketSnapshotCacheTest.snapshot("rice", "Pune", "2500", LocalDate.of(2024, 3, 16))))
                .thenReturn(List.of());

        refresher.invalidate();
        Optional<SnapshotIndex> result = refresher.invalidate();

        assertTrue(result.isEmpty());
        assertEquals(1, cache.current().size());
    }
}
