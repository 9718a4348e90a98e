package com.openmandi.pricing.core;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotRefresher {

    private final MarketSnapshotRepository repository;
    private final MarketSnapshotCache cache;
    private final PricingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pricing.cache.refresh-interval-ms:300000}")
    public void refresh() {
        invalidate();
    }

    /**
     * Rebuilds the snapshot index now. On failure the previous generation stays
     * in place and empty is returned.
     */
    public Optional<SnapshotIndex> invalidate() {
        LocalDate today = LocalDate.now(clock.withZone(properties.getZone()));
        LocalDate from = today.minusDays(properties.getCache().getLookbackDays());
        log.info("Refreshing market snapshots {} .. {}", from, today);
        try {
            List<MarketSnapshot> snapshots = repository.fetchSnapshots(from, today);
            if (snapshots.isEmpty() && cache.current().size() > 0) {
                log.warn("Market data returned no snapshots; keeping generation {}", cache.current().getGeneration());
                return Optional.empty();
            }
            return Optional.of(cache.replaceAll(snapshots));
        } catch (RuntimeException e) {
            log.error("Snapshot refresh failed; keeping generation {}", cache.current().getGeneration(), e);
            return Optional.empty();
        }
    }
}
