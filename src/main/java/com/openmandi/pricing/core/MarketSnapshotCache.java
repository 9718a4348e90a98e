package com.openmandi.pricing.core;

import com.openmandi.pricing.domain.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide read-only view of market snapshots. Writers build a complete
 * new {@link SnapshotIndex} and swap it in; readers hold one generation for a
 * whole request and never see a partial update.
 */
@Slf4j
@Component
public class MarketSnapshotCache {

    private final AtomicReference<SnapshotIndex> current = new AtomicReference<>(SnapshotIndex.empty());
    private final Clock clock;

    public MarketSnapshotCache(Clock clock) {
        this.clock = clock;
    }

    public SnapshotIndex current() {
        return current.get();
    }

    public SnapshotIndex replaceAll(Collection<MarketSnapshot> snapshots) {
        SnapshotIndex next = current.updateAndGet(previous ->
                SnapshotIndex.of(previous.getGeneration() + 1, clock.instant(), snapshots));
        log.info("Snapshot cache generation {} published with {} snapshots", next.getGeneration(), next.size());
        return next;
    }

    /**
     * Publishes a new generation with {@code snapshot} added, replacing any
     * record for the same product, location and date.
     */
    public SnapshotIndex updateSnapshot(MarketSnapshot snapshot) {
        return current.updateAndGet(previous -> {
            List<MarketSnapshot> merged = new ArrayList<>(previous.all());
            merged.removeIf(s -> sameRecord(s, snapshot));
            merged.add(snapshot);
            return SnapshotIndex.of(previous.getGeneration() + 1, clock.instant(), merged);
        });
    }

    private static boolean sameRecord(MarketSnapshot a, MarketSnapshot b) {
        return SnapshotIndex.key(a.getProduct()).equals(SnapshotIndex.key(b.getProduct()))
                && SnapshotIndex.key(a.getLocation()).equals(SnapshotIndex.key(b.getLocation()))
                && a.getDate() != null && a.getDate().equals(b.getDate());
    }
}
