package com.openmandi.pricing.core;

import com.openmandi.pricing.domain.MarketSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Port to the external market-data store. Latency and failures belong to the
 * implementation; the engine only sees finished values.
 */
public interface MarketSnapshotRepository {

    Optional<MarketSnapshot> fetchSnapshot(String product, String location, LocalDate date);

    /**
     * All snapshots recorded between {@code from} and {@code to}, inclusive.
     * Used to build a cache generation.
     */
    List<MarketSnapshot> fetchSnapshots(LocalDate from, LocalDate to);
}
