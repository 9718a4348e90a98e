package com.openmandi.pricing.core;

import com.openmandi.pricing.domain.MarketSnapshot;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One immutable generation of the snapshot cache, grouped by product and
 * ordered newest first (ties by location) so lookups are deterministic.
 */
public final class SnapshotIndex {

    private static final Comparator<MarketSnapshot> NEWEST_FIRST = Comparator
            .comparing(MarketSnapshot::getDate, Comparator.reverseOrder())
            .thenComparing(s -> key(s.getLocation()));

    private final long generation;
    private final Instant builtAt;
    private final Map<String, List<MarketSnapshot>> byProduct;

    private SnapshotIndex(long generation, Instant builtAt, Map<String, List<MarketSnapshot>> byProduct) {
        this.generation = generation;
        this.builtAt = builtAt;
        this.byProduct = byProduct;
    }

    public static SnapshotIndex empty() {
        return new SnapshotIndex(0, Instant.EPOCH, Map.of());
    }

    public static SnapshotIndex of(long generation, Instant builtAt, Collection<MarketSnapshot> snapshots) {
        Map<String, List<MarketSnapshot>> grouped = new HashMap<>();
        for (MarketSnapshot snapshot : snapshots) {
            if (snapshot == null || snapshot.getProduct() == null || snapshot.getModalPrice() == null) {
                continue;
            }
            grouped.computeIfAbsent(key(snapshot.getProduct()), k -> new ArrayList<>()).add(snapshot);
        }
        Map<String, List<MarketSnapshot>> frozen = new HashMap<>();
        grouped.forEach((product, list) -> {
            list.sort(NEWEST_FIRST);
            frozen.put(product, Collections.unmodifiableList(list));
        });
        return new SnapshotIndex(generation, builtAt, Collections.unmodifiableMap(frozen));
    }

    public Optional<MarketSnapshot> exact(String product, String location, LocalDate from, LocalDate to) {
        String wanted = key(location);
        return forProduct(product).stream()
                .filter(s -> inWindow(s, from, to))
                .filter(s -> key(s.getLocation()).equals(wanted))
                .findFirst();
    }

    public Optional<MarketSnapshot> anyLocation(String product, LocalDate from, LocalDate to) {
        return forProduct(product).stream()
                .filter(s -> inWindow(s, from, to))
                .findFirst();
    }

    public List<MarketSnapshot> forProduct(String product) {
        return byProduct.getOrDefault(key(product), List.of());
    }

    public List<MarketSnapshot> all() {
        List<MarketSnapshot> all = new ArrayList<>();
        byProduct.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return byProduct.values().stream().mapToInt(List::size).sum();
    }

    public long getGeneration() {
        return generation;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    private static boolean inWindow(MarketSnapshot snapshot, LocalDate from, LocalDate to) {
        LocalDate date = snapshot.getDate();
        return date != null && !date.isBefore(from) && !date.isAfter(to);
    }

    static String key(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
