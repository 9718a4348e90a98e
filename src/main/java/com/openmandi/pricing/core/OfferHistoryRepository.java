package com.openmandi.pricing.core;

import com.openmandi.pricing.domain.Offer;

import java.time.Duration;
import java.util.List;

public interface OfferHistoryRepository {

    /**
     * Offers made toward {@code counterpartId} on {@code product} within the
     * trailing {@code window}, oldest first.
     */
    List<Offer> fetchHistory(String product, String counterpartId, Duration window);
}
