package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Direction of the trailing modal price series, with a strength in [0, 1].
 */
@Value
@Builder
@Jacksonized
public class MarketTrend {
    TrendDirection direction;
    double strength;
    int samples;

    public static MarketTrend flat(int samples) {
        return new MarketTrend(TrendDirection.STABLE, 0, samples);
    }
}
