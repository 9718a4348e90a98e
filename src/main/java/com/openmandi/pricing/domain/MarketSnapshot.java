package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One mandi record for a (product, location, date), as delivered by the
 * market-data pipeline. Read only; the engine never mutates it.
 */
@Value
@Builder
public class MarketSnapshot {
    String product;
    String location;
    LocalDate date;
    BigDecimal minPrice;
    BigDecimal maxPrice;
    BigDecimal modalPrice;
    String unit;
    QualityGrade qualityGrade;
    BigDecimal arrivalVolume;
    Instant recordedAt;
    DataQuality dataQuality;

    // Trailing modal prices for the product, oldest first
    @Singular("historyPoint")
    List<PricePoint> history;
}
