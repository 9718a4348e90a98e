package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Result of a price query. Lives for one request; callers may cache it.
 * Invariant: {@code lowerBound <= pointPrice <= upperBound}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PriceEstimate {
    String product;
    String location;
    String unit;
    BigDecimal quantity;
    QualityGrade qualityGrade;
    LocalDate asOf;

    // Snapshot actually priced from; differs from product/location after a fallback
    String sourceProduct;
    String sourceLocation;
    BigDecimal basePrice;

    BigDecimal pointPrice;
    BigDecimal lowerBound;
    BigDecimal upperBound;
    double confidence;
    double volatility;
    boolean volatilityRising;
    DataQuality dataQuality;
    boolean degradedConfidence;
    MarketTrend trend;
    PriceRisk risk;

    @Singular
    List<PriceFactor> factors;

    public boolean isSubstituted() {
        return sourceProduct != null && !sourceProduct.equalsIgnoreCase(product);
    }

    public boolean isFromOtherMarket() {
        return sourceLocation != null && location != null && !sourceLocation.equalsIgnoreCase(location);
    }
}
