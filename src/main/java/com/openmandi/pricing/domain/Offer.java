package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Offer {
    Role role;
    BigDecimal unitPrice;
    BigDecimal quantity;
    String product;
    String location;
    QualityGrade qualityGrade; // optional
    String partyId; // optional
    String counterpartId; // optional
    Instant submittedAt; // optional

    /**
     * Signed price deviation from {@code referencePrice}, independent of role.
     */
    public double rawDeviationFrom(BigDecimal referencePrice) {
        return unitPrice.subtract(referencePrice)
                .divide(referencePrice, MathContext.DECIMAL64)
                .doubleValue();
    }

    /**
     * Deviation seen from the submitting role: positive when the price is in
     * the submitter's interest and therefore against the counterpart's.
     */
    public double deviationFrom(BigDecimal referencePrice) {
        double raw = rawDeviationFrom(referencePrice);
        return role == Role.SELLER ? raw : -raw;
    }
}
