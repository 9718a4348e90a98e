package com.openmandi.pricing.domain;

import java.math.BigDecimal;
import java.util.Locale;

public enum QualityGrade {
    PREMIUM(new BigDecimal("1.30")),
    GOOD(new BigDecimal("1.10")),
    STANDARD(new BigDecimal("1.00")),
    AVERAGE(new BigDecimal("0.85")),
    LOW(new BigDecimal("0.70"));

    private final BigDecimal defaultMultiplier;

    QualityGrade(BigDecimal defaultMultiplier) {
        this.defaultMultiplier = defaultMultiplier;
    }

    public BigDecimal getDefaultMultiplier() {
        return defaultMultiplier;
    }

    /**
     * Lenient lookup used at the API edge ("Premium", "below-average" ...).
     *
     * @throws IllegalArgumentException for names outside the fixed set
     */
    public static QualityGrade parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("quality grade is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return QualityGrade.valueOf(normalized);
    }
}
