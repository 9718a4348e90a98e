package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One multiplicative adjustment applied by the pricing model.
 * {@code magnitude} is |multiplier - 1|.
 */
@Value
@Builder
@Jacksonized
public class PriceFactor {
    FactorType type;
    Direction direction;
    BigDecimal magnitude;
    BigDecimal multiplier;

    public static PriceFactor of(FactorType type, BigDecimal multiplier) {
        BigDecimal delta = multiplier.subtract(BigDecimal.ONE);
        return PriceFactor.builder()
                .type(type)
                .direction(delta.signum() >= 0 ? Direction.UP : Direction.DOWN)
                .magnitude(delta.abs())
                .multiplier(multiplier)
                .build();
    }
}
