package com.openmandi.pricing.core;

import lombok.Value;

/**
 * Coefficient of variation of the trailing price series.
 * {@code samples} below 3 means the conservative default was used.
 */
@Value
public class VolatilityReading {
    double coefficient;
    boolean rising;
    int samples;
}
