package com.openmandi.pricing.core;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ConfidenceBand {
    BigDecimal lower;
    BigDecimal upper;
    double confidence;
}
