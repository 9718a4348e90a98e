package com.openmandi.pricing.domain;

public enum TrendDirection {
    RISING,
    FALLING,
    STABLE
}
