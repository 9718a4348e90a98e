package com.openmandi.pricing.domain;

/**
 * Ordered from least to most severe; the ethics guard may only move right.
 */
public enum Verdict {
    FAIR,
    FAVORABLE,
    UNFAVORABLE,
    EXPLOITATIVE;

    public Verdict atLeast(Verdict floor) {
        return this.compareTo(floor) >= 0 ? this : floor;
    }
}
