package com.openmandi.pricing.ethics;

public enum FlagType {
    PREDATORY_PRICING,
    VULNERABLE_USER_EXPOSURE,
    MARKET_MANIPULATION_SUSPECTED
}
