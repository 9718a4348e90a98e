package com.openmandi.pricing.domain;

/**
 * How hard the receiving party should push back on an offer.
 */
public enum NegotiationStrategy {
    AGGRESSIVE,
    MODERATE,
    CONSERVATIVE
}
