package com.openmandi.pricing.ethics;

/**
 * Cohorts a caller can attach to a counterpart. Any one of them marks the
 * counterpart as vulnerable.
 */
public enum VulnerabilityCohort {
    NEW_USER,
    LOW_TRADE_VOLUME,
    LOW_LITERACY,
    LIMITED_LANGUAGE_PROFICIENCY
}
