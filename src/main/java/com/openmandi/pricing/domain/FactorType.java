package com.openmandi.pricing.domain;

/**
 * Declaration order is the canonical tie-break order for explanations.
 */
public enum FactorType {
    SEASONAL("Seasonal demand"),
    QUALITY("Quality grade"),
    QUANTITY("Bulk quantity"),
    LOCATION("Location");

    private final String label;

    FactorType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
