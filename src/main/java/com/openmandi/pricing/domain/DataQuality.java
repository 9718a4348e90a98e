package com.openmandi.pricing.domain;

/**
 * Reliability tag the market-data pipeline attaches to a snapshot.
 */
public enum DataQuality {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * One tier worse; LOW stays LOW.
     */
    public DataQuality downgrade() {
        return this == HIGH ? MEDIUM : LOW;
    }

    public DataQuality downgrade(int tiers) {
        DataQuality result = this;
        for (int i = 0; i < tiers; i++) {
            result = result.downgrade();
        }
        return result;
    }
}
