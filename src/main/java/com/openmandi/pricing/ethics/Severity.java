package com.openmandi.pricing.ethics;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean requiresIntervention() {
        return this == HIGH || this == CRITICAL;
    }
}
