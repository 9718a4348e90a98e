package com.openmandi.pricing.domain;

public enum RiskLevel {
    LOW("Stable market conditions, a good time for trading"),
    MEDIUM("Monitor the market closely and consider smaller quantities at first"),
    HIGH("High risk period, consider waiting or splitting the trade");

    private final String recommendation;

    RiskLevel(String recommendation) {
        this.recommendation = recommendation;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public RiskLevel atLeast(RiskLevel other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
