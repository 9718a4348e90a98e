package com.openmandi.pricing.core;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.MarketTrend;
import com.openmandi.pricing.domain.PriceRisk;
import com.openmandi.pricing.domain.RiskLevel;
import com.openmandi.pricing.domain.TrendDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Grades trading risk from volatility, trend strength and confidence. Each
 * rule can only raise the level.
 */
@Component
@RequiredArgsConstructor
public class MarketRiskAssessor {

    private final PricingProperties properties;

    public PriceRisk assess(VolatilityReading volatility, MarketTrend trend, boolean degradedConfidence) {
        PricingProperties.Risk config = properties.getRisk();
        PriceRisk.PriceRiskBuilder risk = PriceRisk.builder();
        RiskLevel level = RiskLevel.LOW;

        if (volatility.getCoefficient() > config.getHighVolatility()) {
            level = RiskLevel.HIGH;
            risk.reason("High price volatility, prices may change rapidly");
        } else if (volatility.getCoefficient() > config.getMediumVolatility()) {
            level = RiskLevel.MEDIUM;
            risk.reason("Moderate price volatility");
        }

        if (trend != null && trend.getDirection() != TrendDirection.STABLE
                && trend.getStrength() > config.getStrongTrend()) {
            level = level.atLeast(RiskLevel.MEDIUM);
            risk.reason(trend.getDirection() == TrendDirection.RISING
                    ? "Strong upward trend, prices may keep rising"
                    : "Strong downward trend, prices may keep falling");
        }

        if (degradedConfidence) {
            level = level.atLeast(RiskLevel.MEDIUM);
            risk.reason("Market data is thin or old");
        }

        return risk
                .level(level)
                .recommendation(level.getRecommendation())
                .build();
    }
}
