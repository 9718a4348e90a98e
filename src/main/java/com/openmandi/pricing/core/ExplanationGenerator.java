package com.openmandi.pricing.core;

import com.openmandi.pricing.domain.Direction;
import com.openmandi.pricing.domain.FactorStatement;
import com.openmandi.pricing.domain.MarketTrend;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.PriceFactor;
import com.openmandi.pricing.domain.RiskLevel;
import com.openmandi.pricing.domain.TrendDirection;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders the factors of an estimate as plain-language statements. Uses
 * magnitude bands rather than percentages so the text stays accessible.
 */
@Component
public class ExplanationGenerator {

    private static final BigDecimal SLIGHT = new BigDecimal("0.03");
    private static final BigDecimal MODERATE = new BigDecimal("0.10");
    private static final BigDecimal SIGNIFICANT = new BigDecimal("0.25");

    private static final Comparator<PriceFactor> BY_IMPACT = Comparator
            .comparing((PriceFactor f) -> f.getMagnitude().abs(), Comparator.reverseOrder())
            .thenComparing(PriceFactor::getType);

    public List<FactorStatement> explain(PriceEstimate estimate) {
        List<PriceFactor> ordered = new ArrayList<>(estimate.getFactors());
        ordered.sort(BY_IMPACT);

        List<FactorStatement> statements = new ArrayList<>(ordered.size());
        for (PriceFactor factor : ordered) {
            String descriptor = descriptor(factor.getMagnitude());
            String verb = factor.getDirection() == Direction.UP ? "raised" : "lowered";
            statements.add(FactorStatement.builder()
                    .factor(factor.getType())
                    .direction(factor.getDirection())
                    .descriptor(descriptor)
                    .text(String.format("%s %s the price (%s effect)",
                            factor.getType().getLabel(), verb, descriptor))
                    .build());
        }
        return statements;
    }

    public String summarize(PriceEstimate estimate) {
        StringBuilder summary = new StringBuilder()
                .append("Suggested price for ").append(estimate.getProduct())
                .append(": ").append(estimate.getPointPrice().toPlainString())
                .append(" per ").append(estimate.getUnit() != null ? estimate.getUnit() : "unit")
                .append(", likely between ").append(estimate.getLowerBound().toPlainString())
                .append(" and ").append(estimate.getUpperBound().toPlainString())
                .append(" (").append(confidenceWord(estimate.getConfidence())).append(" confidence)");
        if (estimate.isSubstituted()) {
            summary.append("; based on prices of comparable product ").append(estimate.getSourceProduct());
        }
        if (estimate.isFromOtherMarket()) {
            summary.append("; based on the ").append(estimate.getSourceLocation()).append(" market");
        }
        if (estimate.isDegradedConfidence()) {
            summary.append("; market data is thin or old, check prices locally before agreeing");
        }
        MarketTrend trend = estimate.getTrend();
        if (trend != null && trend.getDirection() != TrendDirection.STABLE) {
            summary.append("; prices are ").append(trend.getDirection() == TrendDirection.RISING ? "rising" : "falling");
        }
        if (estimate.getRisk() != null && estimate.getRisk().getLevel() != RiskLevel.LOW) {
            summary.append(". ").append(estimate.getRisk().getRecommendation());
        }
        return summary.toString();
    }

    static String descriptor(BigDecimal magnitude) {
        BigDecimal m = magnitude.abs();
        if (m.compareTo(SLIGHT) < 0) {
            return "slight";
        }
        if (m.compareTo(MODERATE) < 0) {
            return "moderate";
        }
        if (m.compareTo(SIGNIFICANT) < 0) {
            return "significant";
        }
        return "major";
    }

    private static String confidenceWord(double confidence) {
        if (confidence >= 0.7) {
            return "high";
        }
        if (confidence >= 0.4) {
            return "medium";
        }
        return "low";
    }
}
