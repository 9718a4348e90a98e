package com.openmandi.pricing.core;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.DataQuality;
import com.openmandi.pricing.domain.MarketSnapshot;
import com.openmandi.pricing.domain.MarketTrend;
import com.openmandi.pricing.domain.PricePoint;
import com.openmandi.pricing.domain.TrendDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns data quality, record age and price volatility into a confidence score
 * and an asymmetric interval around the point price. Out-of-range inputs are
 * clamped, never rejected.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceEstimator {

    static final double MIN_CONFIDENCE = 0.05;
    static final double MAX_CONFIDENCE = 0.99;
    private static final int MIN_SAMPLES = 3;
    private static final int MIN_TREND_SAMPLES = 6;
    private static final BigDecimal MIN_PRICE = new BigDecimal("0.01");

    private final PricingProperties properties;

    public VolatilityReading volatilityOf(MarketSnapshot snapshot, LocalDate asOf) {
        List<Double> prices = trailingPrices(snapshot, asOf);
        if (prices.size() < MIN_SAMPLES) {
            return new VolatilityReading(properties.getConfidence().getDefaultVolatility(), false, prices.size());
        }

        boolean rising = false;
        if (prices.size() >= MIN_TREND_SAMPLES) {
            int half = prices.size() / 2;
            rising = coefficientOfVariation(prices.subList(half, prices.size()))
                    > coefficientOfVariation(prices.subList(0, half));
        }
        return new VolatilityReading(coefficientOfVariation(prices), rising, prices.size());
    }

    /**
     * Compares the mean of the newer half of the trailing series with the
     * older half. Fewer than three points read as a flat market.
     */
    public MarketTrend trendOf(MarketSnapshot snapshot, LocalDate asOf) {
        PricingProperties.Confidence config = properties.getConfidence();
        List<Double> prices = trailingPrices(snapshot, asOf);
        if (prices.size() < MIN_SAMPLES) {
            return MarketTrend.flat(prices.size());
        }
        int half = prices.size() / 2;
        double older = mean(prices.subList(0, half));
        double newer = mean(prices.subList(prices.size() - half, prices.size()));
        if (older <= 0) {
            return MarketTrend.flat(prices.size());
        }
        double change = newer / older - 1;
        double strength = Math.min(1, Math.abs(change) / config.getTrendFullStrengthChange());
        TrendDirection direction = Math.abs(change) < config.getTrendStableChange() ? TrendDirection.STABLE
                : change > 0 ? TrendDirection.RISING : TrendDirection.FALLING;
        return MarketTrend.builder()
                .direction(direction)
                .strength(strength)
                .samples(prices.size())
                .build();
    }

    public ConfidenceBand bound(BigDecimal pointPrice, MarketSnapshot snapshot, VolatilityReading volatility,
                                DataQuality dataQuality, LocalDate asOf) {
        PricingProperties.Confidence config = properties.getConfidence();

        double staleness = staleness(snapshot, asOf);
        double confidence = confidence(volatility.getCoefficient(), staleness, dataQuality);

        double halfWidth = config.getIntervalScale() * (1 - confidence) * pointPrice.doubleValue();
        double upperHalfWidth = volatility.isRising()
                ? halfWidth * (1 + config.getRisingVolatilityWidening())
                : halfWidth;

        BigDecimal lower = pointPrice.subtract(BigDecimal.valueOf(halfWidth)).setScale(2, RoundingMode.FLOOR);
        BigDecimal upper = pointPrice.add(BigDecimal.valueOf(upperHalfWidth)).setScale(2, RoundingMode.CEILING);
        if (lower.compareTo(MIN_PRICE) < 0) {
            lower = MIN_PRICE.min(pointPrice);
        }
        if (upper.compareTo(lower) <= 0) {
            upper = lower.add(MIN_PRICE);
        }
        return new ConfidenceBand(lower, upper, confidence);
    }

    /**
     * Clamped to [0.05, 0.99]; non-increasing in both volatility and staleness.
     */
    public double confidence(double volatility, double staleness, DataQuality dataQuality) {
        PricingProperties.Confidence config = properties.getConfidence();
        double v = Math.max(0, volatility);
        double s = Math.min(1, Math.max(0, staleness));
        double raw = 1 - (config.getVolatilityWeight() * v
                + config.getStalenessWeight() * s
                + qualityPenalty(dataQuality));
        return Math.min(MAX_CONFIDENCE, Math.max(MIN_CONFIDENCE, raw));
    }

    double staleness(MarketSnapshot snapshot, LocalDate asOf) {
        LocalDate recorded = snapshot.getRecordedAt() != null
                ? snapshot.getRecordedAt().atZone(properties.getZone()).toLocalDate()
                : snapshot.getDate();
        if (recorded == null) {
            return 1.0;
        }
        long ageDays = Math.max(0, ChronoUnit.DAYS.between(recorded, asOf));
        int horizon = Math.max(1, properties.getConfidence().getStalenessHorizonDays());
        return Math.min(1.0, (double) ageDays / horizon);
    }

    private double qualityPenalty(DataQuality dataQuality) {
        if (dataQuality == null) {
            return properties.getConfidence().getLowQualityPenalty();
        }
        switch (dataQuality) {
            case HIGH:
                return 0;
            case MEDIUM:
                return properties.getConfidence().getMediumQualityPenalty();
            default:
                return properties.getConfidence().getLowQualityPenalty();
        }
    }

    private List<Double> trailingPrices(MarketSnapshot snapshot, LocalDate asOf) {
        LocalDate from = asOf.minusDays(properties.getConfidence().getVolatilityWindowDays());
        List<PricePoint> window = new ArrayList<>();
        for (PricePoint point : snapshot.getHistory()) {
            if (point.getDate() == null || point.getModalPrice() == null) {
                continue;
            }
            if (point.getDate().isAfter(from) && !point.getDate().isAfter(asOf)) {
                window.add(point);
            }
        }
        window.sort(Comparator.comparing(PricePoint::getDate));
        List<Double> prices = new ArrayList<>();
        window.forEach(point -> prices.add(point.getModalPrice().doubleValue()));
        return prices;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double coefficientOfVariation(List<Double> values) {
        double mean = mean(values);
        if (mean <= 0) {
            return 0;
        }
        double variance = values.stream()
                .mapToDouble(v -> (v - mean) * (v - mean))
                .average()
                .orElse(0);
        return Math.sqrt(variance) / mean;
    }
}
