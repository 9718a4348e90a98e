package com.openmandi.pricing.config;

import com.openmandi.pricing.domain.QualityGrade;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Every tunable of the engine. Defaults here match application.yml so that
 * components built directly in tests behave like the running service.
 */
@Data
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    /** Market time zone; "today" and record ages are computed in it. */
    private ZoneId zone = ZoneId.of("Asia/Kolkata");

    /** Days before the query date in which a snapshot still counts as current. */
    private int snapshotWindowDays = 7;

    /** Product -> comparable product used when the product has no snapshot at all. */
    private Map<String, String> substitutes = new HashMap<>();

    /** Product -> 12 monthly multipliers, January first. */
    private Map<String, List<BigDecimal>> seasonalFactors = new HashMap<>();

    /** Overrides for {@link QualityGrade#getDefaultMultiplier()}. */
    private Map<QualityGrade, BigDecimal> qualityMultipliers = new EnumMap<>(QualityGrade.class);

    /** Stepped bulk discounts; the highest tier whose threshold is reached wins. */
    private List<BulkTier> bulkTiers = new ArrayList<>(List.of(
            new BulkTier(new BigDecimal("500"), new BigDecimal("0.95")),
            new BulkTier(new BigDecimal("2000"), new BigDecimal("0.90"))));

    /** Location -> fractional price offset of that region (0.10 = 10% dearer). */
    private Map<String, BigDecimal> locationOffsets = new HashMap<>();

    /** Unit -> price granularity used for counter-offer rounding. */
    private Map<String, BigDecimal> unitGranularity = new HashMap<>();

    private BigDecimal defaultGranularity = new BigDecimal("0.01");

    private Confidence confidence = new Confidence();
    private Risk risk = new Risk();
    private Fairness fairness = new Fairness();
    private Ethics ethics = new Ethics();
    private Cache cache = new Cache();
    private MarketData marketData = new MarketData();

    public BigDecimal qualityMultiplier(QualityGrade grade) {
        return qualityMultipliers.getOrDefault(grade, grade.getDefaultMultiplier());
    }

    public BigDecimal granularityFor(String unit) {
        if (unit == null) {
            return defaultGranularity;
        }
        return unitGranularity.getOrDefault(unit.toLowerCase(), defaultGranularity);
    }

    @Data
    public static class BulkTier {
        private BigDecimal minQuantity;
        private BigDecimal multiplier;

        public BulkTier() {
        }

        public BulkTier(BigDecimal minQuantity, BigDecimal multiplier) {
            this.minQuantity = minQuantity;
            this.multiplier = multiplier;
        }
    }

    @Data
    public static class Confidence {
        private int volatilityWindowDays = 30;
        private double defaultVolatility = 0.35;
        private double volatilityWeight = 1.0;
        private double stalenessWeight = 0.30;
        private int stalenessHorizonDays = 14;
        private double mediumQualityPenalty = 0.10;
        private double lowQualityPenalty = 0.25;
        private double intervalScale = 1.0;
        private double risingVolatilityWidening = 0.25;
        private double lowConfidenceThreshold = 0.30;
        /** Half-over-half mean change below which the series counts as flat. */
        private double trendStableChange = 0.02;
        /** Mean change at which trend strength saturates at 1. */
        private double trendFullStrengthChange = 0.10;
    }

    @Data
    public static class Risk {
        private double highVolatility = 0.30;
        private double mediumVolatility = 0.20;
        private double strongTrend = 0.70;
    }

    @Data
    public static class Fairness {
        private double maxDeviation = 0.35;
        private double fairThreshold = 0.05;
        private double directionalThreshold = 0.15;
        private double exploitativeThreshold = 0.35;
    }

    @Data
    public static class Ethics {
        private double criticalDeviation = 0.50;
        private int manipulationRunThreshold = 3;
        private int historyLimit = 50;
        private double squeezeThreshold = 0.15;
        private Duration historyWindow = Duration.ofDays(7);
    }

    @Data
    public static class Cache {
        private long refreshIntervalMs = 300_000;
        private int lookbackDays = 45;
    }

    @Data
    public static class MarketData {
        private String baseUrl = "http://localhost:8090";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
        private int maxRetries = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
    }
}
