package com.openmandi.pricing.core;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.DataQuality;
import com.openmandi.pricing.domain.EstimateRequest;
import com.openmandi.pricing.domain.FactorType;
import com.openmandi.pricing.domain.MarketSnapshot;
import com.openmandi.pricing.domain.MarketTrend;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.PriceFactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives a point price from the best-matching snapshot and adjusts it by
 * seasonal, quality, bulk and location factors, in that order. Pure: the
 * result depends only on the request and the snapshot generation passed in.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PricingModel {

    private static final int MONTHS = 12;
    private static final int FACTOR_SCALE = 4;

    private final PricingProperties properties;
    private final ConfidenceEstimator confidenceEstimator;
    private final MarketRiskAssessor riskAssessor;
    private final Clock clock;

    public PriceEstimate estimate(EstimateRequest request, SnapshotIndex index) {
        validate(request);

        LocalDate asOf = request.getDate() != null
                ? request.getDate()
                : LocalDate.now(clock.withZone(properties.getZone()));
        LocalDate from = asOf.minusDays(properties.getSnapshotWindowDays());

        Selection selection = select(index, request.getProduct(), request.getLocation(), from, asOf)
                .or(() -> substitute(index, request, from, asOf))
                .orElseThrow(() -> new NoComparableDataException(request.getProduct(), request.getLocation()));

        MarketSnapshot snapshot = selection.snapshot;
        DataQuality baseQuality = snapshot.getDataQuality() != null ? snapshot.getDataQuality() : DataQuality.LOW;
        DataQuality dataQuality = baseQuality.downgrade(selection.fallbackSteps);

        List<PriceFactor> factors = new ArrayList<>();
        BigDecimal price = snapshot.getModalPrice();

        price = apply(price, factors, FactorType.SEASONAL,
                seasonalMultiplier(request.getProduct(), snapshot.getProduct(), asOf));
        price = apply(price, factors, FactorType.QUALITY,
                properties.qualityMultiplier(request.getQualityGrade()));
        price = apply(price, factors, FactorType.QUANTITY,
                bulkMultiplier(request.getQuantity()));
        price = apply(price, factors, FactorType.LOCATION,
                locationMultiplier(request.getLocation(), snapshot.getLocation()));

        BigDecimal pointPrice = price.setScale(2, RoundingMode.HALF_UP);

        VolatilityReading volatility = confidenceEstimator.volatilityOf(snapshot, asOf);
        ConfidenceBand band = confidenceEstimator.bound(pointPrice, snapshot, volatility, dataQuality, asOf);
        boolean degraded = band.getConfidence() < properties.getConfidence().getLowConfidenceThreshold();
        MarketTrend trend = confidenceEstimator.trendOf(snapshot, asOf);

        log.debug("Estimated {} x{} {} at {}: modal={} point={} [{}, {}] confidence={} source={}/{}",
                request.getProduct(), request.getQuantity(), request.getQualityGrade(), request.getLocation(),
                snapshot.getModalPrice(), pointPrice, band.getLower(), band.getUpper(),
                band.getConfidence(), snapshot.getProduct(), snapshot.getLocation());

        return PriceEstimate.builder()
                .product(request.getProduct())
                .location(request.getLocation())
                .unit(snapshot.getUnit())
                .quantity(request.getQuantity())
                .qualityGrade(request.getQualityGrade())
                .asOf(asOf)
                .sourceProduct(snapshot.getProduct())
                .sourceLocation(snapshot.getLocation())
                .basePrice(snapshot.getModalPrice())
                .pointPrice(pointPrice)
                .lowerBound(band.getLower())
                .upperBound(band.getUpper())
                .confidence(band.getConfidence())
                .volatility(volatility.getCoefficient())
                .volatilityRising(volatility.isRising())
                .dataQuality(dataQuality)
                .degradedConfidence(degraded)
                .trend(trend)
                .risk(riskAssessor.assess(volatility, trend, degraded))
                .factors(factors)
                .build();
    }

    private void validate(EstimateRequest request) {
        if (request == null) {
            throw new InvalidInputException("estimate request is required");
        }
        if (request.getProduct() == null || request.getProduct().isBlank()) {
            throw new InvalidInputException("product is required");
        }
        if (request.getLocation() == null || request.getLocation().isBlank()) {
            throw new InvalidInputException("location is required");
        }
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new InvalidInputException("quantity must be positive, got " + request.getQuantity());
        }
        if (request.getQualityGrade() == null) {
            throw new InvalidInputException("quality grade is required");
        }
    }

    private Optional<Selection> select(SnapshotIndex index, String product, String location,
                                       LocalDate from, LocalDate to) {
        Optional<MarketSnapshot> exact = index.exact(product, location, from, to);
        if (exact.isPresent()) {
            return Optional.of(new Selection(exact.get(), 0));
        }
        return index.anyLocation(product, from, to).map(s -> new Selection(s, 1));
    }

    private Optional<Selection> substitute(SnapshotIndex index, EstimateRequest request,
                                           LocalDate from, LocalDate to) {
        String comparable = properties.getSubstitutes().get(SnapshotIndex.key(request.getProduct()));
        if (comparable == null || SnapshotIndex.key(comparable).equals(SnapshotIndex.key(request.getProduct()))) {
            return Optional.empty();
        }
        Optional<Selection> found = select(index, comparable, request.getLocation(), from, to)
                .map(s -> new Selection(s.snapshot, s.fallbackSteps + 1));
        found.ifPresent(s -> log.info("No snapshot for {}; priced from comparable product {}",
                request.getProduct(), comparable));
        return found;
    }

    private static BigDecimal apply(BigDecimal price, List<PriceFactor> factors, FactorType type,
                                    BigDecimal multiplier) {
        if (multiplier.compareTo(BigDecimal.ONE) == 0) {
            return price;
        }
        factors.add(PriceFactor.of(type, multiplier));
        return price.multiply(multiplier);
    }

    private BigDecimal seasonalMultiplier(String product, String sourceProduct, LocalDate asOf) {
        List<BigDecimal> table = properties.getSeasonalFactors().get(SnapshotIndex.key(product));
        if (table == null) {
            table = properties.getSeasonalFactors().get(SnapshotIndex.key(sourceProduct));
        }
        if (table == null || table.size() != MONTHS) {
            return BigDecimal.ONE;
        }
        BigDecimal multiplier = table.get(asOf.getMonthValue() - 1);
        return multiplier != null ? multiplier : BigDecimal.ONE;
    }

    private BigDecimal bulkMultiplier(BigDecimal quantity) {
        BigDecimal multiplier = BigDecimal.ONE;
        BigDecimal reached = null;
        for (PricingProperties.BulkTier tier : properties.getBulkTiers()) {
            if (quantity.compareTo(tier.getMinQuantity()) >= 0
                    && (reached == null || tier.getMinQuantity().compareTo(reached) > 0)) {
                reached = tier.getMinQuantity();
                multiplier = tier.getMultiplier();
            }
        }
        return multiplier;
    }

    /**
     * Moves the price from the snapshot's market to the requested one. Same
     * market means no differential.
     */
    private BigDecimal locationMultiplier(String requested, String source) {
        if (SnapshotIndex.key(requested).equals(SnapshotIndex.key(source))) {
            return BigDecimal.ONE;
        }
        BigDecimal target = BigDecimal.ONE.add(offset(requested));
        BigDecimal origin = BigDecimal.ONE.add(offset(source));
        return target.divide(origin, MathContext.DECIMAL64).setScale(FACTOR_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal offset(String location) {
        return properties.getLocationOffsets().getOrDefault(SnapshotIndex.key(location), BigDecimal.ZERO);
    }

    private static final class Selection {
        private final MarketSnapshot snapshot;
        private final int fallbackSteps;

        private Selection(MarketSnapshot snapshot, int fallbackSteps) {
            this.snapshot = snapshot;
            this.fallbackSteps = fallbackSteps;
        }
    }
}
