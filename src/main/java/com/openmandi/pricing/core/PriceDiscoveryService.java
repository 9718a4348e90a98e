package com.openmandi.pricing.core;

import com.openmandi.pricing.audit.NegotiationAuditLogger;
import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.EstimateInputs;
import com.openmandi.pricing.domain.EstimateRequest;
import com.openmandi.pricing.domain.FactorStatement;
import com.openmandi.pricing.domain.FairnessAssessment;
import com.openmandi.pricing.domain.MarketSnapshot;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.QualityGrade;
import com.openmandi.pricing.ethics.EthicsGuard;
import com.openmandi.pricing.ethics.InteractionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for price queries and offer assessments. Each call reads one
 * cache generation and holds no state between calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceDiscoveryService {

    private final MarketSnapshotCache cache;
    private final PricingModel pricingModel;
    private final ExplanationGenerator explanationGenerator;
    private final FairnessScorer fairnessScorer;
    private final EthicsGuard ethicsGuard;
    private final OfferHistoryRepository offerHistoryRepository;
    private final MarketSnapshotRepository snapshotRepository;
    private final NegotiationAuditLogger auditLogger;
    private final PricingProperties properties;
    private final Clock clock;

    public PriceEstimate getPriceEstimate(String product, BigDecimal quantity, String location,
                                          QualityGrade qualityGrade, LocalDate date) {
        long start = System.currentTimeMillis();
        EstimateRequest request = EstimateRequest.builder()
                .product(product)
                .quantity(quantity)
                .location(location)
                .qualityGrade(qualityGrade)
                .date(date)
                .build();

        PriceEstimate estimate = estimateWithFetchOnMiss(request);
        if (estimate.isDegradedConfidence()) {
            log.warn("Low confidence estimate for {} at {}: confidence={} data quality={} source={}/{}",
                    product, location, String.format("%.2f", estimate.getConfidence()),
                    estimate.getDataQuality(), estimate.getSourceProduct(), estimate.getSourceLocation());
        }
        auditLogger.logEstimate(requestId(), estimate, System.currentTimeMillis() - start);
        return estimate;
    }

    /**
     * On a cache miss, asks the market-data store for the exact record once,
     * merges it into a new cache generation and prices again.
     */
    private PriceEstimate estimateWithFetchOnMiss(EstimateRequest request) {
        try {
            return pricingModel.estimate(request, cache.current());
        } catch (NoComparableDataException e) {
            LocalDate date = request.getDate() != null
                    ? request.getDate()
                    : LocalDate.now(clock.withZone(properties.getZone()));
            Optional<MarketSnapshot> fetched = snapshotRepository.fetchSnapshot(
                    request.getProduct(), request.getLocation(), date);
            if (fetched.isEmpty()) {
                throw e;
            }
            log.info("Cache miss for {} at {}, fetched snapshot dated {}",
                    request.getProduct(), request.getLocation(), fetched.get().getDate());
            return pricingModel.estimate(request, cache.updateSnapshot(fetched.get()));
        }
    }

    public List<FactorStatement> explainEstimate(PriceEstimate estimate) {
        if (estimate == null) {
            throw new InvalidInputException("estimate is required");
        }
        return explanationGenerator.explain(estimate);
    }

    public String summarizeEstimate(PriceEstimate estimate) {
        if (estimate == null) {
            throw new InvalidInputException("estimate is required");
        }
        return explanationGenerator.summarize(estimate);
    }

    public FairnessAssessment assessOffer(Offer offer, PriceEstimate estimate, InteractionContext context) {
        long start = System.currentTimeMillis();
        FairnessAssessment scored = fairnessScorer.assess(offer, estimate);
        FairnessAssessment assessment = ethicsGuard.guard(scored, context != null ? context : InteractionContext.empty());
        auditLogger.logAssessment(requestId(), assessment, System.currentTimeMillis() - start);
        return assessment;
    }

    /**
     * Prices the offer's own product, quantity and location, then scores and
     * guards the offer against that estimate.
     */
    public FairnessAssessment guardedAssess(Offer offer, EstimateInputs inputs, InteractionContext context) {
        fairnessScorer.validateOffer(offer);
        EstimateInputs in = inputs != null ? inputs : EstimateInputs.none();
        QualityGrade grade = in.getQualityGrade() != null ? in.getQualityGrade()
                : offer.getQualityGrade() != null ? offer.getQualityGrade()
                : QualityGrade.STANDARD;

        PriceEstimate estimate = getPriceEstimate(
                offer.getProduct(), offer.getQuantity(), offer.getLocation(), grade, in.getDate());
        return assessOffer(offer, estimate, withHistory(offer, context));
    }

    private InteractionContext withHistory(Offer offer, InteractionContext context) {
        InteractionContext ctx = context != null ? context : InteractionContext.empty();
        String counterpart = ctx.getCounterpartId() != null ? ctx.getCounterpartId() : offer.getCounterpartId();
        if (counterpart == null || !ctx.getRecentOffers().isEmpty()) {
            return ctx;
        }
        List<Offer> history = offerHistoryRepository.fetchHistory(
                offer.getProduct(), counterpart, properties.getEthics().getHistoryWindow());
        log.debug("Loaded {} earlier offers toward {} on {}", history.size(), counterpart, offer.getProduct());
        return ctx.toBuilder()
                .counterpartId(counterpart)
                .recentOffers(history)
                .build();
    }

    private static String requestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
