package com.openmandi.pricing.core;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.FairnessAssessment;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.Verdict;
import com.openmandi.pricing.ethics.EthicsGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scores an offer against a price estimate. Each call stands alone; any
 * negotiation history is the ethics guard's input, not state held here.
 */
@Component
@RequiredArgsConstructor
public class FairnessScorer {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final PricingProperties properties;
    private final EthicsGuard ethicsGuard;
    private final NegotiationAdvisor advisor;

    public FairnessAssessment assess(Offer offer, PriceEstimate estimate) {
        validate(offer, estimate);
        PricingProperties.Fairness config = properties.getFairness();

        BigDecimal reference = estimate.getPointPrice();
        double raw = offer.rawDeviationFrom(reference);
        double deviation = offer.deviationFrom(reference);
        double magnitude = Math.abs(deviation);

        double score = 1 - Math.min(1, magnitude / config.getMaxDeviation());
        Verdict verdict = verdict(deviation);

        Offer counter = verdict == Verdict.FAIR ? null : counterOffer(offer, estimate);
        FairnessAssessment assessment = FairnessAssessment.builder()
                .offer(offer)
                .referencePrice(reference)
                .lowerBound(estimate.getLowerBound())
                .upperBound(estimate.getUpperBound())
                .score(score)
                .rawDeviationPct(raw)
                .deviationPct(deviation)
                .verdict(verdict)
                .counterOffer(counter)
                .advice(advisor.advise(offer, estimate, counter))
                .build();

        // Keeps the EXPLOITATIVE => flagged invariant even without a full guard pass
        return ethicsGuard.applyPredatoryRule(assessment);
    }

    Verdict verdict(double deviation) {
        PricingProperties.Fairness config = properties.getFairness();
        double magnitude = Math.abs(deviation);
        if (magnitude <= config.getFairThreshold()) {
            return Verdict.FAIR;
        }
        if (magnitude <= config.getDirectionalThreshold()) {
            return deviation > 0 ? Verdict.FAVORABLE : Verdict.UNFAVORABLE;
        }
        if (magnitude <= config.getExploitativeThreshold()) {
            return Verdict.UNFAVORABLE;
        }
        return Verdict.EXPLOITATIVE;
    }

    /**
     * Halfway from the fair price toward the offer, on the unit's price grid,
     * kept inside the confidence band. Proposed by the counterpart.
     */
    Offer counterOffer(Offer offer, PriceEstimate estimate) {
        BigDecimal point = estimate.getPointPrice();
        BigDecimal halfway = point.add(offer.getUnitPrice().subtract(point).divide(TWO));

        BigDecimal granularity = properties.granularityFor(estimate.getUnit());
        BigDecimal rounded = halfway.divide(granularity, 0, RoundingMode.HALF_UP).multiply(granularity);

        BigDecimal price = rounded.max(estimate.getLowerBound()).min(estimate.getUpperBound());

        return offer.toBuilder()
                .role(offer.getRole().counterpart())
                .unitPrice(price)
                .partyId(offer.getCounterpartId())
                .counterpartId(offer.getPartyId())
                .submittedAt(null)
                .build();
    }

    private void validate(Offer offer, PriceEstimate estimate) {
        validateOffer(offer);
        if (estimate == null || estimate.getPointPrice() == null || estimate.getPointPrice().signum() <= 0
                || estimate.getLowerBound() == null || estimate.getUpperBound() == null) {
            throw new InvalidInputException("a complete price estimate is required");
        }
        if (estimate.getLowerBound().compareTo(estimate.getPointPrice()) > 0
                || estimate.getPointPrice().compareTo(estimate.getUpperBound()) > 0) {
            throw new InvalidInputException(String.format("estimate band [%s, %s] does not contain point price %s",
                    estimate.getLowerBound().toPlainString(), estimate.getUpperBound().toPlainString(),
                    estimate.getPointPrice().toPlainString()));
        }
    }

    /**
     * Checks the offer on its own: role, positive unit price and quantity.
     */
    public void validateOffer(Offer offer) {
        if (offer == null) {
            throw new InvalidInputException("offer is required");
        }
        if (offer.getRole() == null) {
            throw new InvalidInputException("offer role is required");
        }
        if (offer.getUnitPrice() == null || offer.getUnitPrice().signum() <= 0) {
            throw new InvalidInputException("offer unit price must be positive, got " + offer.getUnitPrice());
        }
        if (offer.getQuantity() == null || offer.getQuantity().signum() <= 0) {
            throw new InvalidInputException("offer quantity must be positive, got " + offer.getQuantity());
        }
    }
}
