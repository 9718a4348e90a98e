package com.openmandi.pricing.domain;

import com.openmandi.pricing.ethics.EthicsFlag;
import com.openmandi.pricing.ethics.FlagType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Outcome of scoring one offer. Invariant: an EXPLOITATIVE verdict always
 * carries at least one risk flag.
 */
@Value
@Builder(toBuilder = true)
public class FairnessAssessment {
    Offer offer;
    BigDecimal referencePrice;
    BigDecimal lowerBound;
    BigDecimal upperBound;
    double score;
    double rawDeviationPct;
    double deviationPct;
    Verdict verdict;
    Offer counterOffer; // null for FAIR offers
    NegotiationAdvice advice;
    @Singular
    Set<EthicsFlag> riskFlags;
    boolean requiresIntervention;

    public boolean hasFlag(FlagType type) {
        return riskFlags.stream().anyMatch(flag -> flag.getType() == type);
    }

    /**
     * True when the offer disadvantages the counterpart.
     */
    public boolean againstCounterpart() {
        return deviationPct > 0;
    }
}
