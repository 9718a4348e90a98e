package com.openmandi.pricing.core;

import com.openmandi.pricing.domain.NegotiationAdvice;
import com.openmandi.pricing.domain.NegotiationStrategy;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.Role;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Advice for the party who receives an offer, based on where the offered
 * price sits against the estimate's band.
 */
@Component
public class NegotiationAdvisor {

    public NegotiationAdvice advise(Offer offer, PriceEstimate estimate, Offer counterOffer) {
        Role audience = offer.getRole().counterpart();
        BigDecimal price = offer.getUnitPrice();
        BigDecimal target = counterOffer != null ? counterOffer.getUnitPrice() : estimate.getPointPrice();

        NegotiationAdvice.NegotiationAdviceBuilder advice = NegotiationAdvice.builder().audience(audience);
        if (audience == Role.BUYER) {
            if (price.compareTo(estimate.getUpperBound()) > 0) {
                advice.strategy(NegotiationStrategy.AGGRESSIVE)
                        .point("The asking price is above the likely market range")
                        .point("Counter with around " + target.toPlainString() + " per " + unit(estimate));
            } else if (price.compareTo(estimate.getPointPrice()) > 0) {
                advice.strategy(NegotiationStrategy.MODERATE)
                        .point("The asking price is above the fair price, there is room to negotiate down");
            } else {
                advice.strategy(NegotiationStrategy.CONSERVATIVE)
                        .point("The asking price is at or below the fair price");
            }
            advice.tip("Check the quality of the produce before agreeing");
        } else {
            if (price.compareTo(estimate.getLowerBound()) < 0) {
                advice.strategy(NegotiationStrategy.AGGRESSIVE)
                        .point("Do not accept this offer, it is below the likely market range")
                        .point("Ask for at least " + estimate.getLowerBound().toPlainString() + " per " + unit(estimate));
            } else if (price.compareTo(estimate.getPointPrice()) < 0) {
                advice.strategy(NegotiationStrategy.MODERATE)
                        .point("The offer is below the fair price, ask for a little more");
            } else {
                advice.strategy(NegotiationStrategy.CONSERVATIVE)
                        .point("The offer is at or above the fair price");
            }
            advice.tip("Highlight the quality of your produce");
        }
        return advice
                .tip("Stay polite and respectful")
                .tip("Be prepared to walk away if the price is not right")
                .tip("Payment terms and delivery matter as well as price")
                .build();
    }

    private static String unit(PriceEstimate estimate) {
        return estimate.getUnit() != null ? estimate.getUnit() : "unit";
    }
}
