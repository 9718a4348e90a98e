package com.openmandi.pricing.api.model;

import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.ethics.InteractionContext;

public record AssessOfferRequest(
        Offer offer,
        PriceEstimate estimate,
        InteractionContext context
) {}
