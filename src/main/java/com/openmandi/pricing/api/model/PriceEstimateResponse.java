package com.openmandi.pricing.api.model;

import com.openmandi.pricing.domain.FactorStatement;
import com.openmandi.pricing.domain.PriceEstimate;

import java.util.List;

public record PriceEstimateResponse(
        PriceEstimate estimate,
        List<FactorStatement> explanation,
        String summary
) {}
