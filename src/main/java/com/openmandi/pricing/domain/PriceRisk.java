package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PriceRisk {
    RiskLevel level;
    @Singular
    List<String> reasons;
    String recommendation;
}
