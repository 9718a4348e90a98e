package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FactorStatement {
    FactorType factor;
    Direction direction;
    String descriptor;
    String text;
}
