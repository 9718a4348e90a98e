package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class PricePoint {
    LocalDate date;
    BigDecimal modalPrice;
}
