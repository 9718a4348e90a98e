package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class EstimateRequest {
    String product;
    BigDecimal quantity;
    String location;
    QualityGrade qualityGrade;
    LocalDate date; // null means today
}
