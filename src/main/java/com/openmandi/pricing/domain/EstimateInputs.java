package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Estimate parameters a guarded assessment cannot read off the offer itself.
 * Both are optional: the date defaults to today, the grade to the offer's own
 * grade and then to STANDARD.
 */
@Value
@Builder
@Jacksonized
public class EstimateInputs {
    LocalDate date;
    QualityGrade qualityGrade;

    public static EstimateInputs none() {
        return EstimateInputs.builder().build();
    }
}
