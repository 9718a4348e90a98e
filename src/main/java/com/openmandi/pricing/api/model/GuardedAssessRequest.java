package com.openmandi.pricing.api.model;

import com.openmandi.pricing.domain.EstimateInputs;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.QualityGrade;
import com.openmandi.pricing.ethics.InteractionContext;

import java.time.LocalDate;

public record GuardedAssessRequest(
        Offer offer,
        LocalDate date,
        QualityGrade qualityGrade,
        InteractionContext context
) {
    public EstimateInputs inputs() {
        return EstimateInputs.builder()
                .date(date)
                .qualityGrade(qualityGrade)
                .build();
    }
}
