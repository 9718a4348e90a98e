package com.openmandi.pricing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Guidance for the party receiving an offer ({@code audience}, the
 * counterpart of the submitter).
 */
@Value
@Builder
@Jacksonized
public class NegotiationAdvice {
    Role audience;
    NegotiationStrategy strategy;
    @Singular
    List<String> points;
    @Singular
    List<String> tips;
}
