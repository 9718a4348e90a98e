package com.openmandi.pricing.ethics;

import com.openmandi.pricing.domain.Offer;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * What the caller knows about the negotiation beyond the offer itself.
 * {@code recentOffers} is ordered oldest first.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InteractionContext {
    String counterpartId;
    @Singular
    Set<VulnerabilityCohort> counterpartCohorts;
    @Singular
    List<Offer> recentOffers;

    public static InteractionContext empty() {
        return InteractionContext.builder().build();
    }

    public boolean counterpartVulnerable() {
        return !counterpartCohorts.isEmpty();
    }
}
