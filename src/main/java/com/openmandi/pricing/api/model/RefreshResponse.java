package com.openmandi.pricing.api.model;

import java.time.Instant;

public record RefreshResponse(
        boolean refreshed,
        long generation,
        int snapshots,
        Instant builtAt
) {}
