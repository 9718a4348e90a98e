package com.openmandi.pricing.api.model;

public record ErrorResponse(
        String error,
        String message
) {}
