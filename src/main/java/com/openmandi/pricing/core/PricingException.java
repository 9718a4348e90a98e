package com.openmandi.pricing.core;

/**
 * Base of the typed failures the engine surfaces. The engine never retries;
 * retry and cache fallback are the caller's call.
 */
public abstract class PricingException extends RuntimeException {

    protected PricingException(String message) {
        super(message);
    }

    public abstract String getCode();
}
