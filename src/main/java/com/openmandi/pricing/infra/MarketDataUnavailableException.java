package com.openmandi.pricing.infra;

import com.openmandi.pricing.core.PricingException;

public class MarketDataUnavailableException extends PricingException {

    public MarketDataUnavailableException(String message) {
        super(message);
    }

    public MarketDataUnavailableException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }

    @Override
    public String getCode() {
        return "MARKET_DATA_UNAVAILABLE";
    }
}
