package com.openmandi.pricing.core;

public class InvalidInputException extends PricingException {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_INPUT";
    }
}
