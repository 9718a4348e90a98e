package com.openmandi.pricing.core;

public class NoComparableDataException extends PricingException {

    private final String product;

    public NoComparableDataException(String product, String location) {
        super("No market snapshot or comparable product for " + product + " at " + location);
        this.product = product;
    }

    public String getProduct() {
        return product;
    }

    @Override
    public String getCode() {
        return "NO_COMPARABLE_DATA";
    }
}
