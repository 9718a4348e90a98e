package com.openmandi.pricing.domain;

public enum Role {
    BUYER,
    SELLER;

    public Role counterpart() {
        return this == BUYER ? SELLER : BUYER;
    }

    /**
     * +1 when a higher price is in this role's interest.
     */
    public int priceInterestSign() {
        return this == SELLER ? 1 : -1;
    }
}
