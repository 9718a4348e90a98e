package com.openmandi.pricing.domain;

public enum Direction {
    UP("+"),
    DOWN("-");

    private final String symbol;

    Direction(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
