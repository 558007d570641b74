package com.orderbook.domain;

/**
 * Value object representing a limit price in integer minor units.
 * Example: 15000 = 150.00 with two decimal places.
 */
public record Price(long minorUnits) implements Comparable<Price> {

    public boolean isPositive() {
        return minorUnits > 0;
    }

    @Override
    public int compareTo(Price other) {
        return Long.compare(this.minorUnits, other.minorUnits);
    }

    @Override
    public String toString() {
        return Long.toString(minorUnits);
    }
}
