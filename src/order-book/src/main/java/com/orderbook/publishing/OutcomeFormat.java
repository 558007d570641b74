package com.orderbook.publishing;

/**
 * Line formats for outcome records.
 */
public enum OutcomeFormat {
    CSV,
    JSON;

    public OutcomeFormatter newFormatter() {
        return this == JSON ? new JsonOutcomeFormatter() : new CsvOutcomeFormatter();
    }

    public static OutcomeFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format: " + name + " (expected csv or json)");
        }
    }
}
