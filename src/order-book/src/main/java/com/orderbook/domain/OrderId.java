package com.orderbook.domain;

/**
 * Value object wrapping the caller-supplied order identifier.
 * Identifiers are opaque tokens; the book never interprets them.
 */
public record OrderId(String value) {

    public OrderId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order identifier must be a non-empty token");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
