package com.orderbook.domain;

/**
 * Recoverable reasons for turning a command away. A rejected command leaves the book unchanged.
 */
public enum RejectReason {
    INVALID_PRICE("InvalidPrice"),
    INVALID_QUANTITY("InvalidQuantity"),
    DUPLICATE_IDENTIFIER("DuplicateIdentifier"),
    UNKNOWN_ORDER("UnknownOrder");

    private final String label;

    RejectReason(String label) {
        this.label = label;
    }

    /** Name used on the wire. */
    public String label() {
        return label;
    }
}
