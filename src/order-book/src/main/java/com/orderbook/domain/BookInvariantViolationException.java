package com.orderbook.domain;

/**
 * Logic fault: the ledger and ladder disagree, or a fill exceeded the remaining quantity.
 * Never caused by caller input. Processing must stop once this is thrown.
 */
public class BookInvariantViolationException extends IllegalStateException {

    public BookInvariantViolationException(String message) {
        super(message);
    }
}
