package com.orderbook.domain;

/**
 * Side of the book an order rests on. BUY orders rest as bids, SELL orders as asks.
 */
public enum Side {
    BUY('B'),
    SELL('S');

    private final char code;

    Side(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static Side fromCode(String code) {
        if ("B".equalsIgnoreCase(code)) {
            return BUY;
        }
        if ("S".equalsIgnoreCase(code)) {
            return SELL;
        }
        throw new IllegalArgumentException("Unknown side: " + code);
    }
}
