package com.orderbook.outcome;

public record Flushed() implements OutcomeRecord {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFlushed(this);
    }
}
