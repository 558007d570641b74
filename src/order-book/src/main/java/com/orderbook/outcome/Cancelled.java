package com.orderbook.outcome;

import com.orderbook.domain.OrderId;

public record Cancelled(OrderId orderId) implements OutcomeRecord {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCancelled(this);
    }
}
