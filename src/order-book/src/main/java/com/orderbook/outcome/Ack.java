package com.orderbook.outcome;

import com.orderbook.domain.OrderId;

/**
 * Final record for an accepted new order. restingQuantity is 0 when the order filled on entry.
 */
public record Ack(OrderId orderId, long filledQuantity, long restingQuantity) implements OutcomeRecord {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAck(this);
    }
}
