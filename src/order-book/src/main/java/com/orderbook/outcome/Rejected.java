package com.orderbook.outcome;

import com.orderbook.domain.OrderId;
import com.orderbook.domain.RejectReason;

/**
 * Command turned away without touching the book. orderId is null when the command carried none.
 */
public record Rejected(OrderId orderId, RejectReason reason) implements OutcomeRecord {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRejected(this);
    }
}
