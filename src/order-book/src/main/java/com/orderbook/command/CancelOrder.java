package com.orderbook.command;

import com.orderbook.domain.OrderId;

public record CancelOrder(OrderId orderId) implements Command {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCancelOrder(this);
    }
}
