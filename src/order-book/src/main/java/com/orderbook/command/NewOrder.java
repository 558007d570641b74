package com.orderbook.command;

import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;

/**
 * Submit a limit order. Price and quantity are carried unchecked; the processor rejects
 * non-positive values.
 */
public record NewOrder(OrderId orderId, Side side, Price price, long quantity) implements Command {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNewOrder(this);
    }
}
