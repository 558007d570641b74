package com.orderbook.outcome;

import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;

/**
 * One execution. price is always the maker's resting price.
 */
public record Trade(OrderId takerOrderId, OrderId makerOrderId, Price price, long quantity)
        implements OutcomeRecord {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTrade(this);
    }
}
