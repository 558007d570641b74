package com.orderbook.outcome;

import com.orderbook.domain.Price;
import com.orderbook.domain.Side;

/**
 * Best price and total resting quantity at that price for one side.
 * price is null and totalQuantity 0 when the side is empty.
 */
public record TopOfBook(Side side, Price price, long totalQuantity) implements OutcomeRecord {

    public static TopOfBook empty(Side side) {
        return new TopOfBook(side, null, 0);
    }

    public boolean isEmpty() {
        return price == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTopOfBook(this);
    }
}
