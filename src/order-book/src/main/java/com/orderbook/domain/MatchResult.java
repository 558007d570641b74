package com.orderbook.domain;

/**
 * Represents a single fill (trade) between a taker (incoming) order
 * and a maker (resting) order. Executes at the maker's resting price.
 */
public class MatchResult {

    private final OrderId takerOrderId;
    private final OrderId makerOrderId;
    private final Price executionPrice;
    private final long executionQuantity;

    public MatchResult(OrderId takerOrderId, OrderId makerOrderId,
                       Price executionPrice, long executionQuantity) {
        this.takerOrderId = takerOrderId;
        this.makerOrderId = makerOrderId;
        this.executionPrice = executionPrice;
        this.executionQuantity = executionQuantity;
    }

    public OrderId getTakerOrderId() {
        return takerOrderId;
    }

    public OrderId getMakerOrderId() {
        return makerOrderId;
    }

    public Price getExecutionPrice() {
        return executionPrice;
    }

    public long getExecutionQuantity() {
        return executionQuantity;
    }
}
