package com.orderbook.domain;

/**
 * Order entity with fill tracking. Only remainingQuantity changes after construction;
 * it is decremented by the matcher through {@link OrderLedger#decrement} for resting orders
 * and directly through {@link #fill} for the incoming order.
 */
public class Order {

    private final OrderId id;
    private final Side side;
    private final Price limitPrice;
    private final long originalQuantity;
    private final long sequence;
    private long remainingQuantity;

    public Order(OrderId id, Side side, Price limitPrice, long quantity, long sequence) {
        this.id = id;
        this.side = side;
        this.limitPrice = limitPrice;
        this.originalQuantity = quantity;
        this.remainingQuantity = quantity;
        this.sequence = sequence;
    }

    /**
     * Fill this order by the given quantity.
     *
     * @throws BookInvariantViolationException if qty is not positive or exceeds the remaining quantity
     */
    public void fill(long qty) {
        if (qty <= 0) {
            throw new BookInvariantViolationException(
                    "Fill quantity must be positive: " + qty + " for order " + id);
        }
        if (qty > remainingQuantity) {
            throw new BookInvariantViolationException(
                    "Fill quantity " + qty + " exceeds remaining " + remainingQuantity + " for order " + id);
        }
        remainingQuantity -= qty;
    }

    public boolean isFilled() {
        return remainingQuantity == 0;
    }

    public OrderId getId() {
        return id;
    }

    public Side getSide() {
        return side;
    }

    public Price getLimitPrice() {
        return limitPrice;
    }

    public long getOriginalQuantity() {
        return originalQuantity;
    }

    public long getRemainingQuantity() {
        return remainingQuantity;
    }

    public long getFilledQuantity() {
        return originalQuantity - remainingQuantity;
    }

    /** Arrival sequence number; lower wins at equal price. */
    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", side=" + side +
                ", price=" + limitPrice +
                ", remaining=" + remainingQuantity +
                "/" + originalQuantity +
                ", seq=" + sequence +
                '}';
    }
}
