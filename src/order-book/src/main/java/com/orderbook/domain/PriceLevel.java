package com.orderbook.domain;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * FIFO queue of order identifiers at a single price point.
 * Orders are matched in time priority (first-in, first-out).
 *
 * Backed by a LinkedHashSet: insertion order gives the FIFO, the hash index gives
 * O(1) removal of an arbitrary identifier on cancel. Only identifiers are held here;
 * order state lives in the {@link OrderLedger}.
 */
public class PriceLevel {

    private final Price price;
    private final LinkedHashSet<OrderId> orders;

    public PriceLevel(Price price) {
        this.price = price;
        this.orders = new LinkedHashSet<>();
    }

    public void addOrder(OrderId orderId) {
        if (!orders.add(orderId)) {
            throw new BookInvariantViolationException(
                    "Order " + orderId + " already queued at price " + price);
        }
    }

    /** Oldest identifier at this price, or null if the level is empty. */
    public OrderId peekFirst() {
        return orders.isEmpty() ? null : orders.iterator().next();
    }

    /** Removes and returns the oldest identifier, or null if the level is empty. */
    public OrderId pollFirst() {
        Iterator<OrderId> it = orders.iterator();
        if (!it.hasNext()) {
            return null;
        }
        OrderId first = it.next();
        it.remove();
        return first;
    }

    /**
     * Remove a specific identifier. Used for cancel operations.
     *
     * @return true if the identifier was queued here
     */
    public boolean removeOrder(OrderId orderId) {
        return orders.remove(orderId);
    }

    public boolean contains(OrderId orderId) {
        return orders.contains(orderId);
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public int getOrderCount() {
        return orders.size();
    }

    public Price getPrice() {
        return price;
    }

    /** Read-only view in time priority order. */
    public Set<OrderId> getOrderIds() {
        return Collections.unmodifiableSet(orders);
    }
}
