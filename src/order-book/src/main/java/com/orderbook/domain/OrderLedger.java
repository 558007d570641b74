package com.orderbook.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;

/**
 * Owns every live order by identifier. Single source of truth for order attributes
 * and remaining quantity; price levels only hold identifiers that point back here.
 *
 * Identifiers that have left the book (filled or cancelled) are remembered until the
 * next {@link #clear()} so they cannot be reused for a different order.
 */
public class OrderLedger {

    private final HashMap<OrderId, Order> liveOrders = new HashMap<>();
    private final HashSet<OrderId> retiredIds = new HashSet<>();

    /**
     * @throws OrderRejectedException DUPLICATE_IDENTIFIER if the identifier is live or was used since the last clear
     */
    public void insert(Order order) throws OrderRejectedException {
        OrderId id = order.getId();
        if (isKnown(id)) {
            throw new OrderRejectedException(id, RejectReason.DUPLICATE_IDENTIFIER);
        }
        if (order.getRemainingQuantity() <= 0) {
            throw new BookInvariantViolationException("Cannot insert exhausted order " + order);
        }
        liveOrders.put(id, order);
    }

    /**
     * @throws OrderRejectedException UNKNOWN_ORDER if the identifier is not live
     */
    public Order get(OrderId id) throws OrderRejectedException {
        Order order = liveOrders.get(id);
        if (order == null) {
            throw new OrderRejectedException(id, RejectReason.UNKNOWN_ORDER);
        }
        return order;
    }

    /**
     * Removes a live order. The identifier stays retired until the next clear.
     *
     * @throws OrderRejectedException UNKNOWN_ORDER if the identifier is not live
     */
    public Order remove(OrderId id) throws OrderRejectedException {
        Order order = liveOrders.remove(id);
        if (order == null) {
            throw new OrderRejectedException(id, RejectReason.UNKNOWN_ORDER);
        }
        retiredIds.add(id);
        return order;
    }

    /**
     * Reduce the remaining quantity of a live order. The order is dropped from the ledger
     * when it reaches zero; the caller must then detach it from its price level.
     *
     * @return true if the order was fully filled and removed
     * @throws BookInvariantViolationException if the order is not live or qty is out of range
     */
    public boolean decrement(OrderId id, long qty) {
        Order order = liveOrders.get(id);
        if (order == null) {
            throw new BookInvariantViolationException("Decrement of order " + id + " missing from ledger");
        }
        order.fill(qty);
        if (order.isFilled()) {
            liveOrders.remove(id);
            retiredIds.add(id);
            return true;
        }
        return false;
    }

    /** Marks an identifier as used by an order that never rested (filled on entry). */
    public void retire(OrderId id) {
        if (liveOrders.containsKey(id)) {
            throw new BookInvariantViolationException("Cannot retire live order " + id);
        }
        retiredIds.add(id);
    }

    /** Live order, or null. For callers that treat absence as a fault rather than a rejection. */
    public Order find(OrderId id) {
        return liveOrders.get(id);
    }

    public boolean contains(OrderId id) {
        return liveOrders.containsKey(id);
    }

    /** True if the identifier is live or was used since the last clear. */
    public boolean isKnown(OrderId id) {
        return liveOrders.containsKey(id) || retiredIds.contains(id);
    }

    public int size() {
        return liveOrders.size();
    }

    public boolean isEmpty() {
        return liveOrders.isEmpty();
    }

    public Collection<Order> orders() {
        return Collections.unmodifiableCollection(liveOrders.values());
    }

    public void clear() {
        liveOrders.clear();
        retiredIds.clear();
    }
}
