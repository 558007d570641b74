package com.orderbook.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Both sides of price levels for one instrument.
 *
 * Bids: TreeMap with Comparator.reverseOrder() so firstKey() = highest bid.
 * Asks: TreeMap with natural ordering so firstKey() = lowest ask.
 * Levels are created on the first rest at a price and removed as soon as they empty.
 */
public class PriceLadder {

    private final TreeMap<Price, PriceLevel> bids = new TreeMap<>(Comparator.reverseOrder());
    private final TreeMap<Price, PriceLevel> asks = new TreeMap<>();

    /**
     * Append an identifier to the back of the queue at the given price, creating the level if needed.
     */
    public void rest(Side side, Price price, OrderId orderId) {
        sideOf(side).computeIfAbsent(price, PriceLevel::new).addOrder(orderId);
    }

    /** Best level for the side, or null if the side is empty. */
    public PriceLevel best(Side side) {
        Map.Entry<Price, PriceLevel> entry = sideOf(side).firstEntry();
        return entry != null ? entry.getValue() : null;
    }

    /**
     * Remove and return the oldest identifier at the price, dropping the level if it empties.
     */
    public OrderId popFront(Side side, Price price) {
        TreeMap<Price, PriceLevel> book = sideOf(side);
        PriceLevel level = book.get(price);
        if (level == null || level.isEmpty()) {
            throw new BookInvariantViolationException("No " + side + " level at price " + price);
        }
        OrderId head = level.pollFirst();
        if (level.isEmpty()) {
            book.remove(price);
        }
        return head;
    }

    /**
     * Remove a specific identifier from the level at the price, dropping the level if it empties.
     */
    public void remove(Side side, Price price, OrderId orderId) {
        TreeMap<Price, PriceLevel> book = sideOf(side);
        PriceLevel level = book.get(price);
        if (level == null || !level.removeOrder(orderId)) {
            throw new BookInvariantViolationException(
                    "Order " + orderId + " not queued at " + side + " price " + price);
        }
        if (level.isEmpty()) {
            book.remove(price);
        }
    }

    public void clear() {
        bids.clear();
        asks.clear();
    }

    public int levelCount(Side side) {
        return sideOf(side).size();
    }

    /** Number of resting orders on the side across all levels. */
    public int orderCount(Side side) {
        int depth = 0;
        for (PriceLevel level : sideOf(side).values()) {
            depth += level.getOrderCount();
        }
        return depth;
    }

    /** Levels of one side, best price first. */
    public Collection<PriceLevel> levels(Side side) {
        return Collections.unmodifiableCollection(sideOf(side).values());
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    private TreeMap<Price, PriceLevel> sideOf(Side side) {
        return side == Side.BUY ? bids : asks;
    }
}
