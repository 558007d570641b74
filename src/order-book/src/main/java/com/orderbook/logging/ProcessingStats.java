package com.orderbook.logging;

import com.orderbook.domain.Quantities;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between the processing thread (writer) and the
 * periodic stats logger thread (reader). Book depth is published here by the processing
 * thread so the logger never touches the book itself.
 */
public class ProcessingStats {

    public final AtomicLong newOrders = new AtomicLong();     // accepted only
    public final AtomicLong cancels = new AtomicLong();
    public final AtomicLong flushes = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong tradedQuantity = new AtomicLong();
    public final AtomicLong rejected = new AtomicLong();

    public final AtomicLong bidOrders = new AtomicLong();
    public final AtomicLong askOrders = new AtomicLong();
    public final AtomicLong bidLevels = new AtomicLong();
    public final AtomicLong askLevels = new AtomicLong();

    /** Add a trade's quantity to the running total, saturating at Long.MAX_VALUE. */
    public void addTradedQuantity(long quantity) {
        tradedQuantity.accumulateAndGet(quantity, Quantities::saturatedAdd);
    }

    public long totalCommands() {
        return newOrders.get() + cancels.get() + flushes.get() + rejected.get();
    }
}
