package com.orderbook.logging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingStatsTest {

    @Test
    void tradedQuantityAccumulates() {
        ProcessingStats stats = new ProcessingStats();

        stats.addTradedQuantity(4);
        stats.addTradedQuantity(6);

        assertEquals(10, stats.tradedQuantity.get());
    }

    @Test
    void tradedQuantitySaturatesAtLongMax() {
        ProcessingStats stats = new ProcessingStats();

        stats.addTradedQuantity(Long.MAX_VALUE);
        stats.addTradedQuantity(1);

        assertEquals(Long.MAX_VALUE, stats.tradedQuantity.get());
    }
}
