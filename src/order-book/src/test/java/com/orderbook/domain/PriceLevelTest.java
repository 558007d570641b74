package com.orderbook.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceLevelTest {

    private static final OrderId A = new OrderId("a");
    private static final OrderId B = new OrderId("b");
    private static final OrderId C = new OrderId("c");

    @Test
    void keepsArrivalOrder() {
        PriceLevel level = new PriceLevel(new Price(100));
        level.addOrder(A);
        level.addOrder(B);
        level.addOrder(C);

        assertEquals(A, level.peekFirst());
        assertEquals(A, level.pollFirst());
        assertEquals(B, level.pollFirst());
        assertEquals(C, level.pollFirst());
        assertNull(level.pollFirst());
        assertTrue(level.isEmpty());
    }

    @Test
    void removeFromMiddlePreservesOrderOfOthers() {
        PriceLevel level = new PriceLevel(new Price(100));
        level.addOrder(A);
        level.addOrder(B);
        level.addOrder(C);

        assertTrue(level.removeOrder(B));
        assertFalse(level.removeOrder(B));
        assertEquals(List.of(A, C), List.copyOf(level.getOrderIds()));
        assertEquals(2, level.getOrderCount());
    }

    @Test
    void duplicateIdIsAnInvariantViolation() {
        PriceLevel level = new PriceLevel(new Price(100));
        level.addOrder(A);

        assertThrows(BookInvariantViolationException.class, () -> level.addOrder(A));
    }

    @Test
    void emptyLevelHasNoFront() {
        PriceLevel level = new PriceLevel(new Price(5));

        assertNull(level.peekFirst());
        assertEquals(0, level.getOrderCount());
    }
}
