package com.orderbook.matching;

import com.orderbook.domain.MatchResult;
import com.orderbook.domain.MatchResultSet;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.OrderRejectedException;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceTimePriorityMatcherTest {

    private OrderBook book;
    private PriceTimePriorityMatcher matcher;

    @BeforeEach
    void setUp() {
        book = new OrderBook();
        matcher = new PriceTimePriorityMatcher();
    }

    private MatchResultSet submit(String id, Side side, long price, long qty) {
        Order order = new Order(new OrderId(id), side, new Price(price), qty, book.nextSequence());
        return matcher.match(book, order);
    }

    @Test
    void nonCrossingOrderRests() {
        submit("s1", Side.SELL, 101, 10);
        MatchResultSet result = submit("b1", Side.BUY, 100, 10);

        assertEquals(0, result.getMatchCount());
        assertEquals(10, result.getRestingQuantity());
        assertEquals(new Price(100), book.getBestBid().getPrice());
        assertEquals(new Price(101), book.getBestAsk().getPrice());
    }

    @Test
    void earlierOrderAtSamePriceFillsFirst() {
        submit("s1", Side.SELL, 100, 5);
        submit("s2", Side.SELL, 100, 5);

        MatchResultSet result = submit("b1", Side.BUY, 100, 7);

        assertEquals(2, result.getMatchCount());
        MatchResult first = result.getResults().get(0);
        MatchResult second = result.getResults().get(1);
        assertEquals(new OrderId("s1"), first.getMakerOrderId());
        assertEquals(5, first.getExecutionQuantity());
        assertEquals(new OrderId("s2"), second.getMakerOrderId());
        assertEquals(2, second.getExecutionQuantity());
        assertEquals(3, book.bestLevelQuantity(Side.SELL));
        assertEquals(0, result.getRestingQuantity());
    }

    @Test
    void betterPriceFillsBeforeEarlierArrival() {
        submit("s1", Side.SELL, 102, 5);
        submit("s2", Side.SELL, 101, 5);

        MatchResultSet result = submit("b1", Side.BUY, 102, 5);

        assertEquals(1, result.getMatchCount());
        assertEquals(new OrderId("s2"), result.getResults().get(0).getMakerOrderId());
        assertEquals(new Price(101), result.getResults().get(0).getExecutionPrice());
    }

    @Test
    void executesAtMakerPrice() {
        submit("b1", Side.BUY, 100, 6);

        MatchResultSet result = submit("s1", Side.SELL, 99, 6);

        MatchResult match = result.getResults().get(0);
        assertEquals(new Price(100), match.getExecutionPrice());
        assertEquals(new OrderId("s1"), match.getTakerOrderId());
        assertNull(book.getBestBid());
    }

    @Test
    void sweepsSeveralLevelsAndRestsRemainder() throws OrderRejectedException {
        submit("s1", Side.SELL, 100, 3);
        submit("s2", Side.SELL, 101, 3);
        submit("s3", Side.SELL, 105, 3);

        MatchResultSet result = submit("b1", Side.BUY, 102, 10);

        assertEquals(2, result.getMatchCount());
        assertEquals(6, result.getTotalFilledQuantity());
        assertEquals(4, result.getRestingQuantity());
        assertEquals(new Price(102), book.getBestBid().getPrice());
        assertEquals(new Price(105), book.getBestAsk().getPrice());
        assertEquals(6, book.getLedger().get(new OrderId("b1")).getFilledQuantity());
        book.verifyInvariants();
    }

    @Test
    void fullyFilledIncomingIsRetiredButNotResting() {
        submit("s1", Side.SELL, 100, 10);

        submit("b1", Side.BUY, 100, 4);

        assertFalse(book.getLedger().contains(new OrderId("b1")));
        assertTrue(book.getLedger().isKnown(new OrderId("b1")));
        assertEquals(6, book.bestLevelQuantity(Side.SELL));
    }

    @Test
    void selfTradeIsAllowed() {
        submit("x", Side.BUY, 100, 5);

        MatchResultSet result = submit("y", Side.SELL, 100, 5);

        assertEquals(1, result.getMatchCount());
        assertTrue(book.isEmpty());
    }
}
