package com.orderbook.matching;

import com.orderbook.domain.MatchResultSet;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;

/**
 * Interface for order matching algorithms.
 * The matching algorithm takes an order book and an already validated incoming order,
 * returns the fills produced, and leaves the book uncrossed.
 */
public interface MatchingAlgorithm {
    MatchResultSet match(OrderBook book, Order incomingOrder);
}
