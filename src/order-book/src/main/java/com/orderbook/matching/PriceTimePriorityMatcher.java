package com.orderbook.matching;

import com.orderbook.domain.BookInvariantViolationException;
import com.orderbook.domain.MatchResult;
import com.orderbook.domain.MatchResultSet;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.OrderLedger;
import com.orderbook.domain.OrderRejectedException;
import com.orderbook.domain.Price;
import com.orderbook.domain.PriceLadder;
import com.orderbook.domain.PriceLevel;
import com.orderbook.domain.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Price-time priority matching algorithm.
 *
 * Price priority: best price on the opposite side is matched first
 * (lowest ask for a buy, highest bid for a sell).
 *
 * Time priority: within the same price level, the order that arrived
 * earliest is matched first (FIFO).
 *
 * Fills execute at the maker's price. Any remainder rests at the incoming order's limit;
 * an order filled on entry never reaches the ledger but its identifier is retired.
 *
 * Time complexity: O(log P + F) where P = price levels, F = fills.
 */
public class PriceTimePriorityMatcher implements MatchingAlgorithm {

    @Override
    public MatchResultSet match(OrderBook book, Order incoming) {
        PriceLadder ladder = book.getLadder();
        OrderLedger ledger = book.getLedger();
        Side opposite = incoming.getSide().opposite();

        List<MatchResult> results = new ArrayList<>();
        long totalFilled = 0;

        while (incoming.getRemainingQuantity() > 0) {
            PriceLevel level = ladder.best(opposite);
            if (level == null) {
                break;
            }

            Price bestPrice = level.getPrice();
            if (!crosses(incoming, bestPrice)) {
                break;
            }

            OrderId makerId = level.peekFirst();
            Order maker = ledger.find(makerId);
            if (maker == null) {
                throw new BookInvariantViolationException(
                        "Order " + makerId + " queued at " + bestPrice + " missing from ledger");
            }

            long fillQty = Math.min(incoming.getRemainingQuantity(), maker.getRemainingQuantity());
            incoming.fill(fillQty);
            boolean makerFilled = ledger.decrement(makerId, fillQty);

            results.add(new MatchResult(incoming.getId(), makerId, bestPrice, fillQty));
            totalFilled += fillQty;

            if (makerFilled) {
                OrderId popped = ladder.popFront(opposite, bestPrice);
                if (!makerId.equals(popped)) {
                    throw new BookInvariantViolationException(
                            "Filled maker " + makerId + " but level head was " + popped);
                }
            }
        }

        if (incoming.getRemainingQuantity() > 0) {
            try {
                book.rest(incoming);
            } catch (OrderRejectedException e) {
                // identifiers are checked before matching starts
                throw new BookInvariantViolationException(
                        "Incoming order " + incoming.getId() + " collided in ledger: " + e.getMessage());
            }
        } else {
            ledger.retire(incoming.getId());
        }

        return new MatchResultSet(results, totalFilled, incoming.getRemainingQuantity());
    }

    private static boolean crosses(Order incoming, Price bestOpposite) {
        if (incoming.getSide() == Side.BUY) {
            return incoming.getLimitPrice().compareTo(bestOpposite) >= 0;
        }
        return incoming.getLimitPrice().compareTo(bestOpposite) <= 0;
    }
}
