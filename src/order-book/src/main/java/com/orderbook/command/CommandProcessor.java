package com.orderbook.command;

import com.orderbook.domain.MatchResult;
import com.orderbook.domain.MatchResultSet;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.OrderRejectedException;
import com.orderbook.domain.PriceLevel;
import com.orderbook.domain.RejectReason;
import com.orderbook.domain.Side;
import com.orderbook.matching.MatchingAlgorithm;
import com.orderbook.outcome.Ack;
import com.orderbook.outcome.Cancelled;
import com.orderbook.outcome.Flushed;
import com.orderbook.outcome.OutcomeRecord;
import com.orderbook.outcome.Rejected;
import com.orderbook.outcome.TopOfBook;
import com.orderbook.outcome.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Applies commands to one {@link OrderBook}, one at a time, and assembles the outcome
 * records for each.
 *
 * New: validate price, quantity and identifier (in that order), assign the arrival sequence,
 * match, then emit the trades followed by one {@link Ack}.
 * Cancel: remove the live order or reject with UNKNOWN_ORDER.
 * Flush: clear the book and emit {@link Flushed}; the sequence counter is not reset.
 *
 * Rejections are returned as {@link Rejected} records. A
 * {@link com.orderbook.domain.BookInvariantViolationException} escapes to the caller and
 * the book must not be used afterwards.
 *
 * Not thread-safe. Exactly one thread may call {@link #process}.
 */
public class CommandProcessor implements Command.Visitor<List<OutcomeRecord>> {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    private final OrderBook book;
    private final MatchingAlgorithm matcher;
    private final boolean verifyInvariants;
    private final boolean reportTopOfBook;
    private final EnumMap<Side, TopOfBook> lastReportedTop = new EnumMap<>(Side.class);

    public CommandProcessor(OrderBook book, MatchingAlgorithm matcher,
                            boolean verifyInvariants, boolean reportTopOfBook) {
        this.book = book;
        this.matcher = matcher;
        this.verifyInvariants = verifyInvariants;
        this.reportTopOfBook = reportTopOfBook;
        for (Side side : Side.values()) {
            lastReportedTop.put(side, TopOfBook.empty(side));
        }
    }

    /**
     * Apply one command and return its outcome records in emission order.
     */
    public List<OutcomeRecord> process(Command command) {
        List<OutcomeRecord> records = command.accept(this);
        if (verifyInvariants) {
            book.verifyInvariants();
        }
        if (reportTopOfBook) {
            appendTopOfBookChanges(records);
        }
        return records;
    }

    @Override
    public List<OutcomeRecord> visitNewOrder(NewOrder command) {
        OrderId id = command.orderId();
        if (!command.price().isPositive()) {
            return reject(id, RejectReason.INVALID_PRICE);
        }
        if (command.quantity() <= 0) {
            return reject(id, RejectReason.INVALID_QUANTITY);
        }
        if (book.getLedger().isKnown(id)) {
            return reject(id, RejectReason.DUPLICATE_IDENTIFIER);
        }

        Order order = new Order(id, command.side(), command.price(), command.quantity(), book.nextSequence());
        MatchResultSet resultSet = matcher.match(book, order);

        List<OutcomeRecord> records = new ArrayList<>(resultSet.getMatchCount() + 3);
        for (MatchResult match : resultSet.getResults()) {
            records.add(new Trade(match.getTakerOrderId(), match.getMakerOrderId(),
                    match.getExecutionPrice(), match.getExecutionQuantity()));
        }
        records.add(new Ack(id, resultSet.getTotalFilledQuantity(), resultSet.getRestingQuantity()));
        return records;
    }

    @Override
    public List<OutcomeRecord> visitCancelOrder(CancelOrder command) {
        try {
            book.cancel(command.orderId());
        } catch (OrderRejectedException e) {
            return reject(e.getOrderId(), e.getReason());
        }
        List<OutcomeRecord> records = new ArrayList<>(3);
        records.add(new Cancelled(command.orderId()));
        return records;
    }

    @Override
    public List<OutcomeRecord> visitFlushBook(FlushBook command) {
        PriceLevel bestBid = book.getBestBid();
        PriceLevel bestAsk = book.getBestAsk();
        logger.info("Flushing book",
                keyValue("event", "BOOK_FLUSHED"),
                keyValue("bidOrders", book.getBidDepth()),
                keyValue("askOrders", book.getAskDepth()),
                keyValue("bidLevels", book.getBidLevelCount()),
                keyValue("askLevels", book.getAskLevelCount()),
                keyValue("bestBid", bestBid != null ? bestBid.getPrice().minorUnits() : null),
                keyValue("bestAsk", bestAsk != null ? bestAsk.getPrice().minorUnits() : null),
                keyValue("spread", bestBid != null && bestAsk != null
                        ? bestAsk.getPrice().minorUnits() - bestBid.getPrice().minorUnits() : null));
        book.clear();
        List<OutcomeRecord> records = new ArrayList<>(3);
        records.add(new Flushed());
        return records;
    }

    public OrderBook getOrderBook() {
        return book;
    }

    private List<OutcomeRecord> reject(OrderId id, RejectReason reason) {
        logger.debug("Rejected command for order {}: {}", id, reason.label());
        List<OutcomeRecord> records = new ArrayList<>(3);
        records.add(new Rejected(id, reason));
        return records;
    }

    private void appendTopOfBookChanges(List<OutcomeRecord> records) {
        for (Side side : Side.values()) {
            PriceLevel best = book.getLadder().best(side);
            TopOfBook current = best == null
                    ? TopOfBook.empty(side)
                    : new TopOfBook(side, best.getPrice(), book.levelQuantity(best));
            if (!current.equals(lastReportedTop.get(side))) {
                lastReportedTop.put(side, current);
                records.add(current);
            }
        }
    }
}
