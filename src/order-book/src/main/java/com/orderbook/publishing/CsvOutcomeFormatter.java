package com.orderbook.publishing;

import com.orderbook.domain.OrderId;
import com.orderbook.outcome.Ack;
import com.orderbook.outcome.Cancelled;
import com.orderbook.outcome.Flushed;
import com.orderbook.outcome.OutcomeRecord;
import com.orderbook.outcome.Rejected;
import com.orderbook.outcome.TopOfBook;
import com.orderbook.outcome.Trade;

/**
 * Comma-separated records, mirroring the command format:
 *
 * <pre>
 *   A, id, filled, resting
 *   T, taker, maker, price, quantity
 *   X, id
 *   F
 *   R, id|-, reason
 *   B, side, price|-, total
 * </pre>
 */
public class CsvOutcomeFormatter implements OutcomeFormatter, OutcomeRecord.Visitor<String> {

    private static final String SEPARATOR = ", ";
    private static final String NONE = "-";

    @Override
    public String format(OutcomeRecord record) {
        return record.accept(this);
    }

    @Override
    public String visitAck(Ack ack) {
        return join("A", ack.orderId().value(), ack.filledQuantity(), ack.restingQuantity());
    }

    @Override
    public String visitTrade(Trade trade) {
        return join("T", trade.takerOrderId().value(), trade.makerOrderId().value(),
                trade.price().minorUnits(), trade.quantity());
    }

    @Override
    public String visitCancelled(Cancelled cancelled) {
        return join("X", cancelled.orderId().value());
    }

    @Override
    public String visitFlushed(Flushed flushed) {
        return "F";
    }

    @Override
    public String visitRejected(Rejected rejected) {
        OrderId id = rejected.orderId();
        return join("R", id != null ? id.value() : NONE, rejected.reason().label());
    }

    @Override
    public String visitTopOfBook(TopOfBook top) {
        return join("B", String.valueOf(top.side().code()),
                top.isEmpty() ? NONE : Long.toString(top.price().minorUnits()),
                top.totalQuantity());
    }

    private static String join(String type, Object... fields) {
        StringBuilder sb = new StringBuilder(64).append(type);
        for (Object field : fields) {
            sb.append(SEPARATOR).append(field);
        }
        return sb.toString();
    }
}
