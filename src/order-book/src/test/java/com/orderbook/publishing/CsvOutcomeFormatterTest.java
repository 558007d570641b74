package com.orderbook.publishing;

import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.RejectReason;
import com.orderbook.domain.Side;
import com.orderbook.outcome.Ack;
import com.orderbook.outcome.Cancelled;
import com.orderbook.outcome.Flushed;
import com.orderbook.outcome.Rejected;
import com.orderbook.outcome.TopOfBook;
import com.orderbook.outcome.Trade;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CsvOutcomeFormatterTest {

    private final OutcomeFormatter formatter = new CsvOutcomeFormatter();

    @Test
    void formatsEveryRecordKind() {
        assertEquals("A, 1, 4, 6", formatter.format(new Ack(new OrderId("1"), 4, 6)));
        assertEquals("T, 2, 1, 100, 4",
                formatter.format(new Trade(new OrderId("2"), new OrderId("1"), new Price(100), 4)));
        assertEquals("X, 9", formatter.format(new Cancelled(new OrderId("9"))));
        assertEquals("F", formatter.format(new Flushed()));
        assertEquals("R, 3, DuplicateIdentifier",
                formatter.format(new Rejected(new OrderId("3"), RejectReason.DUPLICATE_IDENTIFIER)));
        assertEquals("B, S, 101, 25", formatter.format(new TopOfBook(Side.SELL, new Price(101), 25)));
    }

    @Test
    void marksMissingValuesWithDash() {
        assertEquals("R, -, UnknownOrder", formatter.format(new Rejected(null, RejectReason.UNKNOWN_ORDER)));
        assertEquals("B, B, -, 0", formatter.format(TopOfBook.empty(Side.BUY)));
    }
}
