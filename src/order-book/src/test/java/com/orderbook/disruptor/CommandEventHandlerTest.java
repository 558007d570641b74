package com.orderbook.disruptor;

import com.orderbook.command.Command;
import com.orderbook.command.CommandProcessor;
import com.orderbook.command.FlushBook;
import com.orderbook.command.NewOrder;
import com.orderbook.domain.BookInvariantViolationException;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;
import com.orderbook.logging.ProcessingStats;
import com.orderbook.matching.MatchingAlgorithm;
import com.orderbook.matching.PriceTimePriorityMatcher;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.publishing.CsvOutcomeFormatter;
import com.orderbook.publishing.OutcomePublisher;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import static org.junit.jupiter.api.Assertions.*;

class CommandEventHandlerTest {

    private final ProcessingStats stats = new ProcessingStats();
    private final MetricsRegistry metrics = new MetricsRegistry();
    private long sequence;

    private CommandEventHandler handler(MatchingAlgorithm matcher, Writer out) {
        CommandProcessor processor = new CommandProcessor(new OrderBook(), matcher, false, false);
        return new CommandEventHandler(processor, new OutcomePublisher(out, new CsvOutcomeFormatter()), stats, metrics);
    }

    private void deliver(CommandEventHandler handler, Command command, boolean endOfBatch) {
        CommandEvent event = new CommandEvent();
        CommandEventTranslator.INSTANCE.translateTo(event, sequence, command, sequence + 1);
        sequence++;
        handler.onEvent(event, sequence, endOfBatch);
        assertNull(event.command, "slot cleared after processing");
    }

    private static NewOrder order(String id, Side side, long price, long qty) {
        return new NewOrder(new OrderId(id), side, new Price(price), qty);
    }

    @Test
    void writesRecordsAndCountsOutcomes() {
        StringWriter out = new StringWriter();
        CommandEventHandler handler = handler(new PriceTimePriorityMatcher(), out);

        deliver(handler, order("1", Side.BUY, 100, 10), false);
        deliver(handler, order("2", Side.SELL, 100, 4), false);
        deliver(handler, order("2", Side.SELL, 100, 4), true);

        assertEquals("A, 1, 0, 10\nT, 2, 1, 100, 4\nA, 2, 4, 0\nR, 2, DuplicateIdentifier\n", out.toString());
        assertEquals(2, stats.newOrders.get());
        assertEquals(1, stats.tradesExecuted.get());
        assertEquals(4, stats.tradedQuantity.get());
        assertEquals(1, stats.rejected.get());
        assertEquals(1, stats.bidOrders.get());
        assertFalse(handler.isHalted());
    }

    @Test
    void invariantViolationHaltsAndDropsLaterCommands() {
        StringWriter out = new StringWriter();
        MatchingAlgorithm broken = (book, incoming) -> {
            throw new BookInvariantViolationException("broken on purpose");
        };
        CommandEventHandler handler = handler(broken, out);

        deliver(handler, new FlushBook(), false);
        deliver(handler, order("1", Side.BUY, 100, 10), false);
        deliver(handler, new FlushBook(), true);

        assertTrue(handler.isHalted());
        assertInstanceOf(BookInvariantViolationException.class, handler.getFailure());
        assertEquals("F\n", out.toString());
        assertEquals(1, stats.flushes.get());
    }

    @Test
    void outputFailureHalts() {
        Writer failing = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        CommandEventHandler handler = handler(new PriceTimePriorityMatcher(), failing);

        deliver(handler, new FlushBook(), true);

        assertTrue(handler.isHalted());
        assertInstanceOf(IOException.class, handler.getFailure());
    }
}
