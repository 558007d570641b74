package com.orderbook.disruptor;

import com.lmax.disruptor.EventHandler;
import com.orderbook.command.CancelOrder;
import com.orderbook.command.Command;
import com.orderbook.command.CommandProcessor;
import com.orderbook.command.FlushBook;
import com.orderbook.command.NewOrder;
import com.orderbook.domain.BookInvariantViolationException;
import com.orderbook.domain.OrderBook;
import com.orderbook.logging.ProcessingStats;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.outcome.Ack;
import com.orderbook.outcome.Cancelled;
import com.orderbook.outcome.Flushed;
import com.orderbook.outcome.OutcomeRecord;
import com.orderbook.outcome.Rejected;
import com.orderbook.outcome.TopOfBook;
import com.orderbook.outcome.Trade;
import com.orderbook.publishing.OutcomePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * The single-threaded command processor. Implements EventHandler<CommandEvent>.
 *
 * Runs on the one thread managed by the Disruptor's BatchEventProcessor, so the
 * book, the processor and the publisher are only ever touched from here.
 *
 * Processing pipeline per event:
 * 1. Apply the command to the book
 * 2. Write the outcome records
 * 3. Record stats and metrics
 * 4. Flush output and publish book depth on endOfBatch
 *
 * Any failure halts the handler: the failing command produces no records and every
 * later event is dropped. Exceptions never reach the Disruptor, so the ring always drains.
 */
public class CommandEventHandler implements EventHandler<CommandEvent> {

    private static final Logger logger = LoggerFactory.getLogger(CommandEventHandler.class);

    private final CommandProcessor processor;
    private final OutcomePublisher publisher;
    private final ProcessingStats stats;
    private final MetricsRegistry metrics;
    private final RecordCounter recordCounter = new RecordCounter();
    private final CountDownLatch started = new CountDownLatch(1);

    private volatile Throwable failure;
    private long droppedEvents;

    public CommandEventHandler(CommandProcessor processor,
                               OutcomePublisher publisher,
                               ProcessingStats stats,
                               MetricsRegistry metrics) {
        this.processor = processor;
        this.publisher = publisher;
        this.stats = stats;
        this.metrics = metrics;
    }

    @Override
    public void onEvent(CommandEvent event, long sequence, boolean endOfBatch) {
        if (event.command == null) {
            return;
        }
        try {
            if (failure != null) {
                droppedEvents++;
                return;
            }
            Command command = event.command;
            List<OutcomeRecord> records = processor.process(command);
            publisher.publish(records);

            metrics.commandsTotal.labelValues(command.accept(COMMAND_TYPE)).inc();
            for (OutcomeRecord record : records) {
                record.accept(recordCounter);
            }
            metrics.commandDuration.observe((System.nanoTime() - event.receivedNanos) / 1_000_000_000.0);

            if (endOfBatch) {
                publisher.flush();
                publishDepth();
            }
        } catch (BookInvariantViolationException e) {
            halt(e, event.lineNumber);
            logger.error("Book invariant violated, halting",
                    keyValue("event", "INVARIANT_VIOLATION"),
                    keyValue("line", event.lineNumber),
                    keyValue("command", event.command),
                    e);
        } catch (IOException e) {
            halt(e, event.lineNumber);
            logger.error("Failed to write outcome records, halting",
                    keyValue("event", "OUTPUT_FAILURE"),
                    keyValue("line", event.lineNumber),
                    e);
        } catch (RuntimeException e) {
            halt(e, event.lineNumber);
            logger.error("Unexpected failure processing command, halting",
                    keyValue("event", "PROCESSING_FAILURE"),
                    keyValue("line", event.lineNumber),
                    keyValue("command", event.command),
                    e);
        } finally {
            event.clear();
        }
    }

    @Override
    public void onStart() {
        started.countDown();
    }

    /**
     * Block until the processing thread is running. Only then does a Disruptor shutdown
     * wait for events already in the ring.
     */
    public void awaitStarted() throws InterruptedException {
        started.await();
    }

    @Override
    public void onShutdown() {
        if (droppedEvents > 0) {
            logger.warn("Dropped {} commands after processing halted", droppedEvents);
        }
    }

    public boolean isHalted() {
        return failure != null;
    }

    /**
     * The failure that halted processing, or null.
     */
    public Throwable getFailure() {
        return failure;
    }

    private void halt(Throwable cause, long lineNumber) {
        failure = cause;
        try {
            publisher.flush();
        } catch (IOException flushFailure) {
            cause.addSuppressed(flushFailure);
        }
        logger.debug("Processing halted at line {}", lineNumber);
    }

    private void publishDepth() {
        OrderBook book = processor.getOrderBook();
        stats.bidOrders.set(book.getBidDepth());
        stats.askOrders.set(book.getAskDepth());
        stats.bidLevels.set(book.getBidLevelCount());
        stats.askLevels.set(book.getAskLevelCount());
        metrics.orderbookDepth.labelValues("bid").set(book.getBidDepth());
        metrics.orderbookDepth.labelValues("ask").set(book.getAskDepth());
        metrics.orderbookPriceLevels.labelValues("bid").set(book.getBidLevelCount());
        metrics.orderbookPriceLevels.labelValues("ask").set(book.getAskLevelCount());
    }

    private static final Command.Visitor<String> COMMAND_TYPE = new Command.Visitor<>() {
        @Override
        public String visitNewOrder(NewOrder command) {
            return "new";
        }

        @Override
        public String visitCancelOrder(CancelOrder command) {
            return "cancel";
        }

        @Override
        public String visitFlushBook(FlushBook command) {
            return "flush";
        }
    };

    private final class RecordCounter implements OutcomeRecord.Visitor<Void> {

        @Override
        public Void visitAck(Ack ack) {
            stats.newOrders.incrementAndGet();
            return null;
        }

        @Override
        public Void visitTrade(Trade trade) {
            stats.tradesExecuted.incrementAndGet();
            stats.addTradedQuantity(trade.quantity());
            metrics.tradesTotal.inc();
            metrics.tradedQuantityTotal.inc(trade.quantity());
            return null;
        }

        @Override
        public Void visitCancelled(Cancelled cancelled) {
            stats.cancels.incrementAndGet();
            return null;
        }

        @Override
        public Void visitFlushed(Flushed flushed) {
            stats.flushes.incrementAndGet();
            return null;
        }

        @Override
        public Void visitRejected(Rejected rejected) {
            stats.rejected.incrementAndGet();
            metrics.rejectionsTotal.labelValues(rejected.reason().label()).inc();
            return null;
        }

        @Override
        public Void visitTopOfBook(TopOfBook topOfBook) {
            return null;
        }
    }
}
