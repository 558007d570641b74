package com.orderbook;

import com.orderbook.command.CommandParser;
import com.orderbook.command.CommandProcessor;
import com.orderbook.command.CommandReader;
import com.orderbook.command.MalformedCommandException;
import com.orderbook.config.EngineConfig;
import com.orderbook.disruptor.CommandEventHandler;
import com.orderbook.disruptor.CommandPipeline;
import com.orderbook.domain.OrderBook;
import com.orderbook.logging.PeriodicStatsLogger;
import com.orderbook.logging.ProcessingStats;
import com.orderbook.matching.PriceTimePriorityMatcher;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.publishing.OutcomePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Runs one command stream through a fresh order book and writes the outcome records.
 *
 * Startup sequence:
 * 1. Create the book, the matcher and the command processor
 * 2. Wrap the output in an OutcomePublisher for the configured format
 * 3. Start the Disruptor pipeline with its single CommandEventHandler
 * 4. Start the periodic stats logger, if enabled
 * 5. Read and publish commands until end of input or until processing halts
 * 6. Drain the pipeline, flush output, log the shutdown summary
 *
 * The output writer is flushed but never closed.
 */
public class OrderBookRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_OR_PARSE_FAILURE = 1;
    public static final int EXIT_INVARIANT_VIOLATION = 2;
    public static final int EXIT_USAGE = 64;

    private static final Logger logger = LoggerFactory.getLogger(OrderBookRunner.class);

    private final EngineConfig config;
    private final MetricsRegistry metrics;
    private final ProcessingStats stats = new ProcessingStats();
    private OrderBook book;

    public OrderBookRunner(EngineConfig config, MetricsRegistry metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * @return process exit code, one of the EXIT_ constants
     */
    public int run(BufferedReader input, Writer output) {
        book = new OrderBook();
        CommandProcessor processor = new CommandProcessor(
                book, new PriceTimePriorityMatcher(), config.isVerifyInvariants(), config.isTopOfBook());
        OutcomePublisher publisher = new OutcomePublisher(output, config.getOutputFormat().newFormatter());
        CommandEventHandler handler = new CommandEventHandler(processor, publisher, stats, metrics);
        CommandPipeline pipeline = new CommandPipeline(handler, config.getRingBufferSize());
        CommandReader reader = new CommandReader(new CommandParser(), config.isStrictParsing());

        PeriodicStatsLogger statsLogger = null;
        if (config.getStatsIntervalSeconds() > 0) {
            statsLogger = new PeriodicStatsLogger(stats, config.getStatsIntervalSeconds());
            statsLogger.start();
        }

        int exitCode = EXIT_OK;
        pipeline.start();
        try {
            reader.readAll(input, pipeline);
        } catch (IOException e) {
            logger.error("Failed to read commands",
                    keyValue("event", "INPUT_FAILURE"), e);
            exitCode = EXIT_IO_OR_PARSE_FAILURE;
        } catch (MalformedCommandException e) {
            logger.error("Malformed command in strict mode: {}", e.getMessage(),
                    keyValue("event", "MALFORMED_COMMAND"),
                    keyValue("line", e.getLineNumber()));
            exitCode = EXIT_IO_OR_PARSE_FAILURE;
        } finally {
            pipeline.shutdown();
        }

        try {
            publisher.flush();
        } catch (IOException e) {
            logger.error("Failed to flush output",
                    keyValue("event", "OUTPUT_FAILURE"), e);
            exitCode = EXIT_IO_OR_PARSE_FAILURE;
        }

        Throwable failure = handler.getFailure();
        if (failure instanceof IOException) {
            exitCode = EXIT_IO_OR_PARSE_FAILURE;
        } else if (failure != null) {
            exitCode = EXIT_INVARIANT_VIOLATION;
        }

        if (statsLogger != null) {
            statsLogger.stop();
        }
        PeriodicStatsLogger.logShutdownSummary(stats, reader.getMalformedLines());
        logger.info("Order book run finished",
                keyValue("event", "RUN_FINISHED"),
                keyValue("commands", pipeline.getPublished()),
                keyValue("records", publisher.getRecordsWritten()),
                keyValue("exitCode", exitCode));
        return exitCode;
    }

    public ProcessingStats getStats() {
        return stats;
    }

    /**
     * The book of the last run. Only safe to inspect after {@link #run} has returned.
     */
    public OrderBook getOrderBook() {
        return book;
    }
}
