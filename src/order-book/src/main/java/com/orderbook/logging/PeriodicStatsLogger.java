package com.orderbook.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate processing statistics every N seconds on a separate daemon thread.
 * Never blocks the processing thread.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final ProcessingStats stats;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastNewOrders;
    private long lastCancels;
    private long lastTrades;
    private long lastRejected;

    public PeriodicStatsLogger(ProcessingStats stats, int intervalSeconds) {
        this.stats = stats;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public static void logShutdownSummary(ProcessingStats stats, long malformedLines) {
        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("totalCommands", stats.totalCommands()),
                keyValue("newOrders", stats.newOrders.get()),
                keyValue("cancels", stats.cancels.get()),
                keyValue("flushes", stats.flushes.get()),
                keyValue("trades", stats.tradesExecuted.get()),
                keyValue("tradedQuantity", stats.tradedQuantity.get()),
                keyValue("rejected", stats.rejected.get()),
                keyValue("malformedLines", malformedLines),
                keyValue("restingBidOrders", stats.bidOrders.get()),
                keyValue("restingAskOrders", stats.askOrders.get()));
    }

    private void logSummary() {
        try {
            long currentNew = stats.newOrders.get();
            long currentCancels = stats.cancels.get();
            long currentTrades = stats.tradesExecuted.get();
            long currentRejected = stats.rejected.get();

            long deltaNew = currentNew - lastNewOrders;
            long deltaCancels = currentCancels - lastCancels;
            long deltaTrades = currentTrades - lastTrades;
            long deltaRejected = currentRejected - lastRejected;
            double tradesPerOrder = deltaNew > 0 ? (double) deltaTrades / deltaNew : 0.0;

            lastNewOrders = currentNew;
            lastCancels = currentCancels;
            lastTrades = currentTrades;
            lastRejected = currentRejected;

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("newOrders", deltaNew),
                    keyValue("cancels", deltaCancels),
                    keyValue("trades", deltaTrades),
                    keyValue("rejected", deltaRejected),
                    keyValue("tradesPerOrder", String.format("%.4f", tradesPerOrder)),
                    keyValue("bidDepth", stats.bidOrders.get()),
                    keyValue("askDepth", stats.askOrders.get()),
                    keyValue("bidLevels", stats.bidLevels.get()),
                    keyValue("askLevels", stats.askLevels.get()));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }
}
