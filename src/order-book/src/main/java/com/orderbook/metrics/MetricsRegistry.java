package com.orderbook.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the order book, defined in one place.
 *
 * Metrics register on a registry owned by this instance rather than the default one,
 * so several pipelines can live in one JVM (tests).
 */
public class MetricsRegistry {

    public final Counter commandsTotal;
    // name: ob_commands_total{type}

    public final Counter tradesTotal;
    // name: ob_trades_total

    public final Counter tradedQuantityTotal;
    // name: ob_traded_quantity_total

    public final Counter rejectionsTotal;
    // name: ob_rejections_total{reason}

    public final Gauge orderbookDepth;
    // name: ob_orderbook_depth{side}

    public final Gauge orderbookPriceLevels;
    // name: ob_orderbook_price_levels{side}

    public final Histogram commandDuration;
    // name: ob_command_duration_seconds, includes ring buffer queueing

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry() {
        this(new PrometheusRegistry());
    }

    public MetricsRegistry(PrometheusRegistry registry) {
        this.registry = registry;

        commandsTotal = Counter.builder()
                .name("ob_commands_total")
                .help("Commands processed by type")
                .labelNames("type")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("ob_trades_total")
                .help("Trades executed")
                .register(registry);

        tradedQuantityTotal = Counter.builder()
                .name("ob_traded_quantity_total")
                .help("Quantity executed across all trades")
                .register(registry);

        rejectionsTotal = Counter.builder()
                .name("ob_rejections_total")
                .help("Commands rejected by reason")
                .labelNames("reason")
                .register(registry);

        orderbookDepth = Gauge.builder()
                .name("ob_orderbook_depth")
                .help("Current resting orders")
                .labelNames("side")
                .register(registry);

        orderbookPriceLevels = Gauge.builder()
                .name("ob_orderbook_price_levels")
                .help("Distinct price levels")
                .labelNames("side")
                .register(registry);

        commandDuration = Histogram.builder()
                .name("ob_command_duration_seconds")
                .help("Time from a command entering the ring buffer to its outcome records being written")
                .classicOnly()
                .classicUpperBounds(0.000001, 0.000005, 0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.01)
                .register(registry);
    }

    /**
     * Register JVM metrics and start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        JvmMetrics.builder().register(registry);
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    public PrometheusRegistry getRegistry() {
        return registry;
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}
