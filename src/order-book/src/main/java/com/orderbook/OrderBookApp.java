package com.orderbook;

import com.orderbook.config.EngineConfig;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.publishing.OutcomeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Command-line entry point. Reads commands from a file or standard input and writes
 * outcome records to standard output. Logs go to standard error.
 *
 * <pre>
 * # Replay a command file
 * order-book -i orders.csv
 *
 * # JSON output with top-of-book changes
 * cat orders.csv | order-book --format json --top-of-book
 * </pre>
 *
 * Options override the matching environment variables read by {@link EngineConfig#fromEnv()}.
 */
@Command(name = "order-book",
        mixinStandardHelpOptions = true,
        version = "Limit Order Book 1.0",
        exitCodeOnInvalidInput = OrderBookRunner.EXIT_USAGE,
        description = "Match limit orders for a single instrument by price-time priority.")
public class OrderBookApp implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(OrderBookApp.class);

    @Option(names = {"-i", "--input"}, description = "Command file (default: standard input)")
    String inputPath;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES}")
    OutcomeFormat format;

    @Option(names = "--top-of-book", description = "Emit a record whenever the best level of a side changes")
    Boolean topOfBook;

    @Option(names = "--strict", description = "Stop at the first malformed line instead of skipping it")
    Boolean strict;

    @Option(names = "--verify-invariants", description = "Check full book consistency after every command")
    Boolean verifyInvariants;

    @Option(names = "--ring-buffer-size", description = "Disruptor ring buffer size, a power of two")
    Integer ringBufferSize;

    @Option(names = "--metrics-port", description = "Serve Prometheus metrics on this port (0 disables)")
    Integer metricsPort;

    @Option(names = "--stats-interval", description = "Seconds between statistics log lines (0 disables)")
    Integer statsIntervalSeconds;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OrderBookApp())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        EngineConfig config;
        try {
            config = resolveConfig(EngineConfig.fromEnv());
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return OrderBookRunner.EXIT_USAGE;
        }
        logger.info("Configuration: {}", config);

        MetricsRegistry metrics = new MetricsRegistry();
        if (config.getMetricsPort() > 0) {
            try {
                metrics.startHttpServer(config.getMetricsPort());
                logger.info("Prometheus metrics HTTP server started on port {}", config.getMetricsPort());
            } catch (IOException e) {
                logger.error("Failed to start Prometheus HTTP server on port {}: {}",
                        config.getMetricsPort(), e.getMessage());
                return OrderBookRunner.EXIT_IO_OR_PARSE_FAILURE;
            }
        }

        Writer output = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        try (BufferedReader input = openInput(config.getInputPath())) {
            return new OrderBookRunner(config, metrics).run(input, output);
        } catch (IOException e) {
            logger.error("Failed to open input {}: {}", config.getInputPath(), e.getMessage());
            return OrderBookRunner.EXIT_IO_OR_PARSE_FAILURE;
        } finally {
            metrics.close();
        }
    }

    EngineConfig resolveConfig(EngineConfig base) {
        EngineConfig.Builder builder = base.toBuilder();
        if (inputPath != null) {
            builder.inputPath(inputPath);
        }
        if (format != null) {
            builder.outputFormat(format);
        }
        if (topOfBook != null) {
            builder.topOfBook(topOfBook);
        }
        if (strict != null) {
            builder.strictParsing(strict);
        }
        if (verifyInvariants != null) {
            builder.verifyInvariants(verifyInvariants);
        }
        if (ringBufferSize != null) {
            builder.ringBufferSize(ringBufferSize);
        }
        if (metricsPort != null) {
            builder.metricsPort(metricsPort);
        }
        if (statsIntervalSeconds != null) {
            builder.statsIntervalSeconds(statsIntervalSeconds);
        }
        return builder.build();
    }

    private static BufferedReader openInput(String path) throws IOException {
        if (path == null || path.equals("-")) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8));
    }
}
