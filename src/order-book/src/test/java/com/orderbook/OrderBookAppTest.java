package com.orderbook;

import com.orderbook.config.EngineConfig;
import com.orderbook.publishing.OutcomeFormat;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrderBookAppTest {

    @Test
    void optionsOverrideEnvironment() {
        OrderBookApp app = new OrderBookApp();
        new CommandLine(app).setCaseInsensitiveEnumValuesAllowed(true)
                .parseArgs("-i", "orders.csv", "-f", "json", "--top-of-book", "--strict",
                        "--ring-buffer-size", "16", "--stats-interval", "3");

        EngineConfig env = EngineConfig.fromEnv(Map.of("OUTPUT_FORMAT", "csv", "VERIFY_INVARIANTS", "true"));
        EngineConfig config = app.resolveConfig(env);

        assertEquals("orders.csv", config.getInputPath());
        assertEquals(OutcomeFormat.JSON, config.getOutputFormat());
        assertTrue(config.isTopOfBook());
        assertTrue(config.isStrictParsing());
        assertTrue(config.isVerifyInvariants());
        assertEquals(16, config.getRingBufferSize());
        assertEquals(3, config.getStatsIntervalSeconds());
    }

    @Test
    void unsetOptionsKeepEnvironmentValues() {
        OrderBookApp app = new OrderBookApp();
        new CommandLine(app).parseArgs();

        EngineConfig config = app.resolveConfig(EngineConfig.fromEnv(Map.of("TOP_OF_BOOK", "true")));

        assertTrue(config.isTopOfBook());
        assertEquals(OutcomeFormat.CSV, config.getOutputFormat());
    }

    @Test
    void unknownOptionIsUsageError() {
        CommandLine cmd = new CommandLine(new OrderBookApp());
        cmd.setErr(new PrintWriter(new StringWriter()));

        assertEquals(OrderBookRunner.EXIT_USAGE, cmd.execute("--no-such-option"));
    }

    @Test
    void invalidRingBufferSizeIsUsageError() {
        CommandLine cmd = new CommandLine(new OrderBookApp());

        assertEquals(OrderBookRunner.EXIT_USAGE, cmd.execute("--ring-buffer-size", "100"));
    }
}
