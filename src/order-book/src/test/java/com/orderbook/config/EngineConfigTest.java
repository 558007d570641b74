package com.orderbook.config;

import com.orderbook.publishing.OutcomeFormat;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaultsWhenEnvironmentIsEmpty() {
        EngineConfig config = EngineConfig.fromEnv(Map.of());

        assertNull(config.getInputPath());
        assertEquals(OutcomeFormat.CSV, config.getOutputFormat());
        assertFalse(config.isTopOfBook());
        assertFalse(config.isStrictParsing());
        assertFalse(config.isVerifyInvariants());
        assertEquals(1024, config.getRingBufferSize());
        assertEquals(0, config.getMetricsPort());
        assertEquals(0, config.getStatsIntervalSeconds());
    }

    @Test
    void readsEveryVariable() {
        Map<String, String> env = new HashMap<>();
        env.put("ORDER_BOOK_INPUT", "/tmp/orders.csv");
        env.put("OUTPUT_FORMAT", "JSON");
        env.put("TOP_OF_BOOK", "true");
        env.put("STRICT_PARSING", "true");
        env.put("VERIFY_INVARIANTS", "true");
        env.put("RING_BUFFER_SIZE", "4096");
        env.put("METRICS_PORT", "9100");
        env.put("STATS_INTERVAL_SECONDS", "5");

        EngineConfig config = EngineConfig.fromEnv(env);

        assertEquals("/tmp/orders.csv", config.getInputPath());
        assertEquals(OutcomeFormat.JSON, config.getOutputFormat());
        assertTrue(config.isTopOfBook());
        assertTrue(config.isStrictParsing());
        assertTrue(config.isVerifyInvariants());
        assertEquals(4096, config.getRingBufferSize());
        assertEquals(9100, config.getMetricsPort());
        assertEquals(5, config.getStatsIntervalSeconds());
    }

    @Test
    void nonNumericValueFallsBackToDefault() {
        EngineConfig config = EngineConfig.fromEnv(Map.of("RING_BUFFER_SIZE", "lots"));

        assertEquals(1024, config.getRingBufferSize());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("RING_BUFFER_SIZE", "1000")));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("METRICS_PORT", "70000")));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("OUTPUT_FORMAT", "xml")));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.builder().statsIntervalSeconds(-1).build());
    }

    @Test
    void toBuilderCopiesAllFields() {
        EngineConfig original = EngineConfig.builder()
                .inputPath("in.csv")
                .outputFormat(OutcomeFormat.JSON)
                .topOfBook(true)
                .ringBufferSize(64)
                .build();

        EngineConfig copy = original.toBuilder().strictParsing(true).build();

        assertEquals("in.csv", copy.getInputPath());
        assertEquals(OutcomeFormat.JSON, copy.getOutputFormat());
        assertTrue(copy.isTopOfBook());
        assertTrue(copy.isStrictParsing());
        assertEquals(64, copy.getRingBufferSize());
        assertFalse(original.isStrictParsing());
    }
}
