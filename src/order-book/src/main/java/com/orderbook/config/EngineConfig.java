package com.orderbook.config;

import com.orderbook.publishing.OutcomeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Configuration parsed from environment variables, optionally overridden from the command line.
 *
 * <pre>
 *   ORDER_BOOK_INPUT        command file; unset reads standard input
 *   OUTPUT_FORMAT           csv | json (csv)
 *   TOP_OF_BOOK             emit top-of-book records (false)
 *   STRICT_PARSING          abort on the first malformed line (false)
 *   VERIFY_INVARIANTS       full book consistency check after every command (false)
 *   RING_BUFFER_SIZE        power of two (1024)
 *   METRICS_PORT            Prometheus exporter port, 0 disables it (0)
 *   STATS_INTERVAL_SECONDS  periodic statistics log, 0 disables it (0)
 * </pre>
 */
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    private final String inputPath;
    private final OutcomeFormat outputFormat;
    private final boolean topOfBook;
    private final boolean strictParsing;
    private final boolean verifyInvariants;
    private final int ringBufferSize;
    private final int metricsPort;
    private final int statsIntervalSeconds;

    private EngineConfig(Builder builder) {
        this.inputPath = builder.inputPath;
        this.outputFormat = builder.outputFormat;
        this.topOfBook = builder.topOfBook;
        this.strictParsing = builder.strictParsing;
        this.verifyInvariants = builder.verifyInvariants;
        this.ringBufferSize = builder.ringBufferSize;
        this.metricsPort = builder.metricsPort;
        this.statsIntervalSeconds = builder.statsIntervalSeconds;
    }

    /**
     * Parse configuration from the process environment with sensible defaults.
     */
    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static EngineConfig fromEnv(Map<String, String> env) {
        Builder builder = new Builder();
        builder.inputPath = getEnv(env, "ORDER_BOOK_INPUT", null);
        builder.outputFormat = OutcomeFormat.fromName(getEnv(env, "OUTPUT_FORMAT", "csv"));
        builder.topOfBook = getEnvBoolean(env, "TOP_OF_BOOK", false);
        builder.strictParsing = getEnvBoolean(env, "STRICT_PARSING", false);
        builder.verifyInvariants = getEnvBoolean(env, "VERIFY_INVARIANTS", false);
        builder.ringBufferSize = getEnvInt(env, "RING_BUFFER_SIZE", 1024);
        builder.metricsPort = getEnvInt(env, "METRICS_PORT", 0);
        builder.statsIntervalSeconds = getEnvInt(env, "STATS_INTERVAL_SECONDS", 0);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.inputPath = inputPath;
        builder.outputFormat = outputFormat;
        builder.topOfBook = topOfBook;
        builder.strictParsing = strictParsing;
        builder.verifyInvariants = verifyInvariants;
        builder.ringBufferSize = ringBufferSize;
        builder.metricsPort = metricsPort;
        builder.statsIntervalSeconds = statsIntervalSeconds;
        return builder;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static boolean getEnvBoolean(Map<String, String> env, String key, boolean defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    private static int getEnvInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric {}='{}', using {}", key, value, defaultValue);
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /** Command file path, or null for standard input. */
    public String getInputPath() {
        return inputPath;
    }

    public OutcomeFormat getOutputFormat() {
        return outputFormat;
    }

    public boolean isTopOfBook() {
        return topOfBook;
    }

    public boolean isStrictParsing() {
        return strictParsing;
    }

    public boolean isVerifyInvariants() {
        return verifyInvariants;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "input='" + (inputPath != null ? inputPath : "<stdin>") + '\'' +
                ", outputFormat=" + outputFormat +
                ", topOfBook=" + topOfBook +
                ", strictParsing=" + strictParsing +
                ", verifyInvariants=" + verifyInvariants +
                ", ringBufferSize=" + ringBufferSize +
                ", metricsPort=" + metricsPort +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                '}';
    }

    public static final class Builder {
        private String inputPath;
        private OutcomeFormat outputFormat = OutcomeFormat.CSV;
        private boolean topOfBook;
        private boolean strictParsing;
        private boolean verifyInvariants;
        private int ringBufferSize = 1024;
        private int metricsPort;
        private int statsIntervalSeconds;

        private Builder() {
        }

        public Builder inputPath(String inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder outputFormat(OutcomeFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder topOfBook(boolean topOfBook) {
            this.topOfBook = topOfBook;
            return this;
        }

        public Builder strictParsing(boolean strictParsing) {
            this.strictParsing = strictParsing;
            return this;
        }

        public Builder verifyInvariants(boolean verifyInvariants) {
            this.verifyInvariants = verifyInvariants;
            return this;
        }

        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder statsIntervalSeconds(int statsIntervalSeconds) {
            this.statsIntervalSeconds = statsIntervalSeconds;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public EngineConfig build() {
            if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be a power of two: " + ringBufferSize);
            }
            if (metricsPort < 0 || metricsPort > 65535) {
                throw new IllegalArgumentException("Metrics port out of range: " + metricsPort);
            }
            if (statsIntervalSeconds < 0) {
                throw new IllegalArgumentException("Stats interval must not be negative: " + statsIntervalSeconds);
            }
            if (outputFormat == null) {
                throw new IllegalArgumentException("Output format is required");
            }
            return new EngineConfig(this);
        }
    }
}
