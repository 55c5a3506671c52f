package com.example.userload.client;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Run parameters. Positional arguments cover what changes between runs (target, user count, batch
 * size, workers); the rest are {@code -Duserload.*} system properties.
 */
public final class LoadTestConfig {

    static final String DEFAULT_TARGET = "localhost:50051";
    static final int DEFAULT_NUM_USERS = 10_000;
    static final int DEFAULT_BATCH_SIZE = 100;
    static final int DEFAULT_WORKERS = 20;

    private final String target;
    private final int numUsers;
    private final int batchSize;
    private final int workers;
    private final Duration callTimeout;
    private final int probeAttempts;
    private final Duration probeDelay;
    private final Duration phasePause;
    private final int progressInterval;
    private final int errorLogCap;
    private final boolean assumeYes;

    private LoadTestConfig(Builder builder) {
        this.target = builder.target;
        this.numUsers = builder.numUsers;
        this.batchSize = builder.batchSize;
        this.workers = builder.workers;
        this.callTimeout = builder.callTimeout;
        this.probeAttempts = builder.probeAttempts;
        this.probeDelay = builder.probeDelay;
        this.phasePause = builder.phasePause;
        this.progressInterval = builder.progressInterval;
        this.errorLogCap = builder.errorLogCap;
        this.assumeYes = builder.assumeYes;
    }

    public static LoadTestConfig fromArgs(String[] args) {
        return fromArgs(args, System.getProperties(), System.getenv());
    }

    static LoadTestConfig fromArgs(String[] args, Properties properties, Map<String, String> env) {
        return builder()
                .target(getArg(args, 0, DEFAULT_TARGET))
                .numUsers(parseInt("numUsers", getArg(args, 1, String.valueOf(DEFAULT_NUM_USERS))))
                .batchSize(parseInt("batchSize", getArg(args, 2, String.valueOf(DEFAULT_BATCH_SIZE))))
                .workers(parseInt("workers", getArg(args, 3, String.valueOf(DEFAULT_WORKERS))))
                .callTimeout(Duration.ofSeconds(intProperty(properties, "userload.callTimeoutSeconds", 10)))
                .probeAttempts(intProperty(properties, "userload.probeAttempts", 10))
                .probeDelay(Duration.ofMillis(intProperty(properties, "userload.probeDelayMillis", 100)))
                .phasePause(Duration.ofMillis(intProperty(properties, "userload.phasePauseMillis", 2000)))
                .progressInterval(intProperty(properties, "userload.progressInterval", 1000))
                .errorLogCap(intProperty(properties, "userload.errorLogCap", 10))
                .assumeYes(Boolean.parseBoolean(properties.getProperty("userload.assumeYes", "false"))
                        || Boolean.parseBoolean(env.getOrDefault("USERLOAD_ASSUME_YES", "false")))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTarget() {
        return target;
    }

    public int getNumUsers() {
        return numUsers;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public int getProbeAttempts() {
        return probeAttempts;
    }

    public Duration getProbeDelay() {
        return probeDelay;
    }

    public Duration getPhasePause() {
        return phasePause;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public int getErrorLogCap() {
        return errorLogCap;
    }

    public boolean isAssumeYes() {
        return assumeYes;
    }

    private static String getArg(String[] args, int index, String defaultValue) {
        if (args.length > index && args[index] != null && !args[index].isBlank()) {
            return args[index];
        }
        return defaultValue;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return parseInt(key, value);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    public static final class Builder {

        private String target = DEFAULT_TARGET;
        private int numUsers = DEFAULT_NUM_USERS;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int workers = DEFAULT_WORKERS;
        private Duration callTimeout = Duration.ofSeconds(10);
        private int probeAttempts = 10;
        private Duration probeDelay = Duration.ofMillis(100);
        private Duration phasePause = Duration.ofSeconds(2);
        private int progressInterval = 1000;
        private int errorLogCap = 10;
        private boolean assumeYes;

        private Builder() {
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder numUsers(int numUsers) {
            this.numUsers = numUsers;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder probeAttempts(int probeAttempts) {
            this.probeAttempts = probeAttempts;
            return this;
        }

        public Builder probeDelay(Duration probeDelay) {
            this.probeDelay = probeDelay;
            return this;
        }

        public Builder phasePause(Duration phasePause) {
            this.phasePause = phasePause;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder errorLogCap(int errorLogCap) {
            this.errorLogCap = errorLogCap;
            return this;
        }

        public Builder assumeYes(boolean assumeYes) {
            this.assumeYes = assumeYes;
            return this;
        }

        public LoadTestConfig build() {
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("target must not be blank");
            }
            requirePositive("numUsers", numUsers);
            requirePositive("batchSize", batchSize);
            requirePositive("workers", workers);
            requirePositive("probeAttempts", probeAttempts);
            requirePositive("progressInterval", progressInterval);
            if (errorLogCap < 0) {
                throw new IllegalArgumentException("errorLogCap must not be negative, got " + errorLogCap);
            }
            if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
                throw new IllegalArgumentException("callTimeout must be positive, got " + callTimeout);
            }
            requireNotNegative("probeDelay", probeDelay);
            requireNotNegative("phasePause", phasePause);
            return new LoadTestConfig(this);
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }

        private static void requireNotNegative(String name, Duration value) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative, got " + value);
            }
        }
    }
}
