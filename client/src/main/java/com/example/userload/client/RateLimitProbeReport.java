package com.example.userload.client;

/**
 * Tally of one sequential rate-limit probe against a single operation.
 */
public final class RateLimitProbeReport {

    private final Operation operation;
    private final String expectedLimit;
    private final boolean skipped;
    private int attempts;
    private int successes;
    private int rateLimited;
    private int failed;

    private RateLimitProbeReport(Operation operation, String expectedLimit, boolean skipped) {
        this.operation = operation;
        this.expectedLimit = expectedLimit;
        this.skipped = skipped;
    }

    static RateLimitProbeReport start(Operation operation, String expectedLimit) {
        return new RateLimitProbeReport(operation, expectedLimit, false);
    }

    static RateLimitProbeReport skipped(Operation operation, String expectedLimit) {
        return new RateLimitProbeReport(operation, expectedLimit, true);
    }

    void record(CallOutcome outcome) {
        attempts++;
        switch (outcome) {
            case SUCCESS -> successes++;
            case RATE_LIMITED -> rateLimited++;
            case FAILED -> failed++;
        }
    }

    public Operation getOperation() {
        return operation;
    }

    public String getExpectedLimit() {
        return expectedLimit;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getSuccesses() {
        return successes;
    }

    public int getRateLimited() {
        return rateLimited;
    }

    public int getFailed() {
        return failed;
    }

    /** True once the service pushed back at least once during the probe. */
    public boolean limitObserved() {
        return rateLimited > 0;
    }
}
