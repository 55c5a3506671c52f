package com.example.userload.client;

/**
 * Latency of one operation so far, in milliseconds.
 */
public final class LatencySnapshot {

    private final long count;
    private final double avgMillis;
    private final double p95Millis;
    private final double p99Millis;

    public LatencySnapshot(long count, double avgMillis, double p95Millis, double p99Millis) {
        this.count = count;
        this.avgMillis = avgMillis;
        this.p95Millis = p95Millis;
        this.p99Millis = p99Millis;
    }

    public long getCount() {
        return count;
    }

    public double getAvgMillis() {
        return avgMillis;
    }

    public double getP95Millis() {
        return p95Millis;
    }

    public double getP99Millis() {
        return p99Millis;
    }
}
