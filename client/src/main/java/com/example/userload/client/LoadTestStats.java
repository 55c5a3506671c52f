package com.example.userload.client;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;

/**
 * Counters and latency histograms shared by every worker of a load test run.
 */
public class LoadTestStats {

    private static final long HIGHEST_LATENCY_MICROS = TimeUnit.SECONDS.toMicros(10);
    private static final int SIGNIFICANT_DIGITS = 3;

    private final Map<Operation, Map<CallOutcome, LongAdder>> counters = new EnumMap<>(Operation.class);
    private final Map<Operation, LatencyTrack> latencies = new EnumMap<>(Operation.class);
    private final AtomicLong bulkElapsedNanos = new AtomicLong();
    private final AtomicLong bulkCompleted = new AtomicLong();

    public LoadTestStats() {
        for (Operation operation : Operation.values()) {
            Map<CallOutcome, LongAdder> byOutcome = new EnumMap<>(CallOutcome.class);
            for (CallOutcome outcome : CallOutcome.values()) {
                byOutcome.put(outcome, new LongAdder());
            }
            counters.put(operation, byOutcome);
            latencies.put(operation, new LatencyTrack());
        }
    }

    public void record(Operation operation, CallOutcome outcome, long latencyNanos) {
        counters.get(operation).get(outcome).increment();
        latencies.get(operation).record(latencyNanos);
    }

    /** Counts an outcome that has no meaningful latency, such as a task that died before its call. */
    public void recordWithoutLatency(Operation operation, CallOutcome outcome) {
        counters.get(operation).get(outcome).increment();
    }

    public long count(Operation operation, CallOutcome outcome) {
        return counters.get(operation).get(outcome).sum();
    }

    public long attempts(Operation operation) {
        long total = 0;
        for (LongAdder adder : counters.get(operation).values()) {
            total += adder.sum();
        }
        return total;
    }

    public void recordBulkRun(long completed, long elapsedNanos) {
        bulkCompleted.set(completed);
        bulkElapsedNanos.set(elapsedNanos);
    }

    public Duration bulkElapsed() {
        return Duration.ofNanos(bulkElapsedNanos.get());
    }

    public double bulkSeconds() {
        return bulkElapsedNanos.get() / 1_000_000_000.0;
    }

    public long bulkCompleted() {
        return bulkCompleted.get();
    }

    /** Completed bulk registrations per second, or 0 before a bulk run finished. */
    public double bulkThroughput() {
        double seconds = bulkSeconds();
        return seconds > 0 ? bulkCompleted.get() / seconds : 0.0;
    }

    public LatencySnapshot latency(Operation operation) {
        return latencies.get(operation).snapshot();
    }

    private static final class LatencyTrack {

        private final Recorder recorder = new Recorder(HIGHEST_LATENCY_MICROS, SIGNIFICANT_DIGITS);
        private final Histogram accumulated = new Histogram(HIGHEST_LATENCY_MICROS, SIGNIFICANT_DIGITS);

        void record(long latencyNanos) {
            long micros = Math.max(1, TimeUnit.NANOSECONDS.toMicros(latencyNanos));
            recorder.recordValue(Math.min(micros, HIGHEST_LATENCY_MICROS));
        }

        synchronized LatencySnapshot snapshot() {
            accumulated.add(recorder.getIntervalHistogram());
            return new LatencySnapshot(accumulated.getTotalCount(),
                    accumulated.getMean() / 1000.0,
                    accumulated.getValueAtPercentile(95.0) / 1000.0,
                    accumulated.getValueAtPercentile(99.0) / 1000.0);
        }
    }
}
