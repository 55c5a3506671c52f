package com.example.userload.client;

import java.util.List;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LoadTestStatsPropertyTest {

    @Property(tries = 100)
    @Label("Outcome counts add up to the attempts of each operation")
    void countsSumToAttempts(@ForAll @Size(max = 300) List<CallOutcome> registers,
                             @ForAll @Size(max = 300) List<CallOutcome> logins) {
        LoadTestStats stats = new LoadTestStats();
        registers.forEach(outcome -> stats.record(Operation.REGISTER, outcome, 1_000_000));
        logins.forEach(outcome -> stats.record(Operation.LOGIN, outcome, 2_000_000));

        assertThat(stats.attempts(Operation.REGISTER)).isEqualTo(registers.size());
        assertThat(stats.attempts(Operation.LOGIN)).isEqualTo(logins.size());
        for (CallOutcome outcome : CallOutcome.values()) {
            assertThat(stats.count(Operation.REGISTER, outcome))
                    .isEqualTo(registers.stream().filter(outcome::equals).count());
            assertThat(stats.count(Operation.LOGIN, outcome))
                    .isEqualTo(logins.stream().filter(outcome::equals).count());
        }
    }

    @Property(tries = 50)
    @Label("Counters never go down")
    void countersAreMonotonic(@ForAll @Size(min = 1, max = 100) List<CallOutcome> outcomes) {
        LoadTestStats stats = new LoadTestStats();
        long previous = 0;
        for (CallOutcome outcome : outcomes) {
            stats.record(Operation.REGISTER, outcome, 500_000);
            long current = stats.attempts(Operation.REGISTER);
            assertThat(current).isEqualTo(previous + 1);
            previous = current;
        }
    }

    @Property(tries = 50)
    @Label("Latency snapshots count every recorded call, including out of range ones")
    void latencyCountsEveryCall(@ForAll @Size(min = 1, max = 50) List<@LongRange(min = 0, max = 120_000_000_000L) Long> latencies) {
        LoadTestStats stats = new LoadTestStats();
        latencies.forEach(nanos -> stats.record(Operation.LOGIN, CallOutcome.SUCCESS, nanos));

        LatencySnapshot first = stats.latency(Operation.LOGIN);
        LatencySnapshot second = stats.latency(Operation.LOGIN);

        assertThat(first.getCount()).isEqualTo(latencies.size());
        assertThat(second.getCount()).isEqualTo(latencies.size());
        assertThat(first.getP99Millis()).isGreaterThanOrEqualTo(first.getP95Millis());
        assertThat(stats.latency(Operation.REGISTER).getCount()).isZero();
    }

    @Property(tries = 50)
    @Label("Outcomes counted without latency leave the histogram untouched")
    void countingWithoutLatencySkipsHistogram(@ForAll @Size(max = 100) List<CallOutcome> timed,
                                              @ForAll @Size(max = 100) List<CallOutcome> untimed) {
        LoadTestStats stats = new LoadTestStats();
        timed.forEach(outcome -> stats.record(Operation.REGISTER, outcome, 3_000_000));
        untimed.forEach(outcome -> stats.recordWithoutLatency(Operation.REGISTER, outcome));

        assertThat(stats.attempts(Operation.REGISTER)).isEqualTo(timed.size() + untimed.size());
        assertThat(stats.latency(Operation.REGISTER).getCount()).isEqualTo(timed.size());
        if (!timed.isEmpty()) {
            assertThat(stats.latency(Operation.REGISTER).getAvgMillis()).isCloseTo(3.0, within(0.01));
        }
    }

    @Property(tries = 30)
    @Label("Latencies beyond ten seconds are clamped to the highest trackable value")
    void slowCallsAreClamped(@ForAll @Size(min = 1, max = 20) List<@LongRange(min = 10_000_000_000L, max = 300_000_000_000L) Long> latencies) {
        LoadTestStats stats = new LoadTestStats();
        latencies.forEach(nanos -> stats.record(Operation.REGISTER, CallOutcome.FAILED, nanos));

        LatencySnapshot snapshot = stats.latency(Operation.REGISTER);
        assertThat(snapshot.getCount()).isEqualTo(latencies.size());
        assertThat(snapshot.getP99Millis()).isBetween(9_990.0, 10_100.0);
    }
}
