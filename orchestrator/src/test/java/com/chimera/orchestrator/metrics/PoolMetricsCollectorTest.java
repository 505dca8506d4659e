package com.chimera.orchestrator.metrics;

import com.chimera.orchestrator.model.ChimeraPhase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PoolMetricsCollectorTest {

    SimpleMeterRegistry  meters;
    PoolMetricsCollector collector;

    @BeforeEach
    void setUp() {
        meters    = new SimpleMeterRegistry();
        collector = new PoolMetricsCollector(meters, 4);
    }

    @Test
    void emptySnapshot_hasZeroRates() {
        PoolMetrics m = collector.snapshot(3, 0, 3, 0);

        assertThat(m.poolSize()).isEqualTo(3);
        assertThat(m.availableSlots()).isEqualTo(3);
        assertThat(m.poolUtilizationPct()).isZero();
        assertThat(m.queueDepth()).isZero();
        assertThat(m.totalWorkflowsProcessed()).isZero();
        assertThat(m.successRate()).isZero();
        assertThat(m.avgWorkflowDurationMs()).isZero();
        assertThat(m.p99DurationMs()).isZero();
        assertThat(m.failureRateByPhase()).isEmpty();
    }

    @Test
    void countsAndRatesStayConsistent() {
        collector.recordSuccess(Duration.ofMillis(100));
        collector.recordSuccess(Duration.ofMillis(300));
        collector.recordFailure(Duration.ofMillis(200), ChimeraPhase.REVIEW);
        collector.recordRetry();

        PoolMetrics m = collector.snapshot(4, 1, 3, 7);

        assertThat(m.poolUtilizationPct()).isEqualTo(25.0);
        assertThat(m.queueDepth()).isEqualTo(7);
        assertThat(m.totalWorkflowsProcessed()).isEqualTo(3);
        assertThat(m.totalWorkflowsSucceeded() + m.totalWorkflowsFailed()).isEqualTo(m.totalWorkflowsProcessed());
        assertThat(m.successRate()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(m.avgWorkflowDurationMs()).isCloseTo(200.0, within(1e-9));
        assertThat(m.totalRetryAttempts()).isEqualTo(1);
        assertThat(m.failureRateByPhase()).containsOnlyKeys("REVIEW");
        assertThat(m.failureRateByPhase().get("REVIEW")).isCloseTo(1.0 / 3.0, within(1e-9));

        assertThat(meters.counter("chimera.workflows", "outcome", "succeeded").count()).isEqualTo(2.0);
        assertThat(meters.counter("chimera.workflows", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void percentiles_useSlidingWindowButAverageCoversAll() {
        collector.recordSuccess(Duration.ofMillis(10_000));   // falls out of the window of 4
        for (int ms : new int[]{10, 20, 30, 40}) {
            collector.recordSuccess(Duration.ofMillis(ms));
        }

        PoolMetrics m = collector.snapshot(1, 0, 1, 0);

        assertThat(m.p50DurationMs()).isEqualTo(20.0);
        assertThat(m.p99DurationMs()).isEqualTo(40.0);
        assertThat(m.avgWorkflowDurationMs()).isCloseTo(10_100.0 / 5, within(1e-9));
    }

    @Test
    void percentile_nearestRank() {
        double[] sorted = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        assertThat(PoolMetricsCollector.percentile(sorted, 0.50)).isEqualTo(5.0);
        assertThat(PoolMetricsCollector.percentile(sorted, 0.95)).isEqualTo(10.0);
        assertThat(PoolMetricsCollector.percentile(new double[0], 0.5)).isZero();
    }
}
