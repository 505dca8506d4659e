package com.chimera.orchestrator.metrics;

import com.chimera.orchestrator.model.ChimeraPhase;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Running totals for finished workflows.
 *
 * Counters and the running mean cover every workflow this pool finished;
 * percentiles use the last {@code windowSize} durations. Each outcome is
 * also published to Micrometer:
 * <pre>
 *   chimera.workflows{outcome="succeeded|failed"}
 *   chimera.workflow.duration{outcome}
 *   chimera.phase.retries
 * </pre>
 * All methods are synchronized; calls are infrequent (once per workflow or retry).
 */
public class PoolMetricsCollector {

    private final MeterRegistry meterRegistry;
    private final int           windowSize;

    private long   processed;
    private long   succeeded;
    private long   failed;
    private double totalDurationMs;
    private long   retryAttempts;
    private final Deque<Double>             window         = new ArrayDeque<>();
    private final Map<ChimeraPhase, Long>   failuresByPhase = new EnumMap<>(ChimeraPhase.class);

    public PoolMetricsCollector(MeterRegistry meterRegistry, int windowSize) {
        this.meterRegistry = meterRegistry;
        this.windowSize    = windowSize;
    }

    public synchronized void recordSuccess(Duration duration) {
        processed++;
        succeeded++;
        addDuration(duration, "succeeded");
    }

    /** @param failedPhase phase the workflow was in when it failed; may be null */
    public synchronized void recordFailure(Duration duration, ChimeraPhase failedPhase) {
        processed++;
        failed++;
        if (failedPhase != null) {
            failuresByPhase.merge(failedPhase, 1L, Long::sum);
        }
        addDuration(duration, "failed");
    }

    public synchronized void recordRetry() {
        retryAttempts++;
        meterRegistry.counter("chimera.phase.retries").increment();
    }

    public synchronized PoolMetrics snapshot(int poolSize, int active, int available, long queueDepth) {
        double[] sorted = window.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);

        Map<String, Double> rateByPhase = new LinkedHashMap<>();
        failuresByPhase.forEach((phase, count) -> rateByPhase.put(phase.name(), (double) count / processed));

        return new PoolMetrics(
                poolSize,
                active,
                available,
                poolSize == 0 ? 0.0 : active * 100.0 / poolSize,
                queueDepth,
                processed,
                succeeded,
                failed,
                processed == 0 ? 0.0 : totalDurationMs / processed,
                processed == 0 ? 0.0 : (double) succeeded / processed,
                percentile(sorted, 0.50),
                percentile(sorted, 0.95),
                percentile(sorted, 0.99),
                retryAttempts,
                rateByPhase);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void addDuration(Duration duration, String outcome) {
        Duration d = (duration == null || duration.isNegative()) ? Duration.ZERO : duration;
        double ms = d.toNanos() / 1_000_000.0;
        totalDurationMs += ms;
        window.addLast(ms);
        while (window.size() > windowSize) {
            window.removeFirst();
        }
        meterRegistry.counter("chimera.workflows", "outcome", outcome).increment();
        meterRegistry.timer("chimera.workflow.duration", "outcome", outcome).record(d.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Nearest-rank percentile; 0 for an empty window. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(p * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }
}
