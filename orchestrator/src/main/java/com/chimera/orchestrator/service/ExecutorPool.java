package com.chimera.orchestrator.service;

import com.chimera.orchestrator.config.ChimeraProperties;
import com.chimera.orchestrator.metrics.PoolMetrics;
import com.chimera.orchestrator.metrics.PoolMetricsCollector;
import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.TaskStatus;
import com.chimera.orchestrator.model.WorkflowTask;
import com.chimera.orchestrator.workflow.PhaseDriver;
import com.chimera.orchestrator.workflow.PhaseOutcome;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded scheduler that drives workflow tasks through the phase pipeline.
 *
 * One poll thread admits work: every tick it reclaims stale RUNNING tasks,
 * then claims QUEUED tasks, never more than the free slot count. Each
 * admitted task runs on its own worker thread, which loops
 * "phase step → persist transition" until the task is terminal.
 *
 * The database is the queue. Claims are compare-and-swap updates, so
 * several pool instances can share one task table without running a task
 * twice. Each instance refreshes the heartbeat of the tasks it owns; a task
 * whose heartbeat goes stale is picked up by whichever pool polls next.
 *
 * Graceful stop: admission halts, workers finish their current step and
 * release their task (heartbeat cleared) so the next start resumes it
 * immediately from the persisted phase.
 */
@Service
public class ExecutorPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutorPool.class);

    static final String CTX_ERROR        = "error";
    static final String CTX_FAILED_PHASE = "failed_phase";

    private static final int METRICS_WINDOW = 100;

    private final TaskQueue               queue;
    private final DeadLetterQueue         deadLetters;
    private final PhaseDriver             driver;
    private final ChimeraProperties.Pool  poolConfig;
    private final ChimeraProperties.Retry retryConfig;
    private final Clock                   clock;
    private final PoolMetricsCollector    metrics;
    private final IntervalFunction        backoff;
    private final String                  poolId = "pool-" + UUID.randomUUID().toString().substring(0, 8);

    // Slot accounting: active + available == maxConcurrent at all times.
    private final ReentrantLock         slotLock      = new ReentrantLock();
    private final Map<String, Instant>  admitted      = new ConcurrentHashMap<>();
    private int                         active        = 0;

    // Serializes admission ticks so free-slot math and claims can't interleave.
    private final ReentrantLock         admissionLock = new ReentrantLock();

    // Last successful read of the QUEUED count, served while the store is unreachable.
    private volatile long               lastQueueDepth = 0;

    private final Object                lifecycle     = new Object();
    private volatile boolean            running       = false;
    private volatile CountDownLatch     shutdownSignal = new CountDownLatch(0);
    private ScheduledExecutorService    poller;
    private ExecutorService             workers;

    public ExecutorPool(TaskQueue queue,
                        DeadLetterQueue deadLetters,
                        PhaseDriver driver,
                        ChimeraProperties properties,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.queue       = queue;
        this.deadLetters = deadLetters;
        this.driver      = driver;
        this.poolConfig  = properties.pool();
        this.retryConfig = properties.retry();
        this.clock       = clock;
        this.metrics     = new PoolMetricsCollector(meterRegistry, METRICS_WINDOW);
        this.backoff     = IntervalFunction.ofExponentialRandomBackoff(
                retryConfig.initialBackoff().toMillis(),
                retryConfig.multiplier(),
                retryConfig.jitter(),
                retryConfig.maxBackoff().toMillis());

        Gauge.builder("chimera.pool.active", this, ExecutorPool::activeCount).register(meterRegistry);
        Gauge.builder("chimera.pool.available", this, ExecutorPool::availableSlots).register(meterRegistry);
        Gauge.builder("chimera.queue.depth", this, ExecutorPool::queueDepth).register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public void start() {
        synchronized (lifecycle) {
            if (running) {
                return;
            }
            queue.initialize();
            shutdownSignal = new CountDownLatch(1);
            poller  = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("chimera-poll-"));
            workers = Executors.newFixedThreadPool(poolConfig.maxConcurrent(),
                    new CustomizableThreadFactory("chimera-worker-"));
            running = true;

            // First tick runs immediately, which doubles as restart recovery.
            poller.scheduleWithFixedDelay(this::tick,
                    0, poolConfig.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
            poller.scheduleAtFixedRate(this::heartbeat,
                    poolConfig.heartbeatInterval().toMillis(),
                    poolConfig.heartbeatInterval().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Executor pool {} started (max {} concurrent workflows)", poolId, poolConfig.maxConcurrent());
        }
    }

    @Override
    public void stop() {
        ScheduledExecutorService oldPoller;
        ExecutorService oldWorkers;
        synchronized (lifecycle) {
            if (!running) {
                return;
            }
            running = false;
            shutdownSignal.countDown();
            oldPoller  = poller;
            oldWorkers = workers;
        }
        log.info("Executor pool {} stopping; {} workflow(s) in flight", poolId, activeCount());

        oldWorkers.shutdown();
        try {
            long timeoutMs = poolConfig.shutdownTimeout().toMillis();
            if (!oldWorkers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {} ms; interrupting", timeoutMs);
                oldWorkers.shutdownNow();
                oldWorkers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            oldWorkers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            oldPoller.shutdownNow();
        }

        // Anything still owned (worker stuck past the deadline) is handed back.
        for (String id : Set.copyOf(admitted.keySet())) {
            releaseQuietly(id);
        }
        log.info("Executor pool {} stopped", poolId);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return poolConfig.autoStart();
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Hint that {@code task} was just enqueued. Schedules an immediate
     * admission tick; the task still goes through the normal claim path.
     */
    public void submitWorkflow(WorkflowTask task) {
        ScheduledExecutorService p = poller;
        if (!running || p == null) {
            log.debug("Pool not running; task {} will be picked up after start", task.getId());
            return;
        }
        try {
            p.execute(this::tick);
        } catch (RejectedExecutionException e) {
            log.debug("Pool shutting down; submit hint for {} dropped", task.getId());
        }
    }

    public int activeCount() {
        slotLock.lock();
        try {
            return active;
        } finally {
            slotLock.unlock();
        }
    }

    public int availableSlots() {
        slotLock.lock();
        try {
            return poolConfig.maxConcurrent() - active;
        } finally {
            slotLock.unlock();
        }
    }

    public PoolMetrics getMetrics() {
        long depth = queueDepth();
        slotLock.lock();
        try {
            return metrics.snapshot(poolConfig.maxConcurrent(), active, poolConfig.maxConcurrent() - active, depth);
        } finally {
            slotLock.unlock();
        }
    }

    /** QUEUED tasks waiting in the store; the last known value if the store is unreachable. */
    public long queueDepth() {
        try {
            lastQueueDepth = queue.countByStatus(TaskStatus.QUEUED);
        } catch (StorageException e) {
            log.warn("Queue depth unavailable, reporting last value {}: {}", lastQueueDepth, e.getMessage());
        }
        return lastQueueDepth;
    }

    /** Identifier written to worker_id on every task this pool owns. */
    public String poolId() {
        return poolId;
    }

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    /**
     * One admission pass. Runs on the poll thread only; exceptions are
     * logged so the periodic schedule survives a bad tick.
     */
    void tick() {
        if (!running) {
            return;
        }
        admissionLock.lock();
        try {
            int free = availableSlots();
            if (free <= 0) {
                return;
            }
            Instant cutoff = clock.instant().minus(poolConfig.staleAfter());
            List<WorkflowTask> reclaimed = queue.reclaimStale(cutoff, free, poolId, Set.copyOf(admitted.keySet()));
            reclaimed.forEach(this::launch);
            free -= reclaimed.size();

            if (free > 0) {
                queue.dequeueReady(free, poolId).forEach(this::launch);
            }
        } catch (StorageException e) {
            log.warn("Admission tick skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in admission tick", e);
        } finally {
            admissionLock.unlock();
        }
    }

    private void launch(WorkflowTask task) {
        Instant admittedAt = task.getAdmittedAt() != null ? task.getAdmittedAt() : clock.instant();
        slotLock.lock();
        try {
            active++;
            admitted.put(task.getId(), admittedAt);
        } finally {
            slotLock.unlock();
        }
        try {
            workers.execute(() -> runWorkflow(task, admittedAt));
            log.info("Admitted task {} in phase {}", task.getId(), task.getCurrentPhase());
        } catch (RejectedExecutionException e) {
            log.info("Pool shutting down; handing task {} back", task.getId());
            releaseQuietly(task.getId());
            freeSlot(task.getId());
        }
    }

    private void heartbeat() {
        if (admitted.isEmpty()) {
            return;
        }
        try {
            queue.heartbeat(Set.copyOf(admitted.keySet()), poolId);
        } catch (StorageException e) {
            log.warn("Heartbeat failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in heartbeat", e);
        }
    }

    // ------------------------------------------------------------------
    // Worker loop
    // ------------------------------------------------------------------

    private void runWorkflow(WorkflowTask task, Instant admittedAt) {
        String id = task.getId();
        MDC.put("taskId", id);
        MDC.put("workerId", poolId);
        try {
            WorkflowTask current = task;
            while (!current.getCurrentPhase().isTerminal()) {
                if (shuttingDown()) {
                    releaseQuietly(id);
                    log.info("Released task {} in phase {} for shutdown", id, current.getCurrentPhase());
                    return;
                }
                MDC.put("phase", current.getCurrentPhase().name());
                current = step(current);
            }
            MDC.put("phase", current.getCurrentPhase().name());
            finish(current, admittedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted; releasing task {}", id);
            releaseQuietly(id);
        } catch (StorageException e) {
            // Row stays RUNNING; once its heartbeat goes stale a later tick resumes it.
            log.error("Storage unavailable while running task {}: {}", id, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled error while running task {}", id, e);
        } finally {
            freeSlot(id);
            MDC.clear();
        }
    }

    /** Run the current phase once and persist what happened. */
    private WorkflowTask step(WorkflowTask current) throws InterruptedException {
        PhaseOutcome outcome = driver.execute(current);
        switch (outcome.kind()) {
            case ADVANCED:
                log.info("Task {} {} → {}", current.getId(), current.getCurrentPhase(), outcome.next());
                return transition(current, outcome.next(), outcome.contextPatch());
            case REJECTED:
                log.warn("Task {} rejected in {}: {}", current.getId(), current.getCurrentPhase(), outcome.reason());
                return fail(current, outcome.reason());
            case ERROR:
            default:
                return retryOrFail(current, outcome.reason());
        }
    }

    private WorkflowTask retryOrFail(WorkflowTask current, String reason) throws InterruptedException {
        if (current.getRetryCount() >= retryConfig.maxRetries()) {
            log.error("Task {} exhausted {} retries in {}: {}",
                    current.getId(), retryConfig.maxRetries(), current.getCurrentPhase(), reason);
            return fail(current, "Retries exhausted in " + current.getCurrentPhase() + ": " + reason);
        }
        WorkflowTask updated = queue.recordRetry(current.getId(), reason);
        metrics.recordRetry();
        long waitMs = backoff.apply(updated.getRetryCount());
        log.warn("Task {} phase {} failed (attempt {}/{}): {}; retrying in {} ms",
                current.getId(), current.getCurrentPhase(),
                updated.getRetryCount(), retryConfig.maxRetries(), reason, waitMs);
        // Returns early if stop() is called; the loop then releases the task.
        shutdownSignal.await(waitMs, TimeUnit.MILLISECONDS);
        return updated;
    }

    private WorkflowTask transition(WorkflowTask current, ChimeraPhase next, Map<String, Object> patch) {
        try {
            return queue.updatePhase(current.getId(), next, patch);
        } catch (InvalidTransitionException e) {
            log.error("Task {}: {}", current.getId(), e.getMessage());
            return fail(current, e.getMessage());
        }
    }

    private WorkflowTask fail(WorkflowTask current, String reason) {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(CTX_ERROR, reason);
        patch.put(CTX_FAILED_PHASE, current.getCurrentPhase().name());
        try {
            return queue.updatePhase(current.getId(), ChimeraPhase.FAILED, patch);
        } catch (InvalidTransitionException e) {
            // Stored row is already terminal; trust it over our copy.
            log.warn("Task {} could not be marked FAILED: {}", current.getId(), e.getMessage());
            return queue.get(current.getId());
        }
    }

    /** Terminal phase reached: set status, audit failures, record metrics. */
    private void finish(WorkflowTask current, Instant admittedAt) {
        boolean succeeded = current.getCurrentPhase() == ChimeraPhase.COMPLETE;
        WorkflowTask done;
        try {
            done = queue.complete(current.getId(), succeeded);
        } catch (InvalidTransitionException e) {
            log.warn("Task {} already finished elsewhere: {}", current.getId(), e.getMessage());
            return;
        }
        Instant end = done.getFinishedAt() != null ? done.getFinishedAt() : clock.instant();
        Duration duration = Duration.between(admittedAt, end);

        if (succeeded) {
            metrics.recordSuccess(duration);
            log.info("Task {} completed in {} ms", done.getId(), duration.toMillis());
            return;
        }

        ChimeraPhase failedPhase = failedPhaseOf(done);
        String reason = done.contextString(CTX_ERROR) != null ? done.contextString(CTX_ERROR) : done.getLastError();
        metrics.recordFailure(duration, failedPhase);
        try {
            deadLetters.add(done, reason, failedPhase);
        } catch (RuntimeException e) {
            log.error("Could not write dead letter for task {}", done.getId(), e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean shuttingDown() {
        return shutdownSignal.getCount() == 0;
    }

    private void freeSlot(String id) {
        slotLock.lock();
        try {
            if (admitted.remove(id) != null) {
                active--;
            }
        } finally {
            slotLock.unlock();
        }
    }

    private void releaseQuietly(String id) {
        try {
            queue.release(id, poolId);
        } catch (RuntimeException e) {
            log.warn("Could not release task {}; it will be reclaimed once stale: {}", id, e.getMessage());
        }
    }

    private static ChimeraPhase failedPhaseOf(WorkflowTask task) {
        String name = task.contextString(CTX_FAILED_PHASE);
        if (name == null) {
            return null;
        }
        try {
            return ChimeraPhase.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("Task {} has unknown failed_phase '{}'", task.getId(), name);
            return null;
        }
    }
}
