package com.chimera.orchestrator.service;

import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.TaskStatus;
import com.chimera.orchestrator.model.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable workflow task queue.
 *
 * Stores one row per workflow request, hands ready rows out in
 * priority/FIFO order with at-most-one-claimant semantics, and persists
 * every phase transition. All state lives in the database, so a restarted
 * process resumes exactly where the last one stopped.
 *
 * Storage exceptions that survive the "task-store" retries surface as
 * {@link StorageException}; domain exceptions pass through unchanged.
 */
@Service
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    // Column widths in workflow_tasks.
    static final int MAX_ID_LENGTH  = 128;
    static final int MAX_URL_LENGTH = 2048;

    private final TaskStore store;
    private final Clock     clock;

    public TaskQueue(TaskStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Verify the task and dead-letter tables are reachable.
     *
     * Flyway creates the schema at startup, so calling this any number of
     * times has no side effects.
     */
    public void initialize() {
        guarded("initialize task store", () -> {
            store.probe();
            return null;
        });
        log.info("Task store ready");
    }

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    /**
     * Insert a new QUEUED task.
     *
     * @param id blank or null to generate a random UUID
     * @throws DuplicateTaskException   if a task with this id already exists
     * @throws IllegalArgumentException if a field is blank or longer than its column
     */
    public WorkflowTask enqueue(String id, String featureDescription, String targetUrl, int priority) {
        if (featureDescription == null || featureDescription.isBlank()) {
            throw new IllegalArgumentException("featureDescription must not be blank");
        }
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new IllegalArgumentException("targetUrl must not be blank");
        }
        if (targetUrl.length() > MAX_URL_LENGTH) {
            throw new IllegalArgumentException("targetUrl must be at most " + MAX_URL_LENGTH + " characters");
        }
        if (id != null && id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException("id must be at most " + MAX_ID_LENGTH + " characters");
        }
        String taskId = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;

        WorkflowTask task = new WorkflowTask(taskId, featureDescription, targetUrl, priority);
        Instant now = clock.instant();
        task.setCreatedAt(now);

        WorkflowTask saved = guarded("enqueue " + taskId, () -> {
            try {
                return store.insert(task);
            } catch (DataIntegrityViolationException e) {
                // Only an existing row makes this a duplicate; any other constraint is a storage fault.
                if (store.find(taskId).isPresent()) {
                    throw new DuplicateTaskException(taskId, e);
                }
                throw e;
            }
        });
        log.info("Enqueued task {} (priority {})", taskId, priority);
        return saved;
    }

    /**
     * Atomically claim up to {@code limit} ready tasks for {@code workerId}.
     *
     * Concurrent callers never receive the same task. The returned tasks are
     * RUNNING and ordered by priority DESC, created_at ASC.
     */
    public List<WorkflowTask> dequeueReady(int limit, String workerId) {
        if (limit <= 0) {
            return List.of();
        }
        List<WorkflowTask> claimed = guarded("dequeue ready tasks",
                () -> store.claimReady(limit, workerId, clock.instant()));
        if (!claimed.isEmpty()) {
            log.debug("Worker {} claimed {} task(s)", workerId, claimed.size());
        }
        return claimed;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /**
     * Advance a task to {@code phase}, merging {@code contextPatch} into its
     * context without overwriting existing keys.
     *
     * Re-applying the stored phase is a no-op.
     *
     * @throws InvalidTransitionException if the move would skip or regress a phase
     */
    public WorkflowTask updatePhase(String id, ChimeraPhase phase, Map<String, ?> contextPatch) {
        WorkflowTask task = guarded("update phase of " + id,
                () -> store.transition(id, phase, contextPatch == null ? Map.of() : contextPatch));
        log.debug("Task {} now in phase {}", id, task.getCurrentPhase());
        return task;
    }

    /** Count one retry of the current phase and remember why it was needed. */
    public WorkflowTask recordRetry(String id, String error) {
        return guarded("record retry of " + id, () -> store.recordRetry(id, error));
    }

    /**
     * Set the terminal status of a RUNNING task.
     *
     * @throws InvalidTransitionException if the task is not RUNNING, or
     *         success is claimed before the phase reached COMPLETE
     */
    public WorkflowTask complete(String id, boolean succeeded) {
        WorkflowTask task = guarded("complete " + id, () -> store.finish(id, succeeded, clock.instant()));
        log.info("Task {} finished: {}", id, task.getStatus());
        return task;
    }

    /** Change the priority of a task that is still waiting. */
    public WorkflowTask reprioritize(String id, int priority) {
        WorkflowTask task = guarded("reprioritize " + id, () -> store.reprioritize(id, priority));
        log.info("Task {} reprioritized to {}", id, priority);
        return task;
    }

    // ------------------------------------------------------------------
    // Ownership
    // ------------------------------------------------------------------

    /** Refresh the liveness timestamp of RUNNING tasks owned by {@code workerId}. */
    public int heartbeat(Collection<String> ids, String workerId) {
        return guarded("heartbeat", () -> store.heartbeat(ids, workerId, clock.instant()));
    }

    /** Give up ownership of a RUNNING task so another pool can resume it at once. */
    public boolean release(String id, String workerId) {
        return guarded("release " + id, () -> store.release(id, workerId, clock.instant()));
    }

    /**
     * Take over RUNNING tasks whose owner has not heartbeated since
     * {@code cutoff}, or that were released on shutdown.
     *
     * @param exclude ids this caller already runs
     */
    public List<WorkflowTask> reclaimStale(Instant cutoff, int limit, String workerId, Collection<String> exclude) {
        if (limit <= 0) {
            return List.of();
        }
        Collection<String> skip = exclude == null ? Set.of() : exclude;
        List<WorkflowTask> reclaimed = guarded("reclaim stale tasks",
                () -> store.claimStale(cutoff, limit, workerId, skip, clock.instant()));
        for (WorkflowTask t : reclaimed) {
            log.warn("Reclaimed task {} in phase {}", t.getId(), t.getCurrentPhase());
        }
        return reclaimed;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public WorkflowTask get(String id) {
        return guarded("get " + id, () -> store.find(id))
                .orElseThrow(() -> new TaskNotFoundException(id));
    }

    public long countByStatus(TaskStatus status) {
        return guarded("count " + status, () -> store.countByStatus(status));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T guarded(String what, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure during {}: {}", what, e.getMessage());
            throw new StorageException("Storage failure during " + what, e);
        }
    }
}
