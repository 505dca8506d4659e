package com.chimera.orchestrator.service;

import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.TaskStatus;
import com.chimera.orchestrator.model.WorkflowTask;
import com.chimera.orchestrator.repository.DeadLetterRepository;
import com.chimera.orchestrator.repository.WorkflowTaskRepository;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional storage operations behind {@link TaskQueue}.
 *
 * Each public method is one transaction wrapped in the "task-store" retry:
 * the retry aspect sits outside the transaction, so a transient failure
 * rolls the whole unit back and the next attempt starts clean.
 *
 * Callers go through TaskQueue, which translates exceptions into the
 * orchestrator's own hierarchy.
 */
@Component
public class TaskStore {

    static final String RETRY = "task-store";

    private final WorkflowTaskRepository taskRepo;
    private final DeadLetterRepository   deadLetterRepo;

    public TaskStore(WorkflowTaskRepository taskRepo, DeadLetterRepository deadLetterRepo) {
        this.taskRepo       = taskRepo;
        this.deadLetterRepo = deadLetterRepo;
    }

    @Retry(name = RETRY)
    @Transactional(readOnly = true)
    public void probe() {
        taskRepo.count();
        deadLetterRepo.count();
    }

    @Retry(name = RETRY)
    @Transactional
    public WorkflowTask insert(WorkflowTask task) {
        return taskRepo.saveAndFlush(task);
    }

    @Retry(name = RETRY)
    @Transactional(readOnly = true)
    public Optional<WorkflowTask> find(String id) {
        return taskRepo.findById(id);
    }

    /**
     * Claim up to {@code limit} QUEUED rows in admission order.
     *
     * Candidates are read without locks; each is then flipped with a
     * conditional UPDATE. Rows lost to a concurrent claimer are skipped,
     * so the result may be shorter than {@code limit}.
     */
    @Retry(name = RETRY)
    @Transactional
    public List<WorkflowTask> claimReady(int limit, String workerId, Instant now) {
        List<String> candidates = taskRepo.findReadyIds(PageRequest.of(0, limit));
        List<String> won = new ArrayList<>();
        for (String id : candidates) {
            if (taskRepo.claimQueued(id, workerId, now) == 1) {
                won.add(id);
            }
        }
        return loadInOrder(won);
    }

    /** Claim RUNNING rows whose heartbeat is older than {@code cutoff}, skipping {@code exclude}. */
    @Retry(name = RETRY)
    @Transactional
    public List<WorkflowTask> claimStale(Instant cutoff, int limit, String workerId,
                                         Collection<String> exclude, Instant now) {
        // Over-fetch so excluded ids don't starve the batch.
        List<String> candidates = taskRepo.findStaleIds(cutoff, PageRequest.of(0, limit + exclude.size()));
        List<String> won = new ArrayList<>();
        for (String id : candidates) {
            if (won.size() >= limit) {
                break;
            }
            if (exclude.contains(id)) {
                continue;
            }
            if (taskRepo.claimStale(id, workerId, cutoff, now) == 1) {
                won.add(id);
            }
        }
        return loadInOrder(won);
    }

    /**
     * Move a task to {@code target} under a row lock.
     *
     * Re-applying the phase the row already holds is a no-op, which makes
     * a replayed step after recovery harmless. Any other move requires the
     * task to be RUNNING: phases advance only once a pool has claimed it.
     */
    @Retry(name = RETRY)
    @Transactional
    public WorkflowTask transition(String id, ChimeraPhase target, Map<String, ?> patch) {
        WorkflowTask task = lockOrThrow(id);
        ChimeraPhase current = task.getCurrentPhase();
        if (current == target) {
            return task;
        }
        if (task.getStatus() != TaskStatus.RUNNING) {
            throw new InvalidTransitionException(
                    "Task " + id + " is " + task.getStatus() + ", only RUNNING tasks can change phase");
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(
                    "Task " + id + " cannot move from " + current + " to " + target);
        }
        task.extendContext(patch);
        task.setCurrentPhase(target);
        if (target != ChimeraPhase.FAILED) {
            task.setRetryCount(0);
            task.setLastError(null);
        }
        return taskRepo.saveAndFlush(task);
    }

    @Retry(name = RETRY)
    @Transactional
    public WorkflowTask recordRetry(String id, String error) {
        WorkflowTask task = lockOrThrow(id);
        task.incrementRetryCount();
        task.setLastError(error);
        return taskRepo.saveAndFlush(task);
    }

    /**
     * Set the terminal status of a RUNNING task.
     *
     * Success requires the phase to have reached COMPLETE. Failure moves any
     * non-terminal phase to FAILED so status and phase never disagree.
     */
    @Retry(name = RETRY)
    @Transactional
    public WorkflowTask finish(String id, boolean succeeded, Instant now) {
        WorkflowTask task = lockOrThrow(id);
        if (task.getStatus() != TaskStatus.RUNNING) {
            throw new InvalidTransitionException(
                    "Task " + id + " is " + task.getStatus() + ", only RUNNING tasks can complete");
        }
        if (succeeded) {
            if (task.getCurrentPhase() != ChimeraPhase.COMPLETE) {
                throw new InvalidTransitionException(
                        "Task " + id + " cannot succeed from phase " + task.getCurrentPhase());
            }
            task.setStatus(TaskStatus.COMPLETED);
        } else {
            if (task.getCurrentPhase() == ChimeraPhase.COMPLETE) {
                throw new InvalidTransitionException(
                        "Task " + id + " reached COMPLETE and cannot be marked failed");
            }
            task.setCurrentPhase(ChimeraPhase.FAILED);
            task.setStatus(TaskStatus.FAILED);
        }
        task.setFinishedAt(now);
        task.setWorkerId(null);
        task.setHeartbeatAt(null);
        return taskRepo.saveAndFlush(task);
    }

    @Retry(name = RETRY)
    @Transactional
    public WorkflowTask reprioritize(String id, int priority) {
        WorkflowTask task = lockOrThrow(id);
        if (task.getStatus() != TaskStatus.QUEUED) {
            throw new InvalidTransitionException(
                    "Task " + id + " is " + task.getStatus() + ", only QUEUED tasks can be reprioritized");
        }
        task.setPriority(priority);
        return taskRepo.saveAndFlush(task);
    }

    @Retry(name = RETRY)
    @Transactional
    public int heartbeat(Collection<String> ids, String workerId, Instant now) {
        if (ids.isEmpty()) {
            return 0;
        }
        return taskRepo.touchHeartbeats(ids, workerId, now);
    }

    @Retry(name = RETRY)
    @Transactional
    public boolean release(String id, String workerId, Instant now) {
        return taskRepo.release(id, workerId, now) == 1;
    }

    @Retry(name = RETRY)
    @Transactional(readOnly = true)
    public long countByStatus(TaskStatus status) {
        return taskRepo.countByStatus(status);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WorkflowTask lockOrThrow(String id) {
        return taskRepo.findForUpdate(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    private List<WorkflowTask> loadInOrder(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<WorkflowTask> tasks = new ArrayList<>(taskRepo.findByIdIn(ids));
        tasks.sort(Comparator.comparingInt(t -> ids.indexOf(t.getId())));
        return tasks;
    }
}
