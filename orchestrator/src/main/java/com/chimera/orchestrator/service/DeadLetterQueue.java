package com.chimera.orchestrator.service;

import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.DeadLetterEntry;
import com.chimera.orchestrator.model.WorkflowTask;
import com.chimera.orchestrator.repository.DeadLetterRepository;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Audit trail of workflows that terminated FAILED.
 *
 * One entry per task id; adding the same task twice keeps the first entry.
 * Entries are never removed automatically.
 */
@Service
public class DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    private final DeadLetterRepository repo;

    public DeadLetterQueue(DeadLetterRepository repo) {
        this.repo = repo;
    }

    /**
     * Record a failed workflow.
     *
     * @return true if a new entry was written, false if one already existed
     */
    @Retry(name = TaskStore.RETRY)
    @Transactional
    public boolean add(WorkflowTask task, String failureReason, ChimeraPhase failedPhase) {
        if (repo.existsById(task.getId())) {
            log.debug("Dead letter for task {} already recorded", task.getId());
            return false;
        }
        String reason = failureReason == null ? "unknown failure" : failureReason;
        repo.saveAndFlush(new DeadLetterEntry(
                task.getId(),
                task.getFeatureDescription(),
                task.getTargetUrl(),
                reason,
                task.getRetryCount(),
                task.getWorkflowContext(),
                failedPhase));
        log.warn("Task {} moved to dead letter queue (phase {}): {}", task.getId(), failedPhase, reason);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<DeadLetterEntry> get(String taskId) {
        return repo.findById(taskId);
    }

    /** Newest first, skipping {@code offset} entries. */
    @Transactional(readOnly = true)
    public List<DeadLetterEntry> entries(int limit, int offset) {
        if (limit <= 0 || offset < 0) {
            throw new IllegalArgumentException("limit must be positive and offset non-negative");
        }
        // Offsets need not align to page boundaries, so read through offset + limit and slice.
        int window = (int) Math.min((long) offset + limit, Integer.MAX_VALUE);
        List<DeadLetterEntry> head = repo.findNewestFirst(PageRequest.of(0, window));
        if (head.size() <= offset) {
            return List.of();
        }
        return List.copyOf(head.subList(offset, head.size()));
    }

    @Transactional
    public boolean remove(String taskId) {
        if (!repo.existsById(taskId)) {
            return false;
        }
        repo.deleteById(taskId);
        log.info("Removed dead letter for task {}", taskId);
        return true;
    }

    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }
}
