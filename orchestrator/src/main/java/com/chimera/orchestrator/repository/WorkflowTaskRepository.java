package com.chimera.orchestrator.repository;

import com.chimera.orchestrator.model.TaskStatus;
import com.chimera.orchestrator.model.WorkflowTask;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + scheduler queries for the workflow_tasks table.
 *
 * Claiming is a two-step affair: read candidate ids without locks, then
 * flip each one with a conditional UPDATE whose WHERE clause re-checks the
 * expected state. The database re-evaluates that predicate after waiting on
 * a concurrent writer, so an update count of 1 means "this caller won the
 * row" and 0 means "someone else got there first". No two callers can win
 * the same row.
 *
 * All @Modifying queries must run inside a transaction in the service layer.
 */
public interface WorkflowTaskRepository extends JpaRepository<WorkflowTask, String> {

    /** Point lookup holding a row lock until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM WorkflowTask t WHERE t.id = :id")
    Optional<WorkflowTask> findForUpdate(@Param("id") String id);

    /** Ready tasks in admission order: priority first, then FIFO. */
    @Query("""
            SELECT t.id FROM WorkflowTask t
            WHERE t.status = com.chimera.orchestrator.model.TaskStatus.QUEUED
            ORDER BY t.priority DESC, t.createdAt ASC
            """)
    List<String> findReadyIds(Pageable page);

    /** QUEUED → RUNNING for one row; returns 1 only for the winning caller. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WorkflowTask t
            SET t.status = com.chimera.orchestrator.model.TaskStatus.RUNNING,
                t.workerId = :workerId,
                t.heartbeatAt = :now,
                t.admittedAt = :now,
                t.updatedAt = :now
            WHERE t.id = :id
              AND t.status = com.chimera.orchestrator.model.TaskStatus.QUEUED
            """)
    int claimQueued(@Param("id") String id,
                    @Param("workerId") String workerId,
                    @Param("now") Instant now);

    /** RUNNING tasks whose owner stopped heartbeating (or released them). */
    @Query("""
            SELECT t.id FROM WorkflowTask t
            WHERE t.status = com.chimera.orchestrator.model.TaskStatus.RUNNING
              AND (t.heartbeatAt IS NULL OR t.heartbeatAt < :cutoff)
            ORDER BY t.priority DESC, t.createdAt ASC
            """)
    List<String> findStaleIds(@Param("cutoff") Instant cutoff, Pageable page);

    /** Take over a stale RUNNING row; returns 1 only for the winning caller. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WorkflowTask t
            SET t.workerId = :workerId,
                t.heartbeatAt = :now,
                t.admittedAt = :now,
                t.updatedAt = :now
            WHERE t.id = :id
              AND t.status = com.chimera.orchestrator.model.TaskStatus.RUNNING
              AND (t.heartbeatAt IS NULL OR t.heartbeatAt < :cutoff)
            """)
    int claimStale(@Param("id") String id,
                   @Param("workerId") String workerId,
                   @Param("cutoff") Instant cutoff,
                   @Param("now") Instant now);

    /** Liveness update for every RUNNING row still owned by this worker. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WorkflowTask t
            SET t.heartbeatAt = :now
            WHERE t.id IN :ids
              AND t.workerId = :workerId
              AND t.status = com.chimera.orchestrator.model.TaskStatus.RUNNING
            """)
    int touchHeartbeats(@Param("ids") Collection<String> ids,
                        @Param("workerId") String workerId,
                        @Param("now") Instant now);

    /** Drop ownership so the next pool start can re-admit the task immediately. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WorkflowTask t
            SET t.heartbeatAt = NULL,
                t.workerId = NULL,
                t.updatedAt = :now
            WHERE t.id = :id
              AND t.workerId = :workerId
              AND t.status = com.chimera.orchestrator.model.TaskStatus.RUNNING
            """)
    int release(@Param("id") String id,
                @Param("workerId") String workerId,
                @Param("now") Instant now);

    long countByStatus(TaskStatus status);

    List<WorkflowTask> findByIdIn(Collection<String> ids);
}
