package com.chimera.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One Chimera workflow request: the persisted unit of work.
 *
 * The executor pool claims a QUEUED row with a compare-and-swap UPDATE,
 * sets status = RUNNING and worker_id, then a worker thread drives the
 * phase pipeline and persists every transition back to this row.
 *
 * The id is assigned by the caller at enqueue time, so the entity reports
 * itself as new until it has been persisted or loaded. Without that,
 * Spring Data would merge() a duplicate id instead of failing the INSERT.
 *
 * DB table: workflow_tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_tasks")
public class WorkflowTask implements Persistable<String> {

    @Id
    @Column(length = 128)
    private String id;

    @Column(name = "feature_description", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String featureDescription;

    @Column(name = "target_url", nullable = false, updatable = false, length = 2048)
    private String targetUrl;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskStatus status = TaskStatus.QUEUED;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_phase", nullable = false, length = 32)
    private ChimeraPhase currentPhase = ChimeraPhase.E2E_TEST_GENERATION;

    // Outputs of every completed phase (test_path, pr_id, ...). Append-only.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "workflow_context", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> workflowContext = new LinkedHashMap<>();

    // Retries spent in the current phase; reset when the phase advances.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // Pool instance that owns this task while RUNNING. Null otherwise.
    @Column(name = "worker_id", length = 64)
    private String workerId;

    // Refreshed by the owning pool to prove liveness.
    // Null while RUNNING means the owner released it on graceful shutdown.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "admitted_at")
    private Instant admittedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Transient
    private boolean isNew = true;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowTask() {}   // required by JPA

    public WorkflowTask(String id, String featureDescription, String targetUrl, int priority) {
        this.id                 = id;
        this.featureDescription = featureDescription;
        this.targetUrl          = targetUrl;
        this.priority           = priority;
    }

    // ------------------------------------------------------------------
    // Context
    // ------------------------------------------------------------------

    /**
     * Merge phase outputs into the context without overwriting existing keys.
     *
     * @return the keys that were actually added
     */
    public Map<String, Object> extendContext(Map<String, ?> patch) {
        Map<String, Object> added = new LinkedHashMap<>();
        if (patch == null) {
            return added;
        }
        // Fresh map so Hibernate sees a changed value for the converted column.
        Map<String, Object> merged = new LinkedHashMap<>(workflowContext);
        patch.forEach((key, value) -> {
            if (value != null && !merged.containsKey(key)) {
                merged.put(key, value);
                added.put(key, value);
            }
        });
        this.workflowContext = merged;
        return added;
    }

    /** Typed context lookup; null when absent. */
    public String contextString(String key) {
        Object v = workflowContext.get(key);
        return v == null ? null : v.toString();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override public String  getId()                  { return id; }
    @Override public boolean isNew()                  { return isNew; }
    public String       getFeatureDescription()       { return featureDescription; }
    public String       getTargetUrl()                { return targetUrl; }
    public int          getPriority()                 { return priority; }
    public TaskStatus   getStatus()                   { return status; }
    public ChimeraPhase getCurrentPhase()             { return currentPhase; }
    public Map<String, Object> getWorkflowContext()   { return Collections.unmodifiableMap(workflowContext); }
    public int          getRetryCount()               { return retryCount; }
    public String       getLastError()                { return lastError; }
    public String       getWorkerId()                 { return workerId; }
    public Instant      getHeartbeatAt()              { return heartbeatAt; }
    public Instant      getAdmittedAt()               { return admittedAt; }
    public Instant      getFinishedAt()               { return finishedAt; }
    public Instant      getCreatedAt()                { return createdAt; }
    public Instant      getUpdatedAt()                { return updatedAt; }

    public void setPriority(int priority)             { this.priority = priority; }
    public void setStatus(TaskStatus status)          { this.status = status; }
    public void setCurrentPhase(ChimeraPhase phase)   { this.currentPhase = phase; }
    public void setLastError(String lastError)        { this.lastError = lastError; }
    public void setWorkerId(String workerId)          { this.workerId = workerId; }
    public void setHeartbeatAt(Instant t)             { this.heartbeatAt = t; }
    public void setAdmittedAt(Instant t)              { this.admittedAt = t; }
    public void setFinishedAt(Instant t)              { this.finishedAt = t; }
    public void setCreatedAt(Instant t)               { this.createdAt = t; }
    public void setRetryCount(int retryCount)         { this.retryCount = retryCount; }
    public void incrementRetryCount()                 { this.retryCount++; }
}
