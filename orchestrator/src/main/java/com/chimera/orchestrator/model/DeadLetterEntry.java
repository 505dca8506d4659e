package com.chimera.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit record for a workflow that terminated FAILED.
 *
 * Holds enough state to diagnose or re-submit the request by hand:
 * the original inputs, the reason, and a snapshot of the workflow context
 * at the moment of failure.
 *
 * DB table: dead_letters  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "dead_letters")
public class DeadLetterEntry implements Persistable<String> {

    @Id
    @Column(name = "task_id", length = 128)
    private String taskId;

    @Column(name = "feature_description", nullable = false, columnDefinition = "TEXT")
    private String featureDescription;

    @Column(name = "target_url", nullable = false, length = 2048)
    private String targetUrl;

    @Column(name = "failure_reason", nullable = false, columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "workflow_state", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> workflowState = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_phase", length = 32)
    private ChimeraPhase lastErrorPhase;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    protected DeadLetterEntry() {}   // required by JPA

    public DeadLetterEntry(String taskId, String featureDescription, String targetUrl,
                           String failureReason, int retryCount,
                           Map<String, Object> workflowState, ChimeraPhase lastErrorPhase) {
        this.taskId             = taskId;
        this.featureDescription = featureDescription;
        this.targetUrl          = targetUrl;
        this.failureReason      = failureReason;
        this.retryCount         = retryCount;
        this.workflowState      = workflowState == null ? new LinkedHashMap<>() : new LinkedHashMap<>(workflowState);
        this.lastErrorPhase     = lastErrorPhase;
    }

    @Override public String getId()                 { return taskId; }
    @Override public boolean isNew()                { return isNew; }
    public String       getTaskId()                 { return taskId; }
    public String       getFeatureDescription()     { return featureDescription; }
    public String       getTargetUrl()              { return targetUrl; }
    public String       getFailureReason()          { return failureReason; }
    public int          getRetryCount()             { return retryCount; }
    public Map<String, Object> getWorkflowState()   { return Collections.unmodifiableMap(workflowState); }
    public ChimeraPhase getLastErrorPhase()         { return lastErrorPhase; }
    public Instant      getCreatedAt()              { return createdAt; }
}
