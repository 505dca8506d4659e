package com.chimera.orchestrator.api;

import com.chimera.orchestrator.api.dto.EnqueueWorkflowRequest;
import com.chimera.orchestrator.api.dto.ReprioritizeRequest;
import com.chimera.orchestrator.api.dto.WorkflowResponse;
import com.chimera.orchestrator.metrics.PoolMetrics;
import com.chimera.orchestrator.model.WorkflowTask;
import com.chimera.orchestrator.service.ExecutorPool;
import com.chimera.orchestrator.service.TaskQueue;
import com.chimera.orchestrator.workflow.PhaseAction;
import com.chimera.orchestrator.workflow.PhaseDriver;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for workflow submission and inspection.
 *
 * POST /workflows                   enqueue a workflow and nudge the pool
 * GET  /workflows/{id}              current status, phase and context
 * GET  /workflows/{id}/next-action  the agent call the current phase will make
 * PUT  /workflows/{id}/priority     change priority while still QUEUED
 * GET  /workflows/metrics           pool metrics snapshot
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final TaskQueue    queue;
    private final ExecutorPool pool;
    private final PhaseDriver  driver;

    public WorkflowController(TaskQueue queue, ExecutorPool pool, PhaseDriver driver) {
        this.queue  = queue;
        this.pool   = pool;
        this.driver = driver;
    }

    /**
     * Enqueue a workflow.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"featureDescription":"User can log in","targetUrl":"https://app.example.com"}'
     *
     * Returns 409 if a task with the same taskId already exists.
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> enqueue(@Valid @RequestBody EnqueueWorkflowRequest req) {
        WorkflowTask task = queue.enqueue(req.taskId(), req.featureDescription(),
                req.targetUrl(), req.priorityOrDefault());
        pool.submitWorkflow(task);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(task));
    }

    /** Returns 404 if the id is unknown. */
    @GetMapping("/{id}")
    public WorkflowResponse get(@PathVariable String id) {
        return WorkflowResponse.from(queue.get(id));
    }

    /** Returns 204 once the workflow is terminal. */
    @GetMapping("/{id}/next-action")
    public ResponseEntity<PhaseAction> nextAction(@PathVariable String id) {
        return driver.nextAction(queue.get(id))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PutMapping("/{id}/priority")
    public WorkflowResponse reprioritize(@PathVariable String id, @Valid @RequestBody ReprioritizeRequest req) {
        return WorkflowResponse.from(queue.reprioritize(id, req.priority()));
    }

    @GetMapping("/metrics")
    public PoolMetrics metrics() {
        return pool.getMetrics();
    }
}
