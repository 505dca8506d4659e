package com.chimera.orchestrator.service;

import com.chimera.orchestrator.agent.ScriptedAgents;
import com.chimera.orchestrator.metrics.PoolMetrics;
import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.DeadLetterEntry;
import com.chimera.orchestrator.model.TaskStatus;
import com.chimera.orchestrator.model.WorkflowTask;
import com.chimera.orchestrator.repository.DeadLetterRepository;
import com.chimera.orchestrator.repository.WorkflowTaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end scenarios for the executor pool: real database, real
 * TaskQueue, scripted agents. The test profile sets max-concurrent = 2,
 * max-retries = 2, millisecond backoff and a 2 s staleness threshold.
 */
@SpringBootTest
@ActiveProfiles("test")
class ExecutorPoolIntegrationTest {

    @TestConfiguration
    static class Agents {
        @Bean
        ScriptedAgents scriptedAgents() {
            return new ScriptedAgents();
        }
    }

    static final Duration WAIT = Duration.ofSeconds(20);

    @Autowired ExecutorPool           pool;
    @Autowired TaskQueue              queue;
    @Autowired DeadLetterQueue        deadLetters;
    @Autowired WorkflowTaskRepository taskRepo;
    @Autowired DeadLetterRepository   deadLetterRepo;
    @Autowired ScriptedAgents         agents;
    @Autowired HealthEndpoint         healthEndpoint;
    @Autowired ApplicationContext     context;

    @BeforeEach
    void setUp() {
        deadLetterRepo.deleteAll();
        taskRepo.deleteAll();
        agents.reset();
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    // ------------------------------------------------------------------
    // Scenarios
    // ------------------------------------------------------------------

    @Test
    void happyPath_runsEveryPhaseOnceAndCompletes() {
        queue.enqueue("wf-happy", "happy", "https://app.test", 0);

        pool.start();
        awaitStatus("wf-happy", TaskStatus.COMPLETED);

        WorkflowTask task = queue.get("wf-happy");
        assertThat(task.getCurrentPhase()).isEqualTo(ChimeraPhase.COMPLETE);
        assertThat(task.getWorkflowContext()).containsKeys(
                "test_path", "pr_id", "commit_sha", "review_decision", "staging_url", "validation_status");
        for (String action : List.of(ScriptedAgents.GENERATE, ScriptedAgents.IMPLEMENT,
                ScriptedAgents.REVIEW, ScriptedAgents.DEPLOY, ScriptedAgents.EXECUTE)) {
            assertThat(agents.callsFor(action, "happy")).as(action).isEqualTo(1);
        }
        assertThat(deadLetters.get("wf-happy")).isEmpty();
    }

    @Test
    void rejectedReview_failsWithoutRetryOrDeployment() {
        agents.reviewDecision("rejected");
        queue.enqueue("wf-rejected", "rejected", "https://app.test", 0);

        pool.start();
        awaitStatus("wf-rejected", TaskStatus.FAILED);

        WorkflowTask task = queue.get("wf-rejected");
        assertThat(task.getCurrentPhase()).isEqualTo(ChimeraPhase.FAILED);
        assertThat(task.getWorkflowContext())
                .containsEntry("failed_phase", "REVIEW")
                .containsKey("pr_id")
                .doesNotContainKeys("staging_url", "deployment_id");
        assertThat(task.contextString("error")).contains("rejected");
        assertThat(agents.callsFor(ScriptedAgents.REVIEW, "rejected")).isEqualTo(1);
        assertThat(agents.calls(ScriptedAgents.DEPLOY)).isEmpty();

        DeadLetterEntry entry = awaitDeadLetter("wf-rejected");
        assertThat(entry.getLastErrorPhase()).isEqualTo(ChimeraPhase.REVIEW);
    }

    @Test
    void burst_neverExceedsCeilingAndMetricsAddUp() {
        agents.delay(Duration.ofMillis(20));
        PoolMetrics before = pool.getMetrics();
        int burst = 8;
        for (int i = 0; i < burst; i++) {
            queue.enqueue("wf-burst-" + i, "burst" + i, "https://app.test", 0);
        }

        AtomicInteger maxActive  = new AtomicInteger();
        AtomicLong    maxRunning = new AtomicLong();
        pool.start();
        await().atMost(WAIT).pollInterval(Duration.ofMillis(10)).until(() -> {
            maxActive.accumulateAndGet(pool.activeCount(), Math::max);
            maxRunning.accumulateAndGet(queue.countByStatus(TaskStatus.RUNNING), Math::max);
            PoolMetrics m = pool.getMetrics();
            assertThat(m.activeWorkflows() + m.availableSlots()).isEqualTo(m.poolSize());
            return queue.countByStatus(TaskStatus.COMPLETED) == burst;
        });

        assertThat(maxActive.get()).isLessThanOrEqualTo(2);
        assertThat(maxRunning.get()).isLessThanOrEqualTo(2);
        assertThat(agents.maxInFlight()).isLessThanOrEqualTo(2);

        await().atMost(WAIT).until(() ->
                pool.getMetrics().totalWorkflowsProcessed() - before.totalWorkflowsProcessed() == burst);
        PoolMetrics after = pool.getMetrics();
        long processed = after.totalWorkflowsProcessed() - before.totalWorkflowsProcessed();
        long succeeded = after.totalWorkflowsSucceeded() - before.totalWorkflowsSucceeded();
        long failed    = after.totalWorkflowsFailed() - before.totalWorkflowsFailed();
        assertThat(succeeded + failed).isEqualTo(processed);
        assertThat(succeeded).isEqualTo(burst);
        assertThat(after.successRate())
                .isEqualTo((double) after.totalWorkflowsSucceeded() / after.totalWorkflowsProcessed());
        assertThat(after.activeWorkflows()).isZero();
        assertThat(after.availableSlots()).isEqualTo(after.poolSize());
    }

    @Test
    void submitHint_admitsNewWorkOnRunningPool() {
        pool.start();
        WorkflowTask task = queue.enqueue("wf-hint", "hint", "https://app.test", 0);

        pool.submitWorkflow(task);

        awaitStatus("wf-hint", TaskStatus.COMPLETED);
    }

    @Test
    void transientAgentFailure_isRetriedThenSucceeds() {
        agents.failNext(ScriptedAgents.IMPLEMENT, 2);
        long retriesBefore = pool.getMetrics().totalRetryAttempts();
        queue.enqueue("wf-flaky", "flaky", "https://app.test", 0);

        pool.start();
        awaitStatus("wf-flaky", TaskStatus.COMPLETED);

        assertThat(agents.callsFor(ScriptedAgents.IMPLEMENT, "flaky")).isEqualTo(3);
        assertThat(pool.getMetrics().totalRetryAttempts() - retriesBefore).isEqualTo(2);
        assertThat(queue.get("wf-flaky").getRetryCount()).isZero();
    }

    @Test
    void exhaustedRetries_failTaskIntoDeadLetterQueue() {
        agents.failNext(ScriptedAgents.DEPLOY, 100);
        queue.enqueue("wf-doomed", "doomed", "https://app.test", 0);

        pool.start();
        awaitStatus("wf-doomed", TaskStatus.FAILED);

        WorkflowTask task = queue.get("wf-doomed");
        assertThat(agents.callsFor(ScriptedAgents.DEPLOY, "doomed")).isEqualTo(3);   // first try + 2 retries
        assertThat(task.getRetryCount()).isEqualTo(2);
        assertThat(task.getLastError()).contains("scripted failure");
        assertThat(task.getWorkflowContext()).containsEntry("failed_phase", "STAGING_DEPLOYMENT");

        DeadLetterEntry entry = awaitDeadLetter("wf-doomed");
        assertThat(entry.getLastErrorPhase()).isEqualTo(ChimeraPhase.STAGING_DEPLOYMENT);
        assertThat(entry.getFailureReason()).contains("Retries exhausted");
        assertThat(entry.getWorkflowState()).containsKeys("test_path", "pr_id", "commit_sha");
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    @Test
    void gracefulRestart_resumesEveryTaskWithoutRepeatingPhases() {
        agents.delay(Duration.ofMillis(100));
        queue.enqueue("wf-r1", "restart1", "https://app.test", 0);
        queue.enqueue("wf-r2", "restart2", "https://app.test", 0);

        pool.start();
        await().atMost(WAIT).until(() ->
                queue.get("wf-r1").getCurrentPhase() != ChimeraPhase.E2E_TEST_GENERATION);
        pool.stop();

        assertThat(pool.isRunning()).isFalse();
        assertThat(pool.activeCount()).isZero();
        for (String id : List.of("wf-r1", "wf-r2")) {
            WorkflowTask t = queue.get(id);
            if (t.getStatus() == TaskStatus.RUNNING) {
                assertThat(t.getWorkerId()).as("released %s", id).isNull();
                assertThat(t.getHeartbeatAt()).isNull();
            }
        }

        pool.start();
        awaitStatus("wf-r1", TaskStatus.COMPLETED);
        awaitStatus("wf-r2", TaskStatus.COMPLETED);

        for (String feature : List.of("restart1", "restart2")) {
            for (String action : List.of(ScriptedAgents.GENERATE, ScriptedAgents.IMPLEMENT,
                    ScriptedAgents.REVIEW, ScriptedAgents.DEPLOY, ScriptedAgents.EXECUTE)) {
                assertThat(agents.callsFor(action, feature)).as(feature + " " + action).isEqualTo(1);
            }
        }
    }

    @Test
    void crashedOwner_taskResumesFromPersistedPhaseOnceStale() {
        PoolMetrics before = pool.getMetrics();
        queue.enqueue("wf-crash", "crash", "https://app.test", 0);
        queue.dequeueReady(1, "dead-pool");
        queue.updatePhase("wf-crash", ChimeraPhase.CODE_IMPLEMENTATION, Map.of("test_path", "tests/crash.spec.ts"));

        pool.start();
        awaitStatus("wf-crash", TaskStatus.COMPLETED);

        assertThat(agents.callsFor(ScriptedAgents.GENERATE, "crash")).isZero();
        assertThat(agents.callsFor(ScriptedAgents.IMPLEMENT, "crash")).isEqualTo(1);
        assertThat(queue.get("wf-crash").getWorkflowContext()).containsEntry("test_path", "tests/crash.spec.ts");

        // Terminal bookkeeping happens once, and stays at once.
        await().during(Duration.ofMillis(500)).atMost(WAIT).until(() ->
                pool.getMetrics().totalWorkflowsProcessed() - before.totalWorkflowsProcessed() == 1);
        PoolMetrics after = pool.getMetrics();
        assertThat(after.totalWorkflowsSucceeded() - before.totalWorkflowsSucceeded()).isEqualTo(1);
        assertThat(after.totalWorkflowsFailed() - before.totalWorkflowsFailed()).isZero();
        assertThat(deadLetters.count()).isZero();
        for (String action : List.of(ScriptedAgents.IMPLEMENT, ScriptedAgents.REVIEW,
                ScriptedAgents.DEPLOY, ScriptedAgents.EXECUTE)) {
            assertThat(agents.callsFor(action, "crash")).as(action).isEqualTo(1);
        }
    }

    @Test
    void storedPhaseMovedUnderneath_failsTaskOnce() {
        PoolMetrics before = pool.getMetrics();
        agents.beforeReply(ScriptedAgents.IMPLEMENT, () -> {
            queue.updatePhase("wf-moved", ChimeraPhase.REVIEW, Map.of());
            queue.updatePhase("wf-moved", ChimeraPhase.STAGING_DEPLOYMENT, Map.of());
        });
        queue.enqueue("wf-moved", "moved", "https://app.test", 0);

        pool.start();
        awaitStatus("wf-moved", TaskStatus.FAILED);

        WorkflowTask task = queue.get("wf-moved");
        assertThat(task.getCurrentPhase()).isEqualTo(ChimeraPhase.FAILED);
        assertThat(task.getWorkflowContext())
                .containsEntry("failed_phase", "CODE_IMPLEMENTATION")
                .doesNotContainKeys("pr_id", "commit_sha");
        assertThat(task.contextString("error")).contains("cannot move from STAGING_DEPLOYMENT to REVIEW");
        assertThat(agents.calls(ScriptedAgents.REVIEW)).isEmpty();
        assertThat(agents.calls(ScriptedAgents.DEPLOY)).isEmpty();

        DeadLetterEntry entry = awaitDeadLetter("wf-moved");
        assertThat(entry.getLastErrorPhase()).isEqualTo(ChimeraPhase.CODE_IMPLEMENTATION);
        await().during(Duration.ofMillis(300)).atMost(WAIT).until(() ->
                pool.getMetrics().totalWorkflowsFailed() - before.totalWorkflowsFailed() == 1);
        assertThat(deadLetters.count()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Health and queue depth
    // ------------------------------------------------------------------

    @Test
    void healthAndQueueDepth_reportedUnderExecutorPoolKey() {
        assertThat(context.getBean("executorPool")).isInstanceOf(ExecutorPool.class);
        for (int i = 0; i < 3; i++) {
            queue.enqueue("wf-wait-" + i, "wait" + i, "https://app.test", 0);
        }

        assertThat(pool.getMetrics().queueDepth()).isEqualTo(3);
        Health stopped = (Health) healthEndpoint.healthForPath("executorPool");
        assertThat(stopped.getStatus()).isEqualTo(Status.DOWN);
        assertThat(stopped.getDetails()).containsEntry("queueDepth", 3L).containsKey("alerts");

        pool.start();
        await().atMost(WAIT).until(() -> queue.countByStatus(TaskStatus.COMPLETED) == 3);

        assertThat(pool.getMetrics().queueDepth()).isZero();
        Health running = (Health) healthEndpoint.healthForPath("executorPool");
        assertThat(running.getStatus()).isNotEqualTo(Status.DOWN);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void awaitStatus(String id, TaskStatus status) {
        await().atMost(WAIT).until(() -> queue.get(id).getStatus() == status);
    }

    private DeadLetterEntry awaitDeadLetter(String id) {
        await().atMost(WAIT).until(() -> deadLetters.get(id).isPresent());
        return deadLetters.get(id).orElseThrow();
    }
}
