package com.chimera.orchestrator.workflow;

import com.chimera.orchestrator.agent.AgentRegistry;
import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.agent.CoderAgent;
import com.chimera.orchestrator.agent.DeploymentAgent;
import com.chimera.orchestrator.agent.E2eTesterAgent;
import com.chimera.orchestrator.agent.GuardianAgent;
import com.chimera.orchestrator.config.ChimeraProperties;
import com.chimera.orchestrator.model.AgentRole;
import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one step of the Chimera pipeline for a task.
 *
 * Each non-terminal phase maps to one agent action through a dispatch
 * table. The driver is stateless: everything it needs comes from the
 * task's persisted phase and context, so a restarted pool resumes a task
 * by simply calling {@link #execute} again.
 *
 * <pre>
 *   E2E_TEST_GENERATION  generate_test(feature, url)        → test_path
 *   CODE_IMPLEMENTATION  implement_feature(test_path, ...)  → pr_id, commit_sha
 *   REVIEW               review_pr(pr_id)                   → decision
 *   STAGING_DEPLOYMENT   deploy_to_staging(commit_sha)      → staging_url
 *   E2E_VALIDATION       execute_test(test_path, staging)   → passed / failed
 * </pre>
 */
public class PhaseDriver {

    private static final Logger log = LoggerFactory.getLogger(PhaseDriver.class);

    // Context keys written by the phases.
    public static final String TEST_PATH         = "test_path";
    public static final String TEST_NAME         = "test_name";
    public static final String PR_ID             = "pr_id";
    public static final String COMMIT_SHA        = "commit_sha";
    public static final String FILES_CHANGED     = "files_changed";
    public static final String REVIEW_DECISION   = "review_decision";
    public static final String REVIEW_SCORE      = "review_score";
    public static final String STAGING_URL       = "staging_url";
    public static final String DEPLOYMENT_ID     = "deployment_id";
    public static final String VALIDATION_STATUS = "validation_status";
    public static final String TESTS_PASSED      = "tests_passed";

    private final AgentRegistry                         agents;
    private final ChimeraProperties.Phases              phases;
    private final Map<ChimeraPhase, PhaseHandler>       handlers = new EnumMap<>(ChimeraPhase.class);

    public PhaseDriver(AgentRegistry agents, ChimeraProperties.Phases phases) {
        this.agents = agents;
        this.phases = phases;

        handlers.put(ChimeraPhase.E2E_TEST_GENERATION, new PhaseHandler(
                AgentRole.E2E_TESTER, "generate_test", List.of(),
                task -> params("feature", task.getFeatureDescription(), "url", task.getTargetUrl()),
                (registry, p) -> registry.invoke(AgentRole.E2E_TESTER, "generate_test", E2eTesterAgent.class,
                        a -> a.generateTest(str(p, "feature"), str(p, "url"))),
                PhaseDriver::afterTestGeneration));

        handlers.put(ChimeraPhase.CODE_IMPLEMENTATION, new PhaseHandler(
                AgentRole.CODER, "implement_feature", List.of(TEST_PATH),
                task -> params("test_path", task.contextString(TEST_PATH), "feature", task.getFeatureDescription()),
                (registry, p) -> registry.invoke(AgentRole.CODER, "implement_feature", CoderAgent.class,
                        a -> a.implementFeature(str(p, "test_path"), str(p, "feature"))),
                PhaseDriver::afterImplementation));

        handlers.put(ChimeraPhase.REVIEW, new PhaseHandler(
                AgentRole.GUARDIAN, "review_pr", List.of(PR_ID),
                task -> params("pr_id", task.contextString(PR_ID)),
                (registry, p) -> registry.invoke(AgentRole.GUARDIAN, "review_pr", GuardianAgent.class,
                        a -> a.reviewPr(str(p, "pr_id"))),
                PhaseDriver::afterReview));

        handlers.put(ChimeraPhase.STAGING_DEPLOYMENT, new PhaseHandler(
                AgentRole.DEPLOYMENT, "deploy_to_staging", List.of(COMMIT_SHA),
                task -> params("commit_sha", task.contextString(COMMIT_SHA)),
                (registry, p) -> registry.invoke(AgentRole.DEPLOYMENT, "deploy_to_staging", DeploymentAgent.class,
                        a -> a.deployToStaging(str(p, "commit_sha"))),
                PhaseDriver::afterDeployment));

        handlers.put(ChimeraPhase.E2E_VALIDATION, new PhaseHandler(
                AgentRole.E2E_TESTER, "execute_test", List.of(TEST_PATH, STAGING_URL),
                task -> params("test_path", task.contextString(TEST_PATH), "url", task.contextString(STAGING_URL)),
                (registry, p) -> registry.invoke(AgentRole.E2E_TESTER, "execute_test", E2eTesterAgent.class,
                        a -> a.executeTest(str(p, "test_path"), str(p, "url"))),
                PhaseDriver::afterValidation));
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Run the current phase of {@code task} once.
     *
     * Blocks for at most the phase timeout.
     *
     * @throws IllegalArgumentException if the task is already terminal
     * @throws InterruptedException     if the worker thread is interrupted while waiting
     */
    public PhaseOutcome execute(WorkflowTask task) throws InterruptedException {
        ChimeraPhase phase = task.getCurrentPhase();
        PhaseHandler handler = handlerFor(phase);

        for (String key : handler.requiredKeys()) {
            if (task.contextString(key) == null) {
                return PhaseOutcome.rejected("Missing context key '" + key + "' required by " + phase);
            }
        }

        Map<String, Object> params = handler.params().apply(task);
        Duration timeout = phases.timeoutFor(phase);
        log.debug("Task {} phase {}: {}.{}", task.getId(), phase, handler.role().agentName(), handler.action());

        CompletableFuture<AgentResult> future = handler.invoker().apply(agents, params);
        AgentResult result;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return PhaseOutcome.error(handler.action() + " timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return PhaseOutcome.error(handler.action() + " failed: " + describe(e.getCause()));
        } catch (CancellationException e) {
            return PhaseOutcome.error(handler.action() + " was cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }

        if (result == null) {
            return PhaseOutcome.error(handler.action() + " returned no result");
        }
        return handler.interpreter().apply(result);
    }

    /** Describe the agent call the task's current phase would make, or empty if terminal. */
    public Optional<PhaseAction> nextAction(WorkflowTask task) {
        PhaseHandler handler = handlers.get(task.getCurrentPhase());
        if (handler == null) {
            return Optional.empty();
        }
        return Optional.of(new PhaseAction(
                handler.role().agentName(),
                handler.action(),
                handler.params().apply(task),
                phases.timeoutFor(task.getCurrentPhase())));
    }

    // ------------------------------------------------------------------
    // Result interpretation
    // ------------------------------------------------------------------

    private static PhaseOutcome afterTestGeneration(AgentResult r) {
        if (!r.isSuccess()) {
            return PhaseOutcome.error("generate_test reported status " + r.status() + errorSuffix(r));
        }
        if (!r.has(TEST_PATH)) {
            return PhaseOutcome.error("generate_test returned no test_path");
        }
        return PhaseOutcome.advanced(ChimeraPhase.CODE_IMPLEMENTATION,
                patch(r, TEST_PATH, TEST_NAME));
    }

    private static PhaseOutcome afterImplementation(AgentResult r) {
        if (!r.isSuccess()) {
            return PhaseOutcome.error("implement_feature reported status " + r.status() + errorSuffix(r));
        }
        if (!r.has(PR_ID) || !r.has(COMMIT_SHA)) {
            return PhaseOutcome.error("implement_feature returned no pr_id/commit_sha");
        }
        return PhaseOutcome.advanced(ChimeraPhase.REVIEW,
                patch(r, PR_ID, COMMIT_SHA, FILES_CHANGED));
    }

    private static PhaseOutcome afterReview(AgentResult r) {
        String decision = r.string("decision");
        if (decision == null) {
            return PhaseOutcome.error("review_pr returned no decision (status " + r.status() + ")" + errorSuffix(r));
        }
        if (!"approved".equalsIgnoreCase(decision)) {
            return PhaseOutcome.rejected("Review decision: " + decision);
        }
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(REVIEW_DECISION, decision);
        if (r.has("score")) {
            patch.put(REVIEW_SCORE, r.get("score"));
        }
        return PhaseOutcome.advanced(ChimeraPhase.STAGING_DEPLOYMENT, patch);
    }

    private static PhaseOutcome afterDeployment(AgentResult r) {
        if (!r.isSuccess()) {
            return PhaseOutcome.error("deploy_to_staging reported status " + r.status() + errorSuffix(r));
        }
        if (!r.has(STAGING_URL)) {
            return PhaseOutcome.error("deploy_to_staging returned no staging_url");
        }
        return PhaseOutcome.advanced(ChimeraPhase.E2E_VALIDATION,
                patch(r, STAGING_URL, DEPLOYMENT_ID));
    }

    private static PhaseOutcome afterValidation(AgentResult r) {
        String status = r.status();
        if ("passed".equalsIgnoreCase(status)) {
            Map<String, Object> patch = new LinkedHashMap<>();
            patch.put(VALIDATION_STATUS, "passed");
            if (r.has(TESTS_PASSED)) {
                patch.put(TESTS_PASSED, r.get(TESTS_PASSED));
            }
            return PhaseOutcome.advanced(ChimeraPhase.COMPLETE, patch);
        }
        if ("failed".equalsIgnoreCase(status)) {
            return PhaseOutcome.rejected("E2E validation failed on staging" + errorSuffix(r));
        }
        return PhaseOutcome.error("execute_test reported status " + status + errorSuffix(r));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PhaseHandler handlerFor(ChimeraPhase phase) {
        PhaseHandler handler = handlers.get(phase);
        if (handler == null) {
            throw new IllegalArgumentException("No step to run in terminal phase " + phase);
        }
        return handler;
    }

    private static Map<String, Object> patch(AgentResult r, String... keys) {
        Map<String, Object> patch = new LinkedHashMap<>();
        for (String key : keys) {
            if (r.has(key)) {
                patch.put(key, r.get(key));
            }
        }
        return patch;
    }

    private static Map<String, Object> params(String... kv) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            params.put(kv[i], kv[i + 1]);
        }
        return params;
    }

    private static String str(Map<String, Object> params, String key) {
        Object v = params.get(key);
        return v == null ? null : v.toString();
    }

    private static String errorSuffix(AgentResult r) {
        String err = r.string("error");
        return err == null ? "" : ": " + err;
    }

    private static String describe(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    }

    /** One row of the dispatch table. */
    private record PhaseHandler(
            AgentRole role,
            String action,
            List<String> requiredKeys,
            Function<WorkflowTask, Map<String, Object>> params,
            BiFunction<AgentRegistry, Map<String, Object>, CompletableFuture<AgentResult>> invoker,
            Function<AgentResult, PhaseOutcome> interpreter) {}
}
