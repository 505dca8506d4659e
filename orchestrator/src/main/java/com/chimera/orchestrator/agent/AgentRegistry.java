package com.chimera.orchestrator.agent;

import com.chimera.orchestrator.model.AgentRole;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Role → agent lookup, built once at startup and passed to whoever needs it.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by role and capability ({@link #require}).</li>
 *   <li>Metrics-instrumented invocation ({@link #invoke}): every call is
 *       timed and counted, with no per-agent boilerplate.</li>
 * </ol>
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<AgentRole, Object> agents;
    private final MeterRegistry meterRegistry;

    public AgentRegistry(Map<AgentRole, ?> agents, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Map<AgentRole, Object> copy = new EnumMap<>(AgentRole.class);
        agents.forEach((role, agent) -> {
            if (agent != null) {
                copy.put(role, agent);
                log.info("Registered agent '{}' ({})", role.agentName(), agent.getClass().getSimpleName());
            }
        });
        this.agents = Collections.unmodifiableMap(copy);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * @throws AgentNotFoundException if nothing is registered for {@code role}
     *         or the registered agent does not implement {@code capability}
     */
    public <T> T require(AgentRole role, Class<T> capability) {
        Object agent = agents.get(role);
        if (!capability.isInstance(agent)) {
            throw new AgentNotFoundException(role, capability);
        }
        return capability.cast(agent);
    }

    public boolean has(AgentRole role) {
        return agents.containsKey(role);
    }

    public Set<AgentRole> roles() {
        return agents.keySet();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented invocation
    // ------------------------------------------------------------------

    /**
     * Call one action on a registered agent.
     *
     * Every call is timed and counted:
     * <pre>
     *   chimera.agent.calls{agent, action, status="success|failure|error"}
     *   chimera.agent.duration{agent, action}
     * </pre>
     * A lookup failure or synchronous throw comes back as a failed future,
     * so callers handle one error path.
     */
    public <T> CompletableFuture<AgentResult> invoke(AgentRole role, String action, Class<T> capability,
                                                     Function<T, ? extends CompletionStage<AgentResult>> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        CompletableFuture<AgentResult> future;
        try {
            future = call.apply(require(role, capability)).toCompletableFuture();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> {
            String status = error != null ? "error"
                    : (result != null && result.isSuccess()) ? "success" : "failure";
            sample.stop(meterRegistry.timer("chimera.agent.duration",
                    "agent", role.agentName(), "action", action));
            meterRegistry.counter("chimera.agent.calls",
                    "agent", role.agentName(), "action", action, "status", status).increment();
        });
    }
}
