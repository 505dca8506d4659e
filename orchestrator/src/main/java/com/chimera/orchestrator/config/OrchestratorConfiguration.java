package com.chimera.orchestrator.config;

import com.chimera.orchestrator.agent.AgentRegistry;
import com.chimera.orchestrator.agent.CoderAgent;
import com.chimera.orchestrator.agent.DeploymentAgent;
import com.chimera.orchestrator.agent.E2eTesterAgent;
import com.chimera.orchestrator.agent.GuardianAgent;
import com.chimera.orchestrator.agent.remote.RemoteAgentClient;
import com.chimera.orchestrator.agent.remote.RemoteCoderAgent;
import com.chimera.orchestrator.agent.remote.RemoteDeploymentAgent;
import com.chimera.orchestrator.agent.remote.RemoteE2eTesterAgent;
import com.chimera.orchestrator.agent.remote.RemoteGuardianAgent;
import com.chimera.orchestrator.model.AgentRole;
import com.chimera.orchestrator.workflow.PhaseDriver;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wiring for the agent registry and phase driver.
 *
 * Agents are whatever beans implement the capability interfaces. With
 * chimera.agents.remote-enabled=true the HTTP adapters below provide them;
 * otherwise an embedding application declares its own. A role with no agent
 * simply makes its phase fail (and retry) with AgentNotFoundException.
 */
@Configuration
public class OrchestratorConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentRegistry agentRegistry(ObjectProvider<E2eTesterAgent> tester,
                                       ObjectProvider<CoderAgent> coder,
                                       ObjectProvider<GuardianAgent> guardian,
                                       ObjectProvider<DeploymentAgent> deployment,
                                       MeterRegistry meterRegistry) {
        Map<AgentRole, Object> agents = new EnumMap<>(AgentRole.class);
        agents.put(AgentRole.E2E_TESTER, tester.getIfAvailable());
        agents.put(AgentRole.CODER,      coder.getIfAvailable());
        agents.put(AgentRole.GUARDIAN,   guardian.getIfAvailable());
        agents.put(AgentRole.DEPLOYMENT, deployment.getIfAvailable());
        return new AgentRegistry(agents, meterRegistry);
    }

    @Bean
    public PhaseDriver phaseDriver(AgentRegistry agentRegistry, ChimeraProperties properties) {
        return new PhaseDriver(agentRegistry, properties.phases());
    }

    // ------------------------------------------------------------------
    // HTTP agent adapters
    // ------------------------------------------------------------------

    @Configuration
    @ConditionalOnProperty(prefix = "chimera.agents", name = "remote-enabled", havingValue = "true")
    static class RemoteAgents {

        @Bean
        RemoteAgentClient remoteAgentClient(ChimeraProperties properties, ObjectMapper objectMapper) {
            ChimeraProperties.Agents cfg = properties.agents();
            Duration timeout = cfg.requestTimeout() != null ? cfg.requestTimeout() : Duration.ofMinutes(5);
            return new RemoteAgentClient(cfg.baseUrls() != null ? cfg.baseUrls() : Map.of(), timeout, objectMapper);
        }

        @Bean
        RemoteE2eTesterAgent remoteE2eTesterAgent(RemoteAgentClient client) {
            return new RemoteE2eTesterAgent(client);
        }

        @Bean
        RemoteCoderAgent remoteCoderAgent(RemoteAgentClient client) {
            return new RemoteCoderAgent(client);
        }

        @Bean
        RemoteGuardianAgent remoteGuardianAgent(RemoteAgentClient client) {
            return new RemoteGuardianAgent(client);
        }

        @Bean
        RemoteDeploymentAgent remoteDeploymentAgent(RemoteAgentClient client) {
            return new RemoteDeploymentAgent(client);
        }
    }
}
