package com.z254.switchboard.config;

import com.z254.switchboard.agent.AgentInvoker;
import com.z254.switchboard.agent.FallbackProvider;
import com.z254.switchboard.agent.impl.HttpAgentInvoker;
import com.z254.switchboard.observability.StructuredLogger;
import com.z254.switchboard.orchestration.Coordinator;
import com.z254.switchboard.orchestration.ExecutionHistory;
import com.z254.switchboard.orchestration.TaskRunner;
import com.z254.switchboard.orchestration.pattern.StrategyExecutor;
import com.z254.switchboard.registry.AgentRegistry;
import com.z254.switchboard.resilience.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

/**
 * Wires the coordinator and its collaborators.
 * Embedding applications may replace the clock, the agent invoker or add a fallback provider.
 */
@Configuration
@Slf4j
public class SwitchboardConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock switchboardClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(AgentInvoker.class)
    @ConditionalOnProperty(prefix = "switchboard.invoker.http", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AgentInvoker httpAgentInvoker(WebClient.Builder webClientBuilder, SwitchboardProperties properties) {
        log.info("Using HTTP agent invoker");
        return new HttpAgentInvoker(webClientBuilder, properties.getInvoker().getHttp());
    }

    @Bean
    public ExecutionHistory executionHistory(SwitchboardProperties properties) {
        return new ExecutionHistory(properties.getCoordinator().getHistorySize());
    }

    @Bean
    public TaskRunner taskRunner(AgentRegistry agentRegistry,
                                 CircuitBreakerRegistry breakerRegistry,
                                 AgentInvoker agentInvoker,
                                 ObjectProvider<FallbackProvider> fallbackProvider,
                                 StructuredLogger structuredLogger,
                                 Clock clock) {
        breakerRegistry.addListener(structuredLogger::logBreakerTransition);
        return new TaskRunner(agentRegistry, breakerRegistry, agentInvoker,
                fallbackProvider.getIfAvailable(), structuredLogger, clock);
    }

    @Bean
    public Coordinator coordinator(List<StrategyExecutor> executors,
                                   TaskRunner taskRunner,
                                   ExecutionHistory executionHistory,
                                   StructuredLogger structuredLogger,
                                   MeterRegistry meterRegistry,
                                   SwitchboardProperties properties) {
        return new Coordinator(executors, taskRunner, executionHistory, structuredLogger,
                meterRegistry, properties.getCoordinator().getWorkflowDeadline());
    }
}
