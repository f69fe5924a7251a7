package com.z254.switchboard.config;

import com.z254.switchboard.domain.model.AgentCapability;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the SWITCHBOARD service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "switchboard")
public class SwitchboardProperties {

    private List<AgentProperties> agents = new ArrayList<>();
    private RegistryProperties registry = new RegistryProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private CoordinatorProperties coordinator = new CoordinatorProperties();
    private InvokerProperties invoker = new InvokerProperties();

    @Data
    public static class AgentProperties {
        private String id;
        private String name;
        private String description;
        private String endpoint;
        private Set<AgentCapability> capabilities = new LinkedHashSet<>();
        private int priority = 100;
        private boolean enabled = true;
        /**
         * Per-call timeout. Unset means the agent's circuit breaker request timeout applies.
         */
        private Duration timeout;
        private Map<String, Object> metadata = new HashMap<>();
    }

    @Data
    public static class RegistryProperties {
        /**
         * Capability used when an intent is not in the lookup table. Null rejects unknown intents.
         */
        private AgentCapability defaultCapability;
    }

    @Data
    public static class CircuitBreakerProperties {
        private BreakerSettings defaults = new BreakerSettings();
        private Map<String, BreakerOverride> instances = new HashMap<>();

        /**
         * Settings for the named breaker: per-instance overrides applied over the defaults.
         */
        public BreakerSettings settingsFor(String name) {
            BreakerOverride override = instances.get(name);
            return override != null ? override.applyTo(defaults) : defaults;
        }
    }

    @Data
    public static class BreakerSettings {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int successThreshold = 2;
        private Duration requestTimeout = Duration.ofSeconds(30);
        /**
         * Concurrent trial calls admitted while half-open. Zero means the success threshold.
         */
        private int permittedCallsInHalfOpen = 0;
        private int recentFailureCapacity = 100;
    }

    /**
     * Per-breaker overrides. Unset fields inherit the defaults.
     */
    @Data
    public static class BreakerOverride {
        private Integer failureThreshold;
        private Duration recoveryTimeout;
        private Integer successThreshold;
        private Duration requestTimeout;
        private Integer permittedCallsInHalfOpen;
        private Integer recentFailureCapacity;

        BreakerSettings applyTo(BreakerSettings base) {
            BreakerSettings merged = new BreakerSettings();
            merged.setFailureThreshold(failureThreshold != null ? failureThreshold : base.getFailureThreshold());
            merged.setRecoveryTimeout(recoveryTimeout != null ? recoveryTimeout : base.getRecoveryTimeout());
            merged.setSuccessThreshold(successThreshold != null ? successThreshold : base.getSuccessThreshold());
            merged.setRequestTimeout(requestTimeout != null ? requestTimeout : base.getRequestTimeout());
            merged.setPermittedCallsInHalfOpen(permittedCallsInHalfOpen != null
                    ? permittedCallsInHalfOpen : base.getPermittedCallsInHalfOpen());
            merged.setRecentFailureCapacity(recentFailureCapacity != null
                    ? recentFailureCapacity : base.getRecentFailureCapacity());
            return merged;
        }
    }

    @Data
    public static class CoordinatorProperties {
        /**
         * Deadline applied to workflows that do not specify one. Null means no deadline.
         */
        private Duration workflowDeadline;
        private int historySize = 100;
    }

    @Data
    public static class InvokerProperties {
        private HttpInvokerProperties http = new HttpInvokerProperties();

        @Data
        public static class HttpInvokerProperties {
            private boolean enabled = true;
            private Duration responseTimeout = Duration.ofSeconds(30);
            private Map<String, String> headers = new HashMap<>();
        }
    }
}
