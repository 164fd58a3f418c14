package com.deepansh.wordplay.config;

import com.deepansh.wordplay.model.AutonomyLevel;
import com.deepansh.wordplay.model.AutonomySettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Loop budgets and autonomy presets, bound from the "agent" prefix.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Execution steps kept per session before the oldest are evicted. */
    private int historyCap = 100;

    /** Reflect after every N tool executions within an iteration. */
    private int reflectionInterval = 5;

    /** Number of trailing steps the reflector scores. */
    private int reflectionWindow = 10;

    /** Default wall-clock budget for one request, overridable per request. */
    private long maxExecutionTimeMs = 300_000;

    /** Sessions untouched for this long are evicted with their context. */
    private long sessionIdleTtlMinutes = 60;

    private long maxSessions = 10_000;

    private Preset conservative = new Preset(10, 5, true);
    private Preset moderate = new Preset(20, 10, true);
    /** Reflection stays off in aggressive mode unless explicitly enabled. */
    private Preset aggressive = new Preset(50, 20, false);

    public AutonomySettings settingsFor(AutonomyLevel level) {
        AutonomyLevel resolved = level != null ? level : AutonomyLevel.MODERATE;
        Preset preset = switch (resolved) {
            case CONSERVATIVE -> conservative;
            case AGGRESSIVE -> aggressive;
            case MODERATE -> moderate;
        };
        return AutonomySettings.builder()
                .level(resolved)
                .maxIterations(preset.getMaxIterations())
                .maxToolChainLength(preset.getMaxToolChainLength())
                .reflectionEnabled(preset.isReflectionEnabled())
                .build();
    }

    @Data
    public static class Preset {
        private int maxIterations;
        private int maxToolChainLength;
        private boolean reflectionEnabled;

        public Preset() {
        }

        public Preset(int maxIterations, int maxToolChainLength, boolean reflectionEnabled) {
            this.maxIterations = maxIterations;
            this.maxToolChainLength = maxToolChainLength;
            this.reflectionEnabled = reflectionEnabled;
        }
    }
}
