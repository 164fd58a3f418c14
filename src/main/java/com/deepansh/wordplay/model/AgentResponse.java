package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentResponse {

    private String sessionId;
    private String plan;
    private String narrative;

    @Builder.Default
    private List<ToolExecutionSummary> toolsExecuted = new ArrayList<>();

    @Builder.Default
    private List<String> suggestedActions = new ArrayList<>();

    private ExecutionDetails executionDetails;
    private ContinuousOperationPlan continuousOperationPlan;

    @Builder.Default
    private List<ResearchFinding> researchFindings = new ArrayList<>();

    @Builder.Default
    private List<IterationLogEntry> executionLog = new ArrayList<>();

    private EditorState editorState;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolExecutionSummary {
        private String tool;
        private boolean success;
        private String message;
        private String reasoning;
        private Map<String, Object> parameters;
        private Object data;
        private long executionTimeMs;
        private boolean chained;

        public static ToolExecutionSummary from(ToolExecution execution) {
            ToolResult result = execution.getResult();
            return ToolExecutionSummary.builder()
                    .tool(execution.getToolName())
                    .success(result.isSuccess())
                    .message(result.describe())
                    .reasoning(execution.getReasoning())
                    .parameters(execution.getParameters())
                    .data(result.getData())
                    .executionTimeMs(result.getExecutionTimeMs())
                    .chained(execution.isChained())
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutionDetails {
        private int toolsPlanned;
        private int toolsExecuted;
        private int successfulTools;
        private int failedTools;
        /** Fraction in [0, 1]; 0 when nothing ran. */
        private double successRate;
        private long averageToolTimeMs;
        private int iterations;
        private int maxIterations;
        private long durationMs;
        private AutonomyLevel autonomyLevel;
        private String stopReason;
        private int reflectionsPerformed;
        private int modelFallbacks;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IterationLogEntry {
        private int iteration;
        private String phase;
        private String action;
        @Builder.Default
        private List<String> toolsExecuted = new ArrayList<>();
        private int successfulTools;
        private int failedTools;
        private boolean shouldContinue;
        private String reasoning;
        private Instant timestamp;
    }
}
