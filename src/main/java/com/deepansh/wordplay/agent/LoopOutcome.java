package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.model.AgentPlan;
import com.deepansh.wordplay.model.AgentResponse.IterationLogEntry;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolExecution;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Everything one run of the autonomous loop produced, before it is shaped into a response. */
@Value
@Builder
public class LoopOutcome {

    AgentPlan plan;
    Goal goal;
    List<ToolExecution> executions;
    /** Synthesis over all executions; null when the plan needed no tools. */
    SynthesisResult synthesis;
    StopReason stopReason;
    int iterations;
    List<IterationLogEntry> executionLog;

    public long successfulCount() {
        return executions.stream().filter(ToolExecution::isSuccess).count();
    }
}
