package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolExecution;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides after each iteration whether the loop runs another one.
 *
 * Rules, first match wins:
 * 1. iteration success rate below 0.3 → stop
 * 2. synthesis proposed no further tool calls → stop
 * 3. iteration ≥ maxIterations - 1 → stop
 * 4. iteration > 5 and the last three executions succeeded less than half the time → stop
 * 5. otherwise continue with the proposed calls
 *
 * The wall-clock budget is enforced by the loop itself.
 */
@Component
public class ContinuationPolicy {

    static final double MIN_SUCCESS_RATE = 0.3;
    static final double MIN_RECENT_SUCCESS_RATE = 0.5;
    static final int PROGRESS_CHECK_AFTER_ITERATION = 5;
    static final int RECENT_WINDOW = 3;

    public Decision decide(List<ToolExecution> iterationExecutions, SynthesisResult synthesis,
                           int iteration, int maxIterations) {
        if (successRate(iterationExecutions) < MIN_SUCCESS_RATE) {
            return Decision.stop(StopReason.LOW_SUCCESS_RATE,
                    "Low success rate, stopping to prevent further failures");
        }
        if (synthesis == null || !synthesis.hasAdditionalToolCalls()) {
            return Decision.stop(StopReason.TASK_COMPLETE,
                    "No additional tools suggested, task appears complete");
        }
        if (iteration >= maxIterations - 1) {
            return Decision.stop(StopReason.ITERATION_LIMIT, "Approaching maximum iteration limit");
        }
        if (iteration > PROGRESS_CHECK_AFTER_ITERATION) {
            List<ToolExecution> recent = iterationExecutions.subList(
                    Math.max(0, iterationExecutions.size() - RECENT_WINDOW), iterationExecutions.size());
            if (successRate(recent) < MIN_RECENT_SUCCESS_RATE) {
                return Decision.stop(StopReason.DECLINING_PROGRESS, "Recent execution success rate declining");
            }
        }
        return Decision.proceed("Continuing autonomous execution with good progress");
    }

    /** Successful over total; an empty list scores 0. */
    public static double successRate(List<ToolExecution> executions) {
        if (executions == null || executions.isEmpty()) {
            return 0.0;
        }
        long ok = executions.stream().filter(ToolExecution::isSuccess).count();
        return (double) ok / executions.size();
    }

    public record Decision(boolean shouldContinue, StopReason stopReason, String explanation) {

        static Decision stop(StopReason reason, String explanation) {
            return new Decision(false, reason, explanation);
        }

        static Decision proceed(String explanation) {
            return new Decision(true, null, explanation);
        }
    }
}
