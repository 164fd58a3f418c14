package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.AgentPlan;
import com.deepansh.wordplay.model.AgentResponse.IterationLogEntry;
import com.deepansh.wordplay.model.AutonomySettings;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.GoalStatus;
import com.deepansh.wordplay.model.Reflection;
import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolCall;
import com.deepansh.wordplay.model.ToolExecution;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.observability.RunContext;
import com.deepansh.wordplay.tool.ToolExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan → act → synthesize → decide, repeated until the continuation policy or a budget stops it.
 *
 * Per-run flow:
 * 1. Plan the request and record a goal for it
 * 2. Execute the planned calls, each followed by its chained calls (chained calls never chain further)
 * 3. Reflect every N executions within an iteration when reflection is enabled
 * 4. Synthesize the iteration; its proposed calls feed the next iteration
 * 5. Stop on the policy's decision, the iteration cap or the wall-clock budget
 * 6. Synthesize across all executions for the final narrative
 *
 * At most maxToolChainLength executions run per iteration, chained calls included.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutonomousLoop {

    private final Planner planner;
    private final ToolExecutor toolExecutor;
    private final ChainingHeuristics chainingHeuristics;
    private final Synthesizer synthesizer;
    private final Reflector reflector;
    private final ContinuationPolicy continuationPolicy;
    private final AgentProperties agentProperties;

    public LoopOutcome run(String request, ExecutionContext context, long budgetMs, RunContext runCtx) {
        AutonomySettings settings = context.getAutonomy();
        List<IterationLogEntry> executionLog = new ArrayList<>();

        AgentPlan plan = planner.plan(request, context);
        if (plan.isFallback()) {
            runCtx.recordModelFallback("planner");
        }
        Goal goal = setGoal(request, plan, context);
        executionLog.add(logEntry(0, "planning", plan.getPlan(), List.of(), plan.needsTools(),
                plan.needsTools() ? plan.getToolCalls().size() + " tool calls planned" : "No tools required"));

        if (!plan.needsTools()) {
            log.info("No tools required [session={}]", context.getSessionId());
            return LoopOutcome.builder()
                    .plan(plan)
                    .goal(goal)
                    .executions(List.of())
                    .stopReason(StopReason.NO_TOOLS_REQUIRED)
                    .iterations(0)
                    .executionLog(executionLog)
                    .build();
        }

        if (goal != null) {
            context.advanceGoal(goal, GoalStatus.IN_PROGRESS, "Executing planned tools");
        }

        List<ToolExecution> allExecutions = new ArrayList<>();
        List<ToolCall> pending = plan.getToolCalls();
        StopReason stopReason;
        int iteration = 0;

        while (true) {
            iteration++;
            log.info("Autonomous iteration {}/{} [session={}, calls={}]",
                    iteration, settings.getMaxIterations(), context.getSessionId(), pending.size());

            List<ToolExecution> iterationExecutions =
                    executeIteration(pending, context, settings, goal, runCtx);
            allExecutions.addAll(iterationExecutions);

            if (iterationExecutions.isEmpty()) {
                stopReason = StopReason.NO_TOOLS_REQUIRED;
                executionLog.add(logEntry(iteration, "execution", "No executable tool calls",
                        iterationExecutions, false, stopReason.getDescription()));
                break;
            }

            SynthesisResult synthesis = synthesizer.synthesize(request, iterationExecutions,
                    context.getModelSelection());
            if (synthesis.isFallback()) {
                runCtx.recordModelFallback("synthesizer");
            }

            ContinuationPolicy.Decision decision = continuationPolicy.decide(
                    iterationExecutions, synthesis, iteration, settings.getMaxIterations());

            boolean overBudget = decision.shouldContinue() && runCtx.exceeded(budgetMs);
            boolean atCap = decision.shouldContinue() && iteration >= settings.getMaxIterations();
            boolean keepGoing = decision.shouldContinue() && !overBudget && !atCap;

            String reasoning = overBudget ? "Wall-clock budget of " + budgetMs + "ms exhausted"
                    : atCap ? "Maximum iterations reached"
                    : decision.explanation();
            executionLog.add(logEntry(iteration, "execution",
                    "Executed " + iterationExecutions.size() + " tools", iterationExecutions, keepGoing, reasoning));

            if (!keepGoing) {
                stopReason = overBudget ? StopReason.TIME_BUDGET_EXCEEDED
                        : atCap ? StopReason.ITERATION_LIMIT
                        : decision.stopReason();
                break;
            }
            pending = synthesis.getAdditionalToolCalls();
        }

        log.info("Autonomous loop stopped [session={}, iterations={}, executions={}, reason={}]",
                context.getSessionId(), iteration, allExecutions.size(), stopReason.getDescription());

        SynthesisResult finalSynthesis = synthesizer.synthesize(request, allExecutions, context.getModelSelection());
        if (finalSynthesis.isFallback()) {
            runCtx.recordModelFallback("synthesizer");
        }

        return LoopOutcome.builder()
                .plan(plan)
                .goal(goal)
                .executions(allExecutions)
                .synthesis(finalSynthesis)
                .stopReason(stopReason)
                .iterations(iteration)
                .executionLog(executionLog)
                .build();
    }

    private List<ToolExecution> executeIteration(List<ToolCall> calls, ExecutionContext context,
                                                 AutonomySettings settings, Goal goal,
                                                 RunContext runCtx) {
        List<ToolExecution> executions = new ArrayList<>();
        int cap = settings.getMaxToolChainLength();

        for (ToolCall call : calls) {
            if (executions.size() >= cap) {
                log.warn("Tool chain cap of {} reached, skipping remaining planned calls [session={}]",
                        cap, context.getSessionId());
                break;
            }
            ToolExecution execution = execute(call.getToolName(), call.getArguments(), call.getReasoning(),
                    false, context);
            executions.add(execution);
            maybeReflect(context, settings, goal, executions.size(), runCtx);

            for (ToolCall chained : chainingHeuristics.nextTools(call.getToolName(), execution.getResult(), context)) {
                if (executions.size() >= cap) {
                    log.warn("Tool chain cap of {} reached, skipping chained [{}] [session={}]",
                            cap, chained.getToolName(), context.getSessionId());
                    break;
                }
                executions.add(execute(chained.getToolName(), chained.getArguments(),
                        "Auto-chained from " + call.getToolName() + ": " + chained.getReasoning(), true, context));
                maybeReflect(context, settings, goal, executions.size(), runCtx);
            }
        }
        return executions;
    }

    private ToolExecution execute(String toolName, Map<String, Object> arguments, String reasoning,
                                  boolean chained, ExecutionContext context) {
        Map<String, Object> params = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
        ToolResult result = toolExecutor.execute(toolName, params, reasoning, context);
        return ToolExecution.builder()
                .toolName(toolName)
                .parameters(params)
                .result(result)
                .reasoning(reasoning)
                .chained(chained)
                .build();
    }

    private void maybeReflect(ExecutionContext context, AutonomySettings settings, Goal goal,
                              int executedThisIteration, RunContext runCtx) {
        int interval = agentProperties.getReflectionInterval();
        if (!settings.isReflectionEnabled() || interval <= 0 || executedThisIteration % interval != 0) {
            return;
        }
        Reflection reflection = reflector.reflect(goal, context.getExecutionHistory(), context.getModelSelection());
        context.recordReflection(reflection);
        runCtx.recordReflection();
        if (reflection.isFallback()) {
            runCtx.recordModelFallback("reflector");
        }
        log.info("Reflection after {} executions this iteration [session={}, successRate={}]: {}",
                executedThisIteration, context.getSessionId(), reflection.getSuccessRate(), reflection.getAnalysis());
    }

    private Goal setGoal(String request, AgentPlan plan, ExecutionContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("description", request);
        params.put("priority", 1);
        params.put("estimatedSteps", plan.needsTools() ? plan.getToolCalls().size() : 5);
        params.put("requiredTools", plan.getToolCalls().stream().map(ToolCall::getToolName).distinct().toList());

        ToolResult result = toolExecutor.execute("set_goal", params, "Tracking progress on the request", context);
        if (result.isSuccess() && result.getData() instanceof Goal created) {
            return context.findGoal(created.getId()).orElse(null);
        }
        log.warn("Could not set goal for request [session={}]: {}", context.getSessionId(), result.describe());
        return null;
    }

    private IterationLogEntry logEntry(int iteration, String phase, String action, List<ToolExecution> executions,
                                       boolean shouldContinue, String reasoning) {
        long ok = executions.stream().filter(ToolExecution::isSuccess).count();
        return IterationLogEntry.builder()
                .iteration(iteration)
                .phase(phase)
                .action(action)
                .toolsExecuted(executions.stream().map(ToolExecution::getToolName).toList())
                .successfulTools((int) ok)
                .failedTools(executions.size() - (int) ok)
                .shouldContinue(shouldContinue)
                .reasoning(reasoning)
                .timestamp(Instant.now())
                .build();
    }
}
