package com.deepansh.wordplay.tool;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;

/**
 * Contract every tool must implement.
 *
 * {@link #getParameters()} is validated by the executor before {@link #execute} runs and
 * is rendered as JSON Schema for the planner, so bodies may rely on required arguments
 * being present and correctly typed.
 *
 * Expected failures (not found, nothing to analyze) should be returned as
 * {@link ToolResult#failure}; anything thrown is caught by the executor and converted.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /** Human-readable description. This is the primary signal the planner uses. */
    String getDescription();

    ToolCategory getCategory();

    ToolParameters getParameters();

    ToolResult execute(ToolArguments arguments, ExecutionContext context);
}
