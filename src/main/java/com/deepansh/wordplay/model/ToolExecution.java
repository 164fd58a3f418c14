package com.deepansh.wordplay.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** A tool call paired with its result, as accumulated by the loop for one turn. */
@Value
@Builder
public class ToolExecution {

    String toolName;
    Map<String, Object> parameters;
    ToolResult result;
    String reasoning;
    boolean chained;

    public boolean isSuccess() {
        return result != null && result.isSuccess();
    }
}
