package com.deepansh.wordplay.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/** Body of a direct single-tool invocation, bypassing planning. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocationRequest {

    @NotBlank(message = "tool must not be blank")
    private String tool;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    private String sessionId;
    private String userId;
    private String reasoning;
    private ContextUpdate context;
}
