package com.deepansh.wordplay.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @NotBlank(message = "request must not be blank")
    private String request;

    /**
     * Optional. When set and the session exists, the request runs against that session's
     * context; otherwise a new session is opened under this id.
     */
    private String sessionId;

    /** Defaults to "default" when absent. */
    private String userId;

    private ContextUpdate context;

    private AutonomyLevel autonomyLevel;

    /** Wall-clock budget override; the configured default applies when null. */
    @Positive
    private Long maxExecutionTimeMs;

    /** Overrides the autonomy preset's reflection toggle when non-null. */
    private Boolean reflectionEnabled;
}
