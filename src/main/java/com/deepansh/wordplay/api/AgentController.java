package com.deepansh.wordplay.api;

import com.deepansh.wordplay.agent.AgentOrchestrator;
import com.deepansh.wordplay.core.ContextSummary;
import com.deepansh.wordplay.core.SessionRegistry;
import com.deepansh.wordplay.model.AgentRequest;
import com.deepansh.wordplay.model.AgentResponse;
import com.deepansh.wordplay.model.ToolInvocationRequest;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.ToolDefinition;
import com.deepansh.wordplay.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Agent endpoints.
 *
 * POST   /api/v1/agent/intelligent-request   plan and run a natural-language request
 * POST   /api/v1/agent/tool                  run a single tool directly
 * GET    /api/v1/agent/tools                 registered tool schemas
 * GET    /api/v1/agent/context/{sessionId}   session context summary
 * DELETE /api/v1/agent/session/{sessionId}   discard a session
 * GET    /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentOrchestrator orchestrator;
    private final ToolRegistry toolRegistry;
    private final SessionRegistry sessionRegistry;

    @PostMapping("/intelligent-request")
    public ResponseEntity<AgentResponse> intelligentRequest(@Valid @RequestBody AgentRequest request) {
        log.info("Agent request [sessionId={}, userId={}, autonomy={}]",
                request.getSessionId(), request.getUserId(), request.getAutonomyLevel());
        return ResponseEntity.ok(orchestrator.handle(request));
    }

    @PostMapping("/tool")
    public ResponseEntity<ToolResult> executeTool(@Valid @RequestBody ToolInvocationRequest request) {
        toolRegistry.get(request.getTool());
        return ResponseEntity.ok(orchestrator.executeTool(request));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDefinition>> tools() {
        return ResponseEntity.ok(toolRegistry.list());
    }

    @GetMapping("/context/{sessionId}")
    public ResponseEntity<ContextSummary> context(@PathVariable String sessionId) {
        return ResponseEntity.ok(orchestrator.contextSummary(sessionId));
    }

    @DeleteMapping("/session/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        orchestrator.closeSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "tools", toolRegistry.toolCount(),
                "activeSessions", sessionRegistry.activeSessions()));
    }
}
