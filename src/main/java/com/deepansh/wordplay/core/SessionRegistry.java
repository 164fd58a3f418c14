package com.deepansh.wordplay.core;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.exception.SessionNotFoundException;
import com.deepansh.wordplay.model.AutonomyLevel;
import com.deepansh.wordplay.persistence.WritingStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Live agent sessions, one private {@link ExecutionContext} each.
 * A session idle for longer than {@code agent.session-idle-ttl-minutes} is evicted together
 * with its context; nothing is persisted across restarts.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Cache<String, ExecutionContext> sessions;
    private final WritingStore store;
    private final AgentProperties agentProperties;

    @Autowired
    public SessionRegistry(WritingStore store, AgentProperties agentProperties) {
        this(store, agentProperties, Ticker.systemTicker());
    }

    SessionRegistry(WritingStore store, AgentProperties agentProperties, Ticker ticker) {
        this.store = store;
        this.agentProperties = agentProperties;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(agentProperties.getSessionIdleTtlMinutes()))
                .maximumSize(agentProperties.getMaxSessions())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String id, ExecutionContext context, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.info("Evicted agent session [{}] ({})", id, cause);
                    }
                })
                .build();
    }

    /** Returns the session's context, opening it under the given id (or a fresh one) if absent. */
    public ExecutionContext open(String sessionId, String userId) {
        String id = sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
        return sessions.get(id, key -> {
            log.info("Opening agent session [{}] for user [{}]", key, userId);
            return new ExecutionContext(key, userId, store,
                    agentProperties.settingsFor(AutonomyLevel.MODERATE),
                    agentProperties.getHistoryCap());
        });
    }

    public Optional<ExecutionContext> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public ExecutionContext require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public void close(String sessionId) {
        if (sessionId == null || sessions.asMap().remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Closed agent session [{}]", sessionId);
    }

    public int activeSessions() {
        sessions.cleanUp();
        return Math.toIntExact(sessions.estimatedSize());
    }
}
