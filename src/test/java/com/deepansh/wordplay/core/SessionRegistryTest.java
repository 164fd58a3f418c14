package com.deepansh.wordplay.core;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.exception.SessionNotFoundException;
import com.deepansh.wordplay.model.AutonomyLevel;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(new InMemoryWritingStore(), new AgentProperties());
    }

    @Test
    void open_sameId_returnsSameContext() {
        ExecutionContext first = registry.open("abc", "u1");
        ExecutionContext second = registry.open("abc", "u1");

        assertThat(second).isSameAs(first);
        assertThat(registry.activeSessions()).isEqualTo(1);
    }

    @Test
    void open_withoutId_generatesOneWithModerateDefaults() {
        ExecutionContext context = registry.open(null, "u1");

        assertThat(context.getSessionId()).isNotBlank();
        assertThat(context.getAutonomy().getLevel()).isEqualTo(AutonomyLevel.MODERATE);
    }

    @Test
    void open_idleBeyondTtl_evictsSession() {
        AtomicLong nanos = new AtomicLong();
        AgentProperties properties = new AgentProperties();
        properties.setSessionIdleTtlMinutes(30);
        SessionRegistry expiring = new SessionRegistry(new InMemoryWritingStore(), properties, nanos::get);

        for (int i = 0; i < 1_000; i++) {
            expiring.open(null, "u1");
        }
        ExecutionContext kept = expiring.open("kept", "u1");
        assertThat(expiring.activeSessions()).isEqualTo(1_001);

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(20));
        expiring.open("kept", "u1");
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(20));

        assertThat(expiring.activeSessions()).isEqualTo(1);
        assertThat(expiring.find("kept")).containsSame(kept);
    }

    @Test
    void require_afterExpiry_throws() {
        AtomicLong nanos = new AtomicLong();
        SessionRegistry expiring = new SessionRegistry(new InMemoryWritingStore(), new AgentProperties(), nanos::get);
        expiring.open("abc", "u1");

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(61));

        assertThatThrownBy(() -> expiring.require("abc")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void require_unknown_throws() {
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void close_removesSession() {
        registry.open("abc", "u1");
        registry.close("abc");

        assertThat(registry.find("abc")).isEmpty();
        assertThatThrownBy(() -> registry.close("abc")).isInstanceOf(SessionNotFoundException.class);
    }
}
