package com.deepansh.wordplay.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Value stored under a caller-chosen key in the session's key-value memory.
 * Every read goes through {@link #read()}, which bumps the access counter.
 */
@Getter
public class MemoryEntry {

    private final String key;
    private final Object value;
    private final String category;
    private final Instant timestamp;
    private int accessCount;

    public MemoryEntry(String key, Object value, String category) {
        this.key = key;
        this.value = value;
        this.category = category != null ? category : "general";
        this.timestamp = Instant.now();
    }

    public Object read() {
        accessCount++;
        return value;
    }
}
