package com.deepansh.wordplay.exception;

public class SessionNotFoundException extends AgentException {

    public SessionNotFoundException(String sessionId) {
        super("No active agent session: " + sessionId);
    }
}
