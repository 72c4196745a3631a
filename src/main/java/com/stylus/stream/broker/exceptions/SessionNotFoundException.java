package com.stylus.stream.broker.exceptions;

public class SessionNotFoundException extends BrokerException {

    public SessionNotFoundException(String sessionId) {
        super("session not found: " + sessionId);
    }
}
