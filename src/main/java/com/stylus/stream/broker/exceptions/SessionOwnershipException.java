package com.stylus.stream.broker.exceptions;

public class SessionOwnershipException extends BrokerException {

    public SessionOwnershipException(String sessionId, String userId) {
        super(String.format("user [%s] doesn't own session [%s]", userId, sessionId));
    }
}
