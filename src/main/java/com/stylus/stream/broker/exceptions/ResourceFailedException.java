package com.stylus.stream.broker.exceptions;

public class ResourceFailedException extends BrokerException {

    public ResourceFailedException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
