package com.stylus.stream.broker.exceptions;

public class StreamUnavailableException extends BrokerException {

    public StreamUnavailableException(String message) {
        super(message);
    }

    public StreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
