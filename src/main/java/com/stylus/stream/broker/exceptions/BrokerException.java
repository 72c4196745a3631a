package com.stylus.stream.broker.exceptions;

/**
 * Base of the broker's typed failures. {@link #isRetryable()} tells the playback side whether asking again may help.
 */
public abstract class BrokerException extends Exception {

    protected BrokerException(String message) {
        super(message);
    }

    protected BrokerException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
