package com.stylus.stream.broker.exceptions;

/**
 * Raised by a stream url resolver; the broker turns it into a rollback and a {@link StreamUnavailableException}.
 */
public class StreamResolutionException extends Exception {

    public StreamResolutionException(String message) {
        super(message);
    }

    public StreamResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
