package com.stylus.stream.broker.model;

public enum SessionEndReason {
    RELEASED(false),
    HEARTBEAT_EXPIRED(false),
    RESOURCE_FAILED(true),
    MAINTENANCE(true),
    RESOLUTION_FAILED(true);

    /**
     * Whether the viewer should be told to retry (stream error) rather than treat the end as final.
     */
    private final boolean retryable;

    SessionEndReason(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
